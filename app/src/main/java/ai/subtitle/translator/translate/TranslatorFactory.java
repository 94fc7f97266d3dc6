package ai.subtitle.translator.translate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Provides translator instances based on the desired execution mode. The production translator is created
 * lazily so dry runs never need model credentials.
 */
public class TranslatorFactory {

    private final Supplier<Translator> productionTranslator;
    private final Translator dryRunTranslator;
    private final Translator mockTranslator;
    private Translator production;

    public TranslatorFactory(Supplier<Translator> productionTranslator,
                             Translator dryRunTranslator,
                             Translator mockTranslator) {
        this.productionTranslator = Objects.requireNonNull(productionTranslator, "productionTranslator");
        this.dryRunTranslator = Objects.requireNonNull(dryRunTranslator, "dryRunTranslator");
        this.mockTranslator = Objects.requireNonNull(mockTranslator, "mockTranslator");
    }

    public TranslatorFactory(Translator productionTranslator,
                             Translator dryRunTranslator,
                             Translator mockTranslator) {
        this(supplierOf(productionTranslator), dryRunTranslator, mockTranslator);
    }

    public Translator select(TranslationMode mode) {
        return switch (mode) {
            case PRODUCTION -> production();
            case DRY_RUN -> dryRunTranslator;
            case MOCK -> mockTranslator;
        };
    }

    private synchronized Translator production() {
        if (production == null) {
            production = Objects.requireNonNull(productionTranslator.get(), "production translator");
        }
        return production;
    }

    private static Supplier<Translator> supplierOf(Translator translator) {
        Objects.requireNonNull(translator, "productionTranslator");
        return () -> translator;
    }
}
