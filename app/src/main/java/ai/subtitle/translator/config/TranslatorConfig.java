package ai.subtitle.translator.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Holds runtime settings for the translation model provider.
 */
public record TranslatorConfig(LlmProvider provider, String modelName, Optional<String> baseUrl) {

    public static final double DEFAULT_TEMPERATURE = 0.3;

    public TranslatorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
