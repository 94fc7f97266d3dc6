package ai.subtitle.translator.translate;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate of every batch in a run: one resolved text per input caption, in input order.
 */
public record TranslationOutcome(List<String> texts,
                                 List<Resolution> resolutions,
                                 List<BatchResult> batchResults) {

    public TranslationOutcome {
        texts = List.copyOf(Objects.requireNonNull(texts, "texts"));
        resolutions = List.copyOf(Objects.requireNonNull(resolutions, "resolutions"));
        batchResults = List.copyOf(Objects.requireNonNull(batchResults, "batchResults"));
    }

    public static TranslationOutcome empty() {
        return new TranslationOutcome(List.of(), List.of(), List.of());
    }

    public int size() {
        return texts.size();
    }

    public long translatedCount() {
        return resolutions.stream().filter(resolution -> resolution == Resolution.TRANSLATED).count();
    }

    public long filledCount() {
        return resolutions.stream().filter(resolution -> resolution == Resolution.FILLED).count();
    }

    public int totalAttempts() {
        return batchResults.stream().mapToInt(BatchResult::attempts).sum();
    }
}
