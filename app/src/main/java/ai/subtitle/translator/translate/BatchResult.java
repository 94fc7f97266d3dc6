package ai.subtitle.translator.translate;

import java.util.List;
import java.util.Objects;

/**
 * Resolved texts for one batch after its retry loop finished.
 */
public record BatchResult(TranslationBatch batch,
                          List<String> texts,
                          List<Resolution> resolutions,
                          int attempts,
                          boolean formatValid) {

    public BatchResult {
        Objects.requireNonNull(batch, "batch");
        texts = List.copyOf(Objects.requireNonNull(texts, "texts"));
        resolutions = List.copyOf(Objects.requireNonNull(resolutions, "resolutions"));
        if (texts.size() != resolutions.size()) {
            throw new IllegalArgumentException("texts and resolutions must have the same size");
        }
    }

    public long filledCount() {
        return resolutions.stream().filter(resolution -> resolution == Resolution.FILLED).count();
    }

    public boolean isComplete() {
        return filledCount() == 0;
    }
}
