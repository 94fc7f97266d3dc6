package ai.subtitle.translator.translate;

/**
 * Batching and retry budget for a translation run.
 */
public record TranslationSettings(int batchSize, int maxAttempts) {

    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    public TranslationSettings {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static TranslationSettings defaults() {
        return new TranslationSettings(DEFAULT_BATCH_SIZE, DEFAULT_MAX_ATTEMPTS);
    }
}
