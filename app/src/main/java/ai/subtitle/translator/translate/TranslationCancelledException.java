package ai.subtitle.translator.translate;

/**
 * Raised when the calling thread is interrupted between batches.
 */
public class TranslationCancelledException extends TranslationException {

    private final int completedBatches;

    public TranslationCancelledException(int completedBatches) {
        super("Translation cancelled after " + completedBatches + " batch(es)");
        this.completedBatches = completedBatches;
    }

    public int completedBatches() {
        return completedBatches;
    }
}
