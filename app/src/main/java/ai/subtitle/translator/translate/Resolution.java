package ai.subtitle.translator.translate;

/**
 * How a caption's final text was obtained.
 */
public enum Resolution {
    /** Text came from a collaborator response. */
    TRANSLATED,
    /** Translation never arrived; the original text was kept. */
    FILLED
}
