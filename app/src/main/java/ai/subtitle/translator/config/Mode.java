package ai.subtitle.translator.config;

/**
 * Which stage, or the whole chain, a CLI run executes.
 */
public enum Mode {
    PIPELINE,
    FIX,
    MERGE_LINES,
    TRANSLATE,
    BILINGUAL,
    RENDER;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PIPELINE;
        }
        String normalized = raw.trim().replace('-', '_');
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    public boolean isSingleStage() {
        return this != PIPELINE;
    }
}
