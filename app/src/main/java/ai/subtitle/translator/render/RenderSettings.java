package ai.subtitle.translator.render;

/**
 * Font sizes for the two language groups of a bilingual script.
 */
public record RenderSettings(int sourceFontSize, int targetFontSize) {

    public static final int DEFAULT_SOURCE_FONT_SIZE = 16;
    public static final int DEFAULT_TARGET_FONT_SIZE = 20;

    public RenderSettings {
        if (sourceFontSize < 1 || targetFontSize < 1) {
            throw new IllegalArgumentException("font sizes must be at least 1");
        }
    }

    public static RenderSettings defaults() {
        return new RenderSettings(DEFAULT_SOURCE_FONT_SIZE, DEFAULT_TARGET_FONT_SIZE);
    }
}
