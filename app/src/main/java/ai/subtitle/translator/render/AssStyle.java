package ai.subtitle.translator.render;

import java.util.Objects;

/**
 * One entry of the {@code [V4+ Styles]} section. Colours use ASS {@code &HAABBGGRR} notation.
 */
public record AssStyle(String name,
                       String fontName,
                       int fontSize,
                       String primaryColour,
                       String outlineColour,
                       int outline,
                       int marginVertical) {

    static final String FORMAT = "Format: Name, Fontname, Fontsize, PrimaryColour, SecondaryColour, OutlineColour, "
            + "BackColour, Bold, Italic, Underline, StrikeOut, ScaleX, ScaleY, Spacing, Angle, BorderStyle, Outline, "
            + "Shadow, Alignment, MarginL, MarginR, MarginV, Encoding";

    private static final String SECONDARY_COLOUR = "&H000000FF";
    private static final String BACK_COLOUR = "&H00000000";
    private static final int BOTTOM_CENTRE = 2;

    public AssStyle {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fontName, "fontName");
        Objects.requireNonNull(primaryColour, "primaryColour");
        Objects.requireNonNull(outlineColour, "outlineColour");
        if (fontSize < 1) {
            throw new IllegalArgumentException("fontSize must be at least 1");
        }
        if (outline < 0 || marginVertical < 0) {
            throw new IllegalArgumentException("outline and marginVertical must be zero or greater");
        }
    }

    String toStyleLine() {
        return "Style: " + String.join(",",
                name,
                fontName,
                Integer.toString(fontSize),
                primaryColour,
                SECONDARY_COLOUR,
                outlineColour,
                BACK_COLOUR,
                "0", "0", "0", "0",
                "100", "100", "0", "0",
                "1",
                Integer.toString(outline),
                "0",
                Integer.toString(BOTTOM_CENTRE),
                "10", "10",
                Integer.toString(marginVertical),
                "1");
    }
}
