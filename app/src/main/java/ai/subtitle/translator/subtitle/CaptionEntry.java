package ai.subtitle.translator.subtitle;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A single time-coded caption. Lines are kept in display order.
 */
public record CaptionEntry(int index, Timestamp start, Timestamp end, List<String> lines) {

    public CaptionEntry {
        if (index < 1) {
            throw new IllegalArgumentException("index must be positive");
        }
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("caption must contain at least one line");
        }
    }

    public static CaptionEntry of(int index, String start, String end, String text) {
        return new CaptionEntry(index, Timestamp.parse(start), Timestamp.parse(end), splitLines(text));
    }

    public static List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of("");
        }
        return Arrays.asList(text.split("\n", -1));
    }

    /**
     * Text with internal line breaks preserved.
     */
    public String text() {
        return String.join("\n", lines);
    }

    /**
     * Text collapsed onto a single display line.
     */
    public String singleLineText() {
        return String.join(" ", lines);
    }

    public CaptionEntry withEnd(Timestamp newEnd) {
        return new CaptionEntry(index, start, newEnd, lines);
    }

    public CaptionEntry withIndex(int newIndex) {
        return new CaptionEntry(newIndex, start, end, lines);
    }

    public CaptionEntry withText(String newText) {
        return new CaptionEntry(index, start, end, splitLines(newText));
    }
}
