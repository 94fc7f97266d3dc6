package ai.subtitle.translator.subtitle;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes SRT caption text. Malformed blocks are skipped rather than failing the whole file.
 */
public class SrtCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(SrtCodec.class);
    private static final Pattern BLOCK_SEPARATOR = Pattern.compile("\\n[ \\t]*\\n");
    private static final Pattern TIME_LINE = Pattern.compile(
            "^(\\d{2,}:\\d{2}:\\d{2},\\d{3})\\s*-->\\s*(\\d{2,}:\\d{2}:\\d{2},\\d{3})");
    private static final String ARROW = " --> ";
    private static final char BOM = '\uFEFF';

    public ParseReport parse(String content) {
        if (content == null || content.isBlank()) {
            return new ParseReport(List.of(), List.of());
        }
        String normalized = normalize(content).strip();
        if (normalized.isEmpty()) {
            return new ParseReport(List.of(), List.of());
        }
        List<CaptionEntry> entries = new ArrayList<>();
        List<ParseReport.SkippedBlock> skipped = new ArrayList<>();
        String[] blocks = BLOCK_SEPARATOR.split(normalized);
        for (int i = 0; i < blocks.length; i++) {
            String block = blocks[i].strip();
            if (block.isEmpty()) {
                continue;
            }
            try {
                entries.add(parseBlock(block));
            } catch (IllegalArgumentException ex) {
                LOGGER.debug("Skipping unparseable caption block {}: {}", i + 1, abbreviate(block));
                skipped.add(new ParseReport.SkippedBlock(i + 1, block, ex.getMessage()));
            }
        }
        if (!skipped.isEmpty()) {
            LOGGER.info("Skipped {} malformed caption block(s)", skipped.size());
        }
        LOGGER.debug("Parsed {} caption entries", entries.size());
        return new ParseReport(entries, skipped);
    }

    public List<CaptionEntry> parseEntries(String content) {
        return parse(content).entries();
    }

    public String serialize(List<CaptionEntry> entries) {
        Objects.requireNonNull(entries, "entries");
        List<String> lines = new ArrayList<>(entries.size() * 4);
        for (CaptionEntry entry : entries) {
            lines.add(Integer.toString(entry.index()));
            lines.add(entry.start().toSrt() + ARROW + entry.end().toSrt());
            lines.addAll(entry.lines());
            lines.add("");
        }
        return String.join("\n", lines);
    }

    private CaptionEntry parseBlock(String block) {
        String[] lines = block.split("\n", -1);
        if (lines.length < 3) {
            throw new IllegalArgumentException("block must contain index, time line and text");
        }
        int index;
        try {
            index = Integer.parseInt(lines[0].trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("invalid index: " + lines[0].trim(), ex);
        }
        Matcher matcher = TIME_LINE.matcher(lines[1].trim());
        if (!matcher.find()) {
            throw new IllegalArgumentException("invalid time line: " + lines[1].trim());
        }
        Timestamp start = Timestamp.parse(matcher.group(1));
        Timestamp end = Timestamp.parse(matcher.group(2));
        List<String> text = new ArrayList<>(lines.length - 2);
        for (int i = 2; i < lines.length; i++) {
            text.add(lines[i]);
        }
        return new CaptionEntry(index, start, end, text);
    }

    private static String normalize(String content) {
        String normalized = content.replace("\r\n", "\n").replace('\r', '\n');
        if (!normalized.isEmpty() && normalized.charAt(0) == BOM) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }

    private static String abbreviate(String block) {
        String flattened = block.replace('\n', ' ');
        return flattened.length() <= 50 ? flattened : flattened.substring(0, 50) + "...";
    }
}
