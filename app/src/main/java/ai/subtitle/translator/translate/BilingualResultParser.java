package ai.subtitle.translator.translate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers numbered bilingual units from free-form model output.
 *
 * <p>Accepted shapes for a unit:</p>
 * <pre>
 * 1. source          1: source
 * 1. target          target
 * </pre>
 * The separator is {@code ". "} or {@code ": "}; the full-width colon may omit the space. A line such as
 * {@code 10:30 ...} is therefore plain text. A repeated index must use the same separator as its first half. A plain
 * line after an indexed line is its implicit second half. An indexed line with no text is not a unit.
 */
public class BilingualResultParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(BilingualResultParser.class);
    private static final Pattern PERIOD_LINE = Pattern.compile("^(\\d+)\\.(?: |$)(.*)$");
    private static final Pattern COLON_LINE = Pattern.compile("^(\\d+)(?:: |:$|：)(.*)$");
    private static final List<String> COMMENTARY_PREFIXES = List.of("以下是", "翻译");
    private static final List<String> ENGLISH_COMMENTARY_PREFIXES = List.of("here is", "here are", "translation:");
    private static final String CODE_FENCE = "```";

    public ParsedTranslation parse(String response) {
        if (response == null || response.isBlank()) {
            return ParsedTranslation.empty();
        }
        List<String> lines = contentLines(response);
        Map<Integer, String> units = new LinkedHashMap<>();
        boolean allComplete = true;
        int position = 0;
        while (position < lines.size()) {
            String line = lines.get(position);
            Optional<IndexedLine> indexed = IndexedLine.parse(line);
            if (indexed.isEmpty()) {
                LOGGER.debug("Ignoring unnumbered line outside a unit: {}", line);
                position++;
                continue;
            }
            IndexedLine head = indexed.get();
            if (head.text().isEmpty()) {
                LOGGER.debug("Ignoring unit {} without text", head.index());
                position++;
                continue;
            }
            String next = position + 1 < lines.size() ? lines.get(position + 1) : null;
            Optional<IndexedLine> nextIndexed = next == null ? Optional.empty() : IndexedLine.parse(next);
            if (nextIndexed.isPresent() && nextIndexed.get().isSiblingOf(head)) {
                String second = nextIndexed.get().text();
                if (second.isEmpty()) {
                    LOGGER.debug("Unit {} has an empty second half", head.index());
                    units.put(head.index(), head.text());
                    allComplete = false;
                } else {
                    units.put(head.index(), head.text() + "\n" + second);
                }
                position += 2;
            } else if (next != null && nextIndexed.isEmpty()) {
                units.put(head.index(), head.text() + "\n" + next);
                position += 2;
            } else {
                LOGGER.debug("Unit {} has no second half", head.index());
                units.put(head.index(), head.text());
                allComplete = false;
                position++;
            }
        }
        return new ParsedTranslation(units, allComplete && !units.isEmpty());
    }

    private List<String> contentLines(String response) {
        List<String> lines = new ArrayList<>();
        for (String raw : response.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty() || isCommentary(line)) {
                continue;
            }
            lines.add(line);
        }
        return lines;
    }

    static boolean isCommentary(String line) {
        if (line.startsWith("#") || line.startsWith(CODE_FENCE)) {
            return true;
        }
        for (String prefix : COMMENTARY_PREFIXES) {
            if (line.startsWith(prefix)) {
                return true;
            }
        }
        String lower = line.toLowerCase(Locale.ROOT);
        for (String prefix : ENGLISH_COMMENTARY_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    enum Separator {
        PERIOD,
        COLON
    }

    record IndexedLine(int index, Separator separator, String text) {

        static Optional<IndexedLine> parse(String line) {
            Matcher period = PERIOD_LINE.matcher(line);
            if (period.matches()) {
                return build(period, Separator.PERIOD);
            }
            Matcher colon = COLON_LINE.matcher(line);
            if (colon.matches()) {
                return build(colon, Separator.COLON);
            }
            return Optional.empty();
        }

        private static Optional<IndexedLine> build(Matcher matcher, Separator separator) {
            try {
                int index = Integer.parseInt(matcher.group(1));
                return Optional.of(new IndexedLine(index, separator, matcher.group(2).strip()));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }

        boolean isSiblingOf(IndexedLine other) {
            return index == other.index && separator == other.separator;
        }
    }
}
