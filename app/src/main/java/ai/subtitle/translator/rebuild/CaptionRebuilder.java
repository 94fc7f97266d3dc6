package ai.subtitle.translator.rebuild;

import ai.subtitle.translator.subtitle.CaptionEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs original caption timing with replacement text. Blank lines are dropped from replacement text, since a blank
 * line ends an SRT block; a replacement with no text left keeps the original caption.
 */
public class CaptionRebuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(CaptionRebuilder.class);

    public List<CaptionEntry> rebuild(List<CaptionEntry> original, List<String> texts) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(texts, "texts");
        if (texts.size() < original.size()) {
            LOGGER.warn("Only {} texts for {} captions; keeping original text for the remainder", texts.size(), original.size());
        }
        List<CaptionEntry> rebuilt = new ArrayList<>(original.size());
        for (int i = 0; i < original.size(); i++) {
            CaptionEntry entry = original.get(i);
            String text = i < texts.size() ? withoutBlankLines(texts.get(i)) : "";
            if (text.isEmpty()) {
                if (i < texts.size()) {
                    LOGGER.debug("Caption {} has no replacement text; keeping the original", entry.index());
                }
                rebuilt.add(entry);
            } else {
                rebuilt.add(entry.withText(text));
            }
        }
        return List.copyOf(rebuilt);
    }

    private static String withoutBlankLines(String text) {
        if (text == null) {
            return "";
        }
        return text.lines()
                .filter(line -> !line.isBlank())
                .collect(Collectors.joining("\n"));
    }
}
