package ai.subtitle.translator.rebuild;

import ai.subtitle.translator.subtitle.CaptionEntry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines two independently produced single-language streams by caption index, without translation.
 * Timing always comes from the first stream.
 */
public class BilingualMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(BilingualMerger.class);

    public List<CaptionEntry> merge(List<CaptionEntry> first, List<CaptionEntry> second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        Map<Integer, CaptionEntry> byIndex = new HashMap<>();
        for (CaptionEntry entry : second) {
            byIndex.putIfAbsent(entry.index(), entry);
        }
        List<CaptionEntry> merged = new ArrayList<>(first.size());
        int unmatched = 0;
        for (CaptionEntry entry : first) {
            CaptionEntry match = byIndex.get(entry.index());
            if (match == null) {
                unmatched++;
                merged.add(entry);
                continue;
            }
            List<String> lines = new ArrayList<>(entry.lines().size() + match.lines().size());
            lines.addAll(entry.lines());
            lines.addAll(match.lines());
            merged.add(new CaptionEntry(entry.index(), entry.start(), entry.end(), lines));
        }
        if (unmatched > 0) {
            LOGGER.warn("{} of {} captions had no counterpart in the second stream", unmatched, first.size());
        }
        LOGGER.info("Merged {} bilingual captions", merged.size());
        return List.copyOf(merged);
    }
}
