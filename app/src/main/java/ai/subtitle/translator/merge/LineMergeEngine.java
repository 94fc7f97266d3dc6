package ai.subtitle.translator.merge;

import ai.subtitle.translator.subtitle.CaptionEntry;
import ai.subtitle.translator.subtitle.ScriptDetector;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines neighbouring captions pairwise to reduce on-screen churn.
 *
 * <p>A caption that already carries more than {@code cjkThreshold} ideographs is dense enough on its own
 * and is never used as the head of a merged pair. Output indices are renumbered from 1.</p>
 */
public class LineMergeEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineMergeEngine.class);
    public static final int DEFAULT_CJK_THRESHOLD = 20;

    private final int cjkThreshold;

    public LineMergeEngine() {
        this(DEFAULT_CJK_THRESHOLD);
    }

    public LineMergeEngine(int cjkThreshold) {
        if (cjkThreshold < 0) {
            throw new IllegalArgumentException("cjkThreshold must be zero or greater");
        }
        this.cjkThreshold = cjkThreshold;
    }

    public List<CaptionEntry> merge(List<CaptionEntry> entries) {
        Objects.requireNonNull(entries, "entries");
        List<CaptionEntry> merged = new ArrayList<>((entries.size() + 1) / 2);
        int position = 0;
        int keptAlone = 0;
        while (position < entries.size()) {
            CaptionEntry first = entries.get(position);
            int nextIndex = merged.size() + 1;
            if (isDense(first)) {
                merged.add(first.withIndex(nextIndex));
                keptAlone++;
                position++;
                continue;
            }
            if (position + 1 >= entries.size()) {
                merged.add(first.withIndex(nextIndex));
                position++;
                continue;
            }
            CaptionEntry second = entries.get(position + 1);
            String text = first.singleLineText() + " " + second.singleLineText();
            merged.add(new CaptionEntry(nextIndex, first.start(), second.end(), List.of(text)));
            position += 2;
        }
        LOGGER.info("Merged {} captions into {} ({} kept alone for density)", entries.size(), merged.size(), keptAlone);
        return List.copyOf(merged);
    }

    boolean isDense(CaptionEntry entry) {
        return ScriptDetector.countCjk(entry.text()) > cjkThreshold;
    }
}
