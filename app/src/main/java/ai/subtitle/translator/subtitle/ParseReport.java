package ai.subtitle.translator.subtitle;

import java.util.List;
import java.util.Objects;

/**
 * Result of parsing a caption file: the accepted entries plus every block that was dropped.
 */
public record ParseReport(List<CaptionEntry> entries, List<SkippedBlock> skipped) {

    public ParseReport {
        entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
        skipped = List.copyOf(Objects.requireNonNull(skipped, "skipped"));
    }

    public boolean hasSkipped() {
        return !skipped.isEmpty();
    }

    /**
     * A caption block that could not be parsed.
     */
    public record SkippedBlock(int blockNumber, String content, String reason) {

        public SkippedBlock {
            Objects.requireNonNull(content, "content");
            Objects.requireNonNull(reason, "reason");
        }
    }
}
