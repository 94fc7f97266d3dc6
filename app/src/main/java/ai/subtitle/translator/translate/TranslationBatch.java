package ai.subtitle.translator.translate;

import ai.subtitle.translator.subtitle.CaptionEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Contiguous slice of a caption stream. Global sequence numbers are derived from the offset, never from the
 * captions' own indices, so they stay stable regardless of where batch boundaries fall.
 */
public record TranslationBatch(int offset, List<CaptionEntry> entries) {

    public TranslationBatch {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be zero or greater");
        }
        entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    }

    public static List<TranslationBatch> split(List<CaptionEntry> entries, int batchSize) {
        Objects.requireNonNull(entries, "entries");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        List<TranslationBatch> batches = new ArrayList<>((entries.size() + batchSize - 1) / batchSize);
        for (int start = 0; start < entries.size(); start += batchSize) {
            int end = Math.min(entries.size(), start + batchSize);
            batches.add(new TranslationBatch(start, entries.subList(start, end)));
        }
        return List.copyOf(batches);
    }

    public int size() {
        return entries.size();
    }

    public int globalSequence(int localPosition) {
        return offset + localPosition + 1;
    }

    public int firstSequence() {
        return offset + 1;
    }

    public int lastSequence() {
        return offset + entries.size();
    }

    public boolean covers(int globalSequence) {
        return globalSequence >= firstSequence() && globalSequence <= lastSequence();
    }

    public String originalText(int globalSequence) {
        return entries.get(globalSequence - offset - 1).singleLineText();
    }

    /**
     * Formats the batch as {@code "<global-seq>: <text>"} lines.
     */
    public String payload() {
        List<String> lines = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            lines.add(globalSequence(i) + ": " + entries.get(i).singleLineText());
        }
        return String.join("\n", lines);
    }
}
