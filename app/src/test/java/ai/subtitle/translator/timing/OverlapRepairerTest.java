package ai.subtitle.translator.timing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.subtitle.translator.subtitle.CaptionEntry;
import ai.subtitle.translator.subtitle.Timestamp;
import java.util.List;
import org.junit.jupiter.api.Test;

class OverlapRepairerTest {

    @Test
    void pullsOverlappingEndBackByOneFrame() {
        List<CaptionEntry> entries = List.of(
                CaptionEntry.of(1, "00:00:00,000", "00:00:05,000", "First"),
                CaptionEntry.of(2, "00:00:04,500", "00:00:06,000", "Second"),
                CaptionEntry.of(3, "00:00:07,000", "00:00:08,000", "Third"));

        List<CaptionEntry> repaired = new OverlapRepairer().repair(entries);

        assertThat(repaired.get(0).end()).isEqualTo(Timestamp.ofMillis(4_483));
        assertThat(repaired.get(1)).isEqualTo(entries.get(1));
        assertThat(repaired.get(2)).isEqualTo(entries.get(2));
        assertThat(repaired).extracting(CaptionEntry::text).containsExactly("First", "Second", "Third");
    }

    @Test
    void touchingBoundaryCountsAsOverlap() {
        List<CaptionEntry> entries = List.of(
                CaptionEntry.of(1, "00:00:01,000", "00:00:02,000", "A"),
                CaptionEntry.of(2, "00:00:02,000", "00:00:03,000", "B"));

        List<CaptionEntry> repaired = new OverlapRepairer(25).repair(entries);

        assertThat(repaired.get(0).end().millis()).isEqualTo(1_960);
    }

    @Test
    void leavesEveryEndAtOrBeforeNextStart() {
        List<CaptionEntry> entries = List.of(
                CaptionEntry.of(1, "00:00:00,000", "00:00:03,000", "A"),
                CaptionEntry.of(2, "00:00:01,000", "00:00:03,500", "B"),
                CaptionEntry.of(3, "00:00:02,000", "00:00:02,900", "C"),
                CaptionEntry.of(4, "00:00:04,000", "00:00:05,000", "D"));

        List<CaptionEntry> repaired = new OverlapRepairer(30).repair(entries);

        for (int i = 0; i < repaired.size() - 1; i++) {
            assertThat(repaired.get(i).end()).isLessThanOrEqualTo(repaired.get(i + 1).start());
        }
    }

    @Test
    void clampsRepairedEndAtZero() {
        List<CaptionEntry> entries = List.of(
                CaptionEntry.of(1, "00:00:00,000", "00:00:00,020", "A"),
                CaptionEntry.of(2, "00:00:00,010", "00:00:01,000", "B"));

        assertThat(new OverlapRepairer().repair(entries).get(0).end()).isEqualTo(Timestamp.ZERO);
    }

    @Test
    void rejectsNonPositiveFrameRate() {
        assertThatThrownBy(() -> new OverlapRepairer(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OverlapRepairer(-24)).isInstanceOf(IllegalArgumentException.class);
    }
}
