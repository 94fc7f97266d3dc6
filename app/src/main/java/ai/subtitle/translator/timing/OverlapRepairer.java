package ai.subtitle.translator.timing;

import ai.subtitle.translator.subtitle.CaptionEntry;
import ai.subtitle.translator.subtitle.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls each caption's end time back by one frame when it reaches into the next caption.
 *
 * <p>This is a single forward pass against the neighbour's original start time. Chains of three or more
 * colliding captions are not resolved transitively.</p>
 */
public class OverlapRepairer {

    private static final Logger LOGGER = LoggerFactory.getLogger(OverlapRepairer.class);
    public static final double DEFAULT_FPS = 60.0;

    private final double frameDurationMillis;
    // floor(start - frame) == start - ceil(frame) for whole-millisecond starts
    private final long frameStepMillis;

    public OverlapRepairer() {
        this(DEFAULT_FPS);
    }

    public OverlapRepairer(double fps) {
        if (!(fps > 0.0) || Double.isInfinite(fps)) {
            throw new IllegalArgumentException("fps must be greater than zero");
        }
        this.frameDurationMillis = 1000.0 / fps;
        this.frameStepMillis = (long) Math.ceil(frameDurationMillis);
    }

    public double frameDurationMillis() {
        return frameDurationMillis;
    }

    public List<CaptionEntry> repair(List<CaptionEntry> entries) {
        Objects.requireNonNull(entries, "entries");
        List<CaptionEntry> repaired = new ArrayList<>(entries.size());
        int adjusted = 0;
        for (int i = 0; i < entries.size(); i++) {
            CaptionEntry current = entries.get(i);
            if (i < entries.size() - 1) {
                Timestamp nextStart = entries.get(i + 1).start();
                if (current.end().millis() >= nextStart.millis()) {
                    current = current.withEnd(nextStart.minus(frameStepMillis));
                    adjusted++;
                }
            }
            repaired.add(current);
        }
        LOGGER.info("Repaired {} overlapping caption(s) out of {}", adjusted, entries.size());
        return List.copyOf(repaired);
    }
}
