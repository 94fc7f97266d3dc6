package ai.subtitle.translator.subtitle;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Millisecond-precision caption instant with SRT ({@code HH:MM:SS,mmm}) and ASS ({@code H:MM:SS.cc}) encodings.
 */
public record Timestamp(long millis) implements Comparable<Timestamp> {

    private static final Pattern SRT_PATTERN = Pattern.compile("(\\d{2,}):(\\d{2}):(\\d{2}),(\\d{3})");

    public static final Timestamp ZERO = new Timestamp(0);

    public Timestamp {
        if (millis < 0) {
            throw new IllegalArgumentException("millis must not be negative");
        }
    }

    public static Timestamp ofMillis(long millis) {
        return new Timestamp(millis);
    }

    public static Timestamp parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("timestamp must be provided");
        }
        Matcher matcher = SRT_PATTERN.matcher(raw.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid SRT timestamp: " + raw);
        }
        long hours = Long.parseLong(matcher.group(1));
        long minutes = Long.parseLong(matcher.group(2));
        long seconds = Long.parseLong(matcher.group(3));
        long milliseconds = Long.parseLong(matcher.group(4));
        return new Timestamp(((hours * 60 + minutes) * 60 + seconds) * 1000 + milliseconds);
    }

    public static long toMillis(String srtTimestamp) {
        return parse(srtTimestamp).millis();
    }

    public static String fromMillis(long millis) {
        return new Timestamp(millis).toSrt();
    }

    /**
     * Subtracts the given amount, clamping at zero.
     */
    public Timestamp minus(long amountMillis) {
        return new Timestamp(Math.max(0, millis - amountMillis));
    }

    public boolean isBefore(Timestamp other) {
        return millis < other.millis;
    }

    public String toSrt() {
        long milli = millis % 1000;
        long totalSeconds = millis / 1000;
        long seconds = totalSeconds % 60;
        long totalMinutes = totalSeconds / 60;
        long minutes = totalMinutes % 60;
        long hours = totalMinutes / 60;
        return String.format("%02d:%02d:%02d,%03d", hours, minutes, seconds, milli);
    }

    /**
     * Presentation form used by ASS scripts. Centiseconds are truncated, never rounded.
     */
    public String toAss() {
        long centiseconds = (millis % 1000) / 10;
        long totalSeconds = millis / 1000;
        long seconds = totalSeconds % 60;
        long totalMinutes = totalSeconds / 60;
        long minutes = totalMinutes % 60;
        long hours = totalMinutes / 60;
        return String.format("%d:%02d:%02d.%02d", hours, minutes, seconds, centiseconds);
    }

    public static String srtToAss(String srtTimestamp) {
        return parse(srtTimestamp).toAss();
    }

    @Override
    public int compareTo(Timestamp other) {
        return Long.compare(millis, other.millis);
    }

    @Override
    public String toString() {
        return toSrt();
    }
}
