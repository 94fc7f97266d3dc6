package ai.subtitle.translator.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One {@code "<seq>: <text>"} line of a batch payload, as read back by the offline translators.
 */
record PayloadLine(int sequence, String text) {

    private static final Pattern LINE = Pattern.compile("^(\\d+): ?(.*)$");

    static List<PayloadLine> parseAll(String payload) {
        if (payload == null || payload.isBlank()) {
            return List.of();
        }
        List<PayloadLine> lines = new ArrayList<>();
        for (String raw : payload.split("\\R")) {
            parse(raw).ifPresent(lines::add);
        }
        return lines;
    }

    static Optional<PayloadLine> parse(String raw) {
        Matcher matcher = LINE.matcher(raw.strip());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new PayloadLine(Integer.parseInt(matcher.group(1)), matcher.group(2)));
    }
}
