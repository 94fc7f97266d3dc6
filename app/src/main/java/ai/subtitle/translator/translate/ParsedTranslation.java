package ai.subtitle.translator.translate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-index units recovered from one collaborator response. {@code formatValid} is true only when every unit
 * carried both its source and target half.
 */
public record ParsedTranslation(Map<Integer, String> units, boolean formatValid) {

    public ParsedTranslation {
        units = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(units, "units")));
    }

    public static ParsedTranslation empty() {
        return new ParsedTranslation(Map.of(), false);
    }

    public int size() {
        return units.size();
    }
}
