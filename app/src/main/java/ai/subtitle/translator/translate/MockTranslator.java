package ai.subtitle.translator.translate;

import java.util.ArrayList;
import java.util.List;

/**
 * Mock translator that marks the second half of every unit with a {@code [MOCK]} prefix.
 */
public class MockTranslator implements Translator {

    static final String PREFIX = "[MOCK] ";

    @Override
    public String translate(String systemPrompt, String userPayload) {
        List<String> response = new ArrayList<>();
        for (PayloadLine line : PayloadLine.parseAll(userPayload)) {
            response.add(line.sequence() + ": " + line.text());
            response.add(PREFIX + line.text());
        }
        return String.join("\n", response);
    }
}
