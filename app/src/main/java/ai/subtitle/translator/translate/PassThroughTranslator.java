package ai.subtitle.translator.translate;

import java.util.ArrayList;
import java.util.List;

/**
 * Translator used for dry runs. Answers every payload line with a well-formed bilingual unit whose second half
 * repeats the source text, without invoking remote APIs.
 */
public class PassThroughTranslator implements Translator {

    @Override
    public String translate(String systemPrompt, String userPayload) {
        List<String> response = new ArrayList<>();
        for (PayloadLine line : PayloadLine.parseAll(userPayload)) {
            response.add(line.sequence() + ": " + line.text());
            response.add(line.text());
        }
        return String.join("\n", response);
    }
}
