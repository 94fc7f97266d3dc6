package ai.subtitle.translator.translate;

/**
 * External text-translation collaborator. Implementations may throw any runtime exception; callers treat a
 * failure the same way as a malformed response.
 */
public interface Translator {

    String translate(String systemPrompt, String userPayload);
}
