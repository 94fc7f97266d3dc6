package ai.subtitle.translator.config;

import java.util.Optional;

/**
 * API keys for the hosted chat model providers.
 */
public record Secrets(Optional<String> openAiApiKey, Optional<String> geminiApiKey) {

    public Secrets {
        openAiApiKey = openAiApiKey == null ? Optional.empty() : openAiApiKey;
        geminiApiKey = geminiApiKey == null ? Optional.empty() : geminiApiKey;
    }

    public static Secrets none() {
        return new Secrets(Optional.empty(), Optional.empty());
    }

    @Override
    public String toString() {
        return "Secrets[openAiApiKey=" + mask(openAiApiKey) + ", geminiApiKey=" + mask(geminiApiKey) + "]";
    }

    private static String mask(Optional<String> value) {
        return value.isPresent() ? "***" : "<unset>";
    }
}
