package ai.subtitle.translator.config;

import java.util.Locale;

/**
 * Supported chat model providers.
 */
public enum LlmProvider {
    OPENAI,
    GEMINI,
    OLLAMA;

    public static LlmProvider from(String value) {
        if (value == null) {
            return OPENAI;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "openai", "" -> OPENAI;
            case "gemini" -> GEMINI;
            case "ollama" -> OLLAMA;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }

    public String defaultModel() {
        return switch (this) {
            case OPENAI -> "gpt-4o-mini";
            case GEMINI -> "gemini-1.5-flash";
            case OLLAMA -> "qwen2.5:7b";
        };
    }
}
