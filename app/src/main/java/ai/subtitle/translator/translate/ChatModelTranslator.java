package ai.subtitle.translator.translate;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.Objects;

/**
 * Translator backed by a LangChain4j {@link ChatModel}. The prompt template goes out as the system message and
 * the numbered caption batch as the user message.
 */
public class ChatModelTranslator implements Translator {

    private final ChatModel model;
    private final String providerName;
    private final String modelName;

    public ChatModelTranslator(ChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public String translate(String systemPrompt, String userPayload) {
        if (userPayload == null || userPayload.isBlank()) {
            return "";
        }
        try {
            ChatResponse response = systemPrompt == null || systemPrompt.isBlank()
                    ? model.chat(UserMessage.from(userPayload))
                    : model.chat(SystemMessage.from(systemPrompt), UserMessage.from(userPayload));
            AiMessage message = response == null ? null : response.aiMessage();
            if (message == null || message.text() == null) {
                throw new TranslationException("%s model '%s' returned an empty response".formatted(providerName, modelName));
            }
            return message.text().strip();
        } catch (TranslationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new TranslationException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new TranslationException("LangChain translation failed", ex);
        }
    }

    public String providerName() {
        return providerName;
    }

    public String modelName() {
        return modelName;
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
