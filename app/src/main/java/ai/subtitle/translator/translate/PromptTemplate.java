package ai.subtitle.translator.translate;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * System prompt sent with every batch.
 */
public record PromptTemplate(String text) {

    public static final String DEFAULT_RESOURCE = "prompts/translate.md";

    public PromptTemplate {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("prompt text must not be blank");
        }
    }

    public static PromptTemplate loadDefault() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static PromptTemplate fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource");
        try (InputStream stream = PromptTemplate.class.getClassLoader().getResourceAsStream(resource)) {
            if (stream == null) {
                throw new IllegalStateException("Prompt resource not found on classpath: " + resource);
            }
            return new PromptTemplate(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read prompt resource: " + resource, ex);
        }
    }

    public static PromptTemplate fromFile(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            return new PromptTemplate(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read prompt file: " + path, ex);
        }
    }
}
