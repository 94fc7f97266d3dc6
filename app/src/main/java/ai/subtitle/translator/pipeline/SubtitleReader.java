package ai.subtitle.translator.pipeline;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads caption files with strict UTF-8 decoding.
 */
public class SubtitleReader {

    public String read(Path source) {
        if (source == null) {
            throw new IllegalArgumentException("source must be provided");
        }
        if (!Files.isRegularFile(source)) {
            throw new SubtitleFileException("Caption file not found: " + source);
        }
        try {
            return Files.readString(source, StandardCharsets.UTF_8);
        } catch (CharacterCodingException ex) {
            throw new SubtitleFileException("Caption file is not valid UTF-8: " + source, ex);
        } catch (IOException ex) {
            throw new SubtitleFileException("Failed to read caption file: " + source, ex);
        }
    }
}
