package ai.subtitle.translator.pipeline;

/**
 * Raised when a caption file is missing, unreadable or not valid UTF-8.
 */
public class SubtitleFileException extends RuntimeException {

    public SubtitleFileException(String message) {
        super(message);
    }

    public SubtitleFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
