package ai.subtitle.translator.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes caption and script files as UTF-8, optionally prefixed with a byte order mark.
 */
public class SubtitleWriter {

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    public Path write(Path target, String content) {
        return write(target, content, false);
    }

    public Path write(Path target, String content, boolean byteOrderMark) {
        if (target == null || content == null) {
            throw new IllegalArgumentException("target and content must be provided");
        }
        byte[] body = content.getBytes(StandardCharsets.UTF_8);
        byte[] bytes = body;
        if (byteOrderMark) {
            bytes = new byte[UTF8_BOM.length + body.length];
            System.arraycopy(UTF8_BOM, 0, bytes, 0, UTF8_BOM.length);
            System.arraycopy(body, 0, bytes, UTF8_BOM.length, body.length);
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(target, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            return target;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write subtitle file: " + target, ex);
        }
    }
}
