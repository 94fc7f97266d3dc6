package ai.subtitle.translator.writer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SubtitleWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesUtf8AndCreatesDirectories() throws Exception {
        Path target = tempDir.resolve("out/nested/talk_zh.srt");

        Path written = new SubtitleWriter().write(target, "1\n00:00:01,000 --> 00:00:02,000\n你好\n");

        assertThat(written).isEqualTo(target);
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("1\n00:00:01,000 --> 00:00:02,000\n你好\n");
    }

    @Test
    void prefixesByteOrderMarkWhenRequested() throws Exception {
        Path target = tempDir.resolve("talk.ass");

        new SubtitleWriter().write(target, "[Script Info]\n", true);

        byte[] bytes = Files.readAllBytes(target);
        assertThat(bytes).startsWith((byte) 0xEF, (byte) 0xBB, (byte) 0xBF);
        assertThat(new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8)).isEqualTo("[Script Info]\n");
    }

    @Test
    void overwritesExistingFile() throws Exception {
        Path target = tempDir.resolve("talk_fix.srt");
        Files.writeString(target, "a much longer previous content", StandardCharsets.UTF_8);

        new SubtitleWriter().write(target, "new");

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("new");
    }

    @Test
    void rejectsMissingArguments() {
        assertThatThrownBy(() -> new SubtitleWriter().write(null, "x")).isInstanceOf(IllegalArgumentException.class);
    }
}
