package ai.subtitle.translator.subtitle;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ScriptDetectorTest {

    @Test
    void countsOnlyUnifiedIdeographs() {
        assertThat(ScriptDetector.countCjk("你好 world")).isEqualTo(2);
        assertThat(ScriptDetector.countCjk("，。！")).isZero();
        assertThat(ScriptDetector.countCjk(null)).isZero();
    }

    @Test
    void detectsPresenceOfChinese() {
        assertThat(ScriptDetector.containsCjk("Hello 世界")).isTrue();
        assertThat(ScriptDetector.containsCjk("Hello world")).isFalse();
        assertThat(ScriptDetector.containsCjk("こんにちは")).isFalse();
    }
}
