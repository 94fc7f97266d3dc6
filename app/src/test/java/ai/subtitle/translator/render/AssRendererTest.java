package ai.subtitle.translator.render;

import static org.assertj.core.api.Assertions.assertThat;

import ai.subtitle.translator.subtitle.CaptionEntry;
import ai.subtitle.translator.subtitle.Timestamp;
import java.util.List;
import org.junit.jupiter.api.Test;

class AssRendererTest {

    @Test
    void writesHeaderWithBothStyles() {
        String script = new AssRenderer().render(List.of());

        assertThat(script).startsWith("[Script Info]\n");
        assertThat(script).contains("ScriptType: v4.00+", "PlayResX: 1280", "PlayResY: 720", "[V4+ Styles]", "[Events]");
        assertThat(script).contains(
                "Style: Default,Arial,16,&H00FFFFFF,&H000000FF,&H00000000,&H00000000,0,0,0,0,100,100,0,0,1,2,0,2,10,10,10,1");
        assertThat(script).contains(
                "Style: Chinese,VYuan_Round,20,&H00FFFFFF,&H000000FF,&H00FF0000,&H00000000,0,0,0,0,100,100,0,0,1,3,0,2,10,10,34,1");
        assertThat(script).endsWith("Format: Layer, Start, End, Style, Name, MarginL, MarginR, MarginV, Effect, Text\n");
    }

    @Test
    void splitsCaptionIntoTargetAndSourceEvents() {
        CaptionEntry entry = new CaptionEntry(1, Timestamp.ofMillis(1_000),
                Timestamp.ofMillis(2_505), List.of("Hello {world}", "", "你好", "世界"));

        String script = new AssRenderer().render(List.of(entry));

        String target = "Dialogue: 0,0:00:01.00,0:00:02.50,Chinese,,0,0,0,,你好\\N世界";
        String source = "Dialogue: 0,0:00:01.00,0:00:02.50,Default,,0,0,0,,Hello \\{world\\}";
        assertThat(script).contains(target, source);
        assertThat(script.indexOf(target)).isLessThan(script.indexOf(source));
    }

    @Test
    void sourceOnlyCaptionYieldsOneEvent() {
        String script = new AssRenderer().render(List.of(CaptionEntry.of(1, "00:00:01,000", "00:00:02,000", "Hello")));

        assertThat(script.lines().filter(line -> line.startsWith("Dialogue:"))).containsExactly(
                "Dialogue: 0,0:00:01.00,0:00:02.00,Default,,0,0,0,,Hello");
    }

    @Test
    void stacksTargetStyleAboveConfiguredSourceSize() {
        String script = new AssRenderer(new RenderSettings(18, 24)).render(List.of());

        assertThat(script).contains("Style: Chinese,VYuan_Round,24,").contains(",10,10,36,1\n");
        assertThat(script).contains("Style: Default,Arial,18,");
    }

    @Test
    void escapesOverrideBraces() {
        assertThat(AssRenderer.escape("{\\b1}bold")).isEqualTo("\\{\\b1\\}bold");
    }
}
