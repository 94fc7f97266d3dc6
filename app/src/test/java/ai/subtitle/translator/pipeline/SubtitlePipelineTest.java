package ai.subtitle.translator.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.subtitle.translator.merge.LineMergeEngine;
import ai.subtitle.translator.render.AssRenderer;
import ai.subtitle.translator.subtitle.CaptionEntry;
import ai.subtitle.translator.subtitle.SrtCodec;
import ai.subtitle.translator.timing.OverlapRepairer;
import ai.subtitle.translator.translate.BatchTranslationOrchestrator;
import ai.subtitle.translator.translate.MockTranslator;
import ai.subtitle.translator.translate.PassThroughTranslator;
import ai.subtitle.translator.translate.PromptTemplate;
import ai.subtitle.translator.translate.TranslationMode;
import ai.subtitle.translator.translate.TranslationOutcome;
import ai.subtitle.translator.translate.Translator;
import ai.subtitle.translator.translate.TranslatorFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

class SubtitlePipelineTest {

    private static final String SOURCE = """
            1
            00:00:00,000 --> 00:00:05,000
            Back in school,

            2
            00:00:04,500 --> 00:00:06,000
            I discovered a very

            3
            00:00:06,500 --> 00:00:08,000
            simple formula

            4
            00:00:08,000 --> 00:00:09,000
            that I keep
            """;

    @TempDir
    Path tempDir;

    private final SrtCodec codec = new SrtCodec();

    @Test
    void runWritesEveryStageNextToTheInput() throws Exception {
        Path input = write("talk.srt", SOURCE);

        PipelineResult result = pipeline(TranslationMode.MOCK).run(input, false);

        assertThat(result.fixed()).isEqualTo(tempDir.resolve("talk_fix.srt")).exists();
        assertThat(result.merged()).isEqualTo(tempDir.resolve("talk_merged.srt")).exists();
        assertThat(result.translated()).isEqualTo(tempDir.resolve("talk_zh.srt")).exists();
        assertThat(result.script()).isEqualTo(tempDir.resolve("talk.ass")).exists();
        assertThat(result.outcome().size()).isEqualTo(2);
        assertThat(result.translationReused()).isFalse();

        List<CaptionEntry> translated = read(result.translated());
        assertThat(translated).extracting(CaptionEntry::text).containsExactly(
                "Back in school, I discovered a very\n[MOCK] Back in school, I discovered a very",
                "simple formula that I keep\n[MOCK] simple formula that I keep");
        assertThat(translated.get(0).end().millis()).isEqualTo(6_000);

        byte[] script = Files.readAllBytes(result.script());
        assertThat(script).startsWith((byte) 0xEF, (byte) 0xBB, (byte) 0xBF);
        assertThat(new String(script, StandardCharsets.UTF_8)).contains("Dialogue: 0,0:00:00.00,0:00:06.00,Default");
    }

    @Test
    void runReusesAnExistingTranslationUnlessOverwriting() throws Exception {
        Path input = write("talk.srt", SOURCE);
        write("talk_zh.srt", "1\n00:00:00,000 --> 00:00:06,000\nEarlier\n之前\n");

        PipelineResult reused = pipeline(TranslationMode.MOCK).run(input, false);

        assertThat(reused.translationReused()).isTrue();
        assertThat(reused.outcome().size()).isZero();
        assertThat(read(reused.translated())).extracting(CaptionEntry::text).containsExactly("Earlier\n之前");
        assertThat(Files.readString(reused.script(), StandardCharsets.UTF_8)).contains("之前");

        PipelineResult overwritten = pipeline(TranslationMode.MOCK).run(input, true);

        assertThat(overwritten.translationReused()).isFalse();
        assertThat(overwritten.outcome().size()).isEqualTo(2);
        assertThat(read(overwritten.translated())).extracting(CaptionEntry::text)
                .contains("simple formula that I keep\n[MOCK] simple formula that I keep");
    }

    @Test
    void fixStageRepairsOverlapsOnly() throws Exception {
        Path input = write("talk.srt", SOURCE);
        Path output = tempDir.resolve("custom/fixed.srt");

        pipeline(TranslationMode.DRY_RUN).fix(input, output);

        List<CaptionEntry> fixed = read(output);
        assertThat(fixed).hasSize(4);
        assertThat(fixed.get(0).end().millis()).isEqualTo(4_483);
        assertThat(fixed.get(2).end().millis()).isEqualTo(7_983);
        assertThat(fixed.get(3).end().millis()).isEqualTo(9_000);
    }

    @Test
    void translateKeepsOriginalTextWhenModelFails() throws Exception {
        Path input = write("talk.srt", SOURCE);
        Translator failing = (system, payload) -> {
            throw new IllegalStateException("quota exceeded");
        };
        SubtitlePipeline pipeline = pipeline(TranslationMode.PRODUCTION, failing);

        TranslationOutcome outcome = pipeline.translate(input, OutputPaths.translated(input));

        assertThat(outcome.filledCount()).isEqualTo(4);
        assertThat(read(OutputPaths.translated(input))).extracting(CaptionEntry::text)
                .containsExactly("Back in school,", "I discovered a very", "simple formula", "that I keep");
    }

    @Test
    void mergesTwoStreamsIntoBilingualFile() throws Exception {
        Path english = write("talk.srt", "1\n00:00:01,000 --> 00:00:02,000\nHello\n\n2\n00:00:03,000 --> 00:00:04,000\nWorld\n");
        Path chinese = write("talk.zh.srt", "1\n00:00:01,000 --> 00:00:02,000\n你好\n\n2\n00:00:03,000 --> 00:00:04,000\n世界\n");

        Path output = pipeline(TranslationMode.DRY_RUN).mergeBilingual(english, chinese, OutputPaths.bilingual(english));

        assertThat(output).isEqualTo(tempDir.resolve("talk_bilingual.srt"));
        assertThat(read(output)).extracting(CaptionEntry::text).containsExactly("Hello\n你好", "World\n世界");
    }

    @Test
    void renderStageWritesScript() throws Exception {
        Path input = write("talk_bilingual.srt", "1\n00:00:01,000 --> 00:00:02,000\nHello\n你好\n");

        Path output = pipeline(TranslationMode.DRY_RUN).render(input, tempDir.resolve("talk.ass"));

        String script = Files.readString(output, StandardCharsets.UTF_8);
        assertThat(script).contains("Chinese,,0,0,0,,你好", "Default,,0,0,0,,Hello");
        assertThat(MDC.get(SubtitlePipeline.MDC_STAGE)).isNull();
    }

    @Test
    void missingOrUndecodableInputIsFatal() throws Exception {
        SubtitlePipeline pipeline = pipeline(TranslationMode.DRY_RUN);
        Path broken = tempDir.resolve("broken.srt");
        Files.write(broken, new byte[] {'1', '\n', (byte) 0xC3, (byte) 0x28});

        assertThatThrownBy(() -> pipeline.fix(tempDir.resolve("absent.srt"), tempDir.resolve("out.srt")))
                .isInstanceOf(SubtitleFileException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> pipeline.fix(broken, tempDir.resolve("out.srt")))
                .isInstanceOf(SubtitleFileException.class)
                .hasMessageContaining("UTF-8");
        assertThat(MDC.get(SubtitlePipeline.MDC_FILE)).isNull();
    }

    private SubtitlePipeline pipeline(TranslationMode mode) {
        return pipeline(mode, (system, payload) -> {
            throw new AssertionError("production translator must not be used");
        });
    }

    private SubtitlePipeline pipeline(TranslationMode mode, Translator production) {
        TranslatorFactory factory = new TranslatorFactory(production, new PassThroughTranslator(), new MockTranslator());
        BatchTranslationOrchestrator orchestrator = new BatchTranslationOrchestrator(factory, new PromptTemplate("prompt"));
        return new SubtitlePipeline(new OverlapRepairer(), new LineMergeEngine(), orchestrator, new AssRenderer(), mode);
    }

    private Path write(String name, String content) throws Exception {
        Path path = tempDir.resolve(name);
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }

    private List<CaptionEntry> read(Path path) throws Exception {
        return codec.parseEntries(Files.readString(path, StandardCharsets.UTF_8));
    }
}
