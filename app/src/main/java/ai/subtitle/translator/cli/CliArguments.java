package ai.subtitle.translator.cli;

import ai.subtitle.translator.config.LogFormat;
import ai.subtitle.translator.config.Mode;
import ai.subtitle.translator.translate.TranslationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "subtitle-translator", mixinStandardHelpOptions = true, version = "subtitle-translator 0.1.0",
        description = "Repairs, merges, translates and renders SRT captions as bilingual subtitles")
public class CliArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "INPUT", description = "Input SRT file")
    private Path input;

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class,
            description = "Stage to run: pipeline, fix, merge-lines, translate, bilingual or render")
    private Mode mode;

    @CommandLine.Option(names = "--second", description = "Second SRT stream for bilingual mode", paramLabel = "SRT")
    private Path second;

    @CommandLine.Option(names = "--output", description = "Output path for single-stage modes", paramLabel = "PATH")
    private Path output;

    @CommandLine.Option(names = "--fps", description = "Frame rate used for overlap repair", paramLabel = "FPS")
    private Double fps;

    @CommandLine.Option(names = "--batch-size", description = "Captions per translation request", paramLabel = "COUNT")
    private Integer batchSize;

    @CommandLine.Option(names = "--max-attempts", description = "Translation attempts per batch", paramLabel = "COUNT")
    private Integer maxAttempts;

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production, dry-run, or mock", converter = TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--source-font-size", description = "Font size of source-language lines", paramLabel = "SIZE")
    private Integer sourceFontSize;

    @CommandLine.Option(names = "--target-font-size", description = "Font size of Chinese lines", paramLabel = "SIZE")
    private Integer targetFontSize;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--overwrite", description = "Translate again even when the translated SRT already exists")
    private boolean overwrite;

    public Path input() {
        return input;
    }

    public Mode mode() {
        return mode;
    }

    public Path second() {
        return second;
    }

    public Path output() {
        return output;
    }

    public Double fps() {
        return fps;
    }

    public Integer batchSize() {
        return batchSize;
    }

    public Integer maxAttempts() {
        return maxAttempts;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public Integer sourceFontSize() {
        return sourceFontSize;
    }

    public Integer targetFontSize() {
        return targetFontSize;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean overwrite() {
        return overwrite;
    }
}
