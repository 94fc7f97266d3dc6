package ai.subtitle.translator.config;

import ai.subtitle.translator.render.RenderSettings;
import ai.subtitle.translator.translate.TranslationMode;
import ai.subtitle.translator.translate.TranslationSettings;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Mode mode,
        Path input,
        Optional<Path> second,
        Optional<Path> output,
        TranslationMode translationMode,
        LogFormat logFormat,
        TranslatorConfig translatorConfig,
        Secrets secrets,
        double fps,
        int cjkMergeThreshold,
        TranslationSettings translationSettings,
        RenderSettings renderSettings,
        Optional<Path> promptFile,
        boolean overwrite
) {

    public Config {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(input, "input");
        second = second == null ? Optional.empty() : second;
        output = output == null ? Optional.empty() : output;
        Objects.requireNonNull(translationMode, "translationMode");
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(translatorConfig, "translatorConfig");
        secrets = secrets == null ? Secrets.none() : secrets;
        Objects.requireNonNull(translationSettings, "translationSettings");
        Objects.requireNonNull(renderSettings, "renderSettings");
        promptFile = promptFile == null ? Optional.empty() : promptFile;
        if (!(fps > 0) || Double.isInfinite(fps)) {
            throw new IllegalArgumentException("fps must be a positive number");
        }
        if (cjkMergeThreshold < 0) {
            throw new IllegalArgumentException("cjkMergeThreshold must be zero or greater");
        }
        if (mode == Mode.BILINGUAL && second.isEmpty()) {
            throw new IllegalArgumentException("--second must be provided in bilingual mode");
        }
        if (!mode.isSingleStage() && output.isPresent()) {
            throw new IllegalArgumentException("--output applies to single-stage modes only");
        }
    }
}
