package ai.subtitle.translator.config;

import ai.subtitle.translator.cli.CliArguments;
import ai.subtitle.translator.merge.LineMergeEngine;
import ai.subtitle.translator.render.RenderSettings;
import ai.subtitle.translator.timing.OverlapRepairer;
import ai.subtitle.translator.translate.TranslationMode;
import ai.subtitle.translator.translate.TranslationSettings;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MODE = "SUBTITLE_MODE";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OPENAI_BASE_URL = "OPENAI_BASE_URL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_FPS = "SUBTITLE_FPS";
    static final String ENV_BATCH_SIZE = "TRANSLATION_BATCH_SIZE";
    static final String ENV_MAX_ATTEMPTS = "TRANSLATION_MAX_ATTEMPTS";
    static final String ENV_CJK_THRESHOLD = "SUBTITLE_MERGE_CJK_THRESHOLD";
    static final String ENV_SOURCE_FONT_SIZE = "ASS_SOURCE_FONT_SIZE";
    static final String ENV_TARGET_FONT_SIZE = "ASS_TARGET_FONT_SIZE";
    static final String ENV_PROMPT_FILE = "SUBTITLE_PROMPT_FILE";

    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.input() == null) {
            throw new IllegalArgumentException("input caption file must be provided");
        }
        Mode mode = resolveMode(arguments);
        TranslationMode translationMode = resolveTranslationMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        LlmProvider provider = env(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OPENAI);
        String modelName = env(ENV_LLM_MODEL).orElse(provider.defaultModel());
        Optional<String> baseUrl = switch (provider) {
            case OPENAI -> env(ENV_OPENAI_BASE_URL);
            case OLLAMA -> Optional.of(env(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL));
            case GEMINI -> Optional.empty();
        };
        Secrets secrets = new Secrets(env(ENV_OPENAI_API_KEY), env(ENV_GEMINI_API_KEY));
        TranslatorConfig translatorConfig = new TranslatorConfig(provider, modelName, baseUrl);

        double fps = arguments.fps() != null
                ? requirePositive(arguments.fps(), "--fps")
                : env(ENV_FPS).map(raw -> parsePositiveDouble(raw, ENV_FPS)).orElse(OverlapRepairer.DEFAULT_FPS);
        int batchSize = resolvePositiveInt(arguments.batchSize(), "--batch-size", ENV_BATCH_SIZE,
                TranslationSettings.DEFAULT_BATCH_SIZE);
        int maxAttempts = resolvePositiveInt(arguments.maxAttempts(), "--max-attempts", ENV_MAX_ATTEMPTS,
                TranslationSettings.DEFAULT_MAX_ATTEMPTS);
        int sourceFontSize = resolvePositiveInt(arguments.sourceFontSize(), "--source-font-size", ENV_SOURCE_FONT_SIZE,
                RenderSettings.DEFAULT_SOURCE_FONT_SIZE);
        int targetFontSize = resolvePositiveInt(arguments.targetFontSize(), "--target-font-size", ENV_TARGET_FONT_SIZE,
                RenderSettings.DEFAULT_TARGET_FONT_SIZE);
        int cjkThreshold = env(ENV_CJK_THRESHOLD)
                .map(raw -> parseNonNegativeInteger(raw, ENV_CJK_THRESHOLD))
                .orElse(LineMergeEngine.DEFAULT_CJK_THRESHOLD);
        Optional<Path> promptFile = env(ENV_PROMPT_FILE).map(Path::of);

        return new Config(mode, arguments.input(), Optional.ofNullable(arguments.second()),
                Optional.ofNullable(arguments.output()), translationMode, logFormat, translatorConfig, secrets, fps,
                cjkThreshold, new TranslationSettings(batchSize, maxAttempts),
                new RenderSettings(sourceFontSize, targetFontSize), promptFile, arguments.overwrite());
    }

    private Mode resolveMode(CliArguments arguments) {
        Mode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return env(ENV_MODE)
                .map(Mode::from)
                .orElse(Mode.PIPELINE);
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return env(ENV_TRANSLATION_MODE)
                .map(TranslationMode::from)
                .orElse(TranslationMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return env(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolvePositiveInt(Integer cliValue, String option, String envKey, int defaultValue) {
        if (cliValue != null) {
            if (cliValue < 1) {
                throw new IllegalArgumentException(option + " must be at least 1");
            }
            return cliValue;
        }
        return env(envKey)
                .map(raw -> parsePositiveInteger(raw, envKey))
                .orElse(defaultValue);
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parsePositiveInteger(String raw, String key) {
        int value = parseNonNegativeInteger(raw, key);
        if (value < 1) {
            throw new IllegalArgumentException(key + " must be at least 1");
        }
        return value;
    }

    private static int parseNonNegativeInteger(String raw, String key) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(key + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static double parsePositiveDouble(String raw, String key) {
        try {
            return requirePositive(Double.parseDouble(raw), key);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + raw, ex);
        }
    }

    private static double requirePositive(double value, String name) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be a positive number");
        }
        return value;
    }
}
