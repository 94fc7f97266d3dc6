package ai.subtitle.translator.cli;

import ai.subtitle.translator.config.Config;
import ai.subtitle.translator.config.ConfigLoader;
import ai.subtitle.translator.config.Secrets;
import ai.subtitle.translator.config.SystemEnvironmentReader;
import ai.subtitle.translator.config.TranslatorConfig;
import ai.subtitle.translator.logging.LoggingConfigurator;
import ai.subtitle.translator.merge.LineMergeEngine;
import ai.subtitle.translator.pipeline.OutputPaths;
import ai.subtitle.translator.pipeline.PipelineResult;
import ai.subtitle.translator.pipeline.SubtitlePipeline;
import ai.subtitle.translator.render.AssRenderer;
import ai.subtitle.translator.timing.OverlapRepairer;
import ai.subtitle.translator.translate.BatchTranslationOrchestrator;
import ai.subtitle.translator.translate.BilingualResultParser;
import ai.subtitle.translator.translate.ChatModelTranslator;
import ai.subtitle.translator.translate.MockTranslator;
import ai.subtitle.translator.translate.PassThroughTranslator;
import ai.subtitle.translator.translate.PromptTemplate;
import ai.subtitle.translator.translate.TranslationOutcome;
import ai.subtitle.translator.translate.Translator;
import ai.subtitle.translator.translate.TranslatorFactory;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and subtitle pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    static final int EXIT_FAILURE = 1;
    private static final Duration MODEL_TIMEOUT = Duration.ofMinutes(2);

    private final ConfigLoader configLoader;
    private final Function<Config, ChatModel> chatModelFactory;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createChatModel);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, ChatModel> chatModelFactory) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.chatModelFactory = Objects.requireNonNull(chatModelFactory, "chatModelFactory");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        try {
            Config config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat());
            LOGGER.info("Running {} on {} (translation mode {}, provider {})",
                    config.mode(), config.input(), config.translationMode(), config.translatorConfig().provider());
            execute(config, createPipeline(config));
            return 0;
        } catch (RuntimeException ex) {
            LOGGER.error("Subtitle processing failed: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private void execute(Config config, SubtitlePipeline pipeline) {
        Path input = config.input();
        switch (config.mode()) {
            case PIPELINE -> {
                PipelineResult result = pipeline.run(input, config.overwrite());
                LOGGER.info("Wrote {}, {}, {} and {}", result.fixed(), result.merged(), result.translated(), result.script());
            }
            case FIX -> logWritten(pipeline.fix(input, config.output().orElse(OutputPaths.fixed(input))));
            case MERGE_LINES -> logWritten(pipeline.mergeLines(input, config.output().orElse(OutputPaths.merged(input))));
            case TRANSLATE -> {
                Path output = config.output().orElse(OutputPaths.translated(input));
                TranslationOutcome outcome = pipeline.translate(input, output);
                LOGGER.info("Wrote {} ({} translated, {} kept original)", output,
                        outcome.translatedCount(), outcome.filledCount());
            }
            case BILINGUAL -> logWritten(pipeline.mergeBilingual(input, config.second().orElseThrow(),
                    config.output().orElse(OutputPaths.bilingual(input))));
            case RENDER -> logWritten(pipeline.render(input, config.output().orElse(OutputPaths.script(input))));
        }
    }

    private static void logWritten(Path output) {
        LOGGER.info("Wrote {}", output);
    }

    SubtitlePipeline createPipeline(Config config) {
        PromptTemplate prompt = config.promptFile()
                .map(PromptTemplate::fromFile)
                .orElseGet(PromptTemplate::loadDefault);
        TranslatorFactory factory = new TranslatorFactory(() -> createProductionTranslator(config),
                new PassThroughTranslator(), new MockTranslator());
        BatchTranslationOrchestrator orchestrator = new BatchTranslationOrchestrator(factory, prompt,
                new BilingualResultParser(), config.translationSettings());
        return new SubtitlePipeline(new OverlapRepairer(config.fps()), new LineMergeEngine(config.cjkMergeThreshold()),
                orchestrator, new AssRenderer(config.renderSettings()), config.translationMode());
    }

    private Translator createProductionTranslator(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        ChatModel chatModel = chatModelFactory.apply(config);
        return new ChatModelTranslator(chatModel, translatorConfig.provider().name(), translatorConfig.modelName());
    }

    private static ChatModel createChatModel(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        return switch (translatorConfig.provider()) {
            case OPENAI -> createOpenAiChatModel(translatorConfig, config.secrets());
            case GEMINI -> createGeminiChatModel(translatorConfig, config.secrets());
            case OLLAMA -> createOllamaChatModel(translatorConfig);
        };
    }

    private static ChatModel createOpenAiChatModel(TranslatorConfig translatorConfig, Secrets secrets) {
        String apiKey = secrets.openAiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("OPENAI_API_KEY must be provided when LLM_PROVIDER=openai"));
        try {
            LOGGER.info("Using OpenAI model '{}'{}", translatorConfig.modelName(),
                    translatorConfig.baseUrl().map(url -> " via " + url).orElse(""));
            OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(TranslatorConfig.DEFAULT_TEMPERATURE)
                    .timeout(MODEL_TIMEOUT);
            translatorConfig.baseUrl().ifPresent(builder::baseUrl);
            return builder.build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize OpenAI chat model", ex);
        }
    }

    private static ChatModel createOllamaChatModel(TranslatorConfig translatorConfig) {
        try {
            String baseUrl = translatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", translatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(translatorConfig.modelName())
                    .temperature(TranslatorConfig.DEFAULT_TEMPERATURE)
                    .timeout(MODEL_TIMEOUT)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(TranslatorConfig translatorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", translatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(TranslatorConfig.DEFAULT_TEMPERATURE)
                    .timeout(MODEL_TIMEOUT)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
