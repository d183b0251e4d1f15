package ai.paper.translator.cli;

import ai.paper.translator.aggregate.OutputFormatter;
import ai.paper.translator.aggregate.RunMetrics;
import ai.paper.translator.chunk.ChunkPlanner;
import ai.paper.translator.chunk.DocumentReader;
import ai.paper.translator.chunk.OpenAiTokenCounter;
import ai.paper.translator.chunk.TokenCounter;
import ai.paper.translator.config.Config;
import ai.paper.translator.config.ConfigLoader;
import ai.paper.translator.config.SystemEnvironmentReader;
import ai.paper.translator.config.TranslatorConfig;
import ai.paper.translator.execute.PromptSettings;
import ai.paper.translator.execute.TranslationExecutor;
import ai.paper.translator.logging.LoggingConfigurator;
import ai.paper.translator.service.DocumentTranslationService;
import ai.paper.translator.service.TranslationSetupException;
import ai.paper.translator.translate.ChatModelFactory;
import ai.paper.translator.translate.ChatModelTranslator;
import ai.paper.translator.translate.ChunkTranslator;
import ai.paper.translator.translate.Glossary;
import ai.paper.translator.translate.GlossaryLoader;
import ai.paper.translator.translate.TranslatorFactory;
import dev.langchain4j.model.chat.ChatModel;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and translation pipeline.
 *
 * <p>Exit codes: {@code 0} when every chunk was translated, {@code 2} when some chunks failed, {@code 1} on
 * configuration or setup errors.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_CHUNK_FAILURES = 2;

    private final ConfigLoader configLoader;
    private final Function<Config, ChatModel> chatModelFactory;
    private final TokenCounter tokenCounter;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()),
                config -> ChatModelFactory.create(config.translatorConfig(), config.secrets()),
                new OpenAiTokenCounter());
    }

    CliApplication(ConfigLoader configLoader, Function<Config, ChatModel> chatModelFactory, TokenCounter tokenCounter) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.chatModelFactory = Objects.requireNonNull(chatModelFactory, "chatModelFactory");
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter");
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

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println("Configuration error: " + ex.getMessage());
            return EXIT_ERROR;
        }

        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Translating {} -> {} (mode={}, provider={}, model={}, workers={})",
                config.inputFile(), config.outputFile(), config.translationMode(),
                config.translatorConfig().provider(), config.translatorConfig().modelName(),
                config.executorSettings().maxWorkers());

        try {
            RunMetrics metrics = createService(config).translate(config.inputFile(), config.outputFile());
            if (config.formatOutput()) {
                new OutputFormatter().format(config.outputFile());
            }
            if (metrics.hasFailures()) {
                LOGGER.warn("{} of {} chunks failed and were left out of {}",
                        metrics.failures(), metrics.totalChunks(), config.outputFile());
                return EXIT_CHUNK_FAILURES;
            }
            return EXIT_OK;
        } catch (TranslationSetupException ex) {
            LOGGER.error("Translation setup failed: {}", ex.getMessage());
            return EXIT_ERROR;
        } catch (RuntimeException ex) {
            LOGGER.error("Translation run aborted", ex);
            return EXIT_ERROR;
        }
    }

    private DocumentTranslationService createService(Config config) {
        Glossary glossary = new GlossaryLoader().load(config.glossaryFile());
        TranslatorConfig translatorConfig = config.translatorConfig();
        ChunkTranslator translator = new TranslatorFactory(() -> createProductionTranslator(config))
                .select(config.translationMode());
        PromptSettings promptSettings = new PromptSettings(glossary.render(), translatorConfig.modelName(),
                translatorConfig.temperature());
        return new DocumentTranslationService(
                new DocumentReader(tokenCounter),
                new ChunkPlanner(config.maxTokenLength()),
                new TranslationExecutor(translator, config.executorSettings()),
                promptSettings);
    }

    private ChunkTranslator createProductionTranslator(Config config) {
        ChatModel chatModel = chatModelFactory.apply(config);
        return new ChatModelTranslator(chatModel, config.translatorConfig().provider().name());
    }
}
