package ai.paper.translator.config;

import ai.paper.translator.cli.CliArguments;
import ai.paper.translator.execute.ExecutorSettings;
import ai.paper.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 * CLI values win over environment values, which win over defaults.
 */
public class ConfigLoader {

    static final String ENV_INPUT_FILE = "INPUT_FILE";
    static final String ENV_OUTPUT_FILE = "OUTPUT_FILE";
    static final String ENV_GLOSSARY_FILE = "GLOSSARY_FILE";
    static final String ENV_MAX_TOKEN_LENGTH = "MAX_TOKEN_LENGTH";
    static final String ENV_MAX_WORKERS = "TRANSLATION_MAX_WORKERS";
    static final String ENV_MAX_RETRIES = "TRANSLATION_MAX_RETRIES";
    static final String ENV_RETRY_BACKOFF_SECONDS = "TRANSLATION_RETRY_BACKOFF_SECONDS";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_TEMPERATURE = "TEMPERATURE";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";

    static final String DEFAULT_OUTPUT_FILE = "translated.txt";
    static final int DEFAULT_MAX_TOKEN_LENGTH = 20_000;
    static final double DEFAULT_TEMPERATURE = 0.3;
    static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        Path inputFile = resolvePath(arguments.inputFile(), ENV_INPUT_FILE)
                .orElseThrow(() -> new IllegalArgumentException("input file must be provided via --input or " + ENV_INPUT_FILE));
        Path outputFile = resolvePath(arguments.outputFile(), ENV_OUTPUT_FILE)
                .orElse(Path.of(DEFAULT_OUTPUT_FILE));
        Optional<Path> glossaryFile = resolvePath(arguments.glossaryFile(), ENV_GLOSSARY_FILE);

        int maxTokenLength = resolveInteger(arguments.maxTokenLength(), ENV_MAX_TOKEN_LENGTH, DEFAULT_MAX_TOKEN_LENGTH);
        if (maxTokenLength < 1) {
            throw new IllegalArgumentException(ENV_MAX_TOKEN_LENGTH + " must be at least 1");
        }
        ExecutorSettings executorSettings = resolveExecutorSettings(arguments);

        TranslationMode translationMode = resolveTranslationMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        LlmProvider provider = environmentReader.find(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OPENAI);
        String modelName = firstNonBlank(arguments.model(), ENV_LLM_MODEL, provider.defaultModel());
        double temperature = resolveDouble(arguments.temperature(), ENV_TEMPERATURE, DEFAULT_TEMPERATURE);
        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(environmentReader.find(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL));
        }
        TranslatorConfig translatorConfig = new TranslatorConfig(provider, modelName, temperature, baseUrl);

        Secrets secrets = new Secrets(environmentReader.find(ENV_OPENAI_API_KEY), environmentReader.find(ENV_GEMINI_API_KEY));
        if (translationMode.requiresModel() && provider == LlmProvider.OPENAI && secrets.openAiApiKey().isEmpty()) {
            throw new IllegalStateException(ENV_OPENAI_API_KEY + " must be provided for production translation with OpenAI");
        }

        return new Config(inputFile, outputFile, glossaryFile, maxTokenLength, executorSettings, translationMode,
                logFormat, !arguments.noFormat(), translatorConfig, secrets);
    }

    private ExecutorSettings resolveExecutorSettings(CliArguments arguments) {
        int maxWorkers = resolveInteger(arguments.maxWorkers(), ENV_MAX_WORKERS, ExecutorSettings.DEFAULT_MAX_WORKERS);
        int maxRetries = resolveInteger(arguments.maxRetries(), ENV_MAX_RETRIES, ExecutorSettings.DEFAULT_MAX_RETRIES);
        if (maxRetries < 0) {
            throw new IllegalArgumentException(ENV_MAX_RETRIES + " must be zero or greater");
        }
        double backoffSeconds = resolveDouble(arguments.retryBackoffSeconds(), ENV_RETRY_BACKOFF_SECONDS, 0.0);
        if (backoffSeconds < 0.0) {
            throw new IllegalArgumentException(ENV_RETRY_BACKOFF_SECONDS + " must be zero or greater");
        }
        Duration backoff = Duration.ofMillis(Math.round(backoffSeconds * 1000.0));
        return new ExecutorSettings(maxWorkers, maxRetries, backoff);
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.find(ENV_TRANSLATION_MODE)
                .map(TranslationMode::from)
                .orElse(TranslationMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.find(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Optional<Path> resolvePath(Path cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.find(envKey).map(Path::of);
    }

    private int resolveInteger(Integer cliValue, String envKey, int defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.find(envKey)
                .map(raw -> parseInteger(raw, envKey))
                .orElse(defaultValue);
    }

    private double resolveDouble(Double cliValue, String envKey, double defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.find(envKey)
                .map(raw -> parseDouble(raw, envKey))
                .orElse(defaultValue);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (cliValue != null && !cliValue.isBlank()) {
            return cliValue.trim();
        }
        return environmentReader.find(envKey).orElse(defaultValue);
    }

    private static int parseInteger(String raw, String name) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer but was '" + raw + "'", ex);
        }
    }

    private static double parseDouble(String raw, String name) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be a number but was '" + raw + "'", ex);
        }
    }
}
