package ai.paper.translator.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.paper.translator.cli.CliArguments;
import ai.paper.translator.execute.ExecutorSettings;
import ai.paper.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "paper.txt",
                "--output", "out/ko.txt",
                "--glossary", "terms.json",
                "--max-token-length", "8000",
                "--max-workers", "5",
                "--max-retries", "4",
                "--retry-backoff", "1.5",
                "--model", "gpt-4o-mini",
                "--temperature", "0.7",
                "--translation-mode", "mock",
                "--log-format", "json",
                "--no-format");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.inputFile()).isEqualTo(Path.of("paper.txt"));
        assertThat(config.outputFile()).isEqualTo(Path.of("out/ko.txt"));
        assertThat(config.glossaryFile()).contains(Path.of("terms.json"));
        assertThat(config.maxTokenLength()).isEqualTo(8000);
        assertThat(config.executorSettings().maxWorkers()).isEqualTo(5);
        assertThat(config.executorSettings().maxRetries()).isEqualTo(4);
        assertThat(config.executorSettings().retryBackoff()).isEqualTo(Duration.ofMillis(1500));
        assertThat(config.translatorConfig().provider()).isEqualTo(LlmProvider.OPENAI);
        assertThat(config.translatorConfig().modelName()).isEqualTo("gpt-4o-mini");
        assertThat(config.translatorConfig().temperature()).isEqualTo(0.7);
        assertThat(config.translationMode()).isEqualTo(TranslationMode.MOCK);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.formatOutput()).isFalse();
    }

    @Test
    void appliesDefaultsWhenOnlyInputIsGiven() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--input", "paper.txt");

        Config config = new ConfigLoader(env(Map.of(ConfigLoader.ENV_OPENAI_API_KEY, "sk-test"))).load(cliArguments);

        assertThat(config.outputFile()).isEqualTo(Path.of("translated.txt"));
        assertThat(config.glossaryFile()).isEmpty();
        assertThat(config.maxTokenLength()).isEqualTo(20_000);
        assertThat(config.executorSettings()).isEqualTo(ExecutorSettings.defaults());
        assertThat(config.translatorConfig().modelName()).isEqualTo("gpt-4o");
        assertThat(config.translatorConfig().temperature()).isEqualTo(0.3);
        assertThat(config.translationMode()).isEqualTo(TranslationMode.PRODUCTION);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.formatOutput()).isTrue();
        assertThat(config.secrets().openAiApiKey()).contains("sk-test");
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_INPUT_FILE, "env-paper.txt");
        envValues.put(ConfigLoader.ENV_OUTPUT_FILE, "env-out.txt");
        envValues.put(ConfigLoader.ENV_GLOSSARY_FILE, "env-glossary.json");
        envValues.put(ConfigLoader.ENV_MAX_TOKEN_LENGTH, "12000");
        envValues.put(ConfigLoader.ENV_MAX_WORKERS, "42");
        envValues.put(ConfigLoader.ENV_MAX_RETRIES, "0");
        envValues.put(ConfigLoader.ENV_RETRY_BACKOFF_SECONDS, "2");
        envValues.put(ConfigLoader.ENV_LLM_PROVIDER, "ollama");
        envValues.put(ConfigLoader.ENV_OLLAMA_BASE_URL, "http://ollama:11434");
        envValues.put(ConfigLoader.ENV_TRANSLATION_MODE, "dry-run");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Config config = new ConfigLoader(env(envValues)).load(cliArguments);

        assertThat(config.inputFile()).isEqualTo(Path.of("env-paper.txt"));
        assertThat(config.outputFile()).isEqualTo(Path.of("env-out.txt"));
        assertThat(config.glossaryFile()).contains(Path.of("env-glossary.json"));
        assertThat(config.maxTokenLength()).isEqualTo(12_000);
        assertThat(config.executorSettings().maxWorkers()).isEqualTo(10);
        assertThat(config.executorSettings().maxRetries()).isZero();
        assertThat(config.executorSettings().retryBackoff()).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.translatorConfig().provider()).isEqualTo(LlmProvider.OLLAMA);
        assertThat(config.translatorConfig().modelName()).isEqualTo("llama3.1");
        assertThat(config.translatorConfig().baseUrl()).contains("http://ollama:11434");
        assertThat(config.translationMode()).isEqualTo(TranslationMode.DRY_RUN);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void cliValuesOverrideEnvironment() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "cli.txt", "--max-workers", "2", "--translation-mode", "mock");
        Map<String, String> envValues = Map.of(
                ConfigLoader.ENV_INPUT_FILE, "env.txt",
                ConfigLoader.ENV_MAX_WORKERS, "8",
                ConfigLoader.ENV_TRANSLATION_MODE, "production");

        Config config = new ConfigLoader(env(envValues)).load(cliArguments);

        assertThat(config.inputFile()).isEqualTo(Path.of("cli.txt"));
        assertThat(config.executorSettings().maxWorkers()).isEqualTo(2);
        assertThat(config.translationMode()).isEqualTo(TranslationMode.MOCK);
    }

    @Test
    void requiresInputFile() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        assertThatThrownBy(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("INPUT_FILE");
    }

    @Test
    void requiresOpenAiKeyOnlyForProductionRuns() {
        CliArguments production = CommandLine.populateCommand(new CliArguments(), "--input", "paper.txt");
        CliArguments mock = CommandLine.populateCommand(new CliArguments(),
                "--input", "paper.txt", "--translation-mode", "mock");
        ConfigLoader loader = new ConfigLoader(key -> Optional.empty());

        assertThatThrownBy(() -> loader.load(production))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OPENAI_API_KEY");
        assertThat(loader.load(mock).secrets().openAiApiKey()).isEmpty();
    }

    @Test
    void rejectsInvalidNumbersNamingTheVariable() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "paper.txt", "--translation-mode", "mock");

        assertThatThrownBy(() -> new ConfigLoader(env(Map.of(ConfigLoader.ENV_MAX_WORKERS, "many"))).load(cliArguments))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("TRANSLATION_MAX_WORKERS");
        assertThatThrownBy(() -> new ConfigLoader(env(Map.of(ConfigLoader.ENV_MAX_TOKEN_LENGTH, "0"))).load(cliArguments))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("MAX_TOKEN_LENGTH");
        assertThatThrownBy(() -> new ConfigLoader(env(Map.of(ConfigLoader.ENV_RETRY_BACKOFF_SECONDS, "-1"))).load(cliArguments))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("TRANSLATION_RETRY_BACKOFF_SECONDS");
    }

    @Test
    void rejectsUnknownProvider() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--input", "paper.txt");

        assertThatThrownBy(() -> new ConfigLoader(env(Map.of(ConfigLoader.ENV_LLM_PROVIDER, "anthropic"))).load(cliArguments))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported LLM provider: anthropic");
    }

    @Test
    void secretsAreMaskedInToString() {
        Secrets secrets = new Secrets(Optional.of("sk-very-secret"), Optional.empty());

        assertThat(secrets.toString()).doesNotContain("sk-very-secret").contains("****");
    }

    private static EnvironmentReader env(Map<String, String> values) {
        return key -> Optional.ofNullable(values.get(key));
    }
}
