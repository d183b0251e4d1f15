package ai.paper.translator.cli;

import ai.paper.translator.config.LogFormat;
import ai.paper.translator.translate.TranslationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "paper-translator", mixinStandardHelpOptions = true,
        description = "Translates long documents chunk by chunk with an LLM")
public class CliArguments {

    @CommandLine.Option(names = {"-i", "--input"}, description = "Document to translate", paramLabel = "FILE")
    private Path inputFile;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Where the translation is written (default: translated.txt)", paramLabel = "FILE")
    private Path outputFile;

    @CommandLine.Option(names = "--glossary", description = "JSON glossary of {term, translation} entries", paramLabel = "FILE")
    private Path glossaryFile;

    @CommandLine.Option(names = "--max-token-length", description = "Maximum tokens per chunk (default: 20000)", paramLabel = "TOKENS")
    private Integer maxTokenLength;

    @CommandLine.Option(names = "--max-workers", description = "Chunks translated concurrently, 1-10 (default: 3)", paramLabel = "COUNT")
    private Integer maxWorkers;

    @CommandLine.Option(names = "--max-retries", description = "Retries per chunk after a transient failure (default: 2)", paramLabel = "COUNT")
    private Integer maxRetries;

    @CommandLine.Option(names = "--retry-backoff", description = "Seconds to wait between retries (default: 0)", paramLabel = "SECONDS")
    private Double retryBackoffSeconds;

    @CommandLine.Option(names = "--model", description = "Model name passed to the provider", paramLabel = "NAME")
    private String model;

    @CommandLine.Option(names = "--temperature", description = "Sampling temperature (default: 0.3)", paramLabel = "VALUE")
    private Double temperature;

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production, dry-run, or mock", converter = TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--no-format", description = "Skip indenting the translated output")
    private boolean noFormat;

    public Path inputFile() {
        return inputFile;
    }

    public Path outputFile() {
        return outputFile;
    }

    public Path glossaryFile() {
        return glossaryFile;
    }

    public Integer maxTokenLength() {
        return maxTokenLength;
    }

    public Integer maxWorkers() {
        return maxWorkers;
    }

    public Integer maxRetries() {
        return maxRetries;
    }

    public Double retryBackoffSeconds() {
        return retryBackoffSeconds;
    }

    public String model() {
        return model;
    }

    public Double temperature() {
        return temperature;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean noFormat() {
        return noFormat;
    }
}
