package ai.paper.translator.config;

import ai.paper.translator.execute.ExecutorSettings;
import ai.paper.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 */
public record Config(
        Path inputFile,
        Path outputFile,
        Optional<Path> glossaryFile,
        int maxTokenLength,
        ExecutorSettings executorSettings,
        TranslationMode translationMode,
        LogFormat logFormat,
        boolean formatOutput,
        TranslatorConfig translatorConfig,
        Secrets secrets
) {

    public Config {
        Objects.requireNonNull(inputFile, "inputFile");
        Objects.requireNonNull(outputFile, "outputFile");
        glossaryFile = glossaryFile == null ? Optional.empty() : glossaryFile;
        if (maxTokenLength < 1) {
            throw new IllegalArgumentException("maxTokenLength must be at least 1");
        }
        Objects.requireNonNull(executorSettings, "executorSettings");
        Objects.requireNonNull(translationMode, "translationMode");
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(translatorConfig, "translatorConfig");
        Objects.requireNonNull(secrets, "secrets");
    }
}
