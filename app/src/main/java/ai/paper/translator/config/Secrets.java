package ai.paper.translator.config;

import java.util.Optional;

/**
 * Holds API keys for the model providers. {@link #toString()} never prints the values.
 */
public record Secrets(Optional<String> openAiApiKey, Optional<String> geminiApiKey) {

    public Secrets {
        openAiApiKey = openAiApiKey == null ? Optional.empty() : openAiApiKey;
        geminiApiKey = geminiApiKey == null ? Optional.empty() : geminiApiKey;
    }

    public static Secrets none() {
        return new Secrets(Optional.empty(), Optional.empty());
    }

    public Optional<String> apiKeyFor(LlmProvider provider) {
        return switch (provider) {
            case OPENAI -> openAiApiKey;
            case GEMINI -> geminiApiKey;
            case OLLAMA -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return "Secrets[openAiApiKey=" + mask(openAiApiKey) + ", geminiApiKey=" + mask(geminiApiKey) + "]";
    }

    private static String mask(Optional<String> value) {
        return value.isPresent() ? "****" : "<unset>";
    }
}
