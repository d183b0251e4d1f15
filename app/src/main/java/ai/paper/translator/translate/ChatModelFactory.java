package ai.paper.translator.translate;

import ai.paper.translator.config.Secrets;
import ai.paper.translator.config.TranslatorConfig;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the LangChain4j chat model for the configured provider.
 *
 * <p>Client-side retries are disabled: {@code TranslationExecutor} owns the retry policy.
 */
public final class ChatModelFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelFactory.class);
    static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);

    private ChatModelFactory() {
    }

    public static ChatModel create(TranslatorConfig config, Secrets secrets) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(secrets, "secrets");
        return switch (config.provider()) {
            case OPENAI -> createOpenAiChatModel(config, secrets);
            case GEMINI -> createGeminiChatModel(config, secrets);
            case OLLAMA -> createOllamaChatModel(config);
        };
    }

    private static ChatModel createOpenAiChatModel(TranslatorConfig config, Secrets secrets) {
        String apiKey = secrets.openAiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("OPENAI_API_KEY must be provided when LLM_PROVIDER=openai"));
        try {
            LOGGER.info("Using OpenAI model '{}'", config.modelName());
            return OpenAiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(config.modelName())
                    .temperature(config.temperature())
                    .timeout(DEFAULT_TIMEOUT)
                    .maxRetries(0)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize OpenAI chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(TranslatorConfig config, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", config.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(config.modelName())
                    .temperature(config.temperature())
                    .timeout(DEFAULT_TIMEOUT)
                    .maxRetries(0)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }

    private static ChatModel createOllamaChatModel(TranslatorConfig config) {
        String baseUrl = config.baseUrl()
                .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
        try {
            LOGGER.info("Using Ollama model '{}' via {}", config.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(config.modelName())
                    .temperature(config.temperature())
                    .timeout(DEFAULT_TIMEOUT)
                    .maxRetries(0)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }
}
