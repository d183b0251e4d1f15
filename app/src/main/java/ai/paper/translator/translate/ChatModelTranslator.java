package ai.paper.translator.translate;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.Objects;

/**
 * Translator backed by a LangChain4j {@link ChatModel} implementation.
 */
public class ChatModelTranslator implements ChunkTranslator {

    private final ChatModel model;
    private final String providerName;
    private final PromptTemplate promptTemplate;

    public ChatModelTranslator(ChatModel model, String providerName) {
        this(model, providerName, PromptTemplate.ACADEMIC_PAPER);
    }

    public ChatModelTranslator(ChatModel model, String providerName, PromptTemplate promptTemplate) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.promptTemplate = Objects.requireNonNull(promptTemplate, "promptTemplate");
    }

    @Override
    public String translate(TranslationRequest request) {
        Objects.requireNonNull(request, "request");
        String prompt = promptTemplate.render(request.glossary(), request.chunkText());
        ChatRequest chatRequest = ChatRequest.builder()
                .messages(UserMessage.from(prompt))
                .modelName(request.model())
                .temperature(request.temperature())
                .build();

        ChatResponse response;
        try {
            response = model.chat(chatRequest);
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw TranslationException.permanentFailure(
                        "%s model '%s' is not available.".formatted(providerName, request.model()), ex);
            }
            FailureKind kind = FailureClassifier.classify(ex);
            throw new TranslationException(kind, "%s translation failed: %s".formatted(providerName, ex.getMessage()), ex);
        }

        String text = extractText(response);
        if (text == null || text.isBlank()) {
            throw TranslationException.permanentFailure("%s returned an empty response".formatted(providerName), null);
        }
        return text.strip();
    }

    private String extractText(ChatResponse response) {
        if (response == null) {
            return null;
        }
        AiMessage message = response.aiMessage();
        return message == null ? null : message.text();
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
