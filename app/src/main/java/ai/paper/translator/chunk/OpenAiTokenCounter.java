package ai.paper.translator.chunk;

import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;
import java.util.Objects;

/**
 * Token counter backed by the OpenAI tokenizer shipped with LangChain4j.
 */
public class OpenAiTokenCounter implements TokenCounter {

    // gpt-4 resolves to the cl100k_base encoding
    public static final String DEFAULT_ENCODING_MODEL = "gpt-4";

    private final OpenAiTokenCountEstimator estimator;

    public OpenAiTokenCounter() {
        this(DEFAULT_ENCODING_MODEL);
    }

    public OpenAiTokenCounter(String modelName) {
        Objects.requireNonNull(modelName, "modelName");
        this.estimator = new OpenAiTokenCountEstimator(modelName);
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return estimator.estimateTokenCountInText(text);
    }
}
