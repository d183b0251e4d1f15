package ai.paper.translator.execute;

import ai.paper.translator.translate.TranslationRequest;
import java.util.Objects;

/**
 * Per-run values that accompany every chunk sent to the translator.
 */
public record PromptSettings(String glossary, String model, double temperature) {

    public PromptSettings {
        glossary = glossary == null ? "" : glossary;
        Objects.requireNonNull(model, "model");
    }

    public TranslationRequest requestFor(String chunkText) {
        return new TranslationRequest(chunkText, glossary, model, temperature);
    }
}
