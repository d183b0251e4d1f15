package ai.paper.translator.translate;

import java.util.Objects;

/**
 * Everything a {@link ChunkTranslator} needs to translate one chunk.
 */
public record TranslationRequest(String chunkText, String glossary, String model, double temperature) {

    public TranslationRequest {
        Objects.requireNonNull(chunkText, "chunkText");
        glossary = glossary == null ? "" : glossary;
        Objects.requireNonNull(model, "model");
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be between 0.0 and 2.0");
        }
    }
}
