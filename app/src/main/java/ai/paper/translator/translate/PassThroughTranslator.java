package ai.paper.translator.translate;

/**
 * Translator used for dry-run scenarios that preserves the original text without invoking remote APIs.
 */
public class PassThroughTranslator implements ChunkTranslator {

    @Override
    public String translate(TranslationRequest request) {
        return request.chunkText().stripTrailing();
    }
}
