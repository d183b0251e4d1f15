package ai.paper.translator.translate;

/**
 * Remote translation capability invoked once per chunk attempt.
 *
 * <p>Implementations return the translated text or throw a {@link TranslationException} whose
 * {@link FailureKind} tells the caller whether the attempt may be retried.
 */
@FunctionalInterface
public interface ChunkTranslator {

    String translate(TranslationRequest request);
}
