package ai.paper.translator.translate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Provides translator instances based on the desired execution mode.
 *
 * <p>The production translator is created lazily so that offline modes never touch model credentials.
 */
public class TranslatorFactory {

    private final Supplier<ChunkTranslator> productionTranslator;
    private final ChunkTranslator dryRunTranslator;
    private final ChunkTranslator mockTranslator;

    public TranslatorFactory(Supplier<ChunkTranslator> productionTranslator) {
        this(productionTranslator, new PassThroughTranslator(), new MockTranslator());
    }

    public TranslatorFactory(Supplier<ChunkTranslator> productionTranslator,
                             ChunkTranslator dryRunTranslator,
                             ChunkTranslator mockTranslator) {
        this.productionTranslator = Objects.requireNonNull(productionTranslator, "productionTranslator");
        this.dryRunTranslator = Objects.requireNonNull(dryRunTranslator, "dryRunTranslator");
        this.mockTranslator = Objects.requireNonNull(mockTranslator, "mockTranslator");
    }

    public ChunkTranslator select(TranslationMode mode) {
        return switch (mode) {
            case PRODUCTION -> Objects.requireNonNull(productionTranslator.get(), "production translator");
            case DRY_RUN -> dryRunTranslator;
            case MOCK -> mockTranslator;
        };
    }
}
