package ai.paper.translator.translate;

import java.util.Objects;

/**
 * Runtime exception used to propagate chunk translation failures, tagged with whether a retry may help.
 */
public class TranslationException extends RuntimeException {

    private final FailureKind kind;

    public TranslationException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static TranslationException transientFailure(String message, Throwable cause) {
        return new TranslationException(FailureKind.TRANSIENT, message, cause);
    }

    public static TranslationException permanentFailure(String message, Throwable cause) {
        return new TranslationException(FailureKind.PERMANENT, message, cause);
    }

    public FailureKind kind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
