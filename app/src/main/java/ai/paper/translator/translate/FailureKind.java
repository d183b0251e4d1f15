package ai.paper.translator.translate;

/**
 * Retryability of a failed translation attempt.
 */
public enum FailureKind {
    TRANSIENT,
    PERMANENT;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
