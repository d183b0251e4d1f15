package ai.paper.translator.execute;

import java.time.Duration;
import java.util.Objects;

/**
 * Concurrency and retry knobs for {@link TranslationExecutor}.
 *
 * @param maxWorkers   number of chunks translated at the same time, clamped to [1, 10]
 * @param maxRetries   additional attempts granted to a chunk after a transient failure
 * @param retryBackoff fixed pause between two attempts of the same chunk
 */
public record ExecutorSettings(int maxWorkers, int maxRetries, Duration retryBackoff) {

    public static final int MIN_WORKERS = 1;
    public static final int MAX_WORKERS = 10;
    public static final int DEFAULT_MAX_WORKERS = 3;
    public static final int DEFAULT_MAX_RETRIES = 2;

    public ExecutorSettings {
        maxWorkers = clampWorkers(maxWorkers);
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be zero or greater");
        }
        retryBackoff = Objects.requireNonNull(retryBackoff, "retryBackoff");
        if (retryBackoff.isNegative()) {
            throw new IllegalArgumentException("retryBackoff must not be negative");
        }
    }

    public static ExecutorSettings defaults() {
        return new ExecutorSettings(DEFAULT_MAX_WORKERS, DEFAULT_MAX_RETRIES, Duration.ZERO);
    }

    public static ExecutorSettings sequential() {
        return new ExecutorSettings(1, DEFAULT_MAX_RETRIES, Duration.ZERO);
    }

    public static int clampWorkers(int requested) {
        return Math.max(MIN_WORKERS, Math.min(MAX_WORKERS, requested));
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
