package ai.paper.translator.aggregate;

import java.util.Locale;

/**
 * Aggregate snapshot of one translation run.
 *
 * @param successes       chunks translated successfully
 * @param failures        chunks that ended up failed after retries or a permanent error
 * @param durationSeconds wall-clock time from executor start until the last chunk finished
 */
public record RunMetrics(int successes, int failures, double durationSeconds) {

    public RunMetrics {
        if (successes < 0 || failures < 0) {
            throw new IllegalArgumentException("counts must be zero or greater");
        }
        if (durationSeconds < 0.0) {
            throw new IllegalArgumentException("durationSeconds must be zero or greater");
        }
    }

    public static RunMetrics empty() {
        return new RunMetrics(0, 0, 0.0);
    }

    public int totalChunks() {
        return successes + failures;
    }

    public boolean hasFailures() {
        return failures > 0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "RunMetrics[successes=%d, failures=%d, duration=%.2fs]",
                successes, failures, durationSeconds);
    }
}
