package ai.paper.translator.execute;

import ai.paper.translator.aggregate.RunMetrics;

/**
 * Receives progress notifications from a translation run. Callbacks may arrive from worker threads
 * concurrently, so implementations must be thread-safe.
 */
public interface ProgressReporter {

    default void runStarted(int totalChunks, int workers) {
    }

    default void chunkStateChanged(int chunkIndex, ChunkState state, int attempt) {
    }

    default void chunkCompleted(ChunkOutcome outcome, int completedChunks, int totalChunks) {
    }

    default void runFinished(RunMetrics metrics) {
    }

    /**
     * Reporter that ignores every notification.
     */
    static ProgressReporter silent() {
        return Silent.INSTANCE;
    }

    final class Silent implements ProgressReporter {
        private static final Silent INSTANCE = new Silent();

        private Silent() {
        }
    }
}
