package ai.paper.translator.execute;

import ai.paper.translator.aggregate.RunMetrics;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes run progress to the application log.
 */
public class LoggingProgressReporter implements ProgressReporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingProgressReporter.class);

    @Override
    public void runStarted(int totalChunks, int workers) {
        LOGGER.info("Translating {} chunks with {} worker(s)", totalChunks, workers);
    }

    @Override
    public void chunkStateChanged(int chunkIndex, ChunkState state, int attempt) {
        if (state == ChunkState.RUNNING) {
            LOGGER.debug("Chunk {} attempt {} started", chunkIndex + 1, attempt);
        }
    }

    @Override
    public void chunkCompleted(ChunkOutcome outcome, int completedChunks, int totalChunks) {
        if (outcome.isSuccess()) {
            LOGGER.info("Chunk {} translated ({}/{} done, attempts={})",
                    outcome.chunkIndex() + 1, completedChunks, totalChunks, outcome.attempts());
        } else {
            LOGGER.warn("Chunk {} failed ({}/{} done, attempts={}): {}",
                    outcome.chunkIndex() + 1, completedChunks, totalChunks, outcome.attempts(),
                    outcome.failureMessage().orElse("unknown error"));
        }
    }

    @Override
    public void runFinished(RunMetrics metrics) {
        LOGGER.info("Translation finished: successes={}, failures={}, duration={}s",
                metrics.successes(), metrics.failures(), String.format(Locale.ROOT, "%.2f", metrics.durationSeconds()));
    }
}
