package ai.paper.translator.aggregate;

import ai.paper.translator.execute.ChunkOutcome;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Collects chunk outcomes arriving in completion order and assembles them back into chunk order.
 *
 * <p>All mutators are synchronized: workers report outcomes concurrently.
 */
public class ResultAggregator {

    private final int expectedChunks;
    private final LongSupplier nanoClock;
    private final long startNanos;
    private final ChunkOutcome[] outcomes;
    private int successes;
    private int failures;
    private long lastCompletionNanos;

    public ResultAggregator(int expectedChunks) {
        this(expectedChunks, System::nanoTime);
    }

    public ResultAggregator(int expectedChunks, LongSupplier nanoClock) {
        if (expectedChunks < 0) {
            throw new IllegalArgumentException("expectedChunks must be zero or greater");
        }
        this.expectedChunks = expectedChunks;
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.startNanos = nanoClock.getAsLong();
        this.lastCompletionNanos = startNanos;
        this.outcomes = new ChunkOutcome[expectedChunks];
    }

    public synchronized int accept(ChunkOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        int index = outcome.chunkIndex();
        if (index >= expectedChunks) {
            throw new IllegalArgumentException("Unexpected chunk index " + index + " for " + expectedChunks + " chunks");
        }
        if (outcomes[index] != null) {
            throw new IllegalStateException("Outcome for chunk " + index + " already recorded");
        }
        outcomes[index] = outcome;
        if (outcome.isSuccess()) {
            successes++;
        } else {
            failures++;
        }
        lastCompletionNanos = nanoClock.getAsLong();
        return successes + failures;
    }

    public synchronized boolean isComplete() {
        return successes + failures == expectedChunks;
    }

    public synchronized RunMetrics metrics() {
        double durationSeconds = Math.max(0L, lastCompletionNanos - startNanos) / 1_000_000_000.0;
        return new RunMetrics(successes, failures, durationSeconds);
    }

    /**
     * Joins successful translations in chunk order with a blank line between them. Failed chunks leave no trace
     * in the text and do not shift the relative order of the others.
     */
    public synchronized AggregatedResult assemble() {
        if (!isComplete()) {
            throw new IllegalStateException("Cannot assemble: %d of %d chunks finished"
                    .formatted(successes + failures, expectedChunks));
        }
        List<ChunkOutcome> ordered = new ArrayList<>(expectedChunks);
        List<String> texts = new ArrayList<>(successes);
        for (ChunkOutcome outcome : outcomes) {
            ordered.add(outcome);
            outcome.translatedText().ifPresent(texts::add);
        }
        return new AggregatedResult(ordered, String.join(AggregatedResult.CHUNK_SEPARATOR, texts), metrics());
    }
}
