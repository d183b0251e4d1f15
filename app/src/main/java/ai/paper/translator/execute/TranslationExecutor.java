package ai.paper.translator.execute;

import ai.paper.translator.aggregate.AggregatedResult;
import ai.paper.translator.aggregate.ResultAggregator;
import ai.paper.translator.chunk.Chunk;
import ai.paper.translator.translate.ChunkTranslator;
import ai.paper.translator.translate.FailureClassifier;
import ai.paper.translator.translate.FailureKind;
import ai.paper.translator.translate.TranslationRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Translates planned chunks on a bounded worker pool and drives each of them to a terminal outcome.
 *
 * <p>Chunks are submitted in index order to a fixed pool of {@code maxWorkers} threads, so a single worker
 * processes them strictly one after another. Transient failures are retried after the configured backoff;
 * permanent failures and exhausted retries mark the chunk failed without stopping the run.
 */
public class TranslationExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationExecutor.class);
    static final String MDC_CHUNK_KEY = "chunk";
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final ChunkTranslator translator;
    private final ExecutorSettings settings;
    private final ProgressReporter reporter;
    private final Sleeper sleeper;

    public TranslationExecutor(ChunkTranslator translator, ExecutorSettings settings) {
        this(translator, settings, new LoggingProgressReporter());
    }

    public TranslationExecutor(ChunkTranslator translator, ExecutorSettings settings, ProgressReporter reporter) {
        this(translator, settings, reporter, duration -> Thread.sleep(duration.toMillis()));
    }

    TranslationExecutor(ChunkTranslator translator,
                        ExecutorSettings settings,
                        ProgressReporter reporter,
                        Sleeper sleeper) {
        this.translator = Objects.requireNonNull(translator, "translator");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public AggregatedResult execute(List<Chunk> chunks, PromptSettings prompt) {
        Objects.requireNonNull(chunks, "chunks");
        Objects.requireNonNull(prompt, "prompt");
        if (chunks.isEmpty()) {
            LOGGER.info("No chunks to translate");
            AggregatedResult empty = AggregatedResult.empty();
            reporter.runFinished(empty.metrics());
            return empty;
        }

        int total = chunks.size();
        int workers = Math.min(settings.maxWorkers(), total);
        ChunkStateTracker tracker = new ChunkStateTracker(total);
        ResultAggregator aggregator = new ResultAggregator(total);
        reporter.runStarted(total, workers);

        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>(total);
            for (Chunk chunk : chunks) {
                AtomicInteger attempts = new AtomicInteger();
                futures.add(CompletableFuture
                        .supplyAsync(() -> translateChunk(chunk, prompt, tracker, attempts), pool)
                        .handle((outcome, error) -> error == null
                                ? outcome
                                : abandon(chunk.index(), tracker, attempts.get(), error))
                        .thenAccept(outcome -> record(outcome, aggregator, total)));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            shutdown(pool);
        }

        AggregatedResult result = aggregator.assemble();
        if (!tracker.allTerminal()) {
            throw new IllegalStateException("Run finished with non-terminal chunks: " + tracker.countsByState());
        }
        reporter.runFinished(result.metrics());
        return result;
    }

    private void record(ChunkOutcome outcome, ResultAggregator aggregator, int total) {
        int completed = aggregator.accept(outcome);
        try {
            reporter.chunkCompleted(outcome, completed, total);
        } catch (RuntimeException ex) {
            LOGGER.warn("Progress reporter failed after chunk {} completed: {}", outcome.chunkIndex() + 1, ex.toString());
        }
    }

    private ChunkOutcome translateChunk(Chunk chunk,
                                        PromptSettings prompt,
                                        ChunkStateTracker tracker,
                                        AtomicInteger attempts) {
        int index = chunk.index();
        MDC.put(MDC_CHUNK_KEY, String.valueOf(index + 1));
        try {
            TranslationRequest request = prompt.requestFor(chunk.text());
            while (true) {
                int attempt = attempts.incrementAndGet();
                moveTo(tracker, index, ChunkState.RUNNING, attempt);
                String translated;
                try {
                    translated = translator.translate(request);
                    if (translated == null) {
                        throw new IllegalStateException("Translator returned no text");
                    }
                } catch (RuntimeException ex) {
                    FailureKind kind = FailureClassifier.classify(ex);
                    if (!kind.isRetryable() || attempt >= settings.maxAttempts()) {
                        return fail(tracker, index, attempt, kind, ex);
                    }
                    LOGGER.warn("Chunk {} attempt {}/{} failed transiently, retrying: {}",
                            index + 1, attempt, settings.maxAttempts(), ex.getMessage());
                    moveTo(tracker, index, ChunkState.RETRYING, attempt);
                    if (!backOff()) {
                        return fail(tracker, index, attempt, kind,
                                new IllegalStateException("Interrupted while waiting to retry", ex));
                    }
                    continue;
                }
                moveTo(tracker, index, ChunkState.SUCCESS, attempt);
                LOGGER.debug("Chunk {} translated on attempt {}", index + 1, attempt);
                return ChunkOutcome.success(index, translated, attempt);
            }
        } finally {
            MDC.remove(MDC_CHUNK_KEY);
        }
    }

    /**
     * Turns an abnormal completion of a chunk's task (an {@link Error} or a failure outside the translator call)
     * into a failed outcome so the remaining chunks still finish.
     */
    private ChunkOutcome abandon(int index, ChunkStateTracker tracker, int attempts, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        ChunkState state = tracker.stateOf(index);
        if (state == ChunkState.PENDING) {
            moveTo(tracker, index, ChunkState.RUNNING, attempts);
        }
        if (!state.isTerminal()) {
            moveTo(tracker, index, ChunkState.FAILED, attempts);
        }
        String reason = cause.getMessage() == null
                ? cause.getClass().getSimpleName()
                : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        LOGGER.error("Chunk {} aborted on attempt {}: {}", index + 1, attempts, reason, cause);
        return ChunkOutcome.failed(index, attempts, reason);
    }

    private ChunkOutcome fail(ChunkStateTracker tracker, int index, int attempt, FailureKind kind, Exception cause) {
        moveTo(tracker, index, ChunkState.FAILED, attempt);
        String reason = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        if (kind.isRetryable()) {
            LOGGER.error("Chunk {} failed after {} attempts: {}", index + 1, attempt, reason);
        } else {
            LOGGER.error("Chunk {} failed permanently on attempt {}: {}", index + 1, attempt, reason);
        }
        LOGGER.debug("Chunk {} failure detail", index + 1, cause);
        return ChunkOutcome.failed(index, attempt, reason);
    }

    private void moveTo(ChunkStateTracker tracker, int index, ChunkState state, int attempt) {
        tracker.transition(index, state);
        try {
            reporter.chunkStateChanged(index, state, attempt);
        } catch (RuntimeException ex) {
            LOGGER.warn("Progress reporter failed on chunk {} entering {}: {}", index + 1, state, ex.toString());
        }
    }

    private boolean backOff() {
        Duration backoff = settings.retryBackoff();
        if (backoff.isZero()) {
            return true;
        }
        try {
            sleeper.sleep(backoff);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warn("Worker pool did not terminate in time, forcing shutdown");
                pool.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    /**
     * Pause between two attempts of the same chunk.
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "translation-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
