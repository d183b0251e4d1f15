package ai.paper.translator.aggregate;

import ai.paper.translator.execute.ChunkOutcome;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Outcomes of a finished run in chunk order, together with the assembled text and metrics.
 */
public record AggregatedResult(List<ChunkOutcome> outcomes, String assembledText, RunMetrics metrics) {

    public static final String CHUNK_SEPARATOR = "\n\n";

    public AggregatedResult {
        outcomes = List.copyOf(Objects.requireNonNull(outcomes, "outcomes"));
        Objects.requireNonNull(assembledText, "assembledText");
        Objects.requireNonNull(metrics, "metrics");
    }

    public static AggregatedResult empty() {
        return new AggregatedResult(List.of(), "", RunMetrics.empty());
    }

    /**
     * Appends every successful chunk, each followed by a blank line, in chunk order. Failed chunks are skipped.
     */
    public void writeTo(OutputSink sink) throws IOException {
        Objects.requireNonNull(sink, "sink");
        for (ChunkOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                sink.append(outcome.translatedText().orElseThrow());
                sink.append(CHUNK_SEPARATOR);
            }
        }
    }
}
