package ai.paper.translator.service;

import ai.paper.translator.aggregate.AggregatedResult;
import ai.paper.translator.aggregate.FileOutputSink;
import ai.paper.translator.aggregate.OutputSink;
import ai.paper.translator.aggregate.RunMetrics;
import ai.paper.translator.chunk.Chunk;
import ai.paper.translator.chunk.ChunkPlanner;
import ai.paper.translator.chunk.DocumentReader;
import ai.paper.translator.chunk.Line;
import ai.paper.translator.execute.PromptSettings;
import ai.paper.translator.execute.TranslationExecutor;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a document, plans its chunks, translates them and writes the assembled result.
 *
 * <p>Setup failures surface as {@link TranslationSetupException} before any chunk is sent out. Chunk failures
 * never escape: they are counted in the returned {@link RunMetrics}.
 */
public class DocumentTranslationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentTranslationService.class);

    private final DocumentReader documentReader;
    private final ChunkPlanner chunkPlanner;
    private final TranslationExecutor executor;
    private final PromptSettings promptSettings;

    public DocumentTranslationService(DocumentReader documentReader,
                                      ChunkPlanner chunkPlanner,
                                      TranslationExecutor executor,
                                      PromptSettings promptSettings) {
        this.documentReader = Objects.requireNonNull(documentReader, "documentReader");
        this.chunkPlanner = Objects.requireNonNull(chunkPlanner, "chunkPlanner");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.promptSettings = Objects.requireNonNull(promptSettings, "promptSettings");
    }

    public RunMetrics translate(Path inputFile, OutputSink sink) {
        Objects.requireNonNull(sink, "sink");
        List<Chunk> chunks = plan(inputFile);
        try {
            return translateChunks(chunks, sink);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write translated output", ex);
        }
    }

    /**
     * Plans the input first and only then truncates {@code outputFile}, so a setup failure leaves it untouched.
     */
    public RunMetrics translate(Path inputFile, Path outputFile) {
        Objects.requireNonNull(outputFile, "outputFile");
        List<Chunk> chunks = plan(inputFile);
        try (FileOutputSink sink = new FileOutputSink(outputFile)) {
            RunMetrics metrics = translateChunks(chunks, sink);
            LOGGER.info("Wrote translated output to {}", outputFile);
            return metrics;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write output file: " + outputFile, ex);
        }
    }

    public List<Chunk> plan(Path inputFile) {
        List<Line> lines = documentReader.read(inputFile);
        List<Chunk> chunks = chunkPlanner.plan(lines);
        LOGGER.info("Planned {} chunk(s) from {} tokens (max {} per chunk)",
                chunks.size(), ChunkPlanner.totalTokens(lines), chunkPlanner.maxTokenLength());
        return chunks;
    }

    private RunMetrics translateChunks(List<Chunk> chunks, OutputSink sink) throws IOException {
        AggregatedResult result = executor.execute(chunks, promptSettings);
        result.writeTo(sink);
        return result.metrics();
    }
}
