package ai.paper.translator.chunk;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Distributes lines into chunks of balanced size rather than packing each chunk greedily up to the limit.
 *
 * <p>The planner first sums all token counts. Input that fits into {@code maxTokenLength} becomes a single
 * chunk. Otherwise the number of chunks is {@code ceil(total / max)} and every chunk aims for
 * {@code total / numChunks} tokens; a chunk is closed at the first line boundary where it reaches that target.
 * A line larger than the limit always stands alone, and a small trailing chunk is folded into its predecessor
 * when the result still fits.
 */
public class ChunkPlanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkPlanner.class);

    static final double TAIL_MERGE_RATIO = 0.7;

    private final int maxTokenLength;

    public ChunkPlanner(int maxTokenLength) {
        if (maxTokenLength < 1) {
            throw new IllegalArgumentException("maxTokenLength must be at least 1");
        }
        this.maxTokenLength = maxTokenLength;
    }

    public int maxTokenLength() {
        return maxTokenLength;
    }

    public List<Chunk> plan(List<Line> lines) {
        Objects.requireNonNull(lines, "lines");
        if (lines.isEmpty()) {
            return List.of();
        }

        long totalTokens = totalTokens(lines);
        if (totalTokens <= maxTokenLength) {
            LOGGER.debug("Input of {} tokens fits into a single chunk (limit {})", totalTokens, maxTokenLength);
            return List.of(new Chunk(0, lines));
        }

        long numChunks = (totalTokens + maxTokenLength - 1) / maxTokenLength;
        double targetChunkSize = (double) totalTokens / numChunks;
        LOGGER.debug("Planning {} tokens into ~{} chunks of ~{} tokens (limit {})",
                totalTokens, numChunks, Math.round(targetChunkSize), maxTokenLength);

        List<List<Line>> groups = distribute(lines, targetChunkSize);
        mergeSmallTail(groups, targetChunkSize);

        List<Chunk> chunks = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            chunks.add(new Chunk(i, groups.get(i)));
        }
        return List.copyOf(chunks);
    }

    private List<List<Line>> distribute(List<Line> lines, double targetChunkSize) {
        List<List<Line>> groups = new ArrayList<>();
        List<Line> current = new ArrayList<>();
        long currentTokens = 0;

        for (Line line : lines) {
            if (line.tokenCount() > maxTokenLength) {
                if (!current.isEmpty()) {
                    groups.add(current);
                    current = new ArrayList<>();
                    currentTokens = 0;
                }
                LOGGER.warn("Line of {} tokens exceeds the chunk limit of {}; translating it on its own",
                        line.tokenCount(), maxTokenLength);
                groups.add(List.of(line));
                continue;
            }
            if (!current.isEmpty() && currentTokens + line.tokenCount() > maxTokenLength) {
                groups.add(current);
                current = new ArrayList<>();
                currentTokens = 0;
            }
            current.add(line);
            currentTokens += line.tokenCount();
            if (currentTokens >= targetChunkSize) {
                groups.add(current);
                current = new ArrayList<>();
                currentTokens = 0;
            }
        }
        if (!current.isEmpty()) {
            groups.add(current);
        }
        return groups;
    }

    private void mergeSmallTail(List<List<Line>> groups, double targetChunkSize) {
        if (groups.size() < 2) {
            return;
        }
        int lastIndex = groups.size() - 1;
        List<Line> last = groups.get(lastIndex);
        long lastTokens = totalTokens(last);
        if (lastTokens >= TAIL_MERGE_RATIO * targetChunkSize) {
            return;
        }
        List<Line> previous = groups.get(lastIndex - 1);
        long mergedTokens = totalTokens(previous) + lastTokens;
        if (mergedTokens > maxTokenLength) {
            LOGGER.debug("Keeping trailing chunk of {} tokens; merging would exceed the limit", lastTokens);
            return;
        }
        List<Line> merged = new ArrayList<>(previous.size() + last.size());
        merged.addAll(previous);
        merged.addAll(last);
        groups.set(lastIndex - 1, merged);
        groups.remove(lastIndex);
    }

    public static long totalTokens(List<Line> lines) {
        long total = 0;
        for (Line line : lines) {
            total += line.tokenCount();
        }
        return total;
    }
}
