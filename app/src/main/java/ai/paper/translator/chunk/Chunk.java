package ai.paper.translator.chunk;

import java.util.List;
import java.util.Objects;

/**
 * Contiguous run of source lines translated as one unit.
 */
public record Chunk(int index, List<Line> lines) {

    public Chunk {
        if (index < 0) {
            throw new IllegalArgumentException("index must be zero or greater");
        }
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("chunk must contain at least one line");
        }
    }

    public long tokenCount() {
        long total = 0;
        for (Line line : lines) {
            total += line.tokenCount();
        }
        return total;
    }

    public String text() {
        StringBuilder builder = new StringBuilder();
        for (Line line : lines) {
            builder.append(line.text());
        }
        return builder.toString();
    }

    public int lineCount() {
        return lines.size();
    }

    public boolean isSingleLine() {
        return lines.size() == 1;
    }
}
