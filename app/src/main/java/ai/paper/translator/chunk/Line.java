package ai.paper.translator.chunk;

import java.util.Objects;

/**
 * Atomic unit of source text. The text keeps its original line terminator so that
 * concatenating lines reproduces the source exactly.
 */
public record Line(String text, int tokenCount) {

    public Line {
        Objects.requireNonNull(text, "text");
        if (tokenCount < 0) {
            throw new IllegalArgumentException("tokenCount must be zero or greater");
        }
    }

    public static Line of(String text, TokenCounter tokenCounter) {
        Objects.requireNonNull(tokenCounter, "tokenCounter");
        return new Line(text, tokenCounter.count(text));
    }
}
