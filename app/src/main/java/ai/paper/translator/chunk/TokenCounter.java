package ai.paper.translator.chunk;

/**
 * Counts model tokens in a piece of text. Implementations must be safe for concurrent use.
 */
@FunctionalInterface
public interface TokenCounter {

    int count(String text);
}
