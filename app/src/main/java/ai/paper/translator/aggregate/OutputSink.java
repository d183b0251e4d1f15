package ai.paper.translator.aggregate;

import java.io.IOException;

/**
 * Append-only destination for translated text.
 */
@FunctionalInterface
public interface OutputSink {

    void append(String text) throws IOException;
}
