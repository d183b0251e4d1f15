package ai.paper.translator.aggregate;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Writes translated text to a UTF-8 file. The file is truncated when the sink is opened.
 */
public class FileOutputSink implements OutputSink, Closeable {

    private final BufferedWriter writer;

    public FileOutputSink(Path target) throws IOException {
        Objects.requireNonNull(target, "target");
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    @Override
    public void append(String text) throws IOException {
        writer.write(text);
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
