package ai.paper.translator.aggregate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Indents every non-blank line of the translated output by two spaces.
 */
public class OutputFormatter {

    private static final Logger LOGGER = LoggerFactory.getLogger(OutputFormatter.class);
    static final String INDENT = "  ";
    private static final String LINE_SEPARATOR = "\n";

    public void format(Path outputFile) {
        try {
            List<String> lines = Files.readAllLines(outputFile, StandardCharsets.UTF_8);
            Files.writeString(outputFile, joinLines(indent(lines)), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to format output file: " + outputFile, ex);
        }
        LOGGER.info("Output formatting completed for {}", outputFile);
    }

    public List<String> indent(List<String> lines) {
        List<String> formatted = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line.isBlank() || line.startsWith(INDENT)) {
                formatted.add(line);
            } else {
                formatted.add(INDENT + line);
            }
        }
        return formatted;
    }

    private static String joinLines(List<String> lines) {
        if (lines.isEmpty()) {
            return "";
        }
        return String.join(LINE_SEPARATOR, lines) + LINE_SEPARATOR;
    }
}
