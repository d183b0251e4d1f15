package ai.paper.translator.chunk;

import ai.paper.translator.service.TranslationSetupException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the source document and turns it into token-counted {@link Line}s.
 */
public class DocumentReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentReader.class);

    private final TokenCounter tokenCounter;

    public DocumentReader(TokenCounter tokenCounter) {
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter");
    }

    public List<Line> read(Path inputFile) {
        Objects.requireNonNull(inputFile, "inputFile");
        if (!Files.isRegularFile(inputFile)) {
            throw new TranslationSetupException("Input file not found: " + inputFile);
        }
        String content;
        try {
            content = Files.readString(inputFile, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new TranslationSetupException("Failed to read input file: " + inputFile, ex);
        }
        List<Line> lines = toLines(content);
        LOGGER.info("Read {} lines from {}", lines.size(), inputFile);
        return lines;
    }

    public List<Line> toLines(String content) {
        List<String> rawLines = splitKeepingTerminators(content);
        List<Line> lines = new ArrayList<>(rawLines.size());
        for (String raw : rawLines) {
            lines.add(Line.of(raw, tokenCounter));
        }
        return lines;
    }

    static List<String> splitKeepingTerminators(String content) {
        List<String> result = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return result;
        }
        int start = 0;
        int length = content.length();
        for (int i = 0; i < length; i++) {
            char ch = content.charAt(i);
            if (ch == '\n') {
                result.add(content.substring(start, i + 1));
                start = i + 1;
            } else if (ch == '\r') {
                int end = i + 1 < length && content.charAt(i + 1) == '\n' ? i + 2 : i + 1;
                result.add(content.substring(start, end));
                start = end;
                i = end - 1;
            }
        }
        if (start < length) {
            result.add(content.substring(start));
        }
        return result;
    }
}
