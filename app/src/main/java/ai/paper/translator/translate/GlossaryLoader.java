package ai.paper.translator.translate;

import ai.paper.translator.service.TranslationSetupException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the glossary JSON file: an array of {@code {"term": ..., "translation": ...}} objects.
 */
public class GlossaryLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(GlossaryLoader.class);
    private static final TypeReference<List<Glossary.Entry>> ENTRY_LIST = new TypeReference<>() { };

    private final ObjectMapper mapper;

    public GlossaryLoader() {
        this(new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    GlossaryLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Glossary load(Optional<Path> glossaryFile) {
        if (glossaryFile == null || glossaryFile.isEmpty()) {
            LOGGER.info("No glossary configured");
            return Glossary.empty();
        }
        return load(glossaryFile.get());
    }

    public Glossary load(Path glossaryFile) {
        if (!Files.isRegularFile(glossaryFile)) {
            throw new TranslationSetupException("Glossary file not found at " + glossaryFile);
        }
        try {
            List<Glossary.Entry> entries = mapper.readValue(glossaryFile.toFile(), ENTRY_LIST);
            Glossary glossary = new Glossary(entries == null ? List.of() : entries);
            LOGGER.info("Loaded {} glossary entries from {}", glossary.entries().size(), glossaryFile);
            return glossary;
        } catch (IOException | IllegalArgumentException ex) {
            throw new TranslationSetupException("Invalid glossary file " + glossaryFile + ": " + ex.getMessage(), ex);
        }
    }
}
