package ai.paper.translator.translate;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Term list handed to the model alongside each chunk.
 */
public record Glossary(List<Entry> entries) {

    public Glossary {
        entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    }

    public static Glossary empty() {
        return new Glossary(List.of());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Renders the glossary as one {@code - term > translation} line per entry.
     */
    public String render() {
        return entries.stream()
                .map(entry -> "- " + entry.term() + " > " + entry.translation())
                .collect(Collectors.joining("\n"))
                .strip();
    }

    public record Entry(@JsonProperty("term") String term, @JsonProperty("translation") String translation) {

        public Entry {
            if (term == null || term.isBlank()) {
                throw new IllegalArgumentException("glossary term must not be blank");
            }
            translation = translation == null ? "" : translation;
        }
    }
}
