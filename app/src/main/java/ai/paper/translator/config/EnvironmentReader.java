package ai.paper.translator.config;

import java.util.Optional;

/**
 * Source of raw configuration values keyed by environment variable name.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Returns the trimmed value for {@code key}, treating blank values as absent.
     */
    default Optional<String> find(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
