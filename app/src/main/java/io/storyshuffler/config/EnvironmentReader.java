package io.storyshuffler.config;

import java.util.Optional;

/**
 * Source of environment settings; tests substitute a map.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
