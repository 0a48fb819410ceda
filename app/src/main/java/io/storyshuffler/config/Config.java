package io.storyshuffler.config;

import io.storyshuffler.manuscript.DelimiterMode;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable run configuration assembled from CLI arguments and environment values.
 *
 * <p>{@code successorLists} maps one-based section numbers to the text typed for their
 * "must come before" list; the text is validated later, per section.
 */
public record Config(
        Path manuscript,
        String delimiter,
        DelimiterMode delimiterMode,
        boolean fixFirst,
        boolean fixLast,
        Map<Integer, String> successorLists,
        Optional<Long> seed,
        Optional<Path> output,
        Optional<String> joinDelimiter,
        boolean stageOutput,
        boolean listSections,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(manuscript, "manuscript");
        delimiter = Objects.requireNonNull(delimiter, "delimiter");
        delimiterMode = Objects.requireNonNull(delimiterMode, "delimiterMode");
        successorLists = successorLists == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(successorLists));
        seed = seed == null ? Optional.empty() : seed;
        output = output == null ? Optional.empty() : output;
        joinDelimiter = joinDelimiter == null ? Optional.empty() : joinDelimiter;
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        for (Integer number : successorLists.keySet()) {
            if (number < 1) {
                throw new IllegalArgumentException("Section numbers start at 1, got " + number);
            }
        }
        if (stageOutput && output.isEmpty()) {
            throw new IllegalArgumentException("--stage requires an output file");
        }
    }
}
