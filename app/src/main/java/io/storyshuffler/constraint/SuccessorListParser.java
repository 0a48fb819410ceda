package io.storyshuffler.constraint;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses the comma-separated list of section numbers a writer types for a constraint.
 *
 * <p>The empty string is valid and names no sections. {@code 0} entries are dropped; every other
 * number is kept even when it lies outside the manuscript, since range depends on the section count.
 */
public final class SuccessorListParser {

    private static final Pattern SECTIONS_LIST = Pattern.compile("^(?:\\s*\\d+\\s*(?:,\\s*\\d+\\s*)*)?$");

    private SuccessorListParser() {
    }

    public static boolean isWellFormed(String raw) {
        return raw != null && SECTIONS_LIST.matcher(raw).matches();
    }

    /**
     * Returns the one-based section numbers, or empty when the text is malformed.
     */
    public static Optional<List<Integer>> parse(String raw) {
        if (!isWellFormed(raw)) {
            return Optional.empty();
        }
        if (raw.isBlank()) {
            return Optional.of(List.of());
        }
        List<Integer> numbers = new ArrayList<>();
        for (String token : raw.split(",")) {
            int value;
            try {
                value = Integer.parseInt(token.trim());
            } catch (NumberFormatException ex) {
                // Only overflow reaches here; the pattern already guarantees digits.
                return Optional.empty();
            }
            if (value != 0) {
                numbers.add(value);
            }
        }
        return Optional.of(List.copyOf(numbers));
    }
}
