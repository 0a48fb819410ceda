package io.storyshuffler.writer;

import io.storyshuffler.manuscript.DelimiterMode;
import io.storyshuffler.shuffle.OrderingResult;
import java.util.Objects;
import java.util.Optional;

/**
 * Joins reordered sections back into a manuscript.
 *
 * <p>A literal delimiter reappears verbatim between sections. A regular expression cannot be written
 * back, so a dinkus separates the sections instead.
 */
public class ManuscriptAssembler {

    static final String DINKUS = "* * *";

    private final Optional<String> joinDelimiter;

    public ManuscriptAssembler() {
        this(Optional.empty());
    }

    public ManuscriptAssembler(Optional<String> joinDelimiter) {
        this.joinDelimiter = joinDelimiter == null ? Optional.empty() : joinDelimiter;
    }

    public String separator(String delimiter, DelimiterMode mode) {
        Objects.requireNonNull(mode, "mode");
        String between = joinDelimiter.orElseGet(() -> mode.isRegex() ? DINKUS : Objects.requireNonNullElse(delimiter, ""));
        return "\n\n" + between + "\n\n";
    }

    public String assemble(OrderingResult ordering, String delimiter, DelimiterMode mode) {
        Objects.requireNonNull(ordering, "ordering");
        return ordering.assemble(separator(delimiter, mode));
    }
}
