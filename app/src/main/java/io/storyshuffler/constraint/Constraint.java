package io.storyshuffler.constraint;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordering rules attached to one section, together with the validation state shown to the writer.
 *
 * <p>{@link #before()} lists one-based numbers of the sections that must come strictly after this one.
 * {@link #rawInput()} keeps the text as typed so a malformed entry can be shown without disturbing
 * the last parsed list.
 */
public final class Constraint {

    private boolean fixed;
    private List<Integer> before = List.of();
    private String rawInput = "";
    private boolean syntacticallyValid = true;
    private Optional<String> referenceError = Optional.empty();
    private Optional<String> paradoxMessage = Optional.empty();

    public Constraint() {
    }

    /**
     * Creates a constraint with an already parsed successor list.
     */
    public static Constraint withSuccessors(Integer... successors) {
        Constraint constraint = new Constraint();
        constraint.before = List.of(successors);
        constraint.rawInput = String.join(",", constraint.before.stream().map(String::valueOf).toList());
        return constraint;
    }

    public boolean fixed() {
        return fixed;
    }

    /**
     * Pins the section. Only honored for the first and last sections of a manuscript.
     */
    public Constraint setFixed(boolean fixed) {
        this.fixed = fixed;
        return this;
    }

    public List<Integer> before() {
        return before;
    }

    public String rawInput() {
        return rawInput;
    }

    public boolean syntacticallyValid() {
        return syntacticallyValid;
    }

    public Optional<String> referenceError() {
        return referenceError;
    }

    public Optional<String> paradoxMessage() {
        return paradoxMessage;
    }

    public boolean readyForValidation() {
        return syntacticallyValid && referenceError.isEmpty();
    }

    /**
     * Replaces the typed successor list, re-parsing it. A malformed list empties {@link #before()}.
     */
    public boolean editSuccessors(String raw) {
        rawInput = raw == null ? "" : raw;
        Optional<List<Integer>> parsed = SuccessorListParser.parse(rawInput);
        syntacticallyValid = parsed.isPresent();
        before = parsed.orElse(List.of());
        referenceError = Optional.empty();
        return syntacticallyValid;
    }

    void setReferenceError(String message) {
        referenceError = Optional.ofNullable(message);
    }

    public void markParadox(String message) {
        paradoxMessage = Optional.of(Objects.requireNonNull(message, "message"));
    }

    public void clearParadox() {
        paradoxMessage = Optional.empty();
    }

    @Override
    public String toString() {
        return "Constraint{fixed=" + fixed + ", before=" + before + ", valid=" + syntacticallyValid + '}';
    }
}
