package io.storyshuffler.constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The constraints of a manuscript, one per section and in section order.
 */
public class ConstraintSet {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintSet.class);

    private final List<Constraint> constraints = new ArrayList<>();

    public ConstraintSet() {
    }

    /**
     * Discards every constraint and starts over with {@code count} unconstrained sections.
     */
    public void reset(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be zero or greater");
        }
        if (!constraints.isEmpty()) {
            LOGGER.debug("Discarding {} constraints for a manuscript of {} sections", constraints.size(), count);
        }
        constraints.clear();
        for (int i = 0; i < count; i++) {
            constraints.add(new Constraint());
        }
    }

    public int size() {
        return constraints.size();
    }

    public Constraint get(int index) {
        return constraints.get(index);
    }

    public List<Constraint> asList() {
        return Collections.unmodifiableList(constraints);
    }

    /**
     * Pins the first or last section in place. Only those two sections can be fixed.
     */
    public void setFixed(int index, boolean fixed) {
        checkIndex(index);
        if (index != 0 && index != constraints.size() - 1) {
            throw new IllegalArgumentException("Only the first and last sections can be fixed, not §" + (index + 1));
        }
        constraints.get(index).setFixed(fixed);
    }

    /**
     * Applies the typed successor list of section {@code index} and checks every number against the
     * manuscript. Returns whether the constraint can take part in validation.
     */
    public boolean editSuccessors(int index, String raw) {
        checkIndex(index);
        Constraint constraint = constraints.get(index);
        if (!constraint.editSuccessors(raw)) {
            LOGGER.debug("Rejected successor list '{}' for §{}", raw, index + 1);
            return false;
        }
        List<Integer> outOfRange = constraint.before().stream()
                .filter(number -> number > constraints.size())
                .distinct()
                .toList();
        if (!outOfRange.isEmpty()) {
            constraint.setReferenceError(describeOutOfRange(outOfRange));
            return false;
        }
        return true;
    }

    public boolean allSyntacticallyValid() {
        return constraints.stream().allMatch(Constraint::syntacticallyValid);
    }

    public boolean readyForValidation() {
        return constraints.stream().allMatch(Constraint::readyForValidation);
    }

    public long paradoxCount() {
        return constraints.stream().filter(constraint -> constraint.paradoxMessage().isPresent()).count();
    }

    private String describeOutOfRange(List<Integer> numbers) {
        String listed = numbers.stream().map(number -> "§" + number).collect(Collectors.joining(", "));
        return "No such section: " + listed + " (the manuscript has " + constraints.size() + " sections)";
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= constraints.size()) {
            throw new IndexOutOfBoundsException("No section at index " + index + " of " + constraints.size());
        }
    }
}
