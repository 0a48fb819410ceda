package io.storyshuffler.constraint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import org.junit.jupiter.api.Test;

class ConstraintSetTest {

    @Test
    void resetCreatesUnconstrainedSections() {
        ConstraintSet constraints = new ConstraintSet();
        constraints.reset(3);

        assertThat(constraints.size()).isEqualTo(3);
        assertThat(constraints.asList()).allSatisfy(constraint -> {
            assertThat(constraint.fixed()).isFalse();
            assertThat(constraint.before()).isEmpty();
            assertThat(constraint.rawInput()).isEmpty();
            assertThat(constraint.syntacticallyValid()).isTrue();
            assertThat(constraint.paradoxMessage()).isEmpty();
        });
        assertThat(constraints.readyForValidation()).isTrue();
    }

    @Test
    void resetDiscardsPreviousConstraints() {
        ConstraintSet constraints = new ConstraintSet();
        constraints.reset(2);
        constraints.setFixed(0, true);
        constraints.editSuccessors(1, "x");

        constraints.reset(2);

        assertThat(constraints.get(0).fixed()).isFalse();
        assertThat(constraints.get(1).syntacticallyValid()).isTrue();
    }

    @Test
    void onlyFirstAndLastSectionsCanBeFixed() {
        ConstraintSet constraints = new ConstraintSet();
        constraints.reset(3);

        constraints.setFixed(0, true);
        constraints.setFixed(2, true);
        Throwable thrown = catchThrowable(() -> constraints.setFixed(1, true));

        assertThat(constraints.get(0).fixed()).isTrue();
        assertThat(constraints.get(2).fixed()).isTrue();
        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("§2");
    }

    @Test
    void malformedListEmptiesSuccessorsAndBlocksValidation() {
        ConstraintSet constraints = new ConstraintSet();
        constraints.reset(3);
        constraints.editSuccessors(0, "2,3");

        boolean accepted = constraints.editSuccessors(0, "2,,3");

        Constraint constraint = constraints.get(0);
        assertThat(accepted).isFalse();
        assertThat(constraint.syntacticallyValid()).isFalse();
        assertThat(constraint.rawInput()).isEqualTo("2,,3");
        assertThat(constraint.before()).isEmpty();
        assertThat(constraints.allSyntacticallyValid()).isFalse();
        assertThat(constraints.readyForValidation()).isFalse();
    }

    @Test
    void outOfRangeReferencesAreKeptAndFlagged() {
        ConstraintSet constraints = new ConstraintSet();
        constraints.reset(3);

        boolean accepted = constraints.editSuccessors(1, "3,7,7");

        Constraint constraint = constraints.get(1);
        assertThat(accepted).isFalse();
        assertThat(constraint.syntacticallyValid()).isTrue();
        assertThat(constraint.before()).containsExactly(3, 7, 7);
        assertThat(constraint.referenceError()).hasValue("No such section: §7 (the manuscript has 3 sections)");
        assertThat(constraints.readyForValidation()).isFalse();
    }

    @Test
    void correctingAListClearsItsErrors() {
        ConstraintSet constraints = new ConstraintSet();
        constraints.reset(3);
        constraints.editSuccessors(1, "9");

        boolean accepted = constraints.editSuccessors(1, "3");

        assertThat(accepted).isTrue();
        assertThat(constraints.get(1).referenceError()).isEmpty();
        assertThat(constraints.get(1).before()).containsExactly(3);
        assertThat(constraints.readyForValidation()).isTrue();
    }

    @Test
    void rejectsIndicesOutsideTheManuscript() {
        ConstraintSet constraints = new ConstraintSet();
        constraints.reset(2);

        assertThat(catchThrowable(() -> constraints.editSuccessors(2, "1")))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
