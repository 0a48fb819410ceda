package io.storyshuffler.shuffle;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a shuffle request. Only {@link ShuffleStatus#SHUFFLED} carries an ordering.
 */
public record ShuffleOutcome(ShuffleStatus status, Optional<OrderingResult> ordering) {

    public ShuffleOutcome {
        status = Objects.requireNonNull(status, "status");
        ordering = ordering == null ? Optional.empty() : ordering;
        if ((status == ShuffleStatus.SHUFFLED) != ordering.isPresent()) {
            throw new IllegalArgumentException("An ordering is present exactly when the status is SHUFFLED");
        }
    }

    public static ShuffleOutcome shuffled(OrderingResult ordering) {
        return new ShuffleOutcome(ShuffleStatus.SHUFFLED, Optional.of(ordering));
    }

    public static ShuffleOutcome blocked(ShuffleStatus status) {
        return new ShuffleOutcome(status, Optional.empty());
    }

    public boolean succeeded() {
        return status == ShuffleStatus.SHUFFLED;
    }
}
