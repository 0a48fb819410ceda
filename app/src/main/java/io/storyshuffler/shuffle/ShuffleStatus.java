package io.storyshuffler.shuffle;

/**
 * Why a shuffle request did or did not produce a new ordering.
 */
public enum ShuffleStatus {
    SHUFFLED,
    TOO_FEW_SECTIONS,
    INVALID_CONSTRAINTS,
    PARADOX
}
