package io.storyshuffler.manuscript;

import java.util.Objects;

/**
 * A contiguous unit of the manuscript, identified by its zero-based position in the original order.
 */
public record Section(int index, String text) {

    private static final int PREVIEW_LENGTH = 79;

    public Section {
        if (index < 0) {
            throw new IllegalArgumentException("index must be zero or greater");
        }
        text = Objects.requireNonNull(text, "text");
    }

    /**
     * One-based number used in everything shown to writers.
     */
    public int number() {
        return index + 1;
    }

    public String preview() {
        int end = text.offsetByCodePoints(0, Math.min(PREVIEW_LENGTH, text.codePointCount(0, text.length())));
        return text.substring(0, end) + '…';
    }
}
