package io.storyshuffler.manuscript;

/**
 * How the section delimiter is interpreted.
 */
public enum DelimiterMode {
    LITERAL,
    REGEX;

    public static DelimiterMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return LITERAL;
        }
        for (DelimiterMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported delimiter mode: " + raw);
    }

    public boolean isRegex() {
        return this == REGEX;
    }
}
