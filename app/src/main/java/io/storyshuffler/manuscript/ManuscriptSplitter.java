package io.storyshuffler.manuscript;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a manuscript into trimmed sections at every occurrence of a delimiter.
 */
public class ManuscriptSplitter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManuscriptSplitter.class);

    public static final String DEFAULT_DELIMITER = "* * *";

    public SplitResult split(String manuscript, String delimiter, DelimiterMode mode) {
        String text = manuscript == null ? "" : manuscript;
        if (delimiter == null || delimiter.isEmpty()) {
            return SplitResult.of(List.of(new Section(0, text.trim())));
        }

        Pattern pattern;
        if (mode == DelimiterMode.REGEX) {
            try {
                pattern = Pattern.compile(delimiter);
            } catch (PatternSyntaxException ex) {
                LOGGER.warn("Rejected delimiter pattern '{}': {}", delimiter, ex.getDescription());
                return SplitResult.failed(ex.getMessage());
            }
        } else {
            pattern = Pattern.compile(Pattern.quote(delimiter));
        }

        // A negative limit keeps trailing empty pieces, so every delimiter separates two sections.
        String[] pieces = pattern.split(text, -1);
        List<Section> sections = new ArrayList<>(pieces.length);
        for (String piece : pieces) {
            sections.add(new Section(sections.size(), piece.trim()));
        }
        LOGGER.debug("Split manuscript of {} characters into {} sections", text.length(), sections.size());
        return SplitResult.of(sections);
    }
}
