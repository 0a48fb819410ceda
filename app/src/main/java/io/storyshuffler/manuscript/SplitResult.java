package io.storyshuffler.manuscript;

import java.util.List;
import java.util.Optional;

/**
 * Sections produced from a manuscript, or the reason the delimiter could not be applied.
 */
public record SplitResult(List<Section> sections, Optional<String> delimiterError) {

    public SplitResult {
        sections = List.copyOf(sections == null ? List.of() : sections);
        delimiterError = delimiterError == null ? Optional.empty() : delimiterError;
    }

    public static SplitResult of(List<Section> sections) {
        return new SplitResult(sections, Optional.empty());
    }

    public static SplitResult failed(String delimiterError) {
        return new SplitResult(List.of(), Optional.of(delimiterError));
    }

    public boolean hasError() {
        return delimiterError.isPresent();
    }

    public List<String> texts() {
        return sections.stream().map(Section::text).toList();
    }
}
