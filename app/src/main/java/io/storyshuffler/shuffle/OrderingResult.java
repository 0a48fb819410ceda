package io.storyshuffler.shuffle;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A shuffled manuscript: the original zero-based indices in their new order and the matching texts.
 */
public record OrderingResult(List<Integer> indices, List<String> sections) {

    public OrderingResult {
        indices = List.copyOf(indices);
        sections = List.copyOf(sections);
        if (indices.size() != sections.size()) {
            throw new IllegalArgumentException("indices and sections must have the same length");
        }
    }

    public int size() {
        return indices.size();
    }

    /**
     * Joins the reordered sections into a new manuscript.
     */
    public String assemble(String separator) {
        return String.join(separator, sections);
    }

    /**
     * One-based order as writers read it, e.g. {@code §3 §1 §2}.
     */
    public String describeOrder() {
        return indices.stream().map(index -> "§" + (index + 1)).collect(Collectors.joining(" "));
    }
}
