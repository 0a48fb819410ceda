package io.storyshuffler.graph;

import java.util.List;

/**
 * A simple directed cycle, listed from its starting vertex back to that same vertex.
 */
public record Cycle(List<Integer> vertices) {

    public Cycle {
        vertices = List.copyOf(vertices);
        if (vertices.size() < 2 || !vertices.get(0).equals(vertices.get(vertices.size() - 1))) {
            throw new IllegalArgumentException("A cycle must start and end at the same vertex: " + vertices);
        }
    }

    public int start() {
        return vertices.get(0);
    }

    /**
     * Number of edges along the cycle; a self loop has length one.
     */
    public int length() {
        return vertices.size() - 1;
    }
}
