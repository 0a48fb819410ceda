package io.storyshuffler.graph;

import com.google.common.graph.ImmutableGraph;
import java.util.List;
import java.util.Objects;

/**
 * Directed graph over one-based section numbers; an edge {@code u -> v} means section {@code u} must
 * come before section {@code v}.
 */
public final class PrecedenceGraph {

    private final ImmutableGraph<Integer> graph;

    PrecedenceGraph(ImmutableGraph<Integer> graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    public int sectionCount() {
        return graph.nodes().size();
    }

    public boolean isEmpty() {
        return graph.nodes().isEmpty();
    }

    /**
     * Section numbers in ascending order.
     */
    public List<Integer> vertices() {
        return graph.nodes().stream().sorted().toList();
    }

    /**
     * Direct successors of {@code vertex} in ascending order.
     */
    public List<Integer> successors(int vertex) {
        return graph.successors(vertex).stream().sorted().toList();
    }

    public int inDegree(int vertex) {
        return graph.inDegree(vertex);
    }

    public boolean hasEdge(int from, int to) {
        return graph.hasEdgeConnecting(from, to);
    }

    public int edgeCount() {
        return graph.edges().size();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof PrecedenceGraph that && graph.equals(that.graph);
    }

    @Override
    public int hashCode() {
        return graph.hashCode();
    }

    @Override
    public String toString() {
        return "PrecedenceGraph" + graph;
    }
}
