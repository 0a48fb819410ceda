package io.storyshuffler.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Enumerates every simple cycle passing through a given vertex.
 *
 * <p>Depth-first search keeps the current path in an on-path set and backtracks whenever it reaches the
 * start vertex again. Enumeration is exponential in the worst case, but the graph has one vertex per
 * section, so it stays small.
 */
public class CycleDetector {

    public List<Cycle> findCycles(PrecedenceGraph graph, int start) {
        Objects.requireNonNull(graph, "graph");
        if (!graph.vertices().contains(start)) {
            throw new IllegalArgumentException("No vertex §" + start + " in graph of " + graph.sectionCount());
        }
        List<Cycle> cycles = new ArrayList<>();
        List<Integer> path = new ArrayList<>();
        path.add(start);
        Set<Integer> onPath = new HashSet<>();
        onPath.add(start);
        search(graph, start, start, path, onPath, cycles);
        return List.copyOf(cycles);
    }

    private void search(PrecedenceGraph graph,
                        int start,
                        int current,
                        List<Integer> path,
                        Set<Integer> onPath,
                        List<Cycle> cycles) {
        for (int successor : graph.successors(current)) {
            if (successor == start) {
                List<Integer> closed = new ArrayList<>(path);
                closed.add(start);
                cycles.add(new Cycle(closed));
            } else if (onPath.add(successor)) {
                path.add(successor);
                search(graph, start, successor, path, onPath, cycles);
                path.remove(path.size() - 1);
                onPath.remove(successor);
            }
        }
    }
}
