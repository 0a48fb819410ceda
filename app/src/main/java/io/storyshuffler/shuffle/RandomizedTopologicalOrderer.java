package io.storyshuffler.shuffle;

import static com.google.common.base.Verify.verify;

import io.storyshuffler.graph.PrecedenceGraph;
import io.storyshuffler.manuscript.Section;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Produces a random order of the sections that respects every edge of an acyclic precedence graph.
 *
 * <p>At each step one of the current roots is chosen uniformly and removed along with its outgoing
 * edges. This is a greedy randomized topological sort: every valid order can appear, but not every
 * valid order is equally likely. In-degrees are tracked incrementally, so a full ordering costs
 * {@code O(N + E)}.
 */
public class RandomizedTopologicalOrderer {

    private final Random random;

    public RandomizedTopologicalOrderer(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public OrderingResult order(PrecedenceGraph graph, List<Section> sections) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(sections, "sections");
        if (graph.sectionCount() != sections.size()) {
            throw new IllegalArgumentException("Graph has " + graph.sectionCount()
                    + " sections but " + sections.size() + " were supplied");
        }

        Map<Integer, Integer> inDegrees = new HashMap<>();
        List<Integer> roots = new ArrayList<>();
        for (int vertex : graph.vertices()) {
            int inDegree = graph.inDegree(vertex);
            inDegrees.put(vertex, inDegree);
            if (inDegree == 0) {
                roots.add(vertex);
            }
        }

        int count = graph.sectionCount();
        List<Integer> indices = new ArrayList<>(count);
        List<String> texts = new ArrayList<>(count);
        while (indices.size() < count) {
            verify(!roots.isEmpty(), "No root among %s remaining sections; the graph was not acyclic",
                    count - indices.size());
            int vertex = removeRandom(roots);
            indices.add(vertex - 1);
            texts.add(sections.get(vertex - 1).text());
            for (int successor : graph.successors(vertex)) {
                int remaining = inDegrees.merge(successor, -1, Integer::sum);
                if (remaining == 0) {
                    roots.add(successor);
                }
            }
        }
        return new OrderingResult(indices, texts);
    }

    private int removeRandom(List<Integer> roots) {
        int chosen = random.nextInt(roots.size());
        int last = roots.size() - 1;
        int vertex = roots.get(chosen);
        roots.set(chosen, roots.get(last));
        roots.remove(last);
        return vertex;
    }
}
