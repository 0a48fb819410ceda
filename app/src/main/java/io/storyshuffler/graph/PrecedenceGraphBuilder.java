package io.storyshuffler.graph;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.graph.ElementOrder;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.ImmutableGraph;
import com.google.common.graph.MutableGraph;
import io.storyshuffler.constraint.Constraint;
import java.util.List;
import java.util.Objects;

/**
 * Converts the constraints of a manuscript into a {@link PrecedenceGraph}.
 *
 * <p>A fixed first section precedes every other section and a fixed last section follows every other
 * section. Each successor reference adds one edge; repeated references collapse into a single edge.
 * References must already be within {@code 1..N}.
 */
public class PrecedenceGraphBuilder {

    public PrecedenceGraph build(List<Constraint> constraints) {
        Objects.requireNonNull(constraints, "constraints");
        int count = constraints.size();
        MutableGraph<Integer> graph = GraphBuilder.directed()
                .allowsSelfLoops(true)
                .nodeOrder(ElementOrder.insertion())
                .expectedNodeCount(count)
                .build();
        if (count == 0) {
            return new PrecedenceGraph(ImmutableGraph.copyOf(graph));
        }

        for (int number = 1; number <= count; number++) {
            graph.addNode(number);
        }
        if (constraints.get(0).fixed()) {
            for (int successor = 2; successor <= count; successor++) {
                graph.putEdge(1, successor);
            }
        }
        if (constraints.get(count - 1).fixed()) {
            for (int predecessor = 1; predecessor < count; predecessor++) {
                graph.putEdge(predecessor, count);
            }
        }
        for (int index = 0; index < count; index++) {
            for (int successor : constraints.get(index).before()) {
                checkArgument(successor >= 1 && successor <= count,
                        "§%s refers to §%s, outside 1..%s", index + 1, successor, count);
                graph.putEdge(index + 1, successor);
            }
        }
        return new PrecedenceGraph(ImmutableGraph.copyOf(graph));
    }
}
