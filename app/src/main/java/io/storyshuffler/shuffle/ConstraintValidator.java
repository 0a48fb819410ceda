package io.storyshuffler.shuffle;

import io.storyshuffler.constraint.Constraint;
import io.storyshuffler.constraint.ConstraintSet;
import io.storyshuffler.graph.Cycle;
import io.storyshuffler.graph.CycleDetector;
import io.storyshuffler.graph.ParadoxFormatter;
import io.storyshuffler.graph.PrecedenceGraph;
import io.storyshuffler.graph.PrecedenceGraphBuilder;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Marks every section that takes part in a paradox and answers the precedence graph only when none do.
 *
 * <p>Every section is visited on each pass, so a section whose paradox has been resolved loses its
 * message even while others still report one. Callers must first make sure every constraint is
 * syntactically valid and refers only to existing sections.
 */
public class ConstraintValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintValidator.class);

    private final PrecedenceGraphBuilder graphBuilder;
    private final CycleDetector cycleDetector;

    public ConstraintValidator() {
        this(new PrecedenceGraphBuilder(), new CycleDetector());
    }

    public ConstraintValidator(PrecedenceGraphBuilder graphBuilder, CycleDetector cycleDetector) {
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder");
        this.cycleDetector = Objects.requireNonNull(cycleDetector, "cycleDetector");
    }

    public Optional<PrecedenceGraph> validate(ConstraintSet constraints) {
        Objects.requireNonNull(constraints, "constraints");
        PrecedenceGraph graph = graphBuilder.build(constraints.asList());
        LOGGER.debug("Built precedence graph with {} sections and {} edges", graph.sectionCount(), graph.edgeCount());

        int invalid = 0;
        for (int vertex : graph.vertices()) {
            Constraint constraint = constraints.get(vertex - 1);
            List<Cycle> cycles = cycleDetector.findCycles(graph, vertex);
            if (cycles.isEmpty()) {
                constraint.clearParadox();
            } else {
                constraint.markParadox(ParadoxFormatter.format(cycles));
                invalid++;
            }
        }

        if (invalid > 0) {
            LOGGER.warn("Found paradoxes involving {} of {} sections", invalid, graph.sectionCount());
            return Optional.empty();
        }
        return Optional.of(graph);
    }
}
