package io.storyshuffler.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.storyshuffler.constraint.Constraint;
import java.util.List;
import org.junit.jupiter.api.Test;

class PrecedenceGraphBuilderTest {

    private final PrecedenceGraphBuilder builder = new PrecedenceGraphBuilder();

    @Test
    void emptyConstraintsBuildEmptyGraph() {
        PrecedenceGraph graph = builder.build(List.of());

        assertThat(graph.isEmpty()).isTrue();
        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    void everySectionBecomesAVertex() {
        PrecedenceGraph graph = builder.build(List.of(new Constraint().setFixed(true)));

        assertThat(graph.vertices()).containsExactly(1);
        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    void fixedFirstSectionPrecedesEveryOtherSection() {
        PrecedenceGraph graph = builder.build(List.of(
                new Constraint().setFixed(true), new Constraint(), new Constraint(), new Constraint()));

        assertThat(graph.successors(1)).containsExactly(2, 3, 4);
        assertThat(graph.edgeCount()).isEqualTo(3);
    }

    @Test
    void fixedLastSectionFollowsEveryOtherSection() {
        PrecedenceGraph graph = builder.build(List.of(
                new Constraint(), new Constraint(), new Constraint().setFixed(true)));

        assertThat(graph.hasEdge(1, 3)).isTrue();
        assertThat(graph.hasEdge(2, 3)).isTrue();
        assertThat(graph.inDegree(3)).isEqualTo(2);
        assertThat(graph.edgeCount()).isEqualTo(2);
    }

    @Test
    void fixedFirstAndLastTogetherShareTheEdgeBetweenThem() {
        PrecedenceGraph graph = builder.build(List.of(
                new Constraint().setFixed(true), new Constraint(), new Constraint().setFixed(true)));

        assertThat(graph.successors(1)).containsExactly(2, 3);
        assertThat(graph.hasEdge(2, 3)).isTrue();
        assertThat(graph.edgeCount()).isEqualTo(3);
    }

    @Test
    void successorListsAddOneEdgePerDistinctReference() {
        PrecedenceGraph graph = builder.build(List.of(
                Constraint.withSuccessors(3, 3, 2), new Constraint(), Constraint.withSuccessors(3)));

        assertThat(graph.successors(1)).containsExactly(2, 3);
        assertThat(graph.hasEdge(3, 3)).isTrue();
        assertThat(graph.edgeCount()).isEqualTo(3);
    }

    @Test
    void fixedFirstPlusExplicitSuccessorDoesNotDuplicateEdges() {
        PrecedenceGraph graph = builder.build(List.of(
                Constraint.withSuccessors(2, 3).setFixed(true), new Constraint(), new Constraint()));

        assertThat(graph.successors(1)).containsExactly(2, 3);
        assertThat(graph.edgeCount()).isEqualTo(2);
    }

    @Test
    void buildingTwiceYieldsEqualGraphs() {
        List<Constraint> constraints = List.of(
                Constraint.withSuccessors(2, 4), Constraint.withSuccessors(3), new Constraint(), new Constraint().setFixed(true));

        assertThat(builder.build(constraints)).isEqualTo(builder.build(constraints));
    }

    @Test
    void rejectsReferencesOutsideTheManuscript() {
        List<Constraint> constraints = List.of(Constraint.withSuccessors(5), new Constraint());

        assertThat(catchThrowable(() -> builder.build(constraints)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("§5");
    }
}
