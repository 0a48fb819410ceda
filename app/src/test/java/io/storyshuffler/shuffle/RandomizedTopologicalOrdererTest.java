package io.storyshuffler.shuffle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import com.google.common.base.VerifyException;
import io.storyshuffler.constraint.Constraint;
import io.storyshuffler.graph.PrecedenceGraph;
import io.storyshuffler.graph.PrecedenceGraphBuilder;
import io.storyshuffler.manuscript.Section;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RandomizedTopologicalOrdererTest {

    private final PrecedenceGraphBuilder builder = new PrecedenceGraphBuilder();

    @Test
    void everyOrderingRespectsEveryEdge() {
        PrecedenceGraph graph = builder.build(List.of(
                Constraint.withSuccessors(3), new Constraint(), Constraint.withSuccessors(5),
                Constraint.withSuccessors(2), new Constraint()));
        List<Section> sections = sections(5);

        for (long seed = 0; seed < 200; seed++) {
            OrderingResult result = new RandomizedTopologicalOrderer(new Random(seed)).order(graph, sections);

            assertThat(result.indices()).containsExactlyInAnyOrder(0, 1, 2, 3, 4);
            for (int from : graph.vertices()) {
                for (int to : graph.successors(from)) {
                    assertThat(result.indices().indexOf(from - 1))
                            .isLessThan(result.indices().indexOf(to - 1));
                }
            }
            for (int i = 0; i < result.size(); i++) {
                assertThat(result.sections().get(i)).isEqualTo(sections.get(result.indices().get(i)).text());
            }
        }
    }

    @Test
    void fixedSectionsStayAtTheEnds() {
        PrecedenceGraph graph = builder.build(List.of(
                new Constraint().setFixed(true), new Constraint(), new Constraint(), new Constraint().setFixed(true)));

        for (long seed = 0; seed < 50; seed++) {
            OrderingResult result = new RandomizedTopologicalOrderer(new Random(seed)).order(graph, sections(4));

            assertThat(result.indices().get(0)).isZero();
            assertThat(result.indices().get(3)).isEqualTo(3);
        }
    }

    @Test
    void fixedLastSectionAloneStaysLast() {
        PrecedenceGraph graph = builder.build(List.of(
                new Constraint(), new Constraint(), new Constraint(), new Constraint().setFixed(true)));
        Set<Integer> firstPositions = new HashSet<>();

        for (long seed = 0; seed < 100; seed++) {
            OrderingResult result = new RandomizedTopologicalOrderer(new Random(seed)).order(graph, sections(4));

            assertThat(result.indices().get(3)).isEqualTo(3);
            firstPositions.add(result.indices().get(0));
        }

        assertThat(firstPositions).containsExactlyInAnyOrder(0, 1, 2);
    }

    @Test
    void fixedFirstSectionAloneStaysFirst() {
        PrecedenceGraph graph = builder.build(List.of(
                new Constraint().setFixed(true), new Constraint(), new Constraint(), new Constraint()));

        for (long seed = 0; seed < 100; seed++) {
            OrderingResult result = new RandomizedTopologicalOrderer(new Random(seed)).order(graph, sections(4));

            assertThat(result.indices().get(0)).isZero();
        }
    }

    @Test
    void sameSeedGivesSameOrder() {
        PrecedenceGraph graph = builder.build(List.of(new Constraint(), new Constraint(), new Constraint(), new Constraint()));

        OrderingResult first = new RandomizedTopologicalOrderer(new Random(42)).order(graph, sections(4));
        OrderingResult second = new RandomizedTopologicalOrderer(new Random(42)).order(graph, sections(4));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void unconstrainedSectionsReachEveryPermutation() {
        PrecedenceGraph graph = builder.build(List.of(new Constraint(), new Constraint(), new Constraint()));
        RandomizedTopologicalOrderer orderer = new RandomizedTopologicalOrderer(new Random(7));
        Set<List<Integer>> seen = new HashSet<>();

        for (int trial = 0; trial < 600; trial++) {
            seen.add(orderer.order(graph, sections(3)).indices());
        }

        assertThat(seen).hasSize(6);
    }

    @Test
    void cyclicGraphFailsVerification() {
        PrecedenceGraph graph = builder.build(List.of(Constraint.withSuccessors(2), Constraint.withSuccessors(1)));

        assertThat(catchThrowable(() -> new RandomizedTopologicalOrderer(new Random(1)).order(graph, sections(2))))
                .isInstanceOf(VerifyException.class);
    }

    @Test
    void rejectsMismatchedSections() {
        PrecedenceGraph graph = builder.build(List.of(new Constraint(), new Constraint()));

        assertThat(catchThrowable(() -> new RandomizedTopologicalOrderer(new Random(1)).order(graph, sections(3))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<Section> sections(int count) {
        List<Section> sections = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            sections.add(new Section(i, "Section " + (i + 1)));
        }
        return sections;
    }
}
