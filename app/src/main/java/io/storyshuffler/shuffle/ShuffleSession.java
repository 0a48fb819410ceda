package io.storyshuffler.shuffle;

import io.storyshuffler.constraint.Constraint;
import io.storyshuffler.constraint.ConstraintSet;
import io.storyshuffler.graph.PrecedenceGraph;
import io.storyshuffler.manuscript.DelimiterMode;
import io.storyshuffler.manuscript.ManuscriptSplitter;
import io.storyshuffler.manuscript.Section;
import io.storyshuffler.manuscript.SplitResult;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Working state of one manuscript: its sections, the constraints a writer placed on them and the most
 * recent shuffle.
 *
 * <p>Re-splitting the manuscript resets every constraint. The latest ordering survives re-splits and
 * blocked shuffles; only a successful shuffle replaces it.
 */
public class ShuffleSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(ShuffleSession.class);

    private final ManuscriptSplitter splitter;
    private final ConstraintValidator validator;
    private final RandomizedTopologicalOrderer orderer;
    private final ConstraintSet constraints = new ConstraintSet();

    private String delimiter = ManuscriptSplitter.DEFAULT_DELIMITER;
    private DelimiterMode delimiterMode = DelimiterMode.LITERAL;
    private SplitResult split = SplitResult.of(List.of());
    private volatile OrderingResult latestOrdering;

    public ShuffleSession(Random random) {
        this(new ManuscriptSplitter(), new ConstraintValidator(), new RandomizedTopologicalOrderer(random));
    }

    public ShuffleSession(ManuscriptSplitter splitter, ConstraintValidator validator, RandomizedTopologicalOrderer orderer) {
        this.splitter = Objects.requireNonNull(splitter, "splitter");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.orderer = Objects.requireNonNull(orderer, "orderer");
    }

    /**
     * Splits {@code manuscript} anew and resets the constraints to match the new sections.
     */
    public SplitResult resplit(String manuscript, String delimiter, DelimiterMode delimiterMode) {
        this.delimiter = delimiter == null ? "" : delimiter;
        this.delimiterMode = Objects.requireNonNull(delimiterMode, "delimiterMode");
        split = splitter.split(manuscript, this.delimiter, this.delimiterMode);
        constraints.reset(split.sections().size());
        LOGGER.info("Manuscript split into {} sections", split.sections().size());
        return split;
    }

    public List<Section> sections() {
        return split.sections();
    }

    public Optional<String> delimiterError() {
        return split.delimiterError();
    }

    public String delimiter() {
        return delimiter;
    }

    public DelimiterMode delimiterMode() {
        return delimiterMode;
    }

    public ConstraintSet constraints() {
        return constraints;
    }

    public Constraint constraint(int index) {
        return constraints.get(index);
    }

    public void setFixed(int index, boolean fixed) {
        constraints.setFixed(index, fixed);
    }

    public boolean editSuccessors(int index, String raw) {
        return constraints.editSuccessors(index, raw);
    }

    public boolean canShuffle() {
        return sections().size() > 1 && constraints.readyForValidation();
    }

    /**
     * Validates the constraints and, when no paradox remains, publishes a new random ordering.
     */
    public ShuffleOutcome shuffle() {
        if (sections().size() < 2) {
            return ShuffleOutcome.blocked(ShuffleStatus.TOO_FEW_SECTIONS);
        }
        if (!constraints.readyForValidation()) {
            LOGGER.warn("Shuffle blocked: some section lists are malformed or name missing sections");
            return ShuffleOutcome.blocked(ShuffleStatus.INVALID_CONSTRAINTS);
        }
        Optional<PrecedenceGraph> graph = validator.validate(constraints);
        if (graph.isEmpty()) {
            return ShuffleOutcome.blocked(ShuffleStatus.PARADOX);
        }
        OrderingResult ordering = orderer.order(graph.get(), sections());
        latestOrdering = ordering;
        LOGGER.atInfo()
                .addKeyValue("sections", ordering.size())
                .log("Shuffled order: {}", ordering.describeOrder());
        return ShuffleOutcome.shuffled(ordering);
    }

    public Optional<OrderingResult> latestOrdering() {
        return Optional.ofNullable(latestOrdering);
    }
}
