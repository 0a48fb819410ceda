package io.storyshuffler.cli;

import io.storyshuffler.config.Config;
import io.storyshuffler.config.ConfigLoader;
import io.storyshuffler.config.EnvironmentReader;
import io.storyshuffler.constraint.Constraint;
import io.storyshuffler.logging.LoggingConfigurator;
import io.storyshuffler.manuscript.Section;
import io.storyshuffler.manuscript.SplitResult;
import io.storyshuffler.shuffle.OrderingResult;
import io.storyshuffler.shuffle.ShuffleOutcome;
import io.storyshuffler.shuffle.ShuffleSession;
import io.storyshuffler.writer.ManuscriptAssembler;
import io.storyshuffler.writer.ManuscriptWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and shuffle session.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_CONSTRAINTS = 1;
    static final int EXIT_PARADOX = 3;
    static final int EXIT_BAD_DELIMITER = 4;
    static final int EXIT_IO_FAILURE = 5;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final ManuscriptWriter manuscriptWriter;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new ManuscriptWriter(),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, ManuscriptWriter manuscriptWriter, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.manuscriptWriter = manuscriptWriter;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());

        try {
            return shuffle(config);
        } catch (UncheckedIOException ex) {
            LOGGER.error("I/O failure: {}", ex.getMessage(), ex);
            err.println(ex.getMessage());
            return EXIT_IO_FAILURE;
        } catch (IllegalStateException ex) {
            LOGGER.error("Staging failed: {}", ex.getMessage(), ex);
            err.println(ex.getMessage());
            return EXIT_IO_FAILURE;
        }
    }

    private int shuffle(Config config) {
        String manuscript = readManuscript(config);
        Random random = config.seed().map(Random::new).orElseGet(Random::new);
        ShuffleSession session = new ShuffleSession(random);

        SplitResult split = session.resplit(manuscript, config.delimiter(), config.delimiterMode());
        if (split.hasError()) {
            err.println("Invalid section delimiter: " + split.delimiterError().orElseThrow());
            return EXIT_BAD_DELIMITER;
        }
        if (config.listSections()) {
            for (Section section : split.sections()) {
                out.println("§" + section.number() + "\t" + section.preview());
            }
            return EXIT_OK;
        }

        if (!applyConstraints(session, config)) {
            return EXIT_INVALID_CONSTRAINTS;
        }

        ShuffleOutcome outcome = session.shuffle();
        switch (outcome.status()) {
            case TOO_FEW_SECTIONS -> LOGGER.warn("Manuscript has {} section(s); nothing to shuffle", split.sections().size());
            case INVALID_CONSTRAINTS -> {
                reportConstraintErrors(session);
                return EXIT_INVALID_CONSTRAINTS;
            }
            case PARADOX -> {
                reportParadoxes(session);
                return EXIT_PARADOX;
            }
            case SHUFFLED -> {
            }
        }

        // A single section is written back unchanged.
        OrderingResult ordering = outcome.ordering()
                .orElseGet(() -> new OrderingResult(
                        IntStream.range(0, split.sections().size()).boxed().toList(), split.texts()));
        ManuscriptAssembler assembler = new ManuscriptAssembler(config.joinDelimiter());
        String shuffled = assembler.assemble(ordering, session.delimiter(), session.delimiterMode());
        if (config.output().isPresent()) {
            manuscriptWriter.write(config.output().get(), shuffled, config.stageOutput());
        } else {
            out.println(shuffled);
        }
        return EXIT_OK;
    }

    private String readManuscript(Config config) {
        try {
            return Files.readString(config.manuscript(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read manuscript: " + config.manuscript(), ex);
        }
    }

    private boolean applyConstraints(ShuffleSession session, Config config) {
        int count = session.sections().size();
        boolean valid = true;
        if (config.fixFirst() && count > 0) {
            session.setFixed(0, true);
        }
        if (config.fixLast() && count > 0) {
            session.setFixed(count - 1, true);
        }
        for (Map.Entry<Integer, String> entry : config.successorLists().entrySet()) {
            int number = entry.getKey();
            if (number > count) {
                err.println("§" + number + ": no such section (the manuscript has " + count + " sections)");
                valid = false;
                continue;
            }
            session.editSuccessors(number - 1, entry.getValue());
        }
        if (!session.constraints().readyForValidation()) {
            reportConstraintErrors(session);
            valid = false;
        }
        return valid;
    }

    private void reportConstraintErrors(ShuffleSession session) {
        for (int index = 0; index < session.constraints().size(); index++) {
            int number = index + 1;
            Constraint constraint = session.constraint(index);
            if (!constraint.syntacticallyValid()) {
                err.println("§" + number + ": invalid list of sections '" + constraint.rawInput()
                        + "'; expected comma-separated section numbers such as 2,3");
            }
            constraint.referenceError().ifPresent(message -> err.println("§" + number + ": " + message));
        }
    }

    private void reportParadoxes(ShuffleSession session) {
        for (int index = 0; index < session.constraints().size(); index++) {
            int number = index + 1;
            session.constraint(index).paradoxMessage()
                    .ifPresent(message -> err.print("§" + number + ": " + message));
        }
        err.flush();
    }
}
