package io.storyshuffler.cli;

import io.storyshuffler.config.LogFormat;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import picocli.CommandLine;

@CommandLine.Command(name = "story-shuffler", mixinStandardHelpOptions = true, version = "story-shuffler 1.0.0",
        description = "Shuffles the sections of a manuscript while honoring ordering constraints")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", description = "Manuscript file to shuffle", paramLabel = "MANUSCRIPT")
    private Path manuscript;

    @CommandLine.Option(names = {"-d", "--delimiter"}, description = "Section break (default: * * *)", paramLabel = "TEXT")
    private String delimiter;

    @CommandLine.Option(names = "--regex", description = "Treat the section break as a regular expression")
    private boolean regex;

    @CommandLine.Option(names = "--fix-first", description = "Keep the first section in place")
    private boolean fixFirst;

    @CommandLine.Option(names = "--fix-last", description = "Keep the last section in place")
    private boolean fixLast;

    @CommandLine.Option(names = "--before", paramLabel = "N=LIST",
            description = "Section N must come before every section in the comma-separated LIST, e.g. 2=4,5")
    private Map<Integer, String> successorLists = new LinkedHashMap<>();

    @CommandLine.Option(names = "--seed", description = "Seed for a reproducible shuffle", paramLabel = "SEED")
    private Long seed;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Write the shuffled manuscript here instead of stdout", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = "--join-delimiter", description = "Section break to use in the shuffled manuscript", paramLabel = "TEXT")
    private String joinDelimiter;

    @CommandLine.Option(names = "--stage", description = "Stage the output file when it lies in a Git work tree")
    private boolean stage;

    @CommandLine.Option(names = "--list-sections", description = "Print the numbered sections and exit")
    private boolean listSections;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path manuscript() {
        return manuscript;
    }

    public String delimiter() {
        return delimiter;
    }

    public boolean regex() {
        return regex;
    }

    public boolean fixFirst() {
        return fixFirst;
    }

    public boolean fixLast() {
        return fixLast;
    }

    public Map<Integer, String> successorLists() {
        return successorLists;
    }

    public Long seed() {
        return seed;
    }

    public Path output() {
        return output;
    }

    public String joinDelimiter() {
        return joinDelimiter;
    }

    public boolean stage() {
        return stage;
    }

    public boolean listSections() {
        return listSections;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
