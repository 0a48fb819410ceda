package io.storyshuffler.config;

import io.storyshuffler.cli.CliArguments;
import io.storyshuffler.manuscript.DelimiterMode;
import io.storyshuffler.manuscript.ManuscriptSplitter;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_DELIMITER = "SHUFFLER_DELIMITER";
    static final String ENV_DELIMITER_MODE = "SHUFFLER_DELIMITER_MODE";
    static final String ENV_SEED = "SHUFFLER_SEED";
    static final String ENV_OUTPUT = "SHUFFLER_OUTPUT";
    static final String ENV_JOIN_DELIMITER = "SHUFFLER_JOIN_DELIMITER";
    static final String ENV_STAGE_OUTPUT = "SHUFFLER_STAGE_OUTPUT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.manuscript() == null) {
            throw new IllegalArgumentException("manuscript file must be provided");
        }

        String delimiter = Optional.ofNullable(arguments.delimiter())
                .or(() -> environmentReader.get(ENV_DELIMITER))
                .orElse(ManuscriptSplitter.DEFAULT_DELIMITER);
        DelimiterMode delimiterMode = resolveDelimiterMode(arguments);

        Optional<Long> seed = Optional.ofNullable(arguments.seed())
                .or(() -> environmentReader.get(ENV_SEED)
                        .filter(ConfigLoader::isNotBlank)
                        .map(String::trim)
                        .map(ConfigLoader::parseSeed));

        Optional<Path> output = Optional.ofNullable(arguments.output())
                .or(() -> environmentReader.get(ENV_OUTPUT)
                        .filter(ConfigLoader::isNotBlank)
                        .map(String::trim)
                        .map(Path::of));

        Optional<String> joinDelimiter = Optional.ofNullable(arguments.joinDelimiter())
                .or(() -> environmentReader.get(ENV_JOIN_DELIMITER));

        // The environment default only applies to runs that write a file; stdout runs ignore it.
        boolean stageOutput = arguments.stage() || (output.isPresent() && environmentReader.get(ENV_STAGE_OUTPUT)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false));

        return new Config(arguments.manuscript(), delimiter, delimiterMode,
                arguments.fixFirst(), arguments.fixLast(), arguments.successorLists(),
                seed, output, joinDelimiter, stageOutput, arguments.listSections(), resolveLogFormat(arguments));
    }

    private DelimiterMode resolveDelimiterMode(CliArguments arguments) {
        if (arguments.regex()) {
            return DelimiterMode.REGEX;
        }
        return environmentReader.get(ENV_DELIMITER_MODE)
                .filter(ConfigLoader::isNotBlank)
                .map(DelimiterMode::from)
                .orElse(DelimiterMode.LITERAL);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static long parseSeed(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_SEED + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
