package io.storyshuffler.cli;

import io.storyshuffler.config.LogFormat;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import picocli.CommandLine;

/**
 * Accepts {@code text} or {@code json} in any case for {@code --log-format}.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            String accepted = Arrays.stream(LogFormat.values())
                    .map(format -> format.name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", "));
            throw new CommandLine.TypeConversionException(
                    "Unknown log format '" + value + "'; expected one of " + accepted);
        }
    }
}
