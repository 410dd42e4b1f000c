package addressbook.command;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Splits an input line on whitespace into a command name and its arguments.
 *
 * <p>Only the command name is lower-cased; arguments are passed through untouched.
 */
public final class CommandParser {

    private CommandParser() {
        // utility class
    }

    /**
     * @param line raw input line, may be null
     * @return the parsed command, or {@link ParsedCommand#EMPTY} for blank input
     */
    public static ParsedCommand parse(final String line) {
        if (line == null || line.isBlank()) {
            return ParsedCommand.EMPTY;
        }
        final String[] tokens = line.trim().split("\\s+");
        final List<String> args = Arrays.asList(tokens).subList(1, tokens.length);
        return new ParsedCommand(tokens[0].toLowerCase(Locale.ROOT), args);
    }
}
