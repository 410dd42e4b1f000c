package addressbook.command;

import java.util.List;

/**
 * A command line split into its lower-cased name and raw arguments.
 *
 * @param name command name, or null for a blank line
 * @param args arguments as typed, never null
 */
public record ParsedCommand(String name, List<String> args) {

    /** Result for a blank input line. */
    public static final ParsedCommand EMPTY = new ParsedCommand(null, List.of());

    public ParsedCommand {
        args = args == null ? List.of() : List.copyOf(args);
    }

    public boolean isEmpty() {
        return name == null;
    }
}
