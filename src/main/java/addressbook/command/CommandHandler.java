package addressbook.command;

import addressbook.AddressBook;
import java.util.List;

/**
 * A single shell command.
 *
 * <p>Handlers may throw validation or lookup exceptions; the shell only ever
 * calls them through {@link CommandErrorAdapter#guard(CommandHandler)}, which
 * turns those exceptions into the returned text.
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * @param args raw arguments after the command name
     * @param book the address book to operate on
     * @return the text to show the user
     */
    String handle(List<String> args, AddressBook book);
}
