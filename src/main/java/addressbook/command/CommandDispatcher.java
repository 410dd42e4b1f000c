package addressbook.command;

import addressbook.AddressBook;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Dispatch table from command name to its guarded handler.
 *
 * <p>Session keywords ({@code hello}, {@code close}, {@code exit}) are handled
 * by the shell and are not registered here.
 */
@Component
public class CommandDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(CommandDispatcher.class);

    private final AddressBook book;
    private final Map<String, CommandHandler> handlers = new LinkedHashMap<>();

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton shares the application's AddressBook bean")
    public CommandDispatcher(final ContactCommands commands, final AddressBook book) {
        this.book = book;
        register("add", commands::addContact);
        register("change", commands::changeContact);
        register("phone", commands::showPhone);
        register("all", commands::showAll);
        register("add-birthday", commands::addBirthday);
        register("show-birthday", commands::showBirthday);
        register("birthdays", commands::birthdays);
        register("remove-phone", commands::removePhone);
        register("delete", commands::deleteContact);
    }

    private void register(final String name, final CommandHandler handler) {
        handlers.put(name, CommandErrorAdapter.guard(handler));
    }

    /**
     * @return registered command names in registration order
     */
    public Set<String> commandNames() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    /**
     * Runs a command against the address book.
     *
     * @param command parsed command
     * @return the handler's text, or empty if no handler is registered under that name
     */
    public Optional<String> dispatch(final ParsedCommand command) {
        if (command == null || command.isEmpty()) {
            return Optional.empty();
        }
        final CommandHandler handler = handlers.get(command.name());
        if (handler == null) {
            LOG.debug("Unknown command '{}'", command.name());
            return Optional.empty();
        }
        LOG.debug("Dispatching '{}' with {} argument(s)", command.name(), command.args().size());
        return Optional.of(handler.handle(command.args(), book));
    }

    /**
     * Convenience overload for callers holding raw arguments.
     *
     * @param name command name, already lower-cased
     * @param args raw arguments
     * @return the handler's text, or empty if no handler is registered under that name
     */
    public Optional<String> dispatch(final String name, final List<String> args) {
        return dispatch(new ParsedCommand(name, args));
    }
}
