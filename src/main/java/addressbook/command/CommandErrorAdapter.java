package addressbook.command;

import addressbook.exception.ContactNotFoundException;
import addressbook.exception.DuplicateResourceException;
import addressbook.exception.MissingArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts handler failures into the text shown to the user.
 *
 * <p>Applied once per handler by {@link CommandDispatcher}; handlers themselves
 * never catch their own validation errors. Mapping:
 * <ul>
 *   <li>{@link IllegalArgumentException}: the exception message</li>
 *   <li>{@link DuplicateResourceException}: the exception message</li>
 *   <li>{@link ContactNotFoundException}: the exception message</li>
 *   <li>{@link MissingArgumentException}: {@value MissingArgumentException#MESSAGE}</li>
 *   <li>any other {@link RuntimeException}: a generic error line, logged at WARN</li>
 * </ul>
 */
public final class CommandErrorAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(CommandErrorAdapter.class);

    private CommandErrorAdapter() {
        // utility class
    }

    /**
     * Wraps a handler so that it always returns text.
     *
     * @param handler the handler to wrap
     * @return a handler that never throws a {@link RuntimeException}
     */
    public static CommandHandler guard(final CommandHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        return (args, book) -> {
            try {
                return handler.handle(args, book);
            } catch (RuntimeException e) {
                return render(e);
            }
        };
    }

    /**
     * @param error the failure raised by a handler
     * @return the user-facing text for it
     */
    static String render(final RuntimeException error) {
        if (error instanceof MissingArgumentException) {
            return MissingArgumentException.MESSAGE;
        }
        if (error instanceof IllegalArgumentException
                || error instanceof DuplicateResourceException
                || error instanceof ContactNotFoundException) {
            return error.getMessage();
        }
        LOG.warn("Unexpected command failure", error);
        return "Unexpected error: " + error.getMessage();
    }
}
