package addressbook.exception;

/**
 * Thrown when an operation would store a value that is already present.
 *
 * <p>Rendered as its message by {@link addressbook.command.CommandErrorAdapter}.
 *
 * @see DuplicatePhoneException
 */
public class DuplicateResourceException extends RuntimeException {

    /**
     * @param message descriptive message naming the duplicated value
     */
    public DuplicateResourceException(final String message) {
        super(message);
    }
}
