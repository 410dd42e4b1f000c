package addressbook.exception;

/**
 * Thrown when a command is invoked with fewer arguments than it needs.
 */
public class MissingArgumentException extends RuntimeException {

    /** Message shown to the user. */
    public static final String MESSAGE = "Enter the argument for the command.";

    private final int required;
    private final int supplied;

    /**
     * @param required number of arguments the command needs
     * @param supplied number of arguments actually given
     */
    public MissingArgumentException(final int required, final int supplied) {
        super(MESSAGE);
        this.required = required;
        this.supplied = supplied;
    }

    public int getRequired() {
        return required;
    }

    public int getSupplied() {
        return supplied;
    }
}
