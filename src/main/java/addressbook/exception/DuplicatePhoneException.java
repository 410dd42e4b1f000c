package addressbook.exception;

/**
 * Thrown when a contact already holds the phone number being added.
 */
public class DuplicatePhoneException extends DuplicateResourceException {

    /** Message shown to the user. */
    public static final String MESSAGE = "This phone is already added.";

    public DuplicatePhoneException() {
        super(MESSAGE);
    }
}
