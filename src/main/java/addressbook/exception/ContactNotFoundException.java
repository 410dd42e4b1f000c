package addressbook.exception;

/**
 * Thrown by command handlers when the named contact is not in the address book.
 *
 * <p>The address book itself reports absence through {@code Optional} and
 * booleans; this exception only exists at the command boundary, where
 * {@link addressbook.command.CommandErrorAdapter} renders it as its message.
 */
public class ContactNotFoundException extends RuntimeException {

    private final String contactName;

    /**
     * @param contactName the name that was looked up
     */
    public ContactNotFoundException(final String contactName) {
        super("Error: Contact '" + contactName + "' not found.");
        this.contactName = contactName;
    }

    public String getContactName() {
        return contactName;
    }
}
