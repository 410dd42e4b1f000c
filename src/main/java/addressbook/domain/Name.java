package addressbook.domain;

/**
 * Contact name value object; the address book key.
 *
 * <p>Stored exactly as given so lookups match the raw command argument.
 */
public final class Name {

    private final String value;

    /**
     * @param value contact name (required, not blank)
     * @throws IllegalArgumentException if the value is null or blank
     */
    public Name(final String value) {
        this.value = Validation.validateNotBlank(value, "name");
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Name)) {
            return false;
        }
        return value.equals(((Name) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
