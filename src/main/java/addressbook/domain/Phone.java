package addressbook.domain;

/**
 * Phone number value object.
 *
 * <p>Enforces:
 * <ul>
 *   <li>value: required, ASCII digits only</li>
 *   <li>value: exactly {@value #LENGTH} characters</li>
 * </ul>
 *
 * <p>Immutable; equality is by the exact stored string.
 */
public final class Phone {

    /** Required number of digits. */
    public static final int LENGTH = 10;

    private final String value;

    /**
     * Creates a phone number after validating it.
     *
     * @param value the raw phone number
     * @throws IllegalArgumentException if the value is null, contains a non-digit,
     *                                  or is not exactly 10 digits long
     */
    public Phone(final String value) {
        this.value = Validation.validateDigits(value, "phone", LENGTH);
    }

    public String value() {
        return value;
    }

    /**
     * Returns whether this phone holds exactly the given raw text.
     *
     * @param raw raw phone text, may be null or invalid
     * @return true on an exact match
     */
    public boolean matches(final String raw) {
        return value.equals(raw);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Phone)) {
            return false;
        }
        return value.equals(((Phone) other).value);
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
