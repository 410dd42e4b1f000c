package addressbook.domain;

/**
 * Shared validation helpers for the address book value types.
 *
 * <p>Every helper throws {@link IllegalArgumentException} with a message that
 * starts with the supplied label, so callers can render the message directly.
 */
public final class Validation {

    private Validation() {
        // utility class
    }

    /**
     * Ensures the value is neither null nor blank.
     *
     * @param value the value to check
     * @param label field name used in the error message
     * @return the value, untouched
     * @throws IllegalArgumentException if the value is null or blank
     */
    public static String validateNotBlank(final String value, final String label) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(label + " must not be null or blank");
        }
        return value;
    }

    /**
     * Ensures the value is non-null.
     *
     * @param value the value to check
     * @param label field name used in the error message
     * @param <T>   value type
     * @return the value
     * @throws IllegalArgumentException if the value is null
     */
    public static <T> T validateNotNull(final T value, final String label) {
        if (value == null) {
            throw new IllegalArgumentException(label + " must not be null");
        }
        return value;
    }

    /**
     * Ensures the value is made of ASCII digits only and has exactly the given length.
     *
     * <p>The digit check runs first, so an empty string is reported as a digit
     * violation rather than a length violation.
     *
     * @param value  the value to check
     * @param label  field name used in the error message
     * @param length required number of digits
     * @return the value, untouched
     * @throws IllegalArgumentException if the value is null, contains a non-digit, or has the wrong length
     */
    public static String validateDigits(final String value, final String label, final int length) {
        validateNotNull(value, label);
        if (value.isEmpty() || !value.chars().allMatch(Validation::isAsciiDigit)) {
            throw new IllegalArgumentException(label + " must contain only digits");
        }
        if (value.length() != length) {
            throw new IllegalArgumentException(label + " must be exactly " + length + " digits");
        }
        return value;
    }

    private static boolean isAsciiDigit(final int ch) {
        return ch >= '0' && ch <= '9';
    }
}
