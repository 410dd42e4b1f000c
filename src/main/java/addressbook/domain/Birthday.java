package addressbook.domain;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;

/**
 * Birthday value object.
 *
 * <p>Parsed from and rendered to the fixed {@code DD.MM.YYYY} text format.
 * Strict resolution rejects impossible calendar dates such as {@code 30.02.2024}.
 */
public final class Birthday {

    /** Human-readable form of the accepted pattern, used in error messages. */
    public static final String DISPLAY_PATTERN = "DD.MM.YYYY";

    /** Formatter shared by every date rendered in the application. */
    public static final DateTimeFormatter FORMATTER = new DateTimeFormatterBuilder()
            .appendPattern("dd.MM.")
            .appendValue(ChronoField.YEAR, 4)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private static final String INVALID_FORMAT = "Invalid date format. Use " + DISPLAY_PATTERN;

    private final LocalDate date;

    /**
     * Parses a birthday from {@code DD.MM.YYYY} text.
     *
     * @param raw the text to parse
     * @throws IllegalArgumentException if the text is null, malformed, or not a real date
     */
    public Birthday(final String raw) {
        this.date = parseDate(raw);
    }

    /**
     * Wraps an already resolved date.
     *
     * @param date the calendar date (required)
     * @throws IllegalArgumentException if the date is null
     */
    public Birthday(final LocalDate date) {
        this.date = Validation.validateNotNull(date, "birthday");
    }

    /**
     * Factory alias for {@link #Birthday(String)}.
     *
     * @param raw the text to parse
     * @return the parsed birthday
     * @throws IllegalArgumentException if the text is null, malformed, or not a real date
     */
    public static Birthday parse(final String raw) {
        return new Birthday(raw);
    }

    public LocalDate date() {
        return date;
    }

    /**
     * Renders the birthday back to {@code DD.MM.YYYY}.
     *
     * @return the formatted date
     */
    public String format() {
        return FORMATTER.format(date);
    }

    private static LocalDate parseDate(final String raw) {
        if (raw == null) {
            throw new IllegalArgumentException(INVALID_FORMAT);
        }
        try {
            return LocalDate.parse(raw, FORMATTER);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(INVALID_FORMAT, e);
        }
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Birthday)) {
            return false;
        }
        return date.equals(((Birthday) other).date);
    }

    @Override
    public int hashCode() {
        return date.hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
