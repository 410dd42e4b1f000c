package addressbook;

import addressbook.domain.Birthday;
import addressbook.domain.Contact;
import addressbook.domain.UpcomingBirthday;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory address book: contacts keyed by name.
 *
 * Design:
 *  - Backed by a {@link LinkedHashMap}, so iteration follows insertion order.
 *  - Every public operation holds the same lock for its whole duration.
 *  - Callers mutate a {@link Contact} through its own methods; the address book
 *    never looks inside phones or birthdays itself.
 */
public final class AddressBook {

    /** Default look-ahead for {@link #upcomingBirthdays(LocalDate)}, inclusive. */
    public static final int DEFAULT_WINDOW_DAYS = 7;

    /** 0-based Monday-start index of the first weekend day (Saturday). */
    private static final int FIRST_WEEKEND_INDEX = 5;
    private static final int DAYS_IN_WEEK = 7;

    private final Map<String, Contact> contacts = new LinkedHashMap<>();
    private final Object lock = new Object();

    /**
     * Stores a contact under its name.
     *
     * <p>An existing entry with the same name is replaced, not merged: its
     * phones and birthday are gone afterwards.
     *
     * @param contact contact to store (must not be null)
     */
    public void addRecord(final Contact contact) {
        if (contact == null) {
            throw new IllegalArgumentException("contact must not be null");
        }
        synchronized (lock) {
            contacts.put(contact.getName(), contact);
        }
    }

    /**
     * Exact-key lookup; no trimming, no case folding.
     *
     * @param name contact name
     * @return the contact, or empty
     */
    public Optional<Contact> find(final String name) {
        synchronized (lock) {
            return Optional.ofNullable(contacts.get(name));
        }
    }

    /**
     * @param name contact name
     * @return true if a contact was removed
     */
    public boolean delete(final String name) {
        synchronized (lock) {
            return contacts.remove(name) != null;
        }
    }

    /**
     * @return snapshot of all contacts in insertion order
     */
    public List<Contact> getAll() {
        synchronized (lock) {
            return List.copyOf(contacts.values());
        }
    }

    public int size() {
        synchronized (lock) {
            return contacts.size();
        }
    }

    public boolean isEmpty() {
        synchronized (lock) {
            return contacts.isEmpty();
        }
    }

    /**
     * Birthdays falling in the next {@value #DEFAULT_WINDOW_DAYS} days.
     *
     * @param today the reference date
     * @return upcoming birthdays in address book order
     * @see #upcomingBirthdays(LocalDate, int)
     */
    public List<UpcomingBirthday> upcomingBirthdays(final LocalDate today) {
        return upcomingBirthdays(today, DEFAULT_WINDOW_DAYS);
    }

    /**
     * Lists contacts whose next birthday is between {@code today} and
     * {@code today + windowDays}, both ends inclusive.
     *
     * <p>A birthday already passed this year counts for next year. A birthday
     * landing on Saturday or Sunday is congratulated on the following Monday.
     * Output keeps address book order; it is not sorted by date.
     *
     * @param today      the reference date (required)
     * @param windowDays look-ahead in days, not negative
     * @return upcoming birthdays
     * @throws IllegalArgumentException if today is null or windowDays is negative
     */
    public List<UpcomingBirthday> upcomingBirthdays(final LocalDate today, final int windowDays) {
        if (today == null) {
            throw new IllegalArgumentException("today must not be null");
        }
        if (windowDays < 0) {
            throw new IllegalArgumentException("windowDays must not be negative");
        }
        final List<UpcomingBirthday> upcoming = new ArrayList<>();
        synchronized (lock) {
            for (Contact contact : contacts.values()) {
                final Optional<Birthday> birthday = contact.getBirthday();
                if (birthday.isEmpty()) {
                    continue;
                }
                final LocalDate next = nextOccurrence(birthday.get().date(), today);
                final long delta = ChronoUnit.DAYS.between(today, next);
                if (delta >= 0 && delta <= windowDays) {
                    upcoming.add(new UpcomingBirthday(contact.getName(), congratulationDate(next)));
                }
            }
        }
        return upcoming;
    }

    // 29 February resolves to 28 February in non-leap years (LocalDate#withYear)
    private static LocalDate nextOccurrence(final LocalDate birthday, final LocalDate today) {
        final LocalDate thisYear = birthday.withYear(today.getYear());
        if (thisYear.isBefore(today)) {
            return birthday.withYear(today.getYear() + 1);
        }
        return thisYear;
    }

    private static LocalDate congratulationDate(final LocalDate date) {
        final int weekdayIndex = date.getDayOfWeek().getValue() - 1;
        if (weekdayIndex >= FIRST_WEEKEND_INDEX) {
            return date.plusDays(DAYS_IN_WEEK - weekdayIndex);
        }
        return date;
    }
}
