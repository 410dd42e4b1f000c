package addressbook.domain;

import addressbook.exception.DuplicatePhoneException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Contact domain object: one entry of the address book.
 *
 * <p>Enforces:
 * <ul>
 *   <li>name: required, not blank, immutable after construction</li>
 *   <li>phones: insertion ordered, each a valid {@link Phone}, no duplicates</li>
 *   <li>birthday: optional, a valid {@link Birthday} when present</li>
 * </ul>
 *
 * <p>Every mutator builds the new value object before touching state, so a
 * validation failure leaves the contact exactly as it was.
 *
 * <h2>Design Decisions</h2>
 * <ul>
 *   <li>Class is {@code final} to prevent subclassing that could bypass validation</li>
 *   <li>Name is immutable after construction (stable map keys)</li>
 *   <li>{@link #getPhones()} is a read-only view; changes go through this class</li>
 * </ul>
 */
public final class Contact {

    /** Shown in {@link #describe()} when no birthday is set. */
    public static final String NO_BIRTHDAY = "—";

    private final Name name;
    private final List<Phone> phones = new ArrayList<>();
    private Birthday birthday;

    /**
     * Creates a contact with no phones and no birthday.
     *
     * @param name contact name (required, not blank)
     * @throws IllegalArgumentException if the name is null or blank
     */
    public Contact(final String name) {
        this.name = new Name(name);
    }

    public String getName() {
        return name.value();
    }

    /**
     * @return read-only view of the phones in insertion order
     */
    public List<Phone> getPhones() {
        return Collections.unmodifiableList(phones);
    }

    public Optional<Birthday> getBirthday() {
        return Optional.ofNullable(birthday);
    }

    /**
     * Adds a phone number to the end of the list.
     *
     * @param raw phone text
     * @throws IllegalArgumentException if the phone is invalid
     * @throws DuplicatePhoneException  if the contact already holds this number
     */
    public void addPhone(final String raw) {
        final Phone phone = new Phone(raw);
        if (phones.contains(phone)) {
            throw new DuplicatePhoneException();
        }
        phones.add(phone);
    }

    /**
     * Looks up a phone by exact text.
     *
     * @param raw phone text; invalid or null text simply finds nothing
     * @return the stored phone, or empty
     */
    public Optional<Phone> findPhone(final String raw) {
        return phones.stream()
                .filter(phone -> phone.matches(raw))
                .findFirst();
    }

    /**
     * Removes the first phone equal to the given text.
     *
     * @param raw phone text
     * @return true if a phone was removed
     */
    public boolean removePhone(final String raw) {
        final int index = indexOf(raw);
        if (index < 0) {
            return false;
        }
        phones.remove(index);
        return true;
    }

    /**
     * Replaces a phone in place, keeping its position in the list.
     *
     * <p>If {@code oldRaw} is not present nothing happens and {@code false} is
     * returned, even when {@code newRaw} is invalid. If it is present the new
     * value is validated first; on failure the list is left unchanged.
     *
     * @param oldRaw phone text to replace
     * @param newRaw replacement phone text
     * @return true if {@code oldRaw} was found and replaced
     * @throws IllegalArgumentException if {@code oldRaw} is present and {@code newRaw} is invalid
     * @throws DuplicatePhoneException  if {@code newRaw} is already held by another entry
     */
    public boolean editPhone(final String oldRaw, final String newRaw) {
        final int index = indexOf(oldRaw);
        if (index < 0) {
            return false;
        }
        final Phone replacement = new Phone(newRaw);
        final int existing = phones.indexOf(replacement);
        if (existing >= 0 && existing != index) {
            throw new DuplicatePhoneException();
        }
        phones.set(index, replacement);
        return true;
    }

    /**
     * Sets or overwrites the birthday.
     *
     * @param raw birthday text in {@code DD.MM.YYYY}
     * @throws IllegalArgumentException if the text is not a valid date in that format
     */
    public void addBirthday(final String raw) {
        this.birthday = new Birthday(raw);
    }

    /**
     * Renders a deterministic one-line summary such as
     * {@code John: phones=[1234567890; 5555555555], birthday=01.02.1990}.
     *
     * @return the summary
     */
    public String describe() {
        final String joinedPhones = phones.stream()
                .map(Phone::value)
                .collect(Collectors.joining("; "));
        final String renderedBirthday = birthday == null ? NO_BIRTHDAY : birthday.format();
        return name.value() + ": phones=[" + joinedPhones + "], birthday=" + renderedBirthday;
    }

    private int indexOf(final String raw) {
        for (int i = 0; i < phones.size(); i++) {
            if (phones.get(i).matches(raw)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return describe();
    }
}
