package addressbook.command;

import addressbook.AddressBook;
import addressbook.domain.Contact;
import addressbook.domain.Phone;
import addressbook.domain.UpcomingBirthday;
import addressbook.exception.ContactNotFoundException;
import addressbook.exception.MissingArgumentException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Handlers behind the shell commands.
 *
 * <p>Each public method matches {@link CommandHandler}, so {@link CommandDispatcher}
 * registers them as method references. Handlers throw on bad input and leave
 * rendering of those failures to {@link CommandErrorAdapter}.
 *
 * <p>New contacts are only stored once their first phone or birthday has
 * validated, so a rejected {@code add} or {@code add-birthday} leaves no empty
 * contact behind.
 */
@Component
public class ContactCommands {

    private final Clock clock;
    private final int windowDays;

    /**
     * @param clock      source of "today" for the birthdays report
     * @param windowDays look-ahead of the birthdays report, inclusive
     */
    public ContactCommands(
            final Clock clock,
            @Value("${app.birthdays.window-days:7}") final int windowDays) {
        if (windowDays < 0) {
            throw new IllegalArgumentException("app.birthdays.window-days must not be negative");
        }
        this.clock = clock;
        this.windowDays = windowDays;
    }

    /**
     * {@code add <name> [phone]}: creates the contact or adds a phone to it.
     */
    public String addContact(final List<String> args, final AddressBook book) {
        if (args.isEmpty()) {
            return "Error: Please provide at least a name.";
        }
        final String name = args.get(0);
        final String phone = args.size() > 1 ? args.get(1) : null;

        final Optional<Contact> existing = book.find(name);
        if (existing.isEmpty()) {
            final Contact contact = new Contact(name);
            if (phone == null) {
                book.addRecord(contact);
                return "Contact '" + name + "' created without phone.";
            }
            contact.addPhone(phone);
            book.addRecord(contact);
            return "Contact '" + name + "' created with phone " + phone + ".";
        }
        if (phone == null) {
            return "Contact '" + name + "' already exists.";
        }
        existing.get().addPhone(phone);
        return "Phone " + phone + " added to contact '" + name + "'.";
    }

    /**
     * {@code change <name> <old phone> <new phone>}.
     */
    public String changeContact(final List<String> args, final AddressBook book) {
        requireArgs(args, 3);
        final String name = args.get(0);
        final String oldPhone = args.get(1);
        final String newPhone = args.get(2);

        final Contact contact = requireContact(book, name);
        if (contact.editPhone(oldPhone, newPhone)) {
            return "Contact updated.";
        }
        return "Error: Phone '" + oldPhone + "' not found.";
    }

    /**
     * {@code phone <name>}: lists the contact's phones.
     */
    public String showPhone(final List<String> args, final AddressBook book) {
        requireArgs(args, 1);
        final String name = args.get(0);
        final Contact contact = requireContact(book, name);
        if (contact.getPhones().isEmpty()) {
            return "Contact '" + name + "' has no phones.";
        }
        return "Phones of " + name + ": " + joinPhones(contact);
    }

    /**
     * {@code all}: one line per contact, in address book order.
     */
    public String showAll(final List<String> args, final AddressBook book) {
        final List<Contact> contacts = book.getAll();
        if (contacts.isEmpty()) {
            return "No contacts found.";
        }
        return contacts.stream()
                .map(contact -> contact.getName() + ": " + joinPhones(contact))
                .collect(Collectors.joining("\n"));
    }

    /**
     * {@code add-birthday <name> <DD.MM.YYYY>}: creates the contact if needed.
     */
    public String addBirthday(final List<String> args, final AddressBook book) {
        requireArgs(args, 2);
        final String name = args.get(0);
        final String birthday = args.get(1);

        final Optional<Contact> existing = book.find(name);
        if (existing.isEmpty()) {
            final Contact contact = new Contact(name);
            contact.addBirthday(birthday);
            book.addRecord(contact);
            return "Contact '" + name + "' created with birthday " + birthday + ".";
        }
        existing.get().addBirthday(birthday);
        return "Birthday " + birthday + " added to contact '" + name + "'.";
    }

    /**
     * {@code show-birthday <name>}.
     */
    public String showBirthday(final List<String> args, final AddressBook book) {
        requireArgs(args, 1);
        final String name = args.get(0);
        final Contact contact = requireContact(book, name);
        return contact.getBirthday()
                .map(birthday -> "Birthday of " + name + " is " + birthday.format())
                .orElse("Error: Contact '" + name + "' has no birthday.");
    }

    /**
     * {@code birthdays}: the upcoming-birthdays report relative to the clock's today.
     */
    public String birthdays(final List<String> args, final AddressBook book) {
        final List<UpcomingBirthday> upcoming = book.upcomingBirthdays(LocalDate.now(clock), windowDays);
        if (upcoming.isEmpty()) {
            return "No upcoming birthdays.";
        }
        return upcoming.stream()
                .map(entry -> entry.name() + ": " + entry.formattedCongratulationDate())
                .collect(Collectors.joining("\n", "Upcoming birthdays:\n", ""));
    }

    /**
     * {@code remove-phone <name> <phone>}.
     */
    public String removePhone(final List<String> args, final AddressBook book) {
        requireArgs(args, 2);
        final String name = args.get(0);
        final String phone = args.get(1);
        final Contact contact = requireContact(book, name);
        if (contact.removePhone(phone)) {
            return "Phone " + phone + " removed from contact '" + name + "'.";
        }
        return "Error: Phone '" + phone + "' not found.";
    }

    /**
     * {@code delete <name>}.
     */
    public String deleteContact(final List<String> args, final AddressBook book) {
        requireArgs(args, 1);
        final String name = args.get(0);
        if (!book.delete(name)) {
            throw new ContactNotFoundException(name);
        }
        return "Contact '" + name + "' deleted.";
    }

    private static void requireArgs(final List<String> args, final int count) {
        if (args.size() < count) {
            throw new MissingArgumentException(count, args.size());
        }
    }

    private static Contact requireContact(final AddressBook book, final String name) {
        return book.find(name).orElseThrow(() -> new ContactNotFoundException(name));
    }

    private static String joinPhones(final Contact contact) {
        return contact.getPhones().stream()
                .map(Phone::value)
                .collect(Collectors.joining(", "));
    }
}
