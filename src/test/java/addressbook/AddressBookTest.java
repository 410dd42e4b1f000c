package addressbook;

import addressbook.domain.Contact;
import addressbook.domain.UpcomingBirthday;
import addressbook.support.TestDates;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for {@link AddressBook}: keyed storage and the upcoming-birthdays query.
 */
class AddressBookTest {

    private AddressBook book;

    @BeforeEach
    void setUp() {
        book = new AddressBook();
    }

    private Contact contactWithBirthday(final String name, final String birthday) {
        final Contact contact = new Contact(name);
        contact.addBirthday(birthday);
        book.addRecord(contact);
        return contact;
    }

    // ==================== Storage ====================

    @Test
    void testAddAndFind() {
        Contact john = new Contact("John");
        book.addRecord(john);

        assertThat(book.find("John")).containsSame(john);
        assertThat(book.find("john")).isEmpty();
        assertThat(book.find("Jo")).isEmpty();
        assertThat(book.size()).isEqualTo(1);
    }

    @Test
    void testAddRecordRejectsNull() {
        assertThatThrownBy(() -> book.addRecord(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("contact must not be null");
    }

    /**
     * A second contact under the same name replaces the first; nothing is merged.
     */
    @Test
    void testAddRecordReplacesWithoutMerging() {
        Contact first = new Contact("John");
        first.addPhone("1111111111");
        first.addBirthday("01.01.1990");
        book.addRecord(first);

        Contact second = new Contact("John");
        second.addPhone("2222222222");
        book.addRecord(second);

        Contact stored = book.find("John").orElseThrow();
        assertThat(stored).isSameAs(second);
        assertThat(stored.findPhone("1111111111")).isEmpty();
        assertThat(stored.getBirthday()).isEmpty();
        assertThat(book.size()).isEqualTo(1);
    }

    @Test
    void testDeleteMissingNameLeavesBookUnchanged() {
        book.addRecord(new Contact("John"));

        assertThat(book.delete("Jane")).isFalse();
        assertThat(book.getAll()).extracting(Contact::getName).containsExactly("John");
    }

    @Test
    void testDeleteRemovesExactlyThatEntry() {
        book.addRecord(new Contact("John"));
        book.addRecord(new Contact("Jane"));

        assertThat(book.delete("John")).isTrue();
        assertThat(book.find("John")).isEmpty();
        assertThat(book.getAll()).extracting(Contact::getName).containsExactly("Jane");
    }

    @Test
    void testGetAllKeepsInsertionOrderAndIsASnapshot() {
        book.addRecord(new Contact("Zed"));
        book.addRecord(new Contact("Amy"));
        book.addRecord(new Contact("Max"));

        List<Contact> all = book.getAll();
        book.delete("Amy");

        assertThat(all).extracting(Contact::getName).containsExactly("Zed", "Amy", "Max");
        assertThatThrownBy(() -> all.add(new Contact("Eve")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(book.isEmpty()).isFalse();
    }

    // ==================== Upcoming birthdays ====================

    /**
     * Friday 17.05.2024: Monday stays, Saturday and Sunday move to Monday,
     * eight days out is excluded.
     */
    @Test
    void testUpcomingBirthdaysAroundAWeekend() {
        contactWithBirthday("Anna", "20.05.2024");
        contactWithBirthday("Ben", "18.05.2024");
        contactWithBirthday("Cara", "19.05.2024");
        contactWithBirthday("Drew", "25.05.2024");

        List<UpcomingBirthday> upcoming = book.upcomingBirthdays(TestDates.FRIDAY);

        assertThat(upcoming)
                .extracting(UpcomingBirthday::name, UpcomingBirthday::formattedCongratulationDate)
                .containsExactly(
                        tuple("Anna", "20.05.2024"),
                        tuple("Ben", "20.05.2024"),
                        tuple("Cara", "20.05.2024"));
    }

    /**
     * The birth year is irrelevant; only day and month are carried into the current year.
     */
    @CsvSource({
            // birthday,   expected congratulation (or 'none')
            "17.05.1990, 17.05.2024",   // today counts
            "21.05.1985, 21.05.2024",   // Tuesday
            "24.05.2000, 24.05.2024",   // exactly seven days out counts
            "25.05.2000, none",         // eight days out
            "16.05.1990, none",         // passed yesterday, next one is a year away
            "18.05.1979, 20.05.2024",   // Saturday, +2
            "19.05.1979, 20.05.2024"    // Sunday, +1
    })
    @ParameterizedTest
    void testUpcomingBirthdayWindow(String birthday, String expected) {
        contactWithBirthday("Someone", birthday);

        List<UpcomingBirthday> upcoming = book.upcomingBirthdays(TestDates.FRIDAY);

        if ("none".equals(expected)) {
            assertThat(upcoming).isEmpty();
        } else {
            assertThat(upcoming).singleElement()
                    .extracting(UpcomingBirthday::formattedCongratulationDate)
                    .isEqualTo(expected);
        }
    }

    @Test
    void testUpcomingBirthdaysWrapIntoNextYear() {
        LocalDate sunday = LocalDate.of(2024, 12, 29);
        contactWithBirthday("NewYear", "01.01.1995");
        contactWithBirthday("Weekend", "04.01.1995");
        contactWithBirthday("Gone", "28.12.1995");

        List<UpcomingBirthday> upcoming = book.upcomingBirthdays(sunday);

        assertThat(upcoming)
                .extracting(UpcomingBirthday::congratulationDate)
                .containsExactly(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 6));
    }

    /**
     * A birthday on today's Saturday is congratulated on the Monday after.
     */
    @Test
    void testBirthdayTodayOnSaturdayMovesToMonday() {
        contactWithBirthday("Sat", "18.05.2000");

        List<UpcomingBirthday> upcoming = book.upcomingBirthdays(LocalDate.of(2024, 5, 18));

        assertThat(upcoming).singleElement()
                .extracting(UpcomingBirthday::congratulationDate)
                .isEqualTo(LocalDate.of(2024, 5, 20));
    }

    @Test
    void testLeapDayBirthdayFallsBackToTwentyEighth() {
        contactWithBirthday("Leap", "29.02.2000");

        List<UpcomingBirthday> upcoming = book.upcomingBirthdays(TestDates.NON_LEAP_WEDNESDAY);

        assertThat(upcoming).singleElement()
                .extracting(UpcomingBirthday::formattedCongratulationDate)
                .isEqualTo("28.02.2025");
    }

    @Test
    void testContactsWithoutBirthdayNeverAppear() {
        Contact noBirthday = new Contact("Nobody");
        noBirthday.addPhone("1234567890");
        book.addRecord(noBirthday);
        contactWithBirthday("Anna", "20.05.1990");

        assertThat(book.upcomingBirthdays(TestDates.FRIDAY))
                .extracting(UpcomingBirthday::name)
                .containsExactly("Anna");
    }

    /**
     * Output follows address book order, not date order.
     */
    @Test
    void testUpcomingBirthdaysKeepInsertionOrder() {
        contactWithBirthday("Late", "23.05.1990");
        contactWithBirthday("Early", "17.05.1990");
        contactWithBirthday("Middle", "21.05.1990");

        assertThat(book.upcomingBirthdays(TestDates.FRIDAY))
                .extracting(UpcomingBirthday::name)
                .containsExactly("Late", "Early", "Middle");
    }

    @Test
    void testCustomWindow() {
        contactWithBirthday("Today", "17.05.1990");
        contactWithBirthday("Tomorrow", "18.05.1990");
        contactWithBirthday("Later", "30.05.1990");

        assertThat(book.upcomingBirthdays(TestDates.FRIDAY, 0))
                .extracting(UpcomingBirthday::name)
                .containsExactly("Today");
        assertThat(book.upcomingBirthdays(TestDates.FRIDAY, 14))
                .extracting(UpcomingBirthday::name)
                .containsExactly("Today", "Tomorrow", "Later");
    }

    @Test
    void testUpcomingBirthdaysRejectsBadArguments() {
        assertThatThrownBy(() -> book.upcomingBirthdays(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("today must not be null");
        assertThatThrownBy(() -> book.upcomingBirthdays(TestDates.FRIDAY, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("windowDays must not be negative");
    }

    @Test
    void testEmptyBookHasNoUpcomingBirthdays() {
        assertThat(book.upcomingBirthdays(TestDates.FRIDAY)).isEmpty();
    }
}
