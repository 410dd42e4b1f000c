package addressbook.domain;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Birthday}.
 */
class BirthdayTest {

    @Test
    void testParsesDayMonthYear() {
        Birthday birthday = new Birthday("05.11.1990");

        assertThat(birthday.date()).isEqualTo(LocalDate.of(1990, 11, 5));
    }

    /**
     * Formatting gives back exactly the parsed text.
     */
    @ParameterizedTest
    @ValueSource(strings = {"01.01.2000", "29.02.2024", "31.12.1999", "09.09.0999"})
    void testFormatRoundTrips(String raw) {
        assertThat(Birthday.parse(raw).format()).isEqualTo(raw);
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {
            "",
            "1990-11-05",
            "5.11.1990",
            "05.11.90",
            "05.11.19901",
            "05/11/1990",
            "30.02.2024",
            "29.02.2023",
            "31.04.2024",
            "00.01.2024",
            "01.13.2024",
            " 05.11.1990",
            "aa.bb.cccc"
    })
    void testInvalidDateIsRejected(String raw) {
        assertThatThrownBy(() -> new Birthday(raw))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid date format. Use DD.MM.YYYY");
    }

    @Test
    void testDateConstructorRejectsNull() {
        assertThatThrownBy(() -> new Birthday((LocalDate) null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("birthday must not be null");
    }

    @Test
    void testEqualityIsByDate() {
        assertThat(new Birthday("01.02.2003"))
                .isEqualTo(new Birthday(LocalDate.of(2003, 2, 1)))
                .hasToString("01.02.2003");
    }
}
