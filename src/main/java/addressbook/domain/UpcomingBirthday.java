package addressbook.domain;

import java.time.LocalDate;

/**
 * One entry of the upcoming-birthdays report.
 *
 * @param name               contact name
 * @param congratulationDate date the greeting is due, already moved off the weekend
 */
public record UpcomingBirthday(String name, LocalDate congratulationDate) {

    /**
     * @return the congratulation date in {@code DD.MM.YYYY}
     */
    public String formattedCongratulationDate() {
        return Birthday.FORMATTER.format(congratulationDate);
    }
}
