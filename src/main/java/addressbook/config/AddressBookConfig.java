package addressbook.config;

import addressbook.AddressBook;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the process-wide {@link AddressBook}.
 *
 * <p>{@link AddressBook} stays free of Spring annotations so it can be created
 * directly in unit tests.
 */
@Configuration
public class AddressBookConfig {

    @Bean
    public AddressBook addressBook() {
        return new AddressBook();
    }
}
