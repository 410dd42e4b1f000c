package addressbook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the address book assistant.
 *
 * <p>Starts the Spring context; the interactive shell runs as a
 * {@link org.springframework.boot.CommandLineRunner} and the JVM exits once it returns.
 */
@SpringBootApplication
public class AddressBookApplication {

    public static void main(final String[] args) {
        SpringApplication.run(AddressBookApplication.class, args);
    }
}
