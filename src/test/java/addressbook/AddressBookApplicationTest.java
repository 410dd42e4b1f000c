package addressbook;

import addressbook.cli.AssistantShell;
import addressbook.command.CommandDispatcher;
import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the Spring context with the interactive shell switched off.
 */
@SpringBootTest(properties = {"app.shell.enabled=false", "app.timezone=UTC"})
class AddressBookApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private CommandDispatcher dispatcher;

    @Autowired
    private AddressBook book;

    @Autowired
    private Clock clock;

    @Test
    void contextWiresCommandsToTheSharedBook() {
        assertThat(dispatcher.dispatch("add", List.of("John", "1234567890")))
                .contains("Contact 'John' created with phone 1234567890.");
        assertThat(book.find("John")).isPresent();
    }

    @Test
    void shellIsNotCreatedWhenDisabled() {
        assertThat(context.getBeansOfType(AssistantShell.class)).isEmpty();
    }

    @Test
    void clockUsesConfiguredZone() {
        assertThat(clock.getZone()).isEqualTo(ZoneId.of("UTC"));
    }
}
