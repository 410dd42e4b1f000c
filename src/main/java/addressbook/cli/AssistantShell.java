package addressbook.cli;

import addressbook.command.CommandDispatcher;
import addressbook.command.CommandParser;
import addressbook.command.ParsedCommand;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Interactive read-dispatch-print loop over standard input.
 *
 * <p>Disabled with {@code app.shell.enabled=false}, which the Spring context
 * tests use so that starting the application does not block on input.
 */
@Component
@ConditionalOnProperty(name = "app.shell.enabled", havingValue = "true", matchIfMissing = true)
public class AssistantShell implements CommandLineRunner {

    private static final Logger LOG = LoggerFactory.getLogger(AssistantShell.class);

    static final String WELCOME = "Welcome to the assistant bot!";
    static final String PROMPT = "Enter a command: ";
    static final String GOODBYE = "Good bye!";
    static final String GREETING = "How can I help you?";
    static final String EMPTY_INPUT = "Enter a command.";
    static final String INVALID_COMMAND = "Invalid command.";

    private static final Set<String> EXIT_COMMANDS = Set.of("close", "exit");
    private static final String HELLO_COMMAND = "hello";

    private final CommandDispatcher dispatcher;

    public AssistantShell(final CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void run(final String... args) {
        final BufferedReader in = new BufferedReader(
                new InputStreamReader(System.in, StandardCharsets.UTF_8));
        run(in, System.out);
    }

    /**
     * Runs the loop until {@code close}, {@code exit}, or end of input.
     *
     * @param in  line source
     * @param out destination for prompts and replies
     */
    public void run(final BufferedReader in, final PrintStream out) {
        LOG.debug("Assistant shell started");
        out.println(WELCOME);
        while (true) {
            out.print(PROMPT);
            out.flush();
            final String line = readLine(in);
            if (line == null) {
                out.println();
                out.println(GOODBYE);
                break;
            }
            final ParsedCommand command = CommandParser.parse(line);
            if (command.isEmpty()) {
                out.println(EMPTY_INPUT);
                continue;
            }
            if (EXIT_COMMANDS.contains(command.name())) {
                out.println(GOODBYE);
                break;
            }
            if (HELLO_COMMAND.equals(command.name())) {
                out.println(GREETING);
                continue;
            }
            final Optional<String> reply = dispatcher.dispatch(command);
            out.println(reply.orElse(INVALID_COMMAND));
        }
        LOG.debug("Assistant shell stopped");
    }

    private static String readLine(final BufferedReader in) {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read command input", e);
        }
    }
}
