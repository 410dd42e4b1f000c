package addressbook.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the application-wide {@link Clock}.
 *
 * <p>The {@code birthdays} command asks this clock for "today", so tests can
 * pin the date with {@link Clock#fixed} and deployments can choose the zone
 * that decides when a day starts.
 *
 * <h2>Configuration</h2>
 * <pre>
 * app:
 *   timezone: Europe/Kyiv
 * </pre>
 *
 * <p>If not specified, defaults to the JVM's system default zone.
 */
@Configuration
public class ClockConfig {

    /**
     * @param timezone the IANA timezone ID (e.g., "Europe/Kyiv", "UTC"); blank for the system zone
     * @return a Clock in the configured timezone
     */
    @Bean
    public Clock clock(@Value("${app.timezone:}") final String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(timezone));
    }
}
