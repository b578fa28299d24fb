package uk.gegc.quizdrill.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Configuration for centralized Clock management.
 * Mistake timestamps and session creation times are read from this bean,
 * so tests can substitute a fixed clock.
 */
@Configuration
public class ClockConfig {

    /**
     * Default timezone for the application.
     * Can be overridden via application properties.
     */
    @Value("${app.timezone:UTC}")
    private String timezone;

    /**
     * Creates the application Clock in the configured timezone.
     *
     * @return Clock instance configured with the application timezone
     */
    @Bean
    public Clock clock() {
        String configuredZone = timezone == null || timezone.isBlank()
                ? "UTC"
                : timezone.trim();
        return Clock.system(ZoneId.of(configuredZone));
    }
}
