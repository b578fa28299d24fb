package uk.gegc.quizdrill.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Process-wide random source used for sampling test questions.
 * Tests construct services with a seeded {@link Random} instead.
 */
@Configuration
public class RandomConfig {

    @Bean
    public Random questionSamplingRandom() {
        return new Random();
    }
}
