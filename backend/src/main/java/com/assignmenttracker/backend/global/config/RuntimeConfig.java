package com.assignmenttracker.backend.global.config;

import java.security.SecureRandom;
import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Time and randomness sources. Services take these as constructor arguments so tests can pin them.
 */
@Configuration
public class RuntimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecureRandom saltRandom() {
        return new SecureRandom();
    }
}
