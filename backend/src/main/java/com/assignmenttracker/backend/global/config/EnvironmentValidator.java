package com.assignmenttracker.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or out of range.
 * The signing key itself is checked when {@code JwtTokenProvider} is built.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final long MIN_EXPIRATION_MILLIS = 300_000L;
    static final long MAX_EXPIRATION_MILLIS = 86_400_000L;

    private static final String[] REQUIRED_PROPERTIES = {
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(property + " is required");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.expiration"))
                .filter(raw -> !raw.isBlank())
                .ifPresent(raw -> {
                    try {
                        long expiration = Long.parseLong(raw.trim());
                        if (expiration < MIN_EXPIRATION_MILLIS || expiration > MAX_EXPIRATION_MILLIS) {
                            problems.add("jwt.expiration must be between "
                                    + MIN_EXPIRATION_MILLIS + " and " + MAX_EXPIRATION_MILLIS + " ms");
                        }
                    } catch (NumberFormatException e) {
                        problems.add("jwt.expiration must be a number of milliseconds");
                    }
                });

        return problems;
    }
}
