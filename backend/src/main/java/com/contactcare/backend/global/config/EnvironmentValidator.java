package com.contactcare.backend.global.config;

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
 * Validates required configuration once the application is ready.
 * A missing datasource or an unusable cascade retry budget fails startup.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String CASCADE_MAX_ATTEMPTS = "contactcare.cascade.max-attempts";
    private static final int MAX_CASCADE_ATTEMPTS = 10;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration check failed: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration check passed");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        String[] requiredVars = {
            "spring.datasource.url",
            CASCADE_MAX_ATTEMPTS
        };
        for (String var : requiredVars) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(var + " is missing");
            }
        }

        Optional.ofNullable(environment.getProperty(CASCADE_MAX_ATTEMPTS)).ifPresent(raw -> {
            try {
                int attempts = Integer.parseInt(raw.trim());
                if (attempts < 1 || attempts > MAX_CASCADE_ATTEMPTS) {
                    problems.add(CASCADE_MAX_ATTEMPTS + " must be between 1 and " + MAX_CASCADE_ATTEMPTS);
                }
            } catch (NumberFormatException ex) {
                problems.add(CASCADE_MAX_ATTEMPTS + " must be a number");
            }
        });

        return problems;
    }
}
