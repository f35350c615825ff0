package com.studio45.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "your-secret-key-change-this-in-production";
    static final int MIN_SECRET_BYTES = 32;

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.frontend-url"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(property);
            if (value == null || value.isBlank()) {
                problems.add(property + ": missing");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(secret -> !secret.isBlank())
                .ifPresent(secret -> {
                    if (PLACEHOLDER_SECRET.equals(secret)) {
                        problems.add("jwt.secret: replace the placeholder value with a random secret");
                    } else if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
                        problems.add("jwt.secret: must be at least " + MIN_SECRET_BYTES + " bytes");
                    }
                });

        Optional.ofNullable(environment.getProperty("jwt.expiration"))
                .filter(value -> !value.isBlank())
                .ifPresent(value -> {
                    try {
                        Duration expiration = DurationStyle.detectAndParse(value);
                        if (expiration.isNegative() || expiration.isZero()) {
                            problems.add("jwt.expiration: must be positive");
                        }
                    } catch (IllegalArgumentException ex) {
                        problems.add("jwt.expiration: not a duration (" + value + ")");
                    }
                });

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration check failed: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }

        log.info("Configuration check passed");
    }
}
