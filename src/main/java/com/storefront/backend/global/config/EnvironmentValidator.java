package com.storefront.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or still carry the development defaults.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "dev-jwt-secret-key-change-in-production-0123456789";
    static final long MIN_ACCESS_TTL_MILLIS = 60_000L;
    static final long MAX_ACCESS_TTL_MILLIS = 86_400_000L;

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "jwt.refresh-expiration",
            "app.frontend.url",
            "app.mail.from"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missing = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missing.add(property);
            }
        }

        if (environment.acceptsProfiles(Profiles.of("prod"))
                && DEV_JWT_SECRET.equals(environment.getProperty("jwt.secret"))) {
            invalid.add("jwt.secret: replace the development secret with a random value");
        }

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw.trim());
                if (expiration < MIN_ACCESS_TTL_MILLIS || expiration > MAX_ACCESS_TTL_MILLIS) {
                    invalid.add("jwt.expiration: must be between " + MIN_ACCESS_TTL_MILLIS + " and "
                            + MAX_ACCESS_TTL_MILLIS + " milliseconds");
                }
            } catch (NumberFormatException e) {
                invalid.add("jwt.expiration: must be a number of milliseconds");
            }
        });

        if (!missing.isEmpty() || !invalid.isEmpty()) {
            if (!missing.isEmpty()) {
                log.error("Missing required settings: {}", String.join(", ", missing));
            }
            invalid.forEach(problem -> log.error("Invalid setting {}", problem));
            throw new IllegalStateException("Environment validation failed");
        }

        log.info("Environment validation passed");
    }
}
