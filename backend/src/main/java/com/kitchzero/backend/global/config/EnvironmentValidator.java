package com.kitchzero.backend.global.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Validates the security-relevant configuration once the context is up and refuses to serve traffic when
 * a required key is missing or the token secrets are unusable.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String ACCESS_SECRET = "app.auth.jwt.access-secret";
    static final String REFRESH_SECRET = "app.auth.jwt.refresh-secret";
    private static final int MIN_SECRET_LENGTH = 32;

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            ACCESS_SECRET,
            REFRESH_SECRET,
            "app.auth.jwt.issuer",
            "app.auth.jwt.audience"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Security configuration validated");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_PROPERTIES) {
            if (read(key).isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        Optional<String> accessSecret = read(ACCESS_SECRET);
        Optional<String> refreshSecret = read(REFRESH_SECRET);
        accessSecret.filter(secret -> secret.length() < MIN_SECRET_LENGTH)
                .ifPresent(secret -> problems.add(ACCESS_SECRET + " must be at least " + MIN_SECRET_LENGTH + " characters"));
        refreshSecret.filter(secret -> secret.length() < MIN_SECRET_LENGTH)
                .ifPresent(secret -> problems.add(REFRESH_SECRET + " must be at least " + MIN_SECRET_LENGTH + " characters"));
        if (accessSecret.isPresent() && accessSecret.equals(refreshSecret)) {
            problems.add(REFRESH_SECRET + " must differ from " + ACCESS_SECRET);
        }

        boolean production = Arrays.asList(environment.getActiveProfiles()).contains("prod");
        boolean secureCookies = environment.getProperty("app.cookies.secure", Boolean.class, false);
        if (production && !secureCookies) {
            problems.add("app.cookies.secure must be true in the prod profile");
        }
        return problems;
    }

    private Optional<String> read(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
