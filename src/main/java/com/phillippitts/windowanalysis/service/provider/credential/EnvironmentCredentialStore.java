package com.phillippitts.windowanalysis.service.provider.credential;

import com.phillippitts.windowanalysis.exception.CredentialNotFoundException;
import org.springframework.core.env.Environment;

import java.util.Objects;

/**
 * Resolves credentials through the Spring {@link Environment}: environment variables,
 * system properties and externalized configuration, in Spring's usual precedence.
 */
public class EnvironmentCredentialStore implements CredentialStore {

    private final Environment environment;

    public EnvironmentCredentialStore(Environment environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    @Override
    public String getCredential(String name) {
        if (name == null || name.isBlank()) {
            throw new CredentialNotFoundException(String.valueOf(name));
        }
        String value = environment.getProperty(name);
        if (value == null || value.isBlank()) {
            throw new CredentialNotFoundException(name);
        }
        return value.trim();
    }
}
