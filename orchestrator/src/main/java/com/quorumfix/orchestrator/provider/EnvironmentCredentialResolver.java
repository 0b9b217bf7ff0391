package com.quorumfix.orchestrator.provider;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves credential references through the Spring {@link Environment},
 * so a reference such as {@code OPENAI_API_KEY} can be satisfied by an
 * environment variable, a system property or an entry in application.yml.
 */
@Component
public class EnvironmentCredentialResolver implements CredentialResolver {

    private final Environment environment;

    public EnvironmentCredentialResolver(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Optional<String> resolve(String credentialRef) {
        if (credentialRef == null || credentialRef.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(environment.getProperty(credentialRef))
                .map(String::strip)
                .filter(v -> !v.isEmpty());
    }
}
