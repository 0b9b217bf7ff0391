package com.quorumfix.orchestrator.provider;

import java.util.Optional;

/**
 * Looks up the API key behind a profile's credential reference.
 * Secret storage itself lives outside the orchestrator.
 */
@FunctionalInterface
public interface CredentialResolver {

    /** @return the secret, or empty when nothing is stored under {@code credentialRef} */
    Optional<String> resolve(String credentialRef);
}
