package com.quorumfix.orchestrator.provider;

/**
 * Thrown when the provider set cannot be used at all: nothing configured,
 * an invalid weight or timeout, or a request for a provider that does not
 * exist. Always raised before any network call is made.
 */
public class ProviderConfigurationException extends RuntimeException {

    public ProviderConfigurationException(String message) {
        super(message);
    }
}
