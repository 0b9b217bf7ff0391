package com.quorumfix.orchestrator.provider;

import com.quorumfix.orchestrator.llm.WireFormat;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable description of one configured backend.
 *
 * Loaded once at startup by {@link ProviderRegistry} and shared read-only
 * by every fan-out task. {@code credentialRef} is the <em>name</em> of the
 * secret (an environment variable or property key), never the secret itself.
 */
public record ProviderProfile(
        ProviderId id,
        String     model,
        double     weight,
        Duration   timeout,
        int        maxTokens,
        URI        endpoint,
        WireFormat wireFormat,
        String     credentialRef,
        String     steering,
        double     temperature
) {
    public ProviderProfile {
        Objects.requireNonNull(id, "id");
        if (model == null || model.isBlank()) {
            throw new ProviderConfigurationException("Provider " + id.tag() + " has no model configured");
        }
        if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0.0) {
            throw new ProviderConfigurationException(
                    "Provider " + id.tag() + " has invalid weight " + weight + " (must be a finite value >= 0)");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ProviderConfigurationException(
                    "Provider " + id.tag() + " has invalid timeout " + timeout);
        }
        if (maxTokens <= 0) {
            throw new ProviderConfigurationException(
                    "Provider " + id.tag() + " has invalid max-tokens " + maxTokens);
        }
        if (endpoint == null) {
            throw new ProviderConfigurationException("Provider " + id.tag() + " has no endpoint configured");
        }
        if (wireFormat == null) {
            throw new ProviderConfigurationException("Provider " + id.tag() + " has no wire format configured");
        }
        if (steering == null || steering.isBlank()) {
            steering = id.defaultSteering();
        }
    }
}
