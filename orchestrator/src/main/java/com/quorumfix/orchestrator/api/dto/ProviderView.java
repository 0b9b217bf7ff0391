package com.quorumfix.orchestrator.api.dto;

import com.quorumfix.orchestrator.provider.ProviderProfile;

/**
 * A configured provider as listed by GET /repairs/providers. Credentials are
 * never exposed.
 */
public record ProviderView(
        String id,
        String model,
        double weight,
        long   timeoutSeconds,
        int    maxTokens,
        String endpoint,
        String wireFormat
) {
    public static ProviderView from(ProviderProfile p) {
        return new ProviderView(
                p.id().tag(),
                p.model(),
                p.weight(),
                p.timeout().toSeconds(),
                p.maxTokens(),
                p.endpoint().toString(),
                p.wireFormat().name()
        );
    }
}
