package com.quorumfix.orchestrator.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only lookup of the configured providers.
 *
 * Built once at startup from {@link ProviderProperties}; every invalid
 * profile fails the application context rather than surfacing mid-run.
 * After construction the registry is never mutated, so concurrent reads
 * from fan-out tasks need no synchronisation.
 *
 * <p>An empty registry is allowed to start; {@link #select} rejects it
 * before any request is built.
 */
@Component
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    // Enum order: also the order responses come back from a fan-out.
    private final Map<ProviderId, ProviderProfile> profiles;

    @Autowired
    public ProviderRegistry(ProviderProperties properties) {
        this(fromProperties(properties));
    }

    private ProviderRegistry(List<ProviderProfile> profiles) {
        Map<ProviderId, ProviderProfile> byId = new EnumMap<>(ProviderId.class);
        for (ProviderProfile profile : profiles) {
            if (byId.put(profile.id(), profile) != null) {
                throw new ProviderConfigurationException("Provider " + profile.id().tag() + " configured twice");
            }
            log.info("Registered provider '{}' model={} weight={} timeout={}",
                    profile.id().tag(), profile.model(), profile.weight(), profile.timeout());
        }
        this.profiles = Collections.unmodifiableMap(byId);
    }

    public static ProviderRegistry of(List<ProviderProfile> profiles) {
        return new ProviderRegistry(profiles);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public List<ProviderProfile> all() {
        return List.copyOf(profiles.values());
    }

    public ProviderProfile get(ProviderId id) {
        ProviderProfile profile = profiles.get(id);
        if (profile == null) {
            throw new ProviderConfigurationException("Provider " + id.tag() + " is not configured");
        }
        return profile;
    }

    public boolean isEmpty() {
        return profiles.isEmpty();
    }

    /** Voting weight per configured provider, in registry order. */
    public Map<ProviderId, Double> weights() {
        Map<ProviderId, Double> weights = new LinkedHashMap<>();
        profiles.forEach((id, p) -> weights.put(id, p.weight()));
        return weights;
    }

    /**
     * Resolve the providers for one fan-out.
     *
     * @param subset requested ids, or {@code null} for every configured provider
     * @throws ProviderConfigurationException if the result would be empty or
     *         names a provider that is not configured
     */
    public List<ProviderProfile> select(Collection<ProviderId> subset) {
        if (profiles.isEmpty()) {
            throw new ProviderConfigurationException("No LLM providers are configured");
        }
        if (subset == null) {
            return all();
        }
        if (subset.isEmpty()) {
            throw new ProviderConfigurationException("Provider subset is empty");
        }
        List<String> unknown = subset.stream()
                .filter(id -> !profiles.containsKey(id))
                .map(ProviderId::tag)
                .toList();
        if (!unknown.isEmpty()) {
            throw new ProviderConfigurationException("Requested providers are not configured: " + unknown);
        }
        // Registry order, whatever order the caller used.
        return profiles.values().stream()
                .filter(p -> subset.contains(p.id()))
                .toList();
    }

    private static List<ProviderProfile> fromProperties(ProviderProperties properties) {
        return properties.getProviders().entrySet().stream()
                .filter(e -> e.getValue().isEnabled())
                .map(e -> e.getValue().toProfile(e.getKey()))
                .toList();
    }
}
