package com.quorumfix.orchestrator.agent;

import com.quorumfix.orchestrator.provider.ProviderId;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * One provider's answer to one fan-out, successful or not.
 *
 * Every selected provider yields exactly one of these per fan-out. A failed
 * call still produces a response, with {@code failure} set and an empty
 * {@code proposedFix}, so downstream code treats "no opinion" uniformly.
 * {@code confidence} is self-reported by the provider and is not trusted
 * beyond being clamped to [0,1].
 */
public record ProviderResponse(
        ProviderId      provider,
        String          analysis,
        String          proposedFix,
        double          confidence,
        String          reasoning,
        String          rootCause,
        List<String>    alternativeApproaches,
        ProviderFailure failure,        // null on success
        Duration        latency
) {
    public ProviderResponse {
        Objects.requireNonNull(provider, "provider");
        analysis              = analysis    == null ? "" : analysis;
        proposedFix           = proposedFix == null ? "" : proposedFix;
        reasoning             = reasoning   == null ? "" : reasoning;
        rootCause             = rootCause   == null ? "" : rootCause;
        alternativeApproaches = alternativeApproaches == null ? List.of() : List.copyOf(alternativeApproaches);
        latency               = latency     == null ? Duration.ZERO : latency;
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        if (failure != null && !proposedFix.isEmpty()) {
            throw new IllegalArgumentException("A failed response must not carry a proposed fix");
        }
    }

    /** A response with no analysis at all: timeout, transport error, missing key. */
    public static ProviderResponse failed(ProviderId provider, ProviderFailure failure, Duration latency) {
        return new ProviderResponse(provider, "", "", 0.0, "", "", List.of(), failure, latency);
    }

    public boolean hasError() {
        return failure != null;
    }

    /** Failure description, or {@code null} when the call succeeded. */
    public String error() {
        return failure == null ? null : failure.message();
    }

    /**
     * True when the provider answered but the payload could not be decoded;
     * the raw text is kept in {@link #analysis()}.
     */
    public boolean isSalvaged() {
        return failure != null && failure.kind() == ProviderFailure.Kind.PARSE_ERROR;
    }

    /** Eligible for clustering and voting. */
    public boolean hasProposal() {
        return failure == null && !proposedFix.isBlank();
    }
}
