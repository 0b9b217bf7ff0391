package com.quorumfix.orchestrator.agent;

import com.quorumfix.orchestrator.provider.ProviderId;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a single provider call, before it is flattened into a
 * {@link ProviderResponse}.
 *
 * Keeping the failure kinds apart until the coordinator boundary lets the
 * coordinator tag metrics and logs by cause; consumers past that point
 * only see {@link ProviderResponse#failure()}.
 */
public sealed interface ProviderCallResult {

    ProviderResponse toResponse(ProviderId provider, Duration latency);

    /** Metric/status tag. */
    String status();

    record Success(String analysis,
                   String proposedFix,
                   double confidence,
                   String reasoning,
                   String rootCause,
                   List<String> alternativeApproaches) implements ProviderCallResult {

        @Override
        public ProviderResponse toResponse(ProviderId provider, Duration latency) {
            return new ProviderResponse(provider, analysis, proposedFix, confidence,
                    reasoning, rootCause, alternativeApproaches, null, latency);
        }

        @Override public String status() { return "success"; }
    }

    record Timeout(Duration limit) implements ProviderCallResult {

        @Override
        public ProviderResponse toResponse(ProviderId provider, Duration latency) {
            return ProviderResponse.failed(provider, new ProviderFailure(ProviderFailure.Kind.TIMEOUT,
                    "Timeout after " + limit.toMillis() + " ms"), latency);
        }

        @Override public String status() { return "timeout"; }
    }

    /** {@code statusCode} is null when no HTTP response was received at all. */
    record TransportError(String message, Integer statusCode) implements ProviderCallResult {

        @Override
        public ProviderResponse toResponse(ProviderId provider, Duration latency) {
            return ProviderResponse.failed(provider,
                    new ProviderFailure(ProviderFailure.Kind.TRANSPORT_ERROR, message), latency);
        }

        @Override public String status() { return "transport_error"; }
    }

    /**
     * The provider answered but no structured payload could be decoded.
     * The raw text is salvaged as analysis with a fixed low confidence.
     */
    record ParseError(String rawText, String detail) implements ProviderCallResult {

        public static final double SALVAGED_CONFIDENCE = 0.3;

        @Override
        public ProviderResponse toResponse(ProviderId provider, Duration latency) {
            return new ProviderResponse(provider, rawText, "", SALVAGED_CONFIDENCE,
                    "Failed to parse structured response", "", List.of(),
                    new ProviderFailure(ProviderFailure.Kind.PARSE_ERROR, detail), latency);
        }

        @Override public String status() { return "parse_error"; }
    }

    record MissingCredential(String credentialRef) implements ProviderCallResult {

        @Override
        public ProviderResponse toResponse(ProviderId provider, Duration latency) {
            return ProviderResponse.failed(provider, new ProviderFailure(ProviderFailure.Kind.MISSING_CREDENTIAL,
                    "API key not found for " + provider.tag() + " (credential '" + credentialRef + "')"), latency);
        }

        @Override public String status() { return "missing_credential"; }
    }
}
