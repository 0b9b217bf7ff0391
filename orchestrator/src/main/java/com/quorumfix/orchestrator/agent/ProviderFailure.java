package com.quorumfix.orchestrator.agent;

import java.util.Objects;

/**
 * Why a provider produced no usable opinion in a fan-out.
 */
public record ProviderFailure(Kind kind, String message) {

    public enum Kind { TIMEOUT, TRANSPORT_ERROR, PARSE_ERROR, MISSING_CREDENTIAL }

    public ProviderFailure {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? kind.name() : message;
    }
}
