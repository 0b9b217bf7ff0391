package com.quorumfix.orchestrator.consensus;

/**
 * Gate a winning cluster must clear: at least {@code minAgreement} members
 * and a weighted confidence of at least {@code minConfidence}.
 */
public record ConsensusThresholds(int minAgreement, double minConfidence) {

    public ConsensusThresholds {
        if (minAgreement < 1) {
            throw new IllegalArgumentException("minAgreement must be at least 1, got " + minAgreement);
        }
        if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be within [0,1], got " + minConfidence);
        }
    }
}
