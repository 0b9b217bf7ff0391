package com.quorumfix.orchestrator.loop;

import com.quorumfix.orchestrator.consensus.ConsensusThresholds;

/**
 * Parameters of one repair run.
 *
 * @param testSelector tests to run each iteration, or {@code null} for the whole suite
 */
public record RepairRequest(
        String testSelector,
        String bugDescription,
        int    maxIterations,
        double minConfidence,
        int    minAgreement
) {
    public RepairRequest {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        bugDescription = bugDescription == null ? "" : bugDescription;
        // Fail fast on bad thresholds rather than at the first consensus round.
        new ConsensusThresholds(minAgreement, minConfidence);
    }

    public ConsensusThresholds thresholds() {
        return new ConsensusThresholds(minAgreement, minConfidence);
    }
}
