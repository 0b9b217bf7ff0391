package com.quorumfix.orchestrator.consensus;

import com.quorumfix.orchestrator.provider.ProviderId;

import java.util.List;

/**
 * Verdict of one consensus round.
 *
 * {@code confidence} is the winning cluster's weighted confidence and
 * {@code totalWeight} its Σ weight × confidence, reported whether or not
 * consensus was reached. {@code chosenFix} is empty without consensus.
 * {@code alternatives} lists every other cluster in rank order.
 */
public record ConsensusDecision(
        boolean           hasConsensus,
        String            chosenFix,
        double            confidence,
        List<ProviderId>  supportingProviders,
        double            totalWeight,
        String            reasoning,
        List<Alternative> alternatives,
        List<String>      conflicts
) {
    public ConsensusDecision {
        chosenFix           = chosenFix == null ? "" : chosenFix;
        reasoning           = reasoning == null ? "" : reasoning;
        supportingProviders = supportingProviders == null ? List.of() : List.copyOf(supportingProviders);
        alternatives        = alternatives == null ? List.of() : List.copyOf(alternatives);
        conflicts           = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    /** A runner-up cluster. */
    public record Alternative(String fix, double weightedScore, List<ProviderId> providers) {
        public Alternative {
            providers = List.copyOf(providers);
        }
    }

    static ConsensusDecision noValidResponses() {
        return new ConsensusDecision(false, "", 0.0, List.of(), 0.0,
                "No valid responses from any provider",
                List.of(),
                List.of("All providers failed or returned empty fixes"));
    }
}
