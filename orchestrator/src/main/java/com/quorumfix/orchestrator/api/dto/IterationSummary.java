package com.quorumfix.orchestrator.api.dto;

import com.quorumfix.orchestrator.agent.ProviderResponse;
import com.quorumfix.orchestrator.consensus.ConsensusDecision;
import com.quorumfix.orchestrator.loop.IterationRecord;
import com.quorumfix.orchestrator.provider.ProviderId;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One iteration of a run as returned by GET /repairs/{id}.
 * {@code providerErrors} maps provider tag to error message for failed calls.
 */
public record IterationSummary(
        int                 iteration,
        boolean             testsPassed,
        int                 failingTests,
        Boolean             consensus,          // null when the tests passed
        double              confidence,
        String              chosenFix,
        List<String>        supportingProviders,
        List<String>        conflicts,
        int                 alternatives,
        boolean             fixApplied,
        Map<String, String> providerErrors,
        Instant             timestamp
) {
    public static IterationSummary from(IterationRecord r) {
        ConsensusDecision d = r.decision();
        Map<String, String> errors = new LinkedHashMap<>();
        for (ProviderResponse response : r.responses()) {
            if (response.hasError()) {
                errors.put(response.provider().tag(), response.error());
            }
        }
        return new IterationSummary(
                r.iteration(),
                r.testOutcome().passed(),
                r.testOutcome().failingTests().size(),
                d == null ? null : d.hasConsensus(),
                d == null ? 0.0 : d.confidence(),
                d == null ? "" : d.chosenFix(),
                d == null ? List.of() : d.supportingProviders().stream().map(ProviderId::tag).toList(),
                d == null ? List.of() : d.conflicts(),
                d == null ? 0 : d.alternatives().size(),
                r.fixApplied(),
                errors,
                r.timestamp()
        );
    }
}
