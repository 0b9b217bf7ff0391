package com.quorumfix.orchestrator.loop;

import com.quorumfix.orchestrator.agent.ProviderResponse;
import com.quorumfix.orchestrator.consensus.ConsensusDecision;
import com.quorumfix.orchestrator.workspace.TestRunOutcome;

import java.time.Instant;
import java.util.List;

/**
 * One pass of the repair loop.
 *
 * When the tests passed, {@code responses} is empty and {@code decision} is null.
 * {@code fixAttempted} is the consensus fix handed to the applier, or empty if
 * none was; {@code fixApplied} says whether the applier accepted it.
 */
public record IterationRecord(
        int                    iteration,
        TestRunOutcome         testOutcome,
        List<ProviderResponse> responses,
        ConsensusDecision      decision,
        boolean                fixApplied,
        String                 fixAttempted,
        Instant                timestamp
) {
    public IterationRecord {
        responses    = responses == null ? List.of() : List.copyOf(responses);
        fixAttempted = fixAttempted == null ? "" : fixAttempted;
    }

    static IterationRecord passed(int iteration, TestRunOutcome outcome) {
        return new IterationRecord(iteration, outcome, List.of(), null, false, "", Instant.now());
    }
}
