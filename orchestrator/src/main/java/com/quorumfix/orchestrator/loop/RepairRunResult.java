package com.quorumfix.orchestrator.loop;

import com.quorumfix.orchestrator.workspace.TestRunOutcome;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a whole repair run.
 *
 * {@code iterations} is the last iteration started, so an aborted run can have
 * one more iteration than history entries. {@code failureReason} is null on
 * success and never blank otherwise. {@code finalTestOutcome} is null only if
 * the very first test run crashed.
 */
public record RepairRunResult(
        boolean               success,
        int                   iterations,
        int                   maxIterations,
        TestRunOutcome        finalTestOutcome,
        List<IterationRecord> history,
        Duration              totalDuration,
        String                failureReason
) {
    public RepairRunResult {
        history = List.copyOf(history);
    }
}
