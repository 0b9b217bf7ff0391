package com.quorumfix.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.quorumfix.orchestrator.loop.RepairRun;
import com.quorumfix.orchestrator.loop.RepairRunResult;

import java.time.Instant;
import java.util.List;

/**
 * Response body for POST /repairs and GET /repairs/{id}.
 * The result fields stay null until the run has finished.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RepairRunResponse(
        String                 runId,
        String                 status,
        Instant                submittedAt,
        Instant                startedAt,
        Instant                finishedAt,
        Boolean                success,
        Integer                iterations,
        Integer                maxIterations,
        Long                   durationMs,
        String                 failureReason,
        List<IterationSummary> history
) {
    public static RepairRunResponse from(RepairRun run) {
        RepairRunResult result = run.getResult();
        if (result == null) {
            return new RepairRunResponse(run.getId(), run.getStatus().name(),
                    run.getSubmittedAt(), run.getStartedAt(), run.getFinishedAt(),
                    null, null, run.getRequest().maxIterations(), null, run.getError(), null);
        }
        return new RepairRunResponse(
                run.getId(),
                run.getStatus().name(),
                run.getSubmittedAt(),
                run.getStartedAt(),
                run.getFinishedAt(),
                result.success(),
                result.iterations(),
                result.maxIterations(),
                result.totalDuration().toMillis(),
                result.failureReason(),
                result.history().stream().map(IterationSummary::from).toList()
        );
    }
}
