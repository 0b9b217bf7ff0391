package com.quorumfix.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response from POST /workspace/run_tests.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunTestsResponse(
        boolean passed,
        int tests_run,
        List<Failure> failing_tests
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Failure(
            String  name,
            String  file,
            String  kind,
            String  message,
            String  trace,
            String  source_file,
            Integer source_line
    ) {}
}
