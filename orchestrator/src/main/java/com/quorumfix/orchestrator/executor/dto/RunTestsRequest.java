package com.quorumfix.orchestrator.executor.dto;

/**
 * Request body for POST /workspace/run_tests.
 * {@code selector} null runs the whole suite.
 */
public record RunTestsRequest(
        String workspace_ref,
        String selector,
        long   timeout_sec
) {}
