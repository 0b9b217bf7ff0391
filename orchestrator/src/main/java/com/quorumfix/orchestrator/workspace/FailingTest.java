package com.quorumfix.orchestrator.workspace;

/**
 * One failing test as reported by the test runner.
 * {@code sourceFile} and {@code sourceLine} are null when the runner could
 * not locate the failure in production code.
 */
public record FailingTest(
        String  name,
        String  file,
        String  kind,
        String  message,
        String  trace,
        String  sourceFile,
        Integer sourceLine
) {}
