package com.quorumfix.orchestrator.workspace;

/**
 * Runs the test suite in the workspace. Must not modify source files.
 */
public interface TestRunner {

    /**
     * @param selector tests to run, or {@code null} for the whole suite
     */
    TestRunOutcome run(String selector);
}
