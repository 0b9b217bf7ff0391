package com.quorumfix.orchestrator.workspace;

import java.util.List;

/**
 * Result of one test-suite run.
 */
public record TestRunOutcome(boolean passed, List<FailingTest> failingTests) {

    public TestRunOutcome {
        failingTests = failingTests == null ? List.of() : List.copyOf(failingTests);
    }

    public static TestRunOutcome passing() {
        return new TestRunOutcome(true, List.of());
    }

    public static TestRunOutcome failing(List<FailingTest> failingTests) {
        return new TestRunOutcome(false, failingTests);
    }

    /**
     * Failure report handed to the providers: one block per failing test with
     * its location, message and trace.
     */
    public String describeFailures() {
        if (passed) {
            return "";
        }
        if (failingTests.isEmpty()) {
            return "Test run failed (no details available)";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(failingTests.size()).append(" failing test(s):\n");
        for (int i = 0; i < failingTests.size(); i++) {
            FailingTest t = failingTests.get(i);
            sb.append("\n").append(i + 1).append(". ").append(t.name());
            if (t.file() != null && !t.file().isBlank()) {
                sb.append(" (").append(t.file()).append(")");
            }
            sb.append("\n");
            if (t.kind() != null && !t.kind().isBlank()) {
                sb.append("   Type: ").append(t.kind()).append("\n");
            }
            if (t.message() != null && !t.message().isBlank()) {
                sb.append("   Error: ").append(t.message()).append("\n");
            }
            if (t.sourceFile() != null) {
                sb.append("   Location: ").append(t.sourceFile());
                if (t.sourceLine() != null) {
                    sb.append(":").append(t.sourceLine());
                }
                sb.append("\n");
            }
            if (t.trace() != null && !t.trace().isBlank()) {
                sb.append("   Traceback:\n").append(t.trace().stripTrailing()).append("\n");
            }
        }
        return sb.toString();
    }
}
