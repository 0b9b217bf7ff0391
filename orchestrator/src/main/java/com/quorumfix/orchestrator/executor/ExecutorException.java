package com.quorumfix.orchestrator.executor;

/**
 * Thrown when the workspace executor or the search service returns an error
 * or is unreachable. The repair loop treats it as a collaborator crash.
 */
public class ExecutorException extends RuntimeException {

    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
