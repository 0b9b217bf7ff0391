package com.quorumfix.orchestrator.loop;

public enum RunStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED
}
