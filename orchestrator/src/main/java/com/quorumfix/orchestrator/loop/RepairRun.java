package com.quorumfix.orchestrator.loop;

import java.time.Instant;

/**
 * A submitted repair run and its progress.
 *
 * Written by the single repair worker, read by API threads; every mutable
 * field is volatile and {@code result} is set before the terminal status.
 */
public class RepairRun {

    private final String        id;
    private final RepairRequest request;
    private final Instant       submittedAt = Instant.now();

    private volatile RunStatus       status = RunStatus.QUEUED;
    private volatile Instant         startedAt;
    private volatile Instant         finishedAt;
    private volatile RepairRunResult result;
    private volatile String          error;

    RepairRun(String id, RepairRequest request) {
        this.id      = id;
        this.request = request;
    }

    void markRunning() {
        startedAt = Instant.now();
        status    = RunStatus.RUNNING;
    }

    void complete(RepairRunResult result) {
        this.result = result;
        finishedAt  = Instant.now();
        status      = result.success() ? RunStatus.SUCCEEDED : RunStatus.FAILED;
    }

    /** The loop itself threw; there is no result to report. */
    void crash(String error) {
        this.error = error;
        finishedAt = Instant.now();
        status     = RunStatus.FAILED;
    }

    public String getId()                { return id; }
    public RepairRequest getRequest()    { return request; }
    public Instant getSubmittedAt()      { return submittedAt; }
    public RunStatus getStatus()         { return status; }
    public Instant getStartedAt()        { return startedAt; }
    public Instant getFinishedAt()       { return finishedAt; }
    public RepairRunResult getResult()   { return result; }
    public String getError()             { return error; }
}
