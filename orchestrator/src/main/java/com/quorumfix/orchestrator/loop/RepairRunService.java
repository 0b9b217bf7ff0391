package com.quorumfix.orchestrator.loop;

import com.quorumfix.orchestrator.consensus.ConsensusProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Accepts repair runs and executes them in the background, one at a time.
 *
 * Runs share the one workspace, so the worker pool has a single thread and
 * submissions queue behind it. Run state is kept in memory; once more than
 * {@code quorumfix.loop.retained-runs} runs have finished, the oldest
 * finished ones are forgotten. Queued and running runs are never evicted.
 */
@Service
public class RepairRunService {

    private static final Logger log = LoggerFactory.getLogger(RepairRunService.class);

    private final Map<String, RepairRun> runs = new ConcurrentHashMap<>();
    // Ids of finished runs, oldest first.
    private final Deque<String> finished = new ArrayDeque<>();

    private final RepairLoop          repairLoop;
    private final LoopProperties      loopProperties;
    private final ConsensusProperties consensusProperties;
    private final ExecutorService     worker;

    @Autowired
    public RepairRunService(RepairLoop repairLoop,
                            LoopProperties loopProperties,
                            ConsensusProperties consensusProperties) {
        this(repairLoop, loopProperties, consensusProperties,
                Executors.newSingleThreadExecutor(r -> new Thread(r, "repair-worker")));
    }

    RepairRunService(RepairLoop repairLoop,
                     LoopProperties loopProperties,
                     ConsensusProperties consensusProperties,
                     ExecutorService worker) {
        this.repairLoop          = repairLoop;
        this.loopProperties      = loopProperties;
        this.consensusProperties = consensusProperties;
        this.worker              = worker;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Queue a run. Null parameters fall back to the configured defaults.
     *
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public RepairRun submit(String testSelector,
                            String bugDescription,
                            Integer maxIterations,
                            Double minConfidence,
                            Integer minAgreement) {
        RepairRequest request = new RepairRequest(
                testSelector,
                bugDescription,
                maxIterations != null ? maxIterations : loopProperties.getMaxIterations(),
                minConfidence != null ? minConfidence : consensusProperties.getMinConfidence(),
                minAgreement  != null ? minAgreement  : consensusProperties.getMinAgreement());

        RepairRun run = new RepairRun(UUID.randomUUID().toString(), request);
        runs.put(run.getId(), run);
        log.info("Queued repair run {} (maxIterations={})", run.getId(), request.maxIterations());

        worker.submit(() -> execute(run));
        return run;
    }

    public Optional<RepairRun> find(String id) {
        return Optional.ofNullable(runs.get(id));
    }

    // ------------------------------------------------------------------
    // Worker
    // ------------------------------------------------------------------

    private void execute(RepairRun run) {
        run.markRunning();
        try {
            run.complete(repairLoop.repair(run.getId(), run.getRequest()));
            log.info("Repair run {} {}", run.getId(), run.getStatus());
        } catch (Exception e) {
            log.error("Unhandled error in repair run {}: {}", run.getId(), e.getMessage(), e);
            run.crash("Unhandled exception: " + e.getMessage());
        }
        retire(run);
    }

    private synchronized void retire(RepairRun run) {
        finished.addLast(run.getId());
        int limit = Math.max(loopProperties.getRetainedRuns(), 0);
        while (finished.size() > limit) {
            String evicted = finished.removeFirst();
            runs.remove(evicted);
            log.debug("Evicted finished repair run {}", evicted);
        }
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        worker.shutdownNow();
        if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
            log.warn("Repair worker did not stop within 10 s");
        }
    }
}
