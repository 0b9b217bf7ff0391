package com.quorumfix.orchestrator.loop;

import com.quorumfix.orchestrator.agent.AnalysisRequest;
import com.quorumfix.orchestrator.agent.FanOutCoordinator;
import com.quorumfix.orchestrator.agent.ProviderResponse;
import com.quorumfix.orchestrator.consensus.ConsensusDecision;
import com.quorumfix.orchestrator.consensus.ConsensusResolver;
import com.quorumfix.orchestrator.consensus.DecisionExplainer;
import com.quorumfix.orchestrator.workspace.FixApplier;
import com.quorumfix.orchestrator.workspace.TestRunOutcome;
import com.quorumfix.orchestrator.workspace.TestRunner;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The debug, fix, retest cycle.
 *
 * <pre>
 *   RUN_TESTS ── pass ──► success
 *       │ fail
 *       ▼
 *   GATHER_CONTEXT ─► FAN_OUT ─► RESOLVE ── no consensus ──► RUN_TESTS
 *                                   │ consensus
 *                                   ▼
 *                               APPLY_FIX ─────────────────► RUN_TESTS
 * </pre>
 *
 * Stops on the first green test run, after {@code maxIterations} iterations,
 * or when a collaborator throws. Every finished iteration is appended to the
 * history before the next one starts. Every applied fix is remembered and
 * shown to the providers as a failed attempt on later iterations.
 *
 * Single-threaded: one call to {@link #repair} runs start to finish on the
 * caller's thread and only the fan-out itself goes parallel.
 *
 * <p>Metrics:
 * <pre>
 *   quorumfix.repair.runs{outcome="success|exhausted|aborted"}
 *   quorumfix.repair.iterations
 * </pre>
 */
@Component
public class RepairLoop {

    private static final Logger log = LoggerFactory.getLogger(RepairLoop.class);

    static final String MAX_ITERATIONS_REACHED = "Maximum iterations reached";

    private final TestRunner        testRunner;
    private final ContextAssembler  contextAssembler;
    private final FanOutCoordinator fanOut;
    private final ConsensusResolver resolver;
    private final FixApplier        fixApplier;
    private final MeterRegistry     meterRegistry;

    public RepairLoop(TestRunner testRunner,
                      ContextAssembler contextAssembler,
                      FanOutCoordinator fanOut,
                      ConsensusResolver resolver,
                      FixApplier fixApplier,
                      MeterRegistry meterRegistry) {
        this.testRunner       = testRunner;
        this.contextAssembler = contextAssembler;
        this.fanOut           = fanOut;
        this.resolver         = resolver;
        this.fixApplier       = fixApplier;
        this.meterRegistry    = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    public RepairRunResult repair(String testSelector,
                                  String bugDescription,
                                  int maxIterations,
                                  double minConfidence,
                                  int minAgreement) {
        return repair(new RepairRequest(testSelector, bugDescription, maxIterations, minConfidence, minAgreement));
    }

    public RepairRunResult repair(RepairRequest request) {
        return repair(UUID.randomUUID().toString().substring(0, 8), request);
    }

    /**
     * Run the loop to completion. Never throws for collaborator failures;
     * those end the run with {@code success=false} and a failure reason.
     */
    public RepairRunResult repair(String runId, RepairRequest request) {
        MDC.put("runId", runId);
        try {
            log.info("Starting repair run: selector={} maxIterations={} minAgreement={} minConfidence={}",
                    request.testSelector() == null ? "all" : request.testSelector(),
                    request.maxIterations(), request.minAgreement(), request.minConfidence());
            return run(request);
        } finally {
            // Clear MDC so context does not leak to the next task on this worker thread.
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // Loop
    // ------------------------------------------------------------------

    private RepairRunResult run(RepairRequest request) {
        long started = System.nanoTime();
        List<IterationRecord> history        = new ArrayList<>();
        List<String>          failedAttempts = new ArrayList<>();
        TestRunOutcome        lastOutcome    = null;

        for (int iteration = 1; iteration <= request.maxIterations(); iteration++) {
            MDC.put("iteration", String.valueOf(iteration));
            log.info("Iteration {}/{}: running tests", iteration, request.maxIterations());

            RepairPhase phase = RepairPhase.RUN_TESTS;
            try {
                TestRunOutcome outcome = testRunner.run(request.testSelector());
                lastOutcome = outcome;

                if (outcome.passed()) {
                    history.add(IterationRecord.passed(iteration, outcome));
                    log.info("Tests passed after {} iteration(s)", iteration);
                    return finish(true, iteration, request, lastOutcome, history, started, null);
                }

                phase = RepairPhase.GATHER_CONTEXT;
                Map<String, String> context = contextAssembler.assemble(request.bugDescription(), outcome);

                phase = RepairPhase.FAN_OUT;
                List<ProviderResponse> responses = fanOut.analyze(new AnalysisRequest(
                        request.bugDescription(), context, outcome.describeFailures(), List.copyOf(failedAttempts)));

                phase = RepairPhase.RESOLVE;
                ConsensusDecision decision = resolver.resolve(responses, fanOut.providerWeights(), request.thresholds());
                log.info("\n{}", DecisionExplainer.explain(decision));

                if (!decision.hasConsensus()) {
                    history.add(new IterationRecord(iteration, outcome, responses, decision, false, "", Instant.now()));
                    log.warn("Iteration {}: no consensus, no fix applied", iteration);
                    continue;
                }

                phase = RepairPhase.APPLY_FIX;
                String fix = decision.chosenFix();
                boolean applied;
                try {
                    applied = fixApplier.apply(fix, context);
                } catch (RuntimeException e) {
                    history.add(new IterationRecord(iteration, outcome, responses, decision, false, fix, Instant.now()));
                    throw e;
                }
                history.add(new IterationRecord(iteration, outcome, responses, decision, applied, fix, Instant.now()));

                if (applied) {
                    // Remembered until a test run proves otherwise; only a green run ends the loop.
                    failedAttempts.add(fix);
                    log.info("Iteration {}: fix applied, retesting", iteration);
                } else {
                    log.warn("Iteration {}: fix could not be applied", iteration);
                }
            } catch (RuntimeException e) {
                String reason = "Iteration %d aborted during %s: %s".formatted(iteration, phase.label(), describe(e));
                log.error("Repair run aborted: {}", reason, e);
                return finish(false, iteration, request, lastOutcome, history, started, reason);
            }
        }

        log.warn("Giving up after {} iteration(s) without a passing test run", request.maxIterations());
        return finish(false, request.maxIterations(), request, lastOutcome, history, started, MAX_ITERATIONS_REACHED);
    }

    private RepairRunResult finish(boolean success,
                                   int iterations,
                                   RepairRequest request,
                                   TestRunOutcome lastOutcome,
                                   List<IterationRecord> history,
                                   long startedNanos,
                                   String failureReason) {
        Duration duration = Duration.ofNanos(System.nanoTime() - startedNanos);

        String outcome = success ? "success"
                : MAX_ITERATIONS_REACHED.equals(failureReason) ? "exhausted" : "aborted";
        meterRegistry.counter("quorumfix.repair.runs", "outcome", outcome).increment();
        meterRegistry.summary("quorumfix.repair.iterations").record(iterations);

        log.info("Repair run finished: outcome={} iterations={}/{} duration={}ms",
                outcome, iterations, request.maxIterations(), duration.toMillis());

        return new RepairRunResult(success, iterations, request.maxIterations(),
                lastOutcome, history, duration, failureReason);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
