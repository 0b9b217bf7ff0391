package com.quorumfix.orchestrator.loop;

import com.quorumfix.orchestrator.agent.AnalysisRequest;
import com.quorumfix.orchestrator.agent.FanOutCoordinator;
import com.quorumfix.orchestrator.agent.ProviderResponse;
import com.quorumfix.orchestrator.consensus.ConsensusProperties;
import com.quorumfix.orchestrator.consensus.ConsensusResolver;
import com.quorumfix.orchestrator.executor.ExecutorException;
import com.quorumfix.orchestrator.provider.ProviderConfigurationException;
import com.quorumfix.orchestrator.provider.ProviderId;
import com.quorumfix.orchestrator.workspace.FailingTest;
import com.quorumfix.orchestrator.workspace.FixApplier;
import com.quorumfix.orchestrator.workspace.TestRunOutcome;
import com.quorumfix.orchestrator.workspace.TestRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.quorumfix.orchestrator.provider.ProviderId.CLAUDE;
import static com.quorumfix.orchestrator.provider.ProviderId.GPT4;
import static com.quorumfix.orchestrator.provider.ProviderId.QWEN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RepairLoop.
 *
 * The workspace, context assembly and fan-out are mocked; consensus uses the
 * real resolver so each scenario is driven by the provider answers alone.
 */
@ExtendWith(MockitoExtension.class)
class RepairLoopTest {

    private static final String SELECTOR = "tests/test_parser.py";
    private static final Map<ProviderId, Double> WEIGHTS = Map.of(GPT4, 1.0, CLAUDE, 0.9, QWEN, 0.7);

    private static final TestRunOutcome FAILING = TestRunOutcome.failing(List.of(
            new FailingTest("test_empty_input", SELECTOR, "IndexError", "list index out of range",
                    "Traceback ...", "src/parser.py", 42)));

    @Mock TestRunner        testRunner;
    @Mock ContextAssembler  contextAssembler;
    @Mock FanOutCoordinator fanOut;
    @Mock FixApplier        fixApplier;

    private SimpleMeterRegistry meterRegistry;
    private RepairLoop          loop;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ConsensusResolver resolver = new ConsensusResolver(new ConsensusProperties(), meterRegistry);
        loop = new RepairLoop(testRunner, contextAssembler, fanOut, resolver, fixApplier, meterRegistry);
    }

    private static ProviderResponse answer(ProviderId id, String fix, double confidence) {
        return new ProviderResponse(id, "analysis from " + id.tag(), fix, confidence,
                "", "", List.of(), null, Duration.ofMillis(10));
    }

    private static List<ProviderResponse> agreeing() {
        return List.of(
                answer(GPT4, "add null check", 0.9),
                answer(CLAUDE, "add null check", 0.9),
                answer(QWEN, "swap the loop bounds", 0.6));
    }

    private static List<ProviderResponse> disagreeing() {
        return List.of(
                answer(GPT4, "add null check", 0.9),
                answer(CLAUDE, "refactor entire function", 0.8),
                answer(QWEN, "swap the loop bounds", 0.6));
    }

    private void givenProvidersAnswer(List<ProviderResponse> responses) {
        when(fanOut.analyze(any(AnalysisRequest.class))).thenReturn(responses);
        when(fanOut.providerWeights()).thenReturn(WEIGHTS);
    }

    private RepairRunResult repair(int maxIterations) {
        return loop.repair(SELECTOR, "Parser crashes on empty input", maxIterations, 0.6, 2);
    }

    // ------------------------------------------------------------------
    // Termination
    // ------------------------------------------------------------------

    @Test
    void repair_testsAlreadyPass_stopsWithoutAskingProviders() {
        when(testRunner.run(SELECTOR)).thenReturn(TestRunOutcome.passing());

        RepairRunResult result = repair(5);

        assertThat(result.success()).isTrue();
        assertThat(result.iterations()).isEqualTo(1);
        assertThat(result.failureReason()).isNull();
        assertThat(result.history()).singleElement().satisfies(record -> {
            assertThat(record.decision()).isNull();
            assertThat(record.responses()).isEmpty();
            assertThat(record.fixApplied()).isFalse();
        });
        verifyNoInteractions(contextAssembler, fanOut, fixApplier);
    }

    @Test
    void repair_noConsensusEveryIteration_stopsAtCap() {
        when(testRunner.run(SELECTOR)).thenReturn(FAILING);
        givenProvidersAnswer(disagreeing());

        RepairRunResult result = repair(3);

        assertThat(result.success()).isFalse();
        assertThat(result.iterations()).isEqualTo(3);
        assertThat(result.maxIterations()).isEqualTo(3);
        assertThat(result.failureReason()).isEqualTo(RepairLoop.MAX_ITERATIONS_REACHED);
        assertThat(result.finalTestOutcome()).isEqualTo(FAILING);
        assertThat(result.history()).hasSize(3)
                .allSatisfy(record -> {
                    assertThat(record.decision().hasConsensus()).isFalse();
                    assertThat(record.fixAttempted()).isEmpty();
                });
        verify(testRunner, times(3)).run(SELECTOR);
        verify(fixApplier, never()).apply(any(), anyMap());
    }

    @Test
    void repair_consensusFixTurnsTestsGreen_succeedsOnNextIteration() {
        when(testRunner.run(SELECTOR)).thenReturn(FAILING, TestRunOutcome.passing());
        givenProvidersAnswer(agreeing());
        when(fixApplier.apply(eq("add null check"), anyMap())).thenReturn(true);

        RepairRunResult result = repair(5);

        assertThat(result.success()).isTrue();
        assertThat(result.iterations()).isEqualTo(2);
        assertThat(result.history()).hasSize(2);

        IterationRecord first = result.history().get(0);
        assertThat(first.iteration()).isEqualTo(1);
        assertThat(first.decision().hasConsensus()).isTrue();
        assertThat(first.decision().supportingProviders()).containsExactly(GPT4, CLAUDE);
        assertThat(first.fixApplied()).isTrue();
        assertThat(first.fixAttempted()).isEqualTo("add null check");
        assertThat(first.responses()).hasSize(3);

        assertThat(result.history().get(1).testOutcome().passed()).isTrue();
    }

    @Test
    void repair_appliedFixStillFailing_offeredAsPreviousAttempt() {
        when(testRunner.run(SELECTOR)).thenReturn(FAILING, FAILING, TestRunOutcome.passing());
        givenProvidersAnswer(agreeing());
        when(fixApplier.apply(eq("add null check"), anyMap())).thenReturn(true);

        repair(5);

        ArgumentCaptor<AnalysisRequest> captor = ArgumentCaptor.forClass(AnalysisRequest.class);
        verify(fanOut, times(2)).analyze(captor.capture());
        List<AnalysisRequest> requests = captor.getAllValues();
        assertThat(requests.get(0).previousAttempts()).isEmpty();
        assertThat(requests.get(1).previousAttempts()).containsExactly("add null check");
        assertThat(requests.get(0).failureText()).contains("test_empty_input", "list index out of range");
        assertThat(requests.get(0).bugDescription()).isEqualTo("Parser crashes on empty input");
    }

    @Test
    void repair_fixRejectedByWorkspace_notRememberedAsAttempt() {
        when(testRunner.run(SELECTOR)).thenReturn(FAILING);
        givenProvidersAnswer(agreeing());
        when(fixApplier.apply(eq("add null check"), anyMap())).thenReturn(false);

        RepairRunResult result = repair(2);

        assertThat(result.history()).extracting(IterationRecord::fixApplied).containsExactly(false, false);
        assertThat(result.history()).extracting(IterationRecord::fixAttempted)
                .containsExactly("add null check", "add null check");

        ArgumentCaptor<AnalysisRequest> captor = ArgumentCaptor.forClass(AnalysisRequest.class);
        verify(fanOut, times(2)).analyze(captor.capture());
        assertThat(captor.getAllValues().get(1).previousAttempts()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Collaborator failures
    // ------------------------------------------------------------------

    @Test
    void repair_testRunnerCrashes_abortsWithPhaseInReason() {
        when(testRunner.run(SELECTOR))
                .thenReturn(FAILING)
                .thenThrow(new ExecutorException("runTests failed: HTTP 500"));
        givenProvidersAnswer(disagreeing());

        RepairRunResult result = repair(5);

        assertThat(result.success()).isFalse();
        assertThat(result.iterations()).isEqualTo(2);
        assertThat(result.history()).hasSize(1);
        assertThat(result.failureReason())
                .isEqualTo("Iteration 2 aborted during run tests: runTests failed: HTTP 500");
    }

    @Test
    void repair_fixApplierThrows_iterationRecordedThenAborted() {
        when(testRunner.run(SELECTOR)).thenReturn(FAILING);
        givenProvidersAnswer(agreeing());
        when(fixApplier.apply(eq("add null check"), anyMap()))
                .thenThrow(new ExecutorException("applyFix failed: HTTP 502"));

        RepairRunResult result = repair(5);

        assertThat(result.success()).isFalse();
        assertThat(result.iterations()).isEqualTo(1);
        assertThat(result.failureReason()).contains("aborted during apply fix", "HTTP 502");
        assertThat(result.history()).singleElement().satisfies(record -> {
            assertThat(record.fixApplied()).isFalse();
            assertThat(record.fixAttempted()).isEqualTo("add null check");
        });
    }

    @Test
    void repair_providerConfigurationBroken_abortsDuringFanOut() {
        when(testRunner.run(SELECTOR)).thenReturn(FAILING);
        when(fanOut.analyze(any(AnalysisRequest.class)))
                .thenThrow(new ProviderConfigurationException("No LLM providers configured"));

        RepairRunResult result = repair(5);

        assertThat(result.success()).isFalse();
        assertThat(result.history()).isEmpty();
        assertThat(result.failureReason())
                .isEqualTo("Iteration 1 aborted during fan out: No LLM providers configured");
        verifyNoInteractions(fixApplier);
    }

    // ------------------------------------------------------------------
    // Observability
    // ------------------------------------------------------------------

    @Test
    void repair_recordsOutcomeCounters() {
        when(testRunner.run(SELECTOR)).thenReturn(TestRunOutcome.passing(), FAILING, FAILING);
        givenProvidersAnswer(disagreeing());

        repair(3);   // passes at once
        repair(2);   // runs out of iterations

        assertThat(meterRegistry.counter("quorumfix.repair.runs", "outcome", "success").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("quorumfix.repair.runs", "outcome", "exhausted").count()).isEqualTo(1.0);
        assertThat(meterRegistry.summary("quorumfix.repair.iterations").count()).isEqualTo(2);
        assertThat(meterRegistry.summary("quorumfix.repair.iterations").totalAmount()).isEqualTo(3.0);
    }

    @Test
    void repair_clearsMdcWhenDone() {
        when(testRunner.run(SELECTOR)).thenReturn(TestRunOutcome.passing());

        loop.repair("run-1234", new RepairRequest(SELECTOR, "bug", 3, 0.6, 2));

        assertThat(MDC.get("runId")).isNull();
        assertThat(MDC.get("iteration")).isNull();
    }
}
