package com.quorumfix.orchestrator.loop;

import com.quorumfix.orchestrator.consensus.ConsensusProperties;
import com.quorumfix.orchestrator.workspace.TestRunOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RepairRunService.
 *
 * Each test drains the worker before asserting, so run state is final.
 */
@ExtendWith(MockitoExtension.class)
class RepairRunServiceTest {

    @Mock RepairLoop repairLoop;

    private LoopProperties   loopProperties;
    private ExecutorService  worker;
    private RepairRunService service;

    @BeforeEach
    void setUp() {
        loopProperties = new LoopProperties();
        loopProperties.setMaxIterations(4);
        ConsensusProperties consensusProperties = new ConsensusProperties();
        consensusProperties.setMinConfidence(0.75);
        consensusProperties.setMinAgreement(3);

        worker  = Executors.newSingleThreadExecutor();
        service = new RepairRunService(repairLoop, loopProperties, consensusProperties, worker);
    }

    private void drain() throws InterruptedException {
        worker.shutdown();
        assertThat(worker.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    }

    private static RepairRunResult result(boolean success) {
        return new RepairRunResult(success, 2, 4, TestRunOutcome.passing(), List.of(),
                Duration.ofSeconds(3), success ? null : RepairLoop.MAX_ITERATIONS_REACHED);
    }

    @Test
    void submit_missingParameters_filledFromConfiguration() throws Exception {
        when(repairLoop.repair(anyString(), any(RepairRequest.class))).thenReturn(result(true));

        RepairRun run = service.submit(null, "Parser crashes", null, null, null);
        drain();

        ArgumentCaptor<RepairRequest> captor = ArgumentCaptor.forClass(RepairRequest.class);
        verify(repairLoop).repair(eq(run.getId()), captor.capture());
        RepairRequest request = captor.getValue();
        assertThat(request.testSelector()).isNull();
        assertThat(request.maxIterations()).isEqualTo(4);
        assertThat(request.minConfidence()).isEqualTo(0.75);
        assertThat(request.minAgreement()).isEqualTo(3);
    }

    @Test
    void submit_explicitParameters_overrideConfiguration() throws Exception {
        when(repairLoop.repair(anyString(), any(RepairRequest.class))).thenReturn(result(true));

        RepairRun run = service.submit("tests/test_parser.py", "bug", 2, 0.5, 1);
        drain();

        assertThat(run.getRequest()).isEqualTo(new RepairRequest("tests/test_parser.py", "bug", 2, 0.5, 1));
    }

    @Test
    void submit_loopSucceeds_runMarkedSucceeded() throws Exception {
        RepairRunResult result = result(true);
        when(repairLoop.repair(anyString(), any(RepairRequest.class))).thenReturn(result);

        RepairRun run = service.submit(null, "bug", null, null, null);
        drain();

        assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(run.getResult()).isSameAs(result);
        assertThat(run.getStartedAt()).isNotNull();
        assertThat(run.getFinishedAt()).isNotNull();
        assertThat(run.getError()).isNull();
        assertThat(service.find(run.getId())).containsSame(run);
    }

    @Test
    void submit_loopGivesUp_runMarkedFailedWithResult() throws Exception {
        when(repairLoop.repair(anyString(), any(RepairRequest.class))).thenReturn(result(false));

        RepairRun run = service.submit(null, "bug", null, null, null);
        drain();

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getResult().failureReason()).isEqualTo(RepairLoop.MAX_ITERATIONS_REACHED);
    }

    @Test
    void submit_loopThrows_runMarkedFailedWithError() throws Exception {
        when(repairLoop.repair(anyString(), any(RepairRequest.class)))
                .thenThrow(new IllegalStateException("boom"));

        RepairRun run = service.submit(null, "bug", null, null, null);
        drain();

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getResult()).isNull();
        assertThat(run.getError()).isEqualTo("Unhandled exception: boom");
    }

    @Test
    void submit_invalidParameters_rejectedBeforeQueueing() {
        assertThatThrownBy(() -> service.submit(null, "bug", 0, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxIterations");
        assertThatThrownBy(() -> service.submit(null, "bug", null, 1.5, null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(repairLoop);
    }

    @Test
    void submit_beyondRetainedRuns_evictsOldestFinished() throws Exception {
        loopProperties.setRetainedRuns(2);
        when(repairLoop.repair(anyString(), any(RepairRequest.class))).thenReturn(result(true));

        RepairRun first  = service.submit(null, "bug 1", null, null, null);
        RepairRun second = service.submit(null, "bug 2", null, null, null);
        RepairRun third  = service.submit(null, "bug 3", null, null, null);
        drain();

        assertThat(service.find(first.getId())).isEmpty();
        assertThat(service.find(second.getId())).containsSame(second);
        assertThat(service.find(third.getId())).containsSame(third);
    }

    @Test
    void submit_crashedRuns_countTowardRetention() throws Exception {
        loopProperties.setRetainedRuns(1);
        when(repairLoop.repair(anyString(), any(RepairRequest.class)))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(result(true));

        RepairRun crashed = service.submit(null, "bug 1", null, null, null);
        RepairRun done    = service.submit(null, "bug 2", null, null, null);
        drain();

        assertThat(service.find(crashed.getId())).isEmpty();
        assertThat(service.find(done.getId())).containsSame(done);
    }

    @Test
    void find_unknownId_returnsEmpty() {
        assertThat(service.find("no-such-run")).isEmpty();
    }
}
