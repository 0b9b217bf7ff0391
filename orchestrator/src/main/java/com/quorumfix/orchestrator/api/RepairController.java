package com.quorumfix.orchestrator.api;

import com.quorumfix.orchestrator.api.dto.ProviderView;
import com.quorumfix.orchestrator.api.dto.RepairRunResponse;
import com.quorumfix.orchestrator.api.dto.SubmitRepairRequest;
import com.quorumfix.orchestrator.loop.RepairRun;
import com.quorumfix.orchestrator.loop.RepairRunService;
import com.quorumfix.orchestrator.provider.ProviderRegistry;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * REST API for repair runs.
 *
 * POST /repairs            submit a run; it executes in the background
 * GET  /repairs/{id}       poll a run; includes the result once finished
 * GET  /repairs/providers  list the configured providers
 */
@RestController
@RequestMapping("/repairs")
public class RepairController {

    private final RepairRunService runService;
    private final ProviderRegistry providers;

    public RepairController(RepairRunService runService, ProviderRegistry providers) {
        this.runService = runService;
        this.providers  = providers;
    }

    /**
     * Submit a repair run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/repairs \
     *     -H "Content-Type: application/json" \
     *     -d '{"bugDescription":"Parser crashes on empty input","testSelector":"tests/test_parser.py"}'
     */
    @PostMapping
    public ResponseEntity<RepairRunResponse> submit(@Valid @RequestBody SubmitRepairRequest req) {
        RepairRun run = runService.submit(req.testSelector(), req.bugDescription(),
                req.maxIterations(), req.minConfidence(), req.minAgreement());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RepairRunResponse.from(run));
    }

    /**
     * Poll a run. Returns 404 if the run ID is not known.
     */
    @GetMapping("/{id}")
    public RepairRunResponse getRun(@PathVariable String id) {
        return runService.find(id)
                .map(RepairRunResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Repair run not found: " + id));
    }

    @GetMapping("/providers")
    public List<ProviderView> listProviders() {
        return providers.all().stream()
                .map(ProviderView::from)
                .toList();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
