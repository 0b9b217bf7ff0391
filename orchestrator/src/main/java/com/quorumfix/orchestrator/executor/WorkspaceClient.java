package com.quorumfix.orchestrator.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quorumfix.orchestrator.executor.dto.ApplyFixRequest;
import com.quorumfix.orchestrator.executor.dto.ApplyFixResponse;
import com.quorumfix.orchestrator.executor.dto.ReadFileRequest;
import com.quorumfix.orchestrator.executor.dto.ReadFileResponse;
import com.quorumfix.orchestrator.executor.dto.RunTestsRequest;
import com.quorumfix.orchestrator.executor.dto.RunTestsResponse;
import com.quorumfix.orchestrator.workspace.FailingTest;
import com.quorumfix.orchestrator.workspace.FixApplier;
import com.quorumfix.orchestrator.workspace.SourceReader;
import com.quorumfix.orchestrator.workspace.TestRunOutcome;
import com.quorumfix.orchestrator.workspace.TestRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP client for the workspace executor service.
 *
 * One workspace per deployment, named by {@code quorumfix.executor.workspace-ref}.
 * Implements the three workspace collaborators the repair loop needs: running
 * tests, applying a fix, and reading source files.
 *
 * Blocking I/O; called only from the repair worker thread.
 */
@Component
public class WorkspaceClient implements TestRunner, FixApplier, SourceReader {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceClient.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       workspaceRef;
    private final Duration     testTimeout;

    public WorkspaceClient(
            @Value("${quorumfix.executor.base-url}") String baseUrl,
            @Value("${quorumfix.executor.workspace-ref:default}") String workspaceRef,
            @Value("${quorumfix.executor.test-timeout:10m}") Duration testTimeout,
            ObjectMapper objectMapper) {
        this.baseUrl      = baseUrl;
        this.workspaceRef = workspaceRef;
        this.testTimeout  = testTimeout;
        this.json         = objectMapper;
        this.http         = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)   // uvicorn doesn't support h2c upgrade
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // TestRunner
    // ------------------------------------------------------------------

    /**
     * @throws ExecutorException if the executor is unreachable or returns a non-2xx status
     */
    @Override
    public TestRunOutcome run(String selector) {
        log.info("Running tests in workspace '{}' (selector: {})", workspaceRef, selector == null ? "all" : selector);
        String body = toJson(new RunTestsRequest(workspaceRef, selector, testTimeout.toSeconds()));
        // The executor enforces the test timeout; allow a little longer on the wire.
        String respBody = post("/workspace/run_tests", body, "runTests", testTimeout.plusSeconds(30));

        RunTestsResponse resp = read(respBody, RunTestsResponse.class, "runTests");
        List<FailingTest> failures = resp.failing_tests() == null ? List.of()
                : resp.failing_tests().stream()
                        .map(f -> new FailingTest(f.name(), f.file(), f.kind(), f.message(),
                                f.trace(), f.source_file(), f.source_line()))
                        .toList();
        log.info("Tests {}: {} run, {} failing", resp.passed() ? "passed" : "failed", resp.tests_run(), failures.size());
        return new TestRunOutcome(resp.passed(), failures);
    }

    // ------------------------------------------------------------------
    // FixApplier
    // ------------------------------------------------------------------

    @Override
    public boolean apply(String fixText, Map<String, String> targetContext) {
        log.info("Applying fix ({} chars) against {} file(s)", fixText.length(), targetContext.size());
        String body = toJson(new ApplyFixRequest(workspaceRef, fixText, targetContext));
        String respBody = post("/workspace/apply_fix", body, "applyFix", DEFAULT_TIMEOUT);

        ApplyFixResponse resp = read(respBody, ApplyFixResponse.class, "applyFix");
        if (resp.applied()) {
            log.info("Fix applied, files changed: {}", resp.files_changed());
        } else {
            log.warn("Executor declined the fix: {}", resp.detail());
        }
        return resp.applied();
    }

    // ------------------------------------------------------------------
    // SourceReader
    // ------------------------------------------------------------------

    @Override
    public Optional<String> read(String path) {
        String body = toJson(new ReadFileRequest(workspaceRef, path));
        String respBody = post("/workspace/read_file", body, "readFile " + path, DEFAULT_TIMEOUT);

        ReadFileResponse resp = read(respBody, ReadFileResponse.class, "readFile");
        if (!resp.exists() || resp.content() == null) {
            log.debug("File '{}' not found in workspace '{}'", path, workspaceRef);
            return Optional.empty();
        }
        return Optional.of(resp.content());
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** POST with an explicit timeout; returns response body as String. */
    private String post(String path, String jsonBody, String opName, Duration timeout) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutorException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (ExecutorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ExecutorException(opName + " failed", e);
        }
    }

    private <T> T read(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Failed to parse " + opName + " response", e);
        }
    }

    /** Serialize obj to JSON string; throws ExecutorException on failure. */
    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("JSON serialization failed", e);
        }
    }
}
