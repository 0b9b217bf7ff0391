package com.quorumfix.orchestrator.agent;

import com.quorumfix.orchestrator.llm.ProviderApiException;
import com.quorumfix.orchestrator.llm.ProviderTransport;
import com.quorumfix.orchestrator.provider.CredentialResolver;
import com.quorumfix.orchestrator.provider.ProviderId;
import com.quorumfix.orchestrator.provider.ProviderProfile;
import com.quorumfix.orchestrator.provider.ProviderRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Asks every selected provider for a diagnosis and a fix, all at once.
 *
 * <p>One task per provider is started under this call and the call only
 * returns once every task has either completed or hit its own deadline,
 * so no request outlives the fan-out. Each task writes to its own slot;
 * the returned list is in registry order, one entry per selected provider.
 *
 * <p>Per-provider problems (timeout, HTTP error, unreadable payload,
 * missing API key) come back as responses with {@code failure} set. The
 * only exception this method raises is
 * {@link com.quorumfix.orchestrator.provider.ProviderConfigurationException},
 * before any request is sent.
 *
 * <p>Metrics:
 * <pre>
 *   quorumfix.provider.calls{provider, status="success|timeout|transport_error|parse_error|missing_credential"}
 *   quorumfix.provider.duration{provider}
 * </pre>
 */
@Component
public class FanOutCoordinator {

    private static final Logger log = LoggerFactory.getLogger(FanOutCoordinator.class);

    private final ProviderRegistry   registry;
    private final ProviderTransport  transport;
    private final CredentialResolver credentials;
    private final PromptBuilder      promptBuilder;
    private final ResponseParser     parser;
    private final MeterRegistry      meterRegistry;

    public FanOutCoordinator(ProviderRegistry registry,
                             ProviderTransport transport,
                             CredentialResolver credentials,
                             PromptBuilder promptBuilder,
                             ResponseParser parser,
                             MeterRegistry meterRegistry) {
        this.registry      = registry;
        this.transport     = transport;
        this.credentials   = credentials;
        this.promptBuilder = promptBuilder;
        this.parser        = parser;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    public List<ProviderResponse> analyze(String bugDescription,
                                          Map<String, String> codeContext,
                                          String failureText,
                                          List<String> previousAttempts) {
        return analyze(new AnalysisRequest(bugDescription, codeContext, failureText, previousAttempts));
    }

    /**
     * Fan the request out and wait for every provider.
     *
     * @throws com.quorumfix.orchestrator.provider.ProviderConfigurationException
     *         if no provider is configured or the subset names an unknown one
     */
    public List<ProviderResponse> analyze(AnalysisRequest request) {
        List<ProviderProfile> selected = registry.select(request.providers());

        log.info("Fanning out to {} provider(s): {} ({} context files, {} previous attempts)",
                selected.size(),
                selected.stream().map(p -> p.id().tag()).toList(),
                request.codeContext().size(),
                request.previousAttempts().size());

        List<CompletableFuture<ProviderResponse>> slots = selected.stream()
                .map(profile -> dispatch(profile, request))
                .toList();

        // Every slot is bounded by its own deadline and never completes
        // exceptionally, so this join cannot hang or throw.
        CompletableFuture.allOf(slots.toArray(CompletableFuture[]::new)).join();
        List<ProviderResponse> responses = slots.stream().map(CompletableFuture::join).toList();

        long succeeded = responses.stream().filter(r -> !r.hasError()).count();
        log.info("Fan-out complete: {}/{} providers succeeded", succeeded, responses.size());
        return responses;
    }

    /** Configured voting weight per provider. */
    public Map<ProviderId, Double> providerWeights() {
        return registry.weights();
    }

    // ------------------------------------------------------------------
    // Per-provider task
    // ------------------------------------------------------------------

    private CompletableFuture<ProviderResponse> dispatch(ProviderProfile profile, AnalysisRequest request) {
        long started = System.nanoTime();

        CompletableFuture<String> call;
        try {
            Optional<String> apiKey = credentials.resolve(profile.credentialRef());
            if (apiKey.isEmpty()) {
                return CompletableFuture.completedFuture(
                        finish(profile, new ProviderCallResult.MissingCredential(profile.credentialRef()), started));
            }
            String prompt = promptBuilder.build(profile, request);
            call = transport.send(profile, apiKey.get(), prompt);
        } catch (RuntimeException e) {
            // Reported as this provider's transport error.
            call = CompletableFuture.failedFuture(e);
        }

        // orTimeout abandons the call at the deadline; a late body is discarded.
        return call
                .orTimeout(profile.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((body, error) -> interpret(profile, body, error))
                .thenApply(result -> finish(profile, result, started));
    }

    private ProviderCallResult interpret(ProviderProfile profile, String body, Throwable error) {
        if (error != null) {
            return classify(profile, error);
        }
        try {
            return parser.parse(profile.wireFormat(), body);
        } catch (RuntimeException e) {
            return new ProviderCallResult.ParseError(body == null ? "" : body,
                    "Unexpected error reading response: " + e.getMessage());
        }
    }

    static ProviderCallResult classify(ProviderProfile profile, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException || cause instanceof HttpTimeoutException) {
            return new ProviderCallResult.Timeout(profile.timeout());
        }
        if (cause instanceof ProviderApiException api) {
            return new ProviderCallResult.TransportError(api.getMessage(), api.statusCode());
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ProviderCallResult.TransportError(message, null);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private ProviderResponse finish(ProviderProfile profile, ProviderCallResult result, long startedNanos) {
        Duration latency = Duration.ofNanos(System.nanoTime() - startedNanos);
        ProviderResponse response = result.toResponse(profile.id(), latency);

        String tag = profile.id().tag();
        meterRegistry.timer("quorumfix.provider.duration", "provider", tag).record(latency);
        meterRegistry.counter("quorumfix.provider.calls", "provider", tag, "status", result.status()).increment();

        MDC.put("provider", tag);
        try {
            if (response.hasError()) {
                log.warn("Provider '{}' failed after {} ms: {}", tag, latency.toMillis(), response.error());
            } else {
                log.debug("Provider '{}' responded in {} ms with confidence {}",
                        tag, latency.toMillis(), response.confidence());
            }
        } finally {
            MDC.remove("provider");
        }
        return response;
    }
}
