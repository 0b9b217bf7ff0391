package com.quorumfix.orchestrator.llm;

import com.quorumfix.orchestrator.provider.ProviderProfile;

import java.util.concurrent.CompletableFuture;

/**
 * One outbound request to one provider.
 *
 * Implementations must not block the caller: the returned future completes
 * with the raw response body on a 2xx status, or exceptionally with
 * {@link ProviderApiException} (non-2xx) or the underlying I/O failure.
 * Retry and backoff are not the transport's concern here.
 */
public interface ProviderTransport {

    CompletableFuture<String> send(ProviderProfile profile, String apiKey, String prompt);
}
