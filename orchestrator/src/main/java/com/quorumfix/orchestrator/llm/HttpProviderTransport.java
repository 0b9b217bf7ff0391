package com.quorumfix.orchestrator.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quorumfix.orchestrator.provider.ProviderProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * {@link ProviderTransport} over the JDK's {@link HttpClient}.
 *
 * Requests go out with {@code sendAsync}, so a fan-out of N providers holds
 * no thread per provider while waiting. The per-request timeout is the
 * profile's timeout; the coordinator applies the same deadline to the
 * returned future so a stalled body read is also bounded.
 */
@Component
public class HttpProviderTransport implements ProviderTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpProviderTransport.class);

    private final HttpClient   http;
    private final ObjectMapper json;

    public HttpProviderTransport(ObjectMapper objectMapper) {
        this.json = objectMapper;
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public CompletableFuture<String> send(ProviderProfile profile, String apiKey, String prompt) {
        String requestBody;
        try {
            requestBody = json.writeValueAsString(profile.wireFormat().requestBody(profile, prompt));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(profile.endpoint())
                .timeout(profile.timeout())
                .POST(HttpRequest.BodyPublishers.ofString(requestBody));
        profile.wireFormat().headers(profile, apiKey).forEach(builder::header);

        log.debug("POST {} for provider '{}' ({} prompt chars)",
                profile.endpoint(), profile.id().tag(), prompt.length());

        return http.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (response.statusCode() < 200 || response.statusCode() >= 300) {
                        throw new ProviderApiException(response.statusCode(), response.body());
                    }
                    return response.body();
                });
    }
}
