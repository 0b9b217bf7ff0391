package com.quorumfix.orchestrator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quorumfix.orchestrator.llm.WireFormat;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a provider's raw HTTP body into a {@link ProviderCallResult}.
 *
 * Two layers are peeled off:
 *   1. the API envelope (Anthropic / OpenAI shape) → the assistant's text
 *   2. the assistant's text → the JSON payload we asked for
 *
 * Models routinely wrap the payload in prose or a ```json fence, so the
 * payload is located leniently before it is decoded strictly. Anything that
 * still fails to decode becomes a {@link ProviderCallResult.ParseError}
 * carrying the raw text: nothing the provider said is silently dropped.
 */
@Component
public class ResponseParser {

    static final double DEFAULT_CONFIDENCE = 0.5;

    // ```json ... ```  (label is case-insensitive)
    private static final Pattern JSON_FENCE = Pattern.compile(
            "```json\\s*(.*?)```",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE
    );

    // ``` ... ``` with any (or no) language label
    private static final Pattern ANY_FENCE = Pattern.compile(
            "```[\\w+-]*[ \\t]*\\n?(.*?)```",
            Pattern.DOTALL
    );

    private final ObjectMapper json;

    public ResponseParser(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    // ------------------------------------------------------------------
    // Envelope + payload
    // ------------------------------------------------------------------

    public ProviderCallResult parse(WireFormat wireFormat, String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return new ProviderCallResult.ParseError("", "Empty response body");
        }
        JsonNode envelope;
        try {
            envelope = json.readTree(rawBody);
        } catch (JsonProcessingException e) {
            return new ProviderCallResult.ParseError(rawBody,
                    "Malformed response envelope: " + e.getOriginalMessage());
        }
        return wireFormat.extractText(envelope)
                .map(this::parsePayload)
                .orElseGet(() -> new ProviderCallResult.ParseError(rawBody, "No text content in response envelope"));
    }

    /**
     * Decode the structured payload from the assistant's text.
     * Every candidate span is tried in order; the first that decodes to a
     * JSON object wins. If none does, the first candidate's error is reported.
     */
    public ProviderCallResult parsePayload(String text) {
        List<String> candidates = jsonCandidates(text);
        if (candidates.isEmpty()) {
            return new ProviderCallResult.ParseError(text, "JSON parse error: no JSON object found in response");
        }
        String firstError = null;
        for (String candidate : candidates) {
            String error;
            try {
                JsonNode payload = json.readTree(candidate);
                if (payload != null && payload.isObject()) {
                    return success(payload);
                }
                error = "JSON parse error: payload is not an object";
            } catch (JsonProcessingException e) {
                error = "JSON parse error: " + e.getOriginalMessage();
            }
            if (firstError == null) {
                firstError = error;
            }
        }
        return new ProviderCallResult.ParseError(text, firstError);
    }

    private static ProviderCallResult.Success success(JsonNode payload) {
        return new ProviderCallResult.Success(
                textOf(payload.get("analysis")),
                textOf(payload.get("proposed_fix")),
                confidenceOf(payload.get("confidence")),
                textOf(payload.get("reasoning")),
                textOf(payload.get("root_cause")),
                listOf(payload.get("alternative_approaches")));
    }

    // ------------------------------------------------------------------
    // Payload location
    // ------------------------------------------------------------------

    /**
     * Candidate JSON spans inside a model reply, most specific first:
     * the body of a ```json fence, the bodies of other fences that start
     * with '{', and the span from the first '{' to the last '}'.
     *
     * A fix that carries its own code fence cuts the ```json body short,
     * which is why later candidates are still offered.
     */
    static List<String> jsonCandidates(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> candidates = new LinkedHashSet<>();
        Matcher jsonFence = JSON_FENCE.matcher(text);
        if (jsonFence.find()) {
            candidates.add(jsonFence.group(1).strip());
        }
        Matcher anyFence = ANY_FENCE.matcher(text);
        while (anyFence.find()) {
            String body = anyFence.group(1).strip();
            if (body.startsWith("{")) {
                candidates.add(body);
            }
        }
        int open  = text.indexOf('{');
        int close = text.lastIndexOf('}');
        if (open >= 0 && close > open) {
            candidates.add(text.substring(open, close + 1));
        }
        return List.copyOf(candidates);
    }

    // ------------------------------------------------------------------
    // Field coercion
    // ------------------------------------------------------------------

    // Some models return the fix as an object or list instead of a string.
    private static String textOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return "";
        return node.isTextual() ? node.asText() : node.toString();
    }

    private static double confidenceOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return DEFAULT_CONFIDENCE;
        double value = node.asDouble(DEFAULT_CONFIDENCE);
        if (Double.isNaN(value)) return DEFAULT_CONFIDENCE;
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static List<String> listOf(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) return values;
        if (node.isArray()) {
            node.forEach(item -> values.add(textOf(item)));
        } else {
            values.add(textOf(node));
        }
        values.removeIf(String::isBlank);
        return values;
    }
}
