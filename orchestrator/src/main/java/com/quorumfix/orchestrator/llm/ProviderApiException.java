package com.quorumfix.orchestrator.llm;

/**
 * A provider answered with a non-2xx HTTP status.
 */
public class ProviderApiException extends RuntimeException {

    private static final int MAX_BODY_CHARS = 500;

    private final int statusCode;

    public ProviderApiException(int statusCode, String body) {
        super("API error %d: %s".formatted(statusCode, abbreviate(body)));
        this.statusCode = statusCode;
    }

    public int statusCode() { return statusCode; }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= MAX_BODY_CHARS ? body : body.substring(0, MAX_BODY_CHARS) + "...";
    }
}
