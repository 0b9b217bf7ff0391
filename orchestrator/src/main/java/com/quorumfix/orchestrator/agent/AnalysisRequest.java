package com.quorumfix.orchestrator.agent;

import com.quorumfix.orchestrator.provider.ProviderId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Input to one fan-out.
 *
 * @param codeContext      path to file content, in the order it should appear in the prompt; may be empty
 * @param failureText      formatted test failures; must be non-blank
 * @param previousAttempts fixes already applied without turning the tests green, oldest first
 * @param providers        subset to ask, or {@code null} for every configured provider
 */
public record AnalysisRequest(
        String              bugDescription,
        Map<String, String> codeContext,
        String              failureText,
        List<String>        previousAttempts,
        Set<ProviderId>     providers
) {
    public AnalysisRequest {
        if (failureText == null || failureText.isBlank()) {
            throw new IllegalArgumentException("failureText must not be blank; nothing to analyse after a passing run");
        }
        bugDescription   = bugDescription == null ? "" : bugDescription;
        codeContext      = codeContext == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(codeContext));
        previousAttempts = previousAttempts == null ? List.of() : List.copyOf(previousAttempts);
        providers        = providers == null ? null : Set.copyOf(providers);
    }

    public AnalysisRequest(String bugDescription, Map<String, String> codeContext,
                           String failureText, List<String> previousAttempts) {
        this(bugDescription, codeContext, failureText, previousAttempts, null);
    }
}
