package com.quorumfix.orchestrator.agent;

import com.quorumfix.orchestrator.provider.ProviderProfile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the per-provider analysis prompt.
 *
 * Every provider sees the same template (bug, failures, code, previous
 * attempts, response format) followed by its own steering clause from
 * {@link ProviderProfile#steering()}.
 */
@Component
public class PromptBuilder {

    private static final Map<String, String> FENCE_LANGUAGES = Map.ofEntries(
            Map.entry("java", "java"),
            Map.entry("kt",   "kotlin"),
            Map.entry("py",   "python"),
            Map.entry("js",   "javascript"),
            Map.entry("ts",   "typescript"),
            Map.entry("go",   "go"),
            Map.entry("rb",   "ruby"),
            Map.entry("rs",   "rust"),
            Map.entry("cs",   "csharp"),
            Map.entry("xml",  "xml"),
            Map.entry("yml",  "yaml"),
            Map.entry("yaml", "yaml")
    );

    public String build(ProviderProfile profile, AnalysisRequest request) {
        return baseTemplate(request) + "\n" + profile.steering();
    }

    String baseTemplate(AnalysisRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a senior software engineer debugging a failing test suite.\n\n");

        sb.append("**Bug Description:**\n")
          .append(request.bugDescription().isBlank() ? "(none given)" : request.bugDescription())
          .append("\n\n");

        sb.append("**Test Failures:**\n").append(request.failureText().strip()).append("\n\n");

        sb.append("**Code Context:**\n");
        if (request.codeContext().isEmpty()) {
            sb.append("(no source files could be located)\n");
        } else {
            request.codeContext().forEach((path, content) ->
                    sb.append("File: ").append(path).append('\n')
                      .append("```").append(fenceLanguage(path)).append('\n')
                      .append(content.stripTrailing()).append("\n```\n\n"));
        }

        List<String> previous = request.previousAttempts();
        if (!previous.isEmpty()) {
            sb.append("\nPrevious fix attempts that failed (do not propose these again):\n");
            for (int i = 0; i < previous.size(); i++) {
                sb.append("Attempt ").append(i + 1).append(":\n").append(previous.get(i).strip()).append("\n");
            }
        }

        sb.append("""

                **Your Task:**
                1. Analyze the bug thoroughly
                2. Identify the root cause
                3. Propose a specific fix with exact code changes
                4. Explain your reasoning
                5. Estimate your confidence (0.0 to 1.0)

                **Response Format (JSON):**
                {
                    "analysis": "Your detailed analysis of the bug",
                    "root_cause": "The underlying cause of the issue",
                    "proposed_fix": "Exact code changes needed (use diff format)",
                    "reasoning": "Why this fix will work",
                    "confidence": 0.85,
                    "alternative_approaches": ["Other possible fixes if confidence is low"]
                }

                Provide ONLY the JSON response, no other text.
                """);
        return sb.toString();
    }

    static String fenceLanguage(String path) {
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot == path.length() - 1) return "";
        return FENCE_LANGUAGES.getOrDefault(path.substring(dot + 1).toLowerCase(Locale.ROOT), "");
    }
}
