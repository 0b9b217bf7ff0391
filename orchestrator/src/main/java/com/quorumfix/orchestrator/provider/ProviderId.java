package com.quorumfix.orchestrator.provider;

/**
 * The LLM backends QuorumFix knows how to steer.
 *
 * Each id carries the short steering clause appended to the shared prompt
 * template. Providers are deliberately not interchangeable: the clauses
 * push each model toward a different kind of diagnosis so the consensus
 * step sees independent proposals.
 */
public enum ProviderId {
    GPT4    ("gpt4",     "Focus on architectural issues and complex logic bugs."),
    CLAUDE  ("claude",   "Focus on API usage patterns and code structure."),
    QWEN    ("qwen",     "Focus on syntax errors and quick fixes. Be concise."),
    DEEPSEEK("deepseek", "Focus on edge cases and subtle bugs.");

    private final String tag;
    private final String defaultSteering;

    ProviderId(String tag, String defaultSteering) {
        this.tag             = tag;
        this.defaultSteering = defaultSteering;
    }

    /** Lower-case tag used in logs, metrics and API payloads. */
    public String tag()             { return tag; }
    public String defaultSteering() { return defaultSteering; }
}
