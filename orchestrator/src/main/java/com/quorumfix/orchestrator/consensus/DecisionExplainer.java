package com.quorumfix.orchestrator.consensus;

import java.util.List;

/**
 * Multi-line, human-readable report of a {@link ConsensusDecision}, written
 * to the log once per repair iteration.
 */
public final class DecisionExplainer {

    private static final String RULE = "=".repeat(80);
    private static final int    FIX_PREVIEW_CHARS = 200;

    private DecisionExplainer() {}

    public static String explain(ConsensusDecision decision) {
        StringBuilder sb = new StringBuilder();
        line(sb, RULE);
        line(sb, "CONSENSUS DECISION");
        line(sb, RULE);

        line(sb, decision.hasConsensus() ? "CONSENSUS REACHED" : "NO CONSENSUS");
        line(sb, "Confidence: " + ConsensusResolver.format(decision.confidence()));
        line(sb, "Total Weight: " + ConsensusResolver.format(decision.totalWeight()));
        if (decision.hasConsensus()) {
            line(sb, "Supporting Providers: " + ConsensusResolver.tags(decision.supportingProviders()));
        }
        line(sb, "");
        line(sb, "Reasoning:");
        line(sb, decision.reasoning());

        if (decision.hasConsensus()) {
            line(sb, "");
            line(sb, "Chosen Fix:");
            line(sb, decision.chosenFix());
        }

        List<ConsensusDecision.Alternative> alternatives = decision.alternatives();
        if (!alternatives.isEmpty()) {
            String label = decision.hasConsensus() ? "Alternative" : "Proposal";
            line(sb, "");
            line(sb, decision.hasConsensus() ? "Alternative Fixes Considered:" : "Proposed Fixes:");
            for (int i = 0; i < alternatives.size(); i++) {
                ConsensusDecision.Alternative alt = alternatives.get(i);
                line(sb, "  %s %d (weight: %s):".formatted(label, i + 1, ConsensusResolver.format(alt.weightedScore())));
                line(sb, "  Providers: " + ConsensusResolver.tags(alt.providers()));
                line(sb, "  Fix: " + preview(alt.fix()));
            }
        }

        if (!decision.conflicts().isEmpty()) {
            line(sb, "");
            line(sb, "Conflicts Detected:");
            decision.conflicts().forEach(c -> line(sb, "  - " + c));
        }

        sb.append(RULE);
        return sb.toString();
    }

    private static String preview(String fix) {
        return fix.length() <= FIX_PREVIEW_CHARS ? fix : fix.substring(0, FIX_PREVIEW_CHARS) + "...";
    }

    private static void line(StringBuilder sb, String text) {
        sb.append(text).append('\n');
    }
}
