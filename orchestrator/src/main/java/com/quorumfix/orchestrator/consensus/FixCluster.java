package com.quorumfix.orchestrator.consensus;

import com.quorumfix.orchestrator.agent.ProviderResponse;
import com.quorumfix.orchestrator.provider.ProviderId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Responses whose proposed fixes are similar enough to count as one fix.
 *
 * Lives only for the duration of one {@link ConsensusResolver#resolve} call.
 * The representative text is the fix of the response that opened the cluster.
 * Scores are derived from the member list on every read.
 */
public final class FixCluster {

    private final String representativeFix;
    private final List<ProviderResponse> members = new ArrayList<>();
    private final List<Double>           weights = new ArrayList<>();

    FixCluster(ProviderResponse seed, double weight) {
        this.representativeFix = seed.proposedFix();
        add(seed, weight);
    }

    void add(ProviderResponse response, double weight) {
        members.add(response);
        weights.add(weight);
    }

    public String representativeFix() { return representativeFix; }

    public List<ProviderResponse> members() { return Collections.unmodifiableList(members); }

    public List<Double> weights() { return Collections.unmodifiableList(weights); }

    public int size() { return members.size(); }

    public List<ProviderId> providers() {
        return members.stream().map(ProviderResponse::provider).toList();
    }

    /** Σ weight × confidence over the members. */
    public double weightedScore() {
        double score = 0.0;
        for (int i = 0; i < members.size(); i++) {
            score += weights.get(i) * members.get(i).confidence();
        }
        return score;
    }

    /** Σ member weights. */
    public double totalWeight() {
        return weights.stream().mapToDouble(Double::doubleValue).sum();
    }

    /** Mean of the members' self-reported confidence, unweighted. */
    public double averageConfidence() {
        return members.stream().mapToDouble(ProviderResponse::confidence).average().orElse(0.0);
    }

    /** Weighted score normalised by the member weights; 0 when every weight is 0. */
    public double weightedConfidence() {
        double total = totalWeight();
        return total > 0 ? weightedScore() / total : 0.0;
    }
}
