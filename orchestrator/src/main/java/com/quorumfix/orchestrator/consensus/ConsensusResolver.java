package com.quorumfix.orchestrator.consensus;

import com.quorumfix.orchestrator.agent.ProviderResponse;
import com.quorumfix.orchestrator.provider.ProviderConfigurationException;
import com.quorumfix.orchestrator.provider.ProviderId;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Weighted vote over one set of provider responses.
 *
 * <ol>
 *   <li>Drop responses that failed or carry no fix.</li>
 *   <li>Greedy single pass: each response joins the existing cluster whose
 *       representative it matches best, if that match reaches the similarity
 *       threshold; otherwise it opens a new cluster. Ties go to the older cluster.</li>
 *   <li>Rank clusters by Σ weight × confidence, descending. The sort is stable,
 *       so equal scores keep their creation order.</li>
 *   <li>The top cluster wins if it has at least {@code minAgreement} members
 *       and a weighted confidence of at least {@code minConfidence}.</li>
 *   <li>Flag close races, low confidence and fragmentation. Flags never change
 *       the verdict.</li>
 * </ol>
 *
 * Stateless between calls; safe to share.
 */
@Component
public class ConsensusResolver {

    private static final Logger log = LoggerFactory.getLogger(ConsensusResolver.class);

    private final ConsensusProperties properties;
    private final MeterRegistry       meterRegistry;

    public ConsensusResolver(ConsensusProperties properties, MeterRegistry meterRegistry) {
        this.properties    = properties;
        this.meterRegistry = meterRegistry;
    }

    public ConsensusDecision resolve(List<ProviderResponse> responses, Map<ProviderId, Double> weights) {
        return resolve(responses, weights, properties.thresholds());
    }

    /**
     * @param weights voting weight per provider; providers missing from the map
     *                vote with the configured default weight
     * @throws ProviderConfigurationException if a weight is negative, NaN or infinite
     */
    public ConsensusDecision resolve(List<ProviderResponse> responses,
                                     Map<ProviderId, Double> weights,
                                     ConsensusThresholds thresholds) {
        validateWeights(weights);

        List<ProviderResponse> valid = responses.stream()
                .filter(ProviderResponse::hasProposal)
                .toList();

        log.debug("Resolving consensus over {} response(s), {} with a proposal", responses.size(), valid.size());

        if (valid.isEmpty()) {
            log.warn("No valid responses to analyze");
            record("no_valid_responses");
            return ConsensusDecision.noValidResponses();
        }

        List<FixCluster> clusters = cluster(order(valid, weights), weights);
        clusters.sort(Comparator.comparingDouble(FixCluster::weightedScore).reversed());

        if (log.isDebugEnabled()) {
            for (int i = 0; i < clusters.size(); i++) {
                FixCluster c = clusters.get(i);
                log.debug("Cluster {}: {} provider(s) {}, score {}",
                        i + 1, c.size(), tags(c.providers()), format(c.weightedScore()));
            }
        }

        List<String> conflicts = detectConflicts(clusters);

        FixCluster top = clusters.get(0);
        int supporters = top.size();
        double weightedConfidence = top.weightedConfidence();

        boolean hasConsensus = supporters >= thresholds.minAgreement()
                && weightedConfidence >= thresholds.minConfidence();

        List<ConsensusDecision.Alternative> alternatives = clusters.stream()
                .skip(1)
                .map(c -> new ConsensusDecision.Alternative(c.representativeFix(), c.weightedScore(), c.providers()))
                .toList();

        String reasoning = hasConsensus
                ? consensusReasoning(top, weightedConfidence, conflicts)
                : noConsensusReasoning(top, weightedConfidence, thresholds, alternatives, conflicts);

        if (hasConsensus) {
            log.info("Consensus reached: {} provider(s) {} agree, weighted confidence {}",
                    supporters, tags(top.providers()), format(weightedConfidence));
        } else {
            log.info("No consensus across {} cluster(s): {}", clusters.size(), reasoning);
        }
        record(hasConsensus ? "consensus" : "no_consensus");

        return new ConsensusDecision(
                hasConsensus,
                hasConsensus ? top.representativeFix() : "",
                weightedConfidence,
                top.providers(),
                top.weightedScore(),
                reasoning,
                alternatives,
                conflicts);
    }

    // ------------------------------------------------------------------
    // Clustering
    // ------------------------------------------------------------------

    private List<ProviderResponse> order(List<ProviderResponse> valid, Map<ProviderId, Double> weights) {
        if (properties.getClusterOrder() == ClusterOrder.WEIGHT_DESCENDING) {
            List<ProviderResponse> sorted = new ArrayList<>(valid);
            sorted.sort(Comparator.comparingDouble((ProviderResponse r) -> weightOf(r.provider(), weights)).reversed());
            return sorted;
        }
        return valid;
    }

    private List<FixCluster> cluster(List<ProviderResponse> ordered, Map<ProviderId, Double> weights) {
        double threshold = properties.getSimilarityThreshold();
        List<FixCluster> clusters = new ArrayList<>();

        for (ProviderResponse response : ordered) {
            double weight = weightOf(response.provider(), weights);

            FixCluster best = null;
            double bestSimilarity = -1.0;
            for (FixCluster candidate : clusters) {
                // A cluster that cannot reach the threshold can never be joined.
                if (TextSimilarity.upperBound(response.proposedFix(), candidate.representativeFix()) < threshold) {
                    continue;
                }
                double similarity = TextSimilarity.ratio(response.proposedFix(), candidate.representativeFix());
                if (similarity > bestSimilarity) {
                    best = candidate;
                    bestSimilarity = similarity;
                }
            }

            if (best != null && bestSimilarity >= threshold) {
                best.add(response, weight);
                log.debug("Grouped {} with existing cluster (similarity {})",
                        response.provider().tag(), format(bestSimilarity));
            } else {
                clusters.add(new FixCluster(response, weight));
                log.debug("Opened new cluster for {}", response.provider().tag());
            }
        }
        return clusters;
    }

    private double weightOf(ProviderId provider, Map<ProviderId, Double> weights) {
        Double weight = weights.get(provider);
        return weight != null ? weight : properties.getDefaultWeight();
    }

    private static void validateWeights(Map<ProviderId, Double> weights) {
        if (weights == null) {
            throw new ProviderConfigurationException("Provider weight map is missing");
        }
        weights.forEach((provider, weight) -> {
            if (weight == null || weight.isNaN() || weight.isInfinite() || weight < 0.0) {
                throw new ProviderConfigurationException(
                        "Invalid weight for provider " + provider.tag() + ": " + weight);
            }
        });
    }

    // ------------------------------------------------------------------
    // Conflicts and reasoning
    // ------------------------------------------------------------------

    private List<String> detectConflicts(List<FixCluster> clusters) {
        List<String> conflicts = new ArrayList<>();

        if (clusters.size() >= 2) {
            double top    = clusters.get(0).weightedScore();
            double second = clusters.get(1).weightedScore();
            double ratio  = properties.getCloseDecisionRatio();
            if (second >= top * ratio) {
                conflicts.add("Close decision: Top fix has weight %s, second has %s (within %d%%)"
                        .formatted(format(top), format(second), Math.round((1.0 - ratio) * 100)));
            }
        }

        double topAverage = clusters.get(0).averageConfidence();
        if (topAverage < properties.getLowConfidenceThreshold()) {
            conflicts.add("Low confidence: Top fix has average confidence " + format(topAverage));
        }

        if (clusters.size() >= properties.getHighDisagreementClusters()) {
            conflicts.add("High disagreement: " + clusters.size() + " different fix proposals");
        }

        if (!conflicts.isEmpty()) {
            log.debug("Detected conflicts: {}", conflicts);
        }
        return conflicts;
    }

    private static String consensusReasoning(FixCluster top, double weightedConfidence, List<String> conflicts) {
        StringBuilder sb = new StringBuilder()
                .append("Consensus reached with ").append(top.size()).append(" providers agreeing ")
                .append("(weighted confidence: ").append(format(weightedConfidence)).append("). ")
                .append("Supporting providers: ").append(tags(top.providers())).append('.');
        if (!conflicts.isEmpty()) {
            sb.append(" Note: ").append(String.join("; ", conflicts));
        }
        return sb.toString();
    }

    private static String noConsensusReasoning(FixCluster top,
                                               double weightedConfidence,
                                               ConsensusThresholds thresholds,
                                               List<ConsensusDecision.Alternative> alternatives,
                                               List<String> conflicts) {
        List<String> reasons = new ArrayList<>();
        if (top.size() < thresholds.minAgreement()) {
            reasons.add("only %d providers agree (need %d)".formatted(top.size(), thresholds.minAgreement()));
        }
        if (weightedConfidence < thresholds.minConfidence()) {
            reasons.add("weighted confidence %s below threshold %s"
                    .formatted(format(weightedConfidence), thresholds.minConfidence()));
        }

        StringBuilder sb = new StringBuilder("No consensus: ").append(String.join("; ", reasons)).append('.');
        if (!alternatives.isEmpty()) {
            sb.append(" Alternative fixes proposed by: ")
              .append(tags(alternatives.stream().flatMap(a -> a.providers().stream()).toList()))
              .append('.');
        }
        if (!conflicts.isEmpty()) {
            sb.append(" Conflicts: ").append(String.join("; ", conflicts));
        }
        return sb.toString();
    }

    private void record(String outcome) {
        meterRegistry.counter("quorumfix.consensus.decisions", "outcome", outcome).increment();
    }

    static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    static String tags(List<ProviderId> providers) {
        return providers.stream().map(ProviderId::tag).collect(Collectors.joining(", "));
    }
}
