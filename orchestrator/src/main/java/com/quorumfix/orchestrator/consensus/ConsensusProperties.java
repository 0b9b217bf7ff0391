package com.quorumfix.orchestrator.consensus;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Thresholds for the consensus resolver, bound from {@code quorumfix.consensus.*}.
 */
@Component
@ConfigurationProperties(prefix = "quorumfix.consensus")
public class ConsensusProperties {

    private double minConfidence           = 0.6;
    private int    minAgreement            = 2;
    private double similarityThreshold     = 0.7;
    private double closeDecisionRatio      = 0.8;
    private double lowConfidenceThreshold  = 0.7;
    private int    highDisagreementClusters = 4;
    private double defaultWeight           = 0.5;
    private ClusterOrder clusterOrder      = ClusterOrder.AS_RECEIVED;

    public ConsensusThresholds thresholds() {
        return new ConsensusThresholds(minAgreement, minConfidence);
    }

    public double getMinConfidence() { return minConfidence; }
    public void setMinConfidence(double minConfidence) { this.minConfidence = minConfidence; }

    public int getMinAgreement() { return minAgreement; }
    public void setMinAgreement(int minAgreement) { this.minAgreement = minAgreement; }

    public double getSimilarityThreshold() { return similarityThreshold; }
    public void setSimilarityThreshold(double similarityThreshold) { this.similarityThreshold = similarityThreshold; }

    public double getCloseDecisionRatio() { return closeDecisionRatio; }
    public void setCloseDecisionRatio(double closeDecisionRatio) { this.closeDecisionRatio = closeDecisionRatio; }

    public double getLowConfidenceThreshold() { return lowConfidenceThreshold; }
    public void setLowConfidenceThreshold(double lowConfidenceThreshold) { this.lowConfidenceThreshold = lowConfidenceThreshold; }

    public int getHighDisagreementClusters() { return highDisagreementClusters; }
    public void setHighDisagreementClusters(int highDisagreementClusters) { this.highDisagreementClusters = highDisagreementClusters; }

    public double getDefaultWeight() { return defaultWeight; }
    public void setDefaultWeight(double defaultWeight) { this.defaultWeight = defaultWeight; }

    public ClusterOrder getClusterOrder() { return clusterOrder; }
    public void setClusterOrder(ClusterOrder clusterOrder) { this.clusterOrder = clusterOrder; }
}
