package com.quorumfix.orchestrator.loop;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Repair loop defaults, bound from {@code quorumfix.loop.*}.
 */
@Component
@ConfigurationProperties(prefix = "quorumfix.loop")
public class LoopProperties {

    private int    maxIterations               = 5;
    private int    contextSearchLimit          = 5;
    private double contextSearchScoreThreshold = 0.7;
    // Failure messages used as extra search queries, besides the bug description.
    private int    contextSearchMaxFailures    = 3;
    // Finished runs kept for lookup; older ones are evicted.
    private int    retainedRuns                = 100;

    public int getMaxIterations() { return maxIterations; }
    public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }

    public int getContextSearchLimit() { return contextSearchLimit; }
    public void setContextSearchLimit(int contextSearchLimit) { this.contextSearchLimit = contextSearchLimit; }

    public double getContextSearchScoreThreshold() { return contextSearchScoreThreshold; }
    public void setContextSearchScoreThreshold(double contextSearchScoreThreshold) {
        this.contextSearchScoreThreshold = contextSearchScoreThreshold;
    }

    public int getContextSearchMaxFailures() { return contextSearchMaxFailures; }
    public void setContextSearchMaxFailures(int contextSearchMaxFailures) {
        this.contextSearchMaxFailures = contextSearchMaxFailures;
    }

    public int getRetainedRuns() { return retainedRuns; }
    public void setRetainedRuns(int retainedRuns) { this.retainedRuns = retainedRuns; }
}
