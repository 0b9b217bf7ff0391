package com.quorumfix.orchestrator.consensus;

/**
 * Order in which valid responses are fed to the greedy clustering pass.
 * Cluster membership depends on it; the winning score does not.
 */
public enum ClusterOrder {

    /** Order of the response list, which a fan-out returns in registry order. */
    AS_RECEIVED,

    /** Heaviest provider first, so higher-weighted fixes seed the clusters. Stable for equal weights. */
    WEIGHT_DESCENDING
}
