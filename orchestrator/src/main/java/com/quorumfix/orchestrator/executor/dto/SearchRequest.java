package com.quorumfix.orchestrator.executor.dto;

/**
 * Request body for POST /search on the code search service.
 */
public record SearchRequest(
        String query,
        String collection,
        int    limit,
        double score_threshold
) {}
