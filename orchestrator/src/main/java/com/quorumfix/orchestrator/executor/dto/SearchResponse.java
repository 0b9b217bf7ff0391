package com.quorumfix.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response from POST /search.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchResponse(List<Result> results) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(String file, String content, double score) {}
}
