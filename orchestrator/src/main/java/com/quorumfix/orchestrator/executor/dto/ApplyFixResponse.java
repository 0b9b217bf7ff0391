package com.quorumfix.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response from POST /workspace/apply_fix.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApplyFixResponse(
        boolean applied,
        List<String> files_changed,
        String detail
) {}
