package com.quorumfix.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /workspace/read_file. {@code content} is null when
 * {@code exists} is false.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReadFileResponse(String path, boolean exists, String content) {}
