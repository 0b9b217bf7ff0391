package com.quorumfix.orchestrator.executor.dto;

/**
 * Request body for POST /workspace/read_file.
 */
public record ReadFileRequest(String workspace_ref, String path) {}
