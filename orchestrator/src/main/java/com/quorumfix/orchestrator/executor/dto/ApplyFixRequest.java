package com.quorumfix.orchestrator.executor.dto;

import java.util.Map;

/**
 * Request body for POST /workspace/apply_fix.
 * {@code target_files} are the files the providers saw, path to content.
 */
public record ApplyFixRequest(
        String workspace_ref,
        String fix_text,
        Map<String, String> target_files
) {}
