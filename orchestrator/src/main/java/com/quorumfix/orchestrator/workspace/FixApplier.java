package com.quorumfix.orchestrator.workspace;

import java.util.Map;

/**
 * Applies a proposed fix to the workspace. How the text is turned into file
 * edits is up to the implementation.
 */
public interface FixApplier {

    /**
     * @param fixText       the consensus fix
     * @param targetContext the files that were shown to the providers, path to content
     * @return whether the fix was applied
     */
    boolean apply(String fixText, Map<String, String> targetContext);
}
