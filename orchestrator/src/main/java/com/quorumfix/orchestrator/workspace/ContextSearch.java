package com.quorumfix.orchestrator.workspace;

import java.util.List;

/**
 * Semantic search over the indexed codebase. Optional: when no bean exists
 * the repair loop loads the files named in the test failures instead.
 */
public interface ContextSearch {

    List<SearchHit> search(String query, int limit, double scoreThreshold);

    /** {@code content} may be null, in which case the caller reads the file itself. */
    record SearchHit(String filePath, String content, double score) {}
}
