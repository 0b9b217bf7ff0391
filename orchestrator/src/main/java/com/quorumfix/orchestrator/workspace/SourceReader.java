package com.quorumfix.orchestrator.workspace;

import java.util.Optional;

/**
 * Reads a file from the workspace by repository-relative path.
 */
public interface SourceReader {

    /** Empty when the file does not exist. */
    Optional<String> read(String path);
}
