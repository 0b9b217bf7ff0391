package com.quorumfix.orchestrator.loop;

import com.quorumfix.orchestrator.executor.ExecutorException;
import com.quorumfix.orchestrator.workspace.ContextSearch;
import com.quorumfix.orchestrator.workspace.FailingTest;
import com.quorumfix.orchestrator.workspace.SourceReader;
import com.quorumfix.orchestrator.workspace.TestRunOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the source files shown to the providers for one iteration.
 *
 * <ol>
 *   <li>Semantic search, when a {@link ContextSearch} exists: one query for the
 *       bug description and one per failure message (first few failures only).
 *       Hits without content are read from the workspace. A search error
 *       falls through to step 2.</li>
 *   <li>If step 1 produced nothing: the source and test files named by the
 *       failing tests.</li>
 * </ol>
 *
 * An empty result is valid; the providers then work from the failure text alone.
 */
@Component
public class ContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    private final Optional<ContextSearch> search;
    private final SourceReader            sources;
    private final LoopProperties          properties;

    public ContextAssembler(Optional<ContextSearch> search, SourceReader sources, LoopProperties properties) {
        this.search     = search;
        this.sources    = sources;
        this.properties = properties;
    }

    /** @return path to content, in discovery order */
    public Map<String, String> assemble(String bugDescription, TestRunOutcome outcome) {
        Map<String, String> context = new LinkedHashMap<>();

        search.ifPresent(s -> searchContext(s, bugDescription, outcome.failingTests(), context));

        if (context.isEmpty()) {
            loadFailureFiles(outcome.failingTests(), context);
        }

        log.info("Assembled code context: {} file(s), {} chars",
                context.size(), context.values().stream().mapToInt(String::length).sum());
        return Collections.unmodifiableMap(context);
    }

    // ------------------------------------------------------------------
    // Strategy 1: semantic search
    // ------------------------------------------------------------------

    private void searchContext(ContextSearch search, String bugDescription,
                               List<FailingTest> failures, Map<String, String> context) {
        List<String> queries = queries(bugDescription, failures);
        if (queries.isEmpty()) {
            return;
        }
        try {
            for (String query : queries) {
                for (ContextSearch.SearchHit hit : search.search(query,
                        properties.getContextSearchLimit(), properties.getContextSearchScoreThreshold())) {
                    String path = hit.filePath();
                    if (path == null || path.isBlank() || context.containsKey(path)) {
                        continue;
                    }
                    if (hit.content() != null && !hit.content().isEmpty()) {
                        context.put(path, hit.content());
                    } else {
                        sources.read(path).ifPresent(content -> context.put(path, content));
                    }
                    log.debug("Found via search: {} (score {})", path, hit.score());
                }
            }
            log.info("Context search found {} relevant file(s)", context.size());
        } catch (RuntimeException e) {
            log.warn("Context search failed, falling back to failing-test files: {}", e.getMessage());
        }
    }

    private List<String> queries(String bugDescription, List<FailingTest> failures) {
        List<String> queries = new ArrayList<>();
        if (bugDescription != null && !bugDescription.isBlank()) {
            queries.add(bugDescription);
        }
        failures.stream()
                .limit(properties.getContextSearchMaxFailures())
                .map(FailingTest::message)
                .filter(m -> m != null && !m.isBlank())
                .forEach(queries::add);
        return queries;
    }

    // ------------------------------------------------------------------
    // Strategy 2: files named by the failures
    // ------------------------------------------------------------------

    private void loadFailureFiles(List<FailingTest> failures, Map<String, String> context) {
        Set<String> paths = new LinkedHashSet<>();
        for (FailingTest failure : failures) {
            if (failure.sourceFile() != null && !failure.sourceFile().isBlank()) {
                paths.add(failure.sourceFile());
            }
            if (failure.file() != null && !failure.file().isBlank()) {
                paths.add(failure.file());
            }
        }

        for (String path : paths) {
            try {
                sources.read(path).ifPresentOrElse(
                        content -> {
                            context.put(path, content);
                            log.debug("Loaded {} ({} chars)", path, content.length());
                        },
                        () -> log.debug("Named file {} does not exist, skipping", path));
            } catch (ExecutorException e) {
                log.error("Failed to load {}: {}", path, e.getMessage());
            }
        }
    }
}
