package io.blockmon.core.recorder;

import java.util.Map;
import java.util.Set;

/**
 * Line coverage source for the recorder. Lines are attributed to the context
 * that was active when they executed; the recorder uses the test id as the
 * context label.
 *
 * <p>Filenames may be absolute or project-relative.
 */
public interface CoverageProvider {

    void start();

    void stop();

    boolean isStarted();

    /**
     * Attributes subsequently executed lines to {@code context}; null attributes
     * them to no context at all.
     */
    void switchContext(String context);

    /** Context to filename to executed lines, for everything collected since the last erase. */
    Map<String, Map<String, Set<Integer>>> linesByContext();

    /** Merges lines collected elsewhere (a nested scope) into {@code context}. */
    void addLines(String context, Map<String, Set<Integer>> lines);

    /** Forgets all collected lines. */
    void erase();
}
