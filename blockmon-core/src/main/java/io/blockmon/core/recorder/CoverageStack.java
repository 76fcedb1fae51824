package io.blockmon.core.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Stack of active coverage providers. Only the top provider collects; when a
 * nested scope is popped its lines are folded into the provider below, which
 * then resumes.
 */
public final class CoverageStack {

    private static final Logger log = LoggerFactory.getLogger(CoverageStack.class);

    private final Deque<CoverageProvider> providers = new ArrayDeque<>();

    /** Suspends the current top provider and starts {@code provider}. */
    public void push(CoverageProvider provider) {
        CoverageProvider top = providers.peek();
        if (top != null && top.isStarted()) {
            top.stop();
        }
        providers.push(provider);
        provider.start();
        log.debug("Coverage scope pushed, depth {}", providers.size());
    }

    /**
     * Stops {@code provider} and returns what it collected.
     *
     * @throws IllegalStateException if {@code provider} is not the top of the stack
     */
    public Map<String, Map<String, Set<Integer>>> pop(CoverageProvider provider) {
        CoverageProvider top = providers.peek();
        if (top != provider) {
            throw new IllegalStateException("Coverage stack is corrupted: popping a provider that is not on top"
                    + " (depth " + providers.size() + ")");
        }
        providers.pop();
        provider.stop();
        Map<String, Map<String, Set<Integer>>> data = provider.linesByContext();

        CoverageProvider enclosing = providers.peek();
        if (enclosing != null) {
            data.forEach(enclosing::addLines);
            enclosing.start();
        }
        log.debug("Coverage scope popped, depth {}", providers.size());
        return data;
    }

    public boolean isEmpty() {
        return providers.isEmpty();
    }

    public int depth() {
        return providers.size();
    }
}
