package io.blockmon.core.recorder;

import java.util.*;

/**
 * {@link CoverageProvider} fed explicitly through {@link #hit(String, int)}.
 * Suits harnesses that already get line events from an agent or a debugger
 * interface and only need them grouped by test. Hits while stopped or with no
 * context active are dropped.
 */
public final class ManualCoverageProvider implements CoverageProvider {

    private final Map<String, Map<String, Set<Integer>>> lines = new LinkedHashMap<>();
    private String context;
    private boolean started;

    @Override
    public synchronized void start() {
        started = true;
    }

    @Override
    public synchronized void stop() {
        started = false;
    }

    @Override
    public synchronized boolean isStarted() {
        return started;
    }

    @Override
    public synchronized void switchContext(String context) {
        this.context = context;
    }

    /** Records that {@code line} of {@code filename} executed. */
    public synchronized void hit(String filename, int line) {
        if (!started || context == null) {
            return;
        }
        lines.computeIfAbsent(context, k -> new LinkedHashMap<>())
                .computeIfAbsent(filename, k -> new TreeSet<>())
                .add(line);
    }

    @Override
    public synchronized Map<String, Map<String, Set<Integer>>> linesByContext() {
        Map<String, Map<String, Set<Integer>>> copy = new LinkedHashMap<>();
        lines.forEach((ctx, files) -> {
            Map<String, Set<Integer>> filesCopy = new LinkedHashMap<>();
            files.forEach((f, l) -> filesCopy.put(f, new TreeSet<>(l)));
            copy.put(ctx, filesCopy);
        });
        return copy;
    }

    @Override
    public synchronized void addLines(String context, Map<String, Set<Integer>> added) {
        Map<String, Set<Integer>> files = lines.computeIfAbsent(context, k -> new LinkedHashMap<>());
        added.forEach((f, l) -> files.computeIfAbsent(f, k -> new TreeSet<>()).addAll(l));
    }

    @Override
    public synchronized void erase() {
        lines.clear();
    }
}
