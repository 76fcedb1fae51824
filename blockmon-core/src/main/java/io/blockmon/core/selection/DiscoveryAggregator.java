package io.blockmon.core.selection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Gathers the tests each worker discovered. Reconciliation may only delete
 * stored tests once every expected worker has reported, since a test missing
 * from one worker's set may belong to another.
 */
public final class DiscoveryAggregator {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryAggregator.class);

    private final Set<String> expectedWorkers;
    private final Map<String, Set<String>> reports = new TreeMap<>();

    public DiscoveryAggregator(Collection<String> expectedWorkers) {
        if (expectedWorkers.isEmpty()) {
            throw new IllegalArgumentException("at least one worker is required");
        }
        this.expectedWorkers = new TreeSet<>(expectedWorkers);
    }

    /** A single worker: the coordinator itself. */
    public static DiscoveryAggregator single() {
        return new DiscoveryAggregator(List.of("main"));
    }

    /**
     * Records the tests {@code workerId} discovered. A second report from the
     * same worker replaces the first.
     *
     * @throws IllegalArgumentException if the worker is not expected
     */
    public synchronized void report(String workerId, Collection<String> discovered) {
        if (!expectedWorkers.contains(workerId)) {
            throw new IllegalArgumentException("Unexpected worker: " + workerId);
        }
        reports.put(workerId, new TreeSet<>(discovered));
        log.debug("Worker {} discovered {} tests ({}/{} reported)", workerId, discovered.size(),
                reports.size(), expectedWorkers.size());
    }

    public synchronized boolean isComplete() {
        return reports.keySet().containsAll(expectedWorkers);
    }

    public synchronized Set<String> missingWorkers() {
        Set<String> missing = new TreeSet<>(expectedWorkers);
        missing.removeAll(reports.keySet());
        return missing;
    }

    /** Union of every report so far. */
    public synchronized Set<String> discovered() {
        Set<String> all = new TreeSet<>();
        reports.values().forEach(all::addAll);
        return all;
    }
}
