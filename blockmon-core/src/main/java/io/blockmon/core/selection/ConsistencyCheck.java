package io.blockmon.core.selection;

import io.blockmon.core.fingerprint.Fingerprints;
import io.blockmon.core.fingerprint.Module;
import io.blockmon.core.source.SourceTree;
import io.blockmon.core.store.ChangedFileData;
import io.blockmon.core.store.FingerprintStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Recomputes the affected tests of the changed files in process, matching
 * every stored fingerprint against the parsed current source, and compares
 * the outcome with the store's answer. A test this check finds affected that
 * the store did not is a selection bug; it is logged, not acted upon.
 */
public final class ConsistencyCheck {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyCheck.class);

    /**
     * @param checkedTests    tests with a fingerprint on a changed file
     * @param locallyAffected tests whose fingerprint does not match the current source
     * @param missedByStore   tests in {@code locallyAffected} the store did not report
     */
    public record Outcome(Set<String> checkedTests, Set<String> locallyAffected, Set<String> missedByStore) {

        public boolean consistent() {
            return missedByStore.isEmpty();
        }
    }

    private final SourceTree tree;

    public ConsistencyCheck(SourceTree tree) {
        this.tree = tree;
    }

    public Outcome run(FingerprintStore store, long executionId, Collection<String> changedFiles,
                       Set<String> storeAffected) {
        Set<String> checked = new TreeSet<>();
        Set<String> affected = new TreeSet<>();
        Map<String, Optional<Module>> modules = new HashMap<>();
        for (ChangedFileData row : store.fetchChangedFileData(executionId, changedFiles)) {
            checked.add(row.testName());
            Optional<Module> module = modules.computeIfAbsent(row.filename(), tree::module);
            if (module.isEmpty() || !Fingerprints.match(module.get(), row.methodChecksums())) {
                affected.add(row.testName());
            }
        }
        Set<String> missed = new TreeSet<>(affected);
        missed.removeAll(storeAffected);
        if (!missed.isEmpty()) {
            log.warn("Consistency check: {} tests have changed fingerprints but were not selected: {}",
                    missed.size(), missed);
        } else {
            log.debug("Consistency check passed for {} tests on {} changed files", checked.size(), changedFiles.size());
        }
        return new Outcome(checked, affected, missed);
    }
}
