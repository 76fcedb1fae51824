package io.blockmon.core.selection;

import io.blockmon.core.TestIds;
import io.blockmon.core.fingerprint.Fingerprints;
import io.blockmon.core.fingerprint.Module;
import io.blockmon.core.source.SourceTree;
import io.blockmon.core.store.ChangedFileData;
import io.blockmon.core.store.FingerprintStore;
import io.blockmon.core.store.StoredTestExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Estimates which tests the next run would select, without starting an
 * execution or writing to the store. Only source fingerprints are compared;
 * data files and package changes are not considered.
 */
public final class ImpactEstimator {

    private static final Logger log = LoggerFactory.getLogger(ImpactEstimator.class);

    /**
     * @param baseline      whether the store has a previous execution for the environment
     * @param changedFiles  files whose content differs from the stored version
     * @param affectedTests tests with a fingerprint that no longer matches
     * @param failingTests  tests that failed last time
     * @param knownTests    number of stored tests
     */
    public record ImpactReport(
            boolean baseline,
            Set<String> changedFiles,
            Set<String> affectedTests,
            Set<String> failingTests,
            int knownTests
    ) {

        /** Tests that would run: affected or failing. */
        public Set<String> testsToRun() {
            Set<String> run = new TreeSet<>(affectedTests);
            run.addAll(failingTests);
            return run;
        }

        /** Test files owning at least one test that would run. */
        public Set<String> testFilesToRun() {
            Set<String> files = new TreeSet<>();
            testsToRun().forEach(t -> files.add(TestIds.homeFile(t)));
            return files;
        }
    }

    private final SourceTree tree;

    public ImpactEstimator(SourceTree tree) {
        this.tree = tree;
    }

    public ImpactReport estimate(FingerprintStore store, String environment) {
        OptionalLong execution = store.lookupExecution(environment);
        if (execution.isEmpty()) {
            log.info("No recorded execution for environment '{}': every test would run", environment);
            return new ImpactReport(false, Set.of(), Set.of(), Set.of(), 0);
        }
        long executionId = execution.getAsLong();

        Set<String> changed = new TreeSet<>();
        store.filenamesFingerprints(executionId).forEach((file, storedSha) -> {
            Optional<String> current = tree.fsha(file);
            if (storedSha == null || current.isEmpty() || !current.get().equals(storedSha)) {
                changed.add(file);
            }
        });

        Set<String> affected = new TreeSet<>();
        Map<String, Optional<Module>> modules = new HashMap<>();
        for (ChangedFileData row : store.fetchChangedFileData(executionId, changed)) {
            Optional<Module> module = modules.computeIfAbsent(row.filename(), tree::module);
            if (module.isEmpty() || !Fingerprints.match(module.get(), row.methodChecksums())) {
                affected.add(row.testName());
            }
        }

        Map<String, StoredTestExecution> tests = store.allTestExecutions(executionId);
        Set<String> failing = new TreeSet<>();
        tests.values().stream().filter(StoredTestExecution::failed).forEach(t -> failing.add(t.testName()));

        log.info("=== Impact: {} changed files, {} affected and {} failing of {} tests ===",
                changed.size(), affected.size(), failing.size(), tests.size());
        return new ImpactReport(true, changed, affected, failing, tests.size());
    }
}
