package io.blockmon.core;

import io.blockmon.core.config.BlockmonConfig;
import io.blockmon.core.discovery.ImportScanner;
import io.blockmon.core.fingerprint.Fingerprints;
import io.blockmon.core.fingerprint.Module;
import io.blockmon.core.git.GitRepository;
import io.blockmon.core.mapping.ModulePathMapper;
import io.blockmon.core.recorder.ClassLoaderModuleLocator;
import io.blockmon.core.recorder.CoverageProvider;
import io.blockmon.core.recorder.DependencyTracker;
import io.blockmon.core.recorder.ExecutionRecorder;
import io.blockmon.core.selection.ConsistencyCheck;
import io.blockmon.core.selection.DiscoveryAggregator;
import io.blockmon.core.source.SourceTree;
import io.blockmon.core.store.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;

/**
 * Main orchestrator: opens the execution, works out which tests are stable,
 * records what runs, reconciles the stored test set and closes the execution.
 *
 * <p>Usage:
 * <pre>{@code
 * BlockmonConfig config = BlockmonConfig.fromEnvironment(System.getenv()).build();
 * SelectionEngine engine = new SelectionEngine(config, projectDir);
 * engine.determineStable();
 * ExecutionRecorder recorder = engine.newRecorder(coverage, engine.newDependencyTracker(loader));
 * // for each test: if (engine.shouldRun(id)) { recorder.testStarted(id); ...; recorder.testFinished(...) }
 * engine.reconcile(discoveredTests);
 * engine.close(durationSeconds);
 * }</pre>
 *
 * <p>When a network store fails, the engine switches to the embedded store
 * for the rest of the session and repeats the call there.
 */
public final class SelectionEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SelectionEngine.class);

    static final String ATTR_LAST_UNSTABLE = "selection.last_unstable";
    static final String ATTR_LAST_TOTAL = "selection.last_total";

    /** Phases of one run, in order. */
    public enum Phase { INIT, DIFF, DETERMINE, PARTITION, RECONCILE, CLOSE }

    /**
     * Outcome of selection.
     *
     * @param stableTests   tests whose every fingerprint still matches
     * @param unstableTests tests that must re-run
     * @param stableFiles   test files with no unstable test
     * @param unstableFiles test files owning at least one unstable test
     * @param failingTests  tests that failed last time; they run even when stable
     */
    public record SelectionResult(
            Set<String> stableTests,
            Set<String> unstableTests,
            Set<String> stableFiles,
            Set<String> unstableFiles,
            Set<String> failingTests
    ) {}

    /**
     * Installed packages and runtime of this process.
     *
     * @param packages       manifest, {@code "name version, name version"}
     * @param runtimeVersion Java version and vendor
     */
    public record RuntimeEnvironment(String packages, String runtimeVersion) {

        public static RuntimeEnvironment current() {
            return new RuntimeEnvironment(
                    PackageManifest.fromClasspath(System.getProperty("java.class.path")),
                    System.getProperty("java.version") + " " + System.getProperty("java.vendor"));
        }
    }

    @FunctionalInterface
    private interface StoreCall<T> {
        T apply(FingerprintStore store, long executionId);
    }

    private final BlockmonConfig config;
    private final Path projectDir;
    private final RuntimeEnvironment runtime;
    private final GitRepository git;
    private final SourceTree tree;
    private final ModulePathMapper mapper;
    private final ImportScanner imports;

    private FingerprintStore store;
    private long executionId = -1;
    private InitiatedExecution initiated;
    private Phase phase = Phase.INIT;
    private SelectionResult result;
    private Set<String> knownTests = Set.of();
    private int fallbacks;
    private boolean closed;

    public SelectionEngine(BlockmonConfig config, Path projectDir) {
        this(config, projectDir, openStore(config, projectDir), RuntimeEnvironment.current());
    }

    public SelectionEngine(BlockmonConfig config, Path projectDir, FingerprintStore store, RuntimeEnvironment runtime) {
        this.config = config;
        this.projectDir = projectDir.toAbsolutePath().normalize();
        this.store = store;
        this.runtime = runtime;
        this.git = GitRepository.open(this.projectDir, config.cacheSize());
        this.tree = new SourceTree(this.projectDir, config, git);
        this.mapper = new ModulePathMapper(this.projectDir, config);
        this.imports = new ImportScanner(this.projectDir, config, mapper);
    }

    private static FingerprintStore openStore(BlockmonConfig config, Path projectDir) {
        try {
            return StoreFactory.open(config, projectDir);
        } catch (StoreException e) {
            throw new IllegalStateException("Cannot open any fingerprint store: " + e.getMessage(), e);
        }
    }

    // ── Selection ───────────────────────────────────────────────────────

    /**
     * Runs INIT, DIFF, DETERMINE and PARTITION.
     */
    public SelectionResult determineStable() {
        log.info("=== blockmon selection ===");
        log.info("Project dir: {}", projectDir);
        log.info("Environment: {}", config.environment());
        log.info("Store: {}", store.isRemote() ? config.serverUrl() : config.dataFile());

        int fallbacksBefore = fallbacks;
        SelectionResult selection = select();
        if (fallbacks != fallbacksBefore) {
            // the remote answers so far were compared against a different baseline
            log.info("Repeating selection against the embedded store");
            selection = select();
        }
        return selection;
    }

    private SelectionResult select() {
        // Step 1: open the execution and hash every file it knows
        enter(Phase.INIT);
        if (initiated == null) {
            initiate();
        }
        Map<String, String> fshas = new TreeMap<>();
        for (String file : initiated.knownFilenames()) {
            fshas.put(file, tree.fsha(file).orElse(null));
        }
        if (initiated.packagesChanged()) {
            log.info("Changed packages: {}", initiated.changedPackageNames());
        }

        // Step 2: only files whose content hash differs need block checksums
        enter(Phase.DIFF);
        List<String> changed = withFallback((s, id) -> s.fetchUnknownFiles(id, fshas));
        log.info("Changed files: {} of {}", changed.size(), fshas.size());

        // Step 3: ask the store which tests those changes affect
        enter(Phase.DETERMINE);
        Map<String, List<Integer>> checksums = new LinkedHashMap<>();
        for (String file : changed) {
            Optional<Module> module = tree.module(file);
            if (module.isPresent() && module.get().parseable()) {
                checksums.put(file, module.get().checksums());
            } else {
                log.debug("{} is missing or does not parse; its tests are affected", file);
                checksums.put(file, null);
            }
        }
        Map<String, String> dependencyShas = new TreeMap<>();
        for (String file : withFallback((s, id) -> s.fileDependencyFilenames(id))) {
            dependencyShas.put(file, tree.dependencySha(file).orElse(null));
        }
        Set<String> changedPackages = initiated.changedPackageNames();
        DeterminedTests determined = withFallback(
                (s, id) -> s.determineTests(id, checksums, dependencyShas, changedPackages));

        if (config.consistencyCheck() && !changed.isEmpty()) {
            ConsistencyCheck check = new ConsistencyCheck(tree);
            withFallback((s, id) -> check.run(s, id, changed, determined.affected()));
        }

        // Step 4: partition the known tests
        enter(Phase.PARTITION);
        knownTests = new TreeSet<>(withFallback((s, id) -> s.allTestExecutions(id)).keySet());
        Set<String> unstable = new TreeSet<>(determined.affected());
        unstable.retainAll(knownTests);
        Set<String> stable = new TreeSet<>(knownTests);
        stable.removeAll(unstable);

        Set<String> unstableFiles = new TreeSet<>();
        unstable.forEach(t -> unstableFiles.add(TestIds.homeFile(t)));
        Set<String> stableFiles = new TreeSet<>();
        stable.forEach(t -> stableFiles.add(TestIds.homeFile(t)));
        stableFiles.removeAll(unstableFiles);

        Set<String> failing = new TreeSet<>(determined.failing());
        failing.retainAll(knownTests);

        result = new SelectionResult(stable, unstable, stableFiles, unstableFiles, failing);
        withFallback((s, id) -> s.fetchAttribute(id, ATTR_LAST_UNSTABLE))
                .ifPresent(last -> log.debug("Previous run selected {} unstable tests", last));
        log.info("=== Result: {} stable, {} unstable, {} failing of {} known tests ===",
                stable.size(), unstable.size(), failing.size(), knownTests.size());
        return result;
    }

    /**
     * True when {@code testId} must run: unknown to the store, unstable, or
     * failing. Everything runs before {@link #determineStable()} has completed.
     */
    public boolean shouldRun(String testId) {
        if (result == null || !knownTests.contains(testId)) {
            return true;
        }
        return result.unstableTests().contains(testId) || result.failingTests().contains(testId);
    }

    /** True when {@code testId} ran although it was known, stable and passing. */
    public boolean isForced(String testId) {
        return result != null && knownTests.contains(testId)
                && !result.unstableTests().contains(testId) && !result.failingTests().contains(testId);
    }

    public Optional<SelectionResult> result() {
        return Optional.ofNullable(result);
    }

    public Phase phase() {
        return phase;
    }

    public long executionId() {
        return executionId;
    }

    /** The store currently in use; changes if the engine fell back to the embedded store. */
    public FingerprintStore store() {
        return store;
    }

    public SourceTree sourceTree() {
        return tree;
    }

    // ── Recording ───────────────────────────────────────────────────────

    /** Tracker resolving loaded classes through {@code classLoader}. */
    public DependencyTracker newDependencyTracker(ClassLoader classLoader) {
        return new DependencyTracker(config, tree, mapper, new ClassLoaderModuleLocator(classLoader, mapper), imports);
    }

    /** Recorder writing each batch to the current store. */
    public ExecutionRecorder newRecorder(CoverageProvider coverage, DependencyTracker tracker) {
        ensureInitiated();
        return new ExecutionRecorder(config, tree, mapper, coverage, tracker,
                batch -> withFallback((s, id) -> {
                    s.insertTestFileFps(id, batch);
                    return null;
                }),
                this::isForced);
    }

    // ── Reconciliation ──────────────────────────────────────────────────

    /**
     * Aligns the stored tests with the tests discovered this run: unknown
     * tests get a placeholder so they are tracked from now on, tests no
     * longer discovered are deleted. Only the coordinator reconciles.
     */
    public void reconcile(Set<String> discovered) {
        if (config.role() != BlockmonConfig.Role.COORDINATOR) {
            log.debug("Worker process: leaving reconciliation to the coordinator");
            return;
        }
        ensureInitiated();
        enter(Phase.RECONCILE);
        if (discovered.isEmpty()) {
            log.warn("No tests were discovered; skipping reconciliation so stored tests are not wiped");
            return;
        }
        Set<String> stored = withFallback((s, id) -> s.allTestExecutions(id)).keySet();

        Set<String> removed = new TreeSet<>(stored);
        removed.removeAll(discovered);
        if (!removed.isEmpty()) {
            log.info("Deleting {} tests that no longer exist", removed.size());
            removed.forEach(t -> log.debug("  - {}", t));
            withFallback((s, id) -> {
                s.deleteTestExecutions(id, removed);
                return null;
            });
        }

        Map<String, TestExecutionRecord> placeholders = new TreeMap<>();
        for (String test : discovered) {
            if (!stored.contains(test)) {
                placeholders.put(test, placeholder(test));
            }
        }
        if (!placeholders.isEmpty()) {
            log.info("Tracking {} new tests", placeholders.size());
            withFallback((s, id) -> {
                s.insertTestFileFps(id, placeholders);
                return null;
            });
        }
    }

    /**
     * Reconciles once every worker has reported.
     *
     * @return false when reconciliation was skipped because workers are missing
     */
    public boolean reconcile(DiscoveryAggregator aggregator) {
        if (!aggregator.isComplete()) {
            log.warn("Skipping reconciliation: no discovery report from {}", aggregator.missingWorkers());
            return false;
        }
        reconcile(aggregator.discovered());
        return true;
    }

    private static TestExecutionRecord placeholder(String testId) {
        FileFingerprint home = new FileFingerprint(TestIds.homeFile(testId), null, Fingerprints.PLACEHOLDER);
        return new TestExecutionRecord(0, false, null, List.of(home), Set.of(), Set.of());
    }

    // ── Close ───────────────────────────────────────────────────────────

    /**
     * Persists saving statistics, finishes the execution and releases the store.
     *
     * @param duration run duration in seconds
     * @return statistics of the run
     */
    public SavingStats close(double duration) {
        if (closed) {
            return SavingStats.EMPTY;
        }
        SavingStats stats = SavingStats.EMPTY;
        try {
            if (initiated != null) {
                enter(Phase.CLOSE);
                boolean selected = result != null;
                stats = withFallback((s, id) -> s.fetchSavingStats(id, selected));
                if (result != null) {
                    withFallback((s, id) -> {
                        s.writeAttribute(id, ATTR_LAST_UNSTABLE, String.valueOf(result.unstableTests().size()));
                        s.writeAttribute(id, ATTR_LAST_TOTAL, String.valueOf(knownTests.size()));
                        return null;
                    });
                }
                withFallback((s, id) -> {
                    s.finishExecution(id, duration, selected);
                    return null;
                });
                log.info("=== Saved {} of {} tests this run, {} of {} overall ===",
                        stats.runSavedTests(), stats.runAllTests(), stats.totalSavedTests(), stats.totalAllTests());
            }
        } finally {
            closed = true;
            store.close();
            tree.clear();
            git.close();
        }
        return stats;
    }

    @Override
    public void close() {
        close(0);
    }

    // ── Store access ────────────────────────────────────────────────────

    private void initiate() {
        Map<String, String> metadata = metadata();
        try {
            initiated = store.initiateExecution(config.environment(), runtime.packages(), runtime.runtimeVersion(),
                    metadata);
        } catch (StoreException e) {
            if (!store.isRemote()) {
                throw e;
            }
            fallBack(e);
        }
        executionId = initiated.executionId();
    }

    private <T> T withFallback(StoreCall<T> call) {
        ensureInitiated();
        try {
            return call.apply(store, executionId);
        } catch (StoreException e) {
            if (!store.isRemote()) {
                throw e;
            }
            fallBack(e);
            return call.apply(store, executionId);
        }
    }

    private void fallBack(StoreException cause) {
        log.warn("Network store failed ({}); continuing with the embedded store {}", cause.getMessage(),
                config.dataFile());
        fallbacks++;
        FingerprintStore remote = store;
        try {
            store = StoreFactory.openEmbedded(config, projectDir);
        } catch (StoreException e) {
            e.addSuppressed(cause);
            throw new IllegalStateException("Cannot open any fingerprint store: " + e.getMessage(), e);
        } finally {
            remote.close();
        }
        initiated = store.initiateExecution(config.environment(), runtime.packages(), runtime.runtimeVersion(),
                metadata());
        executionId = initiated.executionId();
    }

    private void ensureInitiated() {
        if (closed) {
            throw new IllegalStateException("Selection engine is closed");
        }
        if (initiated == null) {
            initiate();
        }
    }

    private Map<String, String> metadata() {
        Map<String, String> metadata = new TreeMap<>();
        String version = SelectionEngine.class.getPackage().getImplementationVersion();
        metadata.put("client_version", version != null ? version : "dev");
        git.headCommit().ifPresent(sha -> metadata.put("git_head_sha", sha));
        metadata.put("ci", String.valueOf(System.getenv("CI") != null));
        if (config.runId() != null) {
            metadata.put("run_id", config.runId());
        }
        return metadata;
    }

    private void enter(Phase next) {
        log.debug("Phase {} -> {}", phase, next);
        phase = next;
    }
}
