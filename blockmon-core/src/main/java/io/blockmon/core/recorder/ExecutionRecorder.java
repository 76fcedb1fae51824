package io.blockmon.core.recorder;

import io.blockmon.core.TestIds;
import io.blockmon.core.config.BlockmonConfig;
import io.blockmon.core.fingerprint.Fingerprints;
import io.blockmon.core.fingerprint.Module;
import io.blockmon.core.mapping.ModulePathMapper;
import io.blockmon.core.source.SourceTree;
import io.blockmon.core.store.FileDependency;
import io.blockmon.core.store.FileFingerprint;
import io.blockmon.core.store.TestExecutionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;
import java.util.function.Predicate;

/**
 * Turns coverage and captured dependencies of executed tests into
 * {@link TestExecutionRecord}s, a batch at a time.
 *
 * <p>One coverage scope spans up to {@code batchSize} consecutive tests, each
 * test being its own coverage context. The batch is flushed when it is full,
 * when the harness reports there is no next test, or when a test is
 * interrupted. An interrupted test is never written: it stays unrecorded and
 * will be selected again next run.
 *
 * <p>Not thread-safe; the harness calls it from the thread running tests.
 */
public final class ExecutionRecorder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRecorder.class);

    /** Receives each flushed batch, keyed by test id. */
    @FunctionalInterface
    public interface BatchSink {
        void write(Map<String, TestExecutionRecord> batch);
    }

    private record Finished(TestOutcome outcome, TrackedDependencies dependencies) {}

    private final BlockmonConfig config;
    private final SourceTree tree;
    private final ModulePathMapper mapper;
    private final CoverageProvider coverage;
    private final DependencyTracker tracker;
    private final BatchSink sink;
    private final Predicate<String> forced;
    private final CoverageStack stack = new CoverageStack();
    private final Map<String, Finished> batch = new LinkedHashMap<>();
    private boolean scopeOpen;
    private int flushes;

    /**
     * @param forced tells whether a test ran although selection considered it stable
     */
    public ExecutionRecorder(BlockmonConfig config, SourceTree tree, ModulePathMapper mapper,
                             CoverageProvider coverage, DependencyTracker tracker,
                             BatchSink sink, Predicate<String> forced) {
        this.config = config;
        this.tree = tree;
        this.mapper = mapper;
        this.coverage = coverage;
        this.tracker = tracker;
        this.sink = sink;
        this.forced = forced;
    }

    // ── Harness callbacks ───────────────────────────────────────────────

    public void testStarted(String testId) {
        if (!scopeOpen) {
            stack.push(coverage);
            scopeOpen = true;
        }
        coverage.switchContext(testId);
        tracker.start(testId);
    }

    /**
     * @param nextTestId the test the harness runs next, or null if this was the last one
     */
    public void testFinished(String testId, TestOutcome outcome, String nextTestId) {
        coverage.switchContext(null);
        batch.put(testId, new Finished(outcome, tracker.stop()));
        if (batch.size() >= config.batchSize() || nextTestId == null) {
            flush();
        }
    }

    /** The test did not complete: drop its capture and flush the tests before it. */
    public void testInterrupted(String testId) {
        coverage.switchContext(null);
        tracker.discard();
        batch.remove(testId);
        log.warn("Test {} was interrupted; it will not be recorded", testId);
        flush();
    }

    /** Number of batches written so far. */
    public int flushes() {
        return flushes;
    }

    /** Flushes the pending batch. */
    @Override
    public void close() {
        flush();
    }

    // ── Flush ───────────────────────────────────────────────────────────

    /** Stops the coverage scope and writes every finished test of the batch. */
    public void flush() {
        if (!scopeOpen) {
            return;
        }
        Map<String, Map<String, Set<Integer>>> lines = stack.pop(coverage);
        scopeOpen = false;
        coverage.erase();
        if (batch.isEmpty()) {
            return;
        }

        Map<String, TestExecutionRecord> records = new LinkedHashMap<>();
        for (Map.Entry<String, Finished> e : batch.entrySet()) {
            String testId = e.getKey();
            records.put(testId, toRecord(testId, e.getValue(), lines.getOrDefault(testId, Map.of())));
        }
        batch.clear();
        sink.write(records);
        flushes++;
        log.debug("Flushed batch {} with {} tests", flushes, records.size());
    }

    private TestExecutionRecord toRecord(String testId, Finished finished, Map<String, Set<Integer>> rawLines) {
        Map<String, Set<Integer>> lines = new TreeMap<>();
        rawLines.forEach((file, covered) -> normalize(file).ifPresent(f ->
                lines.computeIfAbsent(f, k -> new TreeSet<>()).addAll(covered)));

        TrackedDependencies deps = finished.dependencies();
        for (String file : deps.moduleFiles()) {
            lines.computeIfAbsent(file, k -> new TreeSet<>()).add(Fingerprints.MODULE_LOADED_LINE);
        }
        String homeFile = TestIds.homeFile(testId);
        if (!lines.containsKey(homeFile) && tree.exists(homeFile)) {
            lines.put(homeFile, new TreeSet<>(Set.of(Fingerprints.MODULE_LOADED_LINE)));
        }

        List<FileFingerprint> fingerprints = new ArrayList<>();
        for (Map.Entry<String, Set<Integer>> e : lines.entrySet()) {
            String file = e.getKey();
            Optional<String> fsha = tree.fsha(file);
            Optional<Module> module = tree.module(file);
            if (fsha.isEmpty() || module.isEmpty()) {
                log.debug("Skipping {} for {}: file is gone", file, testId);
                continue;
            }
            List<Integer> checksums = Fingerprints.create(module.get(), e.getValue());
            if (!checksums.isEmpty()) {
                fingerprints.add(new FileFingerprint(file, fsha.get(), checksums));
            }
        }

        Set<FileDependency> fileDependencies = new HashSet<>();
        for (String file : deps.fileReads()) {
            tree.dependencySha(file).ifPresent(sha -> fileDependencies.add(new FileDependency(file, sha)));
        }

        TestOutcome outcome = finished.outcome();
        return new TestExecutionRecord(outcome.duration(), outcome.failed(), forced.test(testId),
                fingerprints, fileDependencies, deps.externalPackages());
    }

    /** Project-relative form of a coverage filename; empty for files outside the project. */
    private Optional<String> normalize(String filename) {
        Path path = Path.of(filename);
        Optional<String> relative = path.isAbsolute() ? tree.relativize(path) : Optional.of(filename.replace('\\', '/'));
        return relative.filter(f -> !mapper.isExcluded(f));
    }
}
