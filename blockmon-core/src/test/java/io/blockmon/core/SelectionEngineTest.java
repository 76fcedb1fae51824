package io.blockmon.core;

import io.blockmon.core.SelectionEngine.Phase;
import io.blockmon.core.SelectionEngine.RuntimeEnvironment;
import io.blockmon.core.SelectionEngine.SelectionResult;
import io.blockmon.core.config.BlockmonConfig;
import io.blockmon.core.recorder.ExecutionRecorder;
import io.blockmon.core.recorder.ManualCoverageProvider;
import io.blockmon.core.recorder.TestOutcome;
import io.blockmon.core.selection.DiscoveryAggregator;
import io.blockmon.core.store.*;
import io.blockmon.core.store.embedded.EmbeddedFingerprintStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class SelectionEngineTest {

    private static final String CALC = "src/main/java/com/example/Calc.java";
    private static final String CALC_TEST = "src/test/java/com/example/CalcTest.java";
    private static final String ADDS = CALC_TEST + "::CalcTest::adds";
    private static final String SUBTRACTS = CALC_TEST + "::CalcTest::subtracts";
    private static final String MULTIPLIES = CALC_TEST + "::CalcTest::multiplies";

    private static final RuntimeEnvironment RUNTIME = new RuntimeEnvironment("junit-jupiter 5.10.2", "17.0.9 Test");

    @TempDir
    Path tempDir;

    private BlockmonConfig config;

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static String calc(String... subBody) {
        List<String> lines = new ArrayList<>(List.of(
                "package com.example;",
                "",
                "public class Calc {",
                "    public int add(int a, int b) {",
                "        return a + b;",
                "    }",
                "",
                "    public int sub(int a, int b) {"));
        lines.addAll(List.of(subBody));
        lines.addAll(List.of("    }", "}", ""));
        return String.join("\n", lines);
    }

    @BeforeEach
    void createProject() throws IOException {
        write(CALC, calc("        return a - b;"));
        write(CALC_TEST, "package com.example;\nclass CalcTest {\n    Calc calc = new Calc();\n}\n");
        config = BlockmonConfig.builder().build();
    }

    private SelectionEngine engine() {
        return new SelectionEngine(config, tempDir, StoreFactory.openEmbedded(config, tempDir), RUNTIME);
    }

    /** Runs every test that must run; each one covers the given Calc line. */
    private SavingStats session(Map<String, Integer> tests, Set<String> failing) {
        SelectionEngine engine = engine();
        engine.determineStable();
        ManualCoverageProvider coverage = new ManualCoverageProvider();
        ExecutionRecorder recorder = engine.newRecorder(coverage,
                engine.newDependencyTracker(getClass().getClassLoader()));
        List<String> toRun = new ArrayList<>();
        tests.keySet().stream().filter(engine::shouldRun).forEach(toRun::add);
        for (int i = 0; i < toRun.size(); i++) {
            String test = toRun.get(i);
            recorder.testStarted(test);
            coverage.hit(CALC, tests.get(test));
            String next = i + 1 < toRun.size() ? toRun.get(i + 1) : null;
            recorder.testFinished(test, new TestOutcome(0.5, failing.contains(test)), next);
        }
        recorder.close();
        engine.reconcile(tests.keySet());
        return engine.close(1.0);
    }

    private static Map<String, Integer> calcTests() {
        Map<String, Integer> tests = new LinkedHashMap<>();
        tests.put(ADDS, 5);
        tests.put(SUBTRACTS, 9);
        return tests;
    }

    @Test
    void everythingRunsWithoutHistory() {
        SelectionEngine engine = engine();

        SelectionResult result = engine.determineStable();

        assertTrue(result.stableTests().isEmpty());
        assertTrue(engine.shouldRun(ADDS));
        assertFalse(engine.isForced(ADDS));
        engine.close(0);
    }

    @Test
    void unchangedProjectIsStable() {
        SavingStats first = session(calcTests(), Set.of());
        assertEquals(0, first.runSavedTests());
        assertEquals(2, first.runAllTests());

        SelectionEngine engine = engine();
        assertEquals(Phase.INIT, engine.phase());
        SelectionResult result = engine.determineStable();
        assertEquals(Phase.PARTITION, engine.phase());

        assertEquals(Set.of(ADDS, SUBTRACTS), result.stableTests());
        assertTrue(result.unstableTests().isEmpty());
        assertEquals(Set.of(CALC_TEST), result.stableFiles());
        assertFalse(engine.shouldRun(ADDS));
        assertTrue(engine.isForced(ADDS));

        SavingStats second = engine.close(1.0);
        assertEquals(Phase.CLOSE, engine.phase());
        assertEquals(2, second.runSavedTests());
        assertEquals(2, second.totalSavedTests());
        assertEquals(4, second.totalAllTests());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 250})
    void testsSharingABlockAreBothAffectedWhateverTheBatchSize(int batchSize) throws IOException {
        config = BlockmonConfig.builder().batchSize(batchSize).build();
        Map<String, Integer> tests = new LinkedHashMap<>();
        tests.put(ADDS, 5);
        tests.put(MULTIPLIES, 5);
        session(tests, Set.of());
        write(CALC, calc("        return a - b;").replace("return a + b;", "return b + a;"));

        SelectionEngine engine = engine();
        SelectionResult result = engine.determineStable();

        assertEquals(Set.of(ADDS, MULTIPLIES), result.unstableTests());
        assertTrue(result.stableTests().isEmpty());
        engine.close(0);
    }

    @Test
    void changedBlockAffectsOnlyTestsCoveringIt() throws IOException {
        session(calcTests(), Set.of());
        write(CALC, calc("        return a - b - 0;"));

        SelectionEngine engine = engine();
        SelectionResult result = engine.determineStable();

        assertEquals(Set.of(SUBTRACTS), result.unstableTests());
        assertEquals(Set.of(ADDS), result.stableTests());
        assertEquals(Set.of(CALC_TEST), result.unstableFiles());
        assertTrue(result.stableFiles().isEmpty());
        assertTrue(engine.shouldRun(SUBTRACTS));
        assertFalse(engine.shouldRun(ADDS));
        engine.close(0);
    }

    @Test
    void commentOnlyEditKeepsTestsStable() throws IOException {
        session(calcTests(), Set.of());
        write(CALC, calc("        // difference", "        return a - b;"));

        SelectionEngine engine = engine();
        SelectionResult result = engine.determineStable();

        assertEquals(Set.of(ADDS, SUBTRACTS), result.stableTests());
        engine.close(0);
    }

    @Test
    void deletedSourceFileAffectsItsTests() throws IOException {
        session(calcTests(), Set.of());
        Files.delete(tempDir.resolve(CALC));

        SelectionEngine engine = engine();
        SelectionResult result = engine.determineStable();

        assertEquals(Set.of(ADDS, SUBTRACTS), result.unstableTests());
        engine.close(0);
    }

    @Test
    void failingTestRunsAgainEvenWhenStable() {
        session(calcTests(), Set.of(SUBTRACTS));

        SelectionEngine engine = engine();
        SelectionResult result = engine.determineStable();

        assertEquals(Set.of(SUBTRACTS), result.failingTests());
        assertTrue(result.stableTests().contains(SUBTRACTS));
        assertTrue(engine.shouldRun(SUBTRACTS));
        assertFalse(engine.isForced(SUBTRACTS));
        assertFalse(engine.shouldRun(ADDS));
        engine.close(0);
    }

    @Test
    void reconcileDeletesVanishedTestsAndTracksNewOnes() {
        session(calcTests(), Set.of());

        SelectionEngine engine = engine();
        engine.determineStable();
        engine.reconcile(Set.of(ADDS, MULTIPLIES));
        engine.close(1.0);

        SelectionEngine next = engine();
        SelectionResult result = next.determineStable();

        assertEquals(Set.of(ADDS), result.stableTests());
        assertEquals(Set.of(MULTIPLIES), result.unstableTests());
        assertFalse(next.shouldRun(ADDS));
        assertTrue(next.shouldRun(MULTIPLIES));
        assertTrue(next.shouldRun(SUBTRACTS), "a test unknown to the store always runs");
        next.close(0);
    }

    @Test
    void emptyDiscoveryDoesNotWipeTheStore() {
        session(calcTests(), Set.of());

        SelectionEngine engine = engine();
        engine.determineStable();
        engine.reconcile(Set.of());
        engine.close(0);

        SelectionEngine next = engine();
        assertEquals(Set.of(ADDS, SUBTRACTS), next.determineStable().stableTests());
        next.close(0);
    }

    @Test
    void workerLeavesReconciliationToTheCoordinator() {
        session(calcTests(), Set.of());
        config = BlockmonConfig.builder().role(BlockmonConfig.Role.WORKER).build();

        SelectionEngine engine = engine();
        engine.determineStable();
        engine.reconcile(Set.of(ADDS));
        engine.close(0);

        config = BlockmonConfig.builder().build();
        SelectionEngine next = engine();
        assertEquals(Set.of(ADDS, SUBTRACTS), next.determineStable().stableTests());
        next.close(0);
    }

    @Test
    void reconcileWaitsForEveryWorker() {
        session(calcTests(), Set.of());
        DiscoveryAggregator aggregator = new DiscoveryAggregator(List.of("w1", "w2"));
        aggregator.report("w1", List.of(ADDS));

        SelectionEngine engine = engine();
        engine.determineStable();
        assertFalse(engine.reconcile(aggregator));

        aggregator.report("w2", List.of(SUBTRACTS));
        assertTrue(engine.reconcile(aggregator));
        engine.close(0);
    }

    @Test
    void fallsBackToEmbeddedStoreWhenRemoteFails() {
        session(calcTests(), Set.of());
        FailingRemoteStore remote = new FailingRemoteStore();

        SelectionEngine engine = new SelectionEngine(config, tempDir, remote, RUNTIME);
        SelectionResult result = engine.determineStable();

        assertTrue(remote.closed);
        assertInstanceOf(EmbeddedFingerprintStore.class, engine.store());
        assertEquals(Set.of(ADDS, SUBTRACTS), result.stableTests());
        engine.close(0);
    }

    @Test
    void closedEngineRejectsFurtherUse() {
        SelectionEngine engine = engine();
        engine.determineStable();
        engine.close(0);

        assertEquals(SavingStats.EMPTY, engine.close(0));
        assertThrows(IllegalStateException.class, () -> engine.reconcile(Set.of(ADDS)));
    }

    /** Remote store whose server is never reachable. */
    private static final class FailingRemoteStore implements FingerprintStore {

        boolean closed;

        private static StoreUnavailableException down() {
            return new StoreUnavailableException("connection refused", null);
        }

        @Override
        public InitiatedExecution initiateExecution(String environment, String packages, String runtimeVersion,
                                                    Map<String, String> metadata) {
            throw down();
        }

        @Override
        public OptionalLong lookupExecution(String environment) { throw down(); }

        @Override
        public List<String> fetchUnknownFiles(long executionId, Map<String, String> filenameToFsha) { throw down(); }

        @Override
        public DeterminedTests determineTests(long executionId, Map<String, List<Integer>> filenameToChecksums,
                                              Map<String, String> fileDependencyShas, Set<String> changedPackages) {
            throw down();
        }

        @Override
        public void insertTestFileFps(long executionId, Map<String, TestExecutionRecord> records) { throw down(); }

        @Override
        public void deleteTestExecutions(long executionId, Collection<String> testNames) { throw down(); }

        @Override
        public Map<String, StoredTestExecution> allTestExecutions(long executionId) { throw down(); }

        @Override
        public Set<String> filenames(long executionId) { throw down(); }

        @Override
        public Map<String, String> filenamesFingerprints(long executionId) { throw down(); }

        @Override
        public List<ChangedFileData> fetchChangedFileData(long executionId, Collection<String> filenames) {
            throw down();
        }

        @Override
        public Set<String> fileDependencyFilenames(long executionId) { throw down(); }

        @Override
        public void writeAttribute(long executionId, String name, String value) { throw down(); }

        @Override
        public Optional<String> fetchAttribute(long executionId, String name) { throw down(); }

        @Override
        public SavingStats fetchSavingStats(long executionId, boolean selected) { throw down(); }

        @Override
        public void finishExecution(long executionId, double duration, boolean selected) { throw down(); }

        @Override
        public boolean isRemote() {
            return true;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
