package io.blockmon.core.recorder;

import io.blockmon.core.config.BlockmonConfig;
import io.blockmon.core.discovery.ImportScanner;
import io.blockmon.core.fingerprint.Fingerprints;
import io.blockmon.core.git.GitRepository;
import io.blockmon.core.mapping.ModulePathMapper;
import io.blockmon.core.source.SourceTree;
import io.blockmon.core.store.FileDependency;
import io.blockmon.core.store.FileFingerprint;
import io.blockmon.core.store.TestExecutionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionRecorderTest {

    private static final String CALC = "src/main/java/com/example/Calc.java";
    private static final String CALC_TEST = "src/test/java/com/example/CalcTest.java";
    private static final String ADDS = CALC_TEST + "::CalcTest::adds";
    private static final String SUBTRACTS = CALC_TEST + "::CalcTest::subtracts";

    private static final String CALC_SOURCE = String.join("\n",
            "package com.example;",
            "",
            "public class Calc {",
            "    public int add(int a, int b) {",
            "        return a + b;",
            "    }",
            "",
            "    public int sub(int a, int b) {",
            "        return a - b;",
            "    }",
            "}",
            "");

    @TempDir
    Path tempDir;

    private final List<Map<String, TestExecutionRecord>> batches = new ArrayList<>();
    private final ManualCoverageProvider coverage = new ManualCoverageProvider();
    private SourceTree tree;
    private DependencyTracker tracker;

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @BeforeEach
    void createProject() throws IOException {
        write(CALC, CALC_SOURCE);
        write(CALC_TEST, "package com.example;\nclass CalcTest {\n    void adds() { new Calc().add(1, 2); }\n}\n");
        write("data/rates.csv", "eur,1.0\n");
    }

    private ExecutionRecorder recorder(int batchSize, Predicate<String> forced) {
        BlockmonConfig config = BlockmonConfig.builder().batchSize(batchSize).build();
        ModulePathMapper mapper = new ModulePathMapper(tempDir, config);
        tree = new SourceTree(tempDir, config, GitRepository.open(tempDir, 10));
        tracker = new DependencyTracker(config, tree, mapper, ModuleOrigin::unknown,
                new ImportScanner(tempDir, config, mapper));
        return new ExecutionRecorder(config, tree, mapper, coverage, tracker, batches::add, forced);
    }

    private List<Integer> expected(String file, Integer... lines) {
        return Fingerprints.create(tree.module(file).orElseThrow(), new HashSet<>(Arrays.asList(lines)));
    }

    private static FileFingerprint fingerprintOf(TestExecutionRecord record, String file) {
        return record.fingerprints().stream()
                .filter(fp -> fp.filename().equals(file))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no fingerprint for " + file));
    }

    @Test
    void recordsFingerprintsOfCoveredBlocks() {
        ExecutionRecorder recorder = recorder(250, id -> false);

        recorder.testStarted(ADDS);
        coverage.hit(tempDir.resolve(CALC).toString(), 5);
        coverage.hit("/somewhere/else/Lib.java", 3);
        recorder.testFinished(ADDS, new TestOutcome(0.25, false), null);

        assertEquals(1, batches.size());
        TestExecutionRecord record = batches.get(0).get(ADDS);
        assertEquals(0.25, record.duration());
        assertFalse(record.failed());
        assertEquals(Boolean.FALSE, record.forced());

        FileFingerprint calc = fingerprintOf(record, CALC);
        assertEquals(tree.fsha(CALC).orElseThrow(), calc.fsha());
        assertEquals(expected(CALC, 0, 5), calc.methodChecksums());
        assertNotEquals(expected(CALC, 0, 9), calc.methodChecksums());
        assertEquals(2, record.fingerprints().size());
    }

    @Test
    void homeFileGetsModuleFingerprintWhenUncovered() {
        ExecutionRecorder recorder = recorder(250, id -> false);

        recorder.testStarted(ADDS);
        recorder.testFinished(ADDS, new TestOutcome(0.1, false), null);

        TestExecutionRecord record = batches.get(0).get(ADDS);
        assertEquals(expected(CALC_TEST, 0), fingerprintOf(record, CALC_TEST).methodChecksums());
        assertEquals(expected(CALC, 0), fingerprintOf(record, CALC).methodChecksums());
    }

    @Test
    void flushesWhenBatchIsFull() {
        ExecutionRecorder recorder = recorder(1, id -> false);

        recorder.testStarted(ADDS);
        coverage.hit(CALC, 5);
        recorder.testFinished(ADDS, new TestOutcome(0.1, false), SUBTRACTS);
        recorder.testStarted(SUBTRACTS);
        coverage.hit(CALC, 9);
        recorder.testFinished(SUBTRACTS, new TestOutcome(0.2, true), null);

        assertEquals(2, recorder.flushes());
        assertEquals(Set.of(ADDS), batches.get(0).keySet());
        assertEquals(Set.of(SUBTRACTS), batches.get(1).keySet());
        assertEquals(expected(CALC, 0, 9), fingerprintOf(batches.get(1).get(SUBTRACTS), CALC).methodChecksums());
        assertTrue(batches.get(1).get(SUBTRACTS).failed());
    }

    @Test
    void keepsTestsOfOneBatchApart() {
        ExecutionRecorder recorder = recorder(250, id -> false);

        recorder.testStarted(ADDS);
        coverage.hit(CALC, 5);
        recorder.testFinished(ADDS, new TestOutcome(0.1, false), SUBTRACTS);
        assertTrue(batches.isEmpty());

        recorder.testStarted(SUBTRACTS);
        coverage.hit(CALC, 9);
        recorder.testFinished(SUBTRACTS, new TestOutcome(0.1, false), null);

        assertEquals(1, batches.size());
        Map<String, TestExecutionRecord> batch = batches.get(0);
        assertEquals(expected(CALC, 0, 5), fingerprintOf(batch.get(ADDS), CALC).methodChecksums());
        assertEquals(expected(CALC, 0, 9), fingerprintOf(batch.get(SUBTRACTS), CALC).methodChecksums());
    }

    @Test
    void interruptedTestIsNotRecorded() {
        ExecutionRecorder recorder = recorder(250, id -> false);

        recorder.testStarted(ADDS);
        recorder.testFinished(ADDS, new TestOutcome(0.1, false), SUBTRACTS);
        recorder.testStarted(SUBTRACTS);
        coverage.hit(CALC, 9);
        recorder.testInterrupted(SUBTRACTS);

        assertEquals(1, batches.size());
        assertEquals(Set.of(ADDS), batches.get(0).keySet());
    }

    @Test
    void marksForcedTests() {
        ExecutionRecorder recorder = recorder(250, ADDS::equals);

        recorder.testStarted(ADDS);
        recorder.testFinished(ADDS, new TestOutcome(0.1, false), SUBTRACTS);
        recorder.testStarted(SUBTRACTS);
        recorder.testFinished(SUBTRACTS, new TestOutcome(0.1, false), null);

        assertEquals(Boolean.TRUE, batches.get(0).get(ADDS).forced());
        assertEquals(Boolean.FALSE, batches.get(0).get(SUBTRACTS).forced());
    }

    @Test
    void recordsDataFilesTheTestRead() {
        ExecutionRecorder recorder = recorder(250, id -> false);

        recorder.testStarted(ADDS);
        tracker.beforeFileRead(tempDir.resolve("data/rates.csv"));
        recorder.testFinished(ADDS, new TestOutcome(0.1, false), null);

        TestExecutionRecord record = batches.get(0).get(ADDS);
        String sha = tree.dependencySha("data/rates.csv").orElseThrow();
        assertEquals(Set.of(new FileDependency("data/rates.csv", sha)), record.fileDependencies());
    }

    @Test
    void closeFlushesPendingTests() {
        ExecutionRecorder recorder = recorder(250, id -> false);

        recorder.testStarted(ADDS);
        recorder.testFinished(ADDS, new TestOutcome(0.1, false), SUBTRACTS);
        assertTrue(batches.isEmpty());

        recorder.close();

        assertEquals(1, batches.size());
        assertEquals(1, recorder.flushes());
        recorder.close();
        assertEquals(1, batches.size());
    }
}
