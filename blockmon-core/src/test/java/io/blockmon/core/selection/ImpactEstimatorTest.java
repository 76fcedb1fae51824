package io.blockmon.core.selection;

import io.blockmon.core.config.BlockmonConfig;
import io.blockmon.core.fingerprint.Fingerprints;
import io.blockmon.core.git.GitRepository;
import io.blockmon.core.selection.ImpactEstimator.ImpactReport;
import io.blockmon.core.source.SourceTree;
import io.blockmon.core.store.FileFingerprint;
import io.blockmon.core.store.TestExecutionRecord;
import io.blockmon.core.store.embedded.EmbeddedFingerprintStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class ImpactEstimatorTest {

    private static final String GREETER = "src/main/java/com/example/Greeter.java";
    private static final String HELLO = "src/test/java/com/example/GreeterTest.java::GreeterTest::hello";
    private static final String BYE = "src/test/java/com/example/GreeterTest.java::GreeterTest::bye";

    @TempDir
    Path tempDir;

    private EmbeddedFingerprintStore store;
    private SourceTree tree;

    private static String greeter(String byeWord) {
        return String.join("\n",
                "package com.example;",
                "",
                "public class Greeter {",
                "    String hello() {",
                "        return \"hello\";",
                "    }",
                "",
                "    String bye() {",
                "        return \"" + byeWord + "\";",
                "    }",
                "}",
                "");
    }

    @BeforeEach
    void recordBaseline() throws IOException {
        Path file = tempDir.resolve(GREETER);
        Files.createDirectories(file.getParent());
        Files.writeString(file, greeter("bye"));

        BlockmonConfig config = BlockmonConfig.builder().build();
        tree = new SourceTree(tempDir, config, GitRepository.open(tempDir, 10));
        store = EmbeddedFingerprintStore.open(tempDir.resolve(config.dataFile()), 100);
        long id = store.initiateExecution("default", "", "17", Map.of()).executionId();

        Map<String, TestExecutionRecord> records = new LinkedHashMap<>();
        records.put(HELLO, record(5, false));
        records.put(BYE, record(9, true));
        store.insertTestFileFps(id, records);
    }

    @AfterEach
    void closeStore() {
        store.close();
    }

    private TestExecutionRecord record(int coveredLine, boolean failed) {
        List<Integer> checksums = Fingerprints.create(tree.module(GREETER).orElseThrow(), Set.of(coveredLine));
        FileFingerprint fp = new FileFingerprint(GREETER, tree.fsha(GREETER).orElseThrow(), checksums);
        return new TestExecutionRecord(0.2, failed, false, List.of(fp), Set.of(), Set.of());
    }

    @Test
    void unchangedTreeAffectsNothing() {
        ImpactReport report = new ImpactEstimator(tree).estimate(store, "default");

        assertTrue(report.baseline());
        assertTrue(report.changedFiles().isEmpty());
        assertTrue(report.affectedTests().isEmpty());
        assertEquals(Set.of(BYE), report.failingTests());
        assertEquals(2, report.knownTests());
    }

    @Test
    void changedBlockAffectsItsTests() throws IOException {
        Files.writeString(tempDir.resolve(GREETER), greeter("goodbye"));
        tree.clear();

        ImpactReport report = new ImpactEstimator(tree).estimate(store, "default");

        assertEquals(Set.of(GREETER), report.changedFiles());
        assertEquals(Set.of(BYE), report.affectedTests());
        assertEquals(Set.of(BYE), report.testsToRun());
        assertEquals(Set.of("src/test/java/com/example/GreeterTest.java"), report.testFilesToRun());
    }

    @Test
    void unknownEnvironmentHasNoBaseline() {
        ImpactReport report = new ImpactEstimator(tree).estimate(store, "jdk21");

        assertFalse(report.baseline());
        assertEquals(0, report.knownTests());
    }

    @Test
    void consistencyCheckFlagsTestsTheStoreMissed() throws IOException {
        Files.writeString(tempDir.resolve(GREETER), greeter("goodbye"));
        tree.clear();
        long id = store.lookupExecution("default").getAsLong();
        ConsistencyCheck check = new ConsistencyCheck(tree);

        ConsistencyCheck.Outcome agreeing = check.run(store, id, List.of(GREETER), Set.of(BYE));
        ConsistencyCheck.Outcome missing = check.run(store, id, List.of(GREETER), Set.of());

        assertTrue(agreeing.consistent());
        assertEquals(Set.of(HELLO, BYE), agreeing.checkedTests());
        assertEquals(Set.of(BYE), agreeing.locallyAffected());
        assertFalse(missing.consistent());
        assertEquals(Set.of(BYE), missing.missedByStore());
    }
}
