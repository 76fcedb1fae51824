package io.blockmon.core.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlockmonConfigTest {

    @Test
    void defaultValues() {
        BlockmonConfig config = BlockmonConfig.builder().build();

        assertEquals("default", config.environment());
        assertEquals(".blockmondata", config.dataFile());
        assertEquals(250, config.batchSize());
        assertEquals(1, config.importDepth());
        assertEquals(List.of("src/main/java"), config.sourceDirs());
        assertEquals(List.of("src/test/java"), config.testDirs());
        assertFalse(config.networkEnabled());
        assertEquals("http://localhost:8004", config.serverUrl());
        assertEquals(3, config.maxAttempts());
        assertEquals(1024, config.gzipThreshold());
        assertFalse(config.consistencyCheck());
        assertEquals(BlockmonConfig.Role.COORDINATOR, config.role());
    }

    @Test
    void clampsNumericValues() {
        BlockmonConfig config = BlockmonConfig.builder()
                .batchSize(0)
                .importDepth(42)
                .maxAttempts(-3)
                .backoffMultiplier(0.1)
                .cacheSize(0)
                .build();

        assertEquals(1, config.batchSize());
        assertEquals(5, config.importDepth());
        assertEquals(1, config.maxAttempts());
        assertEquals(1.0, config.backoffMultiplier());
        assertEquals(1, config.cacheSize());
    }

    @Test
    void rejectsBlankEnvironmentAndDataFile() {
        assertThrows(IllegalArgumentException.class, () -> BlockmonConfig.builder().environment(" "));
        assertThrows(IllegalArgumentException.class, () -> BlockmonConfig.builder().dataFile(""));
    }

    @Test
    void serverUrlMustBeHttpAndLosesTrailingSlash() {
        assertThrows(IllegalArgumentException.class, () -> BlockmonConfig.builder().serverUrl("ftp://store"));
        assertEquals("https://store.example.com",
                BlockmonConfig.builder().serverUrl("https://store.example.com/").build().serverUrl());
    }

    @Test
    void networkStoreRequiresRepoId() {
        assertThrows(IllegalArgumentException.class,
                () -> BlockmonConfig.builder().networkEnabled(true).repoId(" ").build());
    }

    @Test
    void readsEnvironmentVariables() {
        BlockmonConfig config = BlockmonConfig.fromEnvironment(Map.of(
                "BLOCKMON_NET_ENABLED", "yes",
                "BLOCKMON_SERVER", "http://store:9000",
                "BLOCKMON_REPO_ID", "acme/shop",
                "BLOCKMON_JOB_ID", "unit",
                "BLOCKMON_AUTH_TOKEN", "s3cret",
                "BLOCKMON_DATAFILE", "custom.db",
                "BLOCKMON_ENVIRONMENT", "jdk17",
                "BLOCKMON_BATCH_SIZE", "10")).build();

        assertTrue(config.networkEnabled());
        assertEquals("http://store:9000", config.serverUrl());
        assertEquals("acme/shop", config.repoId());
        assertEquals("unit", config.jobId());
        assertEquals("s3cret", config.authToken());
        assertEquals("custom.db", config.dataFile());
        assertEquals("jdk17", config.environment());
        assertEquals(10, config.batchSize());
    }

    @Test
    void fallsBackToCiVariables() {
        BlockmonConfig config = BlockmonConfig.fromEnvironment(Map.of(
                "GITHUB_REPOSITORY", "acme/shop",
                "GITHUB_RUN_ID", "987")).build();

        assertEquals("acme/shop", config.repoId());
        assertEquals("987", config.runId());
        assertFalse(config.networkEnabled());
    }

    @Test
    void rejectsNonNumericBatchSize() {
        assertThrows(IllegalArgumentException.class,
                () -> BlockmonConfig.fromEnvironment(Map.of("BLOCKMON_BATCH_SIZE", "lots")));
    }

    @Test
    void recognizesSourceFilesByExtension() {
        BlockmonConfig config = BlockmonConfig.builder()
                .sourceExtensions(List.of("java", "kt"))
                .requestTimeout(Duration.ofSeconds(5))
                .build();

        assertTrue(config.isSourceFile("src/main/java/Foo.java"));
        assertTrue(config.isSourceFile("Bar.kt"));
        assertFalse(config.isSourceFile("data/input.json"));
        assertFalse(config.isSourceFile("Makefile"));
        assertEquals(Duration.ofSeconds(5), config.requestTimeout());
    }
}
