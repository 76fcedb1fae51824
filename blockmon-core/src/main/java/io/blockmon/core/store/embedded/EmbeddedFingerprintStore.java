package io.blockmon.core.store.embedded;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.blockmon.core.fingerprint.Checksums;
import io.blockmon.core.fingerprint.Fingerprints;
import io.blockmon.core.store.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.time.Instant;
import java.util.*;

/**
 * {@link FingerprintStore} on a single SQLite file.
 *
 * <p>One environment row is one execution: its id is the execution id, and
 * re-initiating the same environment updates the row in place. All public
 * methods are {@code synchronized} on the store; each write operation runs in
 * one transaction, so a partially inserted batch is never visible. File
 * fingerprint and file dependency ids are memoized in bounded caches.
 *
 * <p>{@link #close()} commits and checkpoints the write-ahead log so the data
 * file is complete on its own once the process exits.
 */
public final class EmbeddedFingerprintStore implements FingerprintStore {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedFingerprintStore.class);

    /** Max bound parameters per {@code IN (...)} clause. */
    private static final int CHUNK = 500;

    private static final String META_PREFIX = "meta.";

    @FunctionalInterface
    interface SqlCall<T> {
        T run(Connection connection) throws SQLException;
    }

    private record FingerprintKey(String filename, String fsha, String checksums) {}

    private final Path dataFile;
    private final Connection connection;
    private final Cache<FingerprintKey, Long> fingerprintIds;
    private final Cache<FileDependency, Long> dependencyIds;
    private boolean closed;

    private EmbeddedFingerprintStore(Path dataFile, Connection connection, int cacheSize) {
        this.dataFile = dataFile;
        this.connection = connection;
        this.fingerprintIds = Caffeine.newBuilder().maximumSize(cacheSize).build();
        this.dependencyIds = Caffeine.newBuilder().maximumSize(cacheSize).build();
    }

    /**
     * Opens (creating if needed) the store at {@code dataFile}.
     *
     * @throws StoreException if the file cannot be opened or has an incompatible schema
     */
    public static EmbeddedFingerprintStore open(Path dataFile, int cacheSize) {
        Connection connection = null;
        try {
            Path parent = dataFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            connection = DriverManager.getConnection("jdbc:sqlite:" + dataFile.toAbsolutePath());
            try (Statement st = connection.createStatement()) {
                st.execute("PRAGMA journal_mode=WAL");
                st.execute("PRAGMA foreign_keys=ON");
                st.execute("PRAGMA synchronous=NORMAL");
                st.execute("PRAGMA busy_timeout=10000");
            }
            Schema.apply(connection);
            connection.setAutoCommit(false);
            log.debug("Opened embedded store {}", dataFile);
            return new EmbeddedFingerprintStore(dataFile, connection, cacheSize);
        } catch (Exception e) {
            if (connection != null) {
                try {
                    connection.close();
                } catch (SQLException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            if (e instanceof StoreException se) {
                throw se;
            }
            throw new StoreException("Unable to open data file " + dataFile + ": " + e.getMessage(), e);
        }
    }

    public Path dataFile() {
        return dataFile;
    }

    /** Read-only reporting queries over this store. */
    public StoreReports reports() {
        return new StoreReports(this);
    }

    // ── Execution lifecycle ─────────────────────────────────────────────

    @Override
    public synchronized InitiatedExecution initiateExecution(String environment, String packages,
                                                             String runtimeVersion, Map<String, String> metadata) {
        return write("initiate execution", c -> {
            Long id = null;
            String oldPackages = null;
            String oldRuntime = null;
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT id, system_packages, runtime_version FROM environment WHERE environment_name = ?")) {
                ps.setString(1, environment);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        id = rs.getLong(1);
                        oldPackages = rs.getString(2);
                        oldRuntime = rs.getString(3);
                    }
                }
            }

            Set<String> changed = new TreeSet<>();
            if (id == null) {
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO environment (environment_name, system_packages, runtime_version) VALUES (?, ?, ?)")) {
                    ps.setString(1, environment);
                    ps.setString(2, packages);
                    ps.setString(3, runtimeVersion);
                    ps.executeUpdate();
                }
                id = lastInsertId(c);
                log.info("Created execution {} for environment '{}'", id, environment);
            } else {
                changed.addAll(PackageManifest.computeChanges(oldPackages, packages));
                if (!Objects.equals(oldRuntime, runtimeVersion)) {
                    changed.add(PackageManifest.RUNTIME_CHANGED);
                }
                if (!Objects.equals(oldPackages, packages) || !Objects.equals(oldRuntime, runtimeVersion)) {
                    try (PreparedStatement ps = c.prepareStatement(
                            "UPDATE environment SET system_packages = ?, runtime_version = ? WHERE id = ?")) {
                        ps.setString(1, packages);
                        ps.setString(2, runtimeVersion);
                        ps.setLong(3, id);
                        ps.executeUpdate();
                    }
                }
            }

            for (Map.Entry<String, String> e : metadata.entrySet()) {
                upsertAttribute(c, id, META_PREFIX + e.getKey(), e.getValue());
            }
            Set<String> known = filenamesOf(c, id);
            return new InitiatedExecution(id, known, !changed.isEmpty(), changed);
        });
    }

    @Override
    public synchronized OptionalLong lookupExecution(String environment) {
        return read("look up execution", c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT id FROM environment WHERE environment_name = ?")) {
                ps.setString(1, environment);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
                }
            }
        });
    }

    @Override
    public synchronized void finishExecution(long executionId, double duration, boolean selected) {
        write("finish execution", c -> {
            SavingStats stats = savingStats(c, executionId, selected);

            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO run_uid (environment_id, repo_run_id, git_head_sha, created) VALUES (?, ?, ?, ?)")) {
                ps.setLong(1, executionId);
                ps.setString(2, attribute(c, executionId, META_PREFIX + "run_id").orElse(null));
                ps.setString(3, attribute(c, executionId, META_PREFIX + "git_head_sha").orElse(null));
                ps.setString(4, Instant.now().toString());
                ps.executeUpdate();
            }
            long runUid = lastInsertId(c);

            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO run_infos (run_uid, environment_id, tests_saved, tests_all,
                                           run_time_saved, run_time_all, duration, selected)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)""")) {
                ps.setLong(1, runUid);
                ps.setLong(2, executionId);
                ps.setInt(3, stats.runSavedTests());
                ps.setInt(4, stats.runAllTests());
                ps.setDouble(5, stats.runSavedTime());
                ps.setDouble(6, stats.runAllTime());
                ps.setDouble(7, duration);
                ps.setBoolean(8, selected);
                ps.executeUpdate();
            }

            snapshot(c, runUid, executionId, """
                    INSERT INTO test_infos (run_uid, test_execution_id, test_name, duration, failed, forced)
                    SELECT ?, id, test_name, duration, failed, forced FROM test_execution WHERE environment_id = ?""");
            snapshot(c, runUid, executionId, """
                    INSERT INTO test_execution_file_fp_infos (run_uid, test_execution_id, fingerprint_id)
                    SELECT ?, tef.test_execution_id, tef.fingerprint_id
                    FROM test_execution_file_fp tef
                    JOIN test_execution te ON te.id = tef.test_execution_id
                    WHERE te.environment_id = ?""");
            snapshot(c, runUid, executionId, """
                    INSERT INTO file_fp_infos (run_uid, fingerprint_id, filename, fsha, method_checksums)
                    SELECT DISTINCT ?, f.id, f.filename, f.fsha, f.method_checksums
                    FROM file_fp f
                    JOIN test_execution_file_fp tef ON tef.fingerprint_id = f.id
                    JOIN test_execution te ON te.id = tef.test_execution_id
                    WHERE te.environment_id = ?""");

            try (Statement st = c.createStatement()) {
                int fps = st.executeUpdate(
                        "DELETE FROM file_fp WHERE id NOT IN (SELECT fingerprint_id FROM test_execution_file_fp)");
                int deps = st.executeUpdate("DELETE FROM file_dependency WHERE id NOT IN "
                        + "(SELECT file_dependency_id FROM test_execution_file_dependency)");
                log.debug("Pruned {} file fingerprints and {} file dependencies", fps, deps);
            }
            log.info("Finished execution {} as run {}: {}/{} tests saved", executionId, runUid,
                    stats.runSavedTests(), stats.runAllTests());
            return null;
        });
        fingerprintIds.invalidateAll();
        dependencyIds.invalidateAll();
    }

    private static void snapshot(Connection c, long runUid, long executionId, String sql) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, runUid);
            ps.setLong(2, executionId);
            ps.executeUpdate();
        }
    }

    // ── Change detection ────────────────────────────────────────────────

    @Override
    public synchronized List<String> fetchUnknownFiles(long executionId, Map<String, String> filenameToFsha) {
        return read("fetch unknown files", c -> {
            Map<String, Set<String>> stored = new HashMap<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT DISTINCT f.filename, f.fsha
                    FROM test_execution te
                    JOIN test_execution_file_fp tef ON tef.test_execution_id = te.id
                    JOIN file_fp f ON f.id = tef.fingerprint_id
                    WHERE te.environment_id = ?""")) {
                ps.setLong(1, executionId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        stored.computeIfAbsent(rs.getString(1), k -> new HashSet<>()).add(rs.getString(2));
                    }
                }
            }
            List<String> unknown = new ArrayList<>();
            for (Map.Entry<String, String> e : filenameToFsha.entrySet()) {
                Set<String> shas = stored.get(e.getKey());
                String current = e.getValue();
                if (shas == null || current == null || shas.stream().anyMatch(s -> !current.equals(s))) {
                    unknown.add(e.getKey());
                }
            }
            Collections.sort(unknown);
            return unknown;
        });
    }

    @Override
    public synchronized DeterminedTests determineTests(long executionId, Map<String, List<Integer>> filenameToChecksums,
                                                       Map<String, String> fileDependencyShas,
                                                       Set<String> changedPackages) {
        return write("determine tests", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE test_execution SET forced = NULL WHERE environment_id = ?")) {
                ps.setLong(1, executionId);
                ps.executeUpdate();
            }

            Set<String> affected = new TreeSet<>();

            Map<String, Set<Integer>> current = new HashMap<>();
            filenameToChecksums.forEach((f, sums) -> current.put(f, sums == null ? null : new HashSet<>(sums)));
            forEachChunk(filenameToChecksums.keySet(), chunk -> {
                String sql = """
                        SELECT te.test_name, f.filename, f.method_checksums
                        FROM test_execution te
                        JOIN test_execution_file_fp tef ON tef.test_execution_id = te.id
                        JOIN file_fp f ON f.id = tef.fingerprint_id
                        WHERE te.environment_id = ? AND f.filename IN (%s)""".formatted(placeholders(chunk.size()));
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    ps.setLong(1, executionId);
                    bind(ps, 2, chunk);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            String test = rs.getString(1);
                            if (affected.contains(test)) {
                                continue;
                            }
                            if (!fingerprintMatches(test, rs.getString(2), rs.getBytes(3), current)) {
                                affected.add(test);
                            }
                        }
                    }
                }
            });

            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT DISTINCT te.test_name
                    FROM test_execution te
                    JOIN test_execution_file_fp tef ON tef.test_execution_id = te.id
                    LEFT JOIN file_fp f ON f.id = tef.fingerprint_id
                    WHERE te.environment_id = ? AND f.id IS NULL""")) {
                ps.setLong(1, executionId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        log.warn("Test {} references a fingerprint the store no longer has; it must re-run",
                                rs.getString(1));
                        affected.add(rs.getString(1));
                    }
                }
            }

            forEachChunk(fileDependencyShas.keySet(), chunk -> {
                String sql = """
                        SELECT te.test_name, fd.filename, fd.sha
                        FROM test_execution te
                        JOIN test_execution_file_dependency tefd ON tefd.test_execution_id = te.id
                        JOIN file_dependency fd ON fd.id = tefd.file_dependency_id
                        WHERE te.environment_id = ? AND fd.filename IN (%s)""".formatted(placeholders(chunk.size()));
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    ps.setLong(1, executionId);
                    bind(ps, 2, chunk);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            String sha = fileDependencyShas.get(rs.getString(2));
                            if (sha == null || !sha.equals(rs.getString(3))) {
                                affected.add(rs.getString(1));
                            }
                        }
                    }
                }
            });

            if (changedPackages.contains(PackageManifest.RUNTIME_CHANGED)) {
                log.info("Runtime version changed: every test is affected");
                affected.addAll(testNames(c, executionId, "SELECT test_name FROM test_execution WHERE environment_id = ?"));
            } else if (!changedPackages.isEmpty()) {
                forEachChunk(changedPackages, chunk -> {
                    String sql = """
                            SELECT DISTINCT te.test_name
                            FROM test_execution te
                            JOIN test_external_dependency ted ON ted.test_execution_id = te.id
                            WHERE te.environment_id = ? AND ted.package_name IN (%s)""".formatted(placeholders(chunk.size()));
                    try (PreparedStatement ps = c.prepareStatement(sql)) {
                        ps.setLong(1, executionId);
                        bind(ps, 2, chunk);
                        try (ResultSet rs = ps.executeQuery()) {
                            while (rs.next()) {
                                affected.add(rs.getString(1));
                            }
                        }
                    }
                });
            }

            Set<String> failing = new TreeSet<>(testNames(c, executionId,
                    "SELECT test_name FROM test_execution WHERE environment_id = ? AND failed = 1"));
            return new DeterminedTests(affected, failing);
        });
    }

    private static boolean fingerprintMatches(String test, String filename, byte[] blob,
                                              Map<String, Set<Integer>> current) {
        Set<Integer> checksums = current.get(filename);
        if (checksums == null) {
            return false;
        }
        try {
            return checksums.containsAll(Checksums.fromBlob(blob));
        } catch (IllegalArgumentException e) {
            log.warn("Malformed fingerprint of {} on {}: {}", test, filename, e.getMessage());
            return false;
        }
    }

    // ── Test executions ─────────────────────────────────────────────────

    @Override
    public synchronized void insertTestFileFps(long executionId, Map<String, TestExecutionRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        write("insert test fingerprints", c -> {
            for (Map.Entry<String, TestExecutionRecord> e : records.entrySet()) {
                insertTest(c, executionId, e.getKey(), e.getValue());
            }
            return null;
        });
        log.debug("Stored {} test executions", records.size());
    }

    private void insertTest(Connection c, long executionId, String testName, TestExecutionRecord record)
            throws SQLException {
        deleteTests(c, executionId, List.of(testName));

        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO test_execution (environment_id, test_name, duration, failed, forced) VALUES (?, ?, ?, ?, ?)")) {
            ps.setLong(1, executionId);
            ps.setString(2, testName);
            ps.setDouble(3, record.duration());
            ps.setBoolean(4, record.failed());
            if (record.forced() == null) {
                ps.setNull(5, Types.BOOLEAN);
            } else {
                ps.setBoolean(5, record.forced());
            }
            ps.executeUpdate();
        }
        long testId = lastInsertId(c);

        try (PreparedStatement link = c.prepareStatement(
                "INSERT INTO test_execution_file_fp (test_execution_id, fingerprint_id) VALUES (?, ?)")) {
            Set<Long> linked = new HashSet<>();
            for (FileFingerprint fp : record.fingerprints()) {
                long fpId = fingerprintId(c, fp);
                if (linked.add(fpId)) {
                    link.setLong(1, testId);
                    link.setLong(2, fpId);
                    link.addBatch();
                }
            }
            link.executeBatch();
        }

        try (PreparedStatement link = c.prepareStatement(
                "INSERT INTO test_execution_file_dependency (test_execution_id, file_dependency_id) VALUES (?, ?)")) {
            for (FileDependency dep : record.fileDependencies()) {
                link.setLong(1, testId);
                link.setLong(2, dependencyId(c, dep));
                link.addBatch();
            }
            link.executeBatch();
        }

        try (PreparedStatement ps = c.prepareStatement(
                "INSERT OR IGNORE INTO test_external_dependency (test_execution_id, package_name) VALUES (?, ?)")) {
            for (String pkg : record.externalPackages()) {
                ps.setLong(1, testId);
                ps.setString(2, pkg);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private long fingerprintId(Connection c, FileFingerprint fp) throws SQLException {
        byte[] blob = Checksums.toBlob(fp.methodChecksums());
        FingerprintKey key = new FingerprintKey(fp.filename(), fp.fsha(), Checksums.toHex(fp.methodChecksums()));
        Long cached = fingerprintIds.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        Long id = null;
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id FROM file_fp WHERE filename = ? AND fsha IS ? AND method_checksums = ?")) {
            ps.setString(1, fp.filename());
            ps.setString(2, fp.fsha());
            ps.setBytes(3, blob);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    id = rs.getLong(1);
                }
            }
        }
        if (id == null) {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO file_fp (filename, method_checksums, fsha, mtime) VALUES (?, ?, ?, ?)")) {
                ps.setString(1, fp.filename());
                ps.setBytes(2, blob);
                ps.setString(3, fp.fsha());
                ps.setDouble(4, System.currentTimeMillis() / 1000.0);
                ps.executeUpdate();
            }
            id = lastInsertId(c);
        }
        fingerprintIds.put(key, id);
        return id;
    }

    private long dependencyId(Connection c, FileDependency dep) throws SQLException {
        Long cached = dependencyIds.getIfPresent(dep);
        if (cached != null) {
            return cached;
        }
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT OR IGNORE INTO file_dependency (filename, sha) VALUES (?, ?)")) {
            ps.setString(1, dep.filename());
            ps.setString(2, dep.sha());
            ps.executeUpdate();
        }
        long id;
        try (PreparedStatement ps = c.prepareStatement("SELECT id FROM file_dependency WHERE filename = ? AND sha = ?")) {
            ps.setString(1, dep.filename());
            ps.setString(2, dep.sha());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("file_dependency row vanished for " + dep);
                }
                id = rs.getLong(1);
            }
        }
        dependencyIds.put(dep, id);
        return id;
    }

    @Override
    public synchronized void deleteTestExecutions(long executionId, Collection<String> testNames) {
        if (testNames.isEmpty()) {
            return;
        }
        write("delete test executions", c -> {
            deleteTests(c, executionId, testNames);
            return null;
        });
        log.debug("Deleted {} test executions", testNames.size());
    }

    private static void deleteTests(Connection c, long executionId, Collection<String> testNames) throws SQLException {
        forEachChunk(testNames, chunk -> {
            String ids = "SELECT id FROM test_execution WHERE environment_id = ? AND test_name IN ("
                    + placeholders(chunk.size()) + ")";
            for (String table : List.of("test_execution_file_fp", "test_execution_file_dependency",
                    "test_external_dependency")) {
                try (PreparedStatement ps = c.prepareStatement(
                        "DELETE FROM " + table + " WHERE test_execution_id IN (" + ids + ")")) {
                    ps.setLong(1, executionId);
                    bind(ps, 2, chunk);
                    ps.executeUpdate();
                }
            }
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM test_execution WHERE environment_id = ? AND test_name IN ("
                    + placeholders(chunk.size()) + ")")) {
                ps.setLong(1, executionId);
                bind(ps, 2, chunk);
                ps.executeUpdate();
            }
        });
    }

    @Override
    public synchronized Map<String, StoredTestExecution> allTestExecutions(long executionId) {
        return read("list test executions", c -> {
            Map<String, StoredTestExecution> result = new TreeMap<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT test_name, duration, failed, forced FROM test_execution WHERE environment_id = ?")) {
                ps.setLong(1, executionId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        boolean forced = rs.getBoolean(4);
                        Boolean forcedOrNull = rs.wasNull() ? null : forced;
                        result.put(rs.getString(1), new StoredTestExecution(
                                rs.getString(1), rs.getDouble(2), rs.getBoolean(3), forcedOrNull));
                    }
                }
            }
            return result;
        });
    }

    // ── Files ───────────────────────────────────────────────────────────

    @Override
    public synchronized Set<String> filenames(long executionId) {
        return read("list filenames", c -> filenamesOf(c, executionId));
    }

    private static Set<String> filenamesOf(Connection c, long executionId) throws SQLException {
        Set<String> names = new TreeSet<>();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT DISTINCT f.filename
                FROM test_execution te
                JOIN test_execution_file_fp tef ON tef.test_execution_id = te.id
                JOIN file_fp f ON f.id = tef.fingerprint_id
                WHERE te.environment_id = ?""")) {
            ps.setLong(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
        }
        return names;
    }

    @Override
    public synchronized Map<String, String> filenamesFingerprints(long executionId) {
        return read("list file hashes", c -> {
            Map<String, String> result = new TreeMap<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT f.filename, f.fsha
                    FROM file_fp f
                    WHERE f.id IN (
                        SELECT MAX(f2.id)
                        FROM test_execution te
                        JOIN test_execution_file_fp tef ON tef.test_execution_id = te.id
                        JOIN file_fp f2 ON f2.id = tef.fingerprint_id
                        WHERE te.environment_id = ?
                        GROUP BY f2.filename)""")) {
                ps.setLong(1, executionId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.put(rs.getString(1), rs.getString(2));
                    }
                }
            }
            return result;
        });
    }

    @Override
    public synchronized List<ChangedFileData> fetchChangedFileData(long executionId, Collection<String> filenames) {
        return read("fetch changed file data", c -> {
            List<ChangedFileData> result = new ArrayList<>();
            forEachChunk(filenames, chunk -> {
                String sql = """
                        SELECT f.filename, te.test_name, f.method_checksums, te.failed
                        FROM test_execution te
                        JOIN test_execution_file_fp tef ON tef.test_execution_id = te.id
                        JOIN file_fp f ON f.id = tef.fingerprint_id
                        WHERE te.environment_id = ? AND f.filename IN (%s)
                        ORDER BY f.filename, te.test_name""".formatted(placeholders(chunk.size()));
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    ps.setLong(1, executionId);
                    bind(ps, 2, chunk);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            List<Integer> sums;
                            try {
                                sums = Checksums.fromBlob(rs.getBytes(3));
                            } catch (IllegalArgumentException e) {
                                log.warn("Malformed fingerprint of {} on {}", rs.getString(2), rs.getString(1));
                                sums = Fingerprints.PLACEHOLDER;
                            }
                            result.add(new ChangedFileData(rs.getString(1), rs.getString(2), sums, rs.getBoolean(4)));
                        }
                    }
                }
            });
            return result;
        });
    }

    @Override
    public synchronized Set<String> fileDependencyFilenames(long executionId) {
        return read("list file dependencies", c -> {
            Set<String> names = new TreeSet<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT DISTINCT fd.filename
                    FROM test_execution te
                    JOIN test_execution_file_dependency tefd ON tefd.test_execution_id = te.id
                    JOIN file_dependency fd ON fd.id = tefd.file_dependency_id
                    WHERE te.environment_id = ?""")) {
                ps.setLong(1, executionId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        names.add(rs.getString(1));
                    }
                }
            }
            return names;
        });
    }

    // ── Attributes and statistics ───────────────────────────────────────

    @Override
    public synchronized void writeAttribute(long executionId, String name, String value) {
        write("write attribute", c -> {
            upsertAttribute(c, executionId, name, value);
            return null;
        });
    }

    @Override
    public synchronized Optional<String> fetchAttribute(long executionId, String name) {
        return read("fetch attribute", c -> attribute(c, executionId, name));
    }

    private static void upsertAttribute(Connection c, long executionId, String name, String value) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT OR REPLACE INTO attribute (environment_id, name, value) VALUES (?, ?, ?)")) {
            ps.setLong(1, executionId);
            ps.setString(2, name);
            ps.setString(3, value);
            ps.executeUpdate();
        }
    }

    private static Optional<String> attribute(Connection c, long executionId, String name) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT value FROM attribute WHERE environment_id = ? AND name = ?")) {
            ps.setLong(1, executionId);
            ps.setString(2, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    @Override
    public synchronized SavingStats fetchSavingStats(long executionId, boolean selected) {
        return read("fetch saving stats", c -> savingStats(c, executionId, selected));
    }

    private static SavingStats savingStats(Connection c, long executionId, boolean selected) throws SQLException {
        int runAll;
        double runAllTime;
        int runSaved = 0;
        double runSavedTime = 0;
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT COUNT(*), COALESCE(SUM(duration), 0) FROM test_execution WHERE environment_id = ?")) {
            ps.setLong(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                runAll = rs.getInt(1);
                runAllTime = rs.getDouble(2);
            }
        }
        if (selected) {
            try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*), COALESCE(SUM(duration), 0) "
                    + "FROM test_execution WHERE environment_id = ? AND forced IS NULL")) {
                ps.setLong(1, executionId);
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    runSaved = rs.getInt(1);
                    runSavedTime = rs.getDouble(2);
                }
            }
        }
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT COALESCE(SUM(tests_saved), 0), COALESCE(SUM(tests_all), 0),
                       COALESCE(SUM(run_time_saved), 0), COALESCE(SUM(run_time_all), 0)
                FROM run_infos WHERE environment_id = ?""")) {
            ps.setLong(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return new SavingStats(runSaved, runAll, runSavedTime, runAllTime,
                        rs.getInt(1) + runSaved, rs.getInt(2) + runAll,
                        rs.getDouble(3) + runSavedTime, rs.getDouble(4) + runAllTime);
            }
        }
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.commit();
            connection.setAutoCommit(true);
            try (Statement st = connection.createStatement()) {
                st.execute("PRAGMA wal_checkpoint(TRUNCATE)");
            }
        } catch (SQLException e) {
            log.warn("Failed to checkpoint {}: {}", dataFile, e.getMessage());
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Failed to close {}: {}", dataFile, e.getMessage());
            }
        }
        fingerprintIds.invalidateAll();
        dependencyIds.invalidateAll();
    }

    // ── Internal helpers ────────────────────────────────────────────────

    /** Runs a read-only query under the store lock. */
    synchronized <T> T read(String what, SqlCall<T> call) {
        ensureOpen();
        try {
            T result = call.run(connection);
            connection.commit();
            return result;
        } catch (SQLException e) {
            throw new StoreException("Embedded store failed to " + what + ": " + e.getMessage(), e);
        }
    }

    private <T> T write(String what, SqlCall<T> call) {
        ensureOpen();
        try {
            T result = call.run(connection);
            connection.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            // cached ids may point at rows the rollback removed
            fingerprintIds.invalidateAll();
            dependencyIds.invalidateAll();
            if (e instanceof StoreException se) {
                throw se;
            }
            throw new StoreException("Embedded store failed to " + what + ": " + e.getMessage(), e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Embedded store " + dataFile + " is closed");
        }
    }

    private static long lastInsertId(Connection c) throws SQLException {
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static Set<String> testNames(Connection c, long executionId, String sql) throws SQLException {
        Set<String> names = new HashSet<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
        }
        return names;
    }

    @FunctionalInterface
    private interface ChunkAction {
        void accept(List<String> chunk) throws SQLException;
    }

    private static void forEachChunk(Collection<String> values, ChunkAction action) throws SQLException {
        List<String> list = new ArrayList<>(values);
        for (int i = 0; i < list.size(); i += CHUNK) {
            action.accept(list.subList(i, Math.min(i + CHUNK, list.size())));
        }
    }

    static String placeholders(int n) {
        return String.join(", ", Collections.nCopies(n, "?"));
    }

    private static void bind(PreparedStatement ps, int from, List<String> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) {
            ps.setString(from + i, values.get(i));
        }
    }
}
