package io.blockmon.core.store.embedded;

import io.blockmon.core.fingerprint.Checksums;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.*;

/**
 * Read-only queries over the per-run history of an {@link EmbeddedFingerprintStore}:
 * run list, summary counts, tests per file, per-test dependency detail, the
 * file co-dependency graph and coverage rankings.
 *
 * <p>Every query addresses one finished run by its run uid; history is written
 * by {@code finishExecution}, so a run that has not finished has no report.
 */
public final class StoreReports {

    public record RunInfo(
            long runUid,
            String environment,
            String repoRunId,
            String gitHeadSha,
            String created,
            int testsAll,
            int testsSaved,
            double timeAll,
            double timeSaved,
            double duration,
            boolean selected
    ) {}

    public record RunSummary(long runUid, int tests, int failing, int forced, int files, int fingerprints) {}

    public record FingerprintDetail(String filename, String fsha, List<Integer> checksums) {}

    public record TestDetail(String testName, double duration, boolean failed, List<FingerprintDetail> dependencies) {}

    /** Two files sharing {@code sharedTests} tests. {@code source} sorts before {@code target}. */
    public record CoDependency(String source, String target, int sharedTests) {}

    public record FileCoverage(String filename, int tests) {}

    private final EmbeddedFingerprintStore store;

    StoreReports(EmbeddedFingerprintStore store) {
        this.store = store;
    }

    /** All finished runs, newest first. */
    public List<RunInfo> runs() {
        return store.read("list runs", c -> {
            List<RunInfo> runs = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT r.id, e.environment_name, r.repo_run_id, r.git_head_sha, r.created,
                           i.tests_all, i.tests_saved, i.run_time_all, i.run_time_saved, i.duration, i.selected
                    FROM run_uid r
                    JOIN run_infos i ON i.run_uid = r.id
                    LEFT JOIN environment e ON e.id = r.environment_id
                    ORDER BY r.id DESC""");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    runs.add(new RunInfo(rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4),
                            rs.getString(5), rs.getInt(6), rs.getInt(7), rs.getDouble(8), rs.getDouble(9),
                            rs.getDouble(10), rs.getBoolean(11)));
                }
            }
            return runs;
        });
    }

    /**
     * Resolves a run reference: a run uid, a CI run id, or null/blank for the latest run.
     */
    public OptionalLong findRun(String reference) {
        return store.read("find run", c -> {
            String sql;
            if (reference == null || reference.isBlank()) {
                sql = "SELECT MAX(id) FROM run_uid";
            } else {
                sql = "SELECT id FROM run_uid WHERE repo_run_id = ? OR CAST(id AS TEXT) = ? ORDER BY id DESC LIMIT 1";
            }
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                if (reference != null && !reference.isBlank()) {
                    ps.setString(1, reference);
                    ps.setString(2, reference);
                }
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        long id = rs.getLong(1);
                        return rs.wasNull() ? OptionalLong.empty() : OptionalLong.of(id);
                    }
                    return OptionalLong.empty();
                }
            }
        });
    }

    public RunSummary summary(long runUid) {
        return store.read("summarize run", c -> {
            int tests = 0;
            int failing = 0;
            int forced = 0;
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT COUNT(*), COALESCE(SUM(CASE WHEN failed = 1 THEN 1 ELSE 0 END), 0),
                           COALESCE(SUM(CASE WHEN forced = 1 THEN 1 ELSE 0 END), 0)
                    FROM test_infos WHERE run_uid = ?""")) {
                ps.setLong(1, runUid);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        tests = rs.getInt(1);
                        failing = rs.getInt(2);
                        forced = rs.getInt(3);
                    }
                }
            }
            int files = 0;
            int fingerprints = 0;
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT COUNT(DISTINCT filename), COUNT(*) FROM file_fp_infos WHERE run_uid = ?")) {
                ps.setLong(1, runUid);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        files = rs.getInt(1);
                        fingerprints = rs.getInt(2);
                    }
                }
            }
            return new RunSummary(runUid, tests, failing, forced, files, fingerprints);
        });
    }

    /** Filename to the sorted names of tests depending on it. */
    public Map<String, List<String>> testsByFile(long runUid) {
        return store.read("list tests by file", c -> {
            Map<String, List<String>> result = new TreeMap<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT DISTINCT f.filename, t.test_name
                    FROM file_fp_infos f
                    JOIN test_execution_file_fp_infos tef ON tef.run_uid = f.run_uid AND tef.fingerprint_id = f.fingerprint_id
                    JOIN test_infos t ON t.run_uid = tef.run_uid AND t.test_execution_id = tef.test_execution_id
                    WHERE f.run_uid = ?
                    ORDER BY f.filename, t.test_name""")) {
                ps.setLong(1, runUid);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.computeIfAbsent(rs.getString(1), k -> new ArrayList<>()).add(rs.getString(2));
                    }
                }
            }
            return result;
        });
    }

    public Optional<TestDetail> testDetail(long runUid, String testName) {
        return store.read("load test detail", c -> {
            Long testId = null;
            double duration = 0;
            boolean failed = false;
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT test_execution_id, duration, failed FROM test_infos WHERE run_uid = ? AND test_name = ?")) {
                ps.setLong(1, runUid);
                ps.setString(2, testName);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        testId = rs.getLong(1);
                        duration = rs.getDouble(2);
                        failed = rs.getBoolean(3);
                    }
                }
            }
            if (testId == null) {
                return Optional.empty();
            }
            List<FingerprintDetail> deps = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT f.filename, f.fsha, f.method_checksums
                    FROM test_execution_file_fp_infos tef
                    JOIN file_fp_infos f ON f.run_uid = tef.run_uid AND f.fingerprint_id = tef.fingerprint_id
                    WHERE tef.run_uid = ? AND tef.test_execution_id = ?
                    ORDER BY f.filename""")) {
                ps.setLong(1, runUid);
                ps.setLong(2, testId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        deps.add(new FingerprintDetail(rs.getString(1), rs.getString(2), decode(rs.getBytes(3))));
                    }
                }
            }
            return Optional.of(new TestDetail(testName, duration, failed, deps));
        });
    }

    /** Pairs of files that share at least one test, most shared first. */
    public List<CoDependency> coDependencies(long runUid) {
        return store.read("build co-dependency graph", c -> {
            List<CoDependency> edges = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    WITH file_tests AS (
                        SELECT DISTINCT f.filename AS filename, tef.test_execution_id AS test_id
                        FROM file_fp_infos f
                        JOIN test_execution_file_fp_infos tef
                          ON tef.run_uid = f.run_uid AND tef.fingerprint_id = f.fingerprint_id
                        WHERE f.run_uid = ?
                    )
                    SELECT a.filename, b.filename, COUNT(*) AS shared
                    FROM file_tests a
                    JOIN file_tests b ON a.test_id = b.test_id AND a.filename < b.filename
                    GROUP BY a.filename, b.filename
                    ORDER BY shared DESC, a.filename, b.filename""")) {
                ps.setLong(1, runUid);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        edges.add(new CoDependency(rs.getString(1), rs.getString(2), rs.getInt(3)));
                    }
                }
            }
            return edges;
        });
    }

    /**
     * Files ranked by how many tests depend on them.
     *
     * @param ascending least covered first when true
     * @param limit     max rows
     */
    public List<FileCoverage> coverage(long runUid, boolean ascending, int limit) {
        return store.read("rank file coverage", c -> {
            List<FileCoverage> rows = new ArrayList<>();
            String order = ascending ? "ASC" : "DESC";
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT f.filename, COUNT(DISTINCT tef.test_execution_id) AS tests
                    FROM file_fp_infos f
                    JOIN test_execution_file_fp_infos tef
                      ON tef.run_uid = f.run_uid AND tef.fingerprint_id = f.fingerprint_id
                    WHERE f.run_uid = ?
                    GROUP BY f.filename
                    ORDER BY tests %s, f.filename
                    LIMIT ?""".formatted(order))) {
                ps.setLong(1, runUid);
                ps.setInt(2, Math.max(1, limit));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        rows.add(new FileCoverage(rs.getString(1), rs.getInt(2)));
                    }
                }
            }
            return rows;
        });
    }

    private static List<Integer> decode(byte[] blob) throws SQLException {
        try {
            return Checksums.fromBlob(blob);
        } catch (IllegalArgumentException e) {
            throw new SQLException("Malformed checksum blob in history", e);
        }
    }
}
