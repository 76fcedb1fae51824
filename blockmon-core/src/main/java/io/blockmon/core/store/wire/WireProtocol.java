package io.blockmon.core.store.wire;

import io.blockmon.core.fingerprint.Checksums;
import io.blockmon.core.store.ChangedFileData;
import io.blockmon.core.store.FileDependency;
import io.blockmon.core.store.FileFingerprint;
import io.blockmon.core.store.StoredTestExecution;
import io.blockmon.core.store.TestExecutionRecord;

import java.util.*;

/**
 * RPC surface between {@code NetworkFingerprintStore} and the store server.
 *
 * <p>Every operation is a {@code POST} to {@code /api/rpc/{operation}} with a
 * JSON body naming the execution id. Checksum lists travel as the hex form of
 * their blob encoding. All writes are idempotent, so a retried request that
 * already succeeded on the server is harmless.
 */
public final class WireProtocol {

    public static final String RPC_PATH = "/api/rpc/";
    public static final String REPORT_PATH = "/api/report/";
    public static final String HEALTH_PATH = "/health";

    public static final String HEADER_REPO = "X-Repo-ID";
    public static final String HEADER_JOB = "X-Job-ID";
    public static final String HEADER_SESSION = "X-Session-ID";
    public static final String HEADER_AUTHORIZATION = "Authorization";

    public static final String OP_INITIATE = "initiate_execution";
    public static final String OP_LOOKUP = "lookup_execution";
    public static final String OP_FETCH_UNKNOWN = "fetch_unknown_files";
    public static final String OP_DETERMINE = "determine_tests";
    public static final String OP_INSERT = "insert_test_file_fps";
    public static final String OP_DELETE = "delete_test_executions";
    public static final String OP_ALL_TESTS = "all_test_executions";
    public static final String OP_FILENAMES = "filenames";
    public static final String OP_FILENAMES_FINGERPRINTS = "filenames_fingerprints";
    public static final String OP_CHANGED_FILE_DATA = "fetch_changed_file_data";
    public static final String OP_FILE_DEPENDENCIES = "file_dependency_filenames";
    public static final String OP_WRITE_ATTRIBUTE = "write_attribute";
    public static final String OP_FETCH_ATTRIBUTE = "fetch_attribute";
    public static final String OP_SAVING_STATS = "fetch_saving_stats";
    public static final String OP_FINISH = "finish_execution";

    private WireProtocol() {
        // constants and messages only
    }

    // ── Requests ────────────────────────────────────────────────────────

    public record InitiateRequest(String environment, String packages, String runtimeVersion,
                                  Map<String, String> metadata) {}

    public record LookupRequest(String environment) {}

    public record ExecutionRequest(long executionId) {}

    public record FetchUnknownRequest(long executionId, Map<String, String> fshas) {}

    /** Checksums are hex blobs; a null value means the file is gone or does not parse. */
    public record DetermineRequest(long executionId, Map<String, String> checksums,
                                   Map<String, String> fileDependencies, Set<String> changedPackages) {}

    public record WireFingerprint(String filename, String fsha, String checksums) {}

    public record WireTestRecord(double duration, boolean failed, Boolean forced,
                                 List<WireFingerprint> fingerprints, List<FileDependency> fileDependencies,
                                 List<String> externalPackages) {}

    public record InsertRequest(long executionId, Map<String, WireTestRecord> tests) {}

    public record TestNamesRequest(long executionId, List<String> testNames) {}

    public record FilenamesRequest(long executionId, List<String> filenames) {}

    public record AttributeRequest(long executionId, String name, String value) {}

    public record StatsRequest(long executionId, boolean selected) {}

    public record FinishRequest(long executionId, double duration, boolean selected) {}

    // ── Responses ───────────────────────────────────────────────────────

    public record InitiateResponse(long executionId, List<String> knownFilenames, boolean packagesChanged,
                                   List<String> changedPackages) {}

    /** {@code executionId} is null when the environment has no execution yet. */
    public record LookupResponse(Long executionId) {}

    public record FilenamesResponse(List<String> filenames) {}

    public record FileHashesResponse(Map<String, String> fshas) {}

    public record DetermineResponse(List<String> affected, List<String> failing) {}

    public record AllTestsResponse(Map<String, StoredTestExecution> tests) {}

    public record WireChangedFileData(String filename, String testName, String checksums, boolean failed) {}

    public record ChangedFileDataResponse(List<WireChangedFileData> rows) {}

    public record AttributeResponse(String value) {}

    public record AckResponse(String status) {

        public static final AckResponse OK = new AckResponse("ok");
    }

    public record ErrorResponse(String status, String message) {}

    // ── Conversions ─────────────────────────────────────────────────────

    public static Map<String, String> checksumsToWire(Map<String, List<Integer>> checksums) {
        Map<String, String> wire = new LinkedHashMap<>();
        checksums.forEach((f, sums) -> wire.put(f, sums == null ? null : Checksums.toHex(sums)));
        return wire;
    }

    public static Map<String, List<Integer>> checksumsFromWire(Map<String, String> wire) {
        Map<String, List<Integer>> checksums = new LinkedHashMap<>();
        if (wire != null) {
            wire.forEach((f, hex) -> checksums.put(f, Checksums.fromHex(hex)));
        }
        return checksums;
    }

    public static WireTestRecord toWire(TestExecutionRecord record) {
        List<WireFingerprint> fps = new ArrayList<>();
        for (FileFingerprint fp : record.fingerprints()) {
            fps.add(new WireFingerprint(fp.filename(), fp.fsha(), Checksums.toHex(fp.methodChecksums())));
        }
        return new WireTestRecord(record.duration(), record.failed(), record.forced(), fps,
                new ArrayList<>(record.fileDependencies()), new ArrayList<>(record.externalPackages()));
    }

    public static TestExecutionRecord fromWire(WireTestRecord wire) {
        List<FileFingerprint> fps = new ArrayList<>();
        for (WireFingerprint fp : nullToEmpty(wire.fingerprints())) {
            fps.add(new FileFingerprint(fp.filename(), fp.fsha(), Checksums.fromHex(fp.checksums())));
        }
        return new TestExecutionRecord(wire.duration(), wire.failed(), wire.forced(), fps,
                new HashSet<>(nullToEmpty(wire.fileDependencies())),
                new HashSet<>(nullToEmpty(wire.externalPackages())));
    }

    public static WireChangedFileData toWire(ChangedFileData data) {
        return new WireChangedFileData(data.filename(), data.testName(),
                Checksums.toHex(data.methodChecksums()), data.failed());
    }

    public static ChangedFileData fromWire(WireChangedFileData wire) {
        return new ChangedFileData(wire.filename(), wire.testName(),
                Checksums.fromHex(wire.checksums()), wire.failed());
    }

    public static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
