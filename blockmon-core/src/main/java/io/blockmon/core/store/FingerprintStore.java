package io.blockmon.core.store;

import java.util.*;

/**
 * Persistent record of executions, file fingerprints, tests and the
 * associations between them.
 *
 * <p>Two implementations share this contract and must give identical answers
 * for the same data: the embedded SQLite store and the network client talking
 * to a store server. An execution id is only meaningful to the store that
 * issued it.
 *
 * <p>Checksum lists passed to {@link #determineTests} may map a filename to
 * {@code null}, meaning the file no longer exists or no longer parses: every
 * test that depended on it is affected.
 */
public interface FingerprintStore extends AutoCloseable {

    /**
     * Starts or resumes the execution for {@code environment}, comparing the
     * package manifest and runtime version against the previous run.
     *
     * @param environment    environment name
     * @param packages       manifest of installed packages, {@code "name version, name version"}
     * @param runtimeVersion runtime version string
     * @param metadata       free-form creation metadata (VCS revision, CI flag, ...)
     */
    InitiatedExecution initiateExecution(String environment, String packages, String runtimeVersion,
                                         Map<String, String> metadata);

    /** Id of the existing execution for {@code environment}, without creating or updating it. */
    OptionalLong lookupExecution(String environment);

    /**
     * Returns the filenames whose supplied content hash differs from the
     * stored one, or that the store has no hash for.
     */
    List<String> fetchUnknownFiles(long executionId, Map<String, String> filenameToFsha);

    /**
     * Determines which tests are affected by the supplied current state.
     * Resets the {@code forced} flag of every test of the execution.
     *
     * @param filenameToChecksums current block checksums of changed files; null value for deleted files
     * @param fileDependencyShas  current hashes of data files; null value for missing files
     * @param changedPackages     package names whose version changed
     */
    DeterminedTests determineTests(long executionId, Map<String, List<Integer>> filenameToChecksums,
                                   Map<String, String> fileDependencyShas, Set<String> changedPackages);

    /** Replaces each test's stored execution and dependencies with the supplied record. */
    void insertTestFileFps(long executionId, Map<String, TestExecutionRecord> records);

    void deleteTestExecutions(long executionId, Collection<String> testNames);

    Map<String, StoredTestExecution> allTestExecutions(long executionId);

    /** Filenames that at least one test of the execution has a fingerprint on. */
    Set<String> filenames(long executionId);

    /** Filename to the most recently stored fsha (null for placeholders). */
    Map<String, String> filenamesFingerprints(long executionId);

    /** Every stored (test, fingerprint) association on the given files. */
    List<ChangedFileData> fetchChangedFileData(long executionId, Collection<String> filenames);

    /** Data files any test of the execution read. */
    Set<String> fileDependencyFilenames(long executionId);

    void writeAttribute(long executionId, String name, String value);

    Optional<String> fetchAttribute(long executionId, String name);

    /**
     * Counts for this run and the lifetime of the environment. A test counts as
     * saved when it did not run this session.
     *
     * @param selected whether selection was active; when false nothing was saved
     */
    SavingStats fetchSavingStats(long executionId, boolean selected);

    /** Records the run's statistics and history and clears session caches. */
    void finishExecution(long executionId, double duration, boolean selected);

    /** True for stores that talk to a remote server. */
    default boolean isRemote() {
        return false;
    }

    @Override
    void close();
}
