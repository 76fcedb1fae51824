package io.blockmon.core.store;

import java.util.List;
import java.util.Set;

/**
 * Everything recorded for one test in one batch.
 *
 * @param duration         seconds
 * @param failed           whether the test failed
 * @param forced           whether it ran although it was stable; null when it did not run this session
 * @param fingerprints     one per source file the test depended on
 * @param fileDependencies data files read
 * @param externalPackages names of external packages the test used
 */
public record TestExecutionRecord(
        double duration,
        boolean failed,
        Boolean forced,
        List<FileFingerprint> fingerprints,
        Set<FileDependency> fileDependencies,
        Set<String> externalPackages
) {

    public TestExecutionRecord {
        fingerprints = List.copyOf(fingerprints);
        fileDependencies = Set.copyOf(fileDependencies);
        externalPackages = Set.copyOf(externalPackages);
    }
}
