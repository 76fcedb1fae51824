package io.blockmon.core.store;

import java.util.Set;

/**
 * Result of {@link FingerprintStore#initiateExecution}.
 *
 * @param executionId         id of the execution for this environment
 * @param knownFilenames      files the store holds fingerprints for
 * @param packagesChanged     whether the package manifest or runtime changed since the last run
 * @param changedPackageNames packages added, removed or upgraded; may contain
 *                            {@link PackageManifest#RUNTIME_CHANGED}
 */
public record InitiatedExecution(
        long executionId,
        Set<String> knownFilenames,
        boolean packagesChanged,
        Set<String> changedPackageNames
) {}
