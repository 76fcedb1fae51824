package io.blockmon.core.store;

import java.util.List;

/** One stored (test, file fingerprint) association, as returned by {@link FingerprintStore#fetchChangedFileData}. */
public record ChangedFileData(String filename, String testName, List<Integer> methodChecksums, boolean failed) {}
