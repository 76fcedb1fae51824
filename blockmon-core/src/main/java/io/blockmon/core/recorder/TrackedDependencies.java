package io.blockmon.core.recorder;

import java.util.Set;

/**
 * Non-coverage dependencies captured for one test.
 *
 * @param moduleFiles      project source files whose module block the test depends on
 * @param fileReads        project-relative data files the test read
 * @param externalPackages external artifact names the test used
 */
public record TrackedDependencies(Set<String> moduleFiles, Set<String> fileReads, Set<String> externalPackages) {

    public static final TrackedDependencies NONE = new TrackedDependencies(Set.of(), Set.of(), Set.of());

    public TrackedDependencies {
        moduleFiles = Set.copyOf(moduleFiles);
        fileReads = Set.copyOf(fileReads);
        externalPackages = Set.copyOf(externalPackages);
    }
}
