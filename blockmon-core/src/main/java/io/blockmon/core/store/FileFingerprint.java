package io.blockmon.core.store;

import java.util.List;

/**
 * The blocks one test covered in one version of a file.
 *
 * @param filename        project-relative filename
 * @param fsha            whole-file hash of the version covered; null for a placeholder
 * @param methodChecksums checksums of the covered blocks, in block order
 */
public record FileFingerprint(String filename, String fsha, List<Integer> methodChecksums) {

    public FileFingerprint {
        methodChecksums = List.copyOf(methodChecksums);
    }
}
