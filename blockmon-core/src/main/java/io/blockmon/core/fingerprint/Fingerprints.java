package io.blockmon.core.fingerprint;

import java.util.*;

/**
 * Creates and matches fingerprints: ordered lists of the checksums of the
 * blocks a test covered in one file.
 */
public final class Fingerprints {

    /** Covered-line marker meaning "the file was loaded": selects the module block only. */
    public static final int MODULE_LOADED_LINE = 0;

    /**
     * Checksum that no block can produce in practice. Recorded for new tests
     * and for covered files that do not parse, so the test re-runs next time.
     */
    public static final int UNMATCHABLE = Checksums.checksum("0match");

    public static final List<Integer> PLACEHOLDER = List.of(UNMATCHABLE);

    private Fingerprints() {
        // utility class
    }

    /**
     * Returns the checksums of every block owning at least one covered line,
     * in block (preorder) order. The module block is included whenever any
     * line is covered; a method block owns every line its range spans, so a
     * line shared by nested or adjacent blocks selects all of them.
     */
    public static List<Integer> create(Module module, Set<Integer> coveredLines) {
        if (coveredLines.isEmpty()) {
            return List.of();
        }
        if (!module.parseable()) {
            return PLACEHOLDER;
        }
        List<Block> blocks = module.blocks();
        boolean[] selected = new boolean[blocks.size()];
        selected[0] = true;

        for (int line : coveredLines) {
            if (line == MODULE_LOADED_LINE) {
                continue;
            }
            for (int i = 1; i < blocks.size(); i++) {
                if (blocks.get(i).spans(line)) {
                    selected[i] = true;
                }
            }
        }

        List<Integer> fingerprint = new ArrayList<>();
        for (int i = 0; i < blocks.size(); i++) {
            if (selected[i]) {
                fingerprint.add(blocks.get(i).checksum());
            }
        }
        return fingerprint;
    }

    /**
     * True iff every checksum of {@code fingerprint} is among the module's
     * current block checksums, regardless of position.
     */
    public static boolean match(Module module, List<Integer> fingerprint) {
        if (!module.parseable()) {
            return false;
        }
        return new HashSet<>(module.checksums()).containsAll(fingerprint);
    }
}
