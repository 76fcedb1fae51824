package io.blockmon.core.fingerprint;

/**
 * A named, checksummed code region of a source file.
 *
 * @param name      {@code <module>} for the module block, otherwise the
 *                  dotted path of the enclosing types and the method name
 * @param startLine first line of the region (1-based, inclusive)
 * @param endLine   last line of the region (inclusive)
 * @param depth     0 for the module block, nesting depth for method blocks
 * @param text      the normalized text the checksum was computed from
 * @param checksum  {@link Checksums#checksum(String)} of {@code text}
 */
public record Block(String name, int startLine, int endLine, int depth, String text, int checksum) {

    public static final String MODULE_BLOCK_NAME = "<module>";

    public boolean spans(int line) {
        return line >= startLine && line <= endLine;
    }
}
