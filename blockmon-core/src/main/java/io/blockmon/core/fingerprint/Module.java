package io.blockmon.core.fingerprint;

import java.util.ArrayList;
import java.util.List;

/**
 * A source file split into blocks. The first block is always the module block
 * unless the file failed to parse, in which case there are no blocks at all.
 */
public final class Module {

    private final String filename;
    private final List<Block> blocks;
    private final boolean parseable;

    Module(String filename, List<Block> blocks, boolean parseable) {
        this.filename = filename;
        this.blocks = List.copyOf(blocks);
        this.parseable = parseable;
    }

    static Module unparseable(String filename) {
        return new Module(filename, List.of(), false);
    }

    public String filename() { return filename; }
    public List<Block> blocks() { return blocks; }
    public boolean parseable() { return parseable; }

    /** Checksums of every block, in block order. */
    public List<Integer> checksums() {
        List<Integer> result = new ArrayList<>(blocks.size());
        for (Block block : blocks) {
            result.add(block.checksum());
        }
        return result;
    }

    public boolean matches(List<Integer> fingerprint) {
        return Fingerprints.match(this, fingerprint);
    }

    @Override
    public String toString() {
        return "Module[" + filename + ", blocks=" + blocks.size() + (parseable ? "" : ", unparseable") + "]";
    }
}
