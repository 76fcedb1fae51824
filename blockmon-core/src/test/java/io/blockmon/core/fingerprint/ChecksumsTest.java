package io.blockmon.core.fingerprint;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChecksumsTest {

    @Test
    void checksumIsSignedCrc32OfUtf8Bytes() {
        assertEquals(907060870, Checksums.checksum("hello"));
        assertEquals(-390611389, Checksums.checksum("a"), "CRC32 values above 2^31 wrap to negative ints");
        assertEquals(0, Checksums.checksum(""));
    }

    @Test
    void blobIsLittleEndianInt32() {
        assertArrayEquals(new byte[]{1, 0, 0, 0}, Checksums.toBlob(List.of(1)));
        assertEquals("ffffffff02010000", Checksums.toHex(List.of(-1, 258)));
    }

    @Test
    void blobDecodesBackToTheSameChecksums() {
        List<Integer> checksums = List.of(Checksums.checksum("a"), Checksums.checksum("hello"), 0,
                Integer.MAX_VALUE, Integer.MIN_VALUE);

        assertEquals(checksums, Checksums.fromBlob(Checksums.toBlob(checksums)));
        assertEquals(checksums, Checksums.fromHex(Checksums.toHex(checksums)));
    }

    @Test
    void extremeValuesKeepTheirByteLayout() {
        assertArrayEquals(new byte[]{-1, -1, -1, 127, 0, 0, 0, -128},
                Checksums.toBlob(List.of(Integer.MAX_VALUE, Integer.MIN_VALUE)));
        assertEquals("ffffff7f00000080", Checksums.toHex(List.of(Integer.MAX_VALUE, Integer.MIN_VALUE)));
    }

    @Test
    void emptyAndNullInputs() {
        assertEquals(List.of(), Checksums.fromBlob(new byte[0]));
        assertEquals(List.of(), Checksums.fromBlob(null));
        assertNull(Checksums.fromHex(null));
        assertEquals("", Checksums.toHex(List.of()));
    }

    @Test
    void rejectsTruncatedBlob() {
        assertThrows(IllegalArgumentException.class, () -> Checksums.fromBlob(new byte[]{1, 2, 3}));
    }

    @Test
    void unmatchableIsChecksumOfSentinelText() {
        assertEquals(163681302, Fingerprints.UNMATCHABLE);
        assertEquals(List.of(Fingerprints.UNMATCHABLE), Fingerprints.PLACEHOLDER);
    }
}
