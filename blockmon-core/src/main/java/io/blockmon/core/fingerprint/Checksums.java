package io.blockmon.core.fingerprint;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Block checksums and their binary encoding.
 *
 * <p>A checksum is the CRC32 of the block text's UTF-8 bytes, read as a signed
 * 32-bit int. A list of checksums is stored as a blob of little-endian int32
 * values, and sent over the wire as the lowercase hex of that blob.
 */
public final class Checksums {

    private static final HexFormat HEX = HexFormat.of();

    private Checksums() {
        // utility class
    }

    public static int checksum(String text) {
        CRC32 crc = new CRC32();
        crc.update(text.getBytes(StandardCharsets.UTF_8));
        return (int) crc.getValue();
    }

    public static byte[] toBlob(List<Integer> checksums) {
        ByteBuffer buffer = ByteBuffer.allocate(checksums.size() * Integer.BYTES)
                .order(ByteOrder.LITTLE_ENDIAN);
        for (Integer c : checksums) {
            buffer.putInt(c);
        }
        return buffer.array();
    }

    /**
     * Decodes a blob written by {@link #toBlob(List)}.
     *
     * @throws IllegalArgumentException if the blob length is not a multiple of four
     */
    public static List<Integer> fromBlob(byte[] blob) {
        if (blob == null) {
            return List.of();
        }
        if (blob.length % Integer.BYTES != 0) {
            throw new IllegalArgumentException("Malformed checksum blob of " + blob.length + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(blob).order(ByteOrder.LITTLE_ENDIAN);
        List<Integer> result = new ArrayList<>(blob.length / Integer.BYTES);
        while (buffer.hasRemaining()) {
            result.add(buffer.getInt());
        }
        return result;
    }

    public static String toHex(List<Integer> checksums) {
        return HEX.formatHex(toBlob(checksums));
    }

    public static List<Integer> fromHex(String hex) {
        if (hex == null) {
            return null;
        }
        return fromBlob(HEX.parseHex(hex));
    }
}
