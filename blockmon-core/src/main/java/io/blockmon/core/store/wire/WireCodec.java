package io.blockmon.core.store.wire;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.blockmon.core.store.StoreException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * JSON encoding of {@link WireProtocol} messages with optional gzip.
 * Shared by the client and the server.
 */
public final class WireCodec {

    public static final String GZIP = "gzip";

    private final ObjectMapper mapper;
    private final int gzipThreshold;

    public WireCodec(int gzipThreshold) {
        this.gzipThreshold = gzipThreshold;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public byte[] encode(Object message) {
        try {
            return mapper.writeValueAsBytes(message);
        } catch (IOException e) {
            throw new StoreException("Unable to encode " + message.getClass().getSimpleName(), e);
        }
    }

    /**
     * @throws StoreException if the payload is not a valid {@code type}
     */
    public <T> T decode(byte[] body, Class<T> type) {
        try {
            return mapper.readValue(body, type);
        } catch (IOException e) {
            throw new StoreException("Malformed " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    public boolean shouldCompress(byte[] body) {
        return body.length > gzipThreshold;
    }

    public static byte[] gzip(byte[] body) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, body.length / 4));
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(body);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    public static byte[] gunzip(byte[] body) {
        return gunzip(body, Integer.MAX_VALUE - 8);
    }

    /**
     * @throws PayloadTooLargeException if the decompressed body exceeds {@code maxBytes}
     */
    public static byte[] gunzip(byte[] body, int maxBytes) {
        try (GZIPInputStream gz = new GZIPInputStream(new ByteArrayInputStream(body))) {
            return readLimited(gz, maxBytes);
        } catch (IOException e) {
            throw new StoreException("Corrupt gzip body: " + e.getMessage(), e);
        }
    }

    /**
     * Reads {@code in} to the end, stopping as soon as it yields more than
     * {@code maxBytes}.
     *
     * @throws PayloadTooLargeException if the stream holds more than {@code maxBytes}
     */
    public static byte[] readLimited(InputStream in, int maxBytes) throws IOException {
        byte[] bytes = in.readNBytes(maxBytes);
        if (in.read() != -1) {
            throw new PayloadTooLargeException(maxBytes);
        }
        return bytes;
    }
}
