package io.blockmon.server;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import io.blockmon.core.store.wire.WireCodec;
import io.blockmon.core.store.wire.WireProtocol;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.*;

final class HttpUtils {

    private HttpUtils() {
        // utility class
    }

    /**
     * Request body, gunzipped when the client sent {@code Content-Encoding: gzip}.
     * Both the raw and the decompressed body are capped at {@code maxBytes}.
     *
     * @throws io.blockmon.core.store.wire.PayloadTooLargeException if either exceeds the cap
     */
    static byte[] readRequestBody(HttpExchange exchange, int maxBytes) throws IOException {
        byte[] body = WireCodec.readLimited(exchange.getRequestBody(), maxBytes);
        String encoding = exchange.getRequestHeaders().getFirst("Content-Encoding");
        if (encoding != null && encoding.trim().equalsIgnoreCase(WireCodec.GZIP)) {
            return WireCodec.gunzip(body, maxBytes);
        }
        return body;
    }

    /**
     * Sends {@code payload} as JSON, gzipped when the client accepts it and the
     * body is above the codec's threshold.
     */
    static void sendJson(HttpExchange exchange, int statusCode, Object payload, WireCodec codec) throws IOException {
        byte[] body = codec.encode(payload);
        Headers headers = exchange.getResponseHeaders();
        headers.set("Content-Type", "application/json; charset=utf-8");
        if (acceptsGzip(exchange) && codec.shouldCompress(body)) {
            body = WireCodec.gzip(body);
            headers.set("Content-Encoding", WireCodec.GZIP);
        }
        send(exchange, statusCode, body);
    }

    static void sendError(HttpExchange exchange, int statusCode, String message, WireCodec codec) throws IOException {
        sendJson(exchange, statusCode, new WireProtocol.ErrorResponse("error", message), codec);
    }

    static void sendPlainText(HttpExchange exchange, int statusCode, String message) throws IOException {
        byte[] body = message.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        send(exchange, statusCode, body);
    }

    private static void send(HttpExchange exchange, int statusCode, byte[] body) throws IOException {
        exchange.sendResponseHeaders(statusCode, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    static boolean acceptsGzip(HttpExchange exchange) {
        String accept = exchange.getRequestHeaders().getFirst("Accept-Encoding");
        return accept != null && accept.toLowerCase(Locale.ROOT).contains(WireCodec.GZIP);
    }

    /** True when no token is configured or the request carries {@code Authorization: Bearer <token>}. */
    static boolean isAuthorized(HttpExchange exchange, String token) {
        if (token == null) {
            return true;
        }
        String header = exchange.getRequestHeaders().getFirst(WireProtocol.HEADER_AUTHORIZATION);
        return header != null && header.equals("Bearer " + token);
    }

    static Map<String, List<String>> parseQueryParams(HttpExchange exchange) {
        return parseQuery(exchange.getRequestURI().getRawQuery());
    }

    static Map<String, List<String>> parseQuery(String rawQuery) {
        Map<String, List<String>> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] parts = pair.split("=", 2);
            String key = urlDecode(parts[0]);
            String value = parts.length > 1 ? urlDecode(parts[1]) : "";
            params.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }
        return params;
    }

    static String getSingleParam(Map<String, List<String>> params, String key) {
        List<String> values = params.get(key);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    private static String urlDecode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
