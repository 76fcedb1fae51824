package io.blockmon.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.blockmon.core.store.StoreException;
import io.blockmon.core.store.embedded.EmbeddedFingerprintStore;
import io.blockmon.core.store.embedded.StoreReports;
import io.blockmon.core.store.wire.WireCodec;
import io.blockmon.core.store.wire.WireProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * Read-only history views: {@code GET /api/report/{view}?repo=..&job=..&run=..}.
 *
 * <p>Views: {@code runs}, {@code summary}, {@code tests}, {@code test}
 * (needs {@code name}), {@code graph} and {@code coverage} ({@code order=asc|desc},
 * {@code limit}). {@code run} is a run uid or CI run id; omitted means the latest run.
 */
final class ReportingHandler implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(ReportingHandler.class);

    private static final int DEFAULT_COVERAGE_LIMIT = 20;

    private final StoreRegistry registry;
    private final WireCodec codec;
    private final String token;

    ReportingHandler(StoreRegistry registry, WireCodec codec, String token) {
        this.registry = registry;
        this.codec = codec;
        this.token = token;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            HttpUtils.sendPlainText(exchange, 405, "GET required");
            return;
        }
        if (!HttpUtils.isAuthorized(exchange, token)) {
            HttpUtils.sendError(exchange, 401, "Missing or invalid bearer token", codec);
            return;
        }
        String path = exchange.getRequestURI().getPath();
        String view = path.startsWith(WireProtocol.REPORT_PATH) ? path.substring(WireProtocol.REPORT_PATH.length()) : "";
        Map<String, List<String>> params = HttpUtils.parseQueryParams(exchange);

        String repo = HttpUtils.getSingleParam(params, "repo");
        if (repo == null || repo.isBlank()) {
            HttpUtils.sendError(exchange, 400, "repo parameter is required", codec);
            return;
        }
        String job = Objects.requireNonNullElse(HttpUtils.getSingleParam(params, "job"), "default");

        try {
            Optional<EmbeddedFingerprintStore> store = registry.existing(repo, job);
            if (store.isEmpty()) {
                HttpUtils.sendError(exchange, 404, "No store for " + repo + "/" + job, codec);
                return;
            }
            StoreReports reports = store.get().reports();
            if (view.equals("runs")) {
                HttpUtils.sendJson(exchange, 200, reports.runs(), codec);
                return;
            }

            String runRef = HttpUtils.getSingleParam(params, "run");
            OptionalLong run = reports.findRun(runRef);
            if (run.isEmpty()) {
                HttpUtils.sendError(exchange, 404, runRef == null ? "No finished run" : "Unknown run: " + runRef, codec);
                return;
            }
            long runUid = run.getAsLong();

            switch (view) {
                case "summary" -> HttpUtils.sendJson(exchange, 200, reports.summary(runUid), codec);
                case "tests" -> HttpUtils.sendJson(exchange, 200, reports.testsByFile(runUid), codec);
                case "test" -> {
                    String name = HttpUtils.getSingleParam(params, "name");
                    if (name == null) {
                        HttpUtils.sendError(exchange, 400, "name parameter is required", codec);
                        return;
                    }
                    Optional<StoreReports.TestDetail> detail = reports.testDetail(runUid, name);
                    if (detail.isEmpty()) {
                        HttpUtils.sendError(exchange, 404, "Unknown test: " + name, codec);
                    } else {
                        HttpUtils.sendJson(exchange, 200, detail.get(), codec);
                    }
                }
                case "graph" -> HttpUtils.sendJson(exchange, 200, reports.coDependencies(runUid), codec);
                case "coverage" -> {
                    boolean ascending = !"desc".equalsIgnoreCase(HttpUtils.getSingleParam(params, "order"));
                    int limit = parseLimit(HttpUtils.getSingleParam(params, "limit"));
                    HttpUtils.sendJson(exchange, 200, reports.coverage(runUid, ascending, limit), codec);
                }
                default -> HttpUtils.sendError(exchange, 404, "Unknown report: " + view, codec);
            }
        } catch (IllegalArgumentException e) {
            HttpUtils.sendError(exchange, 400, e.getMessage(), codec);
        } catch (StoreException e) {
            log.error("Report {} failed for {}/{}: {}", view, repo, job, e.getMessage(), e);
            HttpUtils.sendError(exchange, 500, e.getMessage(), codec);
        }
    }

    private static int parseLimit(String value) {
        if (value == null) {
            return DEFAULT_COVERAGE_LIMIT;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid limit: " + value, e);
        }
    }
}
