package io.blockmon.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.blockmon.core.store.*;
import io.blockmon.core.store.embedded.EmbeddedFingerprintStore;
import io.blockmon.core.store.wire.PayloadTooLargeException;
import io.blockmon.core.store.wire.WireCodec;
import io.blockmon.core.store.wire.WireProtocol;
import io.blockmon.core.store.wire.WireProtocol.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * Serves {@code POST /api/rpc/{operation}} by decoding the request, running
 * the operation on the (repository, job) store and encoding the result.
 *
 * <p>Status codes: 400 for malformed requests, 401 for a missing or wrong
 * token, 404 for unknown operations, 413 for bodies over the size cap, 500
 * for store failures. Clients retry
 * only the 5xx ones.
 */
final class RpcHandler implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(RpcHandler.class);

    private static final String DEFAULT_JOB = "default";

    /** The request cannot be served as sent. */
    static final class BadRequestException extends RuntimeException {
        private final int status;

        BadRequestException(int status, String message) {
            super(message);
            this.status = status;
        }

        int status() {
            return status;
        }
    }

    private final StoreRegistry registry;
    private final WireCodec codec;
    private final String token;
    private final int maxBodyBytes;

    RpcHandler(StoreRegistry registry, WireCodec codec, String token, int maxBodyBytes) {
        this.registry = registry;
        this.codec = codec;
        this.token = token;
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            HttpUtils.sendPlainText(exchange, 405, "POST required");
            return;
        }
        if (!HttpUtils.isAuthorized(exchange, token)) {
            HttpUtils.sendError(exchange, 401, "Missing or invalid bearer token", codec);
            return;
        }
        String path = exchange.getRequestURI().getPath();
        String operation = path.startsWith(WireProtocol.RPC_PATH) ? path.substring(WireProtocol.RPC_PATH.length()) : "";

        try {
            String repo = exchange.getRequestHeaders().getFirst(WireProtocol.HEADER_REPO);
            if (repo == null || repo.isBlank()) {
                throw new BadRequestException(400, WireProtocol.HEADER_REPO + " header is required");
            }
            String job = Objects.requireNonNullElse(exchange.getRequestHeaders().getFirst(WireProtocol.HEADER_JOB),
                    DEFAULT_JOB);
            registry.touchSession(exchange.getRequestHeaders().getFirst(WireProtocol.HEADER_SESSION), repo, job);

            byte[] body;
            try {
                body = HttpUtils.readRequestBody(exchange, maxBodyBytes);
            } catch (PayloadTooLargeException e) {
                throw new BadRequestException(413, e.getMessage());
            } catch (StoreException e) {
                throw new BadRequestException(400, e.getMessage());
            }
            EmbeddedFingerprintStore store = registry.open(repo, job);
            Object response = dispatch(operation, body, store);
            HttpUtils.sendJson(exchange, 200, response, codec);
        } catch (BadRequestException e) {
            HttpUtils.sendError(exchange, e.status(), e.getMessage(), codec);
        } catch (IllegalArgumentException e) {
            HttpUtils.sendError(exchange, 400, "Invalid " + operation + " request: " + e.getMessage(), codec);
        } catch (StoreException e) {
            log.error("Store failure in {}: {}", operation, e.getMessage(), e);
            HttpUtils.sendError(exchange, 500, e.getMessage(), codec);
        } catch (RuntimeException e) {
            log.error("Unexpected failure in {}", operation, e);
            HttpUtils.sendError(exchange, 500, "Unexpected server error: " + e.getMessage(), codec);
        }
    }

    private Object dispatch(String operation, byte[] body, FingerprintStore store) {
        return switch (operation) {
            case WireProtocol.OP_INITIATE -> {
                InitiateRequest r = decode(body, InitiateRequest.class);
                InitiatedExecution e = store.initiateExecution(r.environment(), r.packages(), r.runtimeVersion(),
                        r.metadata() == null ? Map.of() : r.metadata());
                yield new InitiateResponse(e.executionId(), new ArrayList<>(e.knownFilenames()), e.packagesChanged(),
                        new ArrayList<>(e.changedPackageNames()));
            }
            case WireProtocol.OP_LOOKUP -> {
                LookupRequest r = decode(body, LookupRequest.class);
                OptionalLong id = store.lookupExecution(r.environment());
                yield new LookupResponse(id.isPresent() ? id.getAsLong() : null);
            }
            case WireProtocol.OP_FETCH_UNKNOWN -> {
                FetchUnknownRequest r = decode(body, FetchUnknownRequest.class);
                yield new FilenamesResponse(store.fetchUnknownFiles(r.executionId(), orEmpty(r.fshas())));
            }
            case WireProtocol.OP_DETERMINE -> {
                DetermineRequest r = decode(body, DetermineRequest.class);
                DeterminedTests d = store.determineTests(r.executionId(),
                        WireProtocol.checksumsFromWire(r.checksums()),
                        orEmpty(r.fileDependencies()),
                        r.changedPackages() == null ? Set.of() : r.changedPackages());
                yield new DetermineResponse(new ArrayList<>(d.affected()), new ArrayList<>(d.failing()));
            }
            case WireProtocol.OP_INSERT -> {
                InsertRequest r = decode(body, InsertRequest.class);
                Map<String, TestExecutionRecord> records = new LinkedHashMap<>();
                if (r.tests() != null) {
                    r.tests().forEach((name, test) -> records.put(name, WireProtocol.fromWire(test)));
                }
                store.insertTestFileFps(r.executionId(), records);
                yield AckResponse.OK;
            }
            case WireProtocol.OP_DELETE -> {
                TestNamesRequest r = decode(body, TestNamesRequest.class);
                store.deleteTestExecutions(r.executionId(), WireProtocol.nullToEmpty(r.testNames()));
                yield AckResponse.OK;
            }
            case WireProtocol.OP_ALL_TESTS -> {
                ExecutionRequest r = decode(body, ExecutionRequest.class);
                yield new AllTestsResponse(store.allTestExecutions(r.executionId()));
            }
            case WireProtocol.OP_FILENAMES -> {
                ExecutionRequest r = decode(body, ExecutionRequest.class);
                yield new FilenamesResponse(new ArrayList<>(store.filenames(r.executionId())));
            }
            case WireProtocol.OP_FILENAMES_FINGERPRINTS -> {
                ExecutionRequest r = decode(body, ExecutionRequest.class);
                yield new FileHashesResponse(store.filenamesFingerprints(r.executionId()));
            }
            case WireProtocol.OP_CHANGED_FILE_DATA -> {
                FilenamesRequest r = decode(body, FilenamesRequest.class);
                List<WireChangedFileData> rows = new ArrayList<>();
                for (ChangedFileData row : store.fetchChangedFileData(r.executionId(),
                        WireProtocol.nullToEmpty(r.filenames()))) {
                    rows.add(WireProtocol.toWire(row));
                }
                yield new ChangedFileDataResponse(rows);
            }
            case WireProtocol.OP_FILE_DEPENDENCIES -> {
                ExecutionRequest r = decode(body, ExecutionRequest.class);
                yield new FilenamesResponse(new ArrayList<>(store.fileDependencyFilenames(r.executionId())));
            }
            case WireProtocol.OP_WRITE_ATTRIBUTE -> {
                AttributeRequest r = decode(body, AttributeRequest.class);
                store.writeAttribute(r.executionId(), requireName(r), r.value());
                yield AckResponse.OK;
            }
            case WireProtocol.OP_FETCH_ATTRIBUTE -> {
                AttributeRequest r = decode(body, AttributeRequest.class);
                yield new AttributeResponse(store.fetchAttribute(r.executionId(), requireName(r)).orElse(null));
            }
            case WireProtocol.OP_SAVING_STATS -> {
                StatsRequest r = decode(body, StatsRequest.class);
                yield store.fetchSavingStats(r.executionId(), r.selected());
            }
            case WireProtocol.OP_FINISH -> {
                FinishRequest r = decode(body, FinishRequest.class);
                store.finishExecution(r.executionId(), r.duration(), r.selected());
                yield AckResponse.OK;
            }
            default -> throw new BadRequestException(404, "Unknown operation: " + operation);
        };
    }

    private <T> T decode(byte[] body, Class<T> type) {
        try {
            return codec.decode(body, type);
        } catch (StoreException e) {
            throw new BadRequestException(400, e.getMessage());
        }
    }

    private static String requireName(AttributeRequest r) {
        if (r.name() == null || r.name().isBlank()) {
            throw new BadRequestException(400, "attribute name is required");
        }
        return r.name();
    }

    private static Map<String, String> orEmpty(Map<String, String> map) {
        return map == null ? Map.of() : map;
    }
}
