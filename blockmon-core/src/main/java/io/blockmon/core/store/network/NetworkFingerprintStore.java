package io.blockmon.core.store.network;

import io.blockmon.core.config.BlockmonConfig;
import io.blockmon.core.store.*;
import io.blockmon.core.store.wire.WireCodec;
import io.blockmon.core.store.wire.WireProtocol;
import io.blockmon.core.store.wire.WireProtocol.*;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.*;

/**
 * {@link FingerprintStore} client for the store server.
 *
 * <p>Every call is one {@code POST} carrying the repository, job and session
 * headers. Connection failures, timeouts, HTTP 429 and 5xx responses are
 * retried with exponential backoff; once retries are exhausted the call throws
 * {@link StoreUnavailableException}. Other 4xx responses are not retried and
 * surface as {@link StoreException}.
 */
public final class NetworkFingerprintStore implements FingerprintStore {

    private static final Logger log = LoggerFactory.getLogger(NetworkFingerprintStore.class);

    /** An HTTP status worth retrying. */
    static final class TransientStatusException extends Exception {
        private final int status;

        TransientStatusException(int status, String operation) {
            super("HTTP " + status + " from " + operation);
            this.status = status;
        }

        int status() {
            return status;
        }
    }

    private final BlockmonConfig config;
    private final HttpClient client;
    private final WireCodec codec;
    private final Retry retry;
    private final String sessionId;

    public NetworkFingerprintStore(BlockmonConfig config) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(config.requestTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .build());
    }

    NetworkFingerprintStore(BlockmonConfig config, HttpClient client) {
        this.config = config;
        this.client = client;
        this.codec = new WireCodec(config.gzipThreshold());
        this.sessionId = UUID.randomUUID().toString();
        this.retry = Retry.of("blockmon-store", RetryConfig.custom()
                .maxAttempts(config.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        config.initialBackoff(), config.backoffMultiplier()))
                .retryOnException(e -> e instanceof IOException || e instanceof TransientStatusException)
                .build());
        this.retry.getEventPublisher().onRetry(event -> log.warn("Retrying store call (attempt {}): {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    @Override
    public boolean isRemote() {
        return true;
    }

    public String sessionId() {
        return sessionId;
    }

    // ── Operations ──────────────────────────────────────────────────────

    @Override
    public InitiatedExecution initiateExecution(String environment, String packages, String runtimeVersion,
                                                Map<String, String> metadata) {
        InitiateResponse r = call(WireProtocol.OP_INITIATE,
                new InitiateRequest(environment, packages, runtimeVersion, metadata), InitiateResponse.class);
        log.info("Initiated remote execution {} for {}/{} ({})", r.executionId(), config.repoId(), config.jobId(),
                environment);
        return new InitiatedExecution(r.executionId(),
                new TreeSet<>(WireProtocol.nullToEmpty(r.knownFilenames())),
                r.packagesChanged(),
                new TreeSet<>(WireProtocol.nullToEmpty(r.changedPackages())));
    }

    @Override
    public OptionalLong lookupExecution(String environment) {
        LookupResponse r = call(WireProtocol.OP_LOOKUP, new LookupRequest(environment), LookupResponse.class);
        return r.executionId() == null ? OptionalLong.empty() : OptionalLong.of(r.executionId());
    }

    @Override
    public List<String> fetchUnknownFiles(long executionId, Map<String, String> filenameToFsha) {
        FilenamesResponse r = call(WireProtocol.OP_FETCH_UNKNOWN,
                new FetchUnknownRequest(executionId, filenameToFsha), FilenamesResponse.class);
        return WireProtocol.nullToEmpty(r.filenames());
    }

    @Override
    public DeterminedTests determineTests(long executionId, Map<String, List<Integer>> filenameToChecksums,
                                          Map<String, String> fileDependencyShas, Set<String> changedPackages) {
        DetermineResponse r = call(WireProtocol.OP_DETERMINE,
                new DetermineRequest(executionId, WireProtocol.checksumsToWire(filenameToChecksums),
                        fileDependencyShas, changedPackages),
                DetermineResponse.class);
        return new DeterminedTests(new TreeSet<>(WireProtocol.nullToEmpty(r.affected())),
                new TreeSet<>(WireProtocol.nullToEmpty(r.failing())));
    }

    @Override
    public void insertTestFileFps(long executionId, Map<String, TestExecutionRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        Map<String, WireTestRecord> tests = new LinkedHashMap<>();
        records.forEach((name, record) -> tests.put(name, WireProtocol.toWire(record)));
        call(WireProtocol.OP_INSERT, new InsertRequest(executionId, tests), AckResponse.class);
    }

    @Override
    public void deleteTestExecutions(long executionId, Collection<String> testNames) {
        if (testNames.isEmpty()) {
            return;
        }
        call(WireProtocol.OP_DELETE, new TestNamesRequest(executionId, new ArrayList<>(testNames)), AckResponse.class);
    }

    @Override
    public Map<String, StoredTestExecution> allTestExecutions(long executionId) {
        AllTestsResponse r = call(WireProtocol.OP_ALL_TESTS, new ExecutionRequest(executionId), AllTestsResponse.class);
        return r.tests() == null ? Map.of() : new TreeMap<>(r.tests());
    }

    @Override
    public Set<String> filenames(long executionId) {
        FilenamesResponse r = call(WireProtocol.OP_FILENAMES, new ExecutionRequest(executionId), FilenamesResponse.class);
        return new TreeSet<>(WireProtocol.nullToEmpty(r.filenames()));
    }

    @Override
    public Map<String, String> filenamesFingerprints(long executionId) {
        FileHashesResponse r = call(WireProtocol.OP_FILENAMES_FINGERPRINTS, new ExecutionRequest(executionId),
                FileHashesResponse.class);
        return r.fshas() == null ? Map.of() : new TreeMap<>(r.fshas());
    }

    @Override
    public List<ChangedFileData> fetchChangedFileData(long executionId, Collection<String> filenames) {
        ChangedFileDataResponse r = call(WireProtocol.OP_CHANGED_FILE_DATA,
                new FilenamesRequest(executionId, new ArrayList<>(filenames)), ChangedFileDataResponse.class);
        List<ChangedFileData> rows = new ArrayList<>();
        for (WireChangedFileData row : WireProtocol.nullToEmpty(r.rows())) {
            rows.add(WireProtocol.fromWire(row));
        }
        return rows;
    }

    @Override
    public Set<String> fileDependencyFilenames(long executionId) {
        FilenamesResponse r = call(WireProtocol.OP_FILE_DEPENDENCIES, new ExecutionRequest(executionId),
                FilenamesResponse.class);
        return new TreeSet<>(WireProtocol.nullToEmpty(r.filenames()));
    }

    @Override
    public void writeAttribute(long executionId, String name, String value) {
        call(WireProtocol.OP_WRITE_ATTRIBUTE, new AttributeRequest(executionId, name, value), AckResponse.class);
    }

    @Override
    public Optional<String> fetchAttribute(long executionId, String name) {
        AttributeResponse r = call(WireProtocol.OP_FETCH_ATTRIBUTE, new AttributeRequest(executionId, name, null),
                AttributeResponse.class);
        return Optional.ofNullable(r.value());
    }

    @Override
    public SavingStats fetchSavingStats(long executionId, boolean selected) {
        return call(WireProtocol.OP_SAVING_STATS, new StatsRequest(executionId, selected), SavingStats.class);
    }

    @Override
    public void finishExecution(long executionId, double duration, boolean selected) {
        call(WireProtocol.OP_FINISH, new FinishRequest(executionId, duration, selected), AckResponse.class);
    }

    @Override
    public void close() {
        // durability is the server's concern; nothing is buffered client-side
        log.debug("Closed network store session {}", sessionId);
    }

    // ── Transport ───────────────────────────────────────────────────────

    private <T> T call(String operation, Object request, Class<T> responseType) {
        byte[] body = codec.encode(request);
        boolean compress = codec.shouldCompress(body);
        byte[] payload = compress ? WireCodec.gzip(body) : body;

        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(config.serverUrl() + WireProtocol.RPC_PATH + operation))
                .timeout(config.requestTimeout())
                .header("Content-Type", "application/json")
                .header("Accept-Encoding", WireCodec.GZIP)
                .header(WireProtocol.HEADER_REPO, config.repoId())
                .header(WireProtocol.HEADER_JOB, config.jobId())
                .header(WireProtocol.HEADER_SESSION, sessionId)
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload));
        if (compress) {
            builder.header("Content-Encoding", WireCodec.GZIP);
        }
        if (config.authToken() != null) {
            builder.header(WireProtocol.HEADER_AUTHORIZATION, "Bearer " + config.authToken());
        }
        HttpRequest httpRequest = builder.build();

        byte[] responseBody;
        try {
            responseBody = retry.executeCallable(() -> send(operation, httpRequest));
        } catch (IOException | TransientStatusException e) {
            throw new StoreUnavailableException("Store server " + config.serverUrl() + " unavailable for "
                    + operation + " after " + config.maxAttempts() + " attempts: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted during " + operation, e);
        } catch (StoreException e) {
            throw e;
        } catch (Exception e) {
            throw new StoreException("Store call " + operation + " failed: " + e.getMessage(), e);
        }
        return codec.decode(responseBody, responseType);
    }

    private byte[] send(String operation, HttpRequest request)
            throws IOException, InterruptedException, TransientStatusException {
        HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new TransientStatusException(status, operation);
        }
        byte[] body = response.body();
        if (response.headers().firstValue("Content-Encoding").filter(WireCodec.GZIP::equalsIgnoreCase).isPresent()) {
            body = WireCodec.gunzip(body);
        }
        if (status >= 400) {
            String message = new String(body, java.nio.charset.StandardCharsets.UTF_8);
            throw new StoreException("Store server rejected " + operation + " (HTTP " + status + "): " + message);
        }
        return body;
    }
}
