package io.blockmon.server;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.blockmon.core.store.embedded.EmbeddedFingerprintStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One embedded store per (repository, job), at
 * {@code <dataDir>/<repo>/<job>.db}, opened on first use and kept open until
 * the server stops. Names that sanitize to the same data file share one store. Client sessions are remembered for 30 minutes after
 * their last request.
 */
final class StoreRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StoreRegistry.class);

    static final Duration SESSION_TTL = Duration.ofMinutes(30);

    record StoreKey(String repo, String job) {}

    record Session(String id, StoreKey key, Instant started) {}

    private final Path dataDir;
    private final int cacheSize;
    private final Map<Path, EmbeddedFingerprintStore> stores = new ConcurrentHashMap<>();
    private final Cache<String, Session> sessions;
    private volatile boolean closed;

    StoreRegistry(Path dataDir, int cacheSize) {
        this.dataDir = dataDir.toAbsolutePath().normalize();
        this.cacheSize = cacheSize;
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(SESSION_TTL)
                .maximumSize(10_000)
                .build();
    }

    /** The store for {@code repo}/{@code job}, opened on first use. */
    EmbeddedFingerprintStore open(String repo, String job) {
        if (closed) {
            throw new IllegalStateException("Store registry is closed");
        }
        return stores.computeIfAbsent(dataFile(new StoreKey(repo, job)), file -> {
            log.info("Opening store for {}/{} at {}", repo, job, file);
            return EmbeddedFingerprintStore.open(file, cacheSize);
        });
    }

    /** The store for {@code repo}/{@code job} if its data file exists; never creates one. */
    Optional<EmbeddedFingerprintStore> existing(String repo, String job) {
        Path file = dataFile(new StoreKey(repo, job));
        EmbeddedFingerprintStore open = stores.get(file);
        if (open != null) {
            return Optional.of(open);
        }
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(open(repo, job));
    }

    /** Registers or refreshes a client session. */
    void touchSession(String sessionId, String repo, String job) {
        if (sessionId == null || sessionId.isBlank()) {
            return;
        }
        sessions.get(sessionId, id -> {
            log.info("New session {} for {}/{}", id, repo, job);
            return new Session(id, new StoreKey(repo, job), Instant.now());
        });
    }

    long activeSessions() {
        sessions.cleanUp();
        return sessions.estimatedSize();
    }

    Path dataFile(StoreKey key) {
        return dataDir.resolve(sanitize(key.repo())).resolve(sanitize(key.job()) + ".db");
    }

    /** Keeps names usable as a single path segment: {@code owner/repo} becomes {@code owner_repo}. */
    static String sanitize(String name) {
        String cleaned = name.replaceAll("[^A-Za-z0-9_-]", "_");
        return cleaned.isEmpty() ? "_" : cleaned;
    }

    @Override
    public void close() {
        closed = true;
        for (Map.Entry<Path, EmbeddedFingerprintStore> e : stores.entrySet()) {
            log.debug("Closing store at {}", e.getKey());
            e.getValue().close();
        }
        stores.clear();
        sessions.invalidateAll();
    }
}
