package io.blockmon.server;

import com.sun.net.httpserver.HttpServer;
import io.blockmon.core.store.wire.WireCodec;
import io.blockmon.core.store.wire.WireProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Standalone fingerprint store: serves the RPC surface used by network
 * stores and the read-only reporting views, backed by one embedded store per
 * (repository, job) under the data directory.
 */
public final class FingerprintStoreServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FingerprintStoreServer.class);

    static final int GZIP_THRESHOLD = 1024;
    private static final int STORE_CACHE_SIZE = 1000;

    private final HttpServer server;
    private final ExecutorService executor;
    private final StoreRegistry registry;

    private FingerprintStoreServer(HttpServer server, ExecutorService executor, StoreRegistry registry) {
        this.server = server;
        this.executor = executor;
        this.registry = registry;
    }

    public static void main(String[] args) {
        Config config;
        try {
            config = Config.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(Config.usage());
            System.exit(1);
            return;
        }
        if (config.help()) {
            System.out.println(Config.usage());
            return;
        }

        FingerprintStoreServer server = start(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "blockmon-server-shutdown"));
    }

    /** Binds and starts serving; port 0 picks a free port. */
    public static FingerprintStoreServer start(Config config) {
        HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(config.bindAddress(), config.port()), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot bind " + config.bindAddress() + ":" + config.port(), e);
        }
        WireCodec codec = new WireCodec(GZIP_THRESHOLD);
        StoreRegistry registry = new StoreRegistry(config.dataDir(), STORE_CACHE_SIZE);

        server.createContext(WireProtocol.RPC_PATH, new RpcHandler(registry, codec, config.token(), config.maxBodyBytes()));
        server.createContext(WireProtocol.REPORT_PATH, new ReportingHandler(registry, codec, config.token()));
        server.createContext(WireProtocol.HEALTH_PATH, exchange -> {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                HttpUtils.sendPlainText(exchange, 405, "GET required");
                return;
            }
            HttpUtils.sendPlainText(exchange, 200, "ok");
        });

        ExecutorService executor = Executors.newFixedThreadPool(config.workerThreads());
        server.setExecutor(executor);
        server.start();

        log.info("=== Fingerprint store server ready on {}:{} (threads={}, data={}) ===",
                config.bindAddress(), server.getAddress().getPort(), config.workerThreads(), config.dataDir());
        if (config.token() == null) {
            log.warn("No --token given; requests are not authenticated");
        }
        return new FingerprintStoreServer(server, executor, registry);
    }

    public int port() {
        return server.getAddress().getPort();
    }

    /** Stops accepting requests, drains the worker pool and closes every store. */
    @Override
    public void close() {
        log.info("Shutting down fingerprint store server ({} active sessions)", registry.activeSessions());
        server.stop(0);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        } finally {
            registry.close();
        }
    }

    // ── Configuration ───────────────────────────────────────────────────

    public record Config(String bindAddress, int port, int workerThreads, Path dataDir, String token,
                         int maxBodyBytes, boolean help) {

        public static final int DEFAULT_PORT = 8004;
        public static final int DEFAULT_MAX_BODY_MB = 64;

        /** @throws IllegalArgumentException on unknown options or bad values */
        public static Config fromArgs(String[] args) {
            String bindAddress = "127.0.0.1";
            int port = DEFAULT_PORT;
            int workerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());
            Path dataDir = Path.of("blockmon-data");
            String token = System.getenv("BLOCKMON_SERVER_TOKEN");
            int maxBodyMb = DEFAULT_MAX_BODY_MB;
            boolean help = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--port" -> port = parseIntArg(args, ++i, "--port");
                    case "--bind", "--host" -> bindAddress = requireArg(args, ++i, "--bind");
                    case "--threads" -> workerThreads = Math.max(1, parseIntArg(args, ++i, "--threads"));
                    case "--data-dir" -> dataDir = Path.of(requireArg(args, ++i, "--data-dir"));
                    case "--token" -> token = requireArg(args, ++i, "--token");
                    case "--max-body-mb" -> maxBodyMb = parseIntArg(args, ++i, "--max-body-mb");
                    case "--help", "-h" -> help = true;
                    default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
                }
            }
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            if (maxBodyMb < 1 || maxBodyMb > 1024) {
                throw new IllegalArgumentException("--max-body-mb must be between 1 and 1024: " + maxBodyMb);
            }
            if (token != null && token.isBlank()) {
                token = null;
            }
            return new Config(bindAddress, port, workerThreads, dataDir, token, maxBodyMb << 20, help);
        }

        static String usage() {
            return String.join(System.lineSeparator(), List.of(
                    "Usage: java -jar blockmon-server.jar [options]",
                    "Options:",
                    "  --port <port>            TCP port to listen on (default " + DEFAULT_PORT + ")",
                    "  --bind <address>         Bind address (default 127.0.0.1)",
                    "  --threads <count>        Worker threads (default cpu cores)",
                    "  --data-dir <dir>         Directory holding the store files (default blockmon-data)",
                    "  --token <token>          Require Authorization: Bearer <token> (default $BLOCKMON_SERVER_TOKEN)",
                    "  --max-body-mb <mb>       Largest request body accepted, after gunzip (default " + DEFAULT_MAX_BODY_MB + ")",
                    "  --help                   Show this message"
            ));
        }

        private static String requireArg(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }

        private static int parseIntArg(String[] args, int index, String option) {
            String value = requireArg(args, index, option);
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer for " + option + ": " + value, e);
            }
        }
    }
}
