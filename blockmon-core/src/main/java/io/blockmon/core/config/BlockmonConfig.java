package io.blockmon.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Configuration for a blockmon session.
 * Immutable value object; use the {@link Builder} to construct, or
 * {@link #fromEnvironment(Map)} to read the {@code BLOCKMON_*} variables.
 */
public final class BlockmonConfig {

    /** Role of this process when tests are distributed over several workers. */
    public enum Role { COORDINATOR, WORKER }

    public static final String DEFAULT_DATA_FILE = ".blockmondata";

    private final String environment;
    private final String dataFile;
    private final int batchSize;
    private final int importDepth;
    private final List<String> sourceDirs;
    private final List<String> testDirs;
    private final List<String> sourceExtensions;
    private final List<String> excludePaths;
    private final boolean networkEnabled;
    private final String serverUrl;
    private final String repoId;
    private final String jobId;
    private final String authToken;
    private final String runId;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double backoffMultiplier;
    private final Duration requestTimeout;
    private final int gzipThreshold;
    private final int cacheSize;
    private final boolean consistencyCheck;
    private final Role role;

    private BlockmonConfig(Builder builder) {
        this.environment = builder.environment;
        this.dataFile = builder.dataFile;
        this.batchSize = builder.batchSize;
        this.importDepth = builder.importDepth;
        this.sourceDirs = List.copyOf(builder.sourceDirs);
        this.testDirs = List.copyOf(builder.testDirs);
        this.sourceExtensions = List.copyOf(builder.sourceExtensions);
        this.excludePaths = List.copyOf(builder.excludePaths);
        this.networkEnabled = builder.networkEnabled;
        this.serverUrl = builder.serverUrl;
        this.repoId = builder.repoId;
        this.jobId = builder.jobId;
        this.authToken = builder.authToken;
        this.runId = builder.runId;
        this.maxAttempts = builder.maxAttempts;
        this.initialBackoff = builder.initialBackoff;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.requestTimeout = builder.requestTimeout;
        this.gzipThreshold = builder.gzipThreshold;
        this.cacheSize = builder.cacheSize;
        this.consistencyCheck = builder.consistencyCheck;
        this.role = builder.role;
    }

    public String environment() { return environment; }
    public String dataFile() { return dataFile; }
    public int batchSize() { return batchSize; }
    public int importDepth() { return importDepth; }
    public List<String> sourceDirs() { return sourceDirs; }
    public List<String> testDirs() { return testDirs; }
    public List<String> sourceExtensions() { return sourceExtensions; }
    public List<String> excludePaths() { return excludePaths; }
    public boolean networkEnabled() { return networkEnabled; }
    public String serverUrl() { return serverUrl; }
    public String repoId() { return repoId; }
    public String jobId() { return jobId; }
    public String authToken() { return authToken; }
    public String runId() { return runId; }
    public int maxAttempts() { return maxAttempts; }
    public Duration initialBackoff() { return initialBackoff; }
    public double backoffMultiplier() { return backoffMultiplier; }
    public Duration requestTimeout() { return requestTimeout; }
    public int gzipThreshold() { return gzipThreshold; }
    public int cacheSize() { return cacheSize; }
    public boolean consistencyCheck() { return consistencyCheck; }
    public Role role() { return role; }

    /** True when the file extension is one that {@code BlockParser} splits into blocks. */
    public boolean isSourceFile(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        return sourceExtensions.contains(filename.substring(dot + 1));
    }

    /** Creates a builder with sensible defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads configuration from environment variables. Unknown or blank values
     * keep the builder defaults.
     *
     * @param env variables, usually {@code System.getenv()}
     * @return a builder pre-populated from {@code env}
     */
    public static Builder fromEnvironment(Map<String, String> env) {
        Builder builder = builder();
        String netEnabled = env.get("BLOCKMON_NET_ENABLED");
        if (netEnabled != null) {
            builder.networkEnabled(isTruthy(netEnabled));
        }
        String server = env.get("BLOCKMON_SERVER");
        if (notBlank(server)) {
            builder.serverUrl(server);
        }
        String repo = firstNonBlank(env.get("BLOCKMON_REPO_ID"), env.get("GITHUB_REPOSITORY"));
        if (repo != null) {
            builder.repoId(repo);
        }
        String job = env.get("BLOCKMON_JOB_ID");
        if (notBlank(job)) {
            builder.jobId(job);
        }
        String token = env.get("BLOCKMON_AUTH_TOKEN");
        if (notBlank(token)) {
            builder.authToken(token);
        }
        String run = firstNonBlank(env.get("BLOCKMON_RUN_ID"), env.get("GITHUB_RUN_ID"));
        if (run != null) {
            builder.runId(run);
        }
        String dataFile = env.get("BLOCKMON_DATAFILE");
        if (notBlank(dataFile)) {
            builder.dataFile(dataFile);
        }
        String environment = env.get("BLOCKMON_ENVIRONMENT");
        if (notBlank(environment)) {
            builder.environment(environment);
        }
        String batchSize = env.get("BLOCKMON_BATCH_SIZE");
        if (notBlank(batchSize)) {
            try {
                builder.batchSize(Integer.parseInt(batchSize.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("BLOCKMON_BATCH_SIZE is not a number: " + batchSize, e);
            }
        }
        return builder;
    }

    private static boolean isTruthy(String value) {
        String v = value.trim().toLowerCase();
        return v.equals("1") || v.equals("true") || v.equals("yes") || v.equals("on");
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static String firstNonBlank(String a, String b) {
        if (notBlank(a)) return a;
        if (notBlank(b)) return b;
        return null;
    }

    public static final class Builder {
        private String environment = "default";
        private String dataFile = DEFAULT_DATA_FILE;
        private int batchSize = 250;
        private int importDepth = 1;
        private List<String> sourceDirs = List.of("src/main/java");
        private List<String> testDirs = List.of("src/test/java");
        private List<String> sourceExtensions = List.of("java");
        private List<String> excludePaths = List.of("**/generated/**");
        private boolean networkEnabled = false;
        private String serverUrl = "http://localhost:8004";
        private String repoId = "local";
        private String jobId = "default";
        private String authToken = null;
        private String runId = null;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
        private Duration requestTimeout = Duration.ofSeconds(60);
        private int gzipThreshold = 1024;
        private int cacheSize = 1000;
        private boolean consistencyCheck = false;
        private Role role = Role.COORDINATOR;

        public Builder environment(String environment) {
            if (environment == null || environment.isBlank()) {
                throw new IllegalArgumentException("environment must not be null or blank");
            }
            this.environment = environment;
            return this;
        }

        public Builder dataFile(String dataFile) {
            if (dataFile == null || dataFile.isBlank()) {
                throw new IllegalArgumentException("dataFile must not be null or blank");
            }
            this.dataFile = dataFile;
            return this;
        }

        public Builder serverUrl(String serverUrl) {
            if (serverUrl == null || !(serverUrl.startsWith("http://") || serverUrl.startsWith("https://"))) {
                throw new IllegalArgumentException("serverUrl must be an http(s) URL: " + serverUrl);
            }
            this.serverUrl = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
            return this;
        }

        public Builder batchSize(int v) { this.batchSize = Math.max(1, v); return this; }
        public Builder importDepth(int v) { this.importDepth = Math.max(0, Math.min(v, 5)); return this; }
        public Builder sourceDirs(List<String> v) { this.sourceDirs = v; return this; }
        public Builder testDirs(List<String> v) { this.testDirs = v; return this; }
        public Builder sourceExtensions(List<String> v) { this.sourceExtensions = v; return this; }
        public Builder excludePaths(List<String> v) { this.excludePaths = v; return this; }
        public Builder networkEnabled(boolean v) { this.networkEnabled = v; return this; }
        public Builder repoId(String v) { this.repoId = v; return this; }
        public Builder jobId(String v) { this.jobId = v; return this; }
        public Builder authToken(String v) { this.authToken = v; return this; }
        public Builder runId(String v) { this.runId = v; return this; }
        public Builder maxAttempts(int v) { this.maxAttempts = Math.max(1, Math.min(v, 10)); return this; }
        public Builder initialBackoff(Duration v) { this.initialBackoff = v; return this; }
        public Builder backoffMultiplier(double v) { this.backoffMultiplier = Math.max(1.0, v); return this; }
        public Builder requestTimeout(Duration v) { this.requestTimeout = v; return this; }
        public Builder gzipThreshold(int v) { this.gzipThreshold = Math.max(0, v); return this; }
        public Builder cacheSize(int v) { this.cacheSize = Math.max(1, v); return this; }
        public Builder consistencyCheck(boolean v) { this.consistencyCheck = v; return this; }
        public Builder role(Role v) { this.role = v; return this; }

        public BlockmonConfig build() {
            if (networkEnabled && (repoId == null || repoId.isBlank())) {
                throw new IllegalArgumentException("repoId is required when the network store is enabled");
            }
            return new BlockmonConfig(this);
        }
    }
}
