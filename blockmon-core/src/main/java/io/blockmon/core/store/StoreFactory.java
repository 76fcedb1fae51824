package io.blockmon.core.store;

import io.blockmon.core.config.BlockmonConfig;
import io.blockmon.core.store.embedded.EmbeddedFingerprintStore;
import io.blockmon.core.store.network.NetworkFingerprintStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Picks the {@link FingerprintStore} implementation from configuration.
 */
public final class StoreFactory {

    private static final Logger log = LoggerFactory.getLogger(StoreFactory.class);

    private StoreFactory() {
        // utility class
    }

    /**
     * Opens the configured store: the network store when enabled, otherwise
     * the embedded store at {@code dataFile} under {@code projectDir}.
     */
    public static FingerprintStore open(BlockmonConfig config, Path projectDir) {
        if (config.networkEnabled()) {
            log.info("Using network store at {} (repo={}, job={})",
                    config.serverUrl(), config.repoId(), config.jobId());
            return new NetworkFingerprintStore(config);
        }
        return openEmbedded(config, projectDir);
    }

    /**
     * Opens the embedded store.
     *
     * @throws StoreException if the data file cannot be opened
     */
    public static EmbeddedFingerprintStore openEmbedded(BlockmonConfig config, Path projectDir) {
        Path dataFile = projectDir.resolve(config.dataFile());
        log.info("Using embedded store {}", dataFile);
        return EmbeddedFingerprintStore.open(dataFile, config.cacheSize());
    }
}
