package io.blockmon.core.source;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.blockmon.core.config.BlockmonConfig;
import io.blockmon.core.fingerprint.BlockParser;
import io.blockmon.core.fingerprint.Module;
import io.blockmon.core.git.GitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Session view of the project's files: content hashes and parsed modules.
 *
 * <p>Hashes are remembered per file together with the modification time and
 * size they were computed for; the mtime is only a hint to skip re-reading,
 * the hash is what gets compared. Parsed modules live in a bounded LRU keyed
 * by (filename, fsha), so an unchanged file is parsed once per session.
 */
public final class SourceTree {

    private static final Logger log = LoggerFactory.getLogger(SourceTree.class);

    private record Stamp(long mtime, long size, String fsha) {}

    private record ModuleKey(String filename, String fsha) {}

    private final Path root;
    private final BlockmonConfig config;
    private final GitRepository git;
    private final BlockParser parser = new BlockParser();
    private final Cache<String, Stamp> stamps;
    private final Cache<ModuleKey, Module> modules;

    public SourceTree(Path root, BlockmonConfig config, GitRepository git) {
        this.root = root.toAbsolutePath().normalize();
        this.config = config;
        this.git = git;
        this.stamps = Caffeine.newBuilder().maximumSize(config.cacheSize() * 10L).build();
        this.modules = Caffeine.newBuilder().maximumSize(config.cacheSize()).build();
    }

    public Path root() {
        return root;
    }

    public GitRepository git() {
        return git;
    }

    /** Project-relative, forward-slash form of {@code path}, or empty if it lies outside the project. */
    public Optional<String> relativize(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        if (!absolute.startsWith(root)) {
            return Optional.empty();
        }
        return Optional.of(root.relativize(absolute).toString().replace('\\', '/'));
    }

    public boolean exists(String filename) {
        return Files.isRegularFile(root.resolve(filename));
    }

    /**
     * Whole-file content hash of the working copy.
     *
     * @return the git blob id, or empty when the file does not exist
     */
    public Optional<String> fsha(String filename) {
        Path file = root.resolve(filename);
        try {
            if (!Files.isRegularFile(file)) {
                stamps.invalidate(filename);
                return Optional.empty();
            }
            long mtime = Files.getLastModifiedTime(file).toMillis();
            long size = Files.size(file);
            Stamp stamp = stamps.getIfPresent(filename);
            if (stamp != null && stamp.mtime() == mtime && stamp.size() == size) {
                return Optional.of(stamp.fsha());
            }
            String fsha = GitRepository.blobSha(Files.readAllBytes(file));
            stamps.put(filename, new Stamp(mtime, size, fsha));
            return Optional.of(fsha);
        } catch (IOException e) {
            log.warn("Unable to hash {}: {}", filename, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parsed module for the current content of {@code filename}.
     *
     * @return the module, or empty when the file does not exist or cannot be read
     */
    public Optional<Module> module(String filename) {
        Optional<String> fsha = fsha(filename);
        if (fsha.isEmpty()) {
            return Optional.empty();
        }
        ModuleKey key = new ModuleKey(filename, fsha.get());
        Module cached = modules.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            String content = new String(Files.readAllBytes(root.resolve(filename)), StandardCharsets.UTF_8);
            Module module = config.isSourceFile(filename)
                    ? parser.parse(filename, content)
                    : parser.parseWholeFile(filename, content);
            modules.put(key, module);
            return Optional.of(module);
        } catch (IOException e) {
            log.warn("Unable to read {}: {}", filename, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Hash recorded for a data file a test read. Committed content is used so
     * that local uncommitted edits to fixtures do not churn the store; files
     * git does not track have no hash and are not recorded.
     */
    public Optional<String> dependencySha(String filename) {
        if (!git.isPresent()) {
            return fsha(filename);
        }
        return git.committedBlobSha(filename);
    }

    /** Drops cached hashes and modules. */
    public void clear() {
        stamps.invalidateAll();
        modules.invalidateAll();
    }
}
