package io.blockmon.core.recorder;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.blockmon.core.TestIds;
import io.blockmon.core.config.BlockmonConfig;
import io.blockmon.core.discovery.ImportScanner;
import io.blockmon.core.discovery.ImportScanner.ImportedFiles;
import io.blockmon.core.discovery.SourceFileScanner;
import io.blockmon.core.mapping.ModulePathMapper;
import io.blockmon.core.source.SourceTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Captures the dependencies of the running test that line coverage does not
 * show: data files it reads, classes it loads, and the external packages
 * those classes belong to.
 *
 * <p>At most one context is active at a time: the running test, or outside
 * of tests the test file being collected, so class loading triggered by
 * collecting a test class is attributed to every test in it.
 *
 * <p>State is guarded by a {@link ReentrantLock}. Resolving a class or a path
 * can itself load classes or read files; callbacks arriving on the same thread
 * while one is being handled are ignored.
 */
public final class DependencyTracker implements ResourceAccessObserver {

    private static final Logger log = LoggerFactory.getLogger(DependencyTracker.class);

    private static final Set<String> IGNORED_DIRS = Set.of(".git", "target", "build", ".gradle", ".idea");

    /** Mutable accumulator for one context. */
    private static final class Collected {
        final Set<String> moduleFiles = new TreeSet<>();
        final Set<String> fileReads = new TreeSet<>();
        final Set<String> externalPackages = new TreeSet<>();

        void addAll(Collected other) {
            moduleFiles.addAll(other.moduleFiles);
            fileReads.addAll(other.fileReads);
            externalPackages.addAll(other.externalPackages);
        }
    }

    private final BlockmonConfig config;
    private final SourceTree tree;
    private final ModulePathMapper mapper;
    private final ModuleLocator locator;
    private final ImportScanner imports;
    private final Path dataFile;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Collected> collected = new HashMap<>();
    private final Map<String, Boolean> localModules = new HashMap<>();
    private final Cache<String, Collected> homeFileImports;

    private String currentTest;
    private Collected current;
    private String collectionFile;
    private boolean collecting;
    private boolean handling;

    public DependencyTracker(BlockmonConfig config, SourceTree tree, ModulePathMapper mapper,
                             ModuleLocator locator, ImportScanner imports) {
        this.config = config;
        this.tree = tree;
        this.mapper = mapper;
        this.locator = locator;
        this.imports = imports;
        this.dataFile = tree.root().resolve(config.dataFile()).toAbsolutePath().normalize();
        this.homeFileImports = Caffeine.newBuilder().maximumSize(config.cacheSize()).build();
    }

    // ── Test context ────────────────────────────────────────────────────

    /** Begins capturing for {@code testId}; a context left open is discarded. */
    public void start(String testId) {
        lock.lock();
        try {
            if (currentTest != null) {
                log.warn("Dependency capture for {} was not stopped; discarding it", currentTest);
            }
            currentTest = testId;
            current = new Collected();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends capturing for the current test and returns its dependencies,
     * including what was loaded while its test file was collected and the
     * imports of its test file.
     */
    public TrackedDependencies stop() {
        lock.lock();
        try {
            if (currentTest == null) {
                return TrackedDependencies.NONE;
            }
            String homeFile = TestIds.homeFile(currentTest);
            Collected result = new Collected();
            result.addAll(current);
            Collected atCollection = collected.get(homeFile);
            if (atCollection != null) {
                result.addAll(atCollection);
            }
            result.addAll(homeFileImports.get(homeFile, this::importsOf));
            result.moduleFiles.remove(homeFile);

            currentTest = null;
            current = null;
            return new TrackedDependencies(result.moduleFiles, result.fileReads, result.externalPackages);
        } finally {
            lock.unlock();
        }
    }

    /** Drops the current test's context without returning it. */
    public void discard() {
        lock.lock();
        try {
            currentTest = null;
            current = null;
        } finally {
            lock.unlock();
        }
    }

    // ── Collection context ──────────────────────────────────────────────

    public void startCollection() {
        lock.lock();
        try {
            collecting = true;
            collectionFile = null;
        } finally {
            lock.unlock();
        }
    }

    /** Attributes subsequent loads and reads to the tests of {@code testFile}. */
    public void setCollectionContext(String testFile) {
        lock.lock();
        try {
            collectionFile = testFile;
        } finally {
            lock.unlock();
        }
    }

    public void stopCollection() {
        lock.lock();
        try {
            collecting = false;
            collectionFile = null;
            log.debug("Collection captured dependencies for {} test files", collected.size());
        } finally {
            lock.unlock();
        }
    }

    // ── Callbacks ───────────────────────────────────────────────────────

    @Override
    public void beforeFileRead(Path file) {
        lock.lock();
        try {
            Collected target = activeContext();
            if (target == null || handling) {
                return;
            }
            handling = true;
            try {
                trackedFilename(file).ifPresent(target.fileReads::add);
            } finally {
                handling = false;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onModuleLoad(String className) {
        lock.lock();
        try {
            Collected target = activeContext();
            if (target == null || handling) {
                return;
            }
            handling = true;
            try {
                attribute(locator.locate(className), target);
            } finally {
                handling = false;
            }
        } finally {
            lock.unlock();
        }
    }

    // ── Internal helpers ────────────────────────────────────────────────

    private Collected activeContext() {
        if (current != null) {
            return current;
        }
        if (collecting && collectionFile != null) {
            return collected.computeIfAbsent(collectionFile, k -> new Collected());
        }
        return null;
    }

    private void attribute(ModuleOrigin origin, Collected target) {
        switch (origin.kind()) {
            case LOCAL -> {
                if (!mapper.isExcluded(origin.sourceFile())) {
                    target.moduleFiles.add(origin.sourceFile());
                }
            }
            case EXTERNAL -> {
                if (!isLocalModule(origin.artifact())) {
                    target.externalPackages.add(origin.artifact());
                }
            }
            case PLATFORM, UNKNOWN -> log.trace("Ignoring load of {} ({})", origin.className(), origin.kind());
        }
    }

    private boolean isLocalModule(String artifact) {
        return localModules.computeIfAbsent(artifact,
                a -> SourceFileScanner.isLocalModule(tree.root(), config.sourceDirs(), a));
    }

    /**
     * Project-relative name of a data file worth recording: inside the
     * project, not under VCS or build output, not a source file (coverage
     * covers those) and not the store's own data file.
     */
    private Optional<String> trackedFilename(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        if (absolute.startsWith(dataFile) || absolute.getFileName() == null
                || absolute.getFileName().toString().startsWith(dataFile.getFileName().toString())) {
            return Optional.empty();
        }
        Optional<String> relative = tree.relativize(absolute);
        if (relative.isEmpty()) {
            return Optional.empty();
        }
        String filename = relative.get();
        for (String part : filename.split("/")) {
            if (IGNORED_DIRS.contains(part)) {
                return Optional.empty();
            }
        }
        if (config.isSourceFile(filename) || mapper.isExcluded(filename)) {
            return Optional.empty();
        }
        return relative;
    }

    private Collected importsOf(String homeFile) {
        Collected result = new Collected();
        ImportedFiles scanned = imports.scan(homeFile);
        result.moduleFiles.addAll(scanned.localFiles());
        for (String className : scanned.externalClasses()) {
            attribute(locator.locate(className), result);
        }
        return result;
    }
}
