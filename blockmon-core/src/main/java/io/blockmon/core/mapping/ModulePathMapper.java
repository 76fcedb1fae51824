package io.blockmon.core.mapping;

import io.blockmon.core.config.BlockmonConfig;
import io.blockmon.core.discovery.SourceFileScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.*;

/**
 * Maps project-relative file paths to fully-qualified class names and back.
 * Handles multi-module paths like {@code module/src/main/java/com/example/Foo.java}
 * and filters by exclusion patterns.
 */
public final class ModulePathMapper {

    private static final Logger log = LoggerFactory.getLogger(ModulePathMapper.class);

    private final Path projectDir;
    private final BlockmonConfig config;
    private final List<PathMatcher> excludes;
    private List<Path> roots;

    public ModulePathMapper(Path projectDir, BlockmonConfig config) {
        this.projectDir = projectDir.toAbsolutePath().normalize();
        this.config = config;
        this.excludes = new ArrayList<>();
        for (String pattern : config.excludePaths()) {
            excludes.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }
    }

    /**
     * Class name of a source file under one of the source or test directories.
     *
     * @param filename project-relative path
     * @return the FQN, or empty when the file is not under a known source dir
     */
    public Optional<String> toClassName(String filename) {
        String fqn = tryMapToClass(filename, config.testDirs());
        if (fqn == null) {
            fqn = tryMapToClass(filename, config.sourceDirs());
        }
        return Optional.ofNullable(fqn);
    }

    public boolean isTestFile(String filename) {
        return tryMapToClass(filename, config.testDirs()) != null;
    }

    /**
     * Finds the source file declaring {@code className}. Nested classes
     * ({@code Outer$Inner} or {@code com.example.Outer.Inner}) resolve to the
     * file of their outermost class.
     *
     * @return project-relative path of the source file, or empty when none exists
     */
    public Optional<String> resolveSourceFile(String className) {
        int dollar = className.indexOf('$');
        String candidate = dollar >= 0 ? className.substring(0, dollar) : className;
        while (!candidate.isEmpty()) {
            for (Path root : roots()) {
                for (String extension : config.sourceExtensions()) {
                    Path file = root.resolve(candidate.replace('.', '/') + "." + extension);
                    if (Files.isRegularFile(file)) {
                        return Optional.of(projectDir.relativize(file).toString().replace('\\', '/'));
                    }
                }
            }
            // com.example.Outer.Inner -> com.example.Outer
            int dot = candidate.lastIndexOf('.');
            if (dot < 0) {
                break;
            }
            candidate = candidate.substring(0, dot);
        }
        log.debug("No source file for class {}", className);
        return Optional.empty();
    }

    public boolean isExcluded(String filename) {
        Path path = Path.of(filename);
        for (PathMatcher matcher : excludes) {
            if (matcher.matches(path)) {
                return true;
            }
        }
        return false;
    }

    /** Every source and test root of the project, test roots first. */
    public synchronized List<Path> roots() {
        if (roots == null) {
            List<Path> found = new ArrayList<>();
            for (String dir : config.testDirs()) {
                found.addAll(SourceFileScanner.findAllMatchingDirs(projectDir, dir));
            }
            for (String dir : config.sourceDirs()) {
                found.addAll(SourceFileScanner.findAllMatchingDirs(projectDir, dir));
            }
            roots = List.copyOf(found);
        }
        return roots;
    }

    /**
     * Tries to map a file path to an FQN given a list of source directories.
     */
    private String tryMapToClass(String filePath, List<String> sourceDirs) {
        String normalized = filePath.replace('\\', '/');
        int extensionDot = normalized.lastIndexOf('.');
        if (extensionDot < 0 || !config.sourceExtensions().contains(normalized.substring(extensionDot + 1))) {
            return null;
        }
        for (String sourceDir : sourceDirs) {
            String normalizedDir = sourceDir.replace('\\', '/');
            if (!normalizedDir.endsWith("/")) {
                normalizedDir += "/";
            }
            // the source dir must start the path or follow a "/" boundary
            int start;
            if (normalized.startsWith(normalizedDir)) {
                start = normalizedDir.length();
            } else {
                int idx = normalized.indexOf("/" + normalizedDir);
                if (idx < 0) {
                    continue;
                }
                start = idx + 1 + normalizedDir.length();
            }
            if (start >= extensionDot) {
                continue;
            }
            return normalized.substring(start, extensionDot).replace('/', '.');
        }
        return null;
    }
}
