package io.blockmon.core.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/**
 * File-walking helpers for single-module and multi-module projects.
 *
 * <p>Source roots are found at any nesting depth: with
 * {@code sourceDirs = ["src/main/java"]} the roots {@code root/src/main/java},
 * {@code root/api/src/main/java} and {@code root/services/payment/src/main/java}
 * all count.
 */
public final class SourceFileScanner {

    private static final Logger log = LoggerFactory.getLogger(SourceFileScanner.class);

    /** Directories that should never be descended into when searching for modules. */
    private static final Set<String> SKIP_DIRS = Set.of(
            ".git", ".gradle", ".idea", ".mvn", "build", "target", "out", "node_modules"
    );

    private SourceFileScanner() {
        // utility class
    }

    // ── Local module detection ─────────────────────────────────────────

    /**
     * True when {@code artifactName} names a module of the project: a
     * directory of that name holding one of the source roots. A jar built
     * from a sibling module is then not an external package.
     */
    public static boolean isLocalModule(Path projectDir, List<String> sourceDirs, String artifactName) {
        if (artifactName == null || artifactName.isEmpty()) {
            return false;
        }
        Path projectName = projectDir.toAbsolutePath().normalize().getFileName();
        for (String dir : sourceDirs) {
            for (Path root : findAllMatchingDirs(projectDir, dir)) {
                Path moduleDir = moduleDirOf(root, dir);
                Path name = moduleDir == null ? projectName : moduleDir.getFileName();
                if (name != null && name.toString().equals(artifactName)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Path moduleDirOf(Path root, String relativeDir) {
        Path current = root;
        for (int i = 0; i < Path.of(relativeDir).getNameCount() && current != null; i++) {
            current = current.getParent();
        }
        return current;
    }

    // ── FQN helpers ─────────────────────────────────────────────────────

    /**
     * Returns the package portion of a fully-qualified name.
     */
    public static String packageOf(String fqn) {
        int dot = fqn.lastIndexOf('.');
        return dot >= 0 ? fqn.substring(0, dot) : "";
    }

    // ── Internal helpers ────────────────────────────────────────────────

    /**
     * Walks the project tree and returns every directory that matches the
     * given relative suffix (e.g. {@code "src/test/java"}). Directories in
     * {@link #SKIP_DIRS} are pruned, and a matched source tree is not
     * descended into since its contents are packages, not modules.
     *
     * @param projectDir  the root project directory
     * @param relativeDir the directory suffix to look for
     * @return absolute paths that exist and match
     */
    public static List<Path> findAllMatchingDirs(Path projectDir, String relativeDir) {
        List<Path> matches = new ArrayList<>();
        Path root = projectDir.toAbsolutePath().normalize();

        Path rootMatch = root.resolve(relativeDir);
        if (Files.isDirectory(rootMatch)) {
            matches.add(rootMatch);
        }

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    String dirName = dir.getFileName() != null ? dir.getFileName().toString() : "";
                    if (SKIP_DIRS.contains(dirName)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (dir.equals(rootMatch)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    Path candidate = dir.resolve(relativeDir);
                    if (Files.isDirectory(candidate)) {
                        matches.add(candidate);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Error searching for '{}' under {}: {}", relativeDir, projectDir, e.getMessage());
        }

        log.debug("Found {} directories matching '{}' under {}", matches.size(), relativeDir, projectDir);
        return matches;
    }
}
