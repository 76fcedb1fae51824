package io.blockmon.core.git;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectInserter;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Read-only view of the git repository enclosing the project, via JGit.
 *
 * <p>Content hashes are git blob ids, so a file's {@code fsha} equals what
 * {@code git hash-object} prints for it. The project does not have to be
 * inside a repository: without one, {@link #headCommit()} and
 * {@link #committedBlobSha(String)} return empty results.
 */
public final class GitRepository implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GitRepository.class);

    private final Path projectDir;
    private final Repository repository;
    private final Path workTree;
    private final ObjectId headTree;
    private final String headCommit;
    private final Cache<String, Optional<String>> committedShas;

    private GitRepository(Path projectDir, Repository repository, int cacheSize) {
        this.projectDir = projectDir.toAbsolutePath().normalize();
        this.repository = repository;
        this.committedShas = Caffeine.newBuilder().maximumSize(cacheSize).build();

        Path tree = null;
        ObjectId treeId = null;
        String commit = null;
        if (repository != null) {
            tree = repository.getWorkTree().toPath().toAbsolutePath().normalize();
            try {
                ObjectId headId = repository.resolve(Constants.HEAD);
                if (headId == null) {
                    log.warn("HEAD not found in {}; is this an empty repository?", tree);
                } else {
                    try (RevWalk walk = new RevWalk(repository)) {
                        RevCommit head = walk.parseCommit(headId);
                        treeId = head.getTree().getId();
                        commit = head.getName();
                    }
                }
            } catch (IOException e) {
                log.warn("Unable to resolve HEAD in {}: {}", tree, e.getMessage());
            }
        }
        this.workTree = tree;
        this.headTree = treeId;
        this.headCommit = commit;
    }

    /**
     * Opens the repository enclosing {@code projectDir}, if any.
     *
     * @param projectDir the project root
     * @param cacheSize  bound on cached committed blob ids
     */
    public static GitRepository open(Path projectDir, int cacheSize) {
        FileRepositoryBuilder builder = new FileRepositoryBuilder().findGitDir(projectDir.toFile());
        if (builder.getGitDir() == null) {
            log.info("No git repository found above {}; committed file hashes are unavailable", projectDir);
            return new GitRepository(projectDir, null, cacheSize);
        }
        try {
            return new GitRepository(projectDir, builder.build(), cacheSize);
        } catch (IOException e) {
            log.warn("Failed to open git repository for {}: {}", projectDir, e.getMessage());
            return new GitRepository(projectDir, null, cacheSize);
        }
    }

    public boolean isPresent() {
        return repository != null;
    }

    /** The HEAD commit id, or empty outside a repository or before the first commit. */
    public Optional<String> headCommit() {
        return Optional.ofNullable(headCommit);
    }

    /**
     * Blob id of {@code filename} as committed at HEAD.
     *
     * @param filename path relative to the project directory
     * @return the blob id, or empty when the file is not tracked at HEAD
     */
    public Optional<String> committedBlobSha(String filename) {
        if (headTree == null) {
            return Optional.empty();
        }
        return committedShas.get(filename, this::lookupCommitted);
    }

    private Optional<String> lookupCommitted(String filename) {
        Path absolute = projectDir.resolve(filename).normalize();
        if (!absolute.startsWith(workTree)) {
            return Optional.empty();
        }
        String repoPath = workTree.relativize(absolute).toString().replace('\\', '/');
        try (TreeWalk walk = TreeWalk.forPath(repository, repoPath, headTree)) {
            if (walk == null) {
                return Optional.empty();
            }
            return Optional.of(walk.getObjectId(0).getName());
        } catch (IOException e) {
            log.debug("Failed to look up {} at HEAD: {}", repoPath, e.getMessage());
            return Optional.empty();
        }
    }

    /** Git blob id of the given content. */
    public static String blobSha(byte[] content) {
        try (ObjectInserter.Formatter formatter = new ObjectInserter.Formatter()) {
            return formatter.idFor(Constants.OBJ_BLOB, content).getName();
        }
    }

    @Override
    public void close() {
        if (repository != null) {
            repository.close();
        }
    }
}
