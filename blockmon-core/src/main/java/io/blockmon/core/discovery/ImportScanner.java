package io.blockmon.core.discovery;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import io.blockmon.core.config.BlockmonConfig;
import io.blockmon.core.mapping.ModulePathMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Finds the files a source file depends on at load time by scanning its
 * imports and type references.
 *
 * <p>Loading a class runs the static initialization of every class it
 * references, so those files' module blocks are dependencies of any test that
 * loads it. References are resolved in three tiers:
 * <ol>
 *   <li><strong>Imports:</strong> single-type and static imports name the
 *       class directly.</li>
 *   <li><strong>Wildcard imports:</strong> a simple type name used in the file
 *       is tried against every imported package.</li>
 *   <li><strong>Same package:</strong> a simple type name is tried against
 *       the file's own package.</li>
 * </ol>
 * Names that resolve to a project source file are local; explicitly imported
 * names that do not are external classes.
 *
 * <p>{@link #scan(String)} follows local files transitively up to
 * {@code importDepth} further levels.
 */
public final class ImportScanner {

    private static final Logger log = LoggerFactory.getLogger(ImportScanner.class);

    /**
     * Files and classes a source file depends on.
     *
     * @param localFiles      project-relative source files
     * @param externalClasses imported class names with no source in the project
     */
    public record ImportedFiles(Set<String> localFiles, Set<String> externalClasses) {

        public static final ImportedFiles NONE = new ImportedFiles(Set.of(), Set.of());

        public ImportedFiles {
            localFiles = Set.copyOf(localFiles);
            externalClasses = Set.copyOf(externalClasses);
        }
    }

    private final Path projectDir;
    private final BlockmonConfig config;
    private final ModulePathMapper mapper;
    private final JavaParser parser;
    private final Cache<String, ImportedFiles> direct;

    public ImportScanner(Path projectDir, BlockmonConfig config, ModulePathMapper mapper) {
        this.projectDir = projectDir.toAbsolutePath().normalize();
        this.config = config;
        this.mapper = mapper;
        this.parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.BLEEDING_EDGE));
        this.direct = Caffeine.newBuilder().maximumSize(config.cacheSize()).build();
    }

    /**
     * Dependencies of {@code filename}, following local files
     * {@code importDepth} levels beyond its direct imports. The file itself is
     * never part of the result.
     */
    public ImportedFiles scan(String filename) {
        Set<String> local = new TreeSet<>();
        Set<String> external = new TreeSet<>();
        Set<String> visited = new HashSet<>(Set.of(filename));
        Set<String> currentLevel = Set.of(filename);

        for (int depth = 0; depth <= config.importDepth() && !currentLevel.isEmpty(); depth++) {
            Set<String> nextLevel = new LinkedHashSet<>();
            for (String file : currentLevel) {
                ImportedFiles imports = scanDirect(file);
                external.addAll(imports.externalClasses());
                for (String dep : imports.localFiles()) {
                    if (visited.add(dep)) {
                        local.add(dep);
                        nextLevel.add(dep);
                    }
                }
            }
            currentLevel = nextLevel;
        }
        return new ImportedFiles(local, external);
    }

    /** Direct dependencies of one file, cached for the session. */
    public ImportedFiles scanDirect(String filename) {
        if (!config.isSourceFile(filename)) {
            return ImportedFiles.NONE;
        }
        return direct.get(filename, this::parseImports);
    }

    private ImportedFiles parseImports(String filename) {
        Path file = projectDir.resolve(filename);
        if (!Files.isRegularFile(file)) {
            return ImportedFiles.NONE;
        }
        CompilationUnit cu;
        try {
            ParseResult<CompilationUnit> result = parser.parse(file);
            if (!result.isSuccessful() || result.getResult().isEmpty()) {
                log.debug("Failed to parse {} for imports", filename);
                return ImportedFiles.NONE;
            }
            cu = result.getResult().get();
        } catch (IOException | RuntimeException e) {
            log.debug("Error reading imports of {}: {}", filename, e.getMessage());
            return ImportedFiles.NONE;
        }

        Set<String> local = new TreeSet<>();
        Set<String> external = new TreeSet<>();
        Set<String> wildcardPackages = new LinkedHashSet<>();

        // --- Tier 1: explicit imports ---
        for (ImportDeclaration imp : cu.getImports()) {
            String name = imp.getNameAsString();
            if (imp.isAsterisk() && !imp.isStatic()) {
                wildcardPackages.add(name);
                continue;
            }
            // import static a.b.C.member -> a.b.C; import static a.b.C.* -> a.b.C
            String className = imp.isStatic() && !imp.isAsterisk() ? SourceFileScanner.packageOf(name) : name;
            Optional<String> source = mapper.resolveSourceFile(className);
            if (source.isPresent()) {
                local.add(source.get());
            } else {
                external.add(className);
            }
        }

        // --- Tiers 2 and 3: simple names via wildcard imports or the own package ---
        String ownPackage = cu.getPackageDeclaration().map(pd -> pd.getNameAsString()).orElse("");
        List<String> packages = new ArrayList<>();
        packages.add(ownPackage);
        packages.addAll(wildcardPackages);
        for (String simpleName : referencedSimpleNames(cu)) {
            for (String pkg : packages) {
                String candidate = pkg.isEmpty() ? simpleName : pkg + "." + simpleName;
                Optional<String> source = mapper.resolveSourceFile(candidate);
                if (source.isPresent()) {
                    local.add(source.get());
                    break;
                }
            }
        }

        local.remove(filename);
        local.removeIf(mapper::isExcluded);
        log.debug("{} depends on {} local files and {} external classes", filename, local.size(), external.size());
        return new ImportedFiles(local, external);
    }

    /**
     * Simple names used as types, plus capitalized names used as expression
     * scopes ({@code Foo.bar()}), which are usually class references.
     */
    private static Set<String> referencedSimpleNames(CompilationUnit cu) {
        Set<String> names = new TreeSet<>();
        for (ClassOrInterfaceType type : cu.findAll(ClassOrInterfaceType.class)) {
            if (type.getScope().isEmpty()) {
                names.add(type.getNameAsString());
            }
        }
        for (NameExpr expr : cu.findAll(NameExpr.class)) {
            String name = expr.getNameAsString();
            if (!name.isEmpty() && Character.isUpperCase(name.charAt(0))) {
                names.add(name);
            }
        }
        return names;
    }
}
