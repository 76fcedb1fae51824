package io.blockmon.core.recorder;

import io.blockmon.core.mapping.ModulePathMapper;
import io.blockmon.core.store.PackageManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * {@link ModuleLocator} that asks a class loader where a class file lives:
 * {@code jrt:} URLs are platform classes, {@code jar:} URLs are attributed to
 * the jar's artifact name, and classes from a directory are mapped back to
 * their project source file.
 */
public final class ClassLoaderModuleLocator implements ModuleLocator {

    private static final Logger log = LoggerFactory.getLogger(ClassLoaderModuleLocator.class);

    private final ClassLoader classLoader;
    private final ModulePathMapper mapper;

    public ClassLoaderModuleLocator(ClassLoader classLoader, ModulePathMapper mapper) {
        this.classLoader = classLoader;
        this.mapper = mapper;
    }

    @Override
    public ModuleOrigin locate(String className) {
        if (isPlatformName(className)) {
            return ModuleOrigin.platform(className);
        }
        URL url = classLoader.getResource(className.replace('.', '/') + ".class");
        if (url == null) {
            return mapper.resolveSourceFile(className)
                    .map(file -> ModuleOrigin.local(className, file))
                    .orElseGet(() -> ModuleOrigin.unknown(className));
        }
        return switch (url.getProtocol()) {
            case "jrt" -> ModuleOrigin.platform(className);
            case "jar" -> jarArtifact(url)
                    .map(artifact -> ModuleOrigin.external(className, artifact))
                    .orElseGet(() -> ModuleOrigin.unknown(className));
            case "file" -> mapper.resolveSourceFile(className)
                    .map(file -> ModuleOrigin.local(className, file))
                    .orElseGet(() -> ModuleOrigin.unknown(className));
            default -> {
                log.debug("Unrecognized class location for {}: {}", className, url);
                yield ModuleOrigin.unknown(className);
            }
        };
    }

    private static boolean isPlatformName(String className) {
        return className.startsWith("java.") || className.startsWith("javax.")
                || className.startsWith("jdk.") || className.startsWith("sun.");
    }

    /**
     * {@code jar:file:/repo/guava-33.0.0-jre.jar!/com/google/...} gives {@code guava};
     * an unversioned jar gives its file name without {@code .jar}.
     */
    static Optional<String> jarArtifact(URL url) {
        String path = url.getPath();
        int bang = path.indexOf("!/");
        String jarPath = bang >= 0 ? path.substring(0, bang) : path;
        jarPath = URLDecoder.decode(jarPath, StandardCharsets.UTF_8);
        int slash = jarPath.lastIndexOf('/');
        String jarName = slash >= 0 ? jarPath.substring(slash + 1) : jarPath;
        if (!jarName.endsWith(".jar")) {
            return Optional.empty();
        }
        return Optional.of(PackageManifest.artifactOf(jarName)
                .map(parts -> parts[0])
                .orElse(jarName.substring(0, jarName.length() - ".jar".length())));
    }
}
