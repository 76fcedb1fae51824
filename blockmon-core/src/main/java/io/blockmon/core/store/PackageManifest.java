package io.blockmon.core.store;

import java.io.File;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The set of installed external packages, serialized as
 * {@code "name version, name version"} sorted by name.
 *
 * <p>Patch versions are ignored when comparing manifests, so {@code guava 33.0.1}
 * and {@code guava 33.0.2} are the same package version.
 */
public final class PackageManifest {

    /** Sentinel package name: the runtime itself changed, so every test is affected. */
    public static final String RUNTIME_CHANGED = "__runtime_version_changed__";

    private static final Pattern PATCH_VERSION = Pattern.compile("\\b([\\w_-]+\\s\\d+\\.\\d+)\\.\\w+\\b");

    private static final Pattern JAR_NAME = Pattern.compile("^(.+?)-(\\d[\\w.\\-]*)\\.jar$");

    private PackageManifest() {
        // utility class
    }

    /**
     * Builds a manifest from a class path, taking every {@code name-version.jar}
     * entry. Directories and unversioned jars are skipped.
     */
    public static String fromClasspath(String classpath) {
        if (classpath == null || classpath.isBlank()) {
            return "";
        }
        Map<String, String> packages = new TreeMap<>();
        for (String entry : classpath.split(File.pathSeparator)) {
            if (entry.isBlank()) {
                continue;
            }
            Path fileName = Path.of(entry).getFileName();
            if (fileName == null) {
                continue;
            }
            artifactOf(fileName.toString()).ifPresent(a -> packages.put(a[0], a[1]));
        }
        return format(packages);
    }

    /**
     * Splits a jar file name into artifact name and version.
     *
     * @return {@code [name, version]}, or empty for names without a version
     */
    public static Optional<String[]> artifactOf(String jarFileName) {
        Matcher m = JAR_NAME.matcher(jarFileName);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new String[] {m.group(1), m.group(2)});
    }

    public static String format(Map<String, String> packages) {
        StringJoiner joiner = new StringJoiner(", ");
        new TreeMap<>(packages).forEach((name, version) -> joiner.add(name + " " + version));
        return joiner.toString();
    }

    public static Map<String, String> parse(String manifest) {
        Map<String, String> packages = new TreeMap<>();
        if (manifest == null || manifest.isBlank()) {
            return packages;
        }
        for (String item : manifest.split(",")) {
            String trimmed = item.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int space = trimmed.indexOf(' ');
            if (space < 0) {
                packages.put(trimmed, "");
            } else {
                packages.put(trimmed.substring(0, space), trimmed.substring(space + 1).trim());
            }
        }
        return packages;
    }

    /** {@code "name 1.2.3"} becomes {@code "name 1.2"}; other text is left alone. */
    public static String dropPatchVersion(String manifest) {
        return PATCH_VERSION.matcher(manifest).replaceAll("$1");
    }

    /**
     * Names of packages added, removed or whose major.minor version changed
     * between two manifests.
     */
    public static Set<String> computeChanges(String oldManifest, String newManifest) {
        Map<String, String> before = parse(dropPatchVersion(Objects.requireNonNullElse(oldManifest, "")));
        Map<String, String> after = parse(dropPatchVersion(Objects.requireNonNullElse(newManifest, "")));

        Set<String> changed = new TreeSet<>();
        for (Map.Entry<String, String> e : after.entrySet()) {
            String previous = before.get(e.getKey());
            if (previous == null || !previous.equals(e.getValue())) {
                changed.add(e.getKey());
            }
        }
        for (String name : before.keySet()) {
            if (!after.containsKey(name)) {
                changed.add(name);
            }
        }
        return changed;
    }
}
