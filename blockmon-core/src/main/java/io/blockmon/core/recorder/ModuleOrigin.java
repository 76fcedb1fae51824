package io.blockmon.core.recorder;

/**
 * Where a loaded class comes from.
 *
 * @param kind       origin category
 * @param className  binary class name
 * @param artifact   owning artifact name for {@link Kind#EXTERNAL}, else null
 * @param sourceFile project-relative source file for {@link Kind#LOCAL}, else null
 */
public record ModuleOrigin(Kind kind, String className, String artifact, String sourceFile) {

    public enum Kind {
        /** Compiled from a source file of the project. */
        LOCAL,
        /** Packaged in a third-party jar. */
        EXTERNAL,
        /** Part of the JDK. */
        PLATFORM,
        UNKNOWN
    }

    public static ModuleOrigin local(String className, String sourceFile) {
        return new ModuleOrigin(Kind.LOCAL, className, null, sourceFile);
    }

    public static ModuleOrigin external(String className, String artifact) {
        return new ModuleOrigin(Kind.EXTERNAL, className, artifact, null);
    }

    public static ModuleOrigin platform(String className) {
        return new ModuleOrigin(Kind.PLATFORM, className, null, null);
    }

    public static ModuleOrigin unknown(String className) {
        return new ModuleOrigin(Kind.UNKNOWN, className, null, null);
    }
}
