package io.blockmon.core.recorder;

/**
 * Resolves a loaded class to its {@link ModuleOrigin}.
 */
@FunctionalInterface
public interface ModuleLocator {

    ModuleOrigin locate(String className);
}
