package io.blockmon.core.recorder;

import java.nio.file.Path;

/**
 * Callbacks the test harness makes while a test runs. Both are called
 * synchronously on the thread doing the access.
 */
public interface ResourceAccessObserver {

    /** A file is about to be opened for reading. */
    void beforeFileRead(Path file);

    /** A class was loaded and initialized. */
    void onModuleLoad(String className);
}
