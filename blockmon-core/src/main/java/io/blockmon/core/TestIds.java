package io.blockmon.core;

import java.util.Optional;

/**
 * Test identifiers of the form {@code file[::class]::name}, for example
 * {@code src/test/java/com/example/FooTest.java::FooTest::addsNumbers}.
 */
public final class TestIds {

    public static final String SEPARATOR = "::";

    private TestIds() {
        // utility class
    }

    public static String of(String file, String className, String name) {
        if (className == null || className.isEmpty()) {
            return file + SEPARATOR + name;
        }
        return file + SEPARATOR + className + SEPARATOR + name;
    }

    /** The file the test is declared in: everything before the first separator. */
    public static String homeFile(String testId) {
        int idx = testId.indexOf(SEPARATOR);
        return idx >= 0 ? testId.substring(0, idx) : testId;
    }

    /** The class part, when the id has three parts. */
    public static Optional<String> className(String testId) {
        String[] parts = testId.split(SEPARATOR, -1);
        return parts.length >= 3 ? Optional.of(parts[1]) : Optional.empty();
    }

    /** The last part of the id. */
    public static String name(String testId) {
        int idx = testId.lastIndexOf(SEPARATOR);
        return idx >= 0 ? testId.substring(idx + SEPARATOR.length()) : testId;
    }
}
