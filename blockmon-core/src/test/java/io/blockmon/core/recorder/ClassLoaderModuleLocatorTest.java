package io.blockmon.core.recorder;

import io.blockmon.core.config.BlockmonConfig;
import io.blockmon.core.mapping.ModulePathMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class ClassLoaderModuleLocatorTest {

    @TempDir
    Path tempDir;

    private ModulePathMapper mapper() {
        return new ModulePathMapper(tempDir, BlockmonConfig.builder().build());
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private Path jar(String relative, String entry) throws IOException {
        Path jar = tempDir.resolve(relative);
        Files.createDirectories(jar.getParent());
        try (OutputStream out = Files.newOutputStream(jar); JarOutputStream jos = new JarOutputStream(out)) {
            jos.putNextEntry(new JarEntry(entry));
            jos.write(new byte[]{(byte) 0xCA, (byte) 0xFE});
            jos.closeEntry();
        }
        return jar;
    }

    @Test
    void jdkClassesArePlatform() {
        ClassLoaderModuleLocator locator = new ClassLoaderModuleLocator(getClass().getClassLoader(), mapper());

        assertEquals(ModuleOrigin.Kind.PLATFORM, locator.locate("java.lang.String").kind());
        assertEquals(ModuleOrigin.Kind.PLATFORM, locator.locate("javax.net.ssl.SSLContext").kind());
    }

    @Test
    void classesFromOutputDirectoryMapToSourceFiles() throws Exception {
        write("target/classes/com/example/Foo.class", "");
        write("src/main/java/com/example/Foo.java", "package com.example; public class Foo {}");
        URL classes = tempDir.resolve("target/classes").toUri().toURL();

        try (URLClassLoader loader = new URLClassLoader(new URL[]{classes}, null)) {
            ModuleOrigin origin = new ClassLoaderModuleLocator(loader, mapper()).locate("com.example.Foo");

            assertEquals(ModuleOrigin.Kind.LOCAL, origin.kind());
            assertEquals("src/main/java/com/example/Foo.java", origin.sourceFile());
        }
    }

    @Test
    void classesFromJarsAreExternalArtifacts() throws Exception {
        Path jar = jar("lib/acme-util-1.2.0.jar", "com/acme/Util.class");

        try (URLClassLoader loader = new URLClassLoader(new URL[]{jar.toUri().toURL()}, null)) {
            ModuleOrigin origin = new ClassLoaderModuleLocator(loader, mapper()).locate("com.acme.Util");

            assertEquals(ModuleOrigin.Kind.EXTERNAL, origin.kind());
            assertEquals("acme-util", origin.artifact());
        }
    }

    @Test
    void classWithoutResourceFallsBackToSourceLookup() throws Exception {
        write("src/main/java/com/example/Bar.java", "package com.example; public class Bar {}");

        try (URLClassLoader loader = new URLClassLoader(new URL[0], null)) {
            ClassLoaderModuleLocator locator = new ClassLoaderModuleLocator(loader, mapper());

            assertEquals(ModuleOrigin.Kind.LOCAL, locator.locate("com.example.Bar").kind());
            assertEquals(ModuleOrigin.Kind.UNKNOWN, locator.locate("com.example.Nowhere").kind());
        }
    }

    @Test
    void jarArtifactNames() throws Exception {
        assertEquals(Optional.of("guava"), ClassLoaderModuleLocator.jarArtifact(
                new URL("jar:file:/repo/guava-33.0.0-jre.jar!/com/google/common/base/Strings.class")));
        assertEquals(Optional.of("tools"), ClassLoaderModuleLocator.jarArtifact(
                new URL("jar:file:/opt/jdk/lib/tools.jar!/com/sun/Tool.class")));
        assertEquals(Optional.of("my lib"), ClassLoaderModuleLocator.jarArtifact(
                new URL("jar:file:/libs/my%20lib.jar!/a/B.class")));
    }
}
