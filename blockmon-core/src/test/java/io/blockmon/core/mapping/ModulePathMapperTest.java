package io.blockmon.core.mapping;

import io.blockmon.core.config.BlockmonConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ModulePathMapperTest {

    @TempDir
    Path tempDir;

    private final BlockmonConfig config = BlockmonConfig.builder().build();

    private ModulePathMapper mapper() {
        return new ModulePathMapper(tempDir, config);
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void mapsProductionAndTestFilesToClassNames() {
        ModulePathMapper mapper = mapper();

        assertEquals(Optional.of("com.example.service.FooBar"),
                mapper.toClassName("src/main/java/com/example/service/FooBar.java"));
        assertEquals(Optional.of("com.example.service.FooBarTest"),
                mapper.toClassName("src/test/java/com/example/service/FooBarTest.java"));
        assertTrue(mapper.isTestFile("src/test/java/com/example/service/FooBarTest.java"));
        assertFalse(mapper.isTestFile("src/main/java/com/example/service/FooBar.java"));
    }

    @Test
    void mapsMultiModulePaths() {
        ModulePathMapper mapper = mapper();

        assertEquals(Optional.of("com.example.api.UserDto"),
                mapper.toClassName("api/src/main/java/com/example/api/UserDto.java"));
        assertEquals(Optional.of("com.example.UserDtoTest"),
                mapper.toClassName("application/src/test/java/com/example/UserDtoTest.java"));
    }

    @Test
    void skipsNonSourceFilesAndPartialDirectoryNames() {
        ModulePathMapper mapper = mapper();

        assertTrue(mapper.toClassName("README.md").isEmpty());
        assertTrue(mapper.toClassName("src/main/resources/application.yml").isEmpty());
        assertTrue(mapper.toClassName("notsrc/main/java/com/example/Foo.java").isEmpty());
        assertTrue(mapper.toClassName("lib/Foo.java").isEmpty());
    }

    @Test
    void excludesGeneratedSources() {
        ModulePathMapper mapper = mapper();

        assertTrue(mapper.isExcluded("build/generated/sources/Foo.java"));
        assertFalse(mapper.isExcluded("src/main/java/com/example/Foo.java"));
    }

    @Test
    void resolvesClassesToSourceFiles() throws IOException {
        write("src/main/java/com/example/Foo.java", "package com.example; public class Foo {}");
        write("api/src/main/java/com/example/api/Dto.java", "package com.example.api; public class Dto {}");
        ModulePathMapper mapper = mapper();

        assertEquals(Optional.of("src/main/java/com/example/Foo.java"), mapper.resolveSourceFile("com.example.Foo"));
        assertEquals(Optional.of("api/src/main/java/com/example/api/Dto.java"),
                mapper.resolveSourceFile("com.example.api.Dto"));
        assertTrue(mapper.resolveSourceFile("com.example.Missing").isEmpty());
    }

    @Test
    void nestedClassesResolveToOuterFile() throws IOException {
        write("src/main/java/com/example/Outer.java", "package com.example; public class Outer { static class Inner {} }");
        ModulePathMapper mapper = mapper();

        assertEquals(Optional.of("src/main/java/com/example/Outer.java"),
                mapper.resolveSourceFile("com.example.Outer$Inner"));
        assertEquals(Optional.of("src/main/java/com/example/Outer.java"),
                mapper.resolveSourceFile("com.example.Outer.Inner"));
    }

    @Test
    void testRootsComeFirst() throws IOException {
        write("src/test/java/com/example/Helper.java", "package com.example; class Helper {}");
        write("src/main/java/com/example/Helper.java", "package com.example; class Helper {}");
        ModulePathMapper mapper = mapper();

        assertEquals(Optional.of("src/test/java/com/example/Helper.java"),
                mapper.resolveSourceFile("com.example.Helper"));
        assertEquals(2, mapper.roots().size());
    }

    @Test
    void honoursCustomDirectoriesAndExtensions() {
        BlockmonConfig custom = BlockmonConfig.builder()
                .sourceDirs(List.of("src/main/kotlin"))
                .sourceExtensions(List.of("kt"))
                .excludePaths(List.of())
                .build();
        ModulePathMapper mapper = new ModulePathMapper(tempDir, custom);

        assertEquals(Optional.of("com.example.Foo"), mapper.toClassName("src/main/kotlin/com/example/Foo.kt"));
        assertTrue(mapper.toClassName("src/main/java/com/example/Foo.java").isEmpty());
        assertFalse(mapper.isExcluded("build/generated/Foo.kt"));
    }
}
