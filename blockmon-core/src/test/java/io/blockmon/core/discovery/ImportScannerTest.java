package io.blockmon.core.discovery;

import io.blockmon.core.config.BlockmonConfig;
import io.blockmon.core.discovery.ImportScanner.ImportedFiles;
import io.blockmon.core.mapping.ModulePathMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ImportScannerTest {

    private static final String TEST_FILE = "src/test/java/com/example/OrderServiceTest.java";

    @TempDir
    Path tempDir;

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private ImportScanner scanner(int importDepth) {
        BlockmonConfig config = BlockmonConfig.builder().importDepth(importDepth).build();
        return new ImportScanner(tempDir, config, new ModulePathMapper(tempDir, config));
    }

    @BeforeEach
    void createProject() throws IOException {
        write(TEST_FILE, """
                package com.example;

                import com.example.service.OrderService;
                import com.example.model.*;
                import com.example.generated.Gen;
                import org.junit.jupiter.api.Test;
                import static com.example.util.Strings.join;
                import static org.junit.jupiter.api.Assertions.assertEquals;

                class OrderServiceTest {
                    @Test
                    void totals() {
                        Item item = new Item();
                        assertEquals(join("a"), Money.format(new OrderService().total(item)));
                        Gen.touch();
                    }
                }
                """);
        write("src/main/java/com/example/service/OrderService.java", """
                package com.example.service;

                import com.example.repo.OrderRepository;

                public class OrderService {
                    private final OrderRepository repo = new OrderRepository();
                    public int total(Object item) { return 1; }
                }
                """);
        write("src/main/java/com/example/repo/OrderRepository.java", """
                package com.example.repo;

                import com.example.db.Db;

                public class OrderRepository {
                    static { Db.connect(); }
                }
                """);
        write("src/main/java/com/example/db/Db.java",
                "package com.example.db;\npublic class Db { public static void connect() {} }\n");
        write("src/main/java/com/example/model/Item.java",
                "package com.example.model;\npublic class Item {}\n");
        write("src/main/java/com/example/Money.java",
                "package com.example;\npublic class Money { public static String format(int v) { return \"\"; } }\n");
        write("src/main/java/com/example/util/Strings.java",
                "package com.example.util;\npublic class Strings { public static String join(String s) { return s; } }\n");
        write("src/main/java/com/example/generated/Gen.java",
                "package com.example.generated;\npublic class Gen { public static void touch() {} }\n");
    }

    @Test
    void resolvesAllThreeTiers() {
        ImportedFiles direct = scanner(1).scanDirect(TEST_FILE);

        assertEquals(Set.of(
                "src/main/java/com/example/service/OrderService.java",
                "src/main/java/com/example/util/Strings.java",
                "src/main/java/com/example/model/Item.java",
                "src/main/java/com/example/Money.java"), direct.localFiles());
    }

    @Test
    void unresolvedImportsAreExternalClasses() {
        ImportedFiles direct = scanner(1).scanDirect(TEST_FILE);

        assertEquals(Set.of("org.junit.jupiter.api.Test", "org.junit.jupiter.api.Assertions"),
                direct.externalClasses());
    }

    @Test
    void followsLocalFilesToConfiguredDepth() {
        assertFalse(scanner(0).scan(TEST_FILE).localFiles()
                .contains("src/main/java/com/example/repo/OrderRepository.java"));

        Set<String> depthOne = scanner(1).scan(TEST_FILE).localFiles();
        assertTrue(depthOne.contains("src/main/java/com/example/repo/OrderRepository.java"));
        assertFalse(depthOne.contains("src/main/java/com/example/db/Db.java"));

        assertTrue(scanner(2).scan(TEST_FILE).localFiles().contains("src/main/java/com/example/db/Db.java"));
    }

    @Test
    void neverIncludesTheScannedFileOrExcludedFiles() {
        Set<String> local = scanner(3).scan(TEST_FILE).localFiles();

        assertFalse(local.contains(TEST_FILE));
        assertFalse(local.contains("src/main/java/com/example/generated/Gen.java"));
    }

    @Test
    void nonSourceAndBrokenFilesHaveNoImports() throws IOException {
        write("src/main/java/com/example/Broken.java", "package com.example; class Broken {");
        ImportScanner scanner = scanner(1);

        assertSame(ImportedFiles.NONE, scanner.scanDirect("src/main/resources/app.yml"));
        assertSame(ImportedFiles.NONE, scanner.scanDirect("src/main/java/com/example/Broken.java"));
        assertSame(ImportedFiles.NONE, scanner.scanDirect("src/main/java/com/example/Missing.java"));
    }
}
