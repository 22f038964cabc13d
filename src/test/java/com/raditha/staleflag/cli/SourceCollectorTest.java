package com.raditha.staleflag.cli;

import com.raditha.staleflag.config.CleanupConfig;
import com.raditha.staleflag.model.SourceUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SourceCollector.
 */
class SourceCollectorTest {

    @TempDir
    Path root;

    @Test
    void testCollectsJavaFilesOutsideExcludedDirectories() throws Exception {
        write("com/acme/Service.java", "class Service {}");
        write("com/acme/Flags.java", "class Flags {}");
        write("com/acme/notes.txt", "not java");
        write("generated/com/acme/Stub.java", "class Stub {}");
        write("target/classes/Copy.java", "class Copy {}");

        List<SourceUnit> units = new SourceCollector(CleanupConfig.defaults()).collect(root);

        assertEquals(List.of("com/acme/Flags.java", "com/acme/Service.java"),
                units.stream().map(SourceUnit::name).toList());
        assertEquals("class Service {}", units.get(1).source());
        assertEquals(root.resolve("com/acme/Service.java"), units.get(1).path());
    }

    @Test
    void testNoExcludes() throws Exception {
        write("generated/Stub.java", "class Stub {}");

        List<SourceUnit> units = new SourceCollector(new CleanupConfig(8, 256, 1, false, List.of())).collect(root);

        assertEquals(1, units.size());
        assertEquals("generated/Stub.java", units.get(0).name());
    }

    private void write(String relative, String content) throws Exception {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
