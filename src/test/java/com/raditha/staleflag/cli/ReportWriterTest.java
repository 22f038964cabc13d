package com.raditha.staleflag.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.staleflag.config.CleanupConfig;
import com.raditha.staleflag.engine.CleanupEngine;
import com.raditha.staleflag.engine.CleanupReport;
import com.raditha.staleflag.model.FlagSpec;
import com.raditha.staleflag.model.SourceUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReportWriter.
 */
class ReportWriterTest {

    private static final String DEMO = """
            class Demo {
                private Experiments exp;

                void run() {
                    if (exp.boolValue("staleFlag")) {
                        on();
                    }
                }

                void on() {
                }
            }
            """;

    private CleanupReport report;

    @BeforeEach
    void runEngine() throws Exception {
        CleanupEngine engine = new CleanupEngine(new CleanupConfig(8, 256, 1, false, List.of()));
        report = engine.run(List.of(
                SourceUnit.of("Demo.java", DEMO),
                SourceUnit.of("Untouched.java", "class Untouched {}"),
                SourceUnit.of("Broken.java", "class Broken {")), FlagSpec.of("staleFlag", "exp.boolValue", true));
    }

    @Test
    void testDtoListsOnlyInterestingUnits() {
        ReportWriter.RunDTO run = ReportWriter.toDTO(List.of(report), "1.0.0");

        assertEquals("1.0.0", run.version());
        assertNotNull(run.generatedAt());
        ReportWriter.FlagDTO flag = run.flags().get(0);
        assertEquals("staleFlag", flag.flag());
        assertEquals("exp.boolValue#0", flag.api());
        assertEquals("true", flag.treatment());
        assertEquals(1, flag.matches());
        assertEquals(1, flag.rewritten());
        assertEquals(List.of("Demo.java", "Broken.java"),
                flag.units().stream().map(ReportWriter.UnitDTO::name).toList());

        ReportWriter.UnitDTO broken = flag.units().get(1);
        assertTrue(broken.skipped());
        assertEquals("PARSE_FAILURE", broken.errors().get(0).kind());
    }

    @Test
    void testWriteJson(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("reports/cleanup.json");

        ReportWriter.write(List.of(report), "1.0.0", file);

        JsonNode json = new ObjectMapper().readTree(Files.readString(file));
        assertEquals("1.0.0", json.get("version").asText());
        assertTrue(json.get("generatedAt").isTextual());
        JsonNode flag = json.get("flags").get(0);
        assertEquals("staleFlag", flag.get("flag").asText());
        assertEquals("Demo.java", flag.get("units").get(0).get("name").asText());
        assertTrue(flag.get("units").get(0).get("edits").asInt() > 0);
    }

    @Test
    void testToJsonMatchesWrittenShape() throws Exception {
        JsonNode json = new ObjectMapper().readTree(ReportWriter.toJson(List.of(report), "2.0"));

        assertEquals("2.0", json.get("version").asText());
        assertEquals(1, json.get("flags").size());
        assertTrue(json.get("flags").get(0).get("deletedConstants").isArray());
    }
}
