package com.raditha.staleflag.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.staleflag.engine.CleanupReport;
import com.raditha.staleflag.model.CleanupError;
import com.raditha.staleflag.model.UnitResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Writes cleanup reports as JSON. DTOs keep AST nodes out of the output.
 */
public class ReportWriter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public record RunDTO(String version, Instant generatedAt, List<FlagDTO> flags) {}

    public record FlagDTO(
            String flag,
            String api,
            String treatment,
            Instant startedAt,
            long elapsedMillis,
            int matches,
            int rewritten,
            List<String> deletedConstants,
            List<UnitDTO> units) {}

    public record UnitDTO(
            String name,
            int matches,
            int rewritten,
            int edits,
            boolean skipped,
            List<ErrorDTO> unsupported,
            List<ErrorDTO> errors) {}

    public record ErrorDTO(String kind, String message, Integer line) {}

    public static void write(List<CleanupReport> reports, String version, Path filePath) throws IOException {
        Path parent = filePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(filePath.toFile(), toDTO(reports, version));
    }

    public static String toJson(List<CleanupReport> reports, String version) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDTO(reports, version));
    }

    static RunDTO toDTO(List<CleanupReport> reports, String version) {
        return new RunDTO(version, Instant.now(), reports.stream().map(ReportWriter::toFlagDTO).toList());
    }

    private static FlagDTO toFlagDTO(CleanupReport report) {
        return new FlagDTO(
                report.flag().flagName(),
                report.flag().api().toString(),
                report.flag().treatment().toString(),
                report.startedAt(),
                report.elapsed().toMillis(),
                report.totalMatches(),
                report.totalRewritten(),
                report.deletedConstants(),
                report.units().stream()
                        .filter(u -> u.matchCount() > 0 || u.isChanged() || !u.errors().isEmpty())
                        .map(ReportWriter::toUnitDTO)
                        .toList());
    }

    private static UnitDTO toUnitDTO(UnitResult unit) {
        return new UnitDTO(
                unit.unitName(),
                unit.matchCount(),
                unit.rewrittenCount(),
                unit.edits().size(),
                unit.isSkipped(),
                unit.unsupported().stream().map(ReportWriter::toErrorDTO).toList(),
                unit.errors().stream().map(ReportWriter::toErrorDTO).toList());
    }

    private static ErrorDTO toErrorDTO(CleanupError error) {
        Integer line = error.location() == null ? null : error.location().startLine();
        return new ErrorDTO(error.kind().name(), error.message(), line);
    }
}
