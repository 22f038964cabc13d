package com.raditha.staleflag.cli;

import com.raditha.staleflag.config.CleanupConfig;
import com.raditha.staleflag.config.Settings;
import com.raditha.staleflag.config.StaleFlagSettings;
import com.raditha.staleflag.engine.CleanupEngine;
import com.raditha.staleflag.engine.CleanupReport;
import com.raditha.staleflag.model.CleanupError;
import com.raditha.staleflag.model.FlagSpec;
import com.raditha.staleflag.model.SourceUnit;
import com.raditha.staleflag.model.UnitResult;
import com.raditha.staleflag.rewrite.DiffGenerator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the stale flag cleaner.
 * <p>
 * Usage:
 * java -jar stale-flag-cleaner.jar --flag staleFlag --api experiments.isEnabled [options]
 * <p>
 * Configuration priority: CLI arguments > stale-flag.yml > defaults
 */
@Command(name = "stale-flag", mixinStandardHelpOptions = true, version = "Stale Flag Cleaner v1.0.0",
        description = "Removes dead code behind feature flags that are fixed to one outcome")
public class StaleFlagCLI implements Callable<Integer> {

    static final String VERSION = "1.0.0";

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--base-path", description = "Override project base path", paramLabel = "<path>")
    private String basePath;

    @Option(names = "--flag", description = "Flag identifier to clean (replaces the flags in the config file)",
            paramLabel = "<name>")
    private String flag;

    @Option(names = "--api", description = "Flag query call shape, e.g. experiments.isEnabled#0",
            paramLabel = "<pattern>")
    private String api;

    @Option(names = "--treatment", description = "Fixed outcome of the flag (default: true)", paramLabel = "<value>")
    private String treatment;

    @Option(names = "--treatment-kind", description = "boolean, string or enum (default: boolean)",
            paramLabel = "<kind>")
    private String treatmentKind;

    @Option(names = "--mode", description = "Cleanup mode: ${COMPLETION-CANDIDATES}", paramLabel = "<mode>",
            converter = CleanupModeConverter.class)
    private CleanupMode mode = CleanupMode.DRY_RUN;

    @Option(names = "--json", description = "Write a JSON report to this file", paramLabel = "<path>")
    private String jsonPath;

    @Option(names = "--max-hops", description = "Binding hops followed per flag argument (default: 8)",
            paramLabel = "<n>")
    private int maxHops = 0; // 0 = use YAML/default

    @Option(names = "--parallelism", description = "Worker threads (default: number of processors)",
            paramLabel = "<n>")
    private int parallelism = 0; // 0 = use YAML/default

    private PrintWriter out = new PrintWriter(System.out, true);

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        if (configFile != null) {
            Settings.loadConfigMap(new File(configFile));
        } else {
            Settings.loadConfigMap();
        }
        if (basePath != null) {
            Settings.setProperty(Settings.BASE_PATH, basePath);
        }

        CleanupConfig config = StaleFlagSettings.loadConfig(maxHops, parallelism);
        List<FlagSpec> flags = StaleFlagSettings.loadFlags(flag, api, treatment, treatmentKind);
        if (flags.isEmpty()) {
            throw new IllegalArgumentException("No flags given: use --flag/--api or a flags list in the config file");
        }

        Path root = Paths.get(Settings.getBasePath());
        List<SourceUnit> sources = new SourceCollector(config).collect(root);
        List<CleanupReport> reports = runAll(new CleanupEngine(config), sources, flags);

        if (mode == CleanupMode.APPLY) {
            writeChanges(reports);
        }
        if (jsonPath != null) {
            ReportWriter.write(reports, VERSION, Paths.get(jsonPath));
            out.println("Report written to: " + Paths.get(jsonPath).toAbsolutePath());
        }
        return 0;
    }

    /**
     * Clean each flag in turn, feeding the rewritten sources of one run into the next.
     */
    private List<CleanupReport> runAll(CleanupEngine engine, List<SourceUnit> sources, List<FlagSpec> flags)
            throws InterruptedException {
        List<CleanupReport> reports = new ArrayList<>();
        List<SourceUnit> current = sources;
        for (FlagSpec spec : flags) {
            CleanupReport report = engine.run(current, spec);
            reports.add(report);
            printReport(report);
            current = report.units().stream()
                    .map(u -> new SourceUnit(u.unitName(), u.path(), u.rewrittenSource()))
                    .toList();
        }
        return reports;
    }

    private void printReport(CleanupReport report) {
        out.println("=".repeat(80));
        out.println("FLAG " + report.flag());
        out.println("=".repeat(80));
        out.printf("Sites found: %d, rewritten: %d, files changed: %d%n",
                report.totalMatches(), report.totalRewritten(), report.changedUnits().size());
        if (!report.deletedConstants().isEmpty()) {
            out.println("Constants removed: " + String.join(", ", report.deletedConstants()));
        }

        DiffGenerator diffGenerator = new DiffGenerator();
        for (UnitResult unit : report.units()) {
            for (CleanupError error : unit.errors()) {
                out.printf("  ✗ %s: %s%n", unit.unitName(), error);
            }
            for (CleanupError unsupported : unit.unsupported()) {
                out.printf("  ⊘ %s: %s%n", unit.unitName(), unsupported);
            }
            if (mode == CleanupMode.DRY_RUN && unit.isChanged()) {
                out.println(diffGenerator.generateUnifiedDiff(
                        unit.unitName(), unit.originalSource(), unit.rewrittenSource()));
            }
        }
        out.println();
    }

    private void writeChanges(List<CleanupReport> reports) throws IOException {
        CleanupReport last = reports.get(reports.size() - 1);
        int written = 0;
        for (UnitResult unit : last.units()) {
            if (unit.path() == null) {
                continue;
            }
            String onDisk = Files.readString(unit.path(), StandardCharsets.UTF_8);
            if (!onDisk.equals(unit.rewrittenSource())) {
                Files.writeString(unit.path(), unit.rewrittenSource(), StandardCharsets.UTF_8);
                written++;
            }
        }
        out.printf("✓ %d files updated%n", written);
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (maxHops < 0) {
            throw new IllegalArgumentException("Max-hops must be positive, got: " + maxHops);
        }
        if (parallelism < 0) {
            throw new IllegalArgumentException("Parallelism must be positive, got: " + parallelism);
        }
        if (api != null && flag == null) {
            throw new IllegalArgumentException("--api needs --flag");
        }
        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (basePath != null && !new File(basePath).isDirectory()) {
            throw new IllegalArgumentException("Base path not found: " + basePath);
        }
    }

    void setOut(PrintWriter out) {
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(commandLine(new StaleFlagCLI()).execute(args));
    }

    /**
     * Command line with the exit code mapping: 2 for configuration errors, 3 for
     * I/O errors, 1 for anything else.
     */
    static CommandLine commandLine(StaleFlagCLI cli) {
        CommandLine cmd = new CommandLine(cli);

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    /**
     * Custom converter for CleanupMode enum to handle CLI string values.
     */
    public static class CleanupModeConverter implements ITypeConverter<CleanupMode> {
        @Override
        public CleanupMode convert(String value) throws Exception {
            return CleanupMode.fromString(value);
        }
    }
}
