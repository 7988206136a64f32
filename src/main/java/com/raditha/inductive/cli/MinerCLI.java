package com.raditha.inductive.cli;

import com.raditha.inductive.config.MinerConfig;
import com.raditha.inductive.config.MinerSettings;
import com.raditha.inductive.engine.InductiveMiner;
import com.raditha.inductive.metrics.MiningReport;
import com.raditha.inductive.metrics.StatisticsExporter;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.VariantLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the Inductive Miner.
 * <p>
 * Usage:
 * java -jar inductive-miner.jar [options] &lt;trace-file&gt;
 * <p>
 * Configuration priority: CLI arguments > miner.yml > defaults
 */
@Command(name = "inductive-miner", mixinStandardHelpOptions = true, version = "Inductive Miner v1.0.0",
        description = "Discovers a process tree from a list of traces")
public class MinerCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(MinerCLI.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Trace file: one comma-separated trace per line", paramLabel = "<trace-file>")
    private Path traceFile;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--preset", description = "Configuration preset: default, relaxed, directly_follows", paramLabel = "<name>")
    private String preset;

    @Option(names = "--variant", description = "Miner variant: IM (variant log) or IMD (directly-follows graph)", paramLabel = "<variant>")
    private String variant;

    @Option(names = "--relaxed-sequence", description = "Use the relaxed sequence cut")
    private boolean relaxedSequence = false;

    @Option(names = "--disable-fall-throughs", description = "Use only the flower model when no cut applies")
    private boolean disableFallThroughs = false;

    @Option(names = "--parallelism", description = "Worker threads (default: 1)", paramLabel = "<n>")
    private int parallelism = 0; // 0 = use YAML/default

    @Option(names = "--json", description = "Print the tree as JSON")
    private boolean jsonOutput = false;

    @Option(names = "--stats", description = "Print how many base cases, cuts and fall-throughs were applied")
    private boolean printStats = false;

    @Option(names = "--export", description = "Export statistics (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    @Option(names = "--output", description = "Directory for exported statistics", paramLabel = "<path>")
    private Path outputPath;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        Map<String, Object> yaml = MinerSettings.readYaml(configFile);
        MinerConfig config = MinerSettings.loadConfig(yaml, preset, variant, relaxedSequence,
                disableFallThroughs, parallelism);

        VariantLog log = TraceFileReader.read(traceFile);
        logger.debug("Read {} traces ({} variants) from {}", log.totalTraces(), log.variants().size(), traceFile);

        MiningReport report = new InductiveMiner(config).mineWithReport(log);

        PrintWriter out = spec.commandLine().getOut();
        out.println(jsonOutput ? ProcessTreeJson.write(report.tree()) : report.tree().toString());
        if (printStats) {
            printStatistics(out, report);
        }
        if (exportFormat != null) {
            exportStatistics(out, report);
        }
        out.flush();
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the error handling used by {@link #main(String[])}.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new MinerCLI());

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
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (parallelism < 0) {
            throw new IllegalArgumentException("Parallelism must be positive, got: " + parallelism);
        }
        if (exportFormat != null) {
            String format = exportFormat.toLowerCase();
            if (!format.equals("csv") && !format.equals("json") && !format.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
        }
        if (configFile != null && !Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (outputPath != null && Files.exists(outputPath) && !Files.isDirectory(outputPath)) {
            throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
        }
    }

    private void printStatistics(PrintWriter out, MiningReport report) {
        out.println();
        out.printf("Activities: %d, tree nodes: %d, depth: %d, time: %d ms%n",
                report.alphabetSize(), report.tree().size(), report.maxDepth(), report.elapsed().toMillis());
        for (MiningStep step : MiningStep.values()) {
            int count = report.count(step);
            if (count > 0) {
                out.printf("  %-24s %d%n", step.displayName(), count);
            }
        }
    }

    private void exportStatistics(PrintWriter out, MiningReport report) throws IOException {
        StatisticsExporter exporter = new StatisticsExporter();
        Path outputDir = outputPath != null ? outputPath : Paths.get(".");
        Files.createDirectories(outputDir);
        String format = exportFormat.toLowerCase();

        if ("csv".equals(format) || "both".equals(format)) {
            Path csvPath = outputDir.resolve("mining-statistics.csv");
            exporter.exportToCsv(report, csvPath);
            out.println("Statistics exported to: " + csvPath.toAbsolutePath());
        }
        if ("json".equals(format) || "both".equals(format)) {
            Path jsonPath = outputDir.resolve("mining-statistics.json");
            exporter.exportToJson(report, jsonPath);
            out.println("Statistics exported to: " + jsonPath.toAbsolutePath());
        }
    }
}
