package io.smellscan;

import io.smellscan.ast.JsonAstProvider;
import io.smellscan.config.ConfigLayer;
import io.smellscan.config.ModuleConfig;
import io.smellscan.config.YamlConfigLoader;
import io.smellscan.engine.ExecutionOptions;
import io.smellscan.engine.ModuleAnalyzer;
import io.smellscan.engine.ModuleRequest;
import io.smellscan.model.AnalysisResult;
import io.smellscan.model.Severity;
import io.smellscan.report.ConsoleReporter;
import io.smellscan.report.FailurePolicy;
import io.smellscan.report.JsonReporter;
import io.smellscan.report.Reporter;
import io.smellscan.rules.RuleRegistry;
import io.smellscan.suppress.JsonBaselineStore;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * CLI entry point for the smell-scan tool.
 */
@Command(
        name = "smell-scan",
        mixinStandardHelpOptions = true,
        version = "smell-scan 1.0.0",
        description = "Runs code smell rules over parsed syntax trees (*.ast.json dumps) of one module.",
        footer = {
                "",
                "Examples:",
                "  smell-scan build/ast",
                "  smell-scan build/ast --config smellscan.yml --baseline baseline.json",
                "  smell-scan build/ast --baseline baseline.json --update-baseline",
                "  smell-scan build/ast --output-format json --output-file report.json --fail-on warning"
        }
)
public class SmellScanCli implements Callable<Integer> {

    static final String DEFAULT_CONFIG_RESOURCE = "/smellscan/default-config.yml";
    static final String PROJECT_CONFIG_FILE = "smellscan.yml";
    static final String COMMAND_LINE_LAYER = "command line";

    @Parameters(
            index = "0",
            description = "AST dump file, or directory searched recursively for *" + JsonAstProvider.DUMP_SUFFIX + " files"
    )
    private Path inputPath;

    @Option(
            names = {"-m", "--module"},
            description = "Module name used in the report (defaults to the input directory name)"
    )
    private String moduleName;

    @Option(
            names = {"-c", "--config"},
            description = "Configuration YAML file. Repeatable; later files override earlier ones. "
                    + "A " + PROJECT_CONFIG_FILE + " in the input directory is applied last."
    )
    private List<Path> configFiles;

    @Option(
            names = {"-b", "--baseline"},
            description = "Baseline file with accepted findings"
    )
    private Path baselineFile;

    @Option(
            names = {"--update-baseline"},
            description = "Rewrite the baseline with all current findings instead of filtering by it"
    )
    private boolean updateBaseline;

    @Option(
            names = {"--fail-fast"},
            description = "Stop starting new files after the first Error-or-worse finding or rule error; overrides build.failFast"
    )
    private boolean failFast;

    @Option(
            names = {"-w", "--workers"},
            description = "Number of worker threads (defaults to the number of processors)"
    )
    private Integer workers;

    @Option(
            names = {"-t", "--timeout"},
            description = "Time limit for the module, e.g. PT30S or 30s. Unfinished files are reported as incomplete."
    )
    private String timeout;

    @Option(
            names = {"--type-resolution"},
            description = "Whether the AST dumps carry resolved types. When false, rules that need them are disabled.",
            defaultValue = "true",
            negatable = true
    )
    private boolean typeResolution;

    @Option(
            names = {"--fail-on"},
            description = "Exit with code 2 if findings at this severity or higher: style, warning, error, defect, none",
            defaultValue = "error"
    )
    private String failOnLevel;

    @Option(
            names = {"--max-issues"},
            description = "Exit with code 2 if more findings are reported (overrides build.maxIssues)"
    )
    private Integer maxIssues;

    @Option(
            names = {"-o", "--output-format"},
            description = "Output format: console (default), json",
            defaultValue = "console"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-f", "--output-file"},
            description = "Output file path (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    public enum OutputFormat {
        console,
        json
    }

    @Override
    public Integer call() {
        try {
            if (!Files.exists(inputPath)) {
                System.err.println("Error: Input path does not exist: " + inputPath);
                return 1;
            }

            FailurePolicy policy = parseFailurePolicy();
            if (policy == null) return 1;

            Duration limit = null;
            if (timeout != null) {
                limit = parseTimeout(timeout);
                if (limit == null) return 1;
            }

            List<Path> files = collectFiles(inputPath);
            log("Found " + files.size() + " AST dump(s) in " + inputPath);
            if (files.isEmpty()) {
                System.err.println("Warning: No *" + JsonAstProvider.DUMP_SUFFIX + " files found in " + inputPath);
            }

            ModuleConfig config = loadConfig();

            ExecutionOptions.Builder options = ExecutionOptions.builder()
                    .timeout(limit)
                    .updateBaseline(updateBaseline)
                    .failurePolicy(policy);
            if (workers != null) {
                options.workerCount(workers);
            }

            ModuleRequest.Builder request = ModuleRequest.builder(resolveModuleName())
                    .files(files)
                    .config(config)
                    .options(options.build())
                    .typeResolutionAvailable(typeResolution);
            if (baselineFile != null) {
                log("Using baseline: " + baselineFile);
                request.baselineStore(new JsonBaselineStore(baselineFile));
            } else if (updateBaseline) {
                System.err.println("Error: --update-baseline requires --baseline");
                return 1;
            }

            log("Analyzing...");
            ModuleAnalyzer analyzer = new ModuleAnalyzer(RuleRegistry.createDefault(), new JsonAstProvider());
            AnalysisResult result = analyzer.analyze(request.build());
            log("  " + result.totalFindings() + " finding(s), " + result.diagnostics().size() + " diagnostic(s)");

            if (updateBaseline && outputFormat == OutputFormat.console) {
                if (result.baselineUpdate().isPresent()) {
                    System.out.println("Baseline written to: " + baselineFile);
                } else {
                    System.err.println("Warning: Baseline not updated because some files could not be fully analyzed");
                }
            }

            writeReport(result, createReporter());

            if (!result.passed()) {
                if (outputFormat == OutputFormat.console) {
                    System.err.println();
                    System.err.println("Failing due to findings that do not meet the failure policy.");
                }
                return 2;
            }
            return 0;

        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    private ModuleConfig loadConfig() throws IOException {
        List<ConfigLayer> layers = new ArrayList<>();
        layers.add(YamlConfigLoader.loadResource(DEFAULT_CONFIG_RESOURCE));

        if (configFiles != null) {
            for (Path configFile : configFiles) {
                log("Loading configuration from: " + configFile);
                layers.add(YamlConfigLoader.load(configFile));
            }
        }

        if (Files.isDirectory(inputPath)) {
            Path projectConfig = inputPath.resolve(PROJECT_CONFIG_FILE);
            if (Files.exists(projectConfig)) {
                log("Loading configuration from: " + projectConfig);
                layers.add(YamlConfigLoader.load(projectConfig));
            }
        }

        // The flag on the command line outranks build.failFast from any file
        if (failFast) {
            layers.add(ConfigLayer.builder(COMMAND_LINE_LAYER).failFast(true).build());
        }

        return new ModuleConfig(layers, false);
    }

    static List<Path> collectFiles(Path input) throws IOException {
        if (Files.isRegularFile(input)) {
            return List.of(input);
        }
        try (Stream<Path> walk = Files.walk(input)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(JsonAstProvider.DUMP_SUFFIX))
                    .sorted()
                    .toList();
        }
    }

    private String resolveModuleName() {
        if (moduleName != null && !moduleName.isBlank()) {
            return moduleName;
        }
        Path name = inputPath.toAbsolutePath().normalize().getFileName();
        return name != null ? name.toString() : "module";
    }

    private Reporter createReporter() {
        return switch (outputFormat) {
            case console -> new ConsoleReporter(!noColor && outputFile == null, verbose);
            case json -> new JsonReporter(true);
        };
    }

    private void writeReport(AnalysisResult result, Reporter reporter) throws IOException {
        if (outputFile != null) {
            reporter.write(result, outputFile);
            if (outputFormat == OutputFormat.console) {
                System.out.println("Report written to: " + outputFile);
            }
        } else {
            reporter.write(result, new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        }
    }

    private void log(String message) {
        if (verbose && outputFormat != OutputFormat.json) {
            System.out.println(message);
        }
    }

    private FailurePolicy parseFailurePolicy() {
        if (maxIssues != null && maxIssues < 0) {
            System.err.println("Error: Invalid value for --max-issues: " + maxIssues);
            return null;
        }
        int limit = maxIssues != null ? maxIssues : FailurePolicy.UNLIMITED;
        if ("none".equalsIgnoreCase(failOnLevel)) {
            return FailurePolicy.NEVER.withMaxIssues(limit);
        }
        try {
            return FailurePolicy.failOn(Severity.parse(failOnLevel)).withMaxIssues(limit);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: Invalid value for --fail-on: " + failOnLevel);
            System.err.println("Valid values: style, warning, error, defect, none");
            return null;
        }
    }

    /**
     * Accepts ISO-8601 durations (PT30S) and the short forms 500ms, 30s, 5m.
     */
    static Duration parseTimeout(String value) {
        String text = value.trim();
        try {
            if (text.toUpperCase(Locale.ROOT).startsWith("P")) {
                return Duration.parse(text);
            }
            if (text.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2)));
            }
            if (text.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(text.substring(0, text.length() - 1)));
            }
            if (text.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(text.substring(0, text.length() - 1)));
            }
            return Duration.ofSeconds(Long.parseLong(text));
        } catch (RuntimeException e) {
            System.err.println("Error: Invalid value for --timeout: " + value);
            return null;
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SmellScanCli()).execute(args);
        System.exit(exitCode);
    }
}
