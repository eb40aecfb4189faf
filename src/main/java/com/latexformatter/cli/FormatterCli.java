package com.latexformatter.cli;

import com.latexformatter.api.FormatMode;
import com.latexformatter.api.FormattingChange;
import com.latexformatter.api.error.ConfigException;
import com.latexformatter.api.error.Diagnostic;
import com.latexformatter.api.error.DiagnosticKind;
import com.latexformatter.api.error.Severity;
import com.latexformatter.config.ConfigurationLoader;
import com.latexformatter.config.FormatterConfig;
import com.latexformatter.core.BatchResult;
import com.latexformatter.core.BatchRunner;
import com.latexformatter.core.DocumentOutcome;
import com.latexformatter.core.LatexDocument;
import com.latexformatter.core.LatexFormatterEngine;
import com.latexformatter.passes.PassId;
import com.latexformatter.patterns.PatternCategory;
import com.latexformatter.patterns.PatternStore;
import com.latexformatter.util.DiagnosticFormatter;
import com.latexformatter.util.LoggerUtil;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Command Line Interface for the LaTeX formatter
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    private static final String CONFIG_FILE_NAME = ".latexformatter.yml";
    private static final String DEFAULT_PATTERN_DIR = "patterns";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private DiagnosticFormatter diagnosticFormatter = new DiagnosticFormatter(false);

    public FormatterCli(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new FormatterCli(System.out).run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns the process exit code: 0 on success, 1 when
     * documents need formatting or failed, 2 for usage and configuration errors.
     */
    public int run(String[] args) {
        if (args.length < 1) {
            _printUsage();
            return EXIT_USAGE;
        }

        // Check for color disabling early
        boolean useColors = !_hasOption(args, "--no-color") && System.console() != null;
        diagnosticFormatter = new DiagnosticFormatter(useColors);

        // Configure logging level based on verbose flag
        LoggerUtil.setConsoleLevel(_hasOption(args, "--verbose") ? Level.FINE : Level.WARNING);

        String logFile = _getOptionValue(args, "--log-file");
        if (logFile != null) {
            try {
                LoggerUtil.setLogFile(Paths.get(logFile));
            } catch (IOException | InvalidPathException e) {
                _printError("Error: Cannot open log file: " + logFile);
                return EXIT_USAGE;
            }
        }

        String command = args[0];
        try {
            return switch (command) {
                case "format" -> _formatFiles(args);
                case "check-syntax" -> _checkSyntax(args);
                case "init" -> _initializeConfig(args);
                case "patterns" -> _managePatterns(args);
                case "--version", "-v" -> {
                    _printVersion();
                    yield EXIT_OK;
                }
                case "--help", "-h" -> {
                    _printUsage();
                    yield EXIT_OK;
                }
                default -> {
                    _printError("Unknown command: " + command);
                    _printUsage();
                    yield EXIT_USAGE;
                }
            };
        } catch (ConfigException e) {
            _printError("Configuration error: " + e.getMessage());
            logger.log(Level.FINE, "Configuration error", e);
            return EXIT_USAGE;
        } catch (Exception e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (!_hasOption(args, "--verbose")) {
                _printInfo("Use --verbose for details in the log");
            }
            return EXIT_FAILURE;
        } finally {
            if (logFile != null) {
                LoggerUtil.closeLogFile();
            }
        }
    }

    private void _printVersion() {
        out.println("LaTeX Formatter version " + VERSION);
    }

    private void _printUsage() {
        out.println(diagnosticFormatter.colorize(DiagnosticFormatter.ANSI_BOLD, "LaTeX Formatter CLI v" + VERSION));
        out.println("Usage:");
        out.println("  latex-formatter format <paths...>              - Format .tex files in place");
        out.println("  latex-formatter check-syntax <paths...>        - Report unbalanced braces and environments");
        out.println("  latex-formatter init [--force]                 - Write a configuration file with the defaults");
        out.println("  latex-formatter patterns list                  - List protection patterns");
        out.println("  latex-formatter patterns add <category> <re>   - Add a protection pattern");
        out.println("  latex-formatter patterns remove <category> <re> - Remove a protection pattern");
        out.println("  latex-formatter --help|-h                      - Show this help");
        out.println("  latex-formatter --version|-v                   - Show version information");
        out.println();
        out.println("Options:");
        out.println("  --check                    - Only report files that need formatting");
        out.println("  --diff                     - Print a unified diff instead of writing files");
        out.println("  --parallel                 - Process files concurrently");
        out.println("  --threads=<num>            - Number of threads (default: available processors)");
        out.println("  --config=<file>            - Configuration file (default: " + CONFIG_FILE_NAME + ")");
        out.println("  --pattern-config=<dir>     - Directory with pattern files");
        out.println("  --line-length=<num>        - Maximum line length");
        out.println("  --indent-size=<num>        - Spaces per indentation level");
        out.println("  --passes=<a,b,...>         - Run only these passes: "
                + Arrays.stream(PassId.values()).map(PassId::getConfigName).collect(Collectors.joining(",")));
        out.println("  --include=<glob>           - Only include files matching pattern");
        out.println("  --verbose                  - Show detailed output");
        out.println("  --log-file=<file>          - Append log records to this file");
        out.println("  --no-color                 - Disable colored output");
        out.println("  --force                    - Force overwrite (with init command)");
    }

    private int _formatFiles(String[] args) throws IOException {
        List<String> targets = _positionalArguments(args, 1);
        if (targets.isEmpty()) {
            _printError("Error: Missing path argument");
            _printUsage();
            return EXIT_USAGE;
        }

        // Parse optional arguments
        boolean verbose = _hasOption(args, "--verbose");
        boolean parallel = _hasOption(args, "--parallel");
        FormatMode mode = _hasOption(args, "--diff") ? FormatMode.DIFF
                : _hasOption(args, "--check") ? FormatMode.CHECK
                : FormatMode.FORMAT;
        int threads = _intOption(args, "--threads", Runtime.getRuntime().availableProcessors());
        FormatterConfig config = _loadConfig(args);

        List<Path> files = new ArrayList<>();
        for (String target : targets) {
            Path path = Paths.get(target);
            if (!Files.exists(path)) {
                _printError("Error: Path does not exist: " + target);
                return EXIT_USAGE;
            }
            files.addAll(_findFiles(path, _getOptionValue(args, "--include")));
        }
        _printInfo("Found " + files.size() + " files to " + (mode == FormatMode.FORMAT ? "format" : "check"));

        Map<String, List<Diagnostic>> diagnosticsByFile = new LinkedHashMap<>();
        Map<String, Path> pathsById = new LinkedHashMap<>();
        List<LatexDocument> documents = new ArrayList<>();
        int readFailures = 0;
        for (Path file : files) {
            try {
                String text = Files.readString(file, StandardCharsets.UTF_8);
                documents.add(new LatexDocument(file.toString(), text));
                pathsById.put(file.toString(), file);
            } catch (IOException e) {
                _printError("Error reading file: " + file + " - " + e.getMessage());
                logger.log(Level.WARNING, "Error reading file: " + file, e);
                diagnosticsByFile.put(file.toString(), List.of(new Diagnostic(Severity.FATAL,
                        DiagnosticKind.INTERNAL_CONSISTENCY, "Failed to read file: " + e.getMessage(), 1, 1)));
                readFailures++;
            }
        }

        Instant start = Instant.now();
        BatchResult batch;
        try (LatexFormatterEngine engine = new LatexFormatterEngine(config)) {
            batch = new BatchRunner(engine, Math.max(1, threads)).run(documents, mode, parallel);
        }

        int written = 0;
        int needsFormatting = 0;
        int failed = 0;
        for (DocumentOutcome outcome : batch.getOutcomes()) {
            String id = outcome.getDocumentId();
            diagnosticsByFile.put(id, outcome.getResult().getDiagnostics());

            if (!outcome.getResult().isSuccessful()) {
                failed++;
                _printError("Failed to format: " + id);
                outcome.getResult().getDiagnostics().forEach(d ->
                        _printError("  " + diagnosticFormatter.formatDiagnostic(d)));
                continue;
            }
            if (!outcome.getResult().isChanged()) {
                if (verbose) {
                    _printInfo("  Already formatted: " + id);
                }
                continue;
            }

            needsFormatting++;
            switch (mode) {
                case FORMAT -> {
                    Files.writeString(pathsById.get(id), outcome.getResult().getOutputText(), StandardCharsets.UTF_8);
                    written++;
                    _printSuccess("Formatted: " + id);
                    if (verbose) {
                        for (FormattingChange change : outcome.getResult().getAppliedChanges()) {
                            _printInfo("    - " + change);
                        }
                    }
                }
                case CHECK -> _printWarning("File needs formatting: " + id);
                case DIFF -> out.print(outcome.getDiff().getUnifiedText());
            }
        }

        Duration duration = Duration.between(start, Instant.now());
        out.println("\nCompleted in " + _formatDuration(duration) + ":");
        out.println("  Processed files: " + batch.getOutcomes().size());
        if (mode == FormatMode.FORMAT) {
            out.println("  Reformatted: " + written);
        } else {
            out.println("  Files needing formatting: " + needsFormatting);
        }
        out.println("  Files with errors: " + (failed + readFailures));

        boolean hasDiagnostics = diagnosticsByFile.values().stream().anyMatch(list -> !list.isEmpty());
        if (hasDiagnostics) {
            out.println("\n" + diagnosticFormatter.formatSummary(diagnosticsByFile));
        }

        if (readFailures > 0 || !batch.isSuccessful()) {
            return EXIT_FAILURE;
        }
        return mode == FormatMode.DIFF && needsFormatting > 0 ? EXIT_FAILURE : EXIT_OK;
    }

    private int _checkSyntax(String[] args) throws IOException {
        List<String> targets = _positionalArguments(args, 1);
        if (targets.isEmpty()) {
            _printError("Error: Missing path argument");
            _printUsage();
            return EXIT_USAGE;
        }
        FormatterConfig config = _loadConfig(args);

        Map<String, List<Diagnostic>> diagnosticsByFile = new LinkedHashMap<>();
        boolean hasErrors = false;
        try (LatexFormatterEngine engine = new LatexFormatterEngine(config)) {
            for (String target : targets) {
                Path path = Paths.get(target);
                if (!Files.exists(path)) {
                    _printError("Error: Path does not exist: " + target);
                    return EXIT_USAGE;
                }
                for (Path file : _findFiles(path, _getOptionValue(args, "--include"))) {
                    List<Diagnostic> diagnostics = engine.checkSyntax(Files.readString(file, StandardCharsets.UTF_8));
                    diagnosticsByFile.put(file.toString(), diagnostics);
                    if (diagnostics.isEmpty()) {
                        _printSuccess("OK: " + file);
                        continue;
                    }
                    out.println(diagnosticFormatter.colorize(DiagnosticFormatter.ANSI_BOLD, file + ":"));
                    Map<Severity, List<Diagnostic>> bySeverity = diagnosticFormatter.groupBySeverity(diagnostics);
                    _printDiagnosticsBySeverity(bySeverity, Severity.FATAL);
                    _printDiagnosticsBySeverity(bySeverity, Severity.ERROR);
                    _printDiagnosticsBySeverity(bySeverity, Severity.WARNING);
                    _printDiagnosticsBySeverity(bySeverity, Severity.INFO);
                    hasErrors |= diagnostics.stream().anyMatch(d ->
                            d.getSeverity() == Severity.ERROR || d.getSeverity() == Severity.FATAL);
                }
            }
        }

        out.println("\n" + diagnosticFormatter.formatSummary(diagnosticsByFile));
        return hasErrors ? EXIT_FAILURE : EXIT_OK;
    }

    private int _initializeConfig(String[] args) throws IOException {
        String configOption = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configOption != null ? configOption : CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            out.println("Use --force to overwrite it or specify a different path with --config");
            return EXIT_FAILURE;
        }

        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();
        ConfigurationLoader.saveConfig(config, configPath);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    private int _managePatterns(String[] args) throws IOException {
        List<String> positional = _positionalArguments(args, 1);
        if (positional.isEmpty()) {
            _printError("Error: Missing patterns subcommand (list, add, remove)");
            return EXIT_USAGE;
        }

        String patternOption = _getOptionValue(args, "--pattern-config");
        Path patternDir = patternOption != null ? Paths.get(patternOption) : _loadConfig(args).getPatternConfigDir();
        if (patternDir == null) {
            patternDir = Paths.get(DEFAULT_PATTERN_DIR);
        }
        PatternStore store = new PatternStore(patternDir);

        String subcommand = positional.get(0);
        switch (subcommand) {
            case "list" -> {
                for (Map.Entry<PatternCategory, List<String>> entry : store.listPatterns().entrySet()) {
                    out.println(diagnosticFormatter.colorize(DiagnosticFormatter.ANSI_BOLD,
                            entry.getKey().getConfigKey() + " (" + entry.getValue().size() + ")"));
                    entry.getValue().forEach(pattern -> out.println("  " + pattern));
                }
                return EXIT_OK;
            }
            case "add", "remove" -> {
                if (positional.size() < 3) {
                    _printError("Error: Usage: patterns " + subcommand + " <category> <regex>");
                    return EXIT_USAGE;
                }
                PatternCategory category = PatternCategory.fromConfigKey(positional.get(1));
                if (category == null) {
                    _printError("Error: Unknown pattern category: " + positional.get(1));
                    return EXIT_USAGE;
                }
                String regex = positional.get(2);
                if (subcommand.equals("add")) {
                    store.addPattern(category, regex);
                    _printSuccess("Added pattern to " + category.getConfigKey() + ": " + regex);
                    return EXIT_OK;
                }
                if (store.removePattern(category, regex)) {
                    _printSuccess("Removed pattern from " + category.getConfigKey() + ": " + regex);
                    return EXIT_OK;
                }
                _printWarning("Pattern not found in " + category.getConfigKey() + ": " + regex);
                return EXIT_FAILURE;
            }
            default -> {
                _printError("Unknown patterns subcommand: " + subcommand);
                return EXIT_USAGE;
            }
        }
    }

    /**
     * Loads the configuration file and applies command-line overrides.
     */
    private FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        FormatterConfig config;
        if (configFile != null) {
            _printInfo("Using config file: " + configFile);
            config = ConfigurationLoader.loadConfig(Paths.get(configFile));
        } else if (Files.exists(Paths.get(CONFIG_FILE_NAME))) {
            config = ConfigurationLoader.loadConfig(Paths.get(CONFIG_FILE_NAME));
        } else {
            config = ConfigurationLoader.loadDefaultConfig();
        }

        FormatterConfig.Builder builder = config.toBuilder();
        if (_getOptionValue(args, "--line-length") != null) {
            builder.lineLength(_intOption(args, "--line-length", config.getLineLength()));
        }
        if (_getOptionValue(args, "--indent-size") != null) {
            builder.indentSize(_intOption(args, "--indent-size", config.getIndentSize()));
        }
        String patternConfig = _getOptionValue(args, "--pattern-config");
        if (patternConfig != null) {
            builder.patternConfigDir(Paths.get(patternConfig));
        }
        String passes = _getOptionValue(args, "--passes");
        if (passes != null) {
            Set<PassId> selected = EnumSet.noneOf(PassId.class);
            for (String name : passes.split(",")) {
                if (name.isBlank()) {
                    continue;
                }
                try {
                    selected.add(PassId.fromConfigName(name.trim()));
                } catch (IllegalArgumentException e) {
                    throw new ConfigException("Unknown pass: " + name.trim(), e);
                }
            }
            builder.passes(selected);
        }
        return builder.build();
    }

    private List<Path> _findFiles(Path path, String includePattern) throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }

        try (Stream<Path> walk = Files.walk(path)) {
            return walk.filter(Files::isRegularFile)
                    .filter(FormatterCli::_isSupported)
                    .filter(p -> _matchesIncludePattern(p, includePattern))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            _printError("Error scanning directory: " + e.getMessage());
            throw e;
        }
    }

    private static boolean _isSupported(Path file) {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".tex") || fileName.endsWith(".latex");
    }

    private static boolean _matchesIncludePattern(Path file, String includePattern) {
        if (includePattern == null || includePattern.isEmpty()) {
            return true;
        }

        String fileName = file.getFileName().toString();

        if (includePattern.startsWith("*.")) {
            String extension = includePattern.substring(1);
            return fileName.endsWith(extension);
        } else if (includePattern.contains("*")) {
            String regex = includePattern
                    .replace(".", "\\.")
                    .replace("*", ".*")
                    .replace("?", ".");
            return fileName.matches(regex);
        } else {
            return fileName.contains(includePattern);
        }
    }

    private static List<String> _positionalArguments(String[] args, int from) {
        List<String> positional = new ArrayList<>();
        for (int i = from; i < args.length; i++) {
            if (!args[i].startsWith("--")) {
                positional.add(args[i]);
            }
        }
        return positional;
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static int _intOption(String[] args, String option, int defaultValue) {
        String value = _getOptionValue(args, option);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("Option " + option + " must be an integer, got: " + value, e);
        }
    }

    private void _printDiagnosticsBySeverity(Map<Severity, List<Diagnostic>> bySeverity, Severity severity) {
        if (bySeverity.containsKey(severity)) {
            for (Diagnostic diagnostic : bySeverity.get(severity)) {
                switch (severity) {
                    case FATAL, ERROR -> _printError("  " + diagnosticFormatter.formatDiagnostic(diagnostic));
                    case WARNING -> _printWarning("  " + diagnosticFormatter.formatDiagnostic(diagnostic));
                    case INFO -> _printInfo("  " + diagnosticFormatter.formatDiagnostic(diagnostic));
                }
            }
        }
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        } else {
            long minutes = seconds / 60;
            seconds = seconds % 60;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }

    private void _printSuccess(String message) {
        out.println(diagnosticFormatter.colorize(DiagnosticFormatter.ANSI_GREEN, message));
    }

    private void _printError(String message) {
        out.println(diagnosticFormatter.colorize(DiagnosticFormatter.ANSI_RED, message));
    }

    private void _printWarning(String message) {
        out.println(diagnosticFormatter.colorize(DiagnosticFormatter.ANSI_YELLOW, message));
    }

    private void _printInfo(String message) {
        out.println(diagnosticFormatter.colorize(DiagnosticFormatter.ANSI_BLUE, message));
    }
}
