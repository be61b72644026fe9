package com.codeabbrev.cli;

import com.codeabbrev.cli.config.AbbreviatorConfig;
import com.codeabbrev.cli.config.ConfigReader;
import com.codeabbrev.cli.deps.DependencyEnhancer;
import com.codeabbrev.cli.deps.DependencyModule;
import com.codeabbrev.cli.deps.DependencyWriter;
import com.codeabbrev.cli.deps.PydepsRunner;
import com.codeabbrev.cli.store.AnalysisRecord;
import com.codeabbrev.cli.store.AnalysisStore;
import com.codeabbrev.cli.store.FileFingerprint;
import com.codeabbrev.cli.summary.RepositorySummarizer;
import com.codeabbrev.cli.summary.SummaryClient;
import com.codeabbrev.core.AbbreviationOptions;
import com.codeabbrev.core.AbbreviationResult;
import com.codeabbrev.core.CodeAbbreviator;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;
import okhttp3.OkHttpClient;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar abbreviator-cli.jar abbreviate <file> --preserve-chars N [--depth N] [--preserve-lines N] [--debug]
 *   java -jar abbreviator-cli.jar deps <script> [--with-stdlib]
 *   java -jar abbreviator-cli.jar summarize <repo> [--depth N] [--preserve-chars N] [--min-chars N]
 *   java -jar abbreviator-cli.jar enhance <deps.json> [--summaries-dir DIR] [--output FILE]
 *   java -jar abbreviator-cli.jar db --list
 *
 * Every command also accepts {@code --config FILE}; {@code --output-dir DIR}
 * and {@code --db FILE} override the configured locations.
 */
public class AbbreviatorMain {

    static final String USAGE = "Usage: java -jar abbreviator-cli.jar <abbreviate|deps|summarize|enhance|db> [options]\n"
            + "  abbreviate <file> [--depth N] --preserve-chars N [--preserve-lines N] [--debug]\n"
            + "  deps <script> [--with-stdlib]\n"
            + "  summarize <repo> [--depth N] [--preserve-chars N] [--preserve-lines N] [--min-chars N]\n"
            + "  enhance <deps.json> [--summaries-dir DIR] [--output FILE]\n"
            + "  db --list\n"
            + "Common options: --config FILE, --output-dir DIR, --db FILE";

    private static final Gson GSON = new Gson();
    private static final Set<String> SUBCOMMANDS = Set.of("abbreviate", "deps", "summarize", "enhance", "db");

    public static void main(String[] args) {
        try {
            run(args, System.out);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[abbreviator-cli] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[abbreviator-cli] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args, PrintStream out) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!SUBCOMMANDS.contains(args[0])) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }
        Options options = Options.parse(args);
        AbbreviatorConfig config = options.configPath != null
                ? new ConfigReader().read(Paths.get(options.configPath))
                : new ConfigReader().defaults();

        switch (args[0]) {
            case "abbreviate" -> abbreviate(options, config, out);
            case "deps"       -> dependencies(options, config);
            case "summarize"  -> summarize(options, config, out);
            case "enhance"    -> enhance(options, config);
            case "db"         -> database(options, config, out);
            default -> throw new UsageException("Unknown subcommand: " + args[0]);
        }
    }

    private static void abbreviate(Options options, AbbreviatorConfig config, PrintStream out) {
        Path input = Paths.get(options.requireTarget("input file"));
        Integer preserveChars = options.preserveChars != null ? options.preserveChars : config.getPreserveChars();
        if (preserveChars == null) {
            throw new UsageException("--preserve-chars is required (or set preserve_chars in the config file)");
        }
        AbbreviationOptions abbreviation = new AbbreviationOptions(
                options.depth != null ? options.depth : config.getMaxDepth(),
                preserveChars,
                options.preserveLines != null ? options.preserveLines : config.getPreserveLines(),
                options.debug || config.isDebug());

        String source = readSource(input);
        System.err.println("[abbreviator-cli] Abbreviating " + input + " (" + abbreviation + ")");
        AbbreviationResult result = new CodeAbbreviator().abbreviate(source, abbreviation);

        Path outputFile = OutputFiles.abbreviationFile(
                outputDir(options, config).resolve("abbreviations"), input, abbreviation.maxDepth);
        writeOutput(outputFile, result.text());

        out.println("Abbreviated code written to " + outputFile);
        out.println("Original file: " + result.originalChars() + " characters");
        out.println("Abbreviated file: " + result.abbreviatedChars() + " characters");
        out.println(String.format("Characters saved: %d (%.2f%%)", result.charsSaved(), result.percentSaved()));

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("depth", abbreviation.maxDepth);
        parameters.put("preserve_chars", abbreviation.preserveChars);
        parameters.put("preserve_lines", abbreviation.preserveLines);
        parameters.put("debug", abbreviation.debug);
        recordRun(options, config, input, AnalysisRecord.CODE_ABBREVIATION, parameters, outputFile,
                result.charsSaved(), result.percentSaved());
    }

    private static void dependencies(Options options, AbbreviatorConfig config) {
        Path script = Paths.get(options.requireTarget("script path"));
        System.err.println("[abbreviator-cli] Analyzing dependencies for " + script
                + (options.withStdlib ? " (with stdlib)" : ""));
        Map<String, DependencyModule> modules = new PydepsRunner().run(script, options.withStdlib);

        Path outputFile = OutputFiles.dependencyFile(
                outputDir(options, config).resolve("dependencies"), options.withStdlib);
        new DependencyWriter().write(modules, outputFile);

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("with_stdlib", options.withStdlib);
        recordRun(options, config, script, AnalysisRecord.DEPENDENCY_ANALYSIS, parameters, outputFile, 0, 0.0);
    }

    private static void summarize(Options options, AbbreviatorConfig config, PrintStream out) {
        Path repo = Paths.get(options.requireTarget("repository path"));
        AbbreviationOptions abbreviation = new AbbreviationOptions(
                options.depth != null ? options.depth : config.getMaxDepth(),
                options.preserveChars != null ? options.preserveChars
                        : config.getPreserveChars() != null ? config.getPreserveChars() : 90,
                options.preserveLines != null ? options.preserveLines : config.getPreserveLines(),
                false);
        int minChars = options.minChars != null ? options.minChars : 10;

        String apiKey = SummaryClient.readApiKey(Paths.get(config.getLlmApiKeyFile()));
        SummaryClient client = new SummaryClient(config, apiKey, new OkHttpClient());
        Path outputDir = outputDir(options, config);
        Map<String, String> summaries = new RepositorySummarizer(new CodeAbbreviator(), client).summarize(
                repo, abbreviation, minChars, outputDir.resolve("abbreviations"), outputDir.resolve("summaries"));
        out.println("Successfully summarized " + summaries.size() + " scripts");
    }

    private static void enhance(Options options, AbbreviatorConfig config) {
        Path depsFile = Paths.get(options.requireTarget("dependencies file"));
        Path outputDir = outputDir(options, config);
        Path summariesDir = options.summariesDir != null
                ? Paths.get(options.summariesDir)
                : outputDir.resolve("summaries");
        Path outputFile = options.outputFile != null
                ? Paths.get(options.outputFile)
                : OutputFiles.enhancedDependencyFile(outputDir.resolve("enhanced_dependencies"));

        System.err.println("[abbreviator-cli] Enhancing dependencies from " + depsFile
                + " with summaries from " + summariesDir);
        DependencyWriter io = new DependencyWriter();
        Map<String, DependencyModule> modules = io.read(depsFile);
        new DependencyEnhancer().enhance(modules, summariesDir);
        io.write(modules, outputFile);
    }

    private static void database(Options options, AbbreviatorConfig config, PrintStream out) {
        if (!options.list) {
            throw new UsageException("db requires --list");
        }
        try (AnalysisStore store = AnalysisStore.open(dbPath(options, config))) {
            List<AnalysisRecord> rows = store.list();
            if (rows.isEmpty()) {
                out.println("No analysis results found in the database.");
                return;
            }
            out.println();
            out.println("Analysis Results:");
            out.println(String.format("%-5s %-30s %-20s %-25s %-20s %-15s %-10s",
                    "ID", "File", "Type", "Date", "Params", "Chars Saved", "Percent"));
            out.println("-".repeat(110));
            for (AnalysisRecord row : rows) {
                out.println(String.format("%-5d %-30s %-20s %-25s %-20s %-15d %-10.2f%%",
                        row.id(),
                        Paths.get(row.filePath()).getFileName(),
                        row.analysisType(),
                        row.analysisDate(),
                        formatParameters(row.parameters()),
                        row.charactersSaved(),
                        row.percentSaved()));
            }
            out.println();
            for (AnalysisStore.TypeSummary summary : store.summaries()) {
                out.println(String.format("%s: %d runs, %d chars saved, %.2f%% average",
                        summary.analysisType(), summary.totalAnalyses(), summary.totalCharsSaved(),
                        summary.avgPercentSaved()));
            }
        }
    }

    static String formatParameters(String json) {
        JsonObject params;
        try {
            params = JsonParser.parseString(json).getAsJsonObject();
        } catch (JsonSyntaxException | IllegalStateException e) {
            return json;
        }
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, JsonElement> entry : params.entrySet()) {
            JsonElement value = entry.getValue();
            parts.add(entry.getKey() + "=" + (value.isJsonPrimitive() ? value.getAsString() : value.toString()));
        }
        return String.join(", ", parts);
    }

    private static void recordRun(Options options, AbbreviatorConfig config, Path file, String type,
                                  Map<String, Object> parameters, Path outputFile, int charsSaved,
                                  double percentSaved) {
        FileFingerprint fingerprint = FileFingerprint.of(file);
        AnalysisRecord record = new AnalysisRecord(0L, file.toString(), fingerprint.size(), fingerprint.md5(),
                fingerprint.modifiedDate(), LocalDateTime.now().toString(), type, GSON.toJson(parameters),
                outputFile.toString(), charsSaved, percentSaved);
        try (AnalysisStore store = AnalysisStore.open(dbPath(options, config))) {
            store.record(record);
        } catch (AnalysisStore.StoreException e) {
            System.err.println("[abbreviator-cli] ERROR: could not save run to database: " + e.getMessage());
        }
    }

    private static String readSource(Path input) {
        if (!Files.isRegularFile(input)) {
            throw new IllegalArgumentException("Input file not found: " + input);
        }
        try {
            return Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + input + ": " + e.getMessage(), e);
        }
    }

    private static void writeOutput(Path file, String text) {
        try {
            OutputFiles.writeText(file, text);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file + ": " + e.getMessage(), e);
        }
    }

    private static Path outputDir(Options options, AbbreviatorConfig config) {
        return Paths.get(options.outputDir != null ? options.outputDir : config.getOutputDir());
    }

    private static Path dbPath(Options options, AbbreviatorConfig config) {
        return Paths.get(options.dbPath != null ? options.dbPath : config.getDbPath());
    }

    /** Flags of every subcommand; each subcommand reads the ones it needs. */
    static final class Options {
        String target;
        String configPath;
        String outputDir;
        String dbPath;
        String summariesDir;
        String outputFile;
        Integer depth;
        Integer preserveChars;
        Integer preserveLines;
        Integer minChars;
        boolean debug;
        boolean withStdlib;
        boolean list;

        static Options parse(String[] args) {
            Options o = new Options();
            for (int i = 1; i < args.length; i++) {
                switch (args[i]) {
                    case "--config"         -> o.configPath    = requireNext(args, i++, "--config");
                    case "--output-dir"     -> o.outputDir     = requireNext(args, i++, "--output-dir");
                    case "--db"             -> o.dbPath        = requireNext(args, i++, "--db");
                    case "--summaries-dir"  -> o.summariesDir  = requireNext(args, i++, "--summaries-dir");
                    case "--output"         -> o.outputFile    = requireNext(args, i++, "--output");
                    case "--depth"          -> o.depth         = requireInt(args, i++, "--depth");
                    case "--preserve-chars" -> o.preserveChars = requireInt(args, i++, "--preserve-chars");
                    case "--preserve-lines" -> o.preserveLines = requireInt(args, i++, "--preserve-lines");
                    case "--min-chars"      -> o.minChars      = requireInt(args, i++, "--min-chars");
                    case "--debug"          -> o.debug = true;
                    case "--with-stdlib"    -> o.withStdlib = true;
                    case "--list"           -> o.list = true;
                    default -> {
                        if (args[i].startsWith("--")) throw new UsageException("Unknown flag: " + args[i]);
                        if (o.target != null) throw new UsageException("Unexpected argument: " + args[i]);
                        o.target = args[i];
                    }
                }
            }
            return o;
        }

        String requireTarget(String what) {
            if (target == null) throw new UsageException(what + " is required");
            return target;
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    private static int requireInt(String[] args, int i, String flag) {
        String value = requireNext(args, i, flag);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects an integer, got: " + value);
        }
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
