package com.codeabbrev.cli.summary;

import com.codeabbrev.cli.OutputFiles;
import com.codeabbrev.cli.deps.DependencyEnhancer;
import com.codeabbrev.core.AbbreviationOptions;
import com.codeabbrev.core.CodeAbbreviator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Abbreviates every Python file of a repository and asks the summary service
 * to describe each one.
 */
public class RepositorySummarizer {

    private final CodeAbbreviator abbreviator;
    private final SummaryClient client;

    public RepositorySummarizer(CodeAbbreviator abbreviator, SummaryClient client) {
        this.abbreviator = abbreviator;
        this.client = client;
    }

    /**
     * Walks {@code repo} for {@code *.py} files in path order. Files with at
     * most {@code minChars} characters are skipped. For every other file the
     * abbreviation goes to {@code abbreviationsDir} and the summary to
     * {@code summariesDir/<relative path>.summary.txt}. A failure on one file
     * is logged and the walk continues.
     *
     * @return summaries keyed by path relative to {@code repo}, in walk order
     */
    public Map<String, String> summarize(Path repo, AbbreviationOptions options, int minChars,
                                         Path abbreviationsDir, Path summariesDir) {
        List<Path> scripts = findScripts(repo);
        Map<String, String> summaries = new LinkedHashMap<>();
        if (scripts.isEmpty()) {
            System.err.println("[abbreviator-cli] WARNING: no Python files found in " + repo);
            return summaries;
        }
        System.err.println("[abbreviator-cli] Found " + scripts.size() + " Python files to process");

        for (Path script : scripts) {
            String relative = repo.relativize(script).toString().replace('\\', '/');
            try {
                String content = Files.readString(script, StandardCharsets.UTF_8);
                int chars = content.codePointCount(0, content.length());
                if (chars <= minChars) {
                    System.err.println("[abbreviator-cli] Skipping " + relative + " - too small (" + chars + " chars)");
                    continue;
                }
                System.err.println("[abbreviator-cli] Processing " + relative + " (" + chars + " chars)");

                String abbreviated = abbreviator.abbreviateCode(content, options);
                Path abbreviationFile = OutputFiles.abbreviationFile(abbreviationsDir, script, options.maxDepth);
                OutputFiles.writeText(abbreviationFile, abbreviated);

                String summary = client.summarize(abbreviated);
                if (SummaryClient.isIndeterminate(summary)) {
                    System.err.println("[abbreviator-cli] WARNING: purpose of " + relative + " could not be determined");
                }
                Path summaryFile = summariesDir.resolve(relative + DependencyEnhancer.SUMMARY_SUFFIX);
                OutputFiles.writeText(summaryFile, summary);
                System.err.println("[abbreviator-cli] Summary saved to " + summaryFile);
                summaries.put(relative, summary);
            } catch (IOException | RuntimeException e) {
                System.err.println("[abbreviator-cli] ERROR: failed to summarize " + relative + ": " + e.getMessage());
            }
        }
        return summaries;
    }

    private static List<Path> findScripts(Path repo) {
        if (!Files.isDirectory(repo)) {
            throw new SummaryClient.SummaryException("Repository directory not found: " + repo);
        }
        try (Stream<Path> walk = Files.walk(repo)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".py"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SummaryClient.SummaryException("Failed to list " + repo + ": " + e.getMessage(), e);
        }
    }
}
