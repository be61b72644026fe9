package com.codeabbrev.cli.deps;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Attaches script summaries to the modules of a dependency map.
 *
 * Each {@code <relative path>.summary.txt} under the summaries directory is
 * indexed under its relative path, its dotted module name and its bare base
 * name. A module matches by key, then by {@code name}, then by the base name
 * of {@code path}, then by the last dotted segment of its key.
 */
public class DependencyEnhancer {

    public static final String SUMMARY_SUFFIX = ".summary.txt";

    public static class EnhanceException extends RuntimeException {
        public EnhanceException(String msg, Throwable cause) { super(msg, cause); }
    }

    /** @return number of modules that received a summary */
    public int enhance(Map<String, DependencyModule> modules, Path summariesDir) {
        Map<String, String> summaries = loadSummaries(summariesDir);
        int enhanced = 0;
        for (Map.Entry<String, DependencyModule> entry : modules.entrySet()) {
            String key = entry.getKey();
            DependencyModule module = entry.getValue();
            String summary = findSummary(key, module, summaries);
            if (summary != null) {
                module.summary = summary;
                enhanced++;
            } else {
                System.err.println("[abbreviator-cli] No summary found for " + key);
            }
        }
        System.err.println("[abbreviator-cli] Enhanced " + enhanced + " module(s) with summaries");
        return enhanced;
    }

    private static String findSummary(String key, DependencyModule module, Map<String, String> summaries) {
        if (summaries.containsKey(key)) {
            return summaries.get(key);
        }
        if (module.name != null && summaries.containsKey(module.name)) {
            return summaries.get(module.name);
        }
        if (module.path != null && !module.path.isEmpty()) {
            Path fileName = Paths.get(module.path).getFileName();
            if (fileName != null && summaries.containsKey(fileName.toString())) {
                return summaries.get(fileName.toString());
            }
        }
        String lastSegment = key.substring(key.lastIndexOf('.') + 1);
        return summaries.get(lastSegment);
    }

    /**
     * Indexes every summary file below {@code summariesDir}. A missing
     * directory gives an empty index.
     */
    Map<String, String> loadSummaries(Path summariesDir) {
        Map<String, String> index = new HashMap<>();
        if (!Files.isDirectory(summariesDir)) {
            System.err.println("[abbreviator-cli] WARNING: summaries directory not found: " + summariesDir);
            return index;
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(summariesDir)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(SUMMARY_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new EnhanceException("Failed to list summaries in " + summariesDir + ": " + e.getMessage(), e);
        }
        System.err.println("[abbreviator-cli] Found " + files.size() + " summary files");

        for (Path file : files) {
            String content;
            try {
                content = Files.readString(file, StandardCharsets.UTF_8).strip();
            } catch (IOException e) {
                throw new EnhanceException("Failed to read summary " + file + ": " + e.getMessage(), e);
            }
            String relative = summariesDir.relativize(file).toString().replace('\\', '/');
            String modulePath = relative.substring(0, relative.length() - SUMMARY_SUFFIX.length());
            String moduleName = stripExtension(modulePath).replace('/', '.');
            String baseName = stripExtension(modulePath.substring(modulePath.lastIndexOf('/') + 1));

            index.put(moduleName, content);
            index.put(modulePath, content);
            index.put(baseName, content);
        }
        return index;
    }

    private static String stripExtension(String name) {
        int slash = name.lastIndexOf('/');
        int dot = name.lastIndexOf('.');
        return dot > slash + 1 ? name.substring(0, dot) : name;
    }
}
