package com.codeabbrev.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Naming of the files the commands produce. Every name carries the epoch
 * second of the run.
 */
public final class OutputFiles {

    private OutputFiles() {}

    /** {@code <dir>/<name>_depth<N>_<epochSeconds><ext>} for source file {@code <name><ext>}. */
    public static Path abbreviationFile(Path dir, Path source, int depth) {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String name = dot > 0 ? fileName.substring(0, dot) : fileName;
        String ext = dot > 0 ? fileName.substring(dot) : "";
        return dir.resolve(name + "_depth" + depth + "_" + epochSeconds() + ext);
    }

    /** {@code <dir>/deps_{all|min}_<epochSeconds>.json}. */
    public static Path dependencyFile(Path dir, boolean withStdlib) {
        return dir.resolve("deps_" + (withStdlib ? "all" : "min") + "_" + epochSeconds() + ".json");
    }

    /** {@code <dir>/deps_enhanced_<epochSeconds>.json}. */
    public static Path enhancedDependencyFile(Path dir) {
        return dir.resolve("deps_enhanced_" + epochSeconds() + ".json");
    }

    /** Writes {@code text} as UTF-8, creating parent directories. */
    public static void writeText(Path file, String text) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, text, StandardCharsets.UTF_8);
    }

    private static long epochSeconds() {
        return Instant.now().getEpochSecond();
    }
}
