package com.codeabbrev.cli.deps;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads and writes dependency maps as pretty-printed JSON. Module keys are
 * written in sorted order so repeated runs produce identical files.
 */
public class DependencyWriter {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static class DependencyFileException extends RuntimeException {
        public DependencyFileException(String msg) { super(msg); }
        public DependencyFileException(String msg, Throwable cause) { super(msg, cause); }
    }

    public void write(Map<String, DependencyModule> modules, Path outputFile) {
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new DependencyFileException("Could not create output directory for: " + outputFile, e);
        }
        try (Writer w = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
            GSON.toJson(new TreeMap<>(modules), w);
        } catch (IOException e) {
            throw new DependencyFileException("Failed to write " + outputFile + ": " + e.getMessage(), e);
        }
        System.err.println("[abbreviator-cli] Dependencies written: " + outputFile);
    }

    public Map<String, DependencyModule> read(Path depsFile) {
        if (!Files.isRegularFile(depsFile)) {
            throw new DependencyFileException("Dependencies file not found: " + depsFile);
        }
        try {
            return PydepsRunner.parse(Files.readString(depsFile, StandardCharsets.UTF_8));
        } catch (PydepsRunner.PydepsException e) {
            throw new DependencyFileException("Malformed dependencies file " + depsFile + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DependencyFileException("Failed to read " + depsFile + ": " + e.getMessage(), e);
        }
    }
}
