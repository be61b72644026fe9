package com.codeabbrev.cli.deps;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the external {@code pydeps} tool on a script and returns its module map.
 */
public class PydepsRunner {

    private static final Gson GSON = new Gson();
    private static final Type MODULE_MAP = new TypeToken<LinkedHashMap<String, DependencyModule>>() {}.getType();

    public static class PydepsException extends RuntimeException {
        public PydepsException(String msg) { super(msg); }
        public PydepsException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final List<String> command;

    public PydepsRunner() {
        this(List.of("pydeps"));
    }

    /** @param command executable and leading arguments used in place of {@code pydeps} */
    public PydepsRunner(List<String> command) {
        this.command = List.copyOf(command);
    }

    /**
     * Analyses {@code script}. Paths under the script's directory come back
     * relative to it.
     *
     * An empty result yields a map holding only the script. A failing pydeps
     * run yields the same map with {@code error} set.
     *
     * @throws PydepsException if pydeps cannot be started or prints malformed JSON
     */
    public Map<String, DependencyModule> run(Path script, boolean includeStdlib) {
        if (!Files.isRegularFile(script)) {
            throw new PydepsException("Script not found: " + script);
        }
        List<String> cmd = new ArrayList<>(command);
        cmd.add("--show-deps");
        cmd.add("--no-output");
        cmd.add(script.toString());
        if (includeStdlib) {
            cmd.add("--pylib");
        }

        ProcessResult result = execute(cmd);
        String scriptName = script.getFileName().toString();
        Map<String, DependencyModule> modules;

        if (result.exitCode() != 0) {
            System.err.println("[abbreviator-cli] ERROR: pydeps exited with status " + result.exitCode()
                    + ": " + result.stderr().trim());
            DependencyModule self = DependencyModule.forScript(scriptName, script.toString());
            self.error = "pydeps exited with status " + result.exitCode() + ": " + result.stderr().trim();
            modules = new LinkedHashMap<>();
            modules.put(scriptName, self);
        } else if (result.stdout().isBlank() || result.stdout().trim().equals("{}")) {
            System.err.println("[abbreviator-cli] WARNING: pydeps returned no modules for " + script
                    + "; the script may have no analysable imports or its dependencies are not installed");
            modules = new LinkedHashMap<>();
            modules.put(scriptName, DependencyModule.forScript(scriptName, script.toString()));
        } else {
            modules = parse(result.stdout());
        }

        Path baseDir = script.toAbsolutePath().getParent();
        makePathsRelative(modules, baseDir);
        return modules;
    }

    static Map<String, DependencyModule> parse(String json) {
        try {
            Map<String, DependencyModule> modules = GSON.fromJson(json, MODULE_MAP);
            if (modules == null) {
                throw new PydepsException("pydeps printed no JSON");
            }
            return modules;
        } catch (JsonParseException e) {
            String head = json.length() > 500 ? json.substring(0, 500) : json;
            throw new PydepsException("Malformed pydeps output: " + e.getMessage() + "\n" + head, e);
        }
    }

    static void makePathsRelative(Map<String, DependencyModule> modules, Path baseDir) {
        for (DependencyModule module : modules.values()) {
            if (module.path == null || module.path.isEmpty()) continue;
            Path path = Paths.get(module.path);
            if (path.isAbsolute() && path.startsWith(baseDir)) {
                module.path = baseDir.relativize(path).toString();
            }
        }
    }

    private ProcessResult execute(List<String> cmd) {
        Path errorLog = null;
        try {
            errorLog = Files.createTempFile("pydeps", ".err");
            ProcessBuilder pb = new ProcessBuilder(cmd).redirectError(errorLog.toFile());
            Process process = pb.start();
            StringBuilder stdout = new StringBuilder();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    stdout.append(line).append('\n');
                }
            }
            int exitCode = process.waitFor();
            return new ProcessResult(exitCode, stdout.toString(), Files.readString(errorLog));
        } catch (IOException e) {
            throw new PydepsException("Failed to run " + cmd.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PydepsException("pydeps interrupted", e);
        } finally {
            if (errorLog != null) {
                errorLog.toFile().delete();
            }
        }
    }

    private record ProcessResult(int exitCode, String stdout, String stderr) {}
}
