package com.codeabbrev.cli.deps;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DependencyWriterTest {

    private final DependencyWriter writer = new DependencyWriter();

    @Test
    void writesSortedSnakeCaseJsonWithoutNulls(@TempDir Path tmp) throws IOException {
        Map<String, DependencyModule> modules = new LinkedHashMap<>();
        DependencyModule zeta = DependencyModule.forScript("zeta", "zeta.py");
        zeta.importedBy = List.of("alpha");
        modules.put("zeta", zeta);
        modules.put("alpha", DependencyModule.forScript("alpha", "alpha.py"));

        Path out = tmp.resolve("nested/deps.json");
        writer.write(modules, out);

        String json = Files.readString(out);
        assertTrue(json.indexOf("\"alpha\"") < json.indexOf("\"zeta\""), json);
        assertTrue(json.contains("\"imported_by\""), json);
        assertFalse(json.contains("summary"), json);
        assertFalse(json.contains("null"), json);

        Map<String, DependencyModule> read = writer.read(out);
        assertEquals(List.of("alpha"), read.get("zeta").importedBy);
    }

    @Test
    void missingFileThrows(@TempDir Path tmp) {
        assertThrows(DependencyWriter.DependencyFileException.class, () -> writer.read(tmp.resolve("none.json")));
    }

    @Test
    void malformedFileThrows(@TempDir Path tmp) throws IOException {
        Path bad = tmp.resolve("bad.json");
        Files.writeString(bad, "[1, 2");
        assertThrows(DependencyWriter.DependencyFileException.class, () -> writer.read(bad));
    }
}
