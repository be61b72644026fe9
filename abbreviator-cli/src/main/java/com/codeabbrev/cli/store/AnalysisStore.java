package com.codeabbrev.cli.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite run log. The schema is applied on open and is idempotent.
 */
public class AnalysisStore implements AutoCloseable {

    static final String SCHEMA_RESOURCE = "/db/schema.sql";

    public static class StoreException extends RuntimeException {
        public StoreException(String msg, Throwable cause) { super(msg, cause); }
    }

    /** One row of the {@code analysis_summary} view. */
    public record TypeSummary(String analysisType, int totalAnalyses, long totalCharsSaved,
                              double avgPercentSaved, double maxPercentSaved, double minPercentSaved) {}

    private final Connection connection;

    private AnalysisStore(Connection connection) {
        this.connection = connection;
    }

    /** Opens (creating if needed) the database at {@code dbFile}. */
    public static AnalysisStore open(Path dbFile) {
        try {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StoreException("Could not create database directory for: " + dbFile, e);
        }
        try {
            Connection connection = DriverManager.getConnection("jdbc:sqlite:" + dbFile.toAbsolutePath());
            AnalysisStore store = new AnalysisStore(connection);
            store.applySchema();
            return store;
        } catch (SQLException e) {
            throw new StoreException("Failed to open database " + dbFile + ": " + e.getMessage(), e);
        }
    }

    private void applySchema() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            for (String sql : schemaStatements()) {
                stmt.execute(sql);
            }
        }
    }

    static List<String> schemaStatements() {
        String script;
        try (InputStream in = AnalysisStore.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new StoreException("Schema resource missing: " + SCHEMA_RESOURCE, null);
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("Failed to load schema: " + e.getMessage(), e);
        }
        StringBuilder code = new StringBuilder();
        for (String line : script.split("\n")) {
            if (!line.strip().startsWith("--")) {
                code.append(line).append('\n');
            }
        }
        List<String> statements = new ArrayList<>();
        for (String sql : code.toString().split(";")) {
            if (!sql.isBlank()) statements.add(sql.strip());
        }
        return statements;
    }

    /**
     * Appends {@code record} (its id is ignored) and remembers the file
     * fingerprint in {@code file_history}.
     *
     * @return the stored row's id
     */
    public long record(AnalysisRecord record) {
        String insert = "INSERT INTO analysis_results (file_path, file_size, file_md5, modified_date, analysis_date,"
                + " analysis_type, parameters, output_path, characters_saved, percent_saved)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        String history = "INSERT OR IGNORE INTO file_history (file_path, file_size, file_md5, recorded_date)"
                + " VALUES (?, ?, ?, ?)";
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw new StoreException("Failed to start transaction: " + e.getMessage(), e);
        }
        try (PreparedStatement stmt = connection.prepareStatement(insert, Statement.RETURN_GENERATED_KEYS);
             PreparedStatement hist = connection.prepareStatement(history)) {
            stmt.setString(1, record.filePath());
            stmt.setLong(2, record.fileSize());
            stmt.setString(3, record.fileMd5());
            stmt.setString(4, record.modifiedDate());
            stmt.setString(5, record.analysisDate());
            stmt.setString(6, record.analysisType());
            stmt.setString(7, record.parameters());
            stmt.setString(8, record.outputPath());
            stmt.setInt(9, record.charactersSaved());
            stmt.setDouble(10, record.percentSaved());
            stmt.executeUpdate();

            hist.setString(1, record.filePath());
            hist.setLong(2, record.fileSize());
            hist.setString(3, record.fileMd5());
            hist.setString(4, LocalDateTime.now().toString());
            hist.executeUpdate();

            long id;
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                id = keys.next() ? keys.getLong(1) : 0L;
            }
            connection.commit();
            return id;
        } catch (SQLException e) {
            rollback(e);
            throw new StoreException("Failed to record analysis of " + record.filePath() + ": " + e.getMessage(), e);
        } finally {
            try {
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                System.err.println("[abbreviator-cli] WARNING: could not restore auto-commit: " + e.getMessage());
            }
        }
    }

    private void rollback(SQLException cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    /** All rows, newest first. */
    public List<AnalysisRecord> list() {
        String query = "SELECT id, file_path, file_size, file_md5, modified_date, analysis_date, analysis_type,"
                + " parameters, output_path, characters_saved, percent_saved"
                + " FROM analysis_results ORDER BY analysis_date DESC, id DESC";
        List<AnalysisRecord> rows = new ArrayList<>();
        try (Statement stmt = connection.createStatement(); ResultSet rs = stmt.executeQuery(query)) {
            while (rs.next()) {
                rows.add(new AnalysisRecord(
                        rs.getLong("id"),
                        rs.getString("file_path"),
                        rs.getLong("file_size"),
                        rs.getString("file_md5"),
                        rs.getString("modified_date"),
                        rs.getString("analysis_date"),
                        rs.getString("analysis_type"),
                        rs.getString("parameters"),
                        rs.getString("output_path"),
                        rs.getInt("characters_saved"),
                        rs.getDouble("percent_saved")));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list analyses: " + e.getMessage(), e);
        }
        return rows;
    }

    /** Totals per analysis type, ordered by type. */
    public List<TypeSummary> summaries() {
        String query = "SELECT analysis_type, total_analyses, total_chars_saved, avg_percent_saved,"
                + " max_percent_saved, min_percent_saved FROM analysis_summary ORDER BY analysis_type";
        List<TypeSummary> rows = new ArrayList<>();
        try (Statement stmt = connection.createStatement(); ResultSet rs = stmt.executeQuery(query)) {
            while (rs.next()) {
                rows.add(new TypeSummary(
                        rs.getString(1), rs.getInt(2), rs.getLong(3),
                        rs.getDouble(4), rs.getDouble(5), rs.getDouble(6)));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read analysis summary: " + e.getMessage(), e);
        }
        return rows;
    }

    /** Number of distinct (path, md5) pairs seen. */
    public int historySize() {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM file_history")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count file history: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new StoreException("Failed to close database: " + e.getMessage(), e);
        }
    }
}
