package io.resolvequeue.storage;

import io.resolvequeue.config.QueueConfig;
import io.resolvequeue.config.QueueSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "resolvequeue.schema.migration.v1";
    private final QueueConfig config;
    private final String jdbcUrl;
    private final long busyTimeoutMs;

    public Database(QueueConfig config) {
        this(config, QueueSettings.defaults().busyTimeoutMs());
    }

    public Database(QueueConfig config, long busyTimeoutMs) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.busyTimeoutMs = Math.max(0L, busyTimeoutMs);
    }

    public String namespace() {
        return config.namespace();
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        initSchema();
    }

    /**
     * Every connection waits up to the busy timeout for the write lock, and every
     * explicit transaction starts as {@code BEGIN IMMEDIATE}, so a transaction that
     * reads before it writes already holds the lock when it reads.
     */
    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", Long.toString(busyTimeoutMs));
        props.setProperty("transaction_mode", "IMMEDIATE");
        props.setProperty("foreign_keys", "true");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootBaseDir());
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS batch_spec_resolution_jobs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        namespace TEXT NOT NULL DEFAULT 'default',
                        batch_spec_id INTEGER NOT NULL,
                        allow_unsupported INTEGER NOT NULL DEFAULT 0,
                        allow_ignored INTEGER NOT NULL DEFAULT 0,
                        state TEXT NOT NULL DEFAULT 'queued'
                            CHECK (state IN ('queued','processing','completed','failed','errored')),
                        failure_message TEXT,
                        started_at_ms INTEGER,
                        finished_at_ms INTEGER,
                        process_after_ms INTEGER,
                        num_resets INTEGER NOT NULL DEFAULT 0,
                        num_failures INTEGER NOT NULL DEFAULT 0,
                        worker_hostname TEXT NOT NULL DEFAULT '',
                        progress_detail TEXT,
                        claim_token TEXT,
                        version INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS job_execution_logs (
                        job_id INTEGER NOT NULL,
                        attempt INTEGER NOT NULL,
                        worker_hostname TEXT NOT NULL DEFAULT '',
                        started_at_ms INTEGER NOT NULL,
                        finished_at_ms INTEGER NOT NULL,
                        outcome TEXT NOT NULL,
                        detail TEXT,
                        PRIMARY KEY(job_id, attempt),
                        FOREIGN KEY(job_id) REFERENCES batch_spec_resolution_jobs(id)
                    )
                    """);
            ensureJobColumns(conn);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_claim ON batch_spec_resolution_jobs(namespace, state, process_after_ms, created_at_ms, id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_stalled ON batch_spec_resolution_jobs(namespace, state, updated_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_worker ON batch_spec_resolution_jobs(namespace, worker_hostname)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_claim_token ON batch_spec_resolution_jobs(claim_token)");
        } catch (SQLException e) {
            throw new JobStoreException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureJobColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(batch_spec_resolution_jobs)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("namespace")) {
                st.execute("ALTER TABLE batch_spec_resolution_jobs ADD COLUMN namespace TEXT NOT NULL DEFAULT 'default'");
            }
            if (!columns.contains("claim_token")) {
                st.execute("ALTER TABLE batch_spec_resolution_jobs ADD COLUMN claim_token TEXT");
            }
            if (!columns.contains("progress_detail")) {
                st.execute("ALTER TABLE batch_spec_resolution_jobs ADD COLUMN progress_detail TEXT");
            }
            if (!columns.contains("version")) {
                st.execute("ALTER TABLE batch_spec_resolution_jobs ADD COLUMN version INTEGER NOT NULL DEFAULT 0");
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_schema_migrations_applied ON schema_migrations(applied_at_ms)");
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261017_001_batch_spec_lookup",
                "Index jobs by batch spec for operator lookups",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_jobs_batch_spec ON batch_spec_resolution_jobs(namespace, batch_spec_id)"
                )
        ));
        steps.add(new MigrationStep(
                "20261017_002_execution_log_append_only",
                "Reject updates to execution log entries",
                List.of("""
                        CREATE TRIGGER IF NOT EXISTS trg_job_execution_logs_append_only
                        BEFORE UPDATE ON job_execution_logs
                        BEGIN
                            SELECT RAISE(ABORT, 'execution log entries are append-only');
                        END
                        """)
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        String checksum = checksum(step);
        conn.setAutoCommit(false);
        try {
            try (Statement st = conn.createStatement()) {
                for (String sql : step.sql()) {
                    st.execute(sql);
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
                ps.setString(1, step.version());
                ps.setString(2, step.description());
                ps.setString(3, checksum);
                ps.setLong(4, Instant.now().toEpochMilli());
                ps.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new JobStoreException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, safeLimit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
