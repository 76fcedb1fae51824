package io.blockmon.core.store.embedded;

import io.blockmon.core.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * DDL of the embedded store.
 *
 * <p>The live tables hold the current state of each environment; the
 * {@code *_infos} tables are per-run snapshots used for reporting.
 */
final class Schema {

    private static final Logger log = LoggerFactory.getLogger(Schema.class);

    static final int VERSION = 3;

    private static final List<String> DDL = List.of(
            """
            CREATE TABLE IF NOT EXISTS metadata (
                dataid TEXT PRIMARY KEY,
                data TEXT
            )""",
            """
            CREATE TABLE IF NOT EXISTS environment (
                id INTEGER PRIMARY KEY ASC,
                environment_name TEXT NOT NULL,
                system_packages TEXT,
                runtime_version TEXT,
                UNIQUE (environment_name)
            )""",
            """
            CREATE TABLE IF NOT EXISTS test_execution (
                id INTEGER PRIMARY KEY ASC,
                environment_id INTEGER NOT NULL,
                test_name TEXT NOT NULL,
                duration REAL,
                failed BIT,
                forced BIT,
                FOREIGN KEY (environment_id) REFERENCES environment(id) ON DELETE CASCADE
            )""",
            "CREATE UNIQUE INDEX IF NOT EXISTS test_execution_env_name ON test_execution (environment_id, test_name)",
            """
            CREATE TABLE IF NOT EXISTS file_fp (
                id INTEGER PRIMARY KEY,
                filename TEXT NOT NULL,
                method_checksums BLOB,
                fsha TEXT,
                mtime REAL,
                UNIQUE (filename, fsha, method_checksums)
            )""",
            "CREATE INDEX IF NOT EXISTS file_fp_filename ON file_fp (filename)",
            """
            CREATE TABLE IF NOT EXISTS test_execution_file_fp (
                test_execution_id INTEGER NOT NULL,
                fingerprint_id INTEGER NOT NULL,
                FOREIGN KEY (test_execution_id) REFERENCES test_execution(id) ON DELETE CASCADE
            )""",
            "CREATE INDEX IF NOT EXISTS tef_test ON test_execution_file_fp (test_execution_id)",
            "CREATE INDEX IF NOT EXISTS tef_fingerprint ON test_execution_file_fp (fingerprint_id)",
            """
            CREATE TABLE IF NOT EXISTS file_dependency (
                id INTEGER PRIMARY KEY,
                filename TEXT NOT NULL,
                sha TEXT NOT NULL,
                UNIQUE (filename, sha)
            )""",
            """
            CREATE TABLE IF NOT EXISTS test_execution_file_dependency (
                test_execution_id INTEGER NOT NULL,
                file_dependency_id INTEGER NOT NULL,
                FOREIGN KEY (test_execution_id) REFERENCES test_execution(id) ON DELETE CASCADE,
                FOREIGN KEY (file_dependency_id) REFERENCES file_dependency(id)
            )""",
            "CREATE INDEX IF NOT EXISTS tefd_test ON test_execution_file_dependency (test_execution_id)",
            """
            CREATE TABLE IF NOT EXISTS test_external_dependency (
                id INTEGER PRIMARY KEY,
                test_execution_id INTEGER NOT NULL,
                package_name TEXT NOT NULL,
                FOREIGN KEY (test_execution_id) REFERENCES test_execution(id) ON DELETE CASCADE,
                UNIQUE (test_execution_id, package_name)
            )""",
            "CREATE INDEX IF NOT EXISTS ted_package ON test_external_dependency (package_name)",
            """
            CREATE TABLE IF NOT EXISTS attribute (
                environment_id INTEGER NOT NULL,
                name TEXT NOT NULL,
                value TEXT,
                PRIMARY KEY (environment_id, name)
            )""",
            """
            CREATE TABLE IF NOT EXISTS run_uid (
                id INTEGER PRIMARY KEY,
                environment_id INTEGER NOT NULL,
                repo_run_id TEXT,
                git_head_sha TEXT,
                created TEXT NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS run_infos (
                run_uid INTEGER PRIMARY KEY,
                environment_id INTEGER NOT NULL,
                tests_saved INTEGER,
                tests_all INTEGER,
                run_time_saved REAL,
                run_time_all REAL,
                duration REAL,
                selected BIT,
                FOREIGN KEY (run_uid) REFERENCES run_uid(id) ON DELETE CASCADE
            )""",
            """
            CREATE TABLE IF NOT EXISTS test_infos (
                run_uid INTEGER NOT NULL,
                test_execution_id INTEGER NOT NULL,
                test_name TEXT NOT NULL,
                duration REAL,
                failed BIT,
                forced BIT
            )""",
            "CREATE INDEX IF NOT EXISTS test_infos_run ON test_infos (run_uid)",
            """
            CREATE TABLE IF NOT EXISTS file_fp_infos (
                run_uid INTEGER NOT NULL,
                fingerprint_id INTEGER NOT NULL,
                filename TEXT NOT NULL,
                fsha TEXT,
                method_checksums BLOB
            )""",
            "CREATE INDEX IF NOT EXISTS file_fp_infos_run ON file_fp_infos (run_uid)",
            """
            CREATE TABLE IF NOT EXISTS test_execution_file_fp_infos (
                run_uid INTEGER NOT NULL,
                test_execution_id INTEGER NOT NULL,
                fingerprint_id INTEGER NOT NULL
            )""",
            "CREATE INDEX IF NOT EXISTS tef_infos_run ON test_execution_file_fp_infos (run_uid)"
    );

    private Schema() {
        // utility class
    }

    /**
     * Creates missing tables and checks the stored schema version.
     *
     * @throws StoreException if the file was written by an incompatible version
     */
    static void apply(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            for (String ddl : DDL) {
                st.execute(ddl);
            }
        }
        String stored = null;
        try (PreparedStatement ps = connection.prepareStatement("SELECT data FROM metadata WHERE dataid = 'schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                stored = rs.getString(1);
            }
        }
        if (stored == null) {
            try (PreparedStatement ps = connection.prepareStatement(
                    "INSERT INTO metadata (dataid, data) VALUES ('schema_version', ?)")) {
                ps.setString(1, Integer.toString(VERSION));
                ps.executeUpdate();
            }
            log.debug("Initialised schema version {}", VERSION);
        } else if (!stored.equals(Integer.toString(VERSION))) {
            throw new StoreException("Data file has schema version " + stored + ", expected " + VERSION
                    + ". Delete it to start over.");
        }
    }
}
