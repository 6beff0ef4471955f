package io.mycelic.core.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies pending {@link Migration}s, each in its own write transaction together with its
 * ledger row. The ledger is re-read inside that transaction, so concurrent openers of one file
 * apply every migration exactly once.
 */
public final class SchemaMigrator {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaMigrator.class);

    private final Database database;
    private final List<Migration> migrations;
    private final TimestampSource timestamps;

    public SchemaMigrator(Database database, TimestampSource timestamps) {
        this(database, Migrations.all(), timestamps);
    }

    public SchemaMigrator(Database database, List<Migration> migrations, TimestampSource timestamps) {
        this.database = database;
        this.migrations = new ArrayList<>(migrations);
        this.migrations.sort(Comparator.comparingInt(Migration::version));
        this.timestamps = timestamps;
    }

    /**
     * @return number of migrations applied by this call
     */
    public int migrate() {
        database.write("create migration ledger", connection -> {
            try (Statement statement = connection.createStatement()) {
                statement.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version INTEGER PRIMARY KEY,
                        description TEXT NOT NULL,
                        applied_at TEXT NOT NULL
                    )
                    """);
            }
            return null;
        });

        int applied = 0;
        for (Migration migration : migrations) {
            boolean ran = database.write("apply migration " + migration.version(), connection -> {
                if (isApplied(connection, migration.version())) {
                    return false;
                }
                try (Statement statement = connection.createStatement()) {
                    for (String sql : migration.statements()) {
                        statement.execute(sql);
                    }
                }
                try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT INTO schema_migrations (version, description, applied_at) VALUES (?, ?, ?)")) {
                    insert.setInt(1, migration.version());
                    insert.setString(2, migration.description());
                    insert.setString(3, Timestamps.format(timestamps.next()));
                    insert.executeUpdate();
                }
                return true;
            });
            if (ran) {
                applied++;
                LOG.info("Applied schema migration {} ({})", migration.version(), migration.description());
            }
        }
        return applied;
    }

    public List<Integer> appliedVersions() {
        return database.read("list applied migrations", connection -> {
            List<Integer> versions = new ArrayList<>();
            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery("SELECT version FROM schema_migrations ORDER BY version")) {
                while (rs.next()) {
                    versions.add(rs.getInt(1));
                }
            }
            return versions;
        });
    }

    private boolean isApplied(Connection connection, int version) throws SQLException {
        try (PreparedStatement query = connection.prepareStatement("SELECT 1 FROM schema_migrations WHERE version = ?")) {
            query.setInt(1, version);
            try (ResultSet rs = query.executeQuery()) {
                return rs.next();
            }
        }
    }
}
