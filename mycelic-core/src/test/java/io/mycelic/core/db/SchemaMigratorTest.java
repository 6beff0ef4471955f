package io.mycelic.core.db;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mycelic.core.error.StorageException;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchemaMigratorTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldApplyAllMigrationsOnceAndRecordThem() {
        Database database = new Database(tempDir.resolve("db/memory.db"), 5000);
        SchemaMigrator migrator = new SchemaMigrator(database, new TimestampSource());

        assertThat(migrator.migrate()).isEqualTo(5);
        assertThat(migrator.migrate()).isZero();
        assertThat(new SchemaMigrator(database, new TimestampSource()).migrate()).isZero();
        assertThat(migrator.appliedVersions()).containsExactly(1, 2, 3, 4, 5);
    }

    @Test
    void shouldCreateFullTextTableAndTriggers() {
        Database database = new Database(tempDir.resolve("memory.db"), 5000);
        new SchemaMigrator(database, new TimestampSource()).migrate();

        List<String> names = database.read("list schema objects", connection -> {
            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery("SELECT name FROM sqlite_master ORDER BY name")) {
                List<String> out = new java.util.ArrayList<>();
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
                return out;
            }
        });

        assertThat(names).contains(
            "memories", "memories_fts", "memories_fts_insert", "memories_fts_update", "memories_fts_delete",
            "memory_relationships", "categories", "memory_categorizations", "agent_sessions", "domains",
            "vector_metadata", "schema_migrations"
        );
    }

    @Test
    void shouldRollBackFailedMigrationWithoutLedgerRow() {
        Database database = new Database(tempDir.resolve("memory.db"), 5000);
        Migration broken = new Migration(1, "broken", List.of(
            "CREATE TABLE half_done (id TEXT)",
            "THIS IS NOT SQL"
        ));
        SchemaMigrator migrator = new SchemaMigrator(database, List.of(broken), new TimestampSource());

        assertThatThrownBy(migrator::migrate).isInstanceOf(StorageException.class);

        assertThat(migrator.appliedVersions()).isEmpty();
        Boolean tableExists = database.read("check table", connection -> {
            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery("SELECT 1 FROM sqlite_master WHERE name = 'half_done'")) {
                return rs.next();
            }
        });
        assertThat(tableExists).isFalse();
    }
}
