package io.mycelic.core.domain;

import io.mycelic.core.db.Database;
import io.mycelic.core.db.Timestamps;
import io.mycelic.core.db.TimestampSource;
import io.mycelic.core.error.NotFoundException;
import io.mycelic.core.error.ValidationException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.List;

public final class DomainService {
    private final Database database;
    private final TimestampSource timestamps;
    private final DomainRepository domains;

    public DomainService(Database database, TimestampSource timestamps, DomainRepository domains) {
        this.database = database;
        this.timestamps = timestamps;
        this.domains = domains;
    }

    /**
     * Idempotent by name: creating an existing domain returns the stored one unchanged.
     */
    public Domain create(String name, String description) {
        String trimmed = requireName(name);
        String text = description == null || description.isBlank() ? null : description.trim();
        return database.write("create domain", connection -> domains.ensure(connection, trimmed, text, timestamps.next()));
    }

    public List<Domain> list() {
        return database.read("list domains", domains::list);
    }

    public Domain get(String name) {
        String trimmed = requireName(name);
        return database.read("load domain", connection -> domains.findByName(connection, trimmed))
            .orElseThrow(() -> new NotFoundException("Domain not found: " + trimmed));
    }

    public DomainStats stats(String name) {
        String trimmed = requireName(name);
        return database.read("domain stats", connection -> {
            Domain domain = domains.findByName(connection, trimmed)
                .orElseThrow(() -> new NotFoundException("Domain not found: " + trimmed));
            try (PreparedStatement statement = connection.prepareStatement("""
                SELECT COUNT(*), COALESCE(AVG(importance), 0), MAX(created_at)
                FROM memories
                WHERE domain = ? COLLATE NOCASE
                """)) {
                statement.setString(1, domain.name());
                try (ResultSet rs = statement.executeQuery()) {
                    rs.next();
                    return new DomainStats(
                        domain.name(),
                        domain.description(),
                        rs.getLong(1),
                        rs.getDouble(2),
                        domain.createdAt(),
                        domain.updatedAt(),
                        Timestamps.parse(rs.getString(3))
                    );
                }
            }
        });
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("domain name must not be blank");
        }
        return name.trim();
    }
}
