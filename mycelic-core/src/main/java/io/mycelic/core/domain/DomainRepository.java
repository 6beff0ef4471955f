package io.mycelic.core.domain;

import io.mycelic.core.db.Timestamps;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public final class DomainRepository {

    /**
     * Returns the domain with this name (case-insensitive), creating it first when absent.
     * Must run inside a write transaction.
     */
    public Domain ensure(Connection connection, String name, String description, Instant now) throws SQLException {
        Optional<Domain> existing = findByName(connection, name);
        if (existing.isPresent()) {
            return existing.get();
        }
        Domain created = new Domain(UUID.randomUUID().toString(), name, description, now, now);
        try (PreparedStatement statement = connection.prepareStatement(
            "INSERT INTO domains (id, name, description, created_at, updated_at) VALUES (?, ?, ?, ?, ?)")) {
            statement.setString(1, created.id());
            statement.setString(2, created.name());
            statement.setString(3, created.description());
            statement.setString(4, Timestamps.format(now));
            statement.setString(5, Timestamps.format(now));
            statement.executeUpdate();
        }
        return created;
    }

    public void touch(Connection connection, String id, Instant now) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("UPDATE domains SET updated_at = ? WHERE id = ?")) {
            statement.setString(1, Timestamps.format(now));
            statement.setString(2, id);
            statement.executeUpdate();
        }
    }

    public Optional<Domain> findByName(Connection connection, String name) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT id, name, description, created_at, updated_at FROM domains WHERE name = ?")) {
            statement.setString(1, name);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    public List<Domain> list(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT id, name, description, created_at, updated_at FROM domains ORDER BY name COLLATE NOCASE");
             ResultSet rs = statement.executeQuery()) {
            List<Domain> domains = new ArrayList<>();
            while (rs.next()) {
                domains.add(map(rs));
            }
            return domains;
        }
    }

    public long count(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM domains");
             ResultSet rs = statement.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private Domain map(ResultSet rs) throws SQLException {
        return new Domain(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("description"),
            Timestamps.parse(rs.getString("created_at")),
            Timestamps.parse(rs.getString("updated_at"))
        );
    }
}
