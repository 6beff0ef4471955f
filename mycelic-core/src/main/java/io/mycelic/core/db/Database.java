package io.mycelic.core.db;

import io.mycelic.core.error.ConstraintException;
import io.mycelic.core.error.MemoryEngineException;
import io.mycelic.core.error.StorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * SQLite access with one connection per unit of work.
 *
 * <p>Writers open {@code BEGIN IMMEDIATE} transactions so SQLite serializes them at the file
 * lock; readers run inside a deferred transaction so that every query of one unit sees the same
 * WAL snapshot.
 */
public final class Database {
    private static final Logger LOG = LoggerFactory.getLogger(Database.class);
    private static final int SQLITE_CONSTRAINT = 19;

    private final Path path;
    private final String jdbcUrl;
    private final Properties readerProperties;
    private final Properties writerProperties;

    public Database(Path dbPath, int busyTimeoutMillis) {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        this.path = dbPath.toAbsolutePath();
        try {
            Files.createDirectories(path.getParent());
        } catch (IOException e) {
            throw new StorageException("Failed to create database directory " + path.getParent(), e);
        }
        this.jdbcUrl = "jdbc:sqlite:" + path;
        this.readerProperties = connectionConfig(busyTimeoutMillis, SQLiteConfig.TransactionMode.DEFERRED).toProperties();
        this.writerProperties = connectionConfig(busyTimeoutMillis, SQLiteConfig.TransactionMode.IMMEDIATE).toProperties();
    }

    public Path path() {
        return path;
    }

    public <T> T write(String operation, SqlWork<T> work) {
        try {
            return inTransaction(writerProperties, work);
        } catch (SQLException e) {
            throw translate(operation, e);
        }
    }

    public <T> T read(String operation, SqlWork<T> work) {
        try {
            return inTransaction(readerProperties, work);
        } catch (SQLException first) {
            if (isConstraintViolation(first)) {
                throw translate(operation, first);
            }
            LOG.debug("Retrying read '{}' after storage error: {}", operation, first.getMessage());
            try {
                return inTransaction(readerProperties, work);
            } catch (SQLException second) {
                second.addSuppressed(first);
                throw translate(operation, second);
            }
        }
    }

    private <T> T inTransaction(Properties properties, SqlWork<T> work) throws SQLException {
        try (Connection connection = DriverManager.getConnection(jdbcUrl, properties)) {
            connection.setAutoCommit(false);
            try {
                T result = work.run(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(connection, e);
                throw e;
            }
        }
    }

    private void rollbackQuietly(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private MemoryEngineException translate(String operation, SQLException e) {
        if (isConstraintViolation(e)) {
            return new ConstraintException(operation + " violates a constraint: " + e.getMessage(), e);
        }
        return new StorageException("Failed to " + operation, e);
    }

    static boolean isConstraintViolation(SQLException e) {
        if ((e.getErrorCode() & 0xFF) == SQLITE_CONSTRAINT) {
            return true;
        }
        String message = e.getMessage();
        return message != null && message.contains("CONSTRAINT");
    }

    private static SQLiteConfig connectionConfig(int busyTimeoutMillis, SQLiteConfig.TransactionMode mode) {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(busyTimeoutMillis);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setTransactionMode(mode);
        return config;
    }
}
