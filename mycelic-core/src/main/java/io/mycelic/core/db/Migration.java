package io.mycelic.core.db;

import java.util.List;

/**
 * One schema step. Statements run one by one, in order, inside the migration's transaction.
 */
public record Migration(int version, String description, List<String> statements) {

    public Migration {
        if (version <= 0) {
            throw new IllegalArgumentException("version must be positive");
        }
        statements = List.copyOf(statements);
    }
}
