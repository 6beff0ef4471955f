package io.mycelic.core.db;

import java.util.List;

public final class Migrations {

    private Migrations() {
    }

    public static List<Migration> all() {
        return List.of(coreTables(), graphAndCategories(), vectorMetadata(), fullTextIndex(), memoryChunks());
    }

    private static Migration coreTables() {
        return new Migration(1, "memories, agent sessions and domains", List.of(
            """
            CREATE TABLE IF NOT EXISTS memories (
                id TEXT PRIMARY KEY,
                content TEXT NOT NULL CHECK (length(trim(content)) > 0),
                importance INTEGER NOT NULL DEFAULT 5 CHECK (importance BETWEEN 1 AND 10),
                tags TEXT NOT NULL DEFAULT '[]',
                domain TEXT,
                source TEXT,
                session_id TEXT NOT NULL,
                embedding BLOB,
                agent_type TEXT NOT NULL DEFAULT 'unknown'
                    CHECK (agent_type IN ('desktop-agent', 'code-agent', 'api-caller', 'unknown')),
                agent_context TEXT,
                access_scope TEXT NOT NULL DEFAULT 'session'
                    CHECK (access_scope IN ('session', 'shared', 'global')),
                slug TEXT UNIQUE,
                created_at TEXT NOT NULL,
                updated_at TEXT NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_memories_created_at ON memories(created_at DESC)",
            "CREATE INDEX IF NOT EXISTS idx_memories_session ON memories(session_id)",
            "CREATE INDEX IF NOT EXISTS idx_memories_domain ON memories(domain)",
            "CREATE INDEX IF NOT EXISTS idx_memories_importance ON memories(importance)",
            """
            CREATE TABLE IF NOT EXISTS agent_sessions (
                session_id TEXT PRIMARY KEY,
                agent_type TEXT NOT NULL DEFAULT 'unknown',
                agent_context TEXT,
                created_at TEXT NOT NULL,
                last_accessed TEXT NOT NULL,
                is_active INTEGER NOT NULL DEFAULT 1
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS domains (
                id TEXT PRIMARY KEY,
                name TEXT NOT NULL UNIQUE COLLATE NOCASE,
                description TEXT,
                created_at TEXT NOT NULL,
                updated_at TEXT NOT NULL
            )
            """
        ));
    }

    private static Migration graphAndCategories() {
        return new Migration(2, "relationships, categories and categorizations", List.of(
            """
            CREATE TABLE IF NOT EXISTS memory_relationships (
                id TEXT PRIMARY KEY,
                source_memory_id TEXT NOT NULL REFERENCES memories(id) ON DELETE CASCADE,
                target_memory_id TEXT NOT NULL REFERENCES memories(id) ON DELETE CASCADE,
                relationship_type TEXT NOT NULL CHECK (relationship_type IN
                    ('references', 'contradicts', 'expands', 'similar', 'sequential', 'causes', 'enables')),
                strength REAL NOT NULL CHECK (strength >= 0.0 AND strength <= 1.0),
                context TEXT,
                auto_generated INTEGER NOT NULL DEFAULT 0,
                created_at TEXT NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_relationships_source ON memory_relationships(source_memory_id)",
            "CREATE INDEX IF NOT EXISTS idx_relationships_target ON memory_relationships(target_memory_id)",
            """
            CREATE TABLE IF NOT EXISTS categories (
                id TEXT PRIMARY KEY,
                name TEXT NOT NULL UNIQUE COLLATE NOCASE,
                description TEXT,
                parent_category_id TEXT REFERENCES categories(id) ON DELETE SET NULL,
                confidence_threshold REAL NOT NULL DEFAULT 0.7
                    CHECK (confidence_threshold >= 0.0 AND confidence_threshold <= 1.0),
                auto_generated INTEGER NOT NULL DEFAULT 0,
                created_at TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS memory_categorizations (
                memory_id TEXT NOT NULL REFERENCES memories(id) ON DELETE CASCADE,
                category_id TEXT NOT NULL REFERENCES categories(id) ON DELETE CASCADE,
                confidence REAL NOT NULL CHECK (confidence >= 0.0 AND confidence <= 1.0),
                reasoning TEXT,
                created_at TEXT NOT NULL,
                PRIMARY KEY (memory_id, category_id)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_categorizations_category ON memory_categorizations(category_id)"
        ));
    }

    private static Migration vectorMetadata() {
        return new Migration(3, "vector metadata", List.of(
            """
            CREATE TABLE IF NOT EXISTS vector_metadata (
                memory_id TEXT PRIMARY KEY REFERENCES memories(id) ON DELETE CASCADE,
                vector_index INTEGER NOT NULL UNIQUE,
                embedding_model TEXT NOT NULL,
                embedding_dimension INTEGER NOT NULL,
                last_updated TEXT NOT NULL
            )
            """
        ));
    }

    private static Migration fullTextIndex() {
        String columns = "rowid, content, source, tags, id, session_id, domain, slug";
        return new Migration(4, "full-text index over memories", List.of(
            """
            CREATE VIRTUAL TABLE IF NOT EXISTS memories_fts USING fts5(
                content,
                source,
                tags,
                id UNINDEXED,
                session_id UNINDEXED,
                domain UNINDEXED,
                slug UNINDEXED
            )
            """,
            """
            CREATE TRIGGER IF NOT EXISTS memories_fts_insert AFTER INSERT ON memories BEGIN
                INSERT INTO memories_fts (%s)
                VALUES (new.rowid, new.content, new.source, new.tags, new.id, new.session_id, new.domain, new.slug);
            END
            """.formatted(columns),
            """
            CREATE TRIGGER IF NOT EXISTS memories_fts_update AFTER UPDATE ON memories BEGIN
                DELETE FROM memories_fts WHERE rowid = old.rowid;
                INSERT INTO memories_fts (%s)
                VALUES (new.rowid, new.content, new.source, new.tags, new.id, new.session_id, new.domain, new.slug);
            END
            """.formatted(columns),
            """
            CREATE TRIGGER IF NOT EXISTS memories_fts_delete AFTER DELETE ON memories BEGIN
                DELETE FROM memories_fts WHERE rowid = old.rowid;
            END
            """,
            """
            INSERT INTO memories_fts (%s)
            SELECT rowid, content, source, tags, id, session_id, domain, slug FROM memories
            """.formatted(columns)
        ));
    }

    private static Migration memoryChunks() {
        return new Migration(5, "parent links for chunked memories", List.of(
            "ALTER TABLE memories ADD COLUMN parent_memory_id TEXT REFERENCES memories(id) ON DELETE CASCADE",
            "ALTER TABLE memories ADD COLUMN chunk_level INTEGER NOT NULL DEFAULT 0",
            "ALTER TABLE memories ADD COLUMN chunk_index INTEGER NOT NULL DEFAULT 0",
            "CREATE INDEX IF NOT EXISTS idx_memories_parent ON memories(parent_memory_id)"
        ));
    }
}
