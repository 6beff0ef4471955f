package io.mycelic.core.memory;

import io.mycelic.core.db.Database;
import io.mycelic.core.db.TimestampSource;
import io.mycelic.core.domain.Domain;
import io.mycelic.core.domain.DomainRepository;
import io.mycelic.core.embedding.EmbeddingAdapter;
import io.mycelic.core.embedding.VectorMetadataRepository;
import io.mycelic.core.embedding.Vectors;
import io.mycelic.core.error.ConstraintException;
import io.mycelic.core.error.DependencyUnavailableException;
import io.mycelic.core.error.NotFoundException;
import io.mycelic.core.error.ValidationException;
import io.mycelic.core.session.SessionRepository;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Create, read, update and delete for memories.
 *
 * <p>Embeddings are computed before a write transaction is opened; an unreachable embedding
 * backend never blocks a write, the memory is simply stored without a vector.
 *
 * <p>Long content is additionally split into chunk memories linked to the stored memory. The
 * parent keeps the full content; chunks are written in the same transaction as the parent.
 */
public final class MemoryService {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryService.class);

    private final Database database;
    private final TimestampSource timestamps;
    private final EmbeddingAdapter embeddings;
    private final MemoryRepository memories;
    private final VectorMetadataRepository vectors;
    private final DomainRepository domains;
    private final SessionRepository sessions;
    private final MemoryChunker chunker;

    public MemoryService(
        Database database,
        TimestampSource timestamps,
        EmbeddingAdapter embeddings,
        MemoryRepository memories,
        VectorMetadataRepository vectors,
        DomainRepository domains,
        SessionRepository sessions,
        MemoryChunker chunker
    ) {
        this.database = database;
        this.timestamps = timestamps;
        this.embeddings = embeddings;
        this.memories = memories;
        this.vectors = vectors;
        this.domains = domains;
        this.sessions = sessions;
        this.chunker = chunker;
    }

    public Memory create(MemoryDraft draft) {
        if (draft == null) {
            throw new ValidationException("memory must not be null");
        }
        String content = requireContent(draft.content());
        int importance = draft.importance() == null ? 5 : requireImportance(draft.importance());
        String sessionId = requireSessionId(draft.sessionId());
        List<String> tags = TagNormalizer.normalize(draft.tags());
        String slug = blankToNull(draft.slug());
        AgentType agentType = draft.agentType() == null ? AgentType.UNKNOWN : draft.agentType();
        AccessScope scope = draft.accessScope() == null ? AccessScope.SESSION : draft.accessScope();

        float[] vector = embedQuietly(content);
        List<EmbeddedChunk> chunks = embedChunks(content);
        Instant now = timestamps.next();

        Memory stored = database.write("store memory", connection -> {
            if (slug != null && memories.findBySlug(connection, slug).isPresent()) {
                throw new ConstraintException("Slug already in use: " + slug);
            }
            String domain = touchDomain(connection, blankToNull(draft.domain()), now);
            sessions.touch(connection, sessionId, agentType, blankToNull(draft.agentContext()), now);

            Memory memory = new Memory(
                UUID.randomUUID().toString(),
                content,
                importance,
                tags,
                domain,
                blankToNull(draft.source()),
                sessionId,
                agentType,
                blankToNull(draft.agentContext()),
                scope,
                slug,
                null,
                0,
                0,
                vector != null,
                now,
                now
            );
            insertWithVector(connection, memory, vector, now);
            insertChunks(connection, memory, chunks, now);
            return memory;
        });
        LOG.debug("Stored memory {} in session {} with {} chunks", stored.id(), sessionId, chunks.size());
        return stored;
    }

    public Memory get(String id) {
        requireId(id);
        return database.read("load memory", connection -> memories.findById(connection, id))
            .orElseThrow(() -> new NotFoundException("Memory not found: " + id));
    }

    public Memory getBySlug(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new ValidationException("slug must not be blank");
        }
        return database.read("load memory by slug", connection -> memories.findBySlug(connection, slug.trim()))
            .orElseThrow(() -> new NotFoundException("Memory not found for slug: " + slug));
    }

    public Memory update(String id, MemoryUpdate update) {
        requireId(id);
        if (update == null || update.isEmpty()) {
            throw new ValidationException("update must change at least one field");
        }
        String content = update.content() == null ? null : requireContent(update.content());
        if (update.importance() != null) {
            requireImportance(update.importance());
        }

        float[] vector = content == null ? null : embedQuietly(content);
        List<EmbeddedChunk> chunks = content == null ? List.of() : embedChunks(content);
        Instant now = timestamps.next();

        return database.write("update memory", connection -> {
            Memory existing = memories.findById(connection, id)
                .orElseThrow(() -> new NotFoundException("Memory not found: " + id));

            String domain = existing.domain();
            if (update.domain() != null) {
                domain = blankToNull(update.domain());
            }
            domain = touchDomain(connection, domain, now);
            boolean contentChanged = content != null && !content.equals(existing.content());
            boolean embedded = contentChanged ? vector != null : existing.embedded();

            Memory updated = new Memory(
                existing.id(),
                content == null ? existing.content() : content,
                update.importance() == null ? existing.importance() : update.importance(),
                update.tags() == null ? existing.tags() : TagNormalizer.normalize(update.tags()),
                domain,
                update.source() == null ? existing.source() : blankToNull(update.source()),
                existing.sessionId(),
                existing.agentType(),
                existing.agentContext(),
                existing.accessScope(),
                existing.slug(),
                existing.parentMemoryId(),
                existing.chunkLevel(),
                existing.chunkIndex(),
                embedded,
                existing.createdAt(),
                now
            );
            memories.update(connection, updated);
            if (contentChanged) {
                memories.updateEmbedding(connection, id, vector == null ? null : Vectors.encode(vector));
                if (vector == null) {
                    vectors.delete(connection, id);
                } else {
                    vectors.upsert(connection, id, embeddings.model(), vector.length, now);
                }
            }
            if (existing.parentMemoryId() == null) {
                if (contentChanged) {
                    int removed = memories.deleteChunks(connection, id);
                    insertChunks(connection, updated, chunks, now);
                    LOG.debug("Re-chunked memory {}: {} chunks replaced by {}", id, removed, chunks.size());
                } else {
                    memories.updateChunkMetadata(connection, updated);
                }
            }
            sessions.touch(connection, existing.sessionId(), existing.agentType(), null, now);
            return updated;
        });
    }

    public void delete(String id) {
        requireId(id);
        boolean removed = database.write("delete memory", connection -> memories.delete(connection, id));
        if (!removed) {
            throw new NotFoundException("Memory not found: " + id);
        }
        LOG.debug("Deleted memory {}", id);
    }

    public List<Memory> list(MemoryQuery query) {
        MemoryQuery effective = query == null ? MemoryQuery.all() : query;
        if (effective.offset() != null && effective.offset() < 0) {
            throw new ValidationException("offset must not be negative");
        }
        if (effective.minImportance() != null) {
            requireImportance(effective.minImportance());
        }
        if (effective.maxImportance() != null) {
            requireImportance(effective.maxImportance());
        }
        return database.read("list memories", connection -> memories.list(connection, effective));
    }

    /**
     * Chunks of a memory in order; empty when the memory was short enough to store whole.
     */
    public List<Memory> chunks(String parentId) {
        requireId(parentId);
        return database.read("list memory chunks", connection -> {
            if (!memories.exists(connection, parentId)) {
                throw new NotFoundException("Memory not found: " + parentId);
            }
            return memories.chunks(connection, parentId);
        });
    }

    public long count() {
        return database.read("count memories", memories::count);
    }

    /**
     * Embeds memories that were stored while the embedding backend was unavailable.
     *
     * @return number of memories that received a vector
     */
    public int reindexMissingEmbeddings(int limit) {
        if (!embeddings.isAvailable()) {
            throw new DependencyUnavailableException("Embedding adapter is not available");
        }
        int batch = limit <= 0 ? MemoryQuery.DEFAULT_LIMIT : Math.min(limit, MemoryQuery.MAX_LIMIT);
        List<Memory> pending = database.read("list memories without embeddings",
            connection -> memories.withoutEmbedding(connection, batch));

        int indexed = 0;
        for (Memory memory : pending) {
            float[] vector = embeddings.embed(memory.content());
            Instant now = timestamps.next();
            boolean written = database.write("store embedding", connection -> {
                Optional<Memory> current = memories.findById(connection, memory.id());
                if (current.isEmpty() || current.get().embedded() || !current.get().content().equals(memory.content())) {
                    return false;
                }
                memories.updateEmbedding(connection, memory.id(), Vectors.encode(vector));
                vectors.upsert(connection, memory.id(), embeddings.model(), vector.length, now);
                return true;
            });
            if (written) {
                indexed++;
            }
        }
        LOG.info("Embedded {} of {} memories without vectors", indexed, pending.size());
        return indexed;
    }

    private String touchDomain(Connection connection, String name, Instant now) throws SQLException {
        if (name == null) {
            return null;
        }
        Domain domain = domains.ensure(connection, name, null, now);
        domains.touch(connection, domain.id(), now);
        return domain.name();
    }

    private void insertWithVector(Connection connection, Memory memory, float[] vector, Instant now) throws SQLException {
        memories.insert(connection, memory, vector == null ? null : Vectors.encode(vector));
        if (vector != null) {
            vectors.upsert(connection, memory.id(), embeddings.model(), vector.length, now);
        }
    }

    private void insertChunks(Connection connection, Memory parent, List<EmbeddedChunk> chunks, Instant now)
        throws SQLException {
        for (EmbeddedChunk chunk : chunks) {
            Memory child = new Memory(
                UUID.randomUUID().toString(),
                chunk.chunk().content(),
                parent.importance(),
                parent.tags(),
                parent.domain(),
                parent.source(),
                parent.sessionId(),
                parent.agentType(),
                parent.agentContext(),
                parent.accessScope(),
                null,
                parent.id(),
                chunk.chunk().level(),
                chunk.chunk().index(),
                chunk.vector() != null,
                now,
                now
            );
            insertWithVector(connection, child, chunk.vector(), now);
        }
    }

    private List<EmbeddedChunk> embedChunks(String content) {
        List<EmbeddedChunk> out = new ArrayList<>();
        for (MemoryChunk chunk : chunker.chunk(content)) {
            out.add(new EmbeddedChunk(chunk, embedQuietly(chunk.content())));
        }
        return out;
    }

    private float[] embedQuietly(String content) {
        if (!embeddings.isAvailable()) {
            LOG.debug("Embedding adapter unavailable, storing memory without a vector");
            return null;
        }
        try {
            return embeddings.embed(content);
        } catch (DependencyUnavailableException e) {
            LOG.warn("Embedding failed, storing memory without a vector: {}", e.getMessage());
            return null;
        }
    }

    static String requireContent(String content) {
        String trimmed = content == null ? "" : content.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("content must not be blank");
        }
        return trimmed;
    }

    static int requireImportance(int importance) {
        if (importance < 1 || importance > 10) {
            throw new ValidationException("importance must be between 1 and 10, got " + importance);
        }
        return importance;
    }

    private static String requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("sessionId must not be blank");
        }
        return sessionId.trim();
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("id must not be blank");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private record EmbeddedChunk(MemoryChunk chunk, float[] vector) {
    }
}
