package io.mycelic.core.graph;

import io.mycelic.core.db.Database;
import io.mycelic.core.db.TimestampSource;
import io.mycelic.core.embedding.EmbeddingAdapter;
import io.mycelic.core.embedding.Vectors;
import io.mycelic.core.error.DependencyUnavailableException;
import io.mycelic.core.error.NotFoundException;
import io.mycelic.core.error.ValidationException;
import io.mycelic.core.memory.Memory;
import io.mycelic.core.memory.MemoryRepository;
import io.mycelic.core.memory.MemoryVector;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed, weighted edges between memories: creation, neighbourhood lookup, breadth-first graph
 * mapping and similarity-based discovery.
 */
public final class RelationshipService {
    private static final Logger LOG = LoggerFactory.getLogger(RelationshipService.class);
    private static final double DEFAULT_STRENGTH = 0.5;
    private static final int DEFAULT_LIMIT = 10;
    private static final int MAX_LIMIT = 1000;

    private final Database database;
    private final TimestampSource timestamps;
    private final EmbeddingAdapter embeddings;
    private final MemoryRepository memories;
    private final RelationshipRepository relationships;

    public RelationshipService(
        Database database,
        TimestampSource timestamps,
        EmbeddingAdapter embeddings,
        MemoryRepository memories,
        RelationshipRepository relationships
    ) {
        this.database = database;
        this.timestamps = timestamps;
        this.embeddings = embeddings;
        this.memories = memories;
        this.relationships = relationships;
    }

    public Relationship create(RelationshipDraft draft) {
        if (draft == null) {
            throw new ValidationException("relationship must not be null");
        }
        RelationshipType type = RelationshipType.parse(draft.type());
        double strength = draft.strength() == null ? DEFAULT_STRENGTH : requireStrength(draft.strength(), "strength");
        String source = requireId(draft.sourceId(), "sourceId");
        String target = requireId(draft.targetId(), "targetId");
        if (source.equals(target)) {
            throw new ValidationException("a memory cannot be related to itself");
        }
        Relationship relationship = new Relationship(
            UUID.randomUUID().toString(),
            source,
            target,
            type,
            strength,
            blankToNull(draft.context()),
            false,
            timestamps.next()
        );

        database.write("create relationship", connection -> {
            if (!memories.exists(connection, source)) {
                throw new NotFoundException("source memory not found: " + source);
            }
            if (!memories.exists(connection, target)) {
                throw new NotFoundException("target memory not found: " + target);
            }
            relationships.insert(connection, relationship);
            return null;
        });
        LOG.debug("Linked {} -[{}]-> {}", source, type.wire(), target);
        return relationship;
    }

    /**
     * Neighbours over edges in either direction, each listed once at its strongest edge.
     */
    public List<Memory> findRelated(String memoryId, Double minStrength, RelationshipType type, Integer limit) {
        String id = requireId(memoryId, "memoryId");
        double floor = minStrength == null ? 0.0 : requireStrength(minStrength, "minStrength");
        int max = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);

        return database.read("find related memories", connection -> {
            if (!memories.exists(connection, id)) {
                throw new NotFoundException("Memory not found: " + id);
            }
            Map<String, Double> neighbours = relationships.strongestNeighbours(connection, id, floor, type, max);
            return new ArrayList<>(memories.findByIds(connection, neighbours.keySet()).values());
        });
    }

    public List<Relationship> listForMemory(String memoryId) {
        String id = requireId(memoryId, "memoryId");
        return database.read("list relationships", connection -> {
            if (!memories.exists(connection, id)) {
                throw new NotFoundException("Memory not found: " + id);
            }
            return relationships.touching(connection, id, Set.of(), null);
        });
    }

    /**
     * Breadth-first traversal from the root over edges in both directions. The whole traversal
     * reads one snapshot.
     */
    public MemoryGraph mapGraph(GraphQuery query) {
        if (query == null) {
            throw new ValidationException("graph query must not be null");
        }
        String rootId = requireId(query.rootId(), "rootId");
        if (query.minStrength() != null) {
            requireStrength(query.minStrength(), "minStrength");
        }
        int depth = query.effectiveDepth();
        CancellationSignal cancellation = query.cancellation();

        return database.read("map graph", connection -> {
            if (!memories.exists(connection, rootId)) {
                throw new NotFoundException("Memory not found: " + rootId);
            }
            Map<String, Integer> distances = new LinkedHashMap<>();
            Map<String, Relationship> edges = new LinkedHashMap<>();
            Deque<String> queue = new ArrayDeque<>();
            distances.put(rootId, 0);
            queue.add(rootId);
            boolean truncated = false;

            while (!queue.isEmpty()) {
                if (cancellation.isCancelled()) {
                    truncated = true;
                    break;
                }
                String current = queue.poll();
                int distance = distances.get(current);
                for (Relationship edge : relationships.touching(connection, current, query.types(), query.minStrength())) {
                    String neighbour = edge.otherEnd(current);
                    if (distance < depth && !distances.containsKey(neighbour)) {
                        distances.put(neighbour, distance + 1);
                        queue.add(neighbour);
                    }
                    if (distances.containsKey(neighbour)) {
                        edges.putIfAbsent(edge.id(), edge);
                    }
                }
            }

            Map<String, Memory> byId = memories.findByIds(connection, distances.keySet());
            List<GraphNode> nodes = new ArrayList<>();
            for (Map.Entry<String, Integer> entry : distances.entrySet()) {
                Memory memory = byId.get(entry.getKey());
                if (memory != null) {
                    nodes.add(new GraphNode(memory, entry.getValue()));
                }
            }
            if (truncated) {
                LOG.info("Graph traversal from {} cancelled after {} nodes", rootId, nodes.size());
            }
            return new MemoryGraph(rootId, depth, nodes, new ArrayList<>(edges.values()), truncated);
        });
    }

    /**
     * Links unlinked pairs of embedded memories whose cosine similarity reaches
     * {@code minStrength}, strongest pairs first. Running it again on an unchanged corpus adds nothing.
     */
    public List<Relationship> discover(Integer limit, Double minStrength, CancellationSignal cancellation) {
        if (!embeddings.isAvailable()) {
            throw new DependencyUnavailableException("Relationship discovery needs an embedding adapter");
        }
        int max = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        double floor = minStrength == null ? 0.7 : requireStrength(minStrength, "minStrength");
        CancellationSignal signal = cancellation == null ? CancellationSignal.none() : cancellation;

        List<MemoryVector> vectors = database.read("load vectors for discovery",
            connection -> memories.vectors(connection, Integer.MAX_VALUE));
        Set<String> linked = database.read("load linked pairs", relationships::linkedPairs);
        List<Candidate> candidates = strongestPairs(vectors, linked, floor, max, signal);

        List<Relationship> created = new ArrayList<>();
        for (Candidate candidate : candidates) {
            Relationship relationship = new Relationship(
                UUID.randomUUID().toString(),
                candidate.sourceId(),
                candidate.targetId(),
                RelationshipType.SIMILAR,
                Math.min(1.0, candidate.similarity()),
                "discovered by embedding similarity",
                true,
                timestamps.next()
            );
            boolean inserted = database.write("store discovered relationship",
                connection -> relationships.insertIfUnlinked(connection, relationship));
            if (inserted) {
                created.add(relationship);
            }
        }
        LOG.info("Discovered {} relationships among {} embedded memories", created.size(), vectors.size());
        return created;
    }

    /**
     * Best {@code max} unlinked pairs at or above {@code floor}, strongest first. Keeps only a
     * bounded heap and polls {@code signal} once per row, returning what was found so far when
     * cancelled.
     */
    static List<Candidate> strongestPairs(List<MemoryVector> vectors, Set<String> linked, double floor, int max,
                                          CancellationSignal signal) {
        PriorityQueue<Candidate> best = new PriorityQueue<>(max + 1, Comparator.comparingDouble(Candidate::similarity));
        for (int i = 0; i < vectors.size(); i++) {
            if (signal.isCancelled()) {
                LOG.info("Relationship discovery cancelled after scanning {} of {} memories", i, vectors.size());
                break;
            }
            MemoryVector a = vectors.get(i);
            for (int j = i + 1; j < vectors.size(); j++) {
                MemoryVector b = vectors.get(j);
                double similarity = Vectors.cosine(a.vector(), b.vector());
                if (similarity < floor || similarity <= 0.0) {
                    continue;
                }
                if (best.size() == max && similarity <= best.peek().similarity()) {
                    continue;
                }
                if (linked.contains(RelationshipRepository.pairKey(a.memoryId(), b.memoryId()))) {
                    continue;
                }
                best.add(new Candidate(a.memoryId(), b.memoryId(), similarity));
                if (best.size() > max) {
                    best.poll();
                }
            }
        }
        List<Candidate> ordered = new ArrayList<>(best);
        ordered.sort(Comparator.comparingDouble(Candidate::similarity).reversed());
        return ordered;
    }

    public long count() {
        return database.read("count relationships", relationships::count);
    }

    private static double requireStrength(double value, String field) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException(field + " must be between 0 and 1, got " + value);
        }
        return value;
    }

    private static String requireId(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " must not be blank");
        }
        return value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    record Candidate(String sourceId, String targetId, double similarity) {
    }
}
