package io.mycelic.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mycelic.core.category.CategoryRepository;
import io.mycelic.core.category.CategoryService;
import io.mycelic.core.config.ConfigPaths;
import io.mycelic.core.config.model.MycelicConfig;
import io.mycelic.core.db.Database;
import io.mycelic.core.db.SchemaMigrator;
import io.mycelic.core.db.TimestampSource;
import io.mycelic.core.domain.DomainRepository;
import io.mycelic.core.domain.DomainService;
import io.mycelic.core.embedding.EmbeddingAdapter;
import io.mycelic.core.embedding.EmbeddingAdapters;
import io.mycelic.core.embedding.VectorMetadataRepository;
import io.mycelic.core.graph.RelationshipRepository;
import io.mycelic.core.graph.RelationshipService;
import io.mycelic.core.json.Json;
import io.mycelic.core.memory.MemoryChunker;
import io.mycelic.core.memory.MemoryRepository;
import io.mycelic.core.memory.MemoryService;
import io.mycelic.core.search.DateRangeSearchHandler;
import io.mycelic.core.search.HybridSearchHandler;
import io.mycelic.core.search.HybridWeights;
import io.mycelic.core.search.KeywordSearchHandler;
import io.mycelic.core.search.SearchDispatcher;
import io.mycelic.core.search.SemanticSearchHandler;
import io.mycelic.core.search.TagSearchHandler;
import io.mycelic.core.session.SessionRepository;
import io.mycelic.core.session.SessionService;
import io.mycelic.core.stats.StatsService;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for every front end: opens the database, applies migrations and wires the
 * services together.
 */
public final class MemoryEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryEngine.class);

    private final MycelicConfig config;
    private final Database database;
    private final EmbeddingAdapter embeddings;
    private final ExecutorService searchExecutor;
    private final MemoryService memories;
    private final SearchDispatcher search;
    private final RelationshipService relationships;
    private final CategoryService categories;
    private final DomainService domains;
    private final SessionService sessions;
    private final StatsService stats;

    private MemoryEngine(MycelicConfig config, Path dbPath, EmbeddingAdapter embeddings) {
        this.config = config;
        this.embeddings = embeddings;
        this.database = new Database(dbPath, config.database().busyTimeoutMillis());

        TimestampSource timestamps = new TimestampSource();
        int applied = new SchemaMigrator(database, timestamps).migrate();
        LOG.info("Opened memory database {} ({} migrations applied)", database.path(), applied);

        ObjectMapper mapper = Json.mapper();
        MemoryRepository memoryRepository = new MemoryRepository(mapper);
        VectorMetadataRepository vectorRepository = new VectorMetadataRepository();
        DomainRepository domainRepository = new DomainRepository();
        SessionRepository sessionRepository = new SessionRepository();
        RelationshipRepository relationshipRepository = new RelationshipRepository();
        CategoryRepository categoryRepository = new CategoryRepository();

        this.searchExecutor = Executors.newFixedThreadPool(
            Math.max(2, config.search().workerThreads()),
            searchThreads()
        );

        this.memories = new MemoryService(database, timestamps, embeddings, memoryRepository, vectorRepository,
            domainRepository, sessionRepository, new MemoryChunker(config.chunking()));
        KeywordSearchHandler keyword = new KeywordSearchHandler(database, memoryRepository);
        SemanticSearchHandler semantic = new SemanticSearchHandler(database, memoryRepository, embeddings);
        this.search = new SearchDispatcher(List.of(
            keyword,
            new TagSearchHandler(database, memoryRepository),
            new DateRangeSearchHandler(database, memoryRepository),
            semantic,
            new HybridSearchHandler(keyword, semantic, HybridWeights.from(config.search().hybrid()), searchExecutor)
        ), config.search());
        this.relationships = new RelationshipService(database, timestamps, embeddings, memoryRepository, relationshipRepository);
        this.categories = new CategoryService(database, timestamps, categoryRepository, memoryRepository);
        this.domains = new DomainService(database, timestamps, domainRepository);
        this.sessions = new SessionService(database, timestamps, sessionRepository);
        this.stats = new StatsService(database, relationshipRepository, sessionRepository, domainRepository,
            categoryRepository, vectorRepository);
    }

    public static MemoryEngine open(MycelicConfig config) {
        return open(config, EmbeddingAdapters.fromConfig(config.embedding()));
    }

    public static MemoryEngine open(MycelicConfig config, EmbeddingAdapter embeddings) {
        return new MemoryEngine(config, ConfigPaths.resolve(config.database().path()), embeddings);
    }

    public static MemoryEngine open(Path dbPath, EmbeddingAdapter embeddings) {
        return new MemoryEngine(MycelicConfig.defaults(), dbPath, embeddings);
    }

    public MycelicConfig config() {
        return config;
    }

    public Path databasePath() {
        return database.path();
    }

    public EmbeddingAdapter embeddings() {
        return embeddings;
    }

    public MemoryService memories() {
        return memories;
    }

    public SearchDispatcher search() {
        return search;
    }

    public RelationshipService relationships() {
        return relationships;
    }

    public CategoryService categories() {
        return categories;
    }

    public DomainService domains() {
        return domains;
    }

    public SessionService sessions() {
        return sessions;
    }

    public StatsService stats() {
        return stats;
    }

    @Override
    public void close() {
        searchExecutor.shutdown();
        try {
            if (!searchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                searchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            searchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.debug("Closed memory engine for {}", database.path());
    }

    private static ThreadFactory searchThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "mycelic-search-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
