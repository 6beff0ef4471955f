package io.mycelic.core;

import static org.assertj.core.api.Assertions.assertThat;

import io.mycelic.core.db.Database;
import io.mycelic.core.db.SchemaMigrator;
import io.mycelic.core.db.TimestampSource;
import io.mycelic.core.error.NotFoundException;
import io.mycelic.core.memory.Memory;
import io.mycelic.core.memory.MemoryDraft;
import io.mycelic.core.memory.MemoryUpdate;
import io.mycelic.core.memory.StubEmbeddingAdapter;
import io.mycelic.core.search.ScoredResult;
import io.mycelic.core.search.SearchRequest;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MemoryEngineConcurrencyTest {
    private static final int WORKERS = 6;
    private static final int ROUNDS = 20;

    @TempDir
    Path tempDir;

    @Test
    void shouldKeepFullTextIndexInStepUnderParallelWrites() throws Exception {
        Path dbPath = tempDir.resolve("memory.db");
        ExecutorService pool = Executors.newFixedThreadPool(WORKERS);
        try (MemoryEngine engine = MemoryEngine.open(dbPath, new StubEmbeddingAdapter())) {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Integer>> futures = new ArrayList<>();
            for (int w = 0; w < WORKERS; w++) {
                int worker = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    return churn(engine, worker);
                }));
            }
            start.countDown();
            int searchHits = 0;
            for (Future<Integer> future : futures) {
                searchHits += future.get(60, TimeUnit.SECONDS);
            }

            Database database = new Database(dbPath, 5000);
            long indexed = countRows(database, "memories_fts");
            long stored = countRows(database, "memories");
            assertThat(indexed).isEqualTo(stored);
            assertThat(stored).isEqualTo(engine.memories().count());
            assertThat(searchHits).isPositive();

            List<ScoredResult> hits = engine.search().search(SearchRequest.keyword("rollout").withLimit(100));
            assertThat(hits).isNotEmpty();
            for (ScoredResult hit : hits) {
                assertThat(engine.memories().get(hit.memory().id()).content()).contains("rollout");
            }
            assertThat(engine.search().search(SearchRequest.keyword("retired").withLimit(100))).isEmpty();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldApplyMigrationsOnceWhenEnginesOpenTogether() throws Exception {
        Path dbPath = tempDir.resolve("shared.db");
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        Callable<MemoryEngine> opener = () -> {
            start.await();
            return MemoryEngine.open(dbPath, new StubEmbeddingAdapter());
        };
        try {
            Future<MemoryEngine> first = pool.submit(opener);
            Future<MemoryEngine> second = pool.submit(opener);
            start.countDown();

            try (MemoryEngine a = first.get(60, TimeUnit.SECONDS); MemoryEngine b = second.get(60, TimeUnit.SECONDS)) {
                Memory stored = a.memories().create(MemoryDraft.builder("written by the first engine", "s-1").build());
                assertThat(b.memories().get(stored.id()).content()).isEqualTo("written by the first engine");
            }

            Database database = new Database(dbPath, 5000);
            assertThat(new SchemaMigrator(database, new TimestampSource()).appliedVersions())
                .containsExactly(1, 2, 3, 4, 5);
            assertThat(countRows(database, "schema_migrations")).isEqualTo(5);
        } finally {
            pool.shutdownNow();
        }
    }

    private static int churn(MemoryEngine engine, int worker) {
        int hits = 0;
        for (int i = 0; i < ROUNDS; i++) {
            Memory memory = engine.memories().create(
                MemoryDraft.builder("worker " + worker + " rollout note " + i, "s-" + worker).build());
            if (i % 3 == 0) {
                engine.memories().update(memory.id(),
                    MemoryUpdate.content("worker " + worker + " rollout revised " + i));
            }
            if (i % 4 == 0) {
                Memory retired = engine.memories().create(
                    MemoryDraft.builder("worker " + worker + " retired draft " + i, "s-" + worker).build());
                engine.memories().delete(retired.id());
            }
            for (ScoredResult hit : engine.search().search(SearchRequest.keyword("rollout").withLimit(50))) {
                assertThat(hit.memory().content()).contains("rollout");
                try {
                    engine.memories().get(hit.memory().id());
                    hits++;
                } catch (NotFoundException e) {
                    throw new AssertionError("search returned a memory that does not exist: " + hit.memory().id(), e);
                }
            }
        }
        return hits;
    }

    private static long countRows(Database database, String table) {
        return database.read("count " + table, connection -> {
            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM " + table)) {
                rs.next();
                return rs.getLong(1);
            }
        });
    }
}
