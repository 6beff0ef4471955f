package io.mycelic.core.search;

import io.mycelic.core.db.Database;
import io.mycelic.core.db.Timestamps;
import io.mycelic.core.error.ValidationException;
import io.mycelic.core.memory.MemoryRepository;
import java.util.ArrayList;
import java.util.List;

public final class DateRangeSearchHandler implements SearchHandler {
    private final Database database;
    private final MemoryRepository memories;

    public DateRangeSearchHandler(Database database, MemoryRepository memories) {
        this.database = database;
        this.memories = memories;
    }

    @Override
    public SearchMode mode() {
        return SearchMode.DATE_RANGE;
    }

    @Override
    public List<ScoredResult> candidates(SearchRequest request, int candidateLimit) {
        if (request.start() == null && request.end() == null) {
            throw new ValidationException("date range search needs a start or an end");
        }
        if (request.start() != null && request.end() != null && request.start().isAfter(request.end())) {
            throw new ValidationException("start must not be after end");
        }

        StringBuilder sql = new StringBuilder("SELECT ").append(MemoryRepository.COLUMNS).append(" FROM memories m WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (request.start() != null) {
            sql.append(" AND m.created_at >= ?");
            params.add(Timestamps.format(request.start()));
        }
        if (request.end() != null) {
            sql.append(" AND m.created_at <= ?");
            params.add(Timestamps.format(request.end()));
        }
        sql.append(" ORDER BY m.created_at DESC LIMIT ?");
        params.add(candidateLimit);

        return database.read("date range search", connection -> memories.query(connection, sql.toString(), params)
            .stream()
            .map(memory -> new ScoredResult(memory, 1.0, MatchType.DATE_RANGE))
            .toList());
    }
}
