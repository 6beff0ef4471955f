package io.mycelic.core.category;

import io.mycelic.core.db.Database;
import io.mycelic.core.db.TimestampSource;
import io.mycelic.core.error.ConstraintException;
import io.mycelic.core.error.NotFoundException;
import io.mycelic.core.error.ValidationException;
import io.mycelic.core.memory.Memory;
import io.mycelic.core.memory.MemoryRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public final class CategoryService {
    private static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;

    private final Database database;
    private final TimestampSource timestamps;
    private final CategoryRepository categories;
    private final MemoryRepository memories;

    public CategoryService(Database database, TimestampSource timestamps, CategoryRepository categories, MemoryRepository memories) {
        this.database = database;
        this.timestamps = timestamps;
        this.categories = categories;
        this.memories = memories;
    }

    public Category create(String name, String description, String parentId, Double confidenceThreshold) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("category name must not be blank");
        }
        double threshold = confidenceThreshold == null
            ? DEFAULT_CONFIDENCE_THRESHOLD
            : requireUnit(confidenceThreshold, "confidenceThreshold");
        String parent = parentId == null || parentId.isBlank() ? null : parentId.trim();
        Category category = new Category(
            UUID.randomUUID().toString(),
            trimmed,
            description,
            parent,
            threshold,
            false,
            timestamps.next()
        );

        return database.write("create category", connection -> {
            if (categories.findByName(connection, trimmed).isPresent()) {
                throw new ConstraintException("Category already exists: " + trimmed);
            }
            if (parent != null && categories.findById(connection, parent).isEmpty()) {
                throw new NotFoundException("Parent category not found: " + parent);
            }
            categories.insert(connection, category);
            return category;
        });
    }

    public Category get(String id) {
        requireId(id, "categoryId");
        return database.read("load category", connection -> categories.findById(connection, id))
            .orElseThrow(() -> new NotFoundException("Category not found: " + id));
    }

    public List<Category> list(CategoryQuery query) {
        CategoryQuery effective = query == null ? CategoryQuery.all() : query;
        return database.read("list categories", connection -> categories.list(connection, effective));
    }

    /**
     * Children of a deleted category keep existing with no parent.
     */
    public void delete(String id) {
        requireId(id, "categoryId");
        boolean removed = database.write("delete category", connection -> categories.delete(connection, id));
        if (!removed) {
            throw new NotFoundException("Category not found: " + id);
        }
    }

    public Categorization categorize(String memoryId, String categoryId, double confidence, String reasoning) {
        requireId(memoryId, "memoryId");
        requireId(categoryId, "categoryId");
        requireUnit(confidence, "confidence");
        Instant now = timestamps.next();
        String why = reasoning == null || reasoning.isBlank() ? null : reasoning.trim();

        return database.write("categorize memory", connection -> {
            if (!memories.exists(connection, memoryId)) {
                throw new NotFoundException("Memory not found: " + memoryId);
            }
            Category category = categories.findById(connection, categoryId)
                .orElseThrow(() -> new NotFoundException("Category not found: " + categoryId));
            categories.upsertCategorization(connection, memoryId, categoryId, confidence, why, now);
            return new Categorization(memoryId, categoryId, category.name(), confidence, why, now);
        });
    }

    public List<Categorization> categoriesOf(String memoryId) {
        requireId(memoryId, "memoryId");
        return database.read("list categorizations", connection -> {
            if (!memories.exists(connection, memoryId)) {
                throw new NotFoundException("Memory not found: " + memoryId);
            }
            return categories.categorizationsOf(connection, memoryId);
        });
    }

    public List<Memory> memoriesIn(String categoryId) {
        requireId(categoryId, "categoryId");
        return database.read("list category members", connection -> {
            if (categories.findById(connection, categoryId).isEmpty()) {
                throw new NotFoundException("Category not found: " + categoryId);
            }
            List<String> ids = categories.memoryIdsIn(connection, categoryId);
            return new ArrayList<>(memories.findByIds(connection, ids).values());
        });
    }

    private static double requireUnit(double value, String field) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException(field + " must be between 0 and 1, got " + value);
        }
        return value;
    }

    private static void requireId(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " must not be blank");
        }
    }
}
