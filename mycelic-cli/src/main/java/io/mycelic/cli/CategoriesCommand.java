package io.mycelic.cli;

import io.mycelic.core.MemoryEngine;
import io.mycelic.core.category.CategoryQuery;
import java.util.Map;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "categories", description = "List categories, or manage them with a subcommand")
public final class CategoriesCommand extends EngineCommand {

    @Option(names = "--parent", description = "Only children of this category")
    String parentId;

    @Option(names = "--roots", description = "Only top-level categories")
    boolean rootsOnly;

    public CategoriesCommand(CliContext context) {
        super(context);
    }

    static CommandLine commandLine(CliContext context) {
        return new CommandLine(new CategoriesCommand(context))
            .addSubcommand("create", new Create(context))
            .addSubcommand("assign", new Assign(context))
            .addSubcommand("members", new Members(context))
            .addSubcommand("of", new Of(context))
            .addSubcommand("delete", new Delete(context));
    }

    @Override
    protected String label() {
        return "Categories";
    }

    @Override
    protected Object run(MemoryEngine engine) {
        return engine.categories().list(new CategoryQuery(parentId, rootsOnly));
    }

    @Command(name = "create", description = "Create a category")
    static final class Create extends EngineCommand {
        @Parameters(index = "0")
        String name;

        @Option(names = "--description")
        String description;

        @Option(names = "--parent")
        String parentId;

        @Option(names = "--threshold", description = "Confidence threshold (default 0.7)")
        Double threshold;

        Create(CliContext context) {
            super(context);
        }

        @Override
        protected String label() {
            return "Create category";
        }

        @Override
        protected Object run(MemoryEngine engine) {
            return engine.categories().create(name, description, parentId, threshold);
        }
    }

    @Command(name = "assign", description = "Put a memory into a category")
    static final class Assign extends EngineCommand {
        @Parameters(index = "0", description = "Memory id")
        String memoryId;

        @Parameters(index = "1", description = "Category id")
        String categoryId;

        @Option(names = "--confidence", defaultValue = "1.0")
        double confidence;

        @Option(names = "--reasoning")
        String reasoning;

        Assign(CliContext context) {
            super(context);
        }

        @Override
        protected String label() {
            return "Assign category";
        }

        @Override
        protected Object run(MemoryEngine engine) {
            return engine.categories().categorize(memoryId, categoryId, confidence, reasoning);
        }
    }

    @Command(name = "members", description = "Memories in a category")
    static final class Members extends EngineCommand {
        @Parameters(index = "0", description = "Category id")
        String categoryId;

        Members(CliContext context) {
            super(context);
        }

        @Override
        protected String label() {
            return "Category members";
        }

        @Override
        protected Object run(MemoryEngine engine) {
            return engine.categories().memoriesIn(categoryId);
        }
    }

    @Command(name = "of", description = "Categories a memory belongs to")
    static final class Of extends EngineCommand {
        @Parameters(index = "0", description = "Memory id")
        String memoryId;

        Of(CliContext context) {
            super(context);
        }

        @Override
        protected String label() {
            return "Memory categories";
        }

        @Override
        protected Object run(MemoryEngine engine) {
            return engine.categories().categoriesOf(memoryId);
        }
    }

    @Command(name = "delete", description = "Delete a category; memories stay")
    static final class Delete extends EngineCommand {
        @Parameters(index = "0", description = "Category id")
        String categoryId;

        Delete(CliContext context) {
            super(context);
        }

        @Override
        protected String label() {
            return "Delete category";
        }

        @Override
        protected Object run(MemoryEngine engine) {
            engine.categories().delete(categoryId);
            return Map.of("deleted", categoryId);
        }
    }
}
