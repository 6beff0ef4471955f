package io.mycelic.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.error.MemoryEngineException;
import io.mycelic.core.json.Json;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Opens the engine, runs one operation and prints its result as JSON. Engine errors print
 * "{@code <command> failed: <message>}" on stderr and exit with the code for their kind.
 */
abstract class EngineCommand implements Callable<Integer> {
    static final ObjectMapper MAPPER = Json.wireMapper();

    protected final CliContext context;

    EngineCommand(CliContext context) {
        this.context = context;
    }

    protected abstract String label();

    protected abstract Object run(MemoryEngine engine) throws Exception;

    @Override
    public Integer call() {
        try (MemoryEngine engine = context.openEngine()) {
            print(run(engine));
            return 0;
        } catch (MemoryEngineException e) {
            System.err.println(label() + " failed: " + e.getMessage());
            return ExitCodes.of(e.kind());
        } catch (Exception e) {
            System.err.println(label() + " failed: " + e.getMessage());
            return 1;
        }
    }

    static void print(Object value) throws Exception {
        System.out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }

    static ObjectNode args() {
        return MAPPER.createObjectNode();
    }

    static void put(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    static void put(ObjectNode node, String field, Integer value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    static void put(ObjectNode node, String field, Double value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    static void put(ObjectNode node, String field, List<String> values) {
        if (values != null) {
            values.forEach(node.putArray(field)::add);
        }
    }
}
