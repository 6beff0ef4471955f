package io.mycelic.core.memory;

import java.util.List;

/**
 * Partial update: a null field is left unchanged. A blank {@code domain} or {@code source}
 * clears the stored value.
 */
public record MemoryUpdate(
    String content,
    Integer importance,
    List<String> tags,
    String source,
    String domain
) {

    public static MemoryUpdate content(String content) {
        return new MemoryUpdate(content, null, null, null, null);
    }

    public static MemoryUpdate importance(int importance) {
        return new MemoryUpdate(null, importance, null, null, null);
    }

    public static MemoryUpdate tags(List<String> tags) {
        return new MemoryUpdate(null, null, tags, null, null);
    }

    public boolean isEmpty() {
        return content == null && importance == null && tags == null && source == null && domain == null;
    }
}
