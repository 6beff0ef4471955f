package io.mycelic.core.memory;

import io.mycelic.core.config.model.ChunkingConfig;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits long content into overlapping chunks, on paragraph boundaries when the content has
 * paragraphs and on sentence boundaries otherwise. Sizes are in characters.
 */
public final class MemoryChunker {
    static final int CHUNK_LEVEL = 1;

    private final ChunkingConfig config;

    public MemoryChunker(ChunkingConfig config) {
        this.config = config == null ? ChunkingConfig.defaults() : config;
        if (this.config.enabled() && (this.config.maxChunkSize() <= 0 || this.config.overlapSize() < 0
            || this.config.overlapSize() >= this.config.maxChunkSize())) {
            throw new IllegalArgumentException("chunking needs maxChunkSize > overlapSize >= 0");
        }
    }

    public boolean shouldChunk(String content) {
        return config.enabled() && content != null && content.length() > config.minChunkSize();
    }

    /**
     * @return the chunks in order, or an empty list when the content is short enough to stay whole
     */
    public List<MemoryChunk> chunk(String content) {
        if (!shouldChunk(content)) {
            return List.of();
        }
        List<String> paragraphs = paragraphs(content);
        if (paragraphs.size() > 1) {
            return pack(paragraphs, "\n\n");
        }
        return pack(sentences(content), " ");
    }

    private List<MemoryChunk> pack(List<String> pieces, String separator) {
        List<MemoryChunk> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < pieces.size(); i++) {
            String piece = i < pieces.size() - 1 ? pieces.get(i) + separator : pieces.get(i);
            if (current.length() > 0 && current.length() + piece.length() > config.maxChunkSize()) {
                chunks.add(new MemoryChunk(current.toString().trim(), chunks.size(), CHUNK_LEVEL));
                String overlap = overlapSuffix(current.toString());
                current.setLength(0);
                current.append(overlap);
            }
            current.append(piece);
        }
        if (!current.toString().isBlank()) {
            chunks.add(new MemoryChunk(current.toString().trim(), chunks.size(), CHUNK_LEVEL));
        }
        return chunks;
    }

    private String overlapSuffix(String text) {
        int n = config.overlapSize();
        return text.length() <= n ? text : text.substring(text.length() - n);
    }

    static List<String> paragraphs(String content) {
        List<String> out = new ArrayList<>();
        for (String paragraph : content.split("\\n\\s*\\n")) {
            if (!paragraph.isBlank()) {
                out.add(paragraph.trim());
            }
        }
        return out;
    }

    static List<String> sentences(String content) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            current.append(c);
            boolean end = c == '.' || c == '!' || c == '?';
            if (end && (i == content.length() - 1 || Character.isWhitespace(content.charAt(i + 1)))) {
                if (!current.toString().isBlank()) {
                    out.add(current.toString().trim());
                }
                current.setLength(0);
            }
        }
        if (!current.toString().isBlank()) {
            out.add(current.toString().trim());
        }
        return out;
    }
}
