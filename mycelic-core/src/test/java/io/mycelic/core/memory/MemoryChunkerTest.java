package io.mycelic.core.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mycelic.core.config.model.ChunkingConfig;
import java.util.List;
import org.junit.jupiter.api.Test;

class MemoryChunkerTest {

    private final MemoryChunker chunker = new MemoryChunker(ChunkingConfig.defaults());

    @Test
    void shouldLeaveContentAtOrBelowThresholdWhole() {
        assertThat(chunker.chunk("x".repeat(1500))).isEmpty();
        assertThat(chunker.chunk(null)).isEmpty();
        assertThat(new MemoryChunker(ChunkingConfig.disabled()).chunk("x. ".repeat(2000))).isEmpty();
    }

    @Test
    void shouldSplitOnParagraphsWithOverlap() {
        String first = ("alpha lorem ipsum dolor. ").repeat(30).trim();
        String second = ("beta lorem ipsum dolor. ").repeat(30).trim();
        String third = ("gamma lorem ipsum dolor. ").repeat(30).trim();

        List<MemoryChunk> chunks = chunker.chunk(first + "\n\n" + second + "\n\n" + third);

        assertThat(chunks).hasSize(3);
        assertThat(chunks).extracting(MemoryChunk::index).containsExactly(0, 1, 2);
        assertThat(chunks).extracting(MemoryChunk::level).containsOnly(1);
        assertThat(chunks.get(0).content()).isEqualTo(first);
        assertThat(chunks.get(1).content()).contains("alpha").endsWith(second);
        assertThat(chunks.get(2).content()).contains("beta").endsWith(third);
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.content().length()).isLessThanOrEqualTo(1000));
    }

    @Test
    void shouldFallBackToSentencesForSingleParagraph() {
        StringBuilder content = new StringBuilder();
        for (int i = 0; i < 80; i++) {
            content.append("Sentence number ").append(i).append(" says something useful. ");
        }

        List<MemoryChunk> chunks = chunker.chunk(content.toString().trim());

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).allSatisfy(chunk -> {
            assertThat(chunk.content()).endsWith(".");
            assertThat(chunk.content().length()).isLessThanOrEqualTo(1000);
        });
        assertThat(chunks.get(chunks.size() - 1).content()).endsWith("Sentence number 79 says something useful.");
    }

    @Test
    void shouldSplitSentencesOnlyAtTerminatorsFollowedByWhitespace() {
        assertThat(MemoryChunker.sentences("One. Two! Three? v1.2 stays"))
            .containsExactly("One.", "Two!", "Three?", "v1.2 stays");
        assertThat(MemoryChunker.paragraphs("a\n\n  \n\nb\n \nc")).containsExactly("a", "b", "c");
    }

    @Test
    void shouldRejectOverlapNotSmallerThanChunk() {
        assertThatThrownBy(() -> new MemoryChunker(new ChunkingConfig(true, 1500, 100, 100)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
