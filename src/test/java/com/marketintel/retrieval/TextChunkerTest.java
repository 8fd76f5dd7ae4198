package com.marketintel.retrieval;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextChunkerTest {

    @Test
    void split_shouldReturnSingleChunkForShortText() {
        assertEquals(List.of("short text"), new TextChunker(1000, 150).split("  short text  "));
    }

    @Test
    void split_shouldReturnNothingForBlankText() {
        assertTrue(new TextChunker(1000, 150).split(" \n ").isEmpty());
        assertTrue(new TextChunker(1000, 150).split(null).isEmpty());
    }

    @Test
    void split_shouldOverlapConsecutiveChunksOnHardCuts() {
        String text = "x".repeat(2500);

        List<String> chunks = new TextChunker(1000, 150).split(text);

        assertEquals(3, chunks.size());
        assertEquals(1000, chunks.get(0).length());
        assertEquals(1000, chunks.get(1).length());
        assertEquals(2500 - 1700, chunks.get(2).length());
    }

    @Test
    void split_shouldPreferParagraphBreakInSecondHalfOfWindow() {
        String first = "a".repeat(700);
        String second = "b".repeat(700);
        String text = first + "\n\n" + second;

        List<String> chunks = new TextChunker(1000, 150).split(text);

        assertEquals(first, chunks.get(0));
        assertTrue(chunks.get(1).endsWith(second));
    }

    @Test
    void split_shouldBeDeterministic() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 400; i++) {
            sb.append("word").append(i).append(i % 17 == 0 ? "\n" : " ");
        }
        TextChunker chunker = new TextChunker(300, 50);

        assertEquals(chunker.split(sb.toString()), chunker.split(sb.toString()));
    }

    @Test
    void chunk_shouldCopyMetadataAndNumberChunks() {
        TextChunk block = new TextChunk("y".repeat(1200), Map.of("source", "web_document", "url", "https://a.example"));

        List<TextChunk> chunks = new TextChunker(1000, 150).chunk(List.of(block));

        assertEquals(2, chunks.size());
        assertEquals("0", chunks.get(0).metadata().get("chunk_index"));
        assertEquals("1", chunks.get(1).metadata().get("chunk_index"));
        assertEquals("https://a.example", chunks.get(1).metadata().get("url"));
    }

    @Test
    void constructor_shouldRejectOverlapNotSmallerThanSize() {
        assertThrows(IllegalArgumentException.class, () -> new TextChunker(100, 100));
        assertThrows(IllegalArgumentException.class, () -> new TextChunker(0, 0));
    }
}
