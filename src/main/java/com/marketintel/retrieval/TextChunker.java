package com.marketintel.retrieval;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic overlapping splitter. A window of {@code chunkSize} characters is cut at the last
 * paragraph break, newline or space that lies in its second half, else at the hard limit; the next
 * window starts {@code overlap} characters before the cut.
 */
public final class TextChunker {
    private static final String[] SEPARATORS = {"\n\n", "\n", " "};

    private final int chunkSize;
    private final int overlap;

    public TextChunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be in [0, chunkSize)");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<String> split(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        int len = text.length();
        int start = 0;
        while (start < len) {
            int end = Math.min(start + chunkSize, len);
            if (end < len) {
                end = preferredBreak(text, start, end);
            }
            String piece = text.substring(start, end).strip();
            if (!piece.isEmpty()) {
                out.add(piece);
            }
            if (end >= len) {
                break;
            }
            int next = end - overlap;
            start = next > start ? next : end;
        }
        return out;
    }

    public List<TextChunk> chunk(List<TextChunk> blocks) {
        List<TextChunk> out = new ArrayList<>();
        if (blocks == null) {
            return out;
        }
        for (TextChunk block : blocks) {
            List<String> pieces = split(block.text());
            for (int i = 0; i < pieces.size(); i++) {
                Map<String, String> metadata = new LinkedHashMap<>(block.metadata());
                metadata.put("chunk_index", Integer.toString(i));
                out.add(new TextChunk(pieces.get(i), metadata));
            }
        }
        return out;
    }

    private int preferredBreak(String text, int start, int end) {
        int earliest = start + chunkSize / 2;
        for (String sep : SEPARATORS) {
            int idx = text.lastIndexOf(sep, end - sep.length());
            if (idx >= earliest) {
                return idx + sep.length();
            }
        }
        return end;
    }
}
