package org.companyllm.rag.pipeline.chunking;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.companyllm.rag.pipeline.error.ConfigurationException;

/**
 * Splits text into overlapping fixed-size windows.
 *
 * Window {@code i} starts at {@code i * (chunkSize - chunkOverlap)} and spans at most
 * {@code chunkSize} units. The last window is the first one that reaches the end of
 * the text. Blank input yields no windows.
 */
public class TextChunker {
    private final ChunkingConfig config;

    public TextChunker(ChunkingConfig config) {
        this.config = config.validate();
    }

    public List<String> chunk(String text) {
        return config.getUnit() == ChunkUnit.WORDS
            ? chunkWords(text, config.getChunkSize(), config.getChunkOverlap())
            : chunk(text, config.getChunkSize(), config.getChunkOverlap());
    }

    /** Character windows. */
    public static List<String> chunk(String text, int chunkSize, int chunkOverlap) {
        checkParameters(chunkSize, chunkOverlap);
        if (text == null || text.isBlank()) {
            return List.of();
        }
        var chunks = new ArrayList<String>();
        int step = chunkSize - chunkOverlap;
        for (int start = 0; ; start += step) {
            int end = Math.min(start + chunkSize, text.length());
            chunks.add(text.substring(start, end));
            if (end == text.length()) {
                break;
            }
        }
        return chunks;
    }

    /** Word windows; sizes are counted in words. */
    public static List<String> chunkWords(String text, int chunkSize, int chunkOverlap) {
        checkParameters(chunkSize, chunkOverlap);
        if (text == null || text.isBlank()) {
            return List.of();
        }
        var words = text.strip().split("\\s+");
        var chunks = new ArrayList<String>();
        int step = chunkSize - chunkOverlap;
        for (int start = 0; ; start += step) {
            int end = Math.min(start + chunkSize, words.length);
            chunks.add(String.join(" ", Arrays.asList(words).subList(start, end)));
            if (end == words.length) {
                break;
            }
        }
        return chunks;
    }

    static void checkParameters(int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new ConfigurationException("chunk_size must be positive, was " + chunkSize);
        }
        if (chunkOverlap < 0) {
            throw new ConfigurationException("chunk_overlap must not be negative, was " + chunkOverlap);
        }
        if (chunkOverlap >= chunkSize) {
            throw new ConfigurationException(
                "chunk_overlap (" + chunkOverlap + ") must be smaller than chunk_size (" + chunkSize + ")");
        }
    }
}
