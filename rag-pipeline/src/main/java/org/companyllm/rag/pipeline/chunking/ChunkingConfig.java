package org.companyllm.rag.pipeline.chunking;

import org.companyllm.rag.pipeline.error.ConfigurationException;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChunkingConfig {
    public static final int DEFAULT_CHUNK_SIZE = 1000;
    public static final int DEFAULT_CHUNK_OVERLAP = 200;

    @Builder.Default
    int chunkSize = DEFAULT_CHUNK_SIZE;
    @Builder.Default
    int chunkOverlap = DEFAULT_CHUNK_OVERLAP;
    @Builder.Default
    ChunkUnit unit = ChunkUnit.CHARACTERS;

    /**
     * @throws ConfigurationException unless {@code 0 <= chunkOverlap < chunkSize}
     */
    public ChunkingConfig validate() {
        TextChunker.checkParameters(chunkSize, chunkOverlap);
        if (unit == null) {
            throw new ConfigurationException("Chunk unit must be provided");
        }
        return this;
    }

    public static ChunkingConfig defaults() {
        return builder().build();
    }
}
