package org.companyllm.rag.pipeline.ir;

/**
 * One nearest-neighbour result of a vector query; higher scores are more relevant.
 */
public record SearchHit(IndexEntry entry, double score) {
    public String chunkId() {
        return entry.chunkId();
    }
}
