package org.companyllm.rag.pipeline.retrieval;

import org.companyllm.rag.pipeline.ir.Chunk;

public record RetrievedChunk(Chunk chunk, double score) {}
