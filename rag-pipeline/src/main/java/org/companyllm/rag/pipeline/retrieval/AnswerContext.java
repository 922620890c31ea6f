package org.companyllm.rag.pipeline.retrieval;

import java.util.List;

/**
 * Result of retrieval for one question.
 *
 * @param chunks          every retrieved chunk, best score first
 * @param chunksInContext how many leading entries of {@code chunks} fit the prompt budget
 */
public record AnswerContext(
    String question,
    List<RetrievedChunk> chunks,
    int chunksInContext,
    String assembledPrompt
) {
    public AnswerContext {
        chunks = List.copyOf(chunks);
    }

    public boolean hasContext() {
        return !chunks.isEmpty();
    }
}
