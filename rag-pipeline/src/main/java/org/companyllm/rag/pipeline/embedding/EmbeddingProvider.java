package org.companyllm.rag.pipeline.embedding;

import java.util.List;

import reactor.core.publisher.Mono;

/**
 * External embedding service. One call embeds a whole batch.
 */
public interface EmbeddingProvider {

    /**
     * @return one vector per input text, in input order; fails with an
     *         {@link org.companyllm.rag.pipeline.error.EmbeddingProviderException}
     *         when the batch could not be embedded
     */
    Mono<List<float[]>> embed(List<String> texts);
}
