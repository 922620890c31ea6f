package org.companyllm.rag.pipeline.retrieval;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.companyllm.rag.pipeline.embedding.EmbeddingProvider;
import org.companyllm.rag.pipeline.error.EmbeddingProviderException;
import org.companyllm.rag.pipeline.sink.VectorStore;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Embeds a question, runs one nearest-neighbour query and hands the hits to the
 * {@link PromptAssembler}.
 */
@Slf4j
public class ContextRetriever {
    private static final Comparator<RetrievedChunk> BY_SCORE_THEN_ID = Comparator
        .comparingDouble(RetrievedChunk::score).reversed()
        .thenComparing(retrieved -> retrieved.chunk().chunkId());

    private final EmbeddingProvider embeddingProvider;
    private final VectorStore store;
    private final PromptAssembler assembler;
    private final RetrievalConfig config;
    private final Duration embeddingTimeout;

    public ContextRetriever(EmbeddingProvider embeddingProvider, VectorStore store, RetrievalConfig config) {
        this(embeddingProvider, store, config, Duration.ofSeconds(60));
    }

    public ContextRetriever(
        EmbeddingProvider embeddingProvider,
        VectorStore store,
        RetrievalConfig config,
        Duration embeddingTimeout
    ) {
        this.embeddingProvider = embeddingProvider;
        this.store = store;
        this.config = config.validate();
        this.assembler = new PromptAssembler(config);
        this.embeddingTimeout = embeddingTimeout;
    }

    public Mono<AnswerContext> answerContext(String question) {
        return answerContext(question, config.getTopK());
    }

    public Mono<AnswerContext> answerContext(String question, int k) {
        return Mono.defer(() -> embeddingProvider.embed(List.of(question)))
            .timeout(embeddingTimeout)
            .map(vectors -> {
                if (vectors.size() != 1) {
                    throw new EmbeddingProviderException("Expected one query vector but received " + vectors.size());
                }
                var hits = store.query(vectors.get(0), k).stream()
                    .map(hit -> new RetrievedChunk(hit.entry().toChunk(), hit.score()))
                    .sorted(BY_SCORE_THEN_ID)
                    .collect(Collectors.toList());
                log.debug("Retrieved {} chunks for question", hits.size());
                return assembler.assemble(question, hits);
            });
    }
}
