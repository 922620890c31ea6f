package org.companyllm.rag.pipeline.retrieval;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.companyllm.rag.pipeline.embedding.EmbeddingProvider;
import org.companyllm.rag.pipeline.error.EmbeddingProviderException;
import org.companyllm.rag.pipeline.ir.IndexEntry;
import org.companyllm.rag.pipeline.ir.MetadataKeys;
import org.companyllm.rag.pipeline.sink.InMemoryVectorStore;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class ContextRetrieverTest {
    private final InMemoryVectorStore store = new InMemoryVectorStore();
    private final List<String> embeddedQuestions = new ArrayList<>();
    private final EmbeddingProvider queryEmbedder = texts -> {
        embeddedQuestions.addAll(texts);
        return Mono.just(List.of(new float[] {1, 0}));
    };

    private void index(String id, String title, float... vector) {
        store.upsert(new IndexEntry(id, "h-" + id, vector, "text of " + id,
            Map.of(MetadataKeys.SOURCE, "confluence", MetadataKeys.TITLE, title)));
    }

    @Test
    void kLargerThanIndexReturnsAllEntriesByDescendingScore() {
        index("confluence-1-chunk-0", "Far", 0, 1);
        index("confluence-2-chunk-0", "Near", 1, 0.1f);
        var retriever = new ContextRetriever(queryEmbedder, store, RetrievalConfig.defaults());

        StepVerifier.create(retriever.answerContext("Where is the runbook?", 3))
            .assertNext(context -> {
                assertEquals(2, context.chunks().size());
                assertEquals("confluence-2-chunk-0", context.chunks().get(0).chunk().chunkId());
                assertEquals("confluence-1-chunk-0", context.chunks().get(1).chunk().chunkId());
                assertTrue(context.chunks().get(0).score() > context.chunks().get(1).score());
                assertEquals(2, context.chunksInContext());
                assertTrue(context.assembledPrompt().indexOf("Title: Near") < context.assembledPrompt().indexOf("Title: Far"));
            })
            .verifyComplete();
        assertEquals(List.of("Where is the runbook?"), embeddedQuestions);
    }

    @Test
    void equalScoresAreOrderedByChunkId() {
        index("teams-b-chunk-0", "B", 2, 0);
        index("teams-a-chunk-0", "A", 1, 0);
        index("teams-c-chunk-0", "C", 3, 0);
        var retriever = new ContextRetriever(queryEmbedder, store, RetrievalConfig.defaults());

        StepVerifier.create(retriever.answerContext("q"))
            .assertNext(context -> assertEquals(List.of("teams-a-chunk-0", "teams-b-chunk-0", "teams-c-chunk-0"),
                context.chunks().stream().map(c -> c.chunk().chunkId()).collect(java.util.stream.Collectors.toList())))
            .verifyComplete();
    }

    @Test
    void emptyIndexYieldsNoContextMarker() {
        var retriever = new ContextRetriever(queryEmbedder, store, RetrievalConfig.defaults());

        StepVerifier.create(retriever.answerContext("anything"))
            .assertNext(context -> {
                assertTrue(context.chunks().isEmpty());
                assertTrue(context.assembledPrompt().contains(PromptAssembler.NO_CONTEXT_MARKER));
            })
            .verifyComplete();
    }

    @Test
    void topKComesFromConfiguration() {
        for (int i = 0; i < 5; i++) {
            index("jira-" + i + "-chunk-0", "T" + i, 1, i);
        }
        var retriever = new ContextRetriever(queryEmbedder, store, RetrievalConfig.builder().topK(2).build());

        StepVerifier.create(retriever.answerContext("q"))
            .assertNext(context -> assertEquals(2, context.chunks().size()))
            .verifyComplete();
    }

    @Test
    void embeddingFailurePropagates() {
        EmbeddingProvider failing = texts -> Mono.error(new EmbeddingProviderException("quota exceeded"));
        var retriever = new ContextRetriever(failing, store, RetrievalConfig.defaults());

        StepVerifier.create(retriever.answerContext("q"))
            .expectError(EmbeddingProviderException.class)
            .verify();
    }
}
