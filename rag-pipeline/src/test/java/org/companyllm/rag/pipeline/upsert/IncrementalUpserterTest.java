package org.companyllm.rag.pipeline.upsert;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.companyllm.rag.pipeline.IngestionRun;
import org.companyllm.rag.pipeline.chunking.ContentFingerprinter;
import org.companyllm.rag.pipeline.embedding.CountingEmbeddingProvider;
import org.companyllm.rag.pipeline.error.IndexWriteException;
import org.companyllm.rag.pipeline.ir.Chunk;
import org.companyllm.rag.pipeline.ir.ChunkOutcome;
import org.companyllm.rag.pipeline.ir.IndexEntry;
import org.companyllm.rag.pipeline.ir.IngestionSummary;
import org.companyllm.rag.pipeline.ir.UpsertOutcome;
import org.companyllm.rag.pipeline.sink.InMemoryVectorStore;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class IncrementalUpserterTest {
    private static final ContentFingerprinter FINGERPRINTER = new ContentFingerprinter();

    private final InMemoryVectorStore store = new InMemoryVectorStore();
    private final CountingEmbeddingProvider embeddings = new CountingEmbeddingProvider();

    private static Chunk chunk(String id, String text) {
        return new Chunk(id, text, FINGERPRINTER.fingerprint(text), Map.of());
    }

    private IncrementalUpserter upserter(int maxChunks) {
        return new IncrementalUpserter(store, embeddings, UpsertConfig.builder().maxChunksPerBatch(maxChunks).build());
    }

    private IngestionSummary runOnce(IncrementalUpserter upserter, Chunk... chunks) {
        var run = new IngestionRun();
        StepVerifier.create(upserter.upsert(Flux.fromArray(chunks), run))
            .expectNextCount(chunks.length)
            .verifyComplete();
        return run.summary();
    }

    @Test
    void newThenSkippedThenUpdated() {
        var upserter = upserter(10);

        assertEquals(new IngestionSummary(1, 0, 0, 0), runOnce(upserter, chunk("jira-1-chunk-0", "h1 text")));
        assertEquals(new IngestionSummary(0, 0, 1, 0), runOnce(upserter, chunk("jira-1-chunk-0", "h1 text")));
        assertEquals(new IngestionSummary(0, 1, 0, 0), runOnce(upserter, chunk("jira-1-chunk-0", "h2 text")));

        assertEquals(2, embeddings.getCalls());
        assertEquals(FINGERPRINTER.fingerprint("h2 text"), store.get("jira-1-chunk-0").orElseThrow().contentHash());
    }

    @Test
    void rerunOverUnchangedInputMakesNoEmbeddingCalls() {
        var upserter = upserter(2);
        var chunks = new Chunk[] {chunk("a", "alpha"), chunk("b", "beta"), chunk("c", "gamma")};

        assertEquals(new IngestionSummary(3, 0, 0, 0), runOnce(upserter, chunks));
        int callsAfterFirstRun = embeddings.getCalls();
        long writesAfterFirstRun = store.getUpsertCount();

        assertEquals(new IngestionSummary(0, 0, 3, 0), runOnce(upserter, chunks));
        assertEquals(callsAfterFirstRun, embeddings.getCalls());
        assertEquals(writesAfterFirstRun, store.getUpsertCount());
    }

    @Test
    void onlyChangedSiblingIsReembedded() {
        var upserter = upserter(10);
        runOnce(upserter, chunk("doc-chunk-0", "first"), chunk("doc-chunk-1", "second"), chunk("doc-chunk-2", "third"));

        var summary = runOnce(upserter,
            chunk("doc-chunk-0", "first"), chunk("doc-chunk-1", "second, edited"), chunk("doc-chunk-2", "third"));

        assertEquals(new IngestionSummary(0, 1, 2, 0), summary);
        assertEquals(List.of("first", "second", "third", "second, edited"), embeddings.getEmbeddedTexts());
    }

    @Test
    void failedBatchIsCountedAndProcessingContinues() {
        embeddings.failWhenTextContains("BOOM");
        var upserter = upserter(2);
        var run = new IngestionRun();

        StepVerifier.create(upserter.upsert(Flux.just(
                chunk("a", "ok one"), chunk("b", "BOOM"), chunk("c", "ok two")), run))
            .expectNext(new ChunkOutcome("a", UpsertOutcome.FAILED))
            .expectNext(new ChunkOutcome("b", UpsertOutcome.FAILED))
            .expectNext(new ChunkOutcome("c", UpsertOutcome.NEW))
            .verifyComplete();

        assertEquals(new IngestionSummary(1, 0, 0, 2), run.summary());
        assertTrue(store.get("a").isEmpty());
        assertTrue(store.get("c").isPresent());
    }

    @Test
    void failedChunksAreRetriedByNextRun() {
        embeddings.failWhenTextContains("flaky");
        var upserter = upserter(10);
        assertEquals(new IngestionSummary(0, 0, 0, 1), runOnce(upserter, chunk("a", "flaky")));

        var healthy = new IncrementalUpserter(store, new CountingEmbeddingProvider(), UpsertConfig.defaults());
        assertEquals(new IngestionSummary(1, 0, 0, 0), runOnce(healthy, chunk("a", "flaky")));
    }

    @Test
    void wrongVectorCountFailsTheBatch() {
        var upserter = new IncrementalUpserter(store, texts -> Mono.just(List.of()), UpsertConfig.defaults());
        assertEquals(new IngestionSummary(0, 0, 0, 2), runOnce(upserter, chunk("a", "x"), chunk("b", "y")));
    }

    @Test
    void emptyProviderResultFailsTheBatch() {
        var upserter = new IncrementalUpserter(store, texts -> Mono.empty(), UpsertConfig.defaults());
        assertEquals(new IngestionSummary(0, 0, 0, 2), runOnce(upserter, chunk("a", "x"), chunk("b", "y")));
        assertTrue(store.get("a").isEmpty());
    }

    @Test
    void storeFailureTerminatesTheStream() {
        var failingStore = new InMemoryVectorStore() {
            @Override
            public void upsert(IndexEntry entry) {
                throw new IndexWriteException("disk full");
            }
        };
        var upserter = new IncrementalUpserter(failingStore, embeddings, UpsertConfig.defaults());

        StepVerifier.create(upserter.upsert(Flux.just(chunk("a", "x")), new IngestionRun()))
            .expectError(IndexWriteException.class)
            .verify();
    }

    @Test
    void storeReadFailureTerminatesTheStream() {
        var failingStore = new InMemoryVectorStore() {
            @Override
            public Optional<IndexEntry> get(String chunkId) {
                throw new IndexWriteException("store unavailable");
            }
        };
        var upserter = new IncrementalUpserter(failingStore, embeddings, UpsertConfig.defaults());

        StepVerifier.create(upserter.upsert(Flux.just(chunk("a", "x")), new IngestionRun()))
            .expectError(IndexWriteException.class)
            .verify();
        assertEquals(0, embeddings.getCalls());
    }

    @Test
    void batchesAreBoundedByCountIncludingSkippedChunks() {
        var upserter = upserter(2);
        runOnce(upserter, chunk("s1", "stored one"), chunk("s2", "stored two"));
        int before = embeddings.getBatchSizes().size();

        runOnce(upserter, chunk("n1", "a"), chunk("s1", "stored one"), chunk("n2", "b"),
            chunk("n3", "c"), chunk("s2", "stored two"), chunk("n4", "d"), chunk("n5", "e"));

        assertEquals(List.of(1, 2, 2), embeddings.getBatchSizes().subList(before, embeddings.getBatchSizes().size()));
    }

    @Test
    void unchangedChunksAreReportedWithoutWaitingForTheSourceToEnd() {
        var chunks = List.of(chunk("a", "1"), chunk("b", "2"), chunk("c", "3"), chunk("d", "4"), chunk("e", "5"));
        runOnce(upserter(2), chunks.toArray(new Chunk[0]));
        var run = new IngestionRun();

        StepVerifier.create(upserter(2).upsert(Flux.concat(Flux.fromIterable(chunks), Flux.never()), run))
            .expectNextCount(5)
            .thenCancel()
            .verify(Duration.ofSeconds(5));

        assertEquals(new IngestionSummary(0, 0, 5, 0), run.summary());
    }

    @Test
    void pendingBatchHoldsAtMostTheBatchLimit() {
        var upserter = upserter(3);
        runOnce(upserter, chunk("s1", "x"), chunk("s2", "y"), chunk("s3", "z"));
        var run = new IngestionRun();
        var chunks = Flux.just(chunk("n1", "new"), chunk("s1", "x"), chunk("s2", "y"), chunk("s3", "z"));

        StepVerifier.create(upserter.upsert(Flux.concat(chunks, Flux.never()), run))
            .expectNext(new ChunkOutcome("n1", UpsertOutcome.NEW))
            .expectNext(new ChunkOutcome("s1", UpsertOutcome.SKIPPED))
            .expectNext(new ChunkOutcome("s2", UpsertOutcome.SKIPPED))
            .expectNext(new ChunkOutcome("s3", UpsertOutcome.SKIPPED))
            .thenCancel()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void batchesAreBoundedByCharacters() {
        var upserter = new IncrementalUpserter(store, embeddings,
            UpsertConfig.builder().maxChunksPerBatch(100).maxCharsPerBatch(10).build());

        runOnce(upserter, chunk("a", "123456"), chunk("b", "123456"), chunk("c", "12"));

        assertEquals(List.of(2, 1), embeddings.getBatchSizes());
    }

    @Test
    void batchBoundariesDoNotChangeClassification() {
        var small = new InMemoryVectorStore();
        var large = new InMemoryVectorStore();
        var chunks = new Chunk[] {chunk("a", "1"), chunk("b", "2"), chunk("c", "3"), chunk("d", "4")};
        for (var target : List.of(small, large)) {
            target.upsert(IndexEntry.of(chunk("b", "2"), CountingEmbeddingProvider.vectorFor("2")));
            target.upsert(IndexEntry.of(chunk("c", "old"), CountingEmbeddingProvider.vectorFor("old")));
        }

        var bySmallBatches = runOnce(new IncrementalUpserter(small, embeddings,
            UpsertConfig.builder().maxChunksPerBatch(1).build()), chunks);
        var byLargeBatches = runOnce(new IncrementalUpserter(large, embeddings,
            UpsertConfig.builder().maxChunksPerBatch(100).build()), chunks);

        assertEquals(new IngestionSummary(2, 1, 1, 0), bySmallBatches);
        assertEquals(bySmallBatches, byLargeBatches);
    }

    @Test
    void duplicateChunkInOneRunIsEmbeddedOnce() {
        var upserter = upserter(10);
        var summary = runOnce(upserter, chunk("a", "same"), chunk("a", "same"));

        assertEquals(new IngestionSummary(1, 0, 1, 0), summary);
        assertEquals(1, embeddings.getEmbeddedTexts().size());
    }

    @Test
    void stopRequestEndsTheStreamEarly() {
        var upserter = upserter(1);
        var run = new IngestionRun();
        var chunks = Flux.just(chunk("a", "1"), chunk("b", "2"), chunk("c", "3"))
            .doOnNext(c -> {
                if (c.chunkId().equals("b")) {
                    run.requestStop();
                }
            });

        StepVerifier.create(upserter.upsert(chunks, run))
            .expectNext(new ChunkOutcome("a", UpsertOutcome.NEW))
            .verifyComplete();

        assertEquals(new IngestionSummary(1, 0, 0, 0), run.summary());
        assertTrue(store.get("b").isEmpty());
    }
}
