package org.companyllm.rag.pipeline.upsert;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.companyllm.rag.pipeline.IngestionRun;
import org.companyllm.rag.pipeline.embedding.EmbeddingProvider;
import org.companyllm.rag.pipeline.error.EmbeddingProviderException;
import org.companyllm.rag.pipeline.error.IndexWriteException;
import org.companyllm.rag.pipeline.ir.Chunk;
import org.companyllm.rag.pipeline.ir.ChunkOutcome;
import org.companyllm.rag.pipeline.ir.IndexEntry;
import org.companyllm.rag.pipeline.ir.UpsertOutcome;
import org.companyllm.rag.pipeline.sink.VectorStore;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Compares each chunk's content hash with the stored one and only embeds and writes
 * chunks that are new or changed.
 *
 * Chunks are batched by count and size before calling the embedding provider. A
 * failed batch marks its chunks {@code FAILED} and the stream continues; a store
 * failure terminates the stream with {@link IndexWriteException}. The hash and the
 * vector of an entry are only ever written together, so a chunk that failed to embed
 * is retried by the next run.
 */
@Slf4j
public class IncrementalUpserter {
    private final VectorStore store;
    private final EmbeddingProvider embeddingProvider;
    private final UpsertConfig config;

    public IncrementalUpserter(VectorStore store, EmbeddingProvider embeddingProvider, UpsertConfig config) {
        this.store = store;
        this.embeddingProvider = embeddingProvider;
        this.config = config.validate();
    }

    /**
     * Upsert a stream of chunks, emitting one outcome per chunk in input order and
     * recording each outcome on {@code run}.
     */
    public Flux<ChunkOutcome> upsert(Flux<Chunk> chunks, IngestionRun run) {
        return Flux.defer(() -> chunks
            .takeWhile(ignored -> !run.isStopRequested())
            .map(chunk -> plan(chunk, run))
            .bufferUntil(new EmbeddingBatchPredicate(config.getMaxChunksPerBatch(), config.getMaxCharsPerBatch()))
            .concatMap(batch -> processBatch(batch, run)));
    }

    private PlannedChunk plan(Chunk chunk, IngestionRun run) {
        if (!run.claim(chunk.chunkId(), chunk.contentHash())) {
            log.atDebug().setMessage("Chunk {} already handled in this run").addArgument(chunk::chunkId).log();
            return new PlannedChunk(chunk, UpsertOutcome.SKIPPED);
        }
        var existing = store.get(chunk.chunkId());
        if (existing.isEmpty()) {
            return new PlannedChunk(chunk, UpsertOutcome.NEW);
        }
        if (existing.get().contentHash().equals(chunk.contentHash())) {
            return new PlannedChunk(chunk, UpsertOutcome.SKIPPED);
        }
        return new PlannedChunk(chunk, UpsertOutcome.UPDATED);
    }

    private Flux<ChunkOutcome> processBatch(List<PlannedChunk> batch, IngestionRun run) {
        var pending = batch.stream().filter(PlannedChunk::needsEmbedding).collect(Collectors.toList());
        Mono<List<UpsertOutcome>> written = pending.isEmpty()
            ? Mono.just(List.of())
            : embedAndWrite(pending, run);
        return written.flatMapIterable(writtenOutcomes -> {
            var outcomes = new ArrayList<ChunkOutcome>(batch.size());
            var next = writtenOutcomes.iterator();
            for (var planned : batch) {
                var outcome = planned.needsEmbedding() ? next.next() : UpsertOutcome.SKIPPED;
                run.record(outcome);
                outcomes.add(new ChunkOutcome(planned.chunk().chunkId(), outcome));
            }
            return outcomes;
        });
    }

    private Mono<List<UpsertOutcome>> embedAndWrite(List<PlannedChunk> pending, IngestionRun run) {
        var texts = pending.stream().map(p -> p.chunk().text()).collect(Collectors.toList());
        return Mono.defer(() -> embeddingProvider.embed(texts))
            .timeout(config.getEmbeddingTimeout())
            .switchIfEmpty(Mono.error(() -> new EmbeddingProviderException(
                "Embedding provider returned no result for " + pending.size() + " texts")))
            .map(vectors -> {
                if (vectors == null || vectors.size() != pending.size()) {
                    throw new EmbeddingProviderException("Expected " + pending.size() + " vectors but received "
                        + (vectors == null ? 0 : vectors.size()));
                }
                var outcomes = new ArrayList<UpsertOutcome>(pending.size());
                for (int i = 0; i < pending.size(); i++) {
                    var planned = pending.get(i);
                    store.upsert(IndexEntry.of(planned.chunk(), vectors.get(i)));
                    outcomes.add(planned.plannedOutcome());
                }
                log.debug("Wrote batch of {} chunks", outcomes.size());
                return (List<UpsertOutcome>) outcomes;
            })
            .onErrorResume(e -> !(e instanceof IndexWriteException), e -> {
                log.atWarn().setMessage("Embedding failed for a batch of {} chunks starting at {}")
                    .addArgument(pending.size())
                    .addArgument(() -> pending.get(0).chunk().chunkId())
                    .setCause(e)
                    .log();
                pending.forEach(p -> run.release(p.chunk().chunkId(), p.chunk().contentHash()));
                return Mono.just(pending.stream().map(p -> UpsertOutcome.FAILED).collect(Collectors.toList()));
            });
    }
}
