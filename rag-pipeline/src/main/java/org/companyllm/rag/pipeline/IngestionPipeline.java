package org.companyllm.rag.pipeline;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.companyllm.rag.pipeline.chunking.DocumentChunker;
import org.companyllm.rag.pipeline.error.MalformedRecordException;
import org.companyllm.rag.pipeline.error.TransportException;
import org.companyllm.rag.pipeline.ir.CanonicalDocument;
import org.companyllm.rag.pipeline.ir.RawRecord;
import org.companyllm.rag.pipeline.ir.RunReport;
import org.companyllm.rag.pipeline.ir.SourceReport;
import org.companyllm.rag.pipeline.normalize.RecordNormalizer;
import org.companyllm.rag.pipeline.source.RecordSource;
import org.companyllm.rag.pipeline.upsert.IncrementalUpserter;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Wires record sources through normalization and chunking into the incremental upserter.
 *
 * The pipeline knows nothing about Jira, Confluence or any specific store. Records are
 * pulled lazily from each source; a transport failure ends only the source that raised
 * it, while a store failure ends the whole run.
 */
@Slf4j
public class IngestionPipeline {
    private final RecordNormalizer normalizer;
    private final DocumentChunker chunker;
    private final IncrementalUpserter upserter;
    private final int sourceConcurrency;

    public IngestionPipeline(RecordNormalizer normalizer, DocumentChunker chunker, IncrementalUpserter upserter) {
        this(normalizer, chunker, upserter, 1);
    }

    public IngestionPipeline(
        RecordNormalizer normalizer,
        DocumentChunker chunker,
        IncrementalUpserter upserter,
        int sourceConcurrency
    ) {
        if (sourceConcurrency <= 0) {
            throw new IllegalArgumentException("sourceConcurrency must be positive");
        }
        this.normalizer = normalizer;
        this.chunker = chunker;
        this.upserter = upserter;
        this.sourceConcurrency = sourceConcurrency;
    }

    /**
     * Ingest one source, recording chunk outcomes on {@code run}.
     * Completes with a report even when the source's transport fails mid-way; the
     * report then carries the failure message.
     */
    public Mono<SourceReport> ingestSource(RecordSource source, IngestionRun run) {
        return Mono.defer(() -> {
            var recordsRead = new AtomicLong();
            var documents = new AtomicLong();
            var malformed = new AtomicLong();
            var transportFailure = new AtomicReference<TransportException>();

            // A transport failure ends the record stream, but records already read still flow to the store
            var chunks = source.readRecords()
                .onErrorResume(TransportException.class, e -> {
                    transportFailure.set(e);
                    return Flux.empty();
                })
                .takeWhile(ignored -> !run.isStopRequested())
                .doOnNext(ignored -> recordsRead.incrementAndGet())
                .concatMap(rawRecord -> normalize(source, rawRecord, malformed))
                .doOnNext(ignored -> documents.incrementAndGet())
                .concatMapIterable(chunker::chunk);

            return upserter.upsert(chunks, run)
                .then(Mono.fromSupplier(() -> {
                    var failure = transportFailure.get();
                    if (failure != null) {
                        log.atError().setMessage("Source {} aborted after {} records")
                            .addArgument(source::name)
                            .addArgument(recordsRead::get)
                            .setCause(failure)
                            .log();
                    } else {
                        log.atInfo().setMessage("Source {} finished: {} records, {} documents, {} malformed")
                            .addArgument(source::name)
                            .addArgument(recordsRead::get)
                            .addArgument(documents::get)
                            .addArgument(malformed::get)
                            .log();
                    }
                    return new SourceReport(source.name(), recordsRead.get(), documents.get(), malformed.get(),
                        failure == null ? null : failure.getMessage());
                }));
        });
    }

    /** Ingest all sources in one run, sharing counters. */
    public Mono<RunReport> ingestAll(List<? extends RecordSource> sources) {
        return ingestAll(sources, new IngestionRun());
    }

    public Mono<RunReport> ingestAll(List<? extends RecordSource> sources, IngestionRun run) {
        return Flux.fromIterable(sources)
            .flatMapSequential(
                source -> ingestSource(source, run).subscribeOn(Schedulers.boundedElastic()),
                sourceConcurrency)
            .collectList()
            .map(reports -> {
                var report = new RunReport(run.summary(), reports);
                log.info("Ingestion run finished {}", report.summary());
                return report;
            });
    }

    private Mono<CanonicalDocument> normalize(RecordSource source, RawRecord rawRecord, AtomicLong malformed) {
        try {
            return Mono.just(normalizer.normalize(rawRecord));
        } catch (MalformedRecordException e) {
            malformed.incrementAndGet();
            log.atWarn().setMessage("Skipping malformed record from {}: {}")
                .addArgument(source::name)
                .addArgument(e::getMessage)
                .setCause(e.getCause())
                .log();
            return Mono.empty();
        }
    }
}
