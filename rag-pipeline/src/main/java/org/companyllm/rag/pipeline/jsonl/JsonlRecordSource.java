package org.companyllm.rag.pipeline.jsonl;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.companyllm.rag.pipeline.error.MalformedRecordException;
import org.companyllm.rag.pipeline.error.TransportException;
import org.companyllm.rag.pipeline.ir.RawRecord;
import org.companyllm.rag.pipeline.source.RecordSource;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Replays raw records previously extracted with {@link RawRecordJsonl#writeTo}.
 * Unreadable lines are skipped with a warning.
 */
@Slf4j
public class JsonlRecordSource implements RecordSource {
    private final Path file;

    public JsonlRecordSource(Path file) {
        this.file = file;
    }

    @Override
    public String name() {
        return "jsonl:" + file.getFileName();
    }

    @Override
    public Flux<RawRecord> readRecords() {
        return Flux.using(
                () -> Files.lines(file, StandardCharsets.UTF_8),
                lines -> Flux.fromStream(lines),
                Stream::close)
            .onErrorMap(e -> e instanceof IOException || e instanceof UncheckedIOException,
                e -> new TransportException("Could not read records from " + file, e))
            .index()
            .filter(indexed -> !indexed.getT2().isBlank())
            .concatMap(indexed -> parse(indexed.getT1() + 1, indexed.getT2()));
    }

    private Mono<RawRecord> parse(long lineNumber, String line) {
        try {
            return Mono.just(RawRecordJsonl.fromLine(line));
        } catch (MalformedRecordException e) {
            log.warn("Skipping line {} of {}: {}", lineNumber, file, e.getMessage());
            return Mono.empty();
        }
    }
}
