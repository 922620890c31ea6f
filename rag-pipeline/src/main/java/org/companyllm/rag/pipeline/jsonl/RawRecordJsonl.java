package org.companyllm.rag.pipeline.jsonl;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.companyllm.rag.pipeline.error.MalformedRecordException;
import org.companyllm.rag.pipeline.ir.RawRecord;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * One raw record per line: {@code {"source": "jira", "record": {...}}}.
 * Decimal values are kept exact so a replayed record normalizes identically.
 */
@Slf4j
public class RawRecordJsonl {
    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));

    private RawRecordJsonl() {}

    public static String toLine(RawRecord rawRecord) {
        try {
            return OBJECT_MAPPER.writeValueAsString(rawRecord);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Raw record could not be serialized", e);
        }
    }

    /**
     * @throws MalformedRecordException when the line is not a tagged raw record
     */
    public static RawRecord fromLine(String line) {
        try {
            var node = OBJECT_MAPPER.readTree(line);
            if (node == null || !node.isObject() || !node.path("record").isObject()) {
                throw new MalformedRecordException("Line is not a tagged record object");
            }
            return OBJECT_MAPPER.treeToValue(node, RawRecord.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedRecordException("Unreadable record line: " + e.getMessage());
        }
    }

    /**
     * Write every record of {@code records} to {@code file}, replacing its content.
     *
     * @return the number of lines written
     */
    public static Mono<Long> writeTo(Path file, Flux<RawRecord> records) {
        return Flux.using(
                () -> Files.newBufferedWriter(file, StandardCharsets.UTF_8),
                writer -> records.map(rawRecord -> writeLine(writer, rawRecord)),
                RawRecordJsonl::closeQuietly)
            .count()
            .doOnNext(count -> log.info("Wrote {} raw records to {}", count, file));
    }

    private static RawRecord writeLine(BufferedWriter writer, RawRecord rawRecord) {
        try {
            writer.write(toLine(rawRecord));
            writer.newLine();
            return rawRecord;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void closeQuietly(BufferedWriter writer) {
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("Failed to close record writer", e);
        }
    }
}
