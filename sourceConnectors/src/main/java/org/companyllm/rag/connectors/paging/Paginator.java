package org.companyllm.rag.connectors.paging;

import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Lazily walks a paginated listing. Each subscription starts again from the first page;
 * pages are requested one at a time, in order.
 * A failed fetch ends the sequence with that error, after the records already emitted.
 */
@Slf4j
public class Paginator {
    private final PageFetcher fetcher;
    private final PaginationStrategy strategy;
    private final String description;

    public Paginator(PageFetcher fetcher, PaginationStrategy strategy, String description) {
        this.fetcher = fetcher;
        this.strategy = strategy;
        this.description = description;
    }

    public Flux<JsonNode> fetchAll() {
        return Flux.defer(() -> {
            var pages = new AtomicInteger();
            return fetchPage(strategy.firstRequest(), pages)
                .expand(advance -> advance.next()
                    .map(next -> fetchPage(next, pages))
                    .orElseGet(Mono::empty))
                .concatMapIterable(PageAdvance::records)
                .doOnComplete(() -> log.debug("Finished {} after {} pages", description, pages.get()));
        });
    }

    private Mono<PageAdvance> fetchPage(PageRequest request, AtomicInteger pages) {
        return fetcher.fetchJson(request.target())
            .map(response -> {
                var advance = strategy.advance(request, response);
                log.atDebug().setMessage("{} page {}: {} records, more={}")
                    .addArgument(description)
                    .addArgument(pages.incrementAndGet())
                    .addArgument(() -> advance.records().size())
                    .addArgument(() -> advance.next().isPresent())
                    .log();
                return advance;
            });
    }
}
