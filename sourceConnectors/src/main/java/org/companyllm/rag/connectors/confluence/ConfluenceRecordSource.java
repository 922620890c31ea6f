package org.companyllm.rag.connectors.confluence;

import org.companyllm.rag.connectors.http.QueryString;
import org.companyllm.rag.connectors.http.RestClient;
import org.companyllm.rag.connectors.paging.Paginator;
import org.companyllm.rag.connectors.paging.SizeThresholdPagination;
import org.companyllm.rag.pipeline.ir.RawRecord;
import org.companyllm.rag.pipeline.ir.SourceType;
import org.companyllm.rag.pipeline.source.RecordSource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Pages of the configured (or all discovered) Confluence spaces. Every listing here
 * uses start/limit paging. Page comments are fetched per page and attached to the
 * record's extraction context.
 */
@Slf4j
public class ConfluenceRecordSource implements RecordSource {
    static final String SPACES_PATH = "/rest/api/space";
    static final String CONTENT_PATH = "/rest/api/content";
    static final String SEARCH_PATH = "/rest/api/content/search";
    static final String PAGE_EXPAND = "body.storage,version,history,ancestors";
    static final String COMMENT_EXPAND = "body.storage,history,version";
    public static final String SPACE_KEY_CONTEXT = "space_key";
    public static final String COMMENTS_CONTEXT = "comments";

    private final RestClient client;
    private final ConfluenceConfig config;

    public ConfluenceRecordSource(RestClient client, ConfluenceConfig config) {
        this.client = client;
        this.config = config.validate();
    }

    @Override
    public String name() {
        return SourceType.CONFLUENCE.wireName();
    }

    @Override
    public Flux<RawRecord> readRecords() {
        return spaceKeys()
            .concatMap(spaceKey -> new Paginator(client, pagePagination(spaceKey), "confluence space " + spaceKey)
                .fetchAll()
                .filter(JsonNode::isObject)
                .concatMap(page -> withComments(new RawRecord(SourceType.CONFLUENCE, (ObjectNode) page)
                    .withContext(SPACE_KEY_CONTEXT, TextNode.valueOf(spaceKey)))));
    }

    private Flux<String> spaceKeys() {
        if (!config.getSpaceKeys().isEmpty()) {
            return Flux.fromIterable(config.getSpaceKeys());
        }
        var spaces = SizeThresholdPagination.builder()
            .path(SPACES_PATH)
            .pageSize(config.getPageLimit())
            .build();
        return new Paginator(client, spaces, "confluence spaces").fetchAll()
            .map(space -> space.path("key").asText(""))
            .filter(key -> !key.isBlank())
            .collectList()
            .doOnNext(keys -> log.info("Discovered {} Confluence spaces: {}", keys.size(), keys))
            .flatMapMany(Flux::fromIterable);
    }

    SizeThresholdPagination pagePagination(String spaceKey) {
        if (config.getLookbackDays() != null) {
            var cql = "space = \"" + spaceKey + "\" AND type = \"page\" AND lastModified >= now(\"-"
                + config.getLookbackDays() + "d\")";
            return SizeThresholdPagination.builder()
                .path(SEARCH_PATH)
                .query(QueryString.of("cql", cql).and("expand", PAGE_EXPAND))
                .pageSize(config.getPageLimit())
                .build();
        }
        return SizeThresholdPagination.builder()
            .path(CONTENT_PATH)
            .query(QueryString.of("spaceKey", spaceKey).and("type", "page").and("expand", PAGE_EXPAND))
            .pageSize(config.getPageLimit())
            .build();
    }

    private Mono<RawRecord> withComments(RawRecord page) {
        var pageId = page.payload().path("id").asText("");
        if (!config.isIncludeComments() || pageId.isBlank()) {
            return Mono.just(page);
        }
        var comments = SizeThresholdPagination.builder()
            .path(CONTENT_PATH + "/" + pageId + "/child/comment")
            .query(QueryString.of("expand", COMMENT_EXPAND))
            .pageSize(config.getPageLimit())
            .build();
        return new Paginator(client, comments, "comments of page " + pageId).fetchAll()
            .collect(JsonNodeFactory.instance::arrayNode, (array, comment) -> array.add(comment))
            .map(array -> page.withContext(COMMENTS_CONTEXT, array));
    }
}
