package org.companyllm.rag.connectors.graph;

import java.net.URI;

import org.companyllm.rag.connectors.http.QueryString;
import org.companyllm.rag.connectors.http.RestClient;
import org.companyllm.rag.connectors.paging.LinkPagination;
import org.companyllm.rag.connectors.paging.Paginator;
import org.companyllm.rag.pipeline.error.TransportException;
import org.companyllm.rag.pipeline.ir.RawRecord;
import org.companyllm.rag.pipeline.ir.SourceType;
import org.companyllm.rag.pipeline.source.RecordSource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Files of SharePoint document libraries, read through Microsoft Graph.
 *
 * Each site's default drive is walked recursively; every listing follows
 * {@code @odata.nextLink}. Text files are downloaded, anything else gets a
 * placeholder body so the file still shows up in search by name.
 */
@Slf4j
public class SharePointRecordSource implements RecordSource {
    public static final String SITE_NAME_CONTEXT = "site_name";
    public static final String FILE_PATH_CONTEXT = "file_path";
    public static final String CONTENT_CONTEXT = "content";
    static final String DOWNLOAD_URL_FIELD = "@microsoft.graph.downloadUrl";

    private final RestClient client;
    private final SharePointConfig config;
    private final LookbackWindow lookback;

    public SharePointRecordSource(RestClient client, SharePointConfig config) {
        this.client = client;
        this.config = config.validate();
        this.lookback = LookbackWindow.of(config.getLookbackDays(), config.getClock());
    }

    @Override
    public String name() {
        return SourceType.SHAREPOINT.wireName();
    }

    @Override
    public Flux<RawRecord> readRecords() {
        return sites().concatMap(this::siteFiles);
    }

    private Flux<JsonNode> sites() {
        if (config.getSiteNames().isEmpty()) {
            return new Paginator(client, new LinkPagination("/sites?search=*"), "sharepoint sites").fetchAll();
        }
        return Flux.fromIterable(config.getSiteNames()).concatMap(this::resolveSite);
    }

    /**
     * Search by name, preferring an exact (case-insensitive) display name or name match
     * over the first hit. Falls back to the {@code <hostname>:/sites/<name>} path when
     * the search fails or finds nothing.
     */
    Mono<JsonNode> resolveSite(String siteName) {
        var search = client.getJson(QueryString.of("search", siteName).appendTo("/sites"))
            .flatMap(result -> {
                JsonNode first = null;
                for (var site : result.path("value")) {
                    if (first == null) {
                        first = site;
                    }
                    if (siteName.equalsIgnoreCase(site.path("displayName").asText(""))
                        || siteName.equalsIgnoreCase(site.path("name").asText(""))) {
                        return Mono.just(site);
                    }
                }
                return Mono.justOrEmpty(first);
            })
            .onErrorResume(TransportException.class, e -> {
                log.warn("SharePoint site search failed for '{}': {}. Falling back to hostname lookup", siteName,
                    e.getMessage());
                return Mono.empty();
            });
        return search.switchIfEmpty(Mono.defer(() -> resolveSiteByPath(siteName)))
            .map(site -> (JsonNode) ((ObjectNode) site.deepCopy()).put("_requestedName", siteName));
    }

    private Mono<JsonNode> resolveSiteByPath(String siteName) {
        return client.getJson("/sites/root")
            .map(root -> URI.create(root.path("webUrl").asText()).getHost())
            .flatMap(hostname -> client.getJson("/sites/" + hostname + ":/sites/" + siteName)
                .onErrorResume(
                    e -> e instanceof TransportException && ((TransportException) e).getStatusCode() == 404,
                    e -> client.getJson("/sites/" + hostname + ":/" + siteName)));
    }

    private Flux<RawRecord> siteFiles(JsonNode site) {
        var siteId = site.path("id").asText("");
        var siteName = site.path("_requestedName").asText(site.path("displayName").asText(siteId));
        if (siteId.isBlank()) {
            log.warn("Skipping SharePoint site without id: {}", siteName);
            return Flux.empty();
        }
        return client.getJson("/sites/" + siteId + "/drive")
            .map(drive -> drive.path("id").asText())
            .flatMapMany(driveId -> walk(driveId, "/drives/" + driveId + "/root/children", ""))
            .filter(lookback::includes)
            .concatMap(file -> toRecord(file, siteName));
    }

    private Flux<JsonNode> walk(String driveId, String childrenTarget, String folderPath) {
        return new Paginator(client, new LinkPagination(childrenTarget), "sharepoint folder " + folderPath + "/")
            .fetchAll()
            .concatMap(item -> {
                var itemPath = folderPath + "/" + item.path("name").asText("");
                if (item.has("folder")) {
                    return walk(driveId, "/drives/" + driveId + "/items/" + item.path("id").asText() + "/children", itemPath);
                }
                if (item.has("file") && item.isObject()) {
                    return Flux.<JsonNode>just(((ObjectNode) item.deepCopy()).put("_path", itemPath));
                }
                return Flux.<JsonNode>empty();
            });
    }

    private Mono<RawRecord> toRecord(JsonNode file, String siteName) {
        var payload = (ObjectNode) file.deepCopy();
        var path = payload.remove("_path").asText();
        return content(file).map(content -> new RawRecord(SourceType.SHAREPOINT, payload)
            .withContext(SITE_NAME_CONTEXT, TextNode.valueOf(siteName))
            .withContext(FILE_PATH_CONTEXT, TextNode.valueOf(path))
            .withContext(CONTENT_CONTEXT, TextNode.valueOf(content)));
    }

    private Mono<String> content(JsonNode file) {
        var downloadUrl = file.path(DOWNLOAD_URL_FIELD).asText("");
        var mimeType = mimeTypeOf(file);
        if (downloadUrl.isBlank()) {
            return Mono.just("[Content not available for download]");
        }
        if (!config.getTextMimeTypes().contains(mimeType)) {
            return Mono.just("[Content not extracted: Unsupported MIME type " + mimeType + "]");
        }
        return client.getText(downloadUrl)
            .onErrorResume(TransportException.class, e -> {
                log.atWarn().setMessage("Could not download content of {}: {}")
                    .addArgument(() -> file.path("name").asText())
                    .addArgument(e::getMessage)
                    .log();
                return Mono.just("[Error downloading content: " + e.getMessage() + "]");
            });
    }

    static String mimeTypeOf(JsonNode file) {
        var mimeType = file.path("file").path("mimeType").asText("");
        var separator = mimeType.indexOf(';');
        return (separator >= 0 ? mimeType.substring(0, separator) : mimeType).trim().toLowerCase();
    }
}
