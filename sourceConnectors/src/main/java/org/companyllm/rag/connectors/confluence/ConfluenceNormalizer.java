package org.companyllm.rag.connectors.confluence;

import java.util.LinkedHashMap;

import org.companyllm.rag.connectors.text.CommentList;
import org.companyllm.rag.connectors.text.MarkupText;
import org.companyllm.rag.connectors.text.Metadata;
import org.companyllm.rag.connectors.text.Timestamps;
import org.companyllm.rag.pipeline.error.MalformedRecordException;
import org.companyllm.rag.pipeline.ir.CanonicalDocument;
import org.companyllm.rag.pipeline.ir.MetadataKeys;
import org.companyllm.rag.pipeline.ir.RawRecord;
import org.companyllm.rag.pipeline.ir.SourceType;
import org.companyllm.rag.pipeline.normalize.RecordNormalizer;

import com.fasterxml.jackson.databind.JsonNode;

public class ConfluenceNormalizer implements RecordNormalizer {
    private final String baseUrl;

    /** @param baseUrl wiki root that {@code _links.webui} is relative to, e.g. {@code https://example.atlassian.net/wiki} */
    public ConfluenceNormalizer(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public CanonicalDocument normalize(RawRecord rawRecord) {
        var page = rawRecord.payload();
        var id = Metadata.text(page.path("id"), null);
        if (id == null) {
            throw new MalformedRecordException("Confluence page without id (title=" + page.path("title").asText("?") + ")");
        }

        var metadata = new LinkedHashMap<String, String>();
        metadata.put(MetadataKeys.CONTENT_TYPE, Metadata.text(page.path("type"), "page"));
        var webUi = Metadata.text(page.path("_links").path("webui"), null);
        if (webUi != null) {
            metadata.put(MetadataKeys.URL, baseUrl + webUi);
        }
        metadata.put(MetadataKeys.AUTHOR, Metadata.text(page.path("history").path("createdBy").path("displayName"), "Unknown"));
        Metadata.putIfPresent(metadata, MetadataKeys.CREATED_AT, page.path("history").path("createdDate"));
        Metadata.putIfPresent(metadata, "confluence_space_key",
            rawRecord.context().has(ConfluenceRecordSource.SPACE_KEY_CONTEXT)
                ? rawRecord.context().path(ConfluenceRecordSource.SPACE_KEY_CONTEXT)
                : page.path("space").path("key"));
        Metadata.putIfPresent(metadata, "last_updated_author", page.path("version").path("by").path("displayName"));
        Metadata.putIfPresent(metadata, "version", page.path("version").path("number"));
        var ancestors = page.path("ancestors");
        if (ancestors.isArray() && ancestors.size() > 0) {
            Metadata.putIfPresent(metadata, MetadataKeys.PARENT_ID, ancestors.get(ancestors.size() - 1).path("id"));
        }

        var comments = new CommentList();
        for (var comment : rawRecord.context().path(ConfluenceRecordSource.COMMENTS_CONTEXT)) {
            comments.add(
                Metadata.text(comment.path("id"), null),
                commentAuthor(comment),
                Metadata.text(comment.path("history").path("createdDate"), null),
                MarkupText.toPlainText(comment.path("body").path("storage").path("value").asText("")));
        }
        comments.putInto(metadata);

        return CanonicalDocument.builder()
            .source(SourceType.CONFLUENCE)
            .externalId(id)
            .title(Metadata.text(page.path("title"), "Untitled"))
            .body(MarkupText.toPlainText(page.path("body").path("storage").path("value").asText("")))
            .metadata(metadata)
            .updatedAt(Timestamps.parseLenient(Metadata.text(page.path("version").path("when"), null)).orElse(null))
            .build();
    }

    private static String commentAuthor(JsonNode comment) {
        var author = Metadata.text(comment.path("history").path("createdBy").path("displayName"), null);
        if (author == null) {
            author = Metadata.text(comment.path("author").path("displayName"), null);
        }
        return author == null ? Metadata.text(comment.path("version").path("by").path("displayName"), "Unknown") : author;
    }
}
