package org.companyllm.rag.connectors.graph;

import java.util.LinkedHashMap;

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

/**
 * Teams channel message to canonical document. Replies carry {@code parent_id}; every
 * message carries the {@code thread_id} of its root message.
 */
public class TeamsNormalizer implements RecordNormalizer {

    @Override
    public CanonicalDocument normalize(RawRecord rawRecord) {
        var message = rawRecord.payload();
        var context = rawRecord.context();
        var id = Metadata.text(message.path("id"), null);
        if (id == null) {
            throw new MalformedRecordException("Teams message without id");
        }
        var channelName = Metadata.text(context.path(TeamsRecordSource.CHANNEL_NAME_CONTEXT), "unknown channel");
        var parentId = Metadata.text(message.path("replyToId"), null);

        var metadata = new LinkedHashMap<String, String>();
        metadata.put(MetadataKeys.CONTENT_TYPE, "message");
        Metadata.putIfPresent(metadata, MetadataKeys.URL, message.path("webUrl"));
        metadata.put(MetadataKeys.AUTHOR, author(message.path("from")));
        Metadata.putIfPresent(metadata, MetadataKeys.CREATED_AT, message.path("createdDateTime"));
        Metadata.putIfPresent(metadata, "teams_team_name", context.path(TeamsRecordSource.TEAM_NAME_CONTEXT));
        Metadata.putIfPresent(metadata, "teams_team_id", context.path(TeamsRecordSource.TEAM_ID_CONTEXT));
        metadata.put("teams_channel_name", channelName);
        Metadata.putIfPresent(metadata, "teams_channel_id", context.path(TeamsRecordSource.CHANNEL_ID_CONTEXT));
        Metadata.putIfPresent(metadata, "message_type", message.path("messageType"));
        if (parentId != null) {
            metadata.put(MetadataKeys.PARENT_ID, parentId);
        }
        metadata.put(MetadataKeys.THREAD_ID, parentId != null ? parentId : id);

        var updated = Metadata.text(message.path("lastModifiedDateTime"), null);
        if (updated == null) {
            updated = Metadata.text(message.path("createdDateTime"), null);
        }
        return CanonicalDocument.builder()
            .source(SourceType.TEAMS)
            .externalId(id)
            .title(Metadata.text(message.path("subject"), "Teams Message in " + channelName))
            .body(body(message.path("body")))
            .metadata(metadata)
            .updatedAt(Timestamps.parseLenient(updated).orElse(null))
            .build();
    }

    private static String body(JsonNode body) {
        var content = body.path("content").asText("");
        return "html".equalsIgnoreCase(body.path("contentType").asText("html"))
            ? MarkupText.toPlainText(content)
            : content.strip();
    }

    private static String author(JsonNode from) {
        var user = Metadata.text(from.path("user").path("displayName"), null);
        if (user != null) {
            return user;
        }
        return Metadata.text(from.path("application").path("displayName"), "Unknown");
    }
}
