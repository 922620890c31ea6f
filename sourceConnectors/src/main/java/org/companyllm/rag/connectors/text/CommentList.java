package org.companyllm.rag.connectors.text;

import java.util.Map;

import org.companyllm.rag.pipeline.ir.MetadataKeys;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * Collects comments of an issue or page and stores them in flat metadata as a JSON
 * array of {@code {id, author, created_at, content}} objects.
 */
public class CommentList {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final ArrayNode comments = OBJECT_MAPPER.createArrayNode();

    public CommentList add(String id, String author, String createdAt, String content) {
        var comment = comments.addObject();
        comment.put("id", id);
        comment.put("author", author == null || author.isBlank() ? "Unknown" : author);
        comment.put("created_at", createdAt);
        comment.put("content", content == null ? "" : content);
        return this;
    }

    public int size() {
        return comments.size();
    }

    /** Adds the comments and their count; leaves {@code metadata} untouched when there are none. */
    public void putInto(Map<String, String> metadata) {
        if (comments.isEmpty()) {
            return;
        }
        try {
            metadata.put(MetadataKeys.COMMENTS, OBJECT_MAPPER.writeValueAsString(comments));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Comment list could not be serialized", e);
        }
        metadata.put(MetadataKeys.COMMENT_COUNT, Integer.toString(comments.size()));
    }
}
