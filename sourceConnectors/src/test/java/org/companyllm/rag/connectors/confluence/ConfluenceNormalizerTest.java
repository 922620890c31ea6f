package org.companyllm.rag.connectors.confluence;

import java.time.Instant;

import org.companyllm.rag.pipeline.error.MalformedRecordException;
import org.companyllm.rag.pipeline.ir.RawRecord;
import org.companyllm.rag.pipeline.ir.SourceType;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfluenceNormalizerTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final ConfluenceNormalizer normalizer = new ConfluenceNormalizer("https://example.atlassian.net/wiki");

    @Test
    void pageWithCommentsAndAncestors() throws Exception {
        var page = (ObjectNode) MAPPER.readTree("{\"id\":\"555\",\"type\":\"page\",\"title\":\"Runbook\","
            + "\"body\":{\"storage\":{\"value\":\"<h1>Deploy</h1><p>Run <code>make</code> first</p>\"}},"
            + "\"version\":{\"number\":4,\"when\":\"2024-06-01T08:30:00.000Z\",\"by\":{\"displayName\":\"Cy\"}},"
            + "\"history\":{\"createdBy\":{\"displayName\":\"Dee\"},\"createdDate\":\"2024-01-01T00:00:00.000Z\"},"
            + "\"ancestors\":[{\"id\":\"1\"},{\"id\":\"42\"}],"
            + "\"_links\":{\"webui\":\"/spaces/OPS/pages/555/Runbook\"}}");
        var comments = MAPPER.readTree("[{\"id\":\"c9\",\"history\":{\"createdBy\":{\"displayName\":\"Eve\"},"
            + "\"createdDate\":\"2024-06-02T00:00:00.000Z\"},\"body\":{\"storage\":{\"value\":\"<p>Done &amp; dusted</p>\"}}}]");
        var record = new RawRecord(SourceType.CONFLUENCE, page)
            .withContext(ConfluenceRecordSource.SPACE_KEY_CONTEXT, TextNode.valueOf("OPS"))
            .withContext(ConfluenceRecordSource.COMMENTS_CONTEXT, comments);

        var doc = normalizer.normalize(record);

        assertEquals("confluence-555", doc.documentId());
        assertEquals("Runbook", doc.title());
        assertEquals("Deploy\n\nRun make first", doc.body());
        assertEquals(Instant.parse("2024-06-01T08:30:00Z"), doc.updatedAt());
        var metadata = doc.metadata();
        assertEquals("https://example.atlassian.net/wiki/spaces/OPS/pages/555/Runbook", metadata.get("url"));
        assertEquals("Dee", metadata.get("author"));
        assertEquals("Cy", metadata.get("last_updated_author"));
        assertEquals("4", metadata.get("version"));
        assertEquals("42", metadata.get("parent_id"));
        assertEquals("OPS", metadata.get("confluence_space_key"));
        assertEquals("1", metadata.get("comment_count"));
        var stored = MAPPER.readTree(metadata.get("comments")).get(0);
        assertEquals("Eve", stored.path("author").asText());
        assertEquals("Done & dusted", stored.path("content").asText());
    }

    @Test
    void pageWithoutIdIsMalformed() throws Exception {
        var record = new RawRecord(SourceType.CONFLUENCE, (ObjectNode) MAPPER.readTree("{\"title\":\"Orphan\"}"));
        assertThrows(MalformedRecordException.class, () -> normalizer.normalize(record));
    }
}
