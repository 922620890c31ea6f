package org.companyllm.rag.connectors.jira;

import java.time.Instant;
import java.util.Optional;

import org.companyllm.rag.pipeline.error.MalformedRecordException;
import org.companyllm.rag.pipeline.ir.RawRecord;
import org.companyllm.rag.pipeline.ir.SourceType;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JiraNormalizerTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final JiraNormalizer normalizer = new JiraNormalizer("https://example.atlassian.net/");

    private static RawRecord issue(String json) throws Exception {
        return new RawRecord(SourceType.JIRA, (ObjectNode) MAPPER.readTree(json));
    }

    @Test
    void issueBecomesDocumentWithCommentsInMetadata() throws Exception {
        var record = issue("{\"id\":\"10001\",\"key\":\"ENG-1\",\"fields\":{"
            + "\"summary\":\"Login fails\","
            + "\"description\":{\"type\":\"doc\",\"content\":[{\"type\":\"paragraph\","
            + "\"content\":[{\"type\":\"text\",\"text\":\"Steps to reproduce\"}]}]},"
            + "\"reporter\":{\"displayName\":\"Ann\"},"
            + "\"created\":\"2024-05-01T10:00:00.000+0000\","
            + "\"updated\":\"2024-05-02T11:00:00.000+0000\","
            + "\"status\":{\"name\":\"Open\"},\"issuetype\":{\"name\":\"Bug\"},\"project\":{\"key\":\"ENG\"},"
            + "\"comment\":{\"comments\":[{\"id\":\"c1\",\"author\":{\"displayName\":\"Bob\"},"
            + "\"created\":\"2024-05-01T12:00:00.000+0000\",\"body\":\"Looking into it\"}]}}}")
            .withContext(JiraRecordSource.PROJECT_KEY_CONTEXT, TextNode.valueOf("ENG"));

        var doc = normalizer.normalize(record);

        assertEquals("jira-10001", doc.documentId());
        assertEquals("Login fails", doc.title());
        assertEquals("Steps to reproduce", doc.body());
        assertEquals(Optional.of(Instant.parse("2024-05-02T11:00:00Z")), doc.lastUpdated());
        var metadata = doc.metadata();
        assertEquals("https://example.atlassian.net/browse/ENG-1", metadata.get("url"));
        assertEquals("ENG-1", metadata.get("jira_issue_key"));
        assertEquals("ENG", metadata.get("jira_project_key"));
        assertEquals("Ann", metadata.get("author"));
        assertEquals("Bug", metadata.get("jira_issue_type"));
        assertEquals("None", metadata.get("priority"));
        assertEquals("Unassigned", metadata.get("assignee"));
        assertEquals("1", metadata.get("comment_count"));
        var comments = MAPPER.readTree(metadata.get("comments"));
        assertEquals("Bob", comments.get(0).path("author").asText());
        assertEquals("Looking into it", comments.get(0).path("content").asText());
    }

    @Test
    void missingOptionalFieldsDegradeToDefaults() throws Exception {
        var doc = normalizer.normalize(issue("{\"id\":\"7\",\"fields\":{}}"));

        assertEquals("No Summary", doc.title());
        assertEquals("", doc.body());
        assertTrue(doc.lastUpdated().isEmpty());
        assertFalse(doc.metadata().containsKey("url"));
        assertFalse(doc.metadata().containsKey("comments"));
    }

    @Test
    void issueWithoutIdIsMalformed() throws Exception {
        var record = issue("{\"key\":\"ENG-2\",\"fields\":{\"summary\":\"x\"}}");
        var e = assertThrows(MalformedRecordException.class, () -> normalizer.normalize(record));
        assertTrue(e.getMessage().contains("ENG-2"));
    }
}
