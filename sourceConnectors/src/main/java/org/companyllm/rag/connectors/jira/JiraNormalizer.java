package org.companyllm.rag.connectors.jira;

import java.util.LinkedHashMap;

import org.companyllm.rag.connectors.text.AdfText;
import org.companyllm.rag.connectors.text.CommentList;
import org.companyllm.rag.connectors.text.Metadata;
import org.companyllm.rag.connectors.text.Timestamps;
import org.companyllm.rag.pipeline.error.MalformedRecordException;
import org.companyllm.rag.pipeline.ir.CanonicalDocument;
import org.companyllm.rag.pipeline.ir.MetadataKeys;
import org.companyllm.rag.pipeline.ir.RawRecord;
import org.companyllm.rag.pipeline.ir.SourceType;
import org.companyllm.rag.pipeline.normalize.RecordNormalizer;

/**
 * Jira issue to canonical document. The description and every comment are converted
 * from Atlassian Document Format; comments go to metadata.
 */
public class JiraNormalizer implements RecordNormalizer {
    private final String browseBaseUrl;

    /** @param baseUrl site URL, e.g. {@code https://example.atlassian.net} */
    public JiraNormalizer(String baseUrl) {
        this.browseBaseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public CanonicalDocument normalize(RawRecord rawRecord) {
        var issue = rawRecord.payload();
        var id = Metadata.text(issue.path("id"), null);
        if (id == null) {
            throw new MalformedRecordException("Jira issue without id (key=" + issue.path("key").asText("?") + ")");
        }
        var fields = issue.path("fields");
        var key = Metadata.text(issue.path("key"), null);

        var metadata = new LinkedHashMap<String, String>();
        metadata.put(MetadataKeys.CONTENT_TYPE, "issue");
        if (key != null) {
            metadata.put(MetadataKeys.URL, browseBaseUrl + "/browse/" + key);
            metadata.put("jira_issue_key", key);
        }
        metadata.put(MetadataKeys.AUTHOR, Metadata.text(fields.path("reporter").path("displayName"), "Unknown"));
        Metadata.putIfPresent(metadata, MetadataKeys.CREATED_AT, fields.path("created"));
        Metadata.putIfPresent(metadata, "jira_project_key",
            rawRecord.context().has(JiraRecordSource.PROJECT_KEY_CONTEXT)
                ? rawRecord.context().path(JiraRecordSource.PROJECT_KEY_CONTEXT)
                : fields.path("project").path("key"));
        metadata.put("jira_issue_type", Metadata.text(fields.path("issuetype").path("name"), "Unknown"));
        metadata.put("status", Metadata.text(fields.path("status").path("name"), "Unknown"));
        metadata.put("priority", Metadata.text(fields.path("priority").path("name"), "None"));
        metadata.put("assignee", Metadata.text(fields.path("assignee").path("displayName"), "Unassigned"));

        var comments = new CommentList();
        for (var comment : fields.path("comment").path("comments")) {
            comments.add(
                Metadata.text(comment.path("id"), null),
                Metadata.text(comment.path("author").path("displayName"), "Unknown"),
                Metadata.text(comment.path("created"), null),
                AdfText.toPlainText(comment.path("body")));
        }
        comments.putInto(metadata);

        return CanonicalDocument.builder()
            .source(SourceType.JIRA)
            .externalId(id)
            .title(Metadata.text(fields.path("summary"), "No Summary"))
            .body(AdfText.toPlainText(fields.path("description")))
            .metadata(metadata)
            .updatedAt(Timestamps.parseLenient(Metadata.text(fields.path("updated"), null)).orElse(null))
            .build();
    }
}
