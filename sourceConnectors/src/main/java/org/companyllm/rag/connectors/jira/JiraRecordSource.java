package org.companyllm.rag.connectors.jira;

import org.companyllm.rag.connectors.http.QueryString;
import org.companyllm.rag.connectors.http.RestClient;
import org.companyllm.rag.connectors.paging.Paginator;
import org.companyllm.rag.connectors.paging.TokenCursorPagination;
import org.companyllm.rag.pipeline.ir.RawRecord;
import org.companyllm.rag.pipeline.ir.SourceType;
import org.companyllm.rag.pipeline.source.RecordSource;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

/**
 * Issues of the configured (or all discovered) Jira Cloud projects, newest update first.
 * Uses the token-paginated {@code /rest/api/3/search/jql} endpoint.
 */
@Slf4j
public class JiraRecordSource implements RecordSource {
    static final String PROJECTS_PATH = "/rest/api/3/project";
    static final String SEARCH_PATH = "/rest/api/3/search/jql";
    static final String FIELDS =
        "summary,description,comment,status,priority,reporter,assignee,issuetype,created,updated,project";
    public static final String PROJECT_KEY_CONTEXT = "project_key";

    private final RestClient client;
    private final JiraConfig config;

    public JiraRecordSource(RestClient client, JiraConfig config) {
        this.client = client;
        this.config = config.validate();
    }

    @Override
    public String name() {
        return SourceType.JIRA.wireName();
    }

    @Override
    public Flux<RawRecord> readRecords() {
        return projectKeys()
            .concatMap(projectKey -> new Paginator(client, searchPagination(projectKey), "jira project " + projectKey)
                .fetchAll()
                .filter(issue -> issue.isObject())
                .map(issue -> new RawRecord(SourceType.JIRA, (ObjectNode) issue)
                    .withContext(PROJECT_KEY_CONTEXT, TextNode.valueOf(projectKey))));
    }

    private Flux<String> projectKeys() {
        if (!config.getProjectKeys().isEmpty()) {
            return Flux.fromIterable(config.getProjectKeys());
        }
        return client.getJson(PROJECTS_PATH)
            .flatMapMany(projects -> Flux.fromIterable(projects))
            .map(project -> project.path("key").asText(""))
            .filter(key -> !key.isBlank())
            .collectList()
            .doOnNext(keys -> log.info("Discovered {} Jira projects: {}", keys.size(), keys))
            .flatMapMany(Flux::fromIterable);
    }

    TokenCursorPagination searchPagination(String projectKey) {
        return TokenCursorPagination.builder()
            .path(SEARCH_PATH)
            .query(QueryString.of("jql", jql(projectKey))
                .and("maxResults", config.getMaxResults())
                .and("fields", FIELDS))
            .build();
    }

    String jql(String projectKey) {
        var jql = new StringBuilder("project = \"").append(projectKey).append('"');
        if (config.getLookbackDays() != null) {
            jql.append(" AND updated >= \"-").append(config.getLookbackDays()).append("d\"");
        }
        return jql.append(" ORDER BY updated DESC").toString();
    }
}
