package org.companyllm.rag.connectors.jira;

import org.companyllm.rag.connectors.http.AuthConfig;
import org.companyllm.rag.connectors.http.ConnectionContext;
import org.companyllm.rag.connectors.http.FakeProviderServer;
import org.companyllm.rag.connectors.http.RestClient;
import org.companyllm.rag.pipeline.error.TransportException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class JiraRecordSourceTest {
    private static final String ENG_SEARCH = JiraRecordSource.SEARCH_PATH
        + "?jql=project = \"ENG\" ORDER BY updated DESC&maxResults=2&fields=" + JiraRecordSource.FIELDS;

    private final FakeProviderServer server = new FakeProviderServer();
    private final RestClient client =
        RestClient.create(ConnectionContext.of(server.baseUrl(), new AuthConfig.BasicAuth("a@example.com", "t")));

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void readsAllPagesOfConfiguredProject() {
        server.json(ENG_SEARCH, "{\"issues\":[{\"id\":\"1\"},{\"id\":\"2\"}],\"nextPageToken\":\"p2\"}")
            .json(ENG_SEARCH + "&nextPageToken=p2", "{\"issues\":[{\"id\":\"3\"}],\"isLast\":true}");
        var source = new JiraRecordSource(client, JiraConfig.builder().projectKey("ENG").maxResults(2).build());

        StepVerifier.create(source.readRecords())
            .assertNext(r -> {
                assertEquals("1", r.payload().path("id").asText());
                assertEquals("ENG", r.context().path(JiraRecordSource.PROJECT_KEY_CONTEXT).asText());
            })
            .expectNextCount(2)
            .verifyComplete();
        assertEquals(2, server.countRequests(JiraRecordSource.SEARCH_PATH));
        assertEquals("jira", source.name());
    }

    @Test
    void discoversProjectsWhenNoneConfigured() {
        server.json(JiraRecordSource.PROJECTS_PATH, "[{\"key\":\"ENG\"},{\"key\":\"\"}]")
            .json(ENG_SEARCH, "{\"issues\":[{\"id\":\"9\"}],\"isLast\":true}");
        var source = new JiraRecordSource(client, JiraConfig.builder().maxResults(2).build());

        StepVerifier.create(source.readRecords())
            .assertNext(r -> assertEquals("9", r.payload().path("id").asText()))
            .verifyComplete();
    }

    @Test
    void failingPageEndsStreamAfterEarlierIssues() {
        server.json(ENG_SEARCH, "{\"issues\":[{\"id\":\"1\"}],\"nextPageToken\":\"p2\"}")
            .respond(ENG_SEARCH + "&nextPageToken=p2", 500, "{\"errorMessages\":[\"boom\"]}");
        var source = new JiraRecordSource(client, JiraConfig.builder().projectKey("ENG").maxResults(2).build());

        StepVerifier.create(source.readRecords())
            .expectNextCount(1)
            .expectError(TransportException.class)
            .verify();
    }

    @Test
    void lookbackIsExpressedInJql() {
        var source = new JiraRecordSource(client, JiraConfig.builder().lookbackDays(7).build());
        assertEquals("project = \"OPS\" AND updated >= \"-7d\" ORDER BY updated DESC", source.jql("OPS"));
    }
}
