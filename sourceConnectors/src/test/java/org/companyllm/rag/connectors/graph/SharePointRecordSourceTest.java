package org.companyllm.rag.connectors.graph;

import org.companyllm.rag.connectors.http.AuthConfig;
import org.companyllm.rag.connectors.http.ConnectionContext;
import org.companyllm.rag.connectors.http.FakeProviderServer;
import org.companyllm.rag.connectors.http.RestClient;
import org.companyllm.rag.pipeline.ir.RawRecord;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class SharePointRecordSourceTest {
    private final FakeProviderServer server = new FakeProviderServer();
    private final RestClient client = RestClient.create(ConnectionContext.of(server.baseUrl(), AuthConfig.NoAuth.INSTANCE));

    @AfterEach
    void tearDown() {
        server.close();
    }

    private static String content(RawRecord r) {
        return r.context().path(SharePointRecordSource.CONTENT_CONTEXT).asText();
    }

    private static String path(RawRecord r) {
        return r.context().path(SharePointRecordSource.FILE_PATH_CONTEXT).asText();
    }

    private void engSiteWithOneFolder() {
        server.json("/sites?search=Eng", "{\"value\":[{\"id\":\"s-other\",\"displayName\":\"Engineering\"},"
                + "{\"id\":\"s1\",\"displayName\":\"Eng\"}]}")
            .json("/sites/s1/drive", "{\"id\":\"d1\"}")
            .json("/drives/d1/root/children", "{\"value\":["
                + "{\"id\":\"fo1\",\"name\":\"Docs\",\"folder\":{\"childCount\":1}},"
                + "{\"id\":\"f1\",\"name\":\"a.txt\",\"file\":{\"mimeType\":\"text/plain\"},"
                + "\"@microsoft.graph.downloadUrl\":\"" + server.url("/download/f1") + "\"}]}")
            .json("/drives/d1/items/fo1/children", "{\"value\":["
                + "{\"id\":\"f2\",\"name\":\"deck.pdf\",\"file\":{\"mimeType\":\"application/pdf\"},"
                + "\"@microsoft.graph.downloadUrl\":\"" + server.url("/download/f2") + "\"}]}");
    }

    @Test
    void walksFoldersAndDownloadsOnlyTextFiles() {
        engSiteWithOneFolder();
        server.text("/download/f1", "hello text");
        var source = new SharePointRecordSource(client, SharePointConfig.builder().siteName("Eng").build());

        StepVerifier.create(source.readRecords())
            .assertNext(r -> {
                assertEquals("f2", r.payload().path("id").asText());
                assertEquals("/Docs/deck.pdf", path(r));
                assertTrue(content(r).startsWith("[Content not extracted"));
                assertFalse(r.payload().has("_path"));
            })
            .assertNext(r -> {
                assertEquals("/a.txt", path(r));
                assertEquals("hello text", content(r));
                assertEquals("Eng", r.context().path(SharePointRecordSource.SITE_NAME_CONTEXT).asText());
            })
            .verifyComplete();
        assertEquals(0, server.countRequests("/download/f2"));
    }

    @Test
    void failedDownloadKeepsTheFileWithAnErrorBody() {
        engSiteWithOneFolder();
        server.respond("/download/f1", 500, "{}");
        var source = new SharePointRecordSource(client, SharePointConfig.builder().siteName("Eng").build());

        StepVerifier.create(source.readRecords().map(SharePointRecordSourceTest::content))
            .expectNextCount(1)
            .assertNext(body -> assertTrue(body.startsWith("[Error downloading content:"), body))
            .verifyComplete();
    }

    @Test
    void siteFallsBackToHostnamePaths() {
        server.json("/sites?search=Ops", "{\"value\":[]}")
            .json("/sites/root", "{\"webUrl\":\"https://contoso.sharepoint.com\"}")
            .respond("/sites/contoso.sharepoint.com:/sites/Ops", 404, "{}")
            .json("/sites/contoso.sharepoint.com:/Ops", "{\"id\":\"s2\",\"displayName\":\"Ops\"}");

        StepVerifier.create(new SharePointRecordSource(client, SharePointConfig.builder().build()).resolveSite("Ops"))
            .assertNext(site -> assertEquals("s2", site.path("id").asText()))
            .verifyComplete();
    }

    @Test
    void mimeTypeParametersAreIgnored() {
        var file = FakeProviderServer.parse("{\"file\":{\"mimeType\":\"Text/HTML; charset=utf-8\"}}");
        assertEquals("text/html", SharePointRecordSource.mimeTypeOf(file));
        assertEquals("", SharePointRecordSource.mimeTypeOf(FakeProviderServer.parse("{}")));
    }
}
