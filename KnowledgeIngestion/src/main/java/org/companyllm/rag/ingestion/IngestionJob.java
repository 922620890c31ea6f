package org.companyllm.rag.ingestion;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import org.companyllm.rag.connectors.confluence.ConfluenceNormalizer;
import org.companyllm.rag.connectors.confluence.ConfluenceRecordSource;
import org.companyllm.rag.connectors.graph.SharePointNormalizer;
import org.companyllm.rag.connectors.graph.SharePointRecordSource;
import org.companyllm.rag.connectors.graph.TeamsNormalizer;
import org.companyllm.rag.connectors.graph.TeamsRecordSource;
import org.companyllm.rag.connectors.http.AccessTokenProvider;
import org.companyllm.rag.connectors.http.AuthConfig;
import org.companyllm.rag.connectors.http.ConnectionContext;
import org.companyllm.rag.connectors.http.RestClient;
import org.companyllm.rag.connectors.jira.JiraNormalizer;
import org.companyllm.rag.connectors.jira.JiraRecordSource;
import org.companyllm.rag.connectors.openai.OpenAiEmbeddingClient;
import org.companyllm.rag.pipeline.IngestionPipeline;
import org.companyllm.rag.pipeline.IngestionRun;
import org.companyllm.rag.pipeline.chunking.ChunkingConfig;
import org.companyllm.rag.pipeline.chunking.DocumentChunker;
import org.companyllm.rag.pipeline.embedding.EmbeddingProvider;
import org.companyllm.rag.pipeline.error.ConfigurationException;
import org.companyllm.rag.pipeline.ir.RunReport;
import org.companyllm.rag.pipeline.ir.SourceType;
import org.companyllm.rag.pipeline.normalize.NormalizerRegistry;
import org.companyllm.rag.pipeline.sink.VectorStore;
import org.companyllm.rag.pipeline.source.RecordSource;
import org.companyllm.rag.pipeline.upsert.IncrementalUpserter;
import org.companyllm.rag.pipeline.upsert.UpsertConfig;
import org.companyllm.rag.store.FileVectorStore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * One ingestion of every configured source into one vector store collection.
 *
 * <p>All collaborators are handed in already constructed; {@link #fromSettings} does
 * that wiring for the real providers. The job owns its sources and store and closes
 * them in {@link #close()}.
 */
@Slf4j
public class IngestionJob implements AutoCloseable {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Getter
    private final List<RecordSource> sources;
    private final NormalizerRegistry normalizers;
    @Getter
    private final VectorStore store;
    private final EmbeddingProvider embeddingProvider;
    private final ChunkingConfig chunking;
    private final UpsertConfig upsert;
    private final int sourceConcurrency;

    @Builder
    private IngestionJob(
        @Singular List<RecordSource> sources,
        @NonNull NormalizerRegistry normalizers,
        @NonNull VectorStore store,
        @NonNull EmbeddingProvider embeddingProvider,
        ChunkingConfig chunking,
        UpsertConfig upsert,
        Integer sourceConcurrency
    ) {
        this.sources = List.copyOf(sources);
        this.normalizers = normalizers;
        this.store = store;
        this.embeddingProvider = embeddingProvider;
        this.chunking = (chunking == null ? ChunkingConfig.defaults() : chunking).validate();
        this.upsert = (upsert == null ? UpsertConfig.defaults() : upsert).validate();
        this.sourceConcurrency = sourceConcurrency == null ? Math.max(1, this.sources.size()) : sourceConcurrency;
    }

    /**
     * Build a job for every provider enabled in {@code settings}.
     *
     * @param graphTokens token source for Microsoft Graph; may be null when the settings
     *                    carry a static Graph token or use no Graph provider
     */
    public static IngestionJob fromSettings(RagSettings settings, AccessTokenProvider graphTokens) {
        var builder = builder()
            .normalizers(normalizers(settings))
            .chunking(settings.getChunking())
            .upsert(settings.getUpsert())
            .embeddingProvider(new OpenAiEmbeddingClient(
                client(settings, settings.getEmbeddingBaseUrl(), AuthConfig.BearerAuth.ofToken(settings.getEmbeddingApiKey())),
                settings.getEmbeddingModel()));

        var jiraSite = settings.getJiraSite();
        if (jiraSite != null) {
            builder.source(new JiraRecordSource(
                client(settings, jiraSite.baseUrl(), new AuthConfig.BasicAuth(jiraSite.email(), jiraSite.apiToken())),
                settings.getJira()));
        }
        var confluenceSite = settings.getConfluenceSite();
        if (confluenceSite != null) {
            builder.source(new ConfluenceRecordSource(
                client(settings, confluenceSite.baseUrl(),
                    new AuthConfig.BasicAuth(confluenceSite.email(), confluenceSite.apiToken())),
                settings.getConfluence()));
        }
        if (settings.usesGraph()) {
            var graph = client(settings, settings.getGraphBaseUrl(), graphAuth(settings, graphTokens));
            if (settings.getSharePoint() != null) {
                builder.source(new SharePointRecordSource(graph, settings.getSharePoint()));
            }
            if (settings.getTeams() != null) {
                builder.source(new TeamsRecordSource(graph, settings.getTeams()));
            }
        }
        return builder.store(FileVectorStore.open(settings.getVectorStorePath(), settings.getCollectionName())).build();
    }

    /** One normalizer per provider; Confluence links are relative to the wiki root. */
    static NormalizerRegistry normalizers(RagSettings settings) {
        var registry = new NormalizerRegistry()
            .register(SourceType.SHAREPOINT, new SharePointNormalizer())
            .register(SourceType.TEAMS, new TeamsNormalizer());
        if (settings.getJiraSite() != null) {
            registry.register(SourceType.JIRA, new JiraNormalizer(settings.getJiraSite().baseUrl()));
        }
        if (settings.getConfluenceSite() != null) {
            registry.register(SourceType.CONFLUENCE, new ConfluenceNormalizer(settings.getConfluenceSite().baseUrl()));
        }
        return registry;
    }

    private static AuthConfig graphAuth(RagSettings settings, AccessTokenProvider graphTokens) {
        if (settings.getGraphAccessToken() != null) {
            return AuthConfig.BearerAuth.ofToken(settings.getGraphAccessToken());
        }
        if (graphTokens == null) {
            throw new ConfigurationException(
                "SharePoint or Teams is configured but neither GRAPH_ACCESS_TOKEN nor a token provider was supplied");
        }
        return new AuthConfig.BearerAuth(graphTokens);
    }

    private static RestClient client(RagSettings settings, String baseUrl, AuthConfig auth) {
        return RestClient.create(ConnectionContext.builder()
            .baseUri(URI.create(baseUrl))
            .auth(auth)
            .requestTimeout(settings.getRequestTimeout())
            .build());
    }

    public Mono<RunReport> run() {
        return run(new IngestionRun());
    }

    /**
     * Ingest every source, logging the run summary when done.
     * Fails only when the store fails; source failures are reported in the result.
     */
    public Mono<RunReport> run(IngestionRun ingestionRun) {
        return Mono.defer(() -> {
            log.atInfo().setMessage("Starting ingestion of {} sources into {}")
                .addArgument(() -> describeSources())
                .addArgument(() -> store.stats().location())
                .log();
            var pipeline = new IngestionPipeline(
                normalizers,
                new DocumentChunker(chunking),
                new IncrementalUpserter(store, embeddingProvider, upsert),
                sourceConcurrency);
            return pipeline.ingestAll(sources, ingestionRun);
        }).doOnNext(this::logSummary);
    }

    private String describeSources() {
        var names = new ArrayList<String>();
        sources.forEach(s -> names.add(s.name()));
        return names.toString();
    }

    private void logSummary(RunReport report) {
        try {
            log.info("Ingestion summary: {}", OBJECT_MAPPER.writeValueAsString(report.summary()));
        } catch (JsonProcessingException e) {
            log.atWarn().setMessage("Could not serialize summary {}").addArgument(report.summary()).setCause(e).log();
        }
        report.sources().stream()
            .filter(source -> !source.completed())
            .forEach(source -> log.warn("Source {} did not complete: {}", source.sourceName(), source.failure()));
        log.info("Collection {} now holds {} chunks", store.stats().name(), store.stats().count());
    }

    @Override
    public void close() {
        for (var source : sources) {
            try {
                source.close();
            } catch (Exception e) {
                log.atWarn().setMessage("Failed to close source {}").addArgument(source::name).setCause(e).log();
            }
        }
        store.close();
    }
}
