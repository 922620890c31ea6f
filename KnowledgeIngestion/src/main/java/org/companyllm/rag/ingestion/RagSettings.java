package org.companyllm.rag.ingestion;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.companyllm.rag.connectors.confluence.ConfluenceConfig;
import org.companyllm.rag.connectors.graph.SharePointConfig;
import org.companyllm.rag.connectors.graph.TeamsConfig;
import org.companyllm.rag.connectors.jira.JiraConfig;
import org.companyllm.rag.connectors.openai.OpenAiEmbeddingClient;
import org.companyllm.rag.pipeline.chunking.ChunkUnit;
import org.companyllm.rag.pipeline.chunking.ChunkingConfig;
import org.companyllm.rag.pipeline.error.ConfigurationException;
import org.companyllm.rag.pipeline.retrieval.RetrievalConfig;
import org.companyllm.rag.pipeline.upsert.UpsertConfig;

import lombok.Builder;
import lombok.Value;

/**
 * Everything one ingestion job or knowledge-base query needs, read from environment-style
 * key/value pairs.
 *
 * <p>A provider is enabled by setting its base URL (Jira, Confluence) or the names to ingest
 * (SharePoint sites, Teams teams; {@code *} discovers all). Provider sections are null when
 * disabled. All problems found while reading are reported together in one
 * {@link ConfigurationException}.
 */
@Value
@Builder
public class RagSettings {
    public static final String DEFAULT_GRAPH_BASE_URL = "https://graph.microsoft.com/v1.0";
    public static final String DEFAULT_VECTOR_STORE_PATH = "./vector_store";
    public static final String DEFAULT_COLLECTION_NAME = "company_knowledge";
    public static final String DISCOVER_ALL = "*";

    /** Base URL plus account email and API token of an Atlassian Cloud site. */
    public record AtlassianSite(String baseUrl, String email, String apiToken) {}

    String embeddingApiKey;
    @Builder.Default
    String embeddingBaseUrl = OpenAiEmbeddingClient.DEFAULT_BASE_URL;
    @Builder.Default
    String embeddingModel = OpenAiEmbeddingClient.DEFAULT_MODEL;

    AtlassianSite jiraSite;
    JiraConfig jira;
    AtlassianSite confluenceSite;
    ConfluenceConfig confluence;

    @Builder.Default
    String graphBaseUrl = DEFAULT_GRAPH_BASE_URL;
    /** Static Graph token; when absent the job must be given a token provider. */
    String graphAccessToken;
    SharePointConfig sharePoint;
    TeamsConfig teams;

    @Builder.Default
    ChunkingConfig chunking = ChunkingConfig.defaults();
    @Builder.Default
    UpsertConfig upsert = UpsertConfig.defaults();
    @Builder.Default
    RetrievalConfig retrieval = RetrievalConfig.defaults();
    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(30);
    @Builder.Default
    Path vectorStorePath = Path.of(DEFAULT_VECTOR_STORE_PATH);
    @Builder.Default
    String collectionName = DEFAULT_COLLECTION_NAME;

    public boolean usesGraph() {
        return sharePoint != null || teams != null;
    }

    public static RagSettings fromEnvironment() {
        return fromProperties(System.getenv());
    }

    public static RagSettings fromProperties(Map<String, String> properties) {
        return new Reader(properties).read();
    }

    private static class Reader {
        private final Map<String, String> properties;
        private final List<String> problems = new ArrayList<>();

        Reader(Map<String, String> properties) {
            this.properties = properties;
        }

        RagSettings read() {
            var builder = RagSettings.builder();
            builder.embeddingApiKey(required("OPENAI_API_KEY"));
            text("OPENAI_BASE_URL").ifPresent(builder::embeddingBaseUrl);
            text("OPENAI_EMBEDDING_MODEL").ifPresent(builder::embeddingModel);

            Integer lookbackDays = integer("LOOKBACK_DAYS", null, 1);
            readJira(builder, lookbackDays);
            readConfluence(builder, lookbackDays);
            readGraph(builder, lookbackDays);

            var settings = builder
                .chunking(validated(() -> ChunkingConfig.builder()
                    .chunkSize(integer("CHUNK_SIZE", ChunkingConfig.DEFAULT_CHUNK_SIZE, 1))
                    .chunkOverlap(integer("CHUNK_OVERLAP", ChunkingConfig.DEFAULT_CHUNK_OVERLAP, 0))
                    .unit(chunkUnit())
                    .build()
                    .validate()))
                .upsert(UpsertConfig.builder()
                    .maxChunksPerBatch(integer("EMBEDDING_BATCH_SIZE", 64, 1))
                    .build())
                .retrieval(RetrievalConfig.builder()
                    .topK(integer("RETRIEVAL_TOP_K", 3, 1))
                    .maxContextChars(integer("PROMPT_CONTEXT_MAX_CHARS", 12_000, 1))
                    .build())
                .requestTimeout(Duration.ofSeconds(integer("REQUEST_TIMEOUT_SECONDS", 30, 1)))
                .vectorStorePath(Path.of(text("VECTOR_STORE_PATH").orElse(DEFAULT_VECTOR_STORE_PATH)))
                .collectionName(text("COLLECTION_NAME").orElse(DEFAULT_COLLECTION_NAME))
                .build();

            if (settings.getJiraSite() == null && settings.getConfluenceSite() == null && !settings.usesGraph()) {
                problems.add("No source configured: set JIRA_BASE_URL, CONFLUENCE_BASE_URL, "
                    + "SHAREPOINT_SITE_NAME or TEAMS_GROUP_NAME");
            }
            if (!problems.isEmpty()) {
                throw new ConfigurationException(problems);
            }
            return settings;
        }

        private void readJira(RagSettingsBuilder builder, Integer lookbackDays) {
            var baseUrl = text("JIRA_BASE_URL");
            if (baseUrl.isEmpty()) {
                return;
            }
            builder.jiraSite(new AtlassianSite(baseUrl.get(), required("JIRA_EMAIL"), required("JIRA_API_TOKEN")));
            builder.jira(validated(() -> JiraConfig.builder()
                .projectKeys(list("JIRA_PROJECT_KEY"))
                .lookbackDays(lookbackDays)
                .maxResults(integer("JIRA_MAX_RESULTS", 50, 1))
                .build()
                .validate()));
        }

        private void readConfluence(RagSettingsBuilder builder, Integer lookbackDays) {
            var baseUrl = text("CONFLUENCE_BASE_URL");
            if (baseUrl.isEmpty()) {
                return;
            }
            builder.confluenceSite(
                new AtlassianSite(baseUrl.get(), required("CONFLUENCE_EMAIL"), required("CONFLUENCE_API_TOKEN")));
            builder.confluence(validated(() -> ConfluenceConfig.builder()
                .spaceKeys(list("CONFLUENCE_SPACE_KEY"))
                .lookbackDays(lookbackDays)
                .pageLimit(integer("CONFLUENCE_PAGE_LIMIT", 25, 1))
                .build()
                .validate()));
        }

        private void readGraph(RagSettingsBuilder builder, Integer lookbackDays) {
            text("GRAPH_BASE_URL").ifPresent(builder::graphBaseUrl);
            text("GRAPH_ACCESS_TOKEN").ifPresent(builder::graphAccessToken);
            text("SHAREPOINT_SITE_NAME").ifPresent(names -> builder.sharePoint(SharePointConfig.builder()
                .siteNames(names(names))
                .lookbackDays(lookbackDays)
                .build()));
            text("TEAMS_GROUP_NAME").ifPresent(names -> builder.teams(TeamsConfig.builder()
                .teamNames(names(names))
                .lookbackDays(lookbackDays)
                .build()));
        }

        private ChunkUnit chunkUnit() {
            var value = text("CHUNK_UNIT");
            if (value.isEmpty()) {
                return ChunkUnit.CHARACTERS;
            }
            try {
                return ChunkUnit.valueOf(value.get().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                problems.add("CHUNK_UNIT must be one of " + Arrays.toString(ChunkUnit.values()) + ", was '"
                    + value.get() + "'");
                return ChunkUnit.CHARACTERS;
            }
        }

        /** Runs a config's own validation, recording its complaint instead of stopping at it. */
        private <T> T validated(Supplier<T> config) {
            try {
                return config.get();
            } catch (ConfigurationException e) {
                problems.addAll(e.getProblems());
                return null;
            }
        }

        private Optional<String> text(String key) {
            var value = properties.get(key);
            return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
        }

        private String required(String key) {
            var value = text(key);
            if (value.isEmpty()) {
                problems.add(key + " is required");
            }
            return value.orElse(null);
        }

        private Integer integer(String key, Integer defaultValue, int min) {
            var value = text(key);
            if (value.isEmpty()) {
                return defaultValue;
            }
            try {
                int parsed = Integer.parseInt(value.get());
                if (parsed < min) {
                    problems.add(key + " must be at least " + min + ", was " + parsed);
                    return defaultValue;
                }
                return parsed;
            } catch (NumberFormatException e) {
                problems.add(key + " must be an integer, was '" + value.get() + "'");
                return defaultValue;
            }
        }

        private List<String> list(String key) {
            return text(key).map(Reader::split).orElse(List.of());
        }

        /** Names to ingest; {@code *} means discover everything, expressed as an empty list. */
        private static List<String> names(String value) {
            return DISCOVER_ALL.equals(value) ? List.of() : split(value);
        }

        private static List<String> split(String value) {
            return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        }
    }
}
