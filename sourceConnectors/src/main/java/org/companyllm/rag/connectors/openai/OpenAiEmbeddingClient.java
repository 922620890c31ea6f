package org.companyllm.rag.connectors.openai;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.companyllm.rag.connectors.http.AuthConfig;
import org.companyllm.rag.connectors.http.ConnectionContext;
import org.companyllm.rag.connectors.http.RestClient;
import org.companyllm.rag.pipeline.embedding.EmbeddingProvider;
import org.companyllm.rag.pipeline.error.EmbeddingProviderException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * {@link EmbeddingProvider} for OpenAI-compatible {@code POST /v1/embeddings} endpoints.
 * One call embeds the whole batch; the response's {@code data[]} is reordered by {@code index}.
 */
@Slf4j
public class OpenAiEmbeddingClient implements EmbeddingProvider {
    public static final String DEFAULT_BASE_URL = "https://api.openai.com";
    public static final String DEFAULT_MODEL = "text-embedding-3-small";
    static final String EMBEDDINGS_PATH = "/v1/embeddings";

    private final RestClient client;
    private final String model;

    public OpenAiEmbeddingClient(RestClient client, String model) {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("An embedding model must be provided");
        }
        this.client = client;
        this.model = model;
    }

    public static OpenAiEmbeddingClient create(String apiKey, String model) {
        return new OpenAiEmbeddingClient(
            RestClient.create(ConnectionContext.of(DEFAULT_BASE_URL, AuthConfig.BearerAuth.ofToken(apiKey))),
            model);
    }

    @Override
    public Mono<List<float[]>> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return Mono.just(List.of());
        }
        var request = JsonNodeFactory.instance.objectNode().put("model", model);
        var input = request.putArray("input");
        texts.forEach(input::add);
        return client.postJson(EMBEDDINGS_PATH, request)
            .onErrorMap(e -> !(e instanceof EmbeddingProviderException),
                e -> new EmbeddingProviderException("Embedding request for " + texts.size() + " texts failed: "
                    + e.getMessage(), e))
            .map(response -> vectors(response, texts.size()))
            .doOnNext(vectors -> log.atDebug().setMessage("Embedded {} texts with {}")
                .addArgument(vectors.size()).addArgument(model).log());
    }

    private static List<float[]> vectors(JsonNode response, int expected) {
        var data = new ArrayList<JsonNode>();
        response.path("data").forEach(data::add);
        if (data.size() != expected) {
            throw new EmbeddingProviderException(
                "Embedding response has " + data.size() + " vectors for " + expected + " texts");
        }
        data.sort(Comparator.comparingInt(item -> item.path("index").asInt()));
        var vectors = new ArrayList<float[]>(data.size());
        for (var item : data) {
            var embedding = item.path("embedding");
            if (!embedding.isArray() || embedding.isEmpty()) {
                throw new EmbeddingProviderException("Embedding response item " + item.path("index").asInt()
                    + " has no embedding");
            }
            var vector = new float[embedding.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) embedding.get(i).asDouble();
            }
            vectors.add(vector);
        }
        return vectors;
    }
}
