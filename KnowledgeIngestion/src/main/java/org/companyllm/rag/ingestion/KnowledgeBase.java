package org.companyllm.rag.ingestion;

import java.net.URI;

import org.companyllm.rag.connectors.http.AuthConfig;
import org.companyllm.rag.connectors.http.ConnectionContext;
import org.companyllm.rag.connectors.http.RestClient;
import org.companyllm.rag.connectors.openai.OpenAiEmbeddingClient;
import org.companyllm.rag.pipeline.embedding.EmbeddingProvider;
import org.companyllm.rag.pipeline.retrieval.AnswerContext;
import org.companyllm.rag.pipeline.retrieval.ContextRetriever;
import org.companyllm.rag.pipeline.retrieval.LanguageModel;
import org.companyllm.rag.pipeline.retrieval.RagAnswer;
import org.companyllm.rag.pipeline.retrieval.RagQueryService;
import org.companyllm.rag.pipeline.retrieval.RetrievalConfig;
import org.companyllm.rag.pipeline.sink.VectorStore;
import org.companyllm.rag.store.FileVectorStore;

import reactor.core.publisher.Mono;

/**
 * Question answering over an ingested collection: retrieval with the configured
 * embedding model, then the external language model.
 */
public class KnowledgeBase implements AutoCloseable {
    private final VectorStore store;
    private final ContextRetriever retriever;
    private final RagQueryService queryService;

    public KnowledgeBase(VectorStore store, EmbeddingProvider embeddingProvider, RetrievalConfig retrieval,
                         LanguageModel languageModel) {
        this.store = store;
        this.retriever = new ContextRetriever(embeddingProvider, store, retrieval);
        this.queryService = new RagQueryService(retriever, languageModel);
    }

    public static KnowledgeBase fromSettings(RagSettings settings, LanguageModel languageModel) {
        var embeddings = new OpenAiEmbeddingClient(
            RestClient.create(ConnectionContext.builder()
                .baseUri(URI.create(settings.getEmbeddingBaseUrl()))
                .auth(AuthConfig.BearerAuth.ofToken(settings.getEmbeddingApiKey()))
                .requestTimeout(settings.getRequestTimeout())
                .build()),
            settings.getEmbeddingModel());
        return new KnowledgeBase(
            FileVectorStore.open(settings.getVectorStorePath(), settings.getCollectionName()),
            embeddings,
            settings.getRetrieval(),
            languageModel);
    }

    /** Retrieved chunks and the assembled prompt, without calling the language model. */
    public Mono<AnswerContext> context(String question) {
        return retriever.answerContext(question);
    }

    public Mono<RagAnswer> ask(String question) {
        return queryService.ask(question);
    }

    @Override
    public void close() {
        store.close();
    }
}
