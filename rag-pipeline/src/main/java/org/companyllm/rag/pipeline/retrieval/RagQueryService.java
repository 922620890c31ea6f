package org.companyllm.rag.pipeline.retrieval;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Answers a question from the knowledge base. The language model is only called when
 * retrieval found at least one chunk.
 */
@Slf4j
@RequiredArgsConstructor
public class RagQueryService {
    public static final String NOTHING_FOUND_ANSWER =
        "I could not find any relevant information in the company knowledge base for your query.";

    private final ContextRetriever retriever;
    private final LanguageModel languageModel;

    public Mono<RagAnswer> ask(String question) {
        return retriever.answerContext(question)
            .flatMap(context -> {
                if (!context.hasContext()) {
                    log.info("No documents retrieved, answering without the language model");
                    return Mono.just(new RagAnswer(NOTHING_FOUND_ANSWER, context));
                }
                return languageModel.complete(context.assembledPrompt())
                    .map(answer -> new RagAnswer(answer, context));
            });
    }
}
