package org.companyllm.rag.pipeline.retrieval;

import reactor.core.publisher.Mono;

/**
 * External text-generation model that answers an assembled prompt.
 */
@FunctionalInterface
public interface LanguageModel {
    Mono<String> complete(String prompt);
}
