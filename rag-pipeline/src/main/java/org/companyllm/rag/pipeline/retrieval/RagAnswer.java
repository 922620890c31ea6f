package org.companyllm.rag.pipeline.retrieval;

/**
 * @param answer  the model's response, or a canned message when nothing was retrieved
 * @param context the retrieval that produced the prompt
 */
public record RagAnswer(String answer, AnswerContext context) {}
