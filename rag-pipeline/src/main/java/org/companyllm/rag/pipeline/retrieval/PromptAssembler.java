package org.companyllm.rag.pipeline.retrieval;

import java.util.ArrayList;
import java.util.List;

import org.companyllm.rag.pipeline.ir.Chunk;
import org.companyllm.rag.pipeline.ir.MetadataKeys;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the language-model prompt from retrieved chunks.
 *
 * Each chunk becomes one attributed document block. Blocks are added in order until
 * the next one would exceed the character budget; that block and all after it are
 * dropped whole.
 */
@Slf4j
public class PromptAssembler {
    static final String INSTRUCTIONS = "You are an AI assistant for a company. "
        + "Your task is to answer questions based on the provided company knowledge base. "
        + "Use only the information from the documents provided below to answer the question. "
        + "If the answer cannot be found in the documents, state that you don't have enough information. "
        + "Do not make up any information.";
    public static final String NO_CONTEXT_MARKER = "[No context found: the company knowledge base returned no documents for this query.]";
    static final String BLOCK_SEPARATOR = "\n\n";
    private static final String BLOCK_FOOTER = "----------------------------------------------------------";
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final int maxContextChars;

    public PromptAssembler(int maxContextChars) {
        this.maxContextChars = maxContextChars;
    }

    public PromptAssembler(RetrievalConfig config) {
        this(config.validate().getMaxContextChars());
    }

    public AnswerContext assemble(String question, List<RetrievedChunk> chunks) {
        var blocks = new ArrayList<String>();
        int used = 0;
        for (var retrieved : chunks) {
            var block = renderBlock(blocks.size() + 1, retrieved.chunk());
            int cost = block.length() + (blocks.isEmpty() ? 0 : BLOCK_SEPARATOR.length());
            if (used + cost > maxContextChars) {
                log.debug("Context budget of {} chars reached, dropping {} of {} chunks",
                    maxContextChars, chunks.size() - blocks.size(), chunks.size());
                break;
            }
            blocks.add(block);
            used += cost;
        }
        var context = blocks.isEmpty() ? NO_CONTEXT_MARKER : String.join(BLOCK_SEPARATOR, blocks);
        var prompt = INSTRUCTIONS + "\n\n"
            + "Company Knowledge Base:\n"
            + context + "\n\n"
            + "User Query: " + question + "\n\n"
            + "Answer:";
        return new AnswerContext(question, chunks, blocks.size(), prompt);
    }

    String renderBlock(int position, Chunk chunk) {
        var metadata = chunk.metadata();
        var sb = new StringBuilder()
            .append("--- Document ").append(position)
            .append(" (Source: ").append(metadata.getOrDefault(MetadataKeys.SOURCE, "unknown"))
            .append(", Title: ").append(nonBlankOr(metadata.get(MetadataKeys.TITLE), "Untitled"))
            .append(", URL: ").append(nonBlankOr(metadata.get(MetadataKeys.URL), "No URL"))
            .append(") ---\n");
        var parentId = metadata.get(MetadataKeys.PARENT_ID);
        if (parentId != null && !parentId.isBlank()) {
            sb.append("In reply to message ").append(parentId).append('\n');
        }
        sb.append(chunk.text()).append('\n');
        for (var line : commentLines(chunk)) {
            sb.append(line).append('\n');
        }
        return sb.append(BLOCK_FOOTER).toString();
    }

    private static List<String> commentLines(Chunk chunk) {
        var raw = chunk.metadata().get(MetadataKeys.COMMENTS);
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        JsonNode comments;
        try {
            comments = OBJECT_MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("Chunk {} has unreadable comments metadata", chunk.chunkId());
            return List.of();
        }
        var lines = new ArrayList<String>();
        for (var comment : comments) {
            lines.add("Comment by " + comment.path("author").asText("Unknown")
                + " on " + comment.path("created_at").asText("")
                + ": " + comment.path("content").asText(""));
        }
        return lines;
    }

    private static String nonBlankOr(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
