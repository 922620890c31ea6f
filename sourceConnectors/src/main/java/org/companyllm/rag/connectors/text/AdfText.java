package org.companyllm.rag.connectors.text;

import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Flattens Atlassian Document Format (Jira Cloud descriptions and comments) to plain text.
 * A plain string node is returned unchanged, so older plain-text payloads work too.
 */
public class AdfText {
    private static final Set<String> BLOCK_TYPES = Set.of(
        "paragraph", "heading", "blockquote", "codeBlock", "listItem", "tableRow", "rule", "panel",
        "mediaSingle", "decisionItem", "taskItem"
    );

    private AdfText() {}

    public static String toPlainText(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return "";
        }
        if (node.isTextual()) {
            return node.asText();
        }
        var sb = new StringBuilder();
        render(node, sb);
        return MarkupText.normalizeWhitespace(sb.toString());
    }

    private static void render(JsonNode node, StringBuilder sb) {
        var type = node.path("type").asText("");
        var attrs = node.path("attrs");
        switch (type) {
            case "text":
                sb.append(node.path("text").asText(""));
                return;
            case "hardBreak":
                sb.append('\n');
                return;
            case "mention":
            case "status":
                sb.append(attrs.path("text").asText(""));
                return;
            case "emoji":
                sb.append(attrs.has("text") ? attrs.path("text").asText("") : attrs.path("shortName").asText(""));
                return;
            case "inlineCard":
            case "blockCard":
                sb.append(attrs.path("url").asText(""));
                return;
            case "date":
                sb.append(attrs.path("timestamp").asText(""));
                return;
            case "tableCell":
            case "tableHeader":
                renderChildren(node, sb);
                sb.append(' ');
                return;
            default:
                break;
        }
        boolean block = BLOCK_TYPES.contains(type);
        if (block && sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') {
            sb.append('\n');
        }
        renderChildren(node, sb);
        if (block) {
            sb.append('\n');
        }
    }

    private static void renderChildren(JsonNode node, StringBuilder sb) {
        for (var child : node.path("content")) {
            render(child, sb);
        }
    }
}
