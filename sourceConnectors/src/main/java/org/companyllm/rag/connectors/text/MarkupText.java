package org.companyllm.rag.connectors.text;

import java.util.Set;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

/**
 * Reduces HTML and Confluence storage-format XHTML to plain text.
 *
 * Block-level elements become line breaks, table cells are separated by spaces, CDATA
 * content is kept (code macros hold their body there) and entities are decoded by the
 * parser. Script, style and comment nodes carry no text. Runs of spaces collapse to one
 * and at most one blank line is kept between paragraphs.
 */
public class MarkupText {
    private static final Set<String> BLOCK_ELEMENTS = Set.of(
        "p", "div", "br", "li", "ul", "ol", "tr", "table", "h1", "h2", "h3", "h4", "h5", "h6",
        "blockquote", "pre", "hr", "ac:structured-macro", "ac:task");
    private static final Set<String> CELL_ELEMENTS = Set.of("td", "th");

    private MarkupText() {}

    public static String toPlainText(String markup) {
        if (markup == null || markup.isBlank()) {
            return "";
        }
        var body = Jsoup.parseBodyFragment(markup).body();
        var text = new StringBuilder();
        NodeTraversor.traverse(new TextCollector(text), body);
        return normalizeWhitespace(text.toString());
    }

    public static String normalizeWhitespace(String text) {
        var lines = text.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);
        var sb = new StringBuilder();
        boolean blankPending = false;
        for (var line : lines) {
            var collapsed = line.replaceAll("[ \\t\\u00a0]+", " ").strip();
            if (collapsed.isEmpty()) {
                blankPending = sb.length() > 0;
                continue;
            }
            if (sb.length() > 0) {
                sb.append(blankPending ? "\n\n" : "\n");
            }
            sb.append(collapsed);
            blankPending = false;
        }
        return sb.toString();
    }

    private static class TextCollector implements NodeVisitor {
        private final StringBuilder text;

        TextCollector(StringBuilder text) {
            this.text = text;
        }

        @Override
        public void head(Node node, int depth) {
            if (node instanceof TextNode) {
                // CDataNode is a TextNode too
                text.append(((TextNode) node).getWholeText());
            } else {
                separate(node);
            }
        }

        @Override
        public void tail(Node node, int depth) {
            separate(node);
        }

        private void separate(Node node) {
            if (!(node instanceof Element)) {
                return;
            }
            var name = ((Element) node).normalName();
            if (BLOCK_ELEMENTS.contains(name)) {
                text.append('\n');
            } else if (CELL_ELEMENTS.contains(name)) {
                text.append(' ');
            }
        }
    }
}
