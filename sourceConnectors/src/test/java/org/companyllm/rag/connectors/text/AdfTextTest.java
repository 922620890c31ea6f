package org.companyllm.rag.connectors.text;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdfTextTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static List<String> lines(String text) {
        return Arrays.stream(text.split("\n")).filter(l -> !l.isBlank()).collect(Collectors.toList());
    }

    @Test
    void paragraphsAndListItemsBecomeLines() throws Exception {
        var doc = MAPPER.readTree("{\"type\":\"doc\",\"content\":["
            + "{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"Hello \"},"
            + "{\"type\":\"mention\",\"attrs\":{\"text\":\"@Ann\"}}]},"
            + "{\"type\":\"bulletList\",\"content\":["
            + "{\"type\":\"listItem\",\"content\":[{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"one\"}]}]},"
            + "{\"type\":\"listItem\",\"content\":[{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"two\"}]}]}"
            + "]}]}");

        assertEquals(List.of("Hello @Ann", "one", "two"), lines(AdfText.toPlainText(doc)));
    }

    @Test
    void inlineNodesKeepTheirText() throws Exception {
        var doc = MAPPER.readTree("{\"type\":\"doc\",\"content\":[{\"type\":\"paragraph\",\"content\":["
            + "{\"type\":\"emoji\",\"attrs\":{\"shortName\":\":smile:\"}},"
            + "{\"type\":\"text\",\"text\":\" see \"},"
            + "{\"type\":\"inlineCard\",\"attrs\":{\"url\":\"https://example.com/x\"}},"
            + "{\"type\":\"hardBreak\"},"
            + "{\"type\":\"text\",\"text\":\"next\"}]}]}");

        assertEquals(":smile: see https://example.com/x\nnext", AdfText.toPlainText(doc));
    }

    @Test
    void plainStringsPassThroughAndMissingIsEmpty() {
        assertEquals("already plain", AdfText.toPlainText(TextNode.valueOf("already plain")));
        assertEquals("", AdfText.toPlainText(MissingNode.getInstance()));
        assertEquals("", AdfText.toPlainText(null));
    }
}
