package io.cukecore.parser;

import io.cukecore.common.Resource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxErrorTest {

    @Test
    void testSnippetIsTruncated() {
        String text = "first line\n" + "x".repeat(80);
        Resource resource = Resource.text(text);
        Token token = new Token(resource, TokenType.G_DESC, 11, 1, 0, "x".repeat(80));
        SyntaxError error = SyntaxError.at(token, "unexpected text", "step");
        assertEquals(2, error.line);
        assertEquals(1, error.column);
        assertEquals(SyntaxError.SNIPPET_LENGTH, error.snippet.length());
        assertEquals("[2:1] unexpected text", error.toString());
    }

    @Test
    void testToMap() {
        Resource resource = Resource.text("abc");
        Token token = new Token(resource, TokenType.EOF, 3, 0, 3, "");
        Map<String, Object> map = SyntaxError.at(token, "expected Feature:", "Feature:").toMap();
        assertEquals(List.of("message", "expected", "line", "column", "fragment", "snippet"), List.copyOf(map.keySet()));
        assertEquals(1, map.get("line"));
        assertEquals(4, map.get("column"));
        assertEquals("", map.get("snippet"));
    }

    @Test
    void testParserExceptionMessage() {
        SyntaxError error = new SyntaxError("unexpected text", "step", 3, 5, "oops", "oops\n");
        ParserException e = new ParserException(error);
        assertSame(error, e.getError());
        assertEquals("parse error at line 3, column 5: unexpected text\nnear: \"oops\n\"", e.getMessage());
        e = new ParserException(new SyntaxError("expected Feature:", "Feature:", 1, 1, "", ""));
        assertEquals("parse error at line 1, column 1: expected Feature:", e.getMessage());
    }

}
