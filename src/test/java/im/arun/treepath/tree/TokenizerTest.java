package im.arun.treepath.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

final class TokenizerTest {

    @Test
    void plainWordIsSingleLowercasedToken() {
        assertEquals("value", Tokenizer.tokenize("value"));
        assertEquals("value", Tokenizer.tokenize("Value"));
    }

    @Test
    void splitsOnUnderscoresAndCamelCase() {
        assertEquals("my|name", Tokenizer.tokenize("my_name"));
        assertEquals("get|value", Tokenizer.tokenize("getValue"));
        assertEquals("get|http|response|code", Tokenizer.tokenize("getHTTPResponse_code"));
        assertEquals("xml|parser", Tokenizer.tokenize("XMLParser"));
    }

    @Test
    void dropsEmptyUnderscorePieces() {
        assertEquals("init", Tokenizer.tokenize("__init__"));
        assertEquals("", Tokenizer.tokenize(""));
    }

    @Test
    void upperCaseRunStaysTogether() {
        assertEquals("http", Tokenizer.tokenize("HTTP"));
        assertEquals(List.of("HTTP", "Server"), Tokenizer.camelCaseSplit("HTTPServer"));
    }

    @Test
    void punctuationIsKeptAsIs() {
        assertEquals("(", Tokenizer.tokenize("("));
        assertEquals("a.b", Tokenizer.tokenize("a.b"));
    }
}
