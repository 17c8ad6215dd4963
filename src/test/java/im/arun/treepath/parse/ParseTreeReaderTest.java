package im.arun.treepath.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import im.arun.treepath.model.CodeUnit;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class ParseTreeReaderTest {

    private static final String UNIT = "{\"language\": \"python\", \"code\": \"foo\", \"code_tokens\": [\"foo\"],"
        + " \"url\": \"ignored\", \"tree\": {\"type\": \"module\", \"start_point\": [0, 0], \"end_point\": [0, 3],"
        + " \"children\": [{\"type\": \"identifier\", \"start_point\": [0, 0], \"end_point\": [0, 3]}]}}";

    private final ParseTreeReader reader = new ParseTreeReader();

    @Test
    void readsOneUnit() throws IOException {
        CodeUnit unit = reader.readUnit(UNIT);

        assertEquals("python", unit.getLanguage());
        assertEquals("foo", unit.getCode());
        assertEquals(List.of("foo"), unit.getCodeTokens());

        JsonParseNode root = unit.getTree();
        assertEquals("module", root.getKind());
        assertEquals(3, root.getEndColumn());
        assertEquals(1, root.getChildren().size());
        assertTrue(root.getChildren().get(0).getChildren().isEmpty());
    }

    @Test
    void acceptsCorpusFieldNames() throws IOException {
        CodeUnit unit = reader.readUnit("{\"function\": \"def f(): pass\", \"function_tokens\": [\"def\", \"f\"]}");

        assertEquals("def f(): pass", unit.getCode());
        assertEquals(List.of("def", "f"), unit.getCodeTokens());
        assertNull(unit.getTree());
    }

    @Test
    void unitWithoutCodeIsRejected() {
        assertThrows(IOException.class, () -> reader.readUnit("{\"language\": \"go\"}"));
    }

    @Test
    void readsJsonLinesSkippingBlankLines(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("units.jsonl");
        Files.write(file, (UNIT + "\n\n" + UNIT + "\n").getBytes(StandardCharsets.UTF_8));

        assertEquals(2, reader.readUnits(file).size());
    }

    @Test
    void reportsTheFailingLine(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("units.jsonl");
        Files.write(file, (UNIT + "\n{\"language\": \"go\"}\n").getBytes(StandardCharsets.UTF_8));

        IOException e = assertThrows(IOException.class, () -> reader.readUnits(file));
        assertTrue(e.getMessage().contains(":2:"), e.getMessage());
    }

    @Test
    void readsJsonArrayOrSingleObject(@TempDir Path dir) throws IOException {
        Path array = dir.resolve("units.json");
        Files.write(array, ("[" + UNIT + ", " + UNIT + ", " + UNIT + "]").getBytes(StandardCharsets.UTF_8));
        Path single = dir.resolve("unit.json");
        Files.write(single, UNIT.getBytes(StandardCharsets.UTF_8));

        assertEquals(3, reader.readUnits(array).size());
        assertEquals(1, reader.readUnits(single).size());
    }

    @Test
    void readsBareTree() throws IOException {
        JsonParseNode tree = reader.readTree("{\"type\": \"identifier\", \"start_point\": [2, 4], \"end_point\": [2, 9]}");

        assertEquals("identifier", tree.getKind());
        assertEquals(2, tree.getStartRow());
        assertEquals(4, tree.getStartColumn());
        assertEquals(9, tree.getEndColumn());
    }

    @Test
    void pointWithWrongArityIsMalformed() throws IOException {
        JsonParseNode tree = reader.readTree("{\"type\": \"identifier\", \"start_point\": [2], \"end_point\": [2, 9]}");

        assertThrows(MalformedParseTreeException.class, tree::getStartRow);
    }
}
