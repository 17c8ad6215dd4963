package im.arun.treepath.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.treepath.model.CodeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads code units and parse trees dumped as JSON.
 * A {@code .jsonl} file holds one unit per line; a {@code .json} file holds either
 * a single unit or an array of units.
 */
public class ParseTreeReader {
    private static final Logger logger = LoggerFactory.getLogger(ParseTreeReader.class);
    private final ObjectMapper objectMapper;

    public ParseTreeReader() {
        this.objectMapper = new ObjectMapper();
    }

    public CodeUnit readUnit(String json) throws IOException {
        return checked(objectMapper.readValue(json, CodeUnit.class));
    }

    public JsonParseNode readTree(String json) throws IOException {
        return objectMapper.readValue(json, JsonParseNode.class);
    }

    public JsonParseNode readTree(Path path) throws IOException {
        return objectMapper.readValue(path.toFile(), JsonParseNode.class);
    }

    /**
     * Read every unit stored in {@code path}.
     */
    public List<CodeUnit> readUnits(Path path) throws IOException {
        List<CodeUnit> units = new ArrayList<>();

        if (path.getFileName().toString().endsWith(".jsonl")) {
            try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                String line;
                int lineNumber = 0;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    try {
                        units.add(readUnit(line));
                    } catch (IOException e) {
                        throw new IOException(String.format("%s:%d: %s", path, lineNumber, e.getMessage()), e);
                    }
                }
            }
        } else {
            JsonNode root = objectMapper.readTree(path.toFile());
            if (root.isArray()) {
                for (JsonNode unitNode : root) {
                    units.add(checked(objectMapper.treeToValue(unitNode, CodeUnit.class)));
                }
            } else {
                units.add(checked(objectMapper.treeToValue(root, CodeUnit.class)));
            }
        }

        logger.info("Read {} code units from {}", units.size(), path);
        return units;
    }

    private CodeUnit checked(CodeUnit unit) throws IOException {
        if (unit.getCode() == null) {
            throw new IOException("Code unit has no 'code' field");
        }
        return unit;
    }
}
