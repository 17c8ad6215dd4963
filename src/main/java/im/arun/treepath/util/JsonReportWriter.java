package im.arun.treepath.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates report entries and writes them as one indented JSON array, either to a
 * file or to a stream.
 */
public class JsonReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(JsonReportWriter.class);
    private final List<Object> entries = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public JsonReportWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void add(Object entry) {
        entries.add(entry);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Write all entries to {@code path}, creating parent directories as needed.
     */
    public void writeTo(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(path.toFile(), entries);
        logger.info("Wrote {} entries to {}", entries.size(), path);
    }

    public void writeTo(PrintStream out) throws IOException {
        out.println(toJson());
        out.flush();
    }

    public String toJson() throws IOException {
        return objectMapper.writeValueAsString(entries);
    }
}
