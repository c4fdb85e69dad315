package jump.email.sorter.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes the JSON documents kept in the data directory.
 * Documents are rewritten wholesale through a temporary file that replaces the target in one move,
 * so a crash never leaves a half-written document behind.
 * Write failures are logged and reported as {@code false}; callers keep their in-memory state.
 */
@Slf4j
public class JsonDocumentStore {
    private final Path dataDir;
    private final ObjectMapper objectMapper;

    public JsonDocumentStore(Path dataDir, ObjectMapper objectMapper) {
        this.dataDir = dataDir;
        this.objectMapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Path resolve(String fileName) {
        return dataDir.resolve(fileName);
    }

    public ObjectMapper mapper() {
        return objectMapper;
    }

    /**
     * Read a document as a tree so callers can inspect its version before binding it.
     * @return the tree, or empty when the file is missing or unreadable
     */
    public Optional<JsonNode> readTree(String fileName) {
        Path file = resolve(fileName);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(file.toFile());
            if (node == null || node.isMissingNode() || node.isNull()) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (IOException e) {
            log.error("Error reading {}: {}", file, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public <T> Optional<T> bind(JsonNode node, Class<T> type, String fileName) {
        try {
            return Optional.ofNullable(objectMapper.treeToValue(node, type));
        } catch (JsonProcessingException e) {
            log.error("Error mapping {} to {}: {}", fileName, type.getSimpleName(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    public boolean write(String fileName, Object document) {
        try {
            return writeBytes(fileName, objectMapper.writeValueAsBytes(document));
        } catch (JsonProcessingException e) {
            log.error("Error serializing {}: {}", fileName, e.getMessage(), e);
            return false;
        }
    }

    public boolean writeText(String fileName, String text) {
        return writeBytes(fileName, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Append one compact JSON record as a new line.
     */
    public boolean append(String fileName, Object record) {
        Path file = resolve(fileName);
        try {
            Files.createDirectories(dataDir);
            String line = objectMapper.writer()
                .without(SerializationFeature.INDENT_OUTPUT)
                .writeValueAsString(record);
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(line);
                writer.newLine();
            }
            return true;
        } catch (IOException e) {
            log.error("Error appending to {}: {}", file, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Read every line of a JSON-lines file. Lines that do not parse are skipped with a warning.
     */
    public <T> List<T> readLines(String fileName, Class<T> type) {
        Path file = resolve(fileName);
        List<T> records = new ArrayList<>();
        if (!Files.exists(file)) {
            return records;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    records.add(objectMapper.readValue(line, type));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping malformed line {} of {}: {}", lineNumber, file, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            log.error("Error reading {}: {}", file, e.getMessage(), e);
        }
        return records;
    }

    private boolean writeBytes(String fileName, byte[] content) {
        Path file = resolve(fileName);
        Path temp = null;
        try {
            Files.createDirectories(dataDir);
            temp = Files.createTempFile(dataDir, fileName, ".tmp");
            Files.write(temp, content);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (IOException e) {
            log.error("Error writing {}: {}", file, e.getMessage(), e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    log.warn("Could not remove temporary file {}: {}", temp, cleanup.getMessage());
                }
            }
            return false;
        }
    }
}
