package jump.email.sorter.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jump.email.sorter.entity.CachedPattern;
import jump.email.sorter.entity.PatternCacheDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.ZoneId;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Repository
public class PatternCacheRepository {
    public static final String FILE_NAME = "patterns_cache.json";

    private final JsonDocumentStore store;

    public PatternCacheRepository(JsonDocumentStore store) {
        this.store = store;
    }

    /**
     * Load the cached patterns keyed by fingerprint.
     * Unversioned documents are a flat fingerprint-to-pattern map and are read as such.
     */
    public Map<String, CachedPattern> load() {
        Map<String, CachedPattern> patterns = new LinkedHashMap<>();
        JsonNode root = store.readTree(FILE_NAME).orElse(null);
        if (root == null || !root.isObject()) {
            return patterns;
        }
        int version = root.path("schema_version").asInt(0);
        if (version > PatternCacheDocument.CURRENT_VERSION) {
            log.warn("Ignoring {}: schema_version {} is newer than supported version {}",
                FILE_NAME, version, PatternCacheDocument.CURRENT_VERSION);
            return patterns;
        }
        if (version == 0) {
            root = migrateUnversioned(root);
        }
        store.bind(root, PatternCacheDocument.class, FILE_NAME).ifPresent(document ->
            document.getPatterns().forEach((fingerprint, pattern) -> {
                if (pattern.getFingerprint() == null) {
                    pattern.setFingerprint(fingerprint);
                }
                patterns.put(fingerprint, pattern);
            }));
        return patterns;
    }

    public boolean save(Map<String, CachedPattern> patterns) {
        PatternCacheDocument document = new PatternCacheDocument();
        document.setPatterns(new LinkedHashMap<>(patterns));
        return store.write(FILE_NAME, document);
    }

    private JsonNode migrateUnversioned(JsonNode legacy) {
        ObjectNode patterns = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = legacy.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isObject()) {
                continue;
            }
            ObjectNode pattern = ((ObjectNode) field.getValue()).deepCopy();
            JsonNode lastUsed = LegacyTimestamps.toInstantText(pattern.get("last_used"), ZoneId.systemDefault());
            if (lastUsed == null) {
                pattern.remove("last_used");
            } else {
                pattern.set("last_used", lastUsed);
            }
            patterns.set(field.getKey(), pattern);
        }
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        document.put("schema_version", PatternCacheDocument.CURRENT_VERSION);
        document.set("patterns", patterns);
        log.info("Migrated {} unversioned cache entries", patterns.size());
        return document;
    }
}
