package jump.email.sorter.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jump.email.sorter.entity.CheckpointState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.ZoneId;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Repository
public class CheckpointRepository {
    public static final String FILE_NAME = "checkpoint.json";

    private final JsonDocumentStore store;
    private final ZoneId legacyZone;

    public CheckpointRepository(JsonDocumentStore store) {
        this(store, ZoneId.systemDefault());
    }

    CheckpointRepository(JsonDocumentStore store, ZoneId legacyZone) {
        this.store = store;
        this.legacyZone = legacyZone;
    }

    public Optional<CheckpointState> load() {
        Optional<JsonNode> tree = store.readTree(FILE_NAME);
        if (tree.isEmpty() || !tree.get().isObject()) {
            return Optional.empty();
        }
        ObjectNode node = (ObjectNode) tree.get();
        int version = node.path("schema_version").asInt(0);
        if (version > CheckpointState.CURRENT_VERSION) {
            log.warn("Ignoring {}: schema_version {} is newer than supported version {}",
                FILE_NAME, version, CheckpointState.CURRENT_VERSION);
            return Optional.empty();
        }
        if (version == 0) {
            migrateUnversioned(node);
        }
        Optional<CheckpointState> state = store.bind(node, CheckpointState.class, FILE_NAME);
        state.ifPresent(s -> s.setSchemaVersion(CheckpointState.CURRENT_VERSION));
        return state;
    }

    public boolean save(CheckpointState state) {
        return store.write(FILE_NAME, state);
    }

    /**
     * Documents without a version stored local timestamps without an offset.
     * They are read in the local time zone.
     */
    private void migrateUnversioned(ObjectNode node) {
        JsonNode lastCheck = node.get("last_check");
        if (lastCheck instanceof ObjectNode) {
            Iterator<Map.Entry<String, JsonNode>> fields = lastCheck.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode converted = toInstantText(field.getValue());
                if (converted == null) {
                    fields.remove();
                } else {
                    field.setValue(converted);
                }
            }
        }
        if (node.has("last_update")) {
            JsonNode converted = toInstantText(node.get("last_update"));
            if (converted == null) {
                node.remove("last_update");
            } else {
                node.set("last_update", converted);
            }
        }
        log.info("Migrated unversioned {} to schema_version {}", FILE_NAME, CheckpointState.CURRENT_VERSION);
    }

    private JsonNode toInstantText(JsonNode value) {
        JsonNode converted = LegacyTimestamps.toInstantText(value, legacyZone);
        if (converted == null) {
            log.warn("Dropping unreadable timestamp {} from {}", value, FILE_NAME);
        }
        return converted;
    }
}
