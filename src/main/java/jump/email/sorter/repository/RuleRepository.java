package jump.email.sorter.repository;

import com.fasterxml.jackson.databind.JsonNode;
import jump.email.sorter.entity.LearnedRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Slf4j
@Repository
public class RuleRepository {
    public static final String FILE_NAME = "learned_rules.json";

    private final JsonDocumentStore store;

    public RuleRepository(JsonDocumentStore store) {
        this.store = store;
    }

    public Optional<LearnedRules> load() {
        Optional<JsonNode> tree = store.readTree(FILE_NAME);
        if (tree.isEmpty()) {
            return Optional.empty();
        }
        int version = tree.get().path("schema_version").asInt(0);
        if (version > LearnedRules.CURRENT_VERSION) {
            log.warn("Ignoring {}: schema_version {} is newer than supported version {}",
                FILE_NAME, version, LearnedRules.CURRENT_VERSION);
            return Optional.empty();
        }
        Optional<LearnedRules> rules = store.bind(tree.get(), LearnedRules.class, FILE_NAME);
        rules.ifPresent(r -> r.setSchemaVersion(LearnedRules.CURRENT_VERSION));
        return rules;
    }

    public boolean save(LearnedRules rules) {
        return store.write(FILE_NAME, rules);
    }
}
