package jump.email.sorter.repository;

import jump.email.sorter.entity.Correction;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Append-only log of user corrections, one JSON record per line.
 */
@Repository
public class CorrectionLogRepository {
    public static final String FILE_NAME = "user_corrections.jsonl";

    private final JsonDocumentStore store;

    public CorrectionLogRepository(JsonDocumentStore store) {
        this.store = store;
    }

    public List<Correction> loadAll() {
        return store.readLines(FILE_NAME, Correction.class);
    }

    public boolean append(Correction correction) {
        return store.append(FILE_NAME, correction);
    }
}
