package jump.email.sorter.repository;

import jump.email.sorter.entity.MetricsSnapshot;
import org.springframework.stereotype.Repository;

@Repository
public class MetricsRepository {
    public static final String FILE_NAME = "metrics.json";

    private final JsonDocumentStore store;

    public MetricsRepository(JsonDocumentStore store) {
        this.store = store;
    }

    public boolean save(MetricsSnapshot snapshot) {
        return store.write(FILE_NAME, snapshot);
    }
}
