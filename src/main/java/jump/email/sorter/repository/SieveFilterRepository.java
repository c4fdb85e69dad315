package jump.email.sorter.repository;

import org.springframework.stereotype.Repository;

/**
 * The exported Sieve script, a plain text file next to the JSON documents.
 */
@Repository
public class SieveFilterRepository {
    public static final String FILE_NAME = "filters.sieve";

    private final JsonDocumentStore store;

    public SieveFilterRepository(JsonDocumentStore store) {
        this.store = store;
    }

    public boolean save(String script) {
        return store.writeText(FILE_NAME, script);
    }
}
