package jump.email.sorter.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import jump.email.sorter.entity.CachedPattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PatternCacheRepositoryTest {

    @TempDir
    Path dataDir;

    private PatternCacheRepository repository;

    @BeforeEach
    void setUp() {
        repository = new PatternCacheRepository(new JsonDocumentStore(dataDir, new ObjectMapper()));
    }

    @Test
    void load_WithLegacyFlatMap_ShouldMigrateEntries() throws IOException {
        // Given
        Files.writeString(dataDir.resolve(PatternCacheRepository.FILE_NAME), "{"
            + "\"abc123\": {\"email_hash\": \"abc123\", \"category\": \"BANQUE\", \"confidence\": 0.9,"
            + " \"hit_count\": 3, \"last_used\": \"2025-01-15T10:30:00\", \"from_domain\": \"bank.fr\"},"
            + "\"def456\": {\"category\": \"PRO\", \"confidence\": 0.8, \"hit_count\": 1}"
            + "}");

        // When
        Map<String, CachedPattern> patterns = repository.load();

        // Then
        assertEquals(2, patterns.size());
        CachedPattern bank = patterns.get("abc123");
        assertEquals("BANQUE", bank.getCategory());
        assertEquals(3, bank.getHitCount());
        assertEquals("bank.fr", bank.getSourceDomain());
        assertEquals(LocalDateTime.parse("2025-01-15T10:30:00").atZone(ZoneId.systemDefault()).toInstant(),
            bank.getLastUsed());
        assertEquals("def456", patterns.get("def456").getFingerprint());
        assertNull(patterns.get("def456").getLastUsed());
    }

    @Test
    void save_ThenLoad_ShouldKeepEveryField() {
        // Given
        CachedPattern pattern = CachedPattern.builder()
            .fingerprint("abc123")
            .category("SPAM")
            .confidence(0.75)
            .hitCount(7)
            .lastUsed(Instant.parse("2025-03-01T12:00:00Z"))
            .sourceDomain("promo.com")
            .build();

        // When
        assertTrue(repository.save(Map.of("abc123", pattern)));

        // Then
        assertEquals(pattern, repository.load().get("abc123"));
    }

    @Test
    void load_WithNewerSchemaVersion_ShouldReturnEmptyCache() throws IOException {
        // Given
        Files.writeString(dataDir.resolve(PatternCacheRepository.FILE_NAME),
            "{\"schema_version\": 2, \"patterns\": {\"abc\": {\"category\": \"PRO\"}}}");

        // When / Then
        assertTrue(repository.load().isEmpty());
    }
}
