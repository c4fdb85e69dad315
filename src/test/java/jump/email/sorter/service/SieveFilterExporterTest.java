package jump.email.sorter.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import jump.email.sorter.config.SorterProperties;
import jump.email.sorter.repository.JsonDocumentStore;
import jump.email.sorter.repository.PatternCacheRepository;
import jump.email.sorter.repository.SieveFilterRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class SieveFilterExporterTest {

    @TempDir
    Path dataDir;

    private ClassificationCache cache;
    private SieveFilterExporter exporter;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
        JsonDocumentStore documents = new JsonDocumentStore(dataDir, new ObjectMapper());
        cache = new ClassificationCache(new PatternCacheRepository(documents), clock);
        SorterProperties properties = TestData.properties();
        properties.getSieve().setMinOccurrences(3);
        exporter = new SieveFilterExporter(cache, TestData.registry(properties), new SieveFilterRepository(documents),
            properties, clock);
    }

    private void hit(String fingerprint, String category, String domain, int times) {
        for (int i = 0; i < times; i++) {
            cache.record(fingerprint, category, 0.9, domain);
        }
    }

    @Test
    void render_ShouldEmitRuleOnlyForFrequentDomains() {
        // Given
        hit("f1", "BANQUE", "bank.fr", 3);
        hit("f2", "BANQUE", "bank.fr", 4);
        hit("f3", "SPAM", "rare.com", 2);

        // When
        String script = exporter.render();

        // Then
        assertTrue(script.startsWith("# Mail sorter - generated rules\n"));
        assertTrue(script.contains("require [\"fileinto\"];"));
        assertTrue(script.contains("if header :contains \"From\" \"bank.fr\" {\n    fileinto \"Folders/Banque\";\n    stop;\n}"));
        assertTrue(script.contains("# bank.fr -> BANQUE (7 emails)"));
        assertFalse(script.contains("rare.com"));
    }

    @Test
    void render_WithCompetingCategories_ShouldPickTheDominantOne() {
        // Given
        hit("f1", "SPAM", "shop.com", 5);
        hit("f2", "PRO", "shop.com", 3);

        // When
        String script = exporter.render();

        // Then
        assertTrue(script.contains("fileinto \"Spam\";"));
        assertFalse(script.contains("fileinto \"Folders/Travail\";"));
    }

    @Test
    void export_ShouldWriteScriptToDataDirectory() throws IOException {
        // Given
        hit("f1", "PRO", "acme.com", 3);

        // When
        assertTrue(exporter.export());

        // Then
        String written = Files.readString(dataDir.resolve(SieveFilterRepository.FILE_NAME));
        assertTrue(written.contains("\"acme.com\""));
    }
}
