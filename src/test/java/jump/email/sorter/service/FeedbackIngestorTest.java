package jump.email.sorter.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import jump.email.sorter.config.SorterProperties;
import jump.email.sorter.entity.CachedPattern;
import jump.email.sorter.entity.ClassificationMethod;
import jump.email.sorter.entity.TierDecision;
import jump.email.sorter.mail.FolderDescriptor;
import jump.email.sorter.mail.InMemoryMailStore;
import jump.email.sorter.mail.MailStoreException;
import jump.email.sorter.repository.CorrectionLogRepository;
import jump.email.sorter.repository.JsonDocumentStore;
import jump.email.sorter.repository.PatternCacheRepository;
import jump.email.sorter.repository.RuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeedbackIngestorTest {
    private static final Instant RECEIVED = Instant.parse("2025-03-01T08:00:00Z");

    @TempDir
    Path dataDir;

    private InMemoryMailStore mailStore;
    private RuleStore ruleStore;
    private ClassificationCache cache;
    private MessageFingerprinter fingerprinter;
    private FeedbackIngestor ingestor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
        JsonDocumentStore documents = new JsonDocumentStore(dataDir, new ObjectMapper());
        mailStore = new InMemoryMailStore();
        mailStore.open();
        ruleStore = new RuleStore(new RuleRepository(documents), new CorrectionLogRepository(documents), clock);
        cache = new ClassificationCache(new PatternCacheRepository(documents), clock);
        fingerprinter = new MessageFingerprinter();
        SorterProperties properties = TestData.properties();
        ingestor = new FeedbackIngestor(mailStore, ruleStore, cache, fingerprinter, TestData.registry(properties), properties);
    }

    private List<FolderDescriptor> listing() throws MailStoreException {
        return mailStore.listFolders();
    }

    @Test
    void ingest_WithCorrectionFolder_ShouldLearnOverrideCacheAndEmptyFolder() throws MailStoreException {
        // Given
        mailStore.addMessage("Feedback/PRO", "news@startup.io", "Weekly digest", "Team update", RECEIVED);
        String fingerprint = fingerprinter.fingerprint("news@startup.io", "Weekly digest");
        cache.record(fingerprint, "SPAM", 0.8, "startup.io");

        // When
        int absorbed = ingestor.ingest(listing());

        // Then
        assertEquals(1, absorbed);
        assertTrue(mailStore.subjectsIn("Feedback/PRO").isEmpty());
        assertEquals(1, mailStore.expungeCount("Feedback/PRO"));

        CachedPattern pattern = cache.get(fingerprint).orElseThrow();
        assertEquals("PRO", pattern.getCategory());
        assertEquals(1.0, pattern.getConfidence());

        TierDecision prediction = ruleStore.predict("news@startup.io", "Anything").orElseThrow();
        assertEquals("PRO", prediction.getCategory());
        assertEquals(ClassificationMethod.RULE, prediction.getMethod());
        assertEquals(1, ruleStore.stats().getTotalCorrections());
        assertNull(ruleStore.fewShotExamples(5).get(0).getWrongCategory());
    }

    @Test
    void ingest_WithAgreeingCorrections_ShouldPromoteDomainRule() throws MailStoreException {
        // Given
        mailStore.addMessage("Feedback/BANQUE", "alerts@mybank.com", "Alerte solde", "", RECEIVED);
        mailStore.addMessage("Feedback/BANQUE", "cards@mybank.com", "Nouvelle carte", "", RECEIVED);

        // When
        ingestor.ingest(listing());

        // Then
        TierDecision prediction = ruleStore.predict("support@mybank.com", "Bonjour").orElseThrow();
        assertEquals("BANQUE", prediction.getCategory());
        assertEquals(RuleStore.DOMAIN_CONFIDENCE, prediction.getConfidence());
    }

    @Test
    void ingest_WithDisagreeingCorrections_ShouldNotPromoteDomainRule() throws MailStoreException {
        // Given
        mailStore.addMessage("Feedback/BANQUE", "alerts@mixed.com", "Alerte solde", "", RECEIVED);
        mailStore.addMessage("Feedback/SPAM", "promo@mixed.com", "Promo carte", "", RECEIVED);

        // When
        ingestor.ingest(listing());

        // Then
        assertTrue(ruleStore.predict("support@mixed.com", "Bonjour").isEmpty());
        assertEquals(2, ruleStore.stats().getTotalCorrections());
    }

    @Test
    void ingest_WithUnknownCategoryFolder_ShouldLeaveItAlone() throws MailStoreException {
        // Given
        mailStore.addMessage("Feedback/VOYAGES", "trip@airline.com", "Boarding pass", "", RECEIVED);

        // When
        int absorbed = ingestor.ingest(listing());

        // Then
        assertEquals(0, absorbed);
        assertEquals(List.of("Boarding pass"), mailStore.subjectsIn("Feedback/VOYAGES"));
    }

    @Test
    void ingest_WithEmptyCorrectionFolder_ShouldNotExpunge() throws MailStoreException {
        // Given
        mailStore.folder("Feedback/PRO");

        // When
        int absorbed = ingestor.ingest(listing());

        // Then
        assertEquals(0, absorbed);
        assertEquals(0, mailStore.expungeCount("Feedback/PRO"));
    }
}
