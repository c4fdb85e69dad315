package jump.email.sorter.service;

import jump.email.sorter.entity.CachedPattern;
import jump.email.sorter.entity.ClassificationMethod;
import jump.email.sorter.entity.TierDecision;
import jump.email.sorter.repository.PatternCacheRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fingerprint to category cache. Entries are never evicted.
 * Every update replaces the entry with a new object inside the map's per-key lock, so a hit
 * count only grows and {@code last_used} never goes back in time.
 */
@Slf4j
@Service
public class ClassificationCache {
    private final PatternCacheRepository repository;
    private final Clock clock;
    private final ConcurrentHashMap<String, CachedPattern> patterns;

    public ClassificationCache(PatternCacheRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
        this.patterns = new ConcurrentHashMap<>(repository.load());
        log.info("Classification cache loaded with {} entries", patterns.size());
    }

    /**
     * Count a hit on a cached fingerprint.
     */
    public Optional<TierDecision> lookup(String fingerprint) {
        AtomicReference<CachedPattern> hit = new AtomicReference<>();
        patterns.computeIfPresent(fingerprint, (key, pattern) -> {
            CachedPattern updated = pattern.toBuilder()
                .hitCount(pattern.getHitCount() + 1)
                .lastUsed(latest(pattern.getLastUsed(), Instant.now(clock)))
                .build();
            hit.set(updated);
            return updated;
        });
        CachedPattern pattern = hit.get();
        if (pattern == null) {
            return Optional.empty();
        }
        return Optional.of(new TierDecision(pattern.getCategory(), pattern.getConfidence(), ClassificationMethod.CACHED,
            "Cached pattern (" + pattern.getHitCount() + " hits)"));
    }

    /**
     * Remember a classification for a fingerprint, creating the entry on first sight.
     */
    public void record(String fingerprint, String category, double confidence, String sourceDomain) {
        Instant now = Instant.now(clock);
        patterns.merge(fingerprint,
            CachedPattern.builder()
                .fingerprint(fingerprint)
                .category(category)
                .confidence(confidence)
                .hitCount(1)
                .lastUsed(now)
                .sourceDomain(sourceDomain)
                .build(),
            (existing, fresh) -> existing.toBuilder()
                .category(category)
                .confidence(confidence)
                .hitCount(existing.getHitCount() + 1)
                .lastUsed(latest(existing.getLastUsed(), now))
                .sourceDomain(sourceDomain == null || sourceDomain.isEmpty() ? existing.getSourceDomain() : sourceDomain)
                .build());
    }

    /**
     * Force a fingerprint onto a category the user chose.
     */
    public void override(String fingerprint, String category, String sourceDomain) {
        record(fingerprint, category, 1.0, sourceDomain);
        log.debug("Cache entry {} overridden to {}", fingerprint, category);
    }

    public Optional<CachedPattern> get(String fingerprint) {
        return Optional.ofNullable(patterns.get(fingerprint)).map(CachedPattern::copy);
    }

    public Map<String, CachedPattern> snapshot() {
        Map<String, CachedPattern> copy = new LinkedHashMap<>();
        patterns.forEach((key, pattern) -> copy.put(key, pattern.copy()));
        return copy;
    }

    public int size() {
        return patterns.size();
    }

    public boolean save() {
        return repository.save(snapshot());
    }

    private static Instant latest(Instant previous, Instant now) {
        if (previous == null) {
            return now;
        }
        return previous.isAfter(now) ? previous : now;
    }
}
