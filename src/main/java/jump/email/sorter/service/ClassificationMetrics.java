package jump.email.sorter.service;

import jump.email.sorter.config.SorterProperties;
import jump.email.sorter.entity.ClassificationResult;
import jump.email.sorter.entity.MetricsSnapshot;
import jump.email.sorter.repository.MetricsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-lifetime counters of how messages were classified and what the remote calls cost.
 */
@Slf4j
@Component
public class ClassificationMetrics {
    private final AtomicLong total = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong ruleHits = new AtomicLong();
    private final AtomicLong keywordHits = new AtomicLong();
    private final AtomicLong remoteHits = new AtomicLong();
    private final AtomicLong fallbacks = new AtomicLong();
    private final AtomicLong remoteCalls = new AtomicLong();
    private final AtomicLong remoteMessages = new AtomicLong();

    private final ClassificationCache cache;
    private final MetricsRepository repository;
    private final double costPerCallUsd;

    public ClassificationMetrics(ClassificationCache cache, MetricsRepository repository, SorterProperties properties) {
        this.cache = cache;
        this.repository = repository;
        this.costPerCallUsd = properties.getRemote().getCostPerCallUsd();
    }

    public void record(ClassificationResult result) {
        total.incrementAndGet();
        switch (result.getMethod()) {
            case CACHED:
                cacheHits.incrementAndGet();
                break;
            case RULE:
                ruleHits.incrementAndGet();
                break;
            case KEYWORD:
                keywordHits.incrementAndGet();
                break;
            case REMOTE_SINGLE:
            case REMOTE_BATCH:
                remoteHits.incrementAndGet();
                break;
            default:
                fallbacks.incrementAndGet();
        }
    }

    /**
     * Count one request sent to the remote classifier.
     */
    public void recordRemoteCall(int messages) {
        remoteCalls.incrementAndGet();
        remoteMessages.addAndGet(messages);
    }

    public MetricsSnapshot snapshot() {
        long classified = total.get();
        long local = cacheHits.get() + ruleHits.get() + keywordHits.get();
        double savings = classified == 0 ? 0.0 : round(local * 100.0 / classified, 1);
        return MetricsSnapshot.builder()
            .totalClassifications(classified)
            .cacheHits(cacheHits.get())
            .ruleHits(ruleHits.get())
            .keywordHits(keywordHits.get())
            .remoteHits(remoteHits.get())
            .fallbacks(fallbacks.get())
            .remoteCalls(remoteCalls.get())
            .remoteMessages(remoteMessages.get())
            .cacheSizeEntries(cache.size())
            .estimatedCostUsd(round(remoteCalls.get() * costPerCallUsd, 3))
            .costSavingsPercent(savings)
            .build();
    }

    public MetricsSnapshot logAndSave() {
        MetricsSnapshot snapshot = snapshot();
        log.info("Classification metrics: total={}, cache={}, rule={}, keyword={}, remote={}, fallback={}, "
                + "remote calls={}, est. cost=${}, savings={}%",
            snapshot.getTotalClassifications(), snapshot.getCacheHits(), snapshot.getRuleHits(),
            snapshot.getKeywordHits(), snapshot.getRemoteHits(), snapshot.getFallbacks(),
            snapshot.getRemoteCalls(), snapshot.getEstimatedCostUsd(), snapshot.getCostSavingsPercent());
        repository.save(snapshot);
        return snapshot;
    }

    private static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
