package jump.email.sorter.service;

import jump.email.sorter.config.SorterProperties;
import jump.email.sorter.entity.Category;
import jump.email.sorter.entity.ClassificationMethod;
import jump.email.sorter.entity.ClassificationResult;
import jump.email.sorter.entity.MailMessage;
import jump.email.sorter.entity.MessageIdentity;
import jump.email.sorter.entity.RemoteRequestItem;
import jump.email.sorter.entity.RemoteVerdict;
import jump.email.sorter.entity.TierDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tiered classification: cache, learned rules, keywords, then the remote classifier for whatever
 * is left. Each message gets exactly one result; messages no tier can place come back as
 * {@code UNKNOWN} with confidence 0.
 */
@Slf4j
@Service
public class ClassificationEngine {
    private final ClassificationCache cache;
    private final RuleStore ruleStore;
    private final KeywordScorer keywordScorer;
    private final RemoteClassifier remoteClassifier;
    private final CategoryRegistry categoryRegistry;
    private final MessageFingerprinter fingerprinter;
    private final ClassificationMetrics metrics;
    private final Clock clock;
    private final double ruleMinConfidence;
    private final double keywordMinConfidence;
    private final int batchSize;

    public ClassificationEngine(ClassificationCache cache, RuleStore ruleStore, KeywordScorer keywordScorer,
                                RemoteClassifier remoteClassifier, CategoryRegistry categoryRegistry,
                                MessageFingerprinter fingerprinter, ClassificationMetrics metrics,
                                SorterProperties properties, Clock clock) {
        this.cache = cache;
        this.ruleStore = ruleStore;
        this.keywordScorer = keywordScorer;
        this.remoteClassifier = remoteClassifier;
        this.categoryRegistry = categoryRegistry;
        this.fingerprinter = fingerprinter;
        this.metrics = metrics;
        this.clock = clock;
        this.ruleMinConfidence = properties.getClassification().getRuleMinConfidence();
        this.keywordMinConfidence = properties.getClassification().getKeywordMinConfidence();
        this.batchSize = properties.getScan().effectiveBatchSize();
    }

    public ClassificationResult classify(MailMessage message) {
        return classifyBatch(List.of(message)).get(message.getIdentity());
    }

    /**
     * Classify several messages, sending the ones no local tier can place to the remote
     * classifier in batches.
     * @return one result per message, in input order
     */
    public Map<MessageIdentity, ClassificationResult> classifyBatch(List<MailMessage> messages) {
        Map<MessageIdentity, ClassificationResult> resolved = new HashMap<>();
        List<MailMessage> residual = new ArrayList<>();
        for (MailMessage message : messages) {
            if (resolved.containsKey(message.getIdentity())) {
                continue;
            }
            Optional<ClassificationResult> local = classifyLocally(message);
            if (local.isPresent()) {
                resolved.put(message.getIdentity(), local.get());
            } else {
                residual.add(message);
            }
        }

        for (int start = 0; start < residual.size(); start += batchSize) {
            List<MailMessage> batch = residual.subList(start, Math.min(start + batchSize, residual.size()));
            resolved.putAll(classifyRemotely(batch));
        }

        Map<MessageIdentity, ClassificationResult> results = new LinkedHashMap<>();
        for (MailMessage message : messages) {
            ClassificationResult result = resolved.get(message.getIdentity());
            if (result != null && !results.containsKey(message.getIdentity())) {
                results.put(message.getIdentity(), result);
                metrics.record(result);
                log.info("{} '{}' -> {} via {} ({})", message.getIdentity(), abbreviate(message.getSubject()),
                    result.getCategory(), result.getMethod().label(), String.format("%.2f", result.getConfidence()));
            }
        }
        return results;
    }

    private Optional<ClassificationResult> classifyLocally(MailMessage message) {
        String fingerprint = fingerprinter.fingerprint(message.getSender(), message.getSubject());

        Optional<TierDecision> cached = cache.lookup(fingerprint);
        if (cached.isPresent()) {
            if (categoryRegistry.contains(cached.get().getCategory())) {
                return Optional.of(toResult(message.getIdentity(), cached.get()));
            }
            log.debug("Cached category {} is no longer configured, ignoring cache entry", cached.get().getCategory());
        }

        Optional<TierDecision> rule = ruleStore.predict(message.getSender(), message.getSubject())
            .filter(decision -> categoryRegistry.contains(decision.getCategory()))
            .filter(decision -> decision.clears(ruleMinConfidence));
        if (rule.isPresent()) {
            return Optional.of(toResult(message.getIdentity(), rule.get()));
        }

        Optional<TierDecision> keywords = keywordScorer.score(message.getSubject(), message.getBody())
            .filter(decision -> decision.clears(keywordMinConfidence));
        if (keywords.isPresent()) {
            cache.record(fingerprint, keywords.get().getCategory(), keywords.get().getConfidence(),
                MessageFingerprinter.domainOf(message.getSender()));
            return Optional.of(toResult(message.getIdentity(), keywords.get()));
        }
        return Optional.empty();
    }

    private Map<MessageIdentity, ClassificationResult> classifyRemotely(List<MailMessage> batch) {
        List<RemoteRequestItem> items = new ArrayList<>(batch.size());
        for (MailMessage message : batch) {
            items.add(new RemoteRequestItem(message.getIdentity().key(), message.getSubject(), message.getBody()));
        }
        Map<String, RemoteVerdict> verdicts = remoteClassifier.classifyBatch(items, categoryRegistry.names());
        ClassificationMethod method = batch.size() == 1 ? ClassificationMethod.REMOTE_SINGLE : ClassificationMethod.REMOTE_BATCH;
        Instant now = Instant.now(clock);

        Map<MessageIdentity, ClassificationResult> results = new HashMap<>();
        for (MailMessage message : batch) {
            RemoteVerdict verdict = verdicts.get(message.getIdentity().key());
            if (verdict == null) {
                results.put(message.getIdentity(),
                    ClassificationResult.fallback(message.getIdentity(), "No tier produced a classification", now));
                continue;
            }
            if (verdict.isRejected()) {
                results.put(message.getIdentity(),
                    ClassificationResult.fallback(message.getIdentity(), verdict.getExplanation(), now));
                continue;
            }
            Optional<Category> category = categoryRegistry.find(verdict.getCategory());
            if (category.isPresent() && verdict.getConfidence() >= category.get().getConfidenceThreshold()) {
                cache.record(fingerprinter.fingerprint(message.getSender(), message.getSubject()),
                    verdict.getCategory(), verdict.getConfidence(), MessageFingerprinter.domainOf(message.getSender()));
            }
            results.put(message.getIdentity(), ClassificationResult.builder()
                .identity(message.getIdentity())
                .category(verdict.getCategory())
                .confidence(verdict.getConfidence())
                .method(method)
                .explanation(verdict.getExplanation())
                .timestamp(now)
                .build());
        }
        return results;
    }

    private ClassificationResult toResult(MessageIdentity identity, TierDecision decision) {
        String category = categoryRegistry.find(decision.getCategory()).map(Category::getName).orElse(decision.getCategory());
        return ClassificationResult.builder()
            .identity(identity)
            .category(category)
            .confidence(decision.getConfidence())
            .method(decision.getMethod())
            .explanation(decision.getExplanation())
            .timestamp(Instant.now(clock))
            .build();
    }

    private static String abbreviate(String subject) {
        return subject.length() > 40 ? subject.substring(0, 40) + "..." : subject;
    }
}
