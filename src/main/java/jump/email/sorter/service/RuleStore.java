package jump.email.sorter.service;

import jump.email.sorter.entity.ClassificationMethod;
import jump.email.sorter.entity.Correction;
import jump.email.sorter.entity.LearnedRules;
import jump.email.sorter.entity.RuleStats;
import jump.email.sorter.entity.TierDecision;
import jump.email.sorter.repository.CorrectionLogRepository;
import jump.email.sorter.repository.RuleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Rules learned from user corrections.
 * <p>
 * Sender rules apply after a single correction. Domain and subject-keyword rules only become
 * active once at least {@value #MIN_EVIDENCE} corrections mention them and the dominant category
 * holds more than {@value #MIN_AGREEMENT} of those corrections; a later disagreeing correction
 * retracts them again.
 * <p>
 * Readers work on an immutable snapshot that is swapped after every write, so classification
 * workers never observe a rule table being modified.
 */
@Slf4j
@Service
public class RuleStore {
    static final double SENDER_CONFIDENCE = 0.95;
    static final double DOMAIN_CONFIDENCE = 0.85;
    static final double KEYWORD_CONFIDENCE = 0.75;
    static final int MIN_EVIDENCE = 2;
    static final double MIN_AGREEMENT = 0.7;
    private static final int MIN_KEYWORD_LENGTH = 5;
    private static final int MAX_KEYWORDS_PER_SUBJECT = 5;
    private static final int BODY_PREVIEW_LENGTH = 200;
    private static final int MAX_EXAMPLES_PER_CATEGORY = 2;

    private final RuleRepository ruleRepository;
    private final CorrectionLogRepository correctionLog;
    private final Clock clock;
    private final Object writeLock = new Object();

    private volatile LearnedRules rules;
    private volatile List<Correction> corrections;

    public RuleStore(RuleRepository ruleRepository, CorrectionLogRepository correctionLog, Clock clock) {
        this.ruleRepository = ruleRepository;
        this.correctionLog = correctionLog;
        this.clock = clock;
        this.rules = ruleRepository.load().orElseGet(LearnedRules::new);
        this.corrections = Collections.unmodifiableList(new ArrayList<>(correctionLog.loadAll()));
        log.info("RuleStore loaded: {} corrections, {} sender rules, {} domain rules, {} subject keywords",
            corrections.size(), rules.getSenderRules().size(), rules.getDomainRules().size(),
            rules.getSubjectKeywords().size());
    }

    /**
     * Look up a learned rule: exact sender first, then sender domain, then subject keyword.
     */
    public Optional<TierDecision> predict(String sender, String subject) {
        LearnedRules current = rules;
        String address = MessageFingerprinter.normalizeSender(sender);

        String bySender = current.getSenderRules().get(address);
        if (bySender != null) {
            return Optional.of(new TierDecision(bySender, SENDER_CONFIDENCE, ClassificationMethod.RULE,
                "Learned sender rule: " + address));
        }

        String domain = domainKey(address);
        if (domain != null) {
            String byDomain = current.getDomainRules().get(domain);
            if (byDomain != null) {
                return Optional.of(new TierDecision(byDomain, DOMAIN_CONFIDENCE, ClassificationMethod.RULE,
                    "Learned domain rule: " + domain));
            }
        }

        String lowerSubject = subject == null ? "" : subject.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> keyword : current.getSubjectKeywords().entrySet()) {
            if (lowerSubject.contains(keyword.getKey())) {
                return Optional.of(new TierDecision(keyword.getValue(), KEYWORD_CONFIDENCE, ClassificationMethod.RULE,
                    "Learned subject keyword: '" + keyword.getKey() + "'"));
            }
        }
        return Optional.empty();
    }

    /**
     * Record a correction and update the rules it supports.
     * @param wrongCategory the earlier prediction, or null when it is not known
     */
    public void learnFromCorrection(String sender, String subject, String bodyPreview,
                                    String wrongCategory, String correctCategory) {
        if (correctCategory == null || correctCategory.isBlank()) {
            throw new IllegalArgumentException("correctCategory must not be empty");
        }
        String address = MessageFingerprinter.normalizeSender(sender);
        Correction correction = Correction.builder()
            .sender(address)
            .subject(subject == null ? "" : subject)
            .bodyPreview(truncate(bodyPreview, BODY_PREVIEW_LENGTH))
            .wrongCategory(wrongCategory)
            .correctCategory(correctCategory)
            .timestamp(Instant.now(clock))
            .build();

        synchronized (writeLock) {
            if (!correctionLog.append(correction)) {
                log.warn("Correction for {} kept in memory only", address);
            }
            List<Correction> history = new ArrayList<>(corrections);
            history.add(correction);

            LearnedRules updated = rules.copy();
            if (!address.isEmpty()) {
                String previous = updated.getSenderRules().put(address, correctCategory);
                if (!correctCategory.equals(previous)) {
                    log.debug("Sender rule: {} -> {}", address, correctCategory);
                }
            }

            String domain = domainKey(address);
            if (domain != null) {
                reevaluate(updated.getDomainRules(), domain, history,
                    c -> domain.equals(domainKey(c.getSender())), "Domain rule");
            }

            Set<String> keywords = new LinkedHashSet<>(candidateKeywords(correction.getSubject()));
            String lowerSubject = correction.getSubject().toLowerCase(Locale.ROOT);
            for (String active : rules.getSubjectKeywords().keySet()) {
                if (lowerSubject.contains(active)) {
                    keywords.add(active);
                }
            }
            for (String keyword : keywords) {
                reevaluate(updated.getSubjectKeywords(), keyword, history,
                    c -> c.getSubject() != null && c.getSubject().toLowerCase(Locale.ROOT).contains(keyword),
                    "Subject keyword");
            }

            this.corrections = Collections.unmodifiableList(history);
            this.rules = updated;
        }
        log.info("Learned from correction: '{}' {} -> {}", truncate(subject, 30),
            wrongCategory == null ? "?" : wrongCategory, correctCategory);
    }

    /**
     * Most recent corrections, at most two per category, for prompt examples.
     */
    public List<Correction> fewShotExamples(int max) {
        if (max <= 0) {
            return List.of();
        }
        List<Correction> sorted = new ArrayList<>(corrections);
        sorted.sort(Comparator.comparing(Correction::getTimestamp,
            Comparator.nullsLast(Comparator.<Instant>naturalOrder().reversed())));

        Map<String, List<Correction>> byCategory = new LinkedHashMap<>();
        for (Correction correction : sorted) {
            List<Correction> examples = byCategory.computeIfAbsent(correction.getCorrectCategory(), k -> new ArrayList<>());
            if (examples.size() < MAX_EXAMPLES_PER_CATEGORY) {
                examples.add(correction);
            }
        }
        List<Correction> result = new ArrayList<>();
        byCategory.values().forEach(result::addAll);
        return result.size() > max ? new ArrayList<>(result.subList(0, max)) : result;
    }

    /**
     * @return a copy of the active rule table
     */
    public LearnedRules snapshot() {
        return rules.copy();
    }

    public RuleStats stats() {
        LearnedRules current = rules;
        List<Correction> history = corrections;
        Set<String> categories = new LinkedHashSet<>();
        history.forEach(c -> categories.add(c.getCorrectCategory()));
        return new RuleStats(history.size(), current.getSenderRules().size(), current.getDomainRules().size(),
            current.getSubjectKeywords().size(), categories.size());
    }

    public boolean save() {
        return ruleRepository.save(rules);
    }

    private void reevaluate(Map<String, String> table, String key, List<Correction> history,
                            Predicate<Correction> related, String label) {
        Map<String, Integer> votes = new HashMap<>();
        int total = 0;
        for (Correction correction : history) {
            if (related.test(correction)) {
                votes.merge(correction.getCorrectCategory(), 1, Integer::sum);
                total++;
            }
        }
        Optional<Map.Entry<String, Integer>> dominant = votes.entrySet().stream().max(Map.Entry.comparingByValue());
        if (total >= MIN_EVIDENCE && dominant.isPresent()
            && (double) dominant.get().getValue() / total > MIN_AGREEMENT) {
            String category = dominant.get().getKey();
            if (!category.equals(table.put(key, category))) {
                log.info("{} promoted: {} -> {} ({}/{} corrections)", label, key, category, dominant.get().getValue(), total);
            }
        } else if (table.remove(key) != null) {
            log.info("{} retracted: {} ({} corrections disagree)", label, key, total);
        }
    }

    static List<String> candidateKeywords(String subject) {
        List<String> keywords = new ArrayList<>();
        if (subject == null) {
            return keywords;
        }
        for (String word : subject.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (word.length() >= MIN_KEYWORD_LENGTH && !keywords.contains(word)) {
                keywords.add(word);
                if (keywords.size() == MAX_KEYWORDS_PER_SUBJECT) {
                    break;
                }
            }
        }
        return keywords;
    }

    private static String domainKey(String address) {
        String domain = MessageFingerprinter.domainOf(address);
        return domain.isEmpty() ? null : "@" + domain;
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() > max ? value.substring(0, max) : value;
    }
}
