package jump.email.sorter.service;

import jump.email.sorter.config.SorterProperties;
import jump.email.sorter.entity.Category;
import jump.email.sorter.entity.RemotePrompt;
import jump.email.sorter.entity.RemoteRequestItem;
import jump.email.sorter.entity.RemoteVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Sends a batch of messages to the remote classifier in one rate-limited request.
 * An empty map means "no information": the provider is not configured, the call failed or
 * the reply could not be read. Callers fall back for every message missing from the map.
 */
@Slf4j
@Service
public class RemoteClassifier {
    private final ChatCompletionClient client;
    private final RateLimiter rateLimiter;
    private final RemotePromptBuilder promptBuilder;
    private final RemoteResponseParser responseParser;
    private final RuleStore ruleStore;
    private final CategoryRegistry categoryRegistry;
    private final ClassificationMetrics metrics;
    private final int fewShotExamples;

    public RemoteClassifier(ChatCompletionClient client, RateLimiter rateLimiter, RemotePromptBuilder promptBuilder,
                            RemoteResponseParser responseParser, RuleStore ruleStore,
                            CategoryRegistry categoryRegistry, ClassificationMetrics metrics,
                            SorterProperties properties) {
        this.client = client;
        this.rateLimiter = rateLimiter;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.ruleStore = ruleStore;
        this.categoryRegistry = categoryRegistry;
        this.metrics = metrics;
        this.fewShotExamples = properties.getRemote().getFewShotExamples();
    }

    public Map<String, RemoteVerdict> classifyBatch(List<RemoteRequestItem> items, List<String> validCategories) {
        if (items.isEmpty()) {
            return Map.of();
        }
        if (!client.isConfigured()) {
            log.debug("Remote classifier not configured, {} message(s) left unclassified", items.size());
            return Map.of();
        }

        List<Category> categories = validCategories.stream()
            .map(categoryRegistry::find)
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
        CategoryRegistry allowed = new CategoryRegistry(categories);
        RemotePrompt prompt = promptBuilder.build(items, categories,
            ruleStore.fewShotExamples(fewShotExamples), ruleStore.snapshot());

        if (!rateLimiter.acquire()) {
            log.warn("Remote classification of {} message(s) skipped: interrupted while rate limited", items.size());
            return Map.of();
        }

        ChatOutcome outcome = client.complete(prompt.getSystem(), prompt.getUser());
        metrics.recordRemoteCall(items.size());
        if (!outcome.isSuccess()) {
            log.error("Remote classification of {} message(s) failed ({}): {}", items.size(), outcome.getError(), outcome.getDetail());
            return Map.of();
        }

        Map<String, RemoteVerdict> verdicts = responseParser.parse(outcome.getContent(), items, allowed).orElse(Map.of());
        log.info("Remote batch: {}/{} message(s) classified", verdicts.size(), items.size());
        return verdicts;
    }
}
