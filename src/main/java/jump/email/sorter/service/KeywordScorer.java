package jump.email.sorter.service;

import jump.email.sorter.config.SorterProperties;
import jump.email.sorter.entity.Category;
import jump.email.sorter.entity.ClassificationMethod;
import jump.email.sorter.entity.TierDecision;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Static keyword heuristic over subject and body. Free and local, so it runs before any remote call.
 */
@Component
public class KeywordScorer {
    private static final double MAX_CONFIDENCE = 0.99;

    private final CategoryRegistry categoryRegistry;
    private final double weight;

    public KeywordScorer(CategoryRegistry categoryRegistry, SorterProperties properties) {
        this.categoryRegistry = categoryRegistry;
        this.weight = properties.getClassification().getKeywordWeight();
    }

    /**
     * Score every category by the share of its keywords found in the text.
     * @return the best category, or empty when no keyword matched at all
     */
    public Optional<TierDecision> score(String subject, String body) {
        String content = ((subject == null ? "" : subject) + " " + (body == null ? "" : body)).toLowerCase(Locale.ROOT);

        Category best = null;
        double bestConfidence = 0.0;
        List<String> bestMatches = List.of();
        for (Category category : categoryRegistry.all()) {
            List<String> keywords = category.getKeywords();
            if (keywords.isEmpty()) {
                continue;
            }
            List<String> matches = new ArrayList<>();
            for (String keyword : keywords) {
                if (!keyword.isBlank() && content.contains(keyword.toLowerCase(Locale.ROOT))) {
                    matches.add(keyword);
                }
            }
            if (matches.isEmpty()) {
                continue;
            }
            double confidence = Math.min(MAX_CONFIDENCE, (double) matches.size() / keywords.size() * weight);
            // Equal scores go to the higher priority category
            if (best == null || confidence > bestConfidence
                || (confidence == bestConfidence && category.getPriority() > best.getPriority())) {
                best = category;
                bestConfidence = confidence;
                bestMatches = matches;
            }
        }

        if (best == null) {
            return Optional.empty();
        }
        return Optional.of(new TierDecision(best.getName(), bestConfidence, ClassificationMethod.KEYWORD,
            bestMatches.size() + " keyword(s) matched: " + String.join(", ", bestMatches)));
    }
}
