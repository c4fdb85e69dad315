package jump.email.sorter.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of classifying one message in one scan pass. Never modified after creation;
 * a user correction produces new learning data, not an edited result.
 */
@Value
@Builder
public class ClassificationResult {
    MessageIdentity identity;
    String category;
    double confidence;
    ClassificationMethod method;
    String explanation;
    Instant timestamp;

    public static ClassificationResult fallback(MessageIdentity identity, String explanation, Instant timestamp) {
        return ClassificationResult.builder()
            .identity(identity)
            .category(Category.UNKNOWN)
            .confidence(0.0)
            .method(ClassificationMethod.FALLBACK)
            .explanation(explanation)
            .timestamp(timestamp)
            .build();
    }

    public boolean isUnknown() {
        return Category.UNKNOWN.equals(category);
    }
}
