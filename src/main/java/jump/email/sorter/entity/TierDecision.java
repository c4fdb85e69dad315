package jump.email.sorter.entity;

import lombok.Value;

/**
 * A category proposed by one tier of the classification ladder. Tiers that have nothing to
 * say return an empty {@code Optional} instead.
 */
@Value
public class TierDecision {
    String category;
    double confidence;
    ClassificationMethod method;
    String explanation;

    public boolean clears(double threshold) {
        return confidence >= threshold;
    }
}
