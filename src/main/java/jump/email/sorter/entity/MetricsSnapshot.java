package jump.email.sorter.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class MetricsSnapshot {
    @JsonProperty("total_classifications")
    long totalClassifications;
    @JsonProperty("cache_hits")
    long cacheHits;
    @JsonProperty("rule_hits")
    long ruleHits;
    @JsonProperty("keyword_hits")
    long keywordHits;
    @JsonProperty("remote_hits")
    long remoteHits;
    @JsonProperty("fallbacks")
    long fallbacks;
    @JsonProperty("remote_calls")
    long remoteCalls;
    @JsonProperty("remote_messages")
    long remoteMessages;
    @JsonProperty("cache_size_entries")
    int cacheSizeEntries;
    @JsonProperty("estimated_cost_usd")
    double estimatedCostUsd;
    @JsonProperty("cost_savings_percent")
    double costSavingsPercent;
}
