package jump.email.sorter.entity;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CachedPattern {
    @JsonAlias("email_hash")
    private String fingerprint;

    private String category;

    private double confidence;

    @JsonProperty("hit_count")
    private long hitCount;

    @JsonProperty("last_used")
    private Instant lastUsed;

    @JsonProperty("source_domain")
    @JsonAlias("from_domain")
    private String sourceDomain;

    public CachedPattern copy() {
        return toBuilder().build();
    }
}
