package jump.email.sorter.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PatternCacheDocument {
    public static final int CURRENT_VERSION = 1;

    @JsonProperty("schema_version")
    private int schemaVersion = CURRENT_VERSION;

    private Map<String, CachedPattern> patterns = new LinkedHashMap<>();
}
