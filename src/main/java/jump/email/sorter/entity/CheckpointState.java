package jump.email.sorter.entity;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted scan progress. {@code processed_emails} is the key used by documents written
 * before identities were versioned and is read as {@code processed}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CheckpointState {
    public static final int CURRENT_VERSION = 1;

    @JsonProperty("schema_version")
    private int schemaVersion = CURRENT_VERSION;

    @JsonProperty("initial_scan_done")
    private boolean initialScanDone;

    @JsonProperty("last_check")
    private Map<String, Instant> lastCheck = new LinkedHashMap<>();

    @JsonAlias("processed_emails")
    private List<String> processed = new ArrayList<>();

    @JsonProperty("last_update")
    private Instant lastUpdate;
}
