package jump.email.sorter.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Active rule table of the adaptive learner. Domain keys carry a leading {@code @}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LearnedRules {
    public static final int CURRENT_VERSION = 1;

    @JsonProperty("schema_version")
    private int schemaVersion = CURRENT_VERSION;

    @JsonProperty("sender_rules")
    private Map<String, String> senderRules = new LinkedHashMap<>();

    @JsonProperty("domain_rules")
    private Map<String, String> domainRules = new LinkedHashMap<>();

    @JsonProperty("subject_keywords")
    private Map<String, String> subjectKeywords = new LinkedHashMap<>();

    public LearnedRules copy() {
        LearnedRules copy = new LearnedRules();
        copy.setSchemaVersion(schemaVersion);
        copy.setSenderRules(new LinkedHashMap<>(senderRules));
        copy.setDomainRules(new LinkedHashMap<>(domainRules));
        copy.setSubjectKeywords(new LinkedHashMap<>(subjectKeywords));
        return copy;
    }
}
