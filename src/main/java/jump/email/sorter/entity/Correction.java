package jump.email.sorter.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One line of the append-only correction log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Correction {
    private String sender;

    private String subject;

    @JsonProperty("body_preview")
    private String bodyPreview;

    /** Null when the earlier prediction is not known. */
    @JsonProperty("wrong_category")
    private String wrongCategory;

    @JsonProperty("correct_category")
    private String correctCategory;

    private Instant timestamp;
}
