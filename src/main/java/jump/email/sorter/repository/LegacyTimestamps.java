package jump.email.sorter.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Unversioned documents stored local ISO timestamps without an offset.
 */
final class LegacyTimestamps {

    private LegacyTimestamps() {
    }

    /**
     * @return the value rewritten as an ISO instant, or null when it cannot be read as a timestamp
     */
    static JsonNode toInstantText(JsonNode value, ZoneId zone) {
        if (value == null || !value.isTextual()) {
            return null;
        }
        String text = value.asText();
        try {
            return TextNode.valueOf(Instant.parse(text).toString());
        } catch (DateTimeParseException notAnInstant) {
            try {
                return TextNode.valueOf(LocalDateTime.parse(text).atZone(zone).toInstant().toString());
            } catch (DateTimeParseException e) {
                return null;
            }
        }
    }
}
