package jump.email.sorter.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jump.email.sorter.entity.Category;
import jump.email.sorter.entity.RemoteRequestItem;
import jump.email.sorter.entity.RemoteVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the classifier's reply into verdicts keyed by request id.
 * Elements are joined to the request through {@code email_id}, or through the 0-based
 * {@code email_index} when no usable id is given. Categories outside the configured set
 * come back as rejected verdicts.
 */
@Slf4j
@Component
public class RemoteResponseParser {
    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    public RemoteResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the verdicts, or empty when the reply is not a JSON array
     */
    public Optional<Map<String, RemoteVerdict>> parse(String content, List<RemoteRequestItem> items,
                                                      CategoryRegistry categories) {
        if (content == null || content.isBlank()) {
            log.warn("Remote classifier returned an empty reply");
            return Optional.empty();
        }
        JsonNode array;
        try {
            array = objectMapper.readTree(stripFences(content));
        } catch (JsonProcessingException e) {
            log.warn("Remote classifier reply is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (array == null || !array.isArray()) {
            log.warn("Remote classifier reply is not a JSON array");
            return Optional.empty();
        }

        Set<String> knownIds = new HashSet<>();
        items.forEach(item -> knownIds.add(item.getId()));

        Map<String, RemoteVerdict> verdicts = new LinkedHashMap<>();
        for (JsonNode element : array) {
            if (!element.isObject()) {
                continue;
            }
            String id = resolveId(element, items, knownIds);
            if (id == null) {
                log.debug("Ignoring reply element without a matching id: {}", element);
                continue;
            }
            verdicts.put(id, toVerdict(element, categories));
        }
        return Optional.of(verdicts);
    }

    static String stripFences(String content) {
        String text = content.trim();
        if (text.contains(JSON_FENCE)) {
            text = between(text, text.indexOf(JSON_FENCE) + JSON_FENCE.length());
        } else if (text.contains(FENCE)) {
            text = between(text, text.indexOf(FENCE) + FENCE.length());
        }
        int start = text.indexOf('[');
        int end = text.lastIndexOf(']');
        if (start > 0 && end > start) {
            text = text.substring(start, end + 1);
        }
        return text.trim();
    }

    private static String between(String text, int start) {
        int end = text.indexOf(FENCE, start);
        return end >= 0 ? text.substring(start, end) : text.substring(start);
    }

    private String resolveId(JsonNode element, List<RemoteRequestItem> items, Set<String> knownIds) {
        JsonNode id = element.get("email_id");
        if (id != null && (id.isTextual() || id.isNumber())) {
            String value = id.asText().trim();
            if (knownIds.contains(value)) {
                return value;
            }
        }
        JsonNode index = element.get("email_index");
        if (index != null && index.canConvertToInt()) {
            int position = index.asInt();
            if (position >= 0 && position < items.size()) {
                return items.get(position).getId();
            }
        }
        return null;
    }

    private RemoteVerdict toVerdict(JsonNode element, CategoryRegistry categories) {
        String declared = element.path("category").asText("").trim();
        Optional<Category> category = categories.find(declared);
        if (category.isEmpty()) {
            log.warn("Remote classifier returned invalid category '{}'", declared);
            return RemoteVerdict.rejected(declared);
        }
        double confidence = element.path("confidence").asDouble(0.0);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        return new RemoteVerdict(category.get().getName(), confidence, element.path("explanation").asText(""));
    }
}
