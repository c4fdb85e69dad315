package jump.email.sorter.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jump.email.sorter.config.SorterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for OpenAI-compatible chat-completion endpoints (Perplexity sonar-pro by default).
 */
@Slf4j
public class HttpChatCompletionClient implements ChatCompletionClient {
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final SorterProperties.Remote settings;

    public HttpChatCompletionClient(RestTemplate restTemplate, ObjectMapper objectMapper, SorterProperties.Remote settings) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.settings = settings;

        if (!settings.hasApiKey()) {
            log.warn("Remote classifier API key not configured. Set sorter.remote.api-key or SORTER_REMOTE_API_KEY; remote classification is disabled.");
        }
    }

    @Override
    public boolean isConfigured() {
        return settings.hasApiKey();
    }

    @Override
    public ChatOutcome complete(String systemPrompt, String userPrompt) {
        if (!isConfigured()) {
            return ChatOutcome.failure(ChatOutcome.ErrorKind.NOT_CONFIGURED, "API key not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(settings.getApiKey());

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", settings.getModel());
        requestBody.put("temperature", settings.getTemperature());
        requestBody.put("messages", List.of(
            Map.of("role", "system", "content", systemPrompt),
            Map.of("role", "user", "content", userPrompt)));

        HttpEntity<Map<String, Object>> request = new HttpEntity<>(requestBody, headers);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(settings.getApiUrl(), request, String.class);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value() || isQuotaMessage(e.getResponseBodyAsString())) {
                return ChatOutcome.failure(ChatOutcome.ErrorKind.QUOTA, "Quota/rate limit exceeded: " + e.getStatusCode());
            }
            return ChatOutcome.failure(ChatOutcome.ErrorKind.HTTP_STATUS, "HTTP " + e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            return ChatOutcome.failure(ChatOutcome.ErrorKind.TRANSPORT, e.getMessage());
        } catch (RestClientException e) {
            return ChatOutcome.failure(ChatOutcome.ErrorKind.TRANSPORT, e.getMessage());
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            return ChatOutcome.failure(ChatOutcome.ErrorKind.HTTP_STATUS, "HTTP " + response.getStatusCode().value());
        }

        try {
            JsonNode jsonResponse = objectMapper.readTree(response.getBody());
            JsonNode choices = jsonResponse.path("choices");
            if (choices.isArray() && choices.size() > 0) {
                JsonNode content = choices.get(0).path("message").path("content");
                if (content.isTextual()) {
                    return ChatOutcome.success(content.asText());
                }
            }
            return ChatOutcome.failure(ChatOutcome.ErrorKind.MALFORMED, "Unexpected response format");
        } catch (JsonProcessingException e) {
            return ChatOutcome.failure(ChatOutcome.ErrorKind.MALFORMED, "Response is not JSON: " + e.getOriginalMessage());
        }
    }

    private static boolean isQuotaMessage(String body) {
        String text = body == null ? "" : body.toLowerCase();
        return text.contains("quota") || text.contains("rate limit") || text.contains("resource exhausted");
    }
}
