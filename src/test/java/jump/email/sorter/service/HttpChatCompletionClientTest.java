package jump.email.sorter.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import jump.email.sorter.config.SorterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HttpChatCompletionClientTest {

    @Mock
    private RestTemplate restTemplate;

    private SorterProperties.Remote settings;
    private HttpChatCompletionClient client;

    @BeforeEach
    void setUp() {
        settings = new SorterProperties.Remote();
        settings.setApiKey("secret");
        client = new HttpChatCompletionClient(restTemplate, new ObjectMapper(), settings);
    }

    @Test
    @SuppressWarnings("unchecked")
    void complete_WithSuccessfulResponse_ShouldReturnContentAndSendBearerToken() {
        // Given
        String body = "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"[]\"}}]}";
        when(restTemplate.postForEntity(eq(settings.getApiUrl()), any(HttpEntity.class), eq(String.class)))
            .thenReturn(new ResponseEntity<>(body, HttpStatus.OK));

        // When
        ChatOutcome outcome = client.complete("system", "user");

        // Then
        assertTrue(outcome.isSuccess());
        assertEquals("[]", outcome.getContent());

        ArgumentCaptor<HttpEntity<Map<String, Object>>> captor = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).postForEntity(eq(settings.getApiUrl()), captor.capture(), eq(String.class));
        assertEquals("Bearer secret", captor.getValue().getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals("sonar-pro", captor.getValue().getBody().get("model"));
        List<Map<String, String>> messages = (List<Map<String, String>>) captor.getValue().getBody().get("messages");
        assertEquals("system", messages.get(0).get("role"));
        assertEquals("user", messages.get(1).get("content"));
    }

    @Test
    void complete_WithTooManyRequests_ShouldReportQuota() {
        // Given
        when(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
            .thenThrow(new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS));

        // When
        ChatOutcome outcome = client.complete("system", "user");

        // Then
        assertFalse(outcome.isSuccess());
        assertEquals(ChatOutcome.ErrorKind.QUOTA, outcome.getError());
    }

    @Test
    void complete_WithServerError_ShouldReportHttpStatus() {
        // Given
        when(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
            .thenThrow(new HttpServerErrorException(HttpStatus.BAD_GATEWAY));

        // When
        ChatOutcome outcome = client.complete("system", "user");

        // Then
        assertEquals(ChatOutcome.ErrorKind.HTTP_STATUS, outcome.getError());
        assertTrue(outcome.getDetail().contains("502"));
    }

    @Test
    void complete_WithTimeout_ShouldReportTransport() {
        // Given
        when(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
            .thenThrow(new ResourceAccessException("Read timed out"));

        // When / Then
        assertEquals(ChatOutcome.ErrorKind.TRANSPORT, client.complete("system", "user").getError());
    }

    @Test
    void complete_WithUnexpectedBody_ShouldReportMalformed() {
        // Given
        when(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
            .thenReturn(new ResponseEntity<>("{\"error\":\"none\"}", HttpStatus.OK));

        // When / Then
        assertEquals(ChatOutcome.ErrorKind.MALFORMED, client.complete("system", "user").getError());
    }

    @Test
    void complete_WithoutApiKey_ShouldNotCallEndpoint() {
        // Given
        settings.setApiKey("");

        // When
        ChatOutcome outcome = client.complete("system", "user");

        // Then
        assertFalse(client.isConfigured());
        assertEquals(ChatOutcome.ErrorKind.NOT_CONFIGURED, outcome.getError());
        verifyNoInteractions(restTemplate);
    }
}
