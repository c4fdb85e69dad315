package jump.email.sorter.service;

import com.theokanning.openai.completion.chat.ChatCompletionChoice;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatCompletionResult;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import jump.email.sorter.config.SorterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OpenAiChatCompletionClientTest {

    @Mock
    private OpenAiService openAiService;

    private SorterProperties.Remote settings;
    private OpenAiChatCompletionClient client;

    @BeforeEach
    void setUp() {
        settings = new SorterProperties.Remote();
        settings.setModel("gpt-4o-mini");
        client = new OpenAiChatCompletionClient(openAiService, settings);
    }

    private static ChatCompletionResult resultWith(String content) {
        ChatCompletionChoice choice = new ChatCompletionChoice();
        choice.setMessage(new ChatMessage("assistant", content));
        ChatCompletionResult result = new ChatCompletionResult();
        result.setChoices(List.of(choice));
        return result;
    }

    @Test
    void complete_WithChoice_ShouldReturnContent() {
        // Given
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class))).thenReturn(resultWith("[]"));

        // When
        ChatOutcome outcome = client.complete("system", "user");

        // Then
        assertTrue(outcome.isSuccess());
        assertEquals("[]", outcome.getContent());

        ArgumentCaptor<ChatCompletionRequest> captor = ArgumentCaptor.forClass(ChatCompletionRequest.class);
        verify(openAiService).createChatCompletion(captor.capture());
        assertEquals("gpt-4o-mini", captor.getValue().getModel());
        assertEquals("system", captor.getValue().getMessages().get(0).getRole());
        assertEquals("user", captor.getValue().getMessages().get(1).getContent());
    }

    @Test
    void complete_WithoutChoices_ShouldReportMalformed() {
        // Given
        ChatCompletionResult empty = new ChatCompletionResult();
        empty.setChoices(List.of());
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class))).thenReturn(empty);

        // When / Then
        assertEquals(ChatOutcome.ErrorKind.MALFORMED, client.complete("system", "user").getError());
    }

    @Test
    void complete_WhenClientThrows_ShouldReportTransport() {
        // Given
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class)))
            .thenThrow(new RuntimeException("timeout"));

        // When
        ChatOutcome outcome = client.complete("system", "user");

        // Then
        assertFalse(outcome.isSuccess());
        assertEquals(ChatOutcome.ErrorKind.TRANSPORT, outcome.getError());
    }

    @Test
    void complete_WithoutService_ShouldReportNotConfigured() {
        // Given
        OpenAiChatCompletionClient unconfigured = new OpenAiChatCompletionClient(null, settings);

        // When / Then
        assertFalse(unconfigured.isConfigured());
        assertEquals(ChatOutcome.ErrorKind.NOT_CONFIGURED, unconfigured.complete("system", "user").getError());
    }
}
