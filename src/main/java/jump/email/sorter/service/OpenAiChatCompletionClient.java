package jump.email.sorter.service;

import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionChoice;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.completion.chat.ChatMessageRole;
import com.theokanning.openai.service.OpenAiService;
import jump.email.sorter.config.SorterProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Chat-completion provider backed by the OpenAI client library.
 */
@Slf4j
public class OpenAiChatCompletionClient implements ChatCompletionClient {
    private final OpenAiService openAiService;
    private final SorterProperties.Remote settings;

    /**
     * @param openAiService null when no API key is configured
     */
    public OpenAiChatCompletionClient(OpenAiService openAiService, SorterProperties.Remote settings) {
        this.openAiService = openAiService;
        this.settings = settings;
        if (openAiService == null) {
            log.warn("OpenAI API key not configured. Set sorter.remote.api-key or SORTER_REMOTE_API_KEY; remote classification is disabled.");
        }
    }

    @Override
    public boolean isConfigured() {
        return openAiService != null;
    }

    @Override
    public ChatOutcome complete(String systemPrompt, String userPrompt) {
        if (!isConfigured()) {
            return ChatOutcome.failure(ChatOutcome.ErrorKind.NOT_CONFIGURED, "API key not configured");
        }
        try {
            ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(settings.getModel())
                .messages(List.of(
                    new ChatMessage(ChatMessageRole.SYSTEM.value(), systemPrompt),
                    new ChatMessage(ChatMessageRole.USER.value(), userPrompt)))
                .temperature(settings.getTemperature())
                .build();

            List<ChatCompletionChoice> choices = openAiService.createChatCompletion(request).getChoices();
            if (choices == null || choices.isEmpty() || choices.get(0).getMessage() == null
                || choices.get(0).getMessage().getContent() == null) {
                return ChatOutcome.failure(ChatOutcome.ErrorKind.MALFORMED, "Completion without content");
            }
            return ChatOutcome.success(choices.get(0).getMessage().getContent());
        } catch (OpenAiHttpException e) {
            if (e.statusCode == 429 || isQuotaMessage(e.getMessage())) {
                return ChatOutcome.failure(ChatOutcome.ErrorKind.QUOTA, "Quota/rate limit exceeded: " + e.getMessage());
            }
            return ChatOutcome.failure(ChatOutcome.ErrorKind.HTTP_STATUS, "HTTP " + e.statusCode + ": " + e.getMessage());
        } catch (RuntimeException e) {
            // The client wraps timeouts and connection failures in plain runtime exceptions
            return ChatOutcome.failure(ChatOutcome.ErrorKind.TRANSPORT, e.getMessage());
        }
    }

    private static boolean isQuotaMessage(String message) {
        String text = message == null ? "" : message.toLowerCase();
        return text.contains("quota") || text.contains("exceeded") || text.contains("rate limit");
    }
}
