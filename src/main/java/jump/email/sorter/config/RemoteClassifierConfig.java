package jump.email.sorter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.theokanning.openai.service.OpenAiService;
import jump.email.sorter.service.ChatCompletionClient;
import jump.email.sorter.service.HttpChatCompletionClient;
import jump.email.sorter.service.OpenAiChatCompletionClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Configuration to switch between remote classification providers.
 * Set sorter.remote.provider=http or sorter.remote.provider=openai in application.yml
 */
@Configuration
public class RemoteClassifierConfig {

    @Bean
    @Primary
    @ConditionalOnProperty(name = "sorter.remote.provider", havingValue = "http", matchIfMissing = true)
    public ChatCompletionClient httpChatCompletionClient(SorterProperties properties,
                                                         RestTemplateBuilder restTemplateBuilder,
                                                         ObjectMapper objectMapper) {
        SorterProperties.Remote remote = properties.getRemote();
        RestTemplate restTemplate = restTemplateBuilder
            .setConnectTimeout(Duration.ofMillis(remote.getTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(remote.getTimeoutMs()))
            .build();
        return new HttpChatCompletionClient(restTemplate, objectMapper, remote);
    }

    @Bean
    @Primary
    @ConditionalOnProperty(name = "sorter.remote.provider", havingValue = "openai")
    public ChatCompletionClient openAiChatCompletionClient(SorterProperties properties) {
        SorterProperties.Remote remote = properties.getRemote();
        OpenAiService openAiService = remote.hasApiKey()
            ? new OpenAiService(remote.getApiKey(), Duration.ofMillis(remote.getTimeoutMs()))
            : null;
        return new OpenAiChatCompletionClient(openAiService, remote);
    }
}
