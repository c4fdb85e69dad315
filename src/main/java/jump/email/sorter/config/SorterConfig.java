package jump.email.sorter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jump.email.sorter.entity.Category;
import jump.email.sorter.repository.JsonDocumentStore;
import jump.email.sorter.service.CategoryRegistry;
import jump.email.sorter.service.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Wiring of the process-wide collaborators that are built from configuration values.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SorterProperties.class)
public class SorterConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public CategoryRegistry categoryRegistry(SorterProperties properties) {
        if (properties.getCategories().isEmpty()) {
            throw new IllegalStateException("No categories configured. Declare them under sorter.categories");
        }
        List<Category> categories = properties.getCategories().stream()
            .map(cat -> Category.builder()
                .name(cat.getName())
                .folder(cat.getFolder())
                .keywords(cat.getKeywords())
                .confidenceThreshold(cat.getConfidenceThreshold())
                .priority(cat.getPriority())
                .description(cat.getDescription())
                .build())
            .collect(Collectors.toList());
        CategoryRegistry registry = new CategoryRegistry(categories);
        log.info("Loaded {} categories: {}", registry.names().size(), registry.names());
        return registry;
    }

    @Bean
    public JsonDocumentStore jsonDocumentStore(SorterProperties properties, ObjectMapper objectMapper) {
        log.info("Using data directory {}", properties.getDataDir());
        return new JsonDocumentStore(Paths.get(properties.getDataDir()), objectMapper);
    }

    @Bean
    public RateLimiter remoteRateLimiter(SorterProperties properties) {
        SorterProperties.Remote remote = properties.getRemote();
        return new RateLimiter(remote.getMaxCalls(), Duration.ofSeconds(remote.getWindowSeconds()));
    }
}
