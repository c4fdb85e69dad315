package jump.email.sorter.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Configuration of the worker pool that fetches and classifies messages of a folder.
 * Folders themselves are always scanned one after another.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "classificationExecutor")
    public Executor classificationExecutor(SorterProperties properties) {
        int workers = properties.getScan().effectiveWorkers();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("mail-classifier-");
        // Let in-flight messages finish on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
