package email.agent.app.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pool shared by per-user poll cycles and batch draft items.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "emailProcessingExecutor")
    public Executor emailProcessingExecutor(
            @Value("${agent.executor.core-size:5}") int coreSize,
            @Value("${agent.executor.max-size:10}") int maxSize,
            @Value("${agent.executor.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("email-agent-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
