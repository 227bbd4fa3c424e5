package se.escrow_be.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableAsync
public class AsyncConfig {

    @Value("${escrow.executor.arbitration-threads:4}")
    private int arbitrationThreads;

    @Value("${escrow.executor.broadcast-threads:4}")
    private int broadcastThreads;

    /**
     * Runs oracle calls, which may block for the whole retry window.
     */
    @Bean(name = "escrowTaskExecutor")
    public TaskExecutor escrowTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(arbitrationThreads);
        executor.setMaxPoolSize(arbitrationThreads);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("arbitration-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "broadcastExecutor")
    public TaskExecutor broadcastExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(broadcastThreads);
        executor.setMaxPoolSize(broadcastThreads);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("broadcast-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
