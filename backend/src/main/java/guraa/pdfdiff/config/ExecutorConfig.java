package guraa.pdfdiff.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool used to diff matched page pairs.
 */
@Configuration
public class ExecutorConfig {

    @Value("${pdfdiff.planner.core-pool-size:2}")
    private int corePoolSize;

    @Value("${pdfdiff.planner.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${pdfdiff.planner.queue-capacity:100}")
    private int queueCapacity;

    /**
     * Executor for word diffs of matched page pairs. Only used when
     * {@code pdfdiff.planner.parallel} is enabled.
     *
     * @return The thread pool task executor
     */
    @Bean(name = "pageDiffExecutor")
    public ThreadPoolTaskExecutor pageDiffExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("page-diff-");

        // Use CallerRunsPolicy to avoid rejection when queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.initialize();
        return executor;
    }
}
