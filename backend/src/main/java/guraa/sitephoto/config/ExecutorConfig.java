package guraa.sitephoto.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configuration for thread pools and executor services.
 */
@Configuration
public class ExecutorConfig {

    @Value("${app.reports.core-pool-size:2}")
    private int reportCorePoolSize;

    @Value("${app.reports.max-pool-size:4}")
    private int reportMaxPoolSize;

    @Value("${app.reports.queue-capacity:50}")
    private int reportQueueCapacity;

    /**
     * Worker pool for per-photo extraction and matching units.
     *
     * @param properties Supplies the thread count
     * @return The executor service
     */
    @Bean(name = "matchingExecutor", destroyMethod = "shutdownNow")
    public ExecutorService matchingExecutor(AppProperties properties) {
        int threads = Math.max(1, properties.getMatching().getThreads());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "photo-match-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    /**
     * Executor running whole report builds in the background.
     *
     * @return The thread pool task executor
     */
    @Bean(name = "reportTaskExecutor")
    public ThreadPoolTaskExecutor reportTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(reportCorePoolSize);
        executor.setMaxPoolSize(reportMaxPoolSize);
        executor.setQueueCapacity(reportQueueCapacity);
        executor.setThreadNamePrefix("report-");

        // Reject rather than run a build on the request thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        executor.initialize();
        return executor;
    }
}
