package uk.gegc.fluency.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.aop.interceptor.SimpleAsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Arrays;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for asynchronous work.
 * <p>
 * The {@code syncTaskExecutor} drains the content sync outbox right after a mutation commits.
 * It is bounded; when the queue is full the caller runs the task, and anything that still slips
 * through is picked up by the scheduled outbox sweep.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.sync.core-pool-size:2}")
    private int syncCorePoolSize;

    @Value("${async.sync.max-pool-size:4}")
    private int syncMaxPoolSize;

    @Value("${async.sync.queue-capacity:100}")
    private int syncQueueCapacity;

    @Value("${async.sync.keep-alive-seconds:60}")
    private int syncKeepAliveSeconds;

    @Bean(name = "syncTaskExecutor")
    public Executor syncTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(syncCorePoolSize);
        executor.setMaxPoolSize(syncMaxPoolSize);
        executor.setQueueCapacity(syncQueueCapacity);
        executor.setKeepAliveSeconds(syncKeepAliveSeconds);
        executor.setThreadNamePrefix("content-sync-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Sync Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                syncCorePoolSize, syncMaxPoolSize, syncQueueCapacity, syncKeepAliveSeconds);

        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return syncTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new SimpleAsyncUncaughtExceptionHandler() {
            @Override
            public void handleUncaughtException(Throwable ex, java.lang.reflect.Method method, Object... params) {
                log.error("Uncaught exception in async method: {}.{}() with parameters: {}",
                        method.getDeclaringClass().getSimpleName(),
                        method.getName(),
                        Arrays.toString(params), ex);
                super.handleUncaughtException(ex, method, params);
            }
        };
    }
}
