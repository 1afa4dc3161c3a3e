package com.amblue.agent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Dedicated thread pools, isolated from the web thread pool.
 *
 * - agentTaskExecutor: runs streaming agent loops (one thread per in-flight stream)
 * - sseTaskExecutor:   drains event streams into SSE connections
 * - traceTaskExecutor: async run-trace persistence
 *
 * The loop and its SSE writer sit on separate pools so a full loop pool can never
 * block the writers that would free it.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "agentTaskExecutor")
    public ThreadPoolTaskExecutor agentTaskExecutor() {
        return pool("agent-loop-", 4, 16, 100);
    }

    @Bean(name = "sseTaskExecutor")
    public ThreadPoolTaskExecutor sseTaskExecutor() {
        return pool("agent-sse-", 4, 16, 100);
    }

    @Bean(name = "traceTaskExecutor")
    public Executor traceTaskExecutor() {
        return pool("trace-async-", 2, 5, 50);
    }

    private ThreadPoolTaskExecutor pool(String prefix, int core, int max, int queue) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
