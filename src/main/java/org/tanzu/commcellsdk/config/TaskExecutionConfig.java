package org.tanzu.commcellsdk.config;

import jakarta.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor used to initialize independent feature handles in parallel.
 */
@Configuration
public class TaskExecutionConfig {

    private ExecutorService initTaskExecutor;

    @Bean
    public ExecutorService initTaskExecutor(CommcellConfig commcellConfig) {
        int core = Math.max(1, Math.min(8, commcellConfig.getInitThreadCount()));
        this.initTaskExecutor = new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(64),
                new NamedThreadFactory("commcell-init-"),
                new ThreadPoolExecutor.CallerRunsPolicy());
        return this.initTaskExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (initTaskExecutor != null) {
            initTaskExecutor.shutdown();
        }
    }

    public static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        public NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
