package com.baykanat.insider.insights.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Engine için sınırlı worker pool ve Clock bean'leri. */
@Slf4j
@Configuration
public class EngineConfig {

    /** Actor partition ve entity task'ları için sabit boyutlu pool; daemon thread'ler. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService insightExecutor(AppProperties appProperties) {
        int configured = appProperties.getEngine().getParallelism();
        int size = configured > 0 ? configured : Runtime.getRuntime().availableProcessors();
        log.info("Starting insight executor with {} workers", size);

        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "insight-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(size, threadFactory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
