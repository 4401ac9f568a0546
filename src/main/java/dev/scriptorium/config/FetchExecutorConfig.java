package dev.scriptorium.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/** Provides the thread pool page fetches run on. Concurrency is capped per batch by the caller. */
@Configuration
public class FetchExecutorConfig {

    @Bean(name = "fetchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("fetch-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }
}
