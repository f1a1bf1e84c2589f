package io.github.drompincen.bugflow.runtime.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ActivityProperties.class)
public class RuntimeConfig {

    public static final String ENRICHMENT_EXECUTOR = "enrichmentExecutor";

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = ENRICHMENT_EXECUTOR)
    ThreadPoolTaskExecutor enrichmentExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(3);
        executor.setMaxPoolSize(6);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("enrich-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
