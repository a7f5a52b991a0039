package com.gt.wordfilter.conf;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfig {

    @Bean(name = "dictionaryExecutor")
    public ThreadPoolTaskExecutor getDictionaryExecutor(@Value("${wordfilter.dictionary.maxConcurrentRequests:3}") int maxConcurrentRequests) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrentRequests);
        executor.setMaxPoolSize(maxConcurrentRequests);
        executor.setThreadNamePrefix("dictionary-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        return executor;
    }

    // Maintenance runs are long. Two may run side by side, further requests queue.
    @Bean(name = "maintenanceExecutor")
    public ThreadPoolTaskExecutor getMaintenanceExecutor(@Value("${wordfilter.maintenance.maxQueuedJobs:10}") int maxQueuedJobs) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(maxQueuedJobs);
        executor.setThreadNamePrefix("maintenance-");
        executor.initialize();

        return executor;
    }
}
