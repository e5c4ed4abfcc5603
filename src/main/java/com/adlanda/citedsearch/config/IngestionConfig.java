package com.adlanda.citedsearch.config;

import com.adlanda.citedsearch.exception.CollaboratorTimeoutException;
import com.adlanda.citedsearch.exception.IndexUpsertException;
import com.adlanda.citedsearch.exception.PayloadTooLargeException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

/**
 * Worker pool and retry policy used by the ingestion batcher.
 */
@Configuration
public class IngestionConfig {

    /**
     * Executor dedicated to ingestion batches. Sized by {@code citedsearch.ingestion.parallelism};
     * with the default of 1 batches run on the calling thread and this pool stays idle.
     */
    @Bean(name = "ingestionExecutor")
    public ThreadPoolTaskExecutor ingestionExecutor(IngestionProperties ingestionProperties) {
        int parallelism = Math.max(1, ingestionProperties.getParallelism());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setThreadNamePrefix("ingestion-batch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Retries transient upsert failures with exponential backoff.
     *
     * {@link PayloadTooLargeException} is never retried as-is: the batcher shrinks the request instead.
     */
    @Bean
    public RetryTemplate upsertRetryTemplate(IngestionProperties ingestionProperties) {
        Map<Class<? extends Throwable>, Boolean> retryable = Map.of(
                IndexUpsertException.class, true,
                CollaboratorTimeoutException.class, true,
                PayloadTooLargeException.class, false
        );
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(
                Math.max(0, ingestionProperties.getMaxRetries()) + 1, retryable, true);

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(ingestionProperties.getInitialBackoff().toMillis());
        backOffPolicy.setMultiplier(2.0);
        backOffPolicy.setMaxInterval(ingestionProperties.getMaxBackoff().toMillis());

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(retryPolicy);
        retryTemplate.setBackOffPolicy(backOffPolicy);
        return retryTemplate;
    }
}
