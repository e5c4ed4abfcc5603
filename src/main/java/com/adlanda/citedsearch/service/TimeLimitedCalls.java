package com.adlanda.citedsearch.service;

import com.adlanda.citedsearch.exception.CitedSearchException;
import com.adlanda.citedsearch.exception.CollaboratorTimeoutException;
import com.adlanda.citedsearch.exception.OperationCancelledException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs blocking collaborator calls (embedding model, vector index) under a deadline.
 *
 * The call runs on a worker thread while the caller waits at most {@code timeout}.
 * On timeout, or when the waiting thread is interrupted, the worker is interrupted and
 * its result abandoned.
 */
@Component
public class TimeLimitedCalls {

    private static final Logger log = LoggerFactory.getLogger(TimeLimitedCalls.class);

    private final ExecutorService executor;

    public TimeLimitedCalls() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("collaborator-call-");
        threadFactory.setDaemon(true);
        this.executor = Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * @param collaborator Name used in log lines and in the timeout exception
     * @param timeout      Deadline for the call
     * @param task         The blocking call
     * @return The call's result
     * @throws CollaboratorTimeoutException when the deadline passes
     * @throws OperationCancelledException  when the calling thread is interrupted
     */
    public <T> T call(String collaborator, Duration timeout, Callable<T> task) {
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} call exceeded its {}ms deadline", collaborator, timeout.toMillis());
            throw new CollaboratorTimeoutException(collaborator, timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(collaborator + " call cancelled by caller", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CitedSearchException(collaborator + " call failed: " + cause.getMessage(), cause);
        }
    }

    public void run(String collaborator, Duration timeout, Runnable task) {
        call(collaborator, timeout, () -> {
            task.run();
            return null;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
