package com.bulkops.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for batch and row work, plus the scheduler that drives job polling.
 *
 * Pools are sized generously; the number of calls actually reaching the backend
 * is bounded by the RateLimiter and per-batch semaphores, not by thread counts.
 * Every executor propagates the caller's MDC (operationId, batchId) into its tasks.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Value("${app.execution.batch-concurrency:4}")
    private int batchConcurrency;

    @Value("${app.poller.scheduler-threads:2}")
    private int pollerThreads;

    /**
     * Runs whole batches. One task per in-flight batch.
     */
    @Bean(name = "batchExecutor", destroyMethod = "shutdown")
    public ExecutorService batchExecutor() {
        log.info("Creating batch executor with {} threads and MDC propagation", batchConcurrency);
        return new MdcPropagatingExecutorService(
                Executors.newFixedThreadPool(batchConcurrency, namedThreads("bulkops-batch-")));
    }

    /**
     * Runs per-record synchronous calls. Unbounded; callers limit concurrency with semaphores.
     */
    @Bean(name = "rowExecutor", destroyMethod = "shutdown")
    public ExecutorService rowExecutor() {
        log.info("Creating row executor with MDC propagation");
        return new MdcPropagatingExecutorService(Executors.newCachedThreadPool(namedThreads("bulkops-row-")));
    }

    @Bean(name = "jobPollScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService jobPollScheduler() {
        log.info("Creating job poll scheduler with {} threads", pollerThreads);
        return Executors.newScheduledThreadPool(pollerThreads, namedThreads("bulkops-poll-"));
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * ExecutorService decorator that copies the submitting thread's MDC into each task
     * and clears it afterwards.
     */
    public static class MdcPropagatingExecutorService implements ExecutorService {

        private final ExecutorService delegate;

        public MdcPropagatingExecutorService(ExecutorService delegate) {
            this.delegate = delegate;
        }

        private <T> Callable<T> wrap(Callable<T> callable) {
            final Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    return callable.call();
                } finally {
                    MDC.clear();
                }
            };
        }

        private Runnable wrap(Runnable runnable) {
            final Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }

        private <T> List<Callable<T>> wrapAll(Collection<? extends Callable<T>> tasks) {
            return tasks.stream().<Callable<T>>map(this::wrap).toList();
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(wrap(command));
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
            return delegate.submit(wrap(task));
        }

        @Override
        public Future<?> submit(Runnable task) {
            return delegate.submit(wrap(task));
        }

        @Override
        public <T> Future<T> submit(Runnable task, T result) {
            return delegate.submit(wrap(task), result);
        }

        @Override
        public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks) throws InterruptedException {
            return delegate.invokeAll(wrapAll(tasks));
        }

        @Override
        public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
                throws InterruptedException {
            return delegate.invokeAll(wrapAll(tasks), timeout, unit);
        }

        @Override
        public <T> T invokeAny(Collection<? extends Callable<T>> tasks) throws InterruptedException, ExecutionException {
            return delegate.invokeAny(wrapAll(tasks));
        }

        @Override
        public <T> T invokeAny(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
                throws InterruptedException, ExecutionException, TimeoutException {
            return delegate.invokeAny(wrapAll(tasks), timeout, unit);
        }

        // Boilerplate delegate methods
        @Override
        public void shutdown() { delegate.shutdown(); }
        @Override
        public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override
        public boolean isShutdown() { return delegate.isShutdown(); }
        @Override
        public boolean isTerminated() { return delegate.isTerminated(); }
        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }
}
