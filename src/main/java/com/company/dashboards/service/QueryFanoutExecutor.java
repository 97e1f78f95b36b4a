package com.company.dashboards.service;

import com.company.dashboards.config.DashboardProperties;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Shared, fixed-size pool for query fan-out. The pool size is the global cap on in-flight
 * engine queries; extra tasks wait in the pool's queue. Each batch has its own deadline and
 * only that batch's unfinished tasks are cancelled when it passes.
 */
@Component
@Slf4j
public class QueryFanoutExecutor {

    private final ExecutorService pool;
    private final int maxConcurrentQueries;

    @Autowired
    public QueryFanoutExecutor(DashboardProperties properties) {
        this(properties.getServing().getMaxConcurrentQueries());
    }

    QueryFanoutExecutor(int maxConcurrentQueries) {
        if (maxConcurrentQueries <= 0) {
            throw new IllegalArgumentException("maxConcurrentQueries must be positive: " + maxConcurrentQueries);
        }
        AtomicInteger threadCounter = new AtomicInteger();
        this.maxConcurrentQueries = maxConcurrentQueries;
        this.pool = Executors.newFixedThreadPool(maxConcurrentQueries, runnable -> {
            Thread thread = new Thread(runnable, "query-fanout-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runs every task and returns their results in task order. A task that throws, or is still
     * running or queued when {@code timeout} elapses, is replaced by {@code onFailure} applied to
     * the cause ({@link TimeoutException} for the deadline).
     */
    public <T> List<T> runAll(List<Callable<T>> tasks, Duration timeout, Function<Throwable, T> onFailure) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Callable<T>> wrapped = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            wrapped.add(withMdc(task, mdc));
        }

        List<Future<T>> futures;
        try {
            futures = pool.invokeAll(wrapped, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            List<T> interrupted = new ArrayList<>(tasks.size());
            for (int i = 0; i < tasks.size(); i++) {
                interrupted.add(onFailure.apply(e));
            }
            return interrupted;
        }

        List<T> results = new ArrayList<>(futures.size());
        int timedOut = 0;
        for (Future<T> future : futures) {
            try {
                results.add(future.get());
            } catch (CancellationException e) {
                timedOut++;
                results.add(onFailure.apply(new TimeoutException("Query did not finish within " + timeout)));
            } catch (ExecutionException e) {
                results.add(onFailure.apply(e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.add(onFailure.apply(e));
            }
        }
        if (timedOut > 0) {
            log.warn("{} of {} queries cancelled after {}", timedOut, tasks.size(), timeout);
        }
        return results;
    }

    public int getMaxConcurrentQueries() {
        return maxConcurrentQueries;
    }

    @PreDestroy
    public void shutdown() {
        pool.shutdownNow();
    }

    private static <T> Callable<T> withMdc(Callable<T> task, Map<String, String> mdc) {
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return task.call();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
