package com.herzen.tracing.store;

import com.herzen.tracing.config.EngineProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

@Component
public class StoreCallGuard {
    private static final Logger log = LoggerFactory.getLogger(StoreCallGuard.class);
    private static final int QUEUE_CAPACITY = 512;

    private final ThreadPoolExecutor executor;
    private final Duration timeout;
    private final DependencyFallbackMetrics metrics;

    public StoreCallGuard(EngineProperties properties, DependencyFallbackMetrics metrics) {
        this.timeout = properties.store().timeout();
        this.metrics = metrics;
        int threads = Math.max(1, properties.store().workerThreads());
        AtomicInteger counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(threads, threads, 30, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(QUEUE_CAPACITY),
                r -> {
                    Thread t = new Thread(r, "store-call-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    public <T> Guarded<T> call(String dependency, Callable<T> call, Supplier<T> fallback) {
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException ex) {
            return fallback(dependency, "rejected", ex.getMessage(), fallback);
        }
        try {
            return new Guarded<>(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS), false);
        } catch (TimeoutException ex) {
            future.cancel(true);
            return fallback(dependency, "timeout", "no answer within " + timeout.toMillis() + " ms", fallback);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return fallback(dependency, "interrupted", ex.getMessage(), fallback);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            return fallback(dependency, "error", cause.getMessage(), fallback);
        }
    }

    public boolean run(String dependency, Runnable action) {
        return !call(dependency, () -> {
            action.run();
            return Boolean.TRUE;
        }, () -> Boolean.FALSE).degraded();
    }

    private <T> Guarded<T> fallback(String dependency, String reason, String detail, Supplier<T> fallback) {
        log.warn("Store call to {} fell back ({}): {}", dependency, reason, detail);
        metrics.increment(dependency, reason);
        return new Guarded<>(fallback.get(), true);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public record Guarded<T>(T value, boolean degraded) {}
}
