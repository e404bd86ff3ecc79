package com.herzen.tracing.store;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class DependencyFallbackMetrics {
    public static final String COUNTER_NAME = "tracing.dependency.fallbacks";

    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public DependencyFallbackMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void increment(String dependency, String reason) {
        String dep = safeTag(dependency);
        String why = safeTag(reason);
        counters.computeIfAbsent(dep + "|" + why,
                k -> Counter.builder(COUNTER_NAME)
                        .tag("dependency", dep)
                        .tag("reason", why)
                        .register(registry))
                .increment();
    }

    public double count(String dependency, String reason) {
        Counter counter = counters.get(safeTag(dependency) + "|" + safeTag(reason));
        return counter == null ? 0.0 : counter.count();
    }

    private static String safeTag(String raw) {
        if (raw == null || raw.isBlank()) return "none";
        return raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
