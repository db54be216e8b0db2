package xyz.firestige.clouddeploy.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

public class MicrometerMetricsRegistry implements MetricsRegistry {
    private final MeterRegistry registry;
    private final ConcurrentMap<String, DoubleHolder> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRegistry(MeterRegistry registry) { this.registry = registry; }

    @Override
    public void incrementCounter(String name, String... tags) { registry.counter(name, tags).increment(); }

    @Override
    public void recordDuration(String name, Duration duration, String... tags) {
        registry.timer(name, tags).record(duration);
    }

    @Override
    public void setGauge(String name, double value) {
        DoubleHolder holder = gauges.computeIfAbsent(name, n -> {
            DoubleHolder h = new DoubleHolder();
            registry.gauge(n, h, DoubleHolder::get);
            return h;
        });
        holder.set(value);
    }

    /**
     * 计数器与计时器的可读摘要，key 为 name{tags}
     */
    @Override
    public Map<String, String> summary() {
        Map<String, String> lines = new LinkedHashMap<>();
        for (Meter meter : registry.getMeters()) {
            String key = meter.getId().getName() + meter.getId().getTags().stream()
                    .map(t -> t.getKey() + "=" + t.getValue())
                    .reduce((a, b) -> a + "," + b)
                    .map(s -> "{" + s + "}")
                    .orElse("");
            if (meter instanceof Counter counter) {
                lines.put(key, String.valueOf((long) counter.count()));
            } else if (meter instanceof Timer timer) {
                lines.put(key, String.format("count=%d total=%.1fs", timer.count(), timer.totalTime(TimeUnit.SECONDS)));
            }
        }
        return lines;
    }

    static class DoubleHolder {
        private volatile double v;
        double get() { return v; }
        void set(double v) { this.v = v; }
    }
}
