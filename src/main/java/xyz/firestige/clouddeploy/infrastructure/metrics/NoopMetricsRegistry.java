package xyz.firestige.clouddeploy.infrastructure.metrics;

import java.time.Duration;

public class NoopMetricsRegistry implements MetricsRegistry {
    @Override
    public void incrementCounter(String name, String... tags) { }

    @Override
    public void recordDuration(String name, Duration duration, String... tags) { }

    @Override
    public void setGauge(String name, double value) { }
}
