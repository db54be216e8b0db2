package xyz.firestige.clouddeploy.infrastructure.metrics;

import java.time.Duration;
import java.util.Map;

public interface MetricsRegistry {
    void incrementCounter(String name, String... tags);
    void recordDuration(String name, Duration duration, String... tags);
    void setGauge(String name, double value);

    /**
     * 运行结束时打印的指标摘要
     */
    default Map<String, String> summary() {
        return Map.of();
    }
}
