package xyz.firestige.toolkit.spring.metric;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import xyz.firestige.toolkit.jobticker.JobTicker;
import xyz.firestige.toolkit.jobticker.JobTickerFactory;
import xyz.firestige.toolkit.metrics.TickerMetricsCollector;

import java.util.Map;
import java.util.TreeMap;

/**
 * ticker 健康检查指示器
 * <p>任一登记的 ticker 未运行时为 DOWN；成功率低于阈值时为 UNKNOWN。
 */
public class TickerHealthIndicator implements HealthIndicator {

    private final JobTickerFactory factory;
    private final TickerMetricsCollector collector;
    private final double warningSuccessRateThreshold;

    public TickerHealthIndicator(JobTickerFactory factory, TickerMetricsCollector collector) {
        this(factory, collector, 80.0);
    }

    public TickerHealthIndicator(JobTickerFactory factory,
                                 TickerMetricsCollector collector,
                                 double warningSuccessRateThreshold) {
        this.factory = factory;
        this.collector = collector;
        this.warningSuccessRateThreshold = warningSuccessRateThreshold;
    }

    @Override
    public Health health() {
        TickerMetricsCollector.MetricsSnapshot snapshot = collector.snapshot();

        Map<String, String> states = new TreeMap<>();
        int stopped = 0;
        for (JobTicker ticker : factory.getTickers()) {
            states.put(ticker.getName(), ticker.isRunning() ? "RUNNING" : "STOPPED");
            if (!ticker.isRunning()) {
                stopped++;
            }
        }

        Health.Builder builder = new Health.Builder()
                .withDetail("tickers", states)
                .withDetail("totalExecutions", snapshot.getTotalExecutions())
                .withDetail("failureCount", snapshot.getFailureCount())
                .withDetail("successRate", String.format("%.2f%%", snapshot.getSuccessRate()));

        if (snapshot.getLastExecutionTime() != null) {
            builder.withDetail("lastExecutionTime", snapshot.getLastExecutionTime().toString());
        }

        if (stopped > 0) {
            return builder.down()
                    .withDetail("reason", "未运行的 ticker: " + stopped + " 个")
                    .build();
        }

        double successRate = snapshot.getSuccessRate();
        if (successRate < warningSuccessRateThreshold) {
            return builder.unknown()
                    .withDetail("reason", "成功率过低: " + String.format("%.2f%%", successRate))
                    .build();
        }

        return builder.up().build();
    }
}
