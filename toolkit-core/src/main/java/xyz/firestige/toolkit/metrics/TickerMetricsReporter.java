package xyz.firestige.toolkit.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.toolkit.jobticker.JobTicker;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * ticker 指标定时报告器
 * <p>借助一个 {@link JobTicker} 定期打印收集器中的运行指标
 */
public class TickerMetricsReporter {
    private static final Logger log = LoggerFactory.getLogger(TickerMetricsReporter.class);

    private final TickerMetricsCollector collector;
    private final Duration interval;
    private final JobTicker ticker;

    public TickerMetricsReporter(TickerMetricsCollector collector, Duration interval) {
        this.collector = Objects.requireNonNull(collector);
        this.interval = Objects.requireNonNull(interval);
        this.ticker = JobTicker.builder("ticker-metrics-reporter", this::report, interval).build();
    }

    /**
     * 启动定时报告
     */
    public void start() {
        ticker.start();
        log.info("ticker 指标报告器已启动，间隔: {}", interval);
    }

    /**
     * 停止报告
     */
    public void stop() {
        ticker.stop();
        log.info("ticker 指标报告器已停止");
    }

    public boolean isRunning() {
        return ticker.isRunning();
    }

    /**
     * 打印指标报告
     */
    void report() {
        log.info(render());
    }

    String render() {
        TickerMetricsCollector.MetricsSnapshot snapshot = collector.snapshot();

        StringBuilder report = new StringBuilder("\n");
        report.append("==================== Job Ticker 指标 ====================\n");
        report.append(String.format("总执行次数:      %d%n", snapshot.getTotalExecutions()));
        report.append(String.format("成功次数:        %d%n", snapshot.getSuccessCount()));
        report.append(String.format("失败次数:        %d%n", snapshot.getFailureCount()));
        report.append(String.format("成功率:          %.2f%%%n", snapshot.getSuccessRate()));
        report.append(String.format("平均耗时:        %dms%n", snapshot.getAverageElapsed().toMillis()));

        Instant lastTime = snapshot.getLastExecutionTime();
        report.append(String.format("最后执行时间:    %s%n", lastTime != null ? lastTime : "N/A"));

        for (Map.Entry<String, TickerMetricsCollector.MetricsSnapshot> e : collector.snapshots().entrySet()) {
            TickerMetricsCollector.MetricsSnapshot s = e.getValue();
            report.append(String.format("  [%s] 执行=%d 失败=%d 平均耗时=%dms%n",
                    e.getKey(), s.getTotalExecutions(), s.getFailureCount(), s.getAverageElapsed().toMillis()));
        }
        report.append("=========================================================");
        return report.toString();
    }
}
