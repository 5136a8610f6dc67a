package xyz.firestige.toolkit.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 基于 Micrometer 的 ticker 指标接收器
 * <p>
 * 记录以下指标（标签 ticker=名称, outcome=success|failure）：
 * - job_ticker_executions: 处理器执行次数
 * - job_ticker_duration: 处理器执行耗时分布
 */
public class MicrometerTickerMetrics implements TickerMetrics {

    static final String EXECUTIONS = "job_ticker_executions";
    static final String DURATION = "job_ticker_duration";

    private final MeterRegistry registry;

    public MicrometerTickerMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry);
    }

    @Override
    public void observe(String name, Instant startedAt, Duration elapsed, boolean success) {
        String outcome = success ? "success" : "failure";
        Counter.builder(EXECUTIONS)
                .description("Job ticker handler executions")
                .tag("ticker", name)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder(DURATION)
                .description("Job ticker handler duration")
                .tag("ticker", name)
                .tag("outcome", outcome)
                .register(registry)
                .record(elapsed);
    }

    @Override
    public String getName() {
        return "Micrometer";
    }
}
