package xyz.firestige.toolkit.metrics;

import xyz.firestige.toolkit.Named;

import java.time.Duration;
import java.time.Instant;

/**
 * ticker 指标接收器
 * <p>每次处理器调用结束后回调一次，无论成功、失败还是崩溃。
 */
@FunctionalInterface
public interface TickerMetrics extends Named {

    void observe(String name, Instant startedAt, Duration elapsed, boolean success);

    static TickerMetrics noop() {
        return (name, startedAt, elapsed, success) -> {};
    }
}
