package xyz.firestige.toolkit.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 组合指标接收器，将一次观测分发给多个接收器。
 * <p>单个接收器异常只记录日志，不影响其余接收器。
 */
public class CompositeTickerMetrics implements TickerMetrics {
    private static final Logger log = LoggerFactory.getLogger(CompositeTickerMetrics.class);

    private final List<TickerMetrics> delegates;

    public CompositeTickerMetrics(List<TickerMetrics> delegates) {
        this.delegates = List.copyOf(Objects.requireNonNull(delegates));
    }

    public static CompositeTickerMetrics of(TickerMetrics... delegates) {
        return new CompositeTickerMetrics(List.of(delegates));
    }

    @Override
    public void observe(String name, Instant startedAt, Duration elapsed, boolean success) {
        for (TickerMetrics delegate : delegates) {
            try {
                delegate.observe(name, startedAt, elapsed, success);
            } catch (RuntimeException e) {
                log.warn("指标接收器执行失败: sink={}, ticker={}", delegate.getName(), name, e);
            }
        }
    }

    public List<TickerMetrics> getDelegates() {
        return delegates;
    }

    @Override
    public String getName() {
        return "Composite";
    }
}
