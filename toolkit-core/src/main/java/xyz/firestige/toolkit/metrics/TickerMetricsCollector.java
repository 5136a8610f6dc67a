package xyz.firestige.toolkit.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ticker 指标收集器
 * <p>线程安全的内存指标，按 ticker 名称分别统计，同时维护全局汇总。
 */
public class TickerMetricsCollector implements TickerMetrics {

    private final Stats total = new Stats();
    private final Map<String, Stats> perTicker = new ConcurrentHashMap<>();

    @Override
    public void observe(String name, Instant startedAt, Duration elapsed, boolean success) {
        total.record(startedAt, elapsed, success);
        perTicker.computeIfAbsent(name, n -> new Stats()).record(startedAt, elapsed, success);
    }

    /**
     * 获取总执行次数
     */
    public long getTotalExecutions() {
        return total.executions.get();
    }

    public long getSuccessCount() {
        return total.successes.get();
    }

    public long getFailureCount() {
        return total.failures.get();
    }

    /**
     * 获取成功率（百分比），无数据时为 100
     */
    public double getSuccessRate() {
        return total.successRate();
    }

    public Instant getLastExecutionTime() {
        return total.lastExecution;
    }

    /**
     * 重置指标
     */
    public void reset() {
        total.reset();
        perTicker.clear();
    }

    /**
     * 获取全局指标快照
     */
    public MetricsSnapshot snapshot() {
        return total.snapshot();
    }

    /**
     * 获取单个 ticker 的指标快照，未观测过时返回 null
     */
    public MetricsSnapshot snapshot(String name) {
        Stats stats = perTicker.get(name);
        return stats == null ? null : stats.snapshot();
    }

    /**
     * 按名称排序的全部 ticker 快照
     */
    public Map<String, MetricsSnapshot> snapshots() {
        Map<String, MetricsSnapshot> result = new TreeMap<>();
        perTicker.forEach((name, stats) -> result.put(name, stats.snapshot()));
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String getName() {
        return "Collector";
    }

    private static final class Stats {
        private final AtomicLong executions = new AtomicLong();
        private final AtomicLong successes = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();
        private final AtomicLong elapsedNanos = new AtomicLong();
        private volatile Instant lastExecution;
        private volatile Duration lastElapsed;

        void record(Instant startedAt, Duration elapsed, boolean success) {
            executions.incrementAndGet();
            if (success) {
                successes.incrementAndGet();
            } else {
                failures.incrementAndGet();
            }
            elapsedNanos.addAndGet(elapsed.toNanos());
            lastExecution = startedAt;
            lastElapsed = elapsed;
        }

        double successRate() {
            long count = successes.get() + failures.get();
            return count > 0 ? (double) successes.get() / count * 100 : 100.0;
        }

        void reset() {
            executions.set(0);
            successes.set(0);
            failures.set(0);
            elapsedNanos.set(0);
            lastExecution = null;
            lastElapsed = null;
        }

        MetricsSnapshot snapshot() {
            return new MetricsSnapshot(
                executions.get(),
                successes.get(),
                failures.get(),
                successRate(),
                Duration.ofNanos(elapsedNanos.get()),
                lastExecution,
                lastElapsed
            );
        }
    }

    /**
     * 指标快照（不可变）
     */
    public static class MetricsSnapshot {
        private final long totalExecutions;
        private final long successCount;
        private final long failureCount;
        private final double successRate;
        private final Duration totalElapsed;
        private final Instant lastExecutionTime;
        private final Duration lastElapsed;

        public MetricsSnapshot(long totalExecutions, long successCount, long failureCount,
                               double successRate, Duration totalElapsed,
                               Instant lastExecutionTime, Duration lastElapsed) {
            this.totalExecutions = totalExecutions;
            this.successCount = successCount;
            this.failureCount = failureCount;
            this.successRate = successRate;
            this.totalElapsed = totalElapsed;
            this.lastExecutionTime = lastExecutionTime;
            this.lastElapsed = lastElapsed;
        }

        public long getTotalExecutions() { return totalExecutions; }
        public long getSuccessCount() { return successCount; }
        public long getFailureCount() { return failureCount; }
        public double getSuccessRate() { return successRate; }
        public Duration getTotalElapsed() { return totalElapsed; }
        public Instant getLastExecutionTime() { return lastExecutionTime; }
        public Duration getLastElapsed() { return lastElapsed; }

        /**
         * 平均耗时，无执行记录时为 {@link Duration#ZERO}
         */
        public Duration getAverageElapsed() {
            return totalExecutions > 0 ? totalElapsed.dividedBy(totalExecutions) : Duration.ZERO;
        }
    }
}
