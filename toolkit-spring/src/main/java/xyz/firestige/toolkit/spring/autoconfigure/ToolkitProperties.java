package xyz.firestige.toolkit.spring.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 并发工具包配置属性
 */
@ConfigurationProperties(prefix = "toolkit")
public class ToolkitProperties {

    /**
     * 是否启用自动配置
     */
    private boolean enabled = true;

    private Ticker ticker = new Ticker();

    private Counter counter = new Counter();

    private Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Ticker getTicker() {
        return ticker;
    }

    public void setTicker(Ticker ticker) {
        this.ticker = ticker;
    }

    public Counter getCounter() {
        return counter;
    }

    public void setCounter(Counter counter) {
        this.counter = counter;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    /**
     * ticker 默认配置
     */
    public static class Ticker {
        /**
         * stop 等待处理器完成的最长时间，0 表示无限等待
         */
        private Duration stopTimeout = Duration.ZERO;

        public Duration getStopTimeout() {
            return stopTimeout;
        }

        public void setStopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
        }
    }

    /**
     * TTL 计数器配置
     */
    public static class Counter {
        /**
         * key 的存活时间
         */
        private Duration ttl = Duration.ofSeconds(1);

        /**
         * 后台清理间隔，0 表示不启动后台清理
         */
        private Duration vacuumInterval = Duration.ofSeconds(1);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getVacuumInterval() {
            return vacuumInterval;
        }

        public void setVacuumInterval(Duration vacuumInterval) {
            this.vacuumInterval = vacuumInterval;
        }
    }

    /**
     * 指标配置
     */
    public static class Metrics {
        /**
         * 指标报告间隔，未设置时不启动报告器
         */
        private Duration reportInterval;

        public Duration getReportInterval() {
            return reportInterval;
        }

        public void setReportInterval(Duration reportInterval) {
            this.reportInterval = reportInterval;
        }
    }
}
