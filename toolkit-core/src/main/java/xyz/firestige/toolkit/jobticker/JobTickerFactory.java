package xyz.firestige.toolkit.jobticker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.toolkit.metrics.TickerMetrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JobTicker 工厂
 * <p>以统一的默认选项（停止超时、指标接收器）创建 ticker，并按名称登记，
 * 便于统一查询状态与关闭。
 */
public class JobTickerFactory {
    private static final Logger log = LoggerFactory.getLogger(JobTickerFactory.class);

    private final Duration defaultStopTimeout;
    private final TickerMetrics metrics;
    private final Map<String, JobTicker> tickers = new ConcurrentHashMap<>();

    public JobTickerFactory() {
        this(Duration.ZERO, null);
    }

    public JobTickerFactory(Duration defaultStopTimeout, TickerMetrics metrics) {
        this.defaultStopTimeout = Objects.requireNonNull(defaultStopTimeout);
        this.metrics = metrics;
    }

    /**
     * 创建（未启动的）ticker 并登记。
     *
     * @throws IllegalStateException 名称已被占用
     */
    public JobTicker create(String name, JobHandler handler, Duration interval) {
        JobTicker ticker = JobTicker.builder(name, handler, interval)
                .stopTimeout(defaultStopTimeout)
                .metrics(metrics)
                .build();
        if (tickers.putIfAbsent(name, ticker) != null) {
            throw new IllegalStateException("ticker already registered: " + name);
        }
        log.info("注册 ticker: name={}, interval={}", name, interval);
        return ticker;
    }

    /**
     * 创建、登记并启动 ticker。
     */
    public JobTicker start(String name, JobHandler handler, Duration interval) {
        JobTicker ticker = create(name, handler, interval);
        ticker.start();
        return ticker;
    }

    public JobTicker get(String name) {
        return tickers.get(name);
    }

    public Collection<JobTicker> getTickers() {
        return Collections.unmodifiableCollection(new ArrayList<>(tickers.values()));
    }

    /**
     * 停止所有已登记的 ticker。
     */
    public void stopAll() {
        List<JobTicker> snapshot = new ArrayList<>(tickers.values());
        for (JobTicker ticker : snapshot) {
            ticker.stop();
        }
        log.info("已停止 {} 个 ticker", snapshot.size());
    }
}
