package xyz.firestige.toolkit.ttlcounter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.toolkit.jobticker.JobHandler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 带 TTL 的计数器
 * <p>key 在最后一次访问（inc/touch/reset）后超过 TTL 即视为过期：
 * <ul>
 *   <li>读取（get/touch）时惰性判断过期，过期的 key 读作 0</li>
 *   <li>后台清理按 {@link ExpirationQueue} 中的过期顺序物理删除，无需遍历全部 key</li>
 *   <li>keys/len 反映物理存在的 key，不做过期过滤</li>
 * </ul>
 * 所有操作由同一把锁串行化，线程安全。适用于限流、近期活动统计等场景。
 */
public class TtlCounter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TtlCounter.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_VACUUM_INTERVAL = Duration.ofSeconds(1);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Item> items = new HashMap<>();
    private final ExpirationQueue expirations = new ExpirationQueue();
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ScheduledExecutorService vacuumExecutor;
    private long ttlMillis;

    public TtlCounter(Duration ttl) {
        this(ttl, DEFAULT_VACUUM_INTERVAL);
    }

    public TtlCounter(Duration ttl, Duration vacuumInterval) {
        this(ttl, vacuumInterval, Clock.systemUTC());
    }

    /**
     * @param ttl            过期时间，null 或非正数时使用 {@link #DEFAULT_TTL}
     * @param vacuumInterval 后台清理间隔，null 或 0 表示不启动后台清理（由调用方驱动 {@link #vacuum()}）
     * @param clock          时间源
     */
    public TtlCounter(Duration ttl, Duration vacuumInterval, Clock clock) {
        if (vacuumInterval != null && vacuumInterval.isNegative()) {
            throw new IllegalArgumentException("vacuumInterval must not be negative: " + vacuumInterval);
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttlMillis = toMillis(normalize(ttl));

        if (vacuumInterval == null || vacuumInterval.isZero()) {
            this.vacuumExecutor = null;
        } else {
            this.vacuumExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "ttl-counter-vacuum");
                t.setDaemon(true);
                return t;
            });
            long period = toMillis(vacuumInterval);
            vacuumExecutor.scheduleAtFixedRate(this::vacuumQuietly, period, period, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * 计数加一，不存在（或已过期）时从 1 开始；刷新最后访问时间。
     */
    public void inc(String key) {
        lock.lock();
        try {
            long now = clock.millis();
            Item item = items.get(key);
            if (item == null) {
                item = new Item();
                items.put(key, item);
            } else if (isExpired(item, now)) {
                item.value = 0;
            }
            item.value++;
            item.access = now;
            expirations.schedule(key, now + ttlMillis);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 获取当前值，不存在或已过期返回 0。不刷新访问时间。
     */
    public int get(String key) {
        lock.lock();
        try {
            Item item = items.get(key);
            if (item == null || isExpired(item, clock.millis())) {
                return 0;
            }
            return item.value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 获取当前值并刷新访问时间；不存在或已过期返回 0 且不刷新。
     */
    public int touch(String key) {
        lock.lock();
        try {
            long now = clock.millis();
            Item item = items.get(key);
            if (item == null || isExpired(item, now)) {
                return 0;
            }
            item.access = now;
            expirations.schedule(key, now + ttlMillis);
            return item.value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 删除 key，不存在时无操作。索引中的条目留给清理过程丢弃。
     */
    public void del(String key) {
        lock.lock();
        try {
            items.remove(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 将计数置 0 并刷新访问时间，key 不存在时无操作。
     */
    public void reset(String key) {
        lock.lock();
        try {
            Item item = items.get(key);
            if (item != null) {
                long now = clock.millis();
                item.value = 0;
                item.access = now;
                expirations.schedule(key, now + ttlMillis);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 距离过期的剩余时间，已过期时为 0 或负数；key 不存在返回 {@link Duration#ZERO}。
     */
    public Duration expire(String key) {
        lock.lock();
        try {
            Item item = items.get(key);
            if (item == null) {
                return Duration.ZERO;
            }
            return Duration.ofMillis(item.access + ttlMillis - clock.millis());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 当前物理存在的全部 key（含已过期未清理的），顺序不保证。
     */
    public List<String> keys() {
        lock.lock();
        try {
            return new ArrayList<>(items.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int len() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public Duration getTtl() {
        lock.lock();
        try {
            return Duration.ofMillis(ttlMillis);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 修改 TTL，null 或非正数时使用默认值。
     * 已有 key 以各自的最后访问时间为基准按新 TTL 重新计算过期时间。
     */
    public void setTtl(Duration ttl) {
        lock.lock();
        try {
            long oldTtl = ttlMillis;
            ttlMillis = toMillis(normalize(ttl));
            if (oldTtl != ttlMillis) {
                expirations.rebase(oldTtl, ttlMillis);
                log.debug("TTL 变更: {}ms -> {}ms, 重建索引 {} 条", oldTtl, ttlMillis, expirations.size());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按给定时间清理过期 key：依次弹出 expireAt <= now 的索引条目并删除对应 key。
     * inc/touch/reset 每次访问都会调整条目，被访问过的 key 不会被提前弹出。
     */
    public void vacuum(Instant now) {
        long nowMillis = now.toEpochMilli();
        int evicted = 0;
        lock.lock();
        try {
            while (true) {
                ExpirationQueue.Entry next = expirations.peek();
                if (next == null || next.getExpireAt() > nowMillis) {
                    break;
                }
                expirations.poll();

                // 条目始终等于 access + ttl，弹出即代表该 key 已过期；已删除的 key 直接丢弃条目
                if (items.remove(next.getKey()) != null) {
                    evicted++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (evicted > 0) {
            log.debug("清理过期 key: {} 个", evicted);
        }
    }

    public void vacuum() {
        vacuum(clock.instant());
    }

    /**
     * 以 {@link JobHandler} 形式暴露清理操作，便于交给外部调度器驱动。
     */
    public JobHandler vacuumHandler() {
        return this::vacuum;
    }

    /**
     * 停止后台清理，可重复调用。关闭后数据仍保留，读取时照常做惰性过期判断。
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            if (vacuumExecutor != null) {
                vacuumExecutor.shutdownNow();
                try {
                    if (!vacuumExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                        log.warn("后台清理线程未在 5 秒内结束");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            log.debug("TtlCounter 已关闭");
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void vacuumQuietly() {
        try {
            vacuum();
        } catch (RuntimeException e) {
            // 异常会终止 scheduleAtFixedRate 的后续执行
            log.error("后台清理失败", e);
        }
    }

    private boolean isExpired(Item item, long now) {
        return item.access + ttlMillis <= now;
    }

    /**
     * 换算为毫秒，正数不足 1ms 时向上取整为 1ms
     */
    private static long toMillis(Duration d) {
        return Math.max(1L, d.toMillis());
    }

    private static Duration normalize(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return DEFAULT_TTL;
        }
        return ttl;
    }

    private static final class Item {
        private int value;
        private long access;
    }
}
