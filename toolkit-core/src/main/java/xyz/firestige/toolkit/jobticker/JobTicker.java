package xyz.firestige.toolkit.jobticker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.toolkit.Named;
import xyz.firestige.toolkit.metrics.TickerMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 受管的周期任务执行器
 * <p>在独立守护线程中按固定间隔执行单个 {@link JobHandler}：
 * <ul>
 *   <li>{@link #start()} / {@link #stop()} 可重复、可并发调用，同一时刻最多一个调度循环</li>
 *   <li>停止信号通过容量为 1 的队列投递，并发 stop 只有一个生效，其余立即返回</li>
 *   <li>配置了 stopTimeout 时，stop 最多等待该时长，超时后放弃等待（不取消处理器）</li>
 *   <li>处理器的异常与崩溃被捕获并记录，不会终止调度循环</li>
 * </ul>
 */
public class JobTicker implements Named {
    private static final Logger LOG = LoggerFactory.getLogger(JobTicker.class);

    private final String name;
    private final JobHandler handler;
    private final Duration interval;
    private final Duration stopTimeout;
    private final TickerMetrics metrics;
    private final Logger log;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    // 仅在运行期间存在，受 lock 保护
    private BlockingQueue<Boolean> quit;
    private CountDownLatch done;

    private JobTicker(Builder builder) {
        this.name = builder.name;
        this.handler = builder.handler;
        this.interval = builder.interval;
        this.stopTimeout = builder.stopTimeout;
        this.metrics = builder.metrics;
        this.log = builder.logger != null ? builder.logger : LOG;
    }

    public static Builder builder(String name, JobHandler handler, Duration interval) {
        return new Builder(name, handler, interval);
    }

    /**
     * 创建并立即启动一个 ticker（使用默认选项）。
     */
    public static JobTicker start(String name, JobHandler handler, Duration interval) {
        JobTicker ticker = builder(name, handler, interval).build();
        ticker.start();
        return ticker;
    }

    /**
     * 启动调度循环。已在运行时仅记录 debug 日志。
     */
    public void start() {
        lock.lock();
        try {
            if (running.get()) {
                log.debug("{}: already been started", name);
                return;
            }
            BlockingQueue<Boolean> signal = new ArrayBlockingQueue<>(1);
            CountDownLatch finished = new CountDownLatch(1);
            quit = signal;
            done = finished;
            running.set(true);

            Thread thread = new Thread(() -> run(signal, finished), "job-ticker-" + name);
            thread.setDaemon(true);
            thread.start();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 停止调度循环并等待当前处理器执行完成。
     * <p>未运行时立即返回；已有其他调用投递了停止信号时也立即返回。
     * 配置了 stopTimeout 时最多等待该时长，超时记录 error 日志后返回。
     */
    public void stop() {
        CountDownLatch finished;
        lock.lock();
        try {
            if (quit == null || !running.get()) {
                log.debug("{}: is not running", name);
                return;
            }
            if (!quit.offer(Boolean.TRUE)) {
                log.debug("{}: close already been called", name);
                return;
            }
            finished = done;
        } finally {
            lock.unlock();
        }

        try {
            if (stopTimeout.isZero()) {
                finished.await();
                return;
            }
            if (!finished.await(stopTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
                log.error("{}: forced shutdown due to timeout", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{}: interrupted while waiting for shutdown", name);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public String getName() {
        return name;
    }

    public Duration getInterval() {
        return interval;
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }

    private void run(BlockingQueue<Boolean> signal, CountDownLatch finished) {
        long intervalNanos = interval.toNanos();
        long nextTick = System.nanoTime() + intervalNanos;
        try {
            while (true) {
                // 带超时的 poll 在线程已被中断时直接抛出 InterruptedException
                long waitNanos = Math.max(0L, nextTick - System.nanoTime());
                Boolean stopRequested = signal.poll(waitNanos, TimeUnit.NANOSECONDS);
                if (stopRequested != null) {
                    log.debug("{}: quit...", name);
                    return;
                }

                executeHandler();

                nextTick += intervalNanos;
                long now = System.nanoTime();
                if (nextTick - now < 0) {
                    // 处理器耗时超过间隔：立即补一次，之后重新对齐，不累积
                    nextTick = now;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{}: interrupted, quitting", name);
        } finally {
            lock.lock();
            try {
                if (quit == signal) {
                    quit = null;
                    done = null;
                }
                running.set(false);
            } finally {
                lock.unlock();
            }
            finished.countDown();
        }
    }

    private void executeHandler() {
        Instant startedAt = Instant.now();
        long start = System.nanoTime();
        boolean success = false;
        try {
            handler.handle();
            success = true;
        } catch (RuntimeException | Error e) {
            log.error("{}: handler panic: {}", name, describe(e), e);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                // 保留中断标记，调度循环在下一次等待时退出
                Thread.currentThread().interrupt();
            }
            log.error("{}: {}", name, describe(e), e);
        } finally {
            if (metrics != null) {
                observe(startedAt, Duration.ofNanos(System.nanoTime() - start), success);
            }
        }
    }

    private void observe(Instant startedAt, Duration elapsed, boolean success) {
        try {
            metrics.observe(name, startedAt, elapsed, success);
        } catch (RuntimeException e) {
            log.warn("{}: metrics observation failed", name, e);
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }

    /**
     * JobTicker 构建器
     */
    public static final class Builder {
        private final String name;
        private final JobHandler handler;
        private final Duration interval;
        private Duration stopTimeout = Duration.ZERO;
        private TickerMetrics metrics;
        private Logger logger;

        private Builder(String name, JobHandler handler, Duration interval) {
            this.name = Objects.requireNonNull(name, "name");
            this.handler = Objects.requireNonNull(handler, "handler");
            this.interval = Objects.requireNonNull(interval, "interval");
        }

        /**
         * stop 等待处理器完成的最长时间，{@link Duration#ZERO} 表示无限等待。
         */
        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
            return this;
        }

        public Builder metrics(TickerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * 诊断日志输出目标，默认使用 JobTicker 的类日志。
         */
        public Builder logger(Logger logger) {
            this.logger = logger;
            return this;
        }

        public JobTicker build() {
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("interval must be positive: " + interval);
            }
            if (stopTimeout.isNegative()) {
                throw new IllegalArgumentException("stopTimeout must not be negative: " + stopTimeout);
            }
            return new JobTicker(this);
        }
    }
}
