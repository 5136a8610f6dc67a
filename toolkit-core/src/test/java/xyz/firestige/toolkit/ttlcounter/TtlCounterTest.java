package xyz.firestige.toolkit.ttlcounter;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import xyz.firestige.toolkit.jobticker.JobTicker;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class TtlCounterTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private TtlCounter counter;

    @AfterEach
    void tearDown() {
        if (counter != null) counter.close();
    }

    // 不启动后台清理，由测试手动驱动 vacuum
    private TtlCounter manual(Duration ttl) {
        counter = new TtlCounter(ttl, null, clock);
        return counter;
    }

    @Test
    void inc_and_get() {
        manual(Duration.ofSeconds(2));

        counter.inc("test");
        assertEquals(1, counter.get("test"));

        counter.inc("test");
        counter.inc("test");
        assertEquals(3, counter.get("test"));

        assertEquals(0, counter.get("nonexistent"));
    }

    @Test
    void get_masks_expired_item_lazily() {
        manual(Duration.ofSeconds(1));
        counter.inc("test");

        clock.advance(Duration.ofMillis(900));
        assertEquals(1, counter.get("test"));

        clock.advance(Duration.ofMillis(100));
        assertEquals(0, counter.get("test"), "到达 TTL 边界即视为过期");
        assertEquals(List.of("test"), counter.keys(), "keys 不做过期过滤");
        assertEquals(1, counter.len());
    }

    @Test
    void touch_returns_value_and_resets_expiration() {
        manual(Duration.ofSeconds(3));
        counter.inc("test");
        assertEquals(Duration.ofSeconds(3), counter.expire("test"));

        clock.advance(Duration.ofSeconds(1));
        assertEquals(Duration.ofSeconds(2), counter.expire("test"));

        assertEquals(1, counter.touch("test"));
        assertEquals(Duration.ofSeconds(3), counter.expire("test"));
        assertEquals(1, counter.get("test"), "touch 不改变计数");
    }

    @Test
    void touch_does_not_revive_expired_item() {
        manual(Duration.ofSeconds(1));
        counter.inc("test");
        clock.advance(Duration.ofMillis(1500));

        assertEquals(0, counter.touch("test"));
        assertEquals(Duration.ofMillis(-500), counter.expire("test"));
        assertEquals(0, counter.touch("missing"));
    }

    @Test
    void inc_after_expiration_restarts_from_one() {
        manual(Duration.ofSeconds(1));
        counter.inc("test");
        counter.inc("test");
        clock.advance(Duration.ofSeconds(2));

        counter.inc("test");
        assertEquals(1, counter.get("test"));
    }

    @Test
    void del_removes_key() {
        manual(Duration.ofSeconds(10));
        counter.inc("test");

        counter.del("test");
        assertEquals(0, counter.get("test"));
        assertEquals(0, counter.len());

        counter.del("nonexistent");
    }

    @Test
    void reset_zeroes_value_and_refreshes_access() {
        manual(Duration.ofSeconds(2));
        counter.inc("test");
        counter.inc("test");
        clock.advance(Duration.ofSeconds(1));

        counter.reset("test");
        assertEquals(0, counter.get("test"));
        assertEquals(Duration.ofSeconds(2), counter.expire("test"));
        assertEquals(List.of("test"), counter.keys());

        counter.reset("missing");
        assertEquals(1, counter.len());
    }

    @Test
    void expire_of_absent_key_is_zero() {
        manual(Duration.ofSeconds(2));
        assertEquals(Duration.ZERO, counter.expire("missing"));
    }

    @Test
    void keys_and_len() {
        manual(Duration.ofSeconds(10));
        List<String> keys = List.of("a", "b", "c");
        keys.forEach(counter::inc);

        assertEquals(3, counter.len());
        assertThat(counter.keys()).containsExactlyInAnyOrderElementsOf(keys);
    }

    @Test
    void non_positive_ttl_uses_default() {
        manual(Duration.ZERO);
        assertEquals(TtlCounter.DEFAULT_TTL, counter.getTtl());
        counter.inc("test");
        assertEquals(1, counter.get("test"));

        counter.setTtl(Duration.ofSeconds(10));
        assertEquals(Duration.ofSeconds(10), counter.getTtl());
        counter.setTtl(Duration.ofSeconds(-1));
        assertEquals(TtlCounter.DEFAULT_TTL, counter.getTtl());
        counter.setTtl(null);
        assertEquals(TtlCounter.DEFAULT_TTL, counter.getTtl());
    }

    @Test
    void sub_millisecond_ttl_rounds_up_to_one_millisecond() {
        manual(Duration.ofNanos(500_000));
        assertEquals(Duration.ofMillis(1), counter.getTtl());

        counter.inc("test");
        assertEquals(1, counter.get("test"), "未经过任何时间不应过期");

        counter.setTtl(Duration.ofNanos(999_999));
        assertEquals(Duration.ofMillis(1), counter.getTtl());
        assertEquals(1, counter.get("test"));

        clock.advance(Duration.ofMillis(1));
        assertEquals(0, counter.get("test"));
    }

    @Test
    void sub_millisecond_vacuum_interval_still_sweeps() {
        counter = new TtlCounter(Duration.ofMillis(50), Duration.ofNanos(500_000));
        counter.inc("a");

        await().atMost(Duration.ofSeconds(2)).until(() -> counter.len() == 0);
    }

    @Test
    void negative_vacuum_interval_is_rejected() {
        assertThatThrownBy(() -> new TtlCounter(Duration.ofSeconds(1), Duration.ofSeconds(-1), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void set_ttl_reanchors_to_last_access() {
        manual(Duration.ofSeconds(10));
        counter.inc("early");
        clock.advance(Duration.ofSeconds(2));
        counter.inc("late");

        counter.setTtl(Duration.ofSeconds(5));
        assertEquals(Duration.ofSeconds(3), counter.expire("early"));
        assertEquals(Duration.ofSeconds(5), counter.expire("late"));

        counter.setTtl(Duration.ofSeconds(1));
        assertEquals(0, counter.get("early"), "访问已超过 2 秒，缩短到 1 秒后立即过期");
        assertEquals(1, counter.get("late"));

        counter.vacuum();
        assertEquals(List.of("late"), counter.keys());

        clock.advance(Duration.ofSeconds(1));
        counter.vacuum();
        assertEquals(0, counter.len());
    }

    @Test
    void set_ttl_longer_keeps_stale_item_alive() {
        manual(Duration.ofSeconds(1));
        counter.inc("test");
        clock.advance(Duration.ofMillis(1500));
        assertEquals(0, counter.get("test"));

        counter.setTtl(Duration.ofSeconds(10));
        assertEquals(1, counter.get("test"));
        counter.vacuum();
        assertEquals(1, counter.len());
    }

    @Test
    void vacuum_removes_only_expired_items() {
        manual(Duration.ofSeconds(1));
        counter.inc("a");
        clock.advance(Duration.ofMillis(500));
        counter.inc("b");
        clock.advance(Duration.ofMillis(500));

        counter.vacuum(clock.instant());
        assertEquals(List.of("b"), counter.keys());

        counter.vacuum(clock.instant().plusMillis(499));
        assertEquals(List.of("b"), counter.keys());

        counter.vacuum(clock.instant().plusMillis(500));
        assertEquals(0, counter.len());
    }

    @Test
    void vacuum_keeps_touched_item() {
        manual(Duration.ofSeconds(1));
        counter.inc("a");
        clock.advance(Duration.ofMillis(900));
        counter.touch("a");
        clock.advance(Duration.ofMillis(200));

        counter.vacuum();
        assertEquals(1, counter.get("a"));
    }

    @Test
    void vacuum_keeps_reset_item() {
        manual(Duration.ofSeconds(1));
        counter.inc("a");
        clock.advance(Duration.ofMillis(800));
        counter.reset("a");
        clock.advance(Duration.ofMillis(400));

        counter.vacuum();
        assertEquals(List.of("a"), counter.keys());

        clock.advance(Duration.ofMillis(600));
        counter.vacuum();
        assertEquals(0, counter.len());
    }

    @Test
    void vacuum_ignores_entry_of_deleted_then_recreated_key() {
        manual(Duration.ofSeconds(1));
        counter.inc("a");
        counter.del("a");
        clock.advance(Duration.ofMillis(500));
        counter.inc("a");
        clock.advance(Duration.ofMillis(600));

        counter.vacuum();
        assertEquals(1, counter.get("a"));

        clock.advance(Duration.ofMillis(400));
        counter.vacuum();
        assertEquals(0, counter.len());
    }

    @Test
    void concurrent_increments_are_not_lost() throws Exception {
        counter = new TtlCounter(Duration.ofSeconds(10));
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch gate = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            futures.add(pool.submit(() -> {
                gate.await();
                counter.inc("concurrent");
                counter.get("concurrent");
                counter.touch("concurrent");
                return null;
            }));
        }
        gate.countDown();
        for (Future<?> f : futures) {
            f.get(5, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(100, counter.get("concurrent"));
    }

    @Test
    void background_vacuum_evicts_expired_items() {
        counter = new TtlCounter(Duration.ofMillis(100), Duration.ofMillis(20));
        counter.inc("a");
        counter.inc("b");
        assertEquals(2, counter.len());

        await().atMost(Duration.ofSeconds(2)).until(() -> counter.len() == 0);
    }

    @Test
    void close_is_idempotent_and_stops_vacuum() throws Exception {
        counter = new TtlCounter(Duration.ofSeconds(1), Duration.ofMillis(10), clock);
        counter.inc("test");

        counter.close();
        counter.close();
        assertTrue(counter.isClosed());

        clock.advance(Duration.ofSeconds(2));
        TimeUnit.MILLISECONDS.sleep(100);

        assertEquals(0, counter.get("test"), "关闭后仍做惰性过期判断");
        assertEquals(1, counter.len(), "关闭后不再物理清理");
    }

    @Test
    void vacuum_handler_runs_on_job_ticker() {
        counter = new TtlCounter(Duration.ofMillis(50), null);
        JobTicker vacuum = JobTicker.builder("counter-vacuum", counter.vacuumHandler(), Duration.ofMillis(10)).build();
        try {
            vacuum.start();
            counter.inc("a");
            await().atMost(Duration.ofSeconds(2)).until(() -> counter.len() == 0);
        } finally {
            vacuum.stop();
        }
        assertFalse(vacuum.isRunning());
    }
}
