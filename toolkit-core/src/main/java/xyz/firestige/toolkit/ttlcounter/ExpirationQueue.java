package xyz.firestige.toolkit.ttlcounter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 过期时间索引：按 expireAt 升序的二叉最小堆。
 * <p>额外维护 key 到堆下标的映射，任意 key 的定位为 O(1)，调整为 O(log n)。
 * 每个 key 最多对应一个条目。非线程安全，由持有者加锁保护。
 */
public class ExpirationQueue {

    private final List<Entry> heap = new ArrayList<>();
    private final Map<String, Integer> positions = new HashMap<>();

    /**
     * 插入新条目
     *
     * @throws IllegalArgumentException key 已存在
     */
    public void push(String key, long expireAt) {
        Objects.requireNonNull(key, "key");
        if (positions.containsKey(key)) {
            throw new IllegalArgumentException("key already indexed: " + key);
        }
        heap.add(new Entry(key, expireAt));
        int i = heap.size() - 1;
        positions.put(key, i);
        siftUp(i);
    }

    /**
     * 存在则调整过期时间，否则插入。
     */
    public void schedule(String key, long expireAt) {
        if (!fix(key, expireAt)) {
            push(key, expireAt);
        }
    }

    /**
     * 查看最早过期的条目，不移除；为空时返回 null
     */
    public Entry peek() {
        return heap.isEmpty() ? null : heap.get(0);
    }

    /**
     * 移除并返回最早过期的条目；为空时返回 null
     */
    public Entry poll() {
        if (heap.isEmpty()) {
            return null;
        }
        Entry min = heap.get(0);
        Entry last = heap.remove(heap.size() - 1);
        positions.remove(min.key);
        if (!heap.isEmpty()) {
            heap.set(0, last);
            positions.put(last.key, 0);
            siftDown(0);
        }
        return min;
    }

    /**
     * 更新 key 的过期时间并恢复堆序。
     *
     * @return key 不在索引中时返回 false
     */
    public boolean fix(String key, long expireAt) {
        Integer i = positions.get(key);
        if (i == null) {
            return false;
        }
        long old = heap.get(i).expireAt;
        heap.set(i, new Entry(key, expireAt));
        if (expireAt < old) {
            siftUp(i);
        } else if (expireAt > old) {
            siftDown(i);
        }
        return true;
    }

    /**
     * TTL 变更后重建：每个条目 expireAt = (expireAt - oldTtl) + newTtl，
     * 即保持各自的最后访问时间不变，然后整体重新建堆。
     */
    public void rebase(long oldTtlMillis, long newTtlMillis) {
        long delta = newTtlMillis - oldTtlMillis;
        if (delta == 0) {
            return;
        }
        for (int i = 0; i < heap.size(); i++) {
            Entry e = heap.get(i);
            heap.set(i, new Entry(e.key, e.expireAt + delta));
        }
        for (int i = heap.size() / 2 - 1; i >= 0; i--) {
            siftDown(i);
        }
    }

    public boolean contains(String key) {
        return positions.containsKey(key);
    }

    public int size() {
        return heap.size();
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    private void siftUp(int i) {
        while (i > 0) {
            int parent = (i - 1) >>> 1;
            if (heap.get(parent).expireAt <= heap.get(i).expireAt) {
                break;
            }
            swap(i, parent);
            i = parent;
        }
    }

    private void siftDown(int i) {
        int n = heap.size();
        while (true) {
            int left = 2 * i + 1;
            if (left >= n) {
                break;
            }
            int right = left + 1;
            int smallest = right < n && heap.get(right).expireAt < heap.get(left).expireAt ? right : left;
            if (heap.get(i).expireAt <= heap.get(smallest).expireAt) {
                break;
            }
            swap(i, smallest);
            i = smallest;
        }
    }

    private void swap(int i, int j) {
        Entry a = heap.get(i);
        Entry b = heap.get(j);
        heap.set(i, b);
        heap.set(j, a);
        positions.put(b.key, i);
        positions.put(a.key, j);
    }

    /**
     * 索引条目（不可变）
     */
    public static final class Entry {
        private final String key;
        private final long expireAt;

        Entry(String key, long expireAt) {
            this.key = key;
            this.expireAt = expireAt;
        }

        public String getKey() { return key; }

        /**
         * 过期时间（epoch 毫秒）
         */
        public long getExpireAt() { return expireAt; }

        @Override
        public String toString() {
            return "Entry{key=" + key + ", expireAt=" + expireAt + '}';
        }
    }
}
