package com.accountbroker.capacity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 进程内计数存储，单实例部署与测试使用
 */
public class InMemoryCounterStore implements CounterStore {

    private final Clock clock;
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void increment(String key, long bucket, long amount, Duration ttl) {
        Entry entry = entries.computeIfAbsent(key, k -> new Entry());
        entry.buckets.computeIfAbsent(bucket, b -> new AtomicLong()).addAndGet(amount);
        entry.expiresAt = clock.instant().plus(ttl);
    }

    @Override
    public long sumSince(String key, long fromBucket) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return 0;
        }
        entry.buckets.headMap(fromBucket).clear();
        long sum = 0;
        for (AtomicLong v : entry.buckets.values()) {
            sum += v.get();
        }
        return sum;
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    /**
     * 清理过期 key（由定时任务调用）
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().expiresAt != null && now.isAfter(e.getValue().expiresAt));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    private static class Entry {
        final ConcurrentSkipListMap<Long, AtomicLong> buckets = new ConcurrentSkipListMap<>();
        volatile Instant expiresAt;
    }
}
