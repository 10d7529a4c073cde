package com.accountbroker.capacity;

import com.accountbroker.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCounterStoreTest {

    @Test
    void sumSinceExcludesOlderBuckets() {
        InMemoryCounterStore store = new InMemoryCounterStore(MutableClock.startingAt("2026-03-01T00:00:00Z"));
        store.increment("k", 100, 3, Duration.ofMinutes(2));
        store.increment("k", 101, 4, Duration.ofMinutes(2));
        store.increment("k", 160, 5, Duration.ofMinutes(2));

        assertThat(store.sumSince("k", 100)).isEqualTo(12);
        assertThat(store.sumSince("k", 101)).isEqualTo(9);
        assertThat(store.sumSince("k", 161)).isZero();
        assertThat(store.sumSince("missing", 0)).isZero();
    }

    @Test
    void purgeRemovesExpiredKeys() {
        MutableClock clock = MutableClock.startingAt("2026-03-01T00:00:00Z");
        InMemoryCounterStore store = new InMemoryCounterStore(clock);
        store.increment("old", 1, 1, Duration.ofMinutes(2));
        clock.advance(Duration.ofMinutes(1));
        store.increment("fresh", 2, 1, Duration.ofMinutes(2));

        clock.advance(Duration.ofSeconds(90));

        assertThat(store.purgeExpired()).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.sumSince("fresh", 0)).isEqualTo(1);
    }
}
