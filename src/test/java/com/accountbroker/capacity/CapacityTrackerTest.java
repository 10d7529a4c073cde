package com.accountbroker.capacity;

import com.accountbroker.config.AppProperties;
import com.accountbroker.exception.ConfigurationException;
import com.accountbroker.exception.StoreUnavailableException;
import com.accountbroker.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CapacityTrackerTest {

    private static final CapacityLimits LIMITS = new CapacityLimits(10, 50_000, 20_000);

    private MutableClock clock;
    private AppProperties.CapacityConfig config;
    private CapacityTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        config = new AppProperties.CapacityConfig();
        tracker = new CapacityTracker(new InMemoryCounterStore(clock), config, clock);
    }

    @Test
    @DisplayName("窗口内用量达到上限后不可用")
    void exhaustsAtLimit() {
        for (int i = 0; i < 9; i++) {
            tracker.recordUsage("a", 1, 100, 50, false);
        }
        assertThat(tracker.hasCapacity("a", LIMITS, UsageUnits.ofRequest(0)).available()).isTrue();

        tracker.recordUsage("a", 1, 100, 50, false);
        CapacityCheck check = tracker.hasCapacity("a", LIMITS, UsageUnits.ofRequest(0));
        assertThat(check.available()).isFalse();
        assertThat(check.usageOf(CapacityMetric.REQUESTS).used()).isEqualTo(10);
        assertThat(check.remaining(CapacityMetric.REQUESTS)).isZero();
    }

    @Test
    void requestedUnitsThatWouldOverflowAreRejected() {
        tracker.recordUsage("a", 1, 45_000, 10_000, false);

        assertThat(tracker.hasCapacity("a", LIMITS, UsageUnits.ofRequest(4_000)).available()).isTrue();
        assertThat(tracker.hasCapacity("a", LIMITS, UsageUnits.ofRequest(6_000)).available()).isFalse();
    }

    @Test
    @DisplayName("超过窗口宽度的桶不再计入")
    void usageExpiresAfterWindow() {
        tracker.recordUsage("a", 10, 0, 0, false);
        assertThat(tracker.hasCapacity("a", LIMITS, UsageUnits.ofRequest(0)).available()).isFalse();

        clock.advance(Duration.ofSeconds(30));
        assertThat(tracker.hasCapacity("a", LIMITS, UsageUnits.ofRequest(0)).available()).isFalse();

        clock.advance(Duration.ofSeconds(31));
        CapacityCheck check = tracker.hasCapacity("a", LIMITS, UsageUnits.ofRequest(0));
        assertThat(check.available()).isTrue();
        assertThat(check.usageOf(CapacityMetric.REQUESTS).used()).isZero();
    }

    @Test
    void slidingWindowKeepsRecentBuckets() {
        tracker.recordUsage("a", 4, 0, 0, false);
        clock.advance(Duration.ofSeconds(40));
        tracker.recordUsage("a", 5, 0, 0, false);
        clock.advance(Duration.ofSeconds(25));

        // 第一批已滑出窗口，第二批仍在
        assertThat(tracker.snapshot("a", LIMITS).usageOf(CapacityMetric.REQUESTS).used()).isEqualTo(5);
    }

    @Test
    @DisplayName("cache-read token 按折扣计入: 10000 x 0.1 = 1000")
    void cacheReadTokensAreDiscounted() {
        tracker.recordUsage("a", 1, 10_000, 10_000, true);

        CapacityCheck check = tracker.snapshot("a", LIMITS);
        assertThat(check.usageOf(CapacityMetric.TOKENS).used()).isEqualTo(1_000);
        assertThat(check.usageOf(CapacityMetric.INPUT_TOKENS).used()).isEqualTo(1_000);
        assertThat(check.usageOf(CapacityMetric.REQUESTS).used()).isEqualTo(1);
    }

    @Test
    void accountsAreTrackedIndependently() {
        tracker.recordUsage("a", 10, 0, 0, false);

        assertThat(tracker.hasCapacity("a", LIMITS, UsageUnits.ofRequest(0)).available()).isFalse();
        assertThat(tracker.hasCapacity("b", LIMITS, UsageUnits.ofRequest(0)).available()).isTrue();
    }

    @Test
    void unlimitedMetricsAreIgnored() {
        CapacityLimits requestsOnly = new CapacityLimits(5, 0, 0);
        tracker.recordUsage("a", 1, 1_000_000, 1_000_000, false);

        CapacityCheck check = tracker.hasCapacity("a", requestsOnly, UsageUnits.ofRequest(1_000_000));
        assertThat(check.available()).isTrue();
        assertThat(check.usageOf(CapacityMetric.TOKENS).unlimited()).isTrue();
    }

    @Test
    void clearDropsWindows() {
        tracker.recordUsage("a", 10, 0, 0, false);
        tracker.clear("a");

        assertThat(tracker.hasCapacity("a", LIMITS, UsageUnits.ofRequest(0)).available()).isTrue();
    }

    @Test
    @DisplayName("计数存储不可用时默认 fail-open")
    void storeFailureFailsOpenByDefault() {
        CounterStore broken = brokenStore();
        CapacityTracker failOpen = new CapacityTracker(broken, config, clock);

        CapacityCheck check = failOpen.hasCapacity("a", LIMITS, UsageUnits.ofRequest(100));
        assertThat(check.available()).isTrue();
        assertThat(check.degraded()).isTrue();

        // 记录用量不向调用方抛异常
        failOpen.recordUsage("a", 1, 100, 100, false);
    }

    @Test
    void storeFailureFailsClosedWhenConfigured() {
        config.setFailOpen(false);
        CapacityTracker failClosed = new CapacityTracker(brokenStore(), config, clock);

        CapacityCheck check = failClosed.hasCapacity("a", LIMITS, UsageUnits.ofRequest(100));
        assertThat(check.available()).isFalse();
        assertThat(check.degraded()).isTrue();
    }

    @Test
    void rejectsDiscountOutsideUnitInterval() {
        config.setCacheReadDiscount(1.0);

        assertThatThrownBy(() -> new CapacityTracker(new InMemoryCounterStore(clock), config, clock))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("cache-read-discount");
    }

    private static CounterStore brokenStore() {
        CounterStore store = mock(CounterStore.class);
        StoreUnavailableException down = new StoreUnavailableException("redis timeout", new RuntimeException());
        when(store.sumSince(anyString(), anyLong())).thenThrow(down);
        doThrow(down).when(store).increment(anyString(), anyLong(), anyLong(), any());
        return store;
    }
}
