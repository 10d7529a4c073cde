package com.accountbroker.pool;

import com.accountbroker.capacity.CapacityCheck;
import com.accountbroker.capacity.CapacityMetric;
import com.accountbroker.capacity.MetricUsage;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * 策略测试用的账号与容量快照
 */
public final class StrategyFixtures {

    private StrategyFixtures() {
    }

    public static Account account(String id, int priority) {
        return new Account(id, "t1", "acct-" + id, AccountTier.TIER_2, priority, "v1:x:y", null, null,
                AccountStatus.ACTIVE, Instant.parse("2026-03-01T00:00:00Z"));
    }

    /**
     * 请求数用量 used / limit，token 指标不限额
     */
    public static CapacityCheck requestUsage(long used, long limit) {
        Map<CapacityMetric, MetricUsage> usage = new EnumMap<>(CapacityMetric.class);
        usage.put(CapacityMetric.REQUESTS, new MetricUsage(used, limit));
        usage.put(CapacityMetric.TOKENS, new MetricUsage(0, 0));
        usage.put(CapacityMetric.INPUT_TOKENS, new MetricUsage(0, 0));
        return new CapacityCheck(true, usage, false);
    }
}
