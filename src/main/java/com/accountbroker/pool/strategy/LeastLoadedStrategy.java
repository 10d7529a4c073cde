package com.accountbroker.pool.strategy;

import com.accountbroker.capacity.CapacityMetric;
import com.accountbroker.pool.Account;
import com.accountbroker.pool.SelectionContext;
import com.accountbroker.pool.SelectionStrategy;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 最小负载：主指标（每分钟请求数）剩余比例最大者优先，相同时取当前绝对用量最小者
 */
public class LeastLoadedStrategy implements SelectionStrategy {

    public static final String NAME = "least-loaded";

    private static final CapacityMetric PRIMARY = CapacityMetric.REQUESTS;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Account> select(List<Account> eligible, SelectionContext context) {
        Comparator<Account> byRemaining = Comparator.comparingDouble(
                a -> context.usageOf(a, PRIMARY).remainingFraction());
        Comparator<Account> byUsedDesc = Comparator.comparingLong(
                (Account a) -> context.usageOf(a, PRIMARY).used()).reversed();
        return eligible.stream().max(byRemaining.thenComparing(byUsedDesc));
    }
}
