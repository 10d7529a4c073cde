package com.accountbroker.pool.strategy;

import com.accountbroker.pool.Account;
import com.accountbroker.pool.SelectionContext;
import com.accountbroker.pool.SelectionStrategy;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * 容量感知随机：在剩余容量比例高于下限的账号中均匀随机，全部低于下限时在所有可用账号中随机
 */
public class CapacityAwareStrategy implements SelectionStrategy {

    public static final String NAME = "capacity-aware";

    private final double capacityFloor;
    private final Random random;

    public CapacityAwareStrategy(double capacityFloor) {
        this(capacityFloor, new Random());
    }

    public CapacityAwareStrategy(double capacityFloor, Random random) {
        this.capacityFloor = capacityFloor;
        this.random = random;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Account> select(List<Account> eligible, SelectionContext context) {
        if (eligible.isEmpty()) {
            return Optional.empty();
        }
        List<Account> roomy = eligible.stream()
                .filter(a -> context.minRemainingFraction(a) > capacityFloor)
                .toList();
        List<Account> pool = roomy.isEmpty() ? eligible : roomy;
        return Optional.of(pool.get(random.nextInt(pool.size())));
    }
}
