package com.accountbroker.pool.strategy;

import com.accountbroker.pool.Account;
import com.accountbroker.pool.SelectionContext;
import com.accountbroker.pool.SelectionStrategy;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * 优先级加权：取 priority 最高的一组，组内按 priority 加权随机
 */
public class PriorityWeightedStrategy implements SelectionStrategy {

    public static final String NAME = "priority-weighted";

    private final Random random;

    public PriorityWeightedStrategy() {
        this(new Random());
    }

    public PriorityWeightedStrategy(Random random) {
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
        int top = eligible.stream().mapToInt(Account::priority).max().getAsInt();
        List<Account> candidates = eligible.stream().filter(a -> a.priority() == top).toList();
        if (candidates.size() == 1) {
            return Optional.of(candidates.get(0));
        }
        return Optional.of(weightedPick(candidates));
    }

    private Account weightedPick(List<Account> candidates) {
        // priority <= 0 时按权重 1 处理，避免总权重为 0
        long total = 0;
        for (Account a : candidates) {
            total += weight(a);
        }
        long roll = (long) (random.nextDouble() * total);
        for (Account a : candidates) {
            roll -= weight(a);
            if (roll < 0) {
                return a;
            }
        }
        return candidates.get(candidates.size() - 1);
    }

    private static long weight(Account account) {
        return Math.max(1, account.priority());
    }
}
