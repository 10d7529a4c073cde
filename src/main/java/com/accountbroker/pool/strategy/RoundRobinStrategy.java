package com.accountbroker.pool.strategy;

import com.accountbroker.pool.Account;
import com.accountbroker.pool.SelectionContext;
import com.accountbroker.pool.SelectionStrategy;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 轮询：游标按注册顺序在可用列表上循环前进
 */
public class RoundRobinStrategy implements SelectionStrategy {

    public static final String NAME = "round-robin";

    private final AtomicInteger cursor = new AtomicInteger(0);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Account> select(List<Account> eligible, SelectionContext context) {
        if (eligible.isEmpty()) {
            return Optional.empty();
        }
        int idx = Math.floorMod(cursor.getAndIncrement(), eligible.size());
        return Optional.of(eligible.get(idx));
    }
}
