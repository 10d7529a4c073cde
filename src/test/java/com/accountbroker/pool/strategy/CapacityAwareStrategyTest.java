package com.accountbroker.pool.strategy;

import com.accountbroker.capacity.CapacityCheck;
import com.accountbroker.pool.Account;
import com.accountbroker.pool.SelectionContext;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static com.accountbroker.pool.StrategyFixtures.account;
import static com.accountbroker.pool.StrategyFixtures.requestUsage;
import static org.assertj.core.api.Assertions.assertThat;

class CapacityAwareStrategyTest {

    @Test
    void skipsAccountsBelowFloor() {
        CapacityAwareStrategy strategy = new CapacityAwareStrategy(0.1, new Random(5));
        List<Account> eligible = List.of(account("nearly-full", 1), account("roomy-1", 1), account("roomy-2", 1));
        Map<String, CapacityCheck> capacity = new HashMap<>();
        capacity.put("nearly-full", requestUsage(95, 100));
        capacity.put("roomy-1", requestUsage(10, 100));
        capacity.put("roomy-2", requestUsage(50, 100));

        Set<String> picked = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            picked.add(strategy.select(eligible, new SelectionContext("t1", capacity)).orElseThrow().id());
        }

        assertThat(picked).containsExactlyInAnyOrder("roomy-1", "roomy-2");
    }

    @Test
    void fallsBackToAllEligibleWhenNoneClearFloor() {
        CapacityAwareStrategy strategy = new CapacityAwareStrategy(0.1, new Random(5));
        Map<String, CapacityCheck> capacity = new HashMap<>();
        capacity.put("a", requestUsage(95, 100));
        capacity.put("b", requestUsage(99, 100));

        assertThat(strategy.select(List.of(account("a", 1), account("b", 1)), new SelectionContext("t1", capacity)))
                .isPresent();
    }
}
