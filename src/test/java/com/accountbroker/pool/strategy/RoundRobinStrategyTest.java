package com.accountbroker.pool.strategy;

import com.accountbroker.pool.Account;
import com.accountbroker.pool.SelectionContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.accountbroker.pool.StrategyFixtures.account;
import static org.assertj.core.api.Assertions.assertThat;

class RoundRobinStrategyTest {

    @Test
    void rotatesInRegistrationOrder() {
        RoundRobinStrategy strategy = new RoundRobinStrategy();
        List<Account> eligible = List.of(account("a", 1), account("b", 1), account("c", 1));

        List<String> picks = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            picks.add(strategy.select(eligible, SelectionContext.empty("t1")).orElseThrow().id());
        }

        assertThat(picks).containsExactly("a", "b", "c", "a", "b", "c");
    }
}
