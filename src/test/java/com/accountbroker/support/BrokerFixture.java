package com.accountbroker.support;

import com.accountbroker.alert.AlertDispatcher;
import com.accountbroker.capacity.CapacityTracker;
import com.accountbroker.capacity.InMemoryCounterStore;
import com.accountbroker.circuit.CircuitBreaker;
import com.accountbroker.config.AppProperties;
import com.accountbroker.crypto.CredentialCipher;
import com.accountbroker.dao.AccountDAO;
import com.accountbroker.dao.CircuitStateDAO;
import com.accountbroker.dao.QuotaAlertDAO;
import com.accountbroker.pool.Account;
import com.accountbroker.pool.AccountPool;
import com.accountbroker.pool.AccountSelector;
import com.accountbroker.pool.RegisterAccountRequest;
import com.accountbroker.pool.strategy.CapacityAwareStrategy;
import com.accountbroker.pool.strategy.LeastLoadedStrategy;
import com.accountbroker.pool.strategy.PriorityWeightedStrategy;
import com.accountbroker.pool.strategy.RoundRobinStrategy;

import java.util.List;
import java.util.Random;

/**
 * 按生产装配方式手工组装的完整账号池，组件之间不共享任何全局状态
 */
public final class BrokerFixture implements AutoCloseable {

    public static final String MASTER_KEY = "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=";

    public final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    public final AppProperties properties;
    public final TestDatabase database = new TestDatabase();
    public final AccountDAO accountDAO = new AccountDAO(database.jdbc());
    public final CircuitStateDAO circuitStateDAO = new CircuitStateDAO(database.jdbc());
    public final QuotaAlertDAO quotaAlertDAO = new QuotaAlertDAO(database.jdbc());
    public final InMemoryCounterStore counterStore = new InMemoryCounterStore(clock);
    public final CapacityTracker capacityTracker;
    public final CircuitBreaker circuitBreaker;
    public final AccountSelector selector;
    public final RecordingChannel channel = new RecordingChannel();
    public final AlertDispatcher alertDispatcher;
    public final CredentialCipher cipher = new CredentialCipher(MASTER_KEY);
    public final AccountPool pool;

    public BrokerFixture(String strategy) {
        this(defaultProperties(strategy));
    }

    public BrokerFixture(AppProperties properties) {
        this.properties = properties;
        this.capacityTracker = new CapacityTracker(counterStore, properties.getCapacity(), clock);
        this.circuitBreaker = new CircuitBreaker(circuitStateDAO, properties.getCircuit(), clock);
        this.selector = new AccountSelector(List.of(
                new RoundRobinStrategy(),
                new LeastLoadedStrategy(),
                new PriorityWeightedStrategy(new Random(7)),
                new CapacityAwareStrategy(properties.getSelection().getCapacityFloor(), new Random(7))));
        this.alertDispatcher = new AlertDispatcher(channel, properties.getAlert(), clock);
        this.pool = newPool();
        this.pool.init();
    }

    /**
     * 基于同一数据库的另一个账号池实例（模拟重启或多实例）
     */
    public AccountPool newPool() {
        return new AccountPool(properties, accountDAO, capacityTracker, circuitBreaker, selector,
                alertDispatcher, cipher, clock);
    }

    public Account register(String tenantId, String name, String tier, int priority) {
        return pool.registerAccount(RegisterAccountRequest.of(tenantId, name, tier, priority,
                "sk-ant-api03-" + name.replaceAll("[^A-Za-z0-9]", "") + "-secret"));
    }

    public static AppProperties defaultProperties(String strategy) {
        AppProperties properties = new AppProperties();
        properties.setPoolStrategy(strategy);
        return properties;
    }

    @Override
    public void close() {
        database.close();
    }
}
