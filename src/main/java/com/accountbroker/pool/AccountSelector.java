package com.accountbroker.pool;

import com.accountbroker.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 选择策略注册表
 * <p>
 * 策略按名称注册；未知名称在加载配置时直接失败，不静默回退到默认策略。
 */
public class AccountSelector {

    private static final Logger log = LoggerFactory.getLogger(AccountSelector.class);

    private final Map<String, SelectionStrategy> strategies = new ConcurrentHashMap<>();

    public AccountSelector(List<SelectionStrategy> strategies) {
        strategies.forEach(this::register);
    }

    public void register(SelectionStrategy strategy) {
        SelectionStrategy previous = strategies.put(strategy.name(), strategy);
        if (previous != null) {
            log.warn("选择策略 {} 被覆盖: {} -> {}", strategy.name(),
                    previous.getClass().getSimpleName(), strategy.getClass().getSimpleName());
        }
    }

    /**
     * 按名称获取策略
     *
     * @throws ConfigurationException 未注册的策略名
     */
    public SelectionStrategy resolve(String name) {
        SelectionStrategy strategy = name != null ? strategies.get(name.trim().toLowerCase()) : null;
        if (strategy == null) {
            throw new ConfigurationException("未知的账号选择策略: " + name + ", 可选值 " + names());
        }
        return strategy;
    }

    public Optional<Account> select(String strategyName, List<Account> eligible, SelectionContext context) {
        if (eligible.isEmpty()) {
            return Optional.empty();
        }
        return resolve(strategyName).select(eligible, context);
    }

    public Set<String> names() {
        return Set.copyOf(strategies.keySet());
    }
}
