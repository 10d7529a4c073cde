package com.accountbroker.pool;

import com.accountbroker.alert.AlertDispatcher;
import com.accountbroker.alert.AlertType;
import com.accountbroker.capacity.CapacityCheck;
import com.accountbroker.capacity.CapacityLimits;
import com.accountbroker.capacity.CapacityTracker;
import com.accountbroker.capacity.UsageUnits;
import com.accountbroker.circuit.CircuitBreaker;
import com.accountbroker.circuit.CircuitSnapshot;
import com.accountbroker.circuit.CircuitState;
import com.accountbroker.circuit.CircuitTransition;
import com.accountbroker.config.AppProperties;
import com.accountbroker.crypto.CredentialCipher;
import com.accountbroker.dao.AccountDAO;
import com.accountbroker.exception.AccountNotFoundException;
import com.accountbroker.exception.BrokerException;
import com.accountbroker.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.DependsOn;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * 多账号池管理
 * <p>
 * 按状态、熔断、容量过滤租户账号后交给选择策略；调用方执行上游请求后上报结果，
 * 回写容量追踪与熔断器。选择基于尽力而为的快照，不做跨账号事务：
 * 并发调用方可能同时选中同一账号，容量上限是软上限。
 */
@Component
@DependsOn("databaseConfig")
public class AccountPool {

    private static final Logger log = LoggerFactory.getLogger(AccountPool.class);

    private static final Pattern CREDENTIAL_FORMAT = Pattern.compile("^sk-ant-[A-Za-z0-9_\\-]{4,}$");

    private final AppProperties properties;
    private final AccountDAO accountDAO;
    private final CapacityTracker capacityTracker;
    private final CircuitBreaker circuitBreaker;
    private final AccountSelector selector;
    private final AlertDispatcher alertDispatcher;
    private final CredentialCipher credentialCipher;
    private final Clock clock;

    private final Map<String, Account> accounts = new ConcurrentHashMap<>();
    // 注册顺序，round-robin 依赖
    private final List<String> registrationOrder = new CopyOnWriteArrayList<>();

    private volatile String strategyName;

    public AccountPool(AppProperties properties, AccountDAO accountDAO, CapacityTracker capacityTracker,
                       CircuitBreaker circuitBreaker, AccountSelector selector, AlertDispatcher alertDispatcher,
                       CredentialCipher credentialCipher, Clock clock) {
        this.properties = properties;
        this.accountDAO = accountDAO;
        this.capacityTracker = capacityTracker;
        this.circuitBreaker = circuitBreaker;
        this.selector = selector;
        this.alertDispatcher = alertDispatcher;
        this.credentialCipher = credentialCipher;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        // 策略名在启动时校验，未知名称直接失败
        setStrategy(properties.getPoolStrategy());

        accounts.clear();
        registrationOrder.clear();
        for (AccountDAO.AccountRow row : accountDAO.findAll()) {
            Account account = fromRow(row);
            accounts.put(account.id(), account);
            registrationOrder.add(account.id());
        }
        log.info("账号池初始化完成: {} 个账号, 策略={}", accounts.size(), strategyName);
    }

    /**
     * 设置选择策略
     *
     * @throws ConfigurationException 未注册的策略名
     */
    public void setStrategy(String name) {
        SelectionStrategy strategy = selector.resolve(name);
        this.strategyName = strategy.name();
        log.info("账号池策略切换为: {}", strategyName);
    }

    public String strategyName() {
        return strategyName;
    }

    // ==================== 选择与结果上报 ====================

    /**
     * 为租户选择一个可用账号
     * <p>
     * 无可用账号是正常的背压信号，返回 empty 而不是抛异常。
     * 租户有候选账号但全部因熔断 / 容量 / 配额不可用时发出 ALL_ACCOUNTS_EXHAUSTED 告警（受冷却限制）。
     */
    public Optional<Account> selectAccount(String tenantId, SelectionConstraints constraints) {
        SelectionConstraints effective = constraints != null ? constraints : SelectionConstraints.none();

        List<Account> candidates = new ArrayList<>();
        for (String id : registrationOrder) {
            Account a = accounts.get(id);
            if (a != null && a.tenantId().equals(tenantId)
                    && a.status() != AccountStatus.DISABLED && effective.permits(a)) {
                candidates.add(a);
            }
        }
        if (candidates.isEmpty()) {
            log.debug("租户 {} 没有符合约束的账号", tenantId);
            return Optional.empty();
        }

        UsageUnits requested = UsageUnits.ofRequest(effective.estimatedTokens());
        List<Account> eligible = new ArrayList<>();
        Map<String, CapacityCheck> capacity = new HashMap<>();
        for (Account a : candidates) {
            if (!a.isActive()) {
                continue;
            }
            if (!circuitBreaker.allowRequest(a.id())) {
                continue;
            }
            CapacityCheck check = capacityTracker.hasCapacity(a.id(), a.limits(), requested);
            if (!check.available()) {
                continue;
            }
            capacity.put(a.id(), check);
            eligible.add(a);
        }

        if (eligible.isEmpty()) {
            log.warn("租户 {} 无可用账号: 候选 {} 个, 全部熔断 / 容量不足 / 配额耗尽", tenantId, candidates.size());
            alertDispatcher.sendAllAccountsExhausted(tenantId, candidates.size(), candidates.size());
            return Optional.empty();
        }

        Optional<Account> selected = selector.select(strategyName, eligible, new SelectionContext(tenantId, capacity));
        selected.ifPresent(a -> log.debug("租户 {} 选中账号 {} ({}), 策略={}, 可用 {} 个",
                tenantId, a.id(), a.name(), strategyName, eligible.size()));
        return selected;
    }

    /**
     * 上报调用结果
     * <p>
     * 成功：记录实际用量 + 熔断成功；失败：记录熔断失败，已消耗 token 时仍记录用量。
     */
    public void recordOutcome(String accountId, CallOutcome outcome) {
        Account account = accounts.get(accountId);
        if (account == null) {
            log.warn("上报结果的账号不存在: {}", accountId);
            return;
        }
        Instant now = clock.instant();

        if (outcome.success()) {
            capacityTracker.recordUsage(accountId, 1, outcome.totalTokens(),
                    Math.max(0, outcome.requestTokens()), outcome.cacheHit());
            circuitBreaker.recordSuccess(accountId);
            account.markSuccess(now);
            persistQuietly(() -> accountDAO.updateSuccess(accountId, now.toString()), accountId);
            return;
        }

        if (outcome.totalTokens() > 0) {
            capacityTracker.recordUsage(accountId, 1, outcome.totalTokens(),
                    Math.max(0, outcome.requestTokens()), outcome.cacheHit());
        }
        String reason = outcome.errorReason() != null ? outcome.errorReason() : "unknown";
        CircuitTransition transition = circuitBreaker.recordFailure(accountId);
        account.markFailure(now, reason);
        persistQuietly(() -> accountDAO.updateFailure(accountId, now.toString(), reason), accountId);

        if (transition.opened()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("账号", account.name());
            payload.put("租户", account.tenantId());
            payload.put("原因", reason);
            payload.put("来源状态", transition.from());
            payload.put("恢复等待", properties.getCircuit().getRecoveryTimeoutSeconds() + "s");
            alertDispatcher.send(AlertType.CIRCUIT_OPEN, accountId, payload);
        }
    }

    // ==================== 账号管理 ====================

    /**
     * 注册账号：校验凭证格式与档位后加密入库并激活
     *
     * @return 新账号
     * @throws ConfigurationException 凭证格式非法或档位未知
     */
    public Account registerAccount(RegisterAccountRequest request) {
        if (request.tenantId() == null || request.tenantId().isBlank()) {
            throw new ConfigurationException("tenantId 不能为空");
        }
        if (request.name() == null || request.name().isBlank()) {
            throw new ConfigurationException("账号名称不能为空");
        }
        AccountTier tier = AccountTier.parse(request.tier());
        String credential = request.credential() != null ? request.credential().trim() : "";
        if (!CREDENTIAL_FORMAT.matcher(credential).matches()) {
            throw new ConfigurationException("凭证格式非法, 需以 sk-ant- 开头");
        }
        int priority = request.priority() != null ? request.priority() : 100;
        if (priority < 0) {
            throw new ConfigurationException("priority 不能为负数: " + priority);
        }

        CapacityLimits defaults = tier.defaultLimits();
        CapacityLimits limits = new CapacityLimits(
                positiveOr(request.requestsPerMinute(), defaults.requestsPerMinute()),
                positiveOr(request.tokensPerMinute(), defaults.tokensPerMinute()),
                positiveOr(request.inputTokensPerMinute(), defaults.inputTokensPerMinute()));

        String id = UUID.randomUUID().toString();
        String encrypted = credentialCipher.encrypt(credential, id);
        Instant now = clock.instant();
        Account account = new Account(id, request.tenantId(), request.name(), tier, priority,
                encrypted, request.usageKeyId(), limits, AccountStatus.ACTIVE, now);

        accountDAO.insert(new AccountDAO.AccountRow(id, account.tenantId(), account.name(), tier.value(), priority,
                encrypted, account.usageKeyId(), limits.requestsPerMinute(), limits.tokensPerMinute(),
                limits.inputTokensPerMinute(), AccountStatus.ACTIVE.value(), false, null, null, null, now.toString()));
        accounts.put(id, account);
        registrationOrder.add(id);

        log.info("注册账号: id={}, tenant={}, name={}, tier={}, priority={}, credential={}",
                id, account.tenantId(), account.name(), tier.value(), priority, CredentialCipher.mask(credential));
        return account;
    }

    /**
     * 注销账号：只改为 DISABLED，保留审计与告警历史以及配额耗尽标记
     */
    public void deregisterAccount(String accountId) {
        Account account = require(accountId);
        synchronized (account) {
            AccountStatus current = account.status();
            if (current == AccountStatus.DISABLED) {
                return;
            }
            if (changeStatus(account, current, AccountStatus.DISABLED, account.quotaExhausted())) {
                log.info("注销账号: id={}, name={}, from={}", accountId, account.name(), current.value());
            }
        }
    }

    /**
     * 重新启用被注销的账号
     * <p>
     * 注销前配额已耗尽且尚未续期的账号回到 EXHAUSTED，其余回到 ACTIVE。
     */
    public void enableAccount(String accountId) {
        Account account = require(accountId);
        synchronized (account) {
            if (account.status() != AccountStatus.DISABLED) {
                throw new BrokerException("只有 disabled 账号可以重新启用, 当前状态 " + account.status().value(), 409);
            }
            AccountStatus next = account.quotaExhausted() ? AccountStatus.EXHAUSTED : AccountStatus.ACTIVE;
            if (!changeStatus(account, AccountStatus.DISABLED, next, account.quotaExhausted())) {
                throw new BrokerException("账号状态已被并发修改, 请重试: " + accountId, 409);
            }
            log.info("启用账号: id={}, name={}, status={}", accountId, account.name(), next.value());
        }
    }

    /**
     * 标记配额耗尽，仅供配额监控调用
     *
     * @return true 状态发生变化
     */
    public boolean markExhausted(String accountId) {
        Account account = require(accountId);
        synchronized (account) {
            if (account.status() != AccountStatus.ACTIVE
                    || !changeStatus(account, AccountStatus.ACTIVE, AccountStatus.EXHAUSTED, true)) {
                return false;
            }
        }
        log.warn("账号配额耗尽: id={}, name={}", accountId, account.name());
        return true;
    }

    /**
     * 外部配额续期后恢复（EXHAUSTED → ACTIVE）
     * <p>
     * 已注销的账号只清除耗尽标记，保持 DISABLED。
     *
     * @return true 状态发生变化
     */
    public boolean renewQuota(String accountId) {
        Account account = require(accountId);
        synchronized (account) {
            AccountStatus current = account.status();
            boolean changed = switch (current) {
                case EXHAUSTED -> changeStatus(account, AccountStatus.EXHAUSTED, AccountStatus.ACTIVE, false);
                case DISABLED -> account.quotaExhausted()
                        && changeStatus(account, AccountStatus.DISABLED, AccountStatus.DISABLED, false);
                case ACTIVE -> false;
            };
            if (!changed) {
                return false;
            }
        }
        log.info("账号配额已续期: id={}, name={}, status={}", accountId, account.name(), account.status().value());
        return true;
    }

    /**
     * 运维手动重置熔断器
     */
    public CircuitSnapshot resetCircuit(String accountId) {
        require(accountId);
        return circuitBreaker.reset(accountId).to();
    }

    /**
     * 解密账号凭证，仅在调用方真正发起上游请求时使用，结果不得记录日志
     */
    public String credentialFor(String accountId) {
        Account account = require(accountId);
        return credentialCipher.decrypt(account.encryptedCredential(), account.id());
    }

    // ==================== 查询 ====================

    /**
     * 账号健康快照（只读，不触发熔断状态转换）
     */
    public AccountHealth getHealth(String accountId) {
        return toHealth(require(accountId));
    }

    public List<AccountHealth> listHealth() {
        List<AccountHealth> result = new ArrayList<>();
        for (String id : registrationOrder) {
            Account a = accounts.get(id);
            if (a != null) {
                result.add(toHealth(a));
            }
        }
        return result;
    }

    public List<Account> listAccounts() {
        List<Account> result = new ArrayList<>();
        for (String id : registrationOrder) {
            Account a = accounts.get(id);
            if (a != null) {
                result.add(a);
            }
        }
        return result;
    }

    public Optional<Account> getById(String id) {
        return Optional.ofNullable(accounts.get(id));
    }

    /**
     * 获取统计信息
     */
    public PoolStats getStats() {
        int active = 0;
        int disabled = 0;
        int exhausted = 0;
        int circuitOpen = 0;
        for (Account a : accounts.values()) {
            switch (a.status()) {
                case ACTIVE -> active++;
                case DISABLED -> disabled++;
                case EXHAUSTED -> exhausted++;
            }
            if (circuitBreaker.getStats(a.id()).state() == CircuitState.OPEN) {
                circuitOpen++;
            }
        }
        return new PoolStats(accounts.size(), active, disabled, exhausted, circuitOpen);
    }

    public int size() {
        return accounts.size();
    }

    // ==================== 内部方法 ====================

    private AccountHealth toHealth(Account a) {
        CapacityCheck capacity = capacityTracker.snapshot(a.id(), a.limits());
        return new AccountHealth(a.id(), a.tenantId(), a.name(), a.tier(), a.priority(), a.status(),
                circuitBreaker.getStats(a.id()), capacity.usage(), capacity.degraded(),
                a.lastFailureAt(), a.lastFailureReason(), a.lastSuccessAt());
    }

    /**
     * 状态条件更新，调用方持有 account 锁
     * <p>
     * 库中状态已被其他实例改动时放弃本次修改，并以库中状态刷新内存。
     */
    private boolean changeStatus(Account account, AccountStatus expected, AccountStatus next, boolean quotaExhausted) {
        boolean updated = accountDAO.updateStatus(account.id(), expected.value(), next.value(), quotaExhausted,
                clock.instant().toString());
        if (!updated) {
            accountDAO.findById(account.id()).ifPresent(row ->
                    account.setStatus(AccountStatus.fromValue(row.status()), row.quotaExhausted()));
            log.warn("账号 {} 状态已被其他实例修改为 {}, 放弃 {} -> {}",
                    account.id(), account.status().value(), expected.value(), next.value());
            return false;
        }
        account.setStatus(next, quotaExhausted);
        return true;
    }

    private Account require(String accountId) {
        Account account = accounts.get(accountId);
        if (account == null) {
            throw new AccountNotFoundException(accountId);
        }
        return account;
    }

    private void persistQuietly(Runnable write, String accountId) {
        try {
            write.run();
        } catch (DataAccessException e) {
            log.warn("账号 {} 调用记录持久化失败: {}", accountId, e.getMessage());
        }
    }

    private static long positiveOr(Long value, long fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static Account fromRow(AccountDAO.AccountRow row) {
        Account account = new Account(
                row.id(), row.tenantId(), row.name(), AccountTier.parse(row.tier()), row.priority(),
                row.encryptedCredential(), row.usageKeyId(),
                new CapacityLimits(row.rpmLimit(), row.tpmLimit(), row.itpmLimit()),
                AccountStatus.fromValue(row.status()), Instant.parse(row.createdAt()));
        account.setStatus(account.status(), row.quotaExhausted());
        account.restoreActivity(
                row.lastSuccessAt() != null ? Instant.parse(row.lastSuccessAt()) : null,
                row.lastFailureAt() != null ? Instant.parse(row.lastFailureAt()) : null,
                row.lastFailureReason());
        return account;
    }

    // ==================== 统计 Record ====================

    public record PoolStats(int total, int active, int disabled, int exhausted, int circuitOpen) {}
}
