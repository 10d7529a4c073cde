package com.accountbroker.circuit;

import com.accountbroker.config.AppProperties;
import com.accountbroker.dao.CircuitStateDAO;
import com.accountbroker.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * 账号级熔断器
 * <p>
 * CLOSED → OPEN → HALF_OPEN → CLOSED / OPEN。
 * 状态保存在多实例共享的 circuit_states 表中，同一账号的每次变更都是基于 version 的条件写；不同账号互不影响。
 * OPEN → HALF_OPEN 在下一次可用性检查时惰性判断，不依赖后台定时器。
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private static final int MAX_CAS_ATTEMPTS = 8;

    private final CircuitStateDAO circuitStateDAO;
    private final Clock clock;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int halfOpenSuccessThreshold;
    private final ConcurrentHashMap<String, Cell> cells = new ConcurrentHashMap<>();

    public CircuitBreaker(CircuitStateDAO circuitStateDAO, AppProperties.CircuitConfig config, Clock clock) {
        this.circuitStateDAO = circuitStateDAO;
        this.clock = clock;
        this.failureThreshold = Math.max(1, config.getFailureThreshold());
        this.recoveryTimeout = Duration.ofSeconds(Math.max(0, config.getRecoveryTimeoutSeconds()));
        this.halfOpenSuccessThreshold = Math.max(1, config.getHalfOpenSuccessThreshold());
        log.info("CircuitBreaker 初始化: failureThreshold={}, recoveryTimeout={}s, halfOpenSuccesses={}",
                failureThreshold, recoveryTimeout.toSeconds(), halfOpenSuccessThreshold);
    }

    /**
     * 账号当前是否允许被选中
     * <p>
     * OPEN 且恢复超时已过时在此转为 HALF_OPEN。
     */
    public boolean allowRequest(String accountId) {
        CircuitTransition t = update(accountId, current -> {
            if (current.state() == CircuitState.OPEN && recoveryElapsed(current)) {
                return CircuitSnapshot.halfOpen(current.openedAt());
            }
            return current;
        });
        if (t.changed()) {
            log.info("账号 {} 熔断恢复期已过, 进入 HALF_OPEN 探测", accountId);
        }
        return t.to().state() != CircuitState.OPEN;
    }

    /**
     * 记录成功
     */
    public CircuitTransition recordSuccess(String accountId) {
        CircuitTransition t = update(accountId, current -> switch (current.state()) {
            case CLOSED -> current.consecutiveFailures() == 0 ? current : current.withFailures(0);
            case HALF_OPEN -> {
                int successes = current.consecutiveSuccesses() + 1;
                yield successes >= halfOpenSuccessThreshold
                        ? CircuitSnapshot.closed()
                        : current.withSuccesses(successes);
            }
            // OPEN 期间迟到的成功上报不改变状态
            case OPEN -> current;
        });
        if (t.changed()) {
            log.info("账号 {} 熔断关闭: HALF_OPEN 连续成功 {} 次", accountId, halfOpenSuccessThreshold);
        }
        return t;
    }

    /**
     * 记录失败
     */
    public CircuitTransition recordFailure(String accountId) {
        Instant now = clock.instant();
        CircuitTransition t = update(accountId, current -> switch (current.state()) {
            case CLOSED -> {
                int failures = current.consecutiveFailures() + 1;
                yield failures >= failureThreshold
                        ? CircuitSnapshot.open(now)
                        : current.withFailures(failures);
            }
            case HALF_OPEN -> CircuitSnapshot.open(now);
            case OPEN -> current;
        });
        if (t.opened()) {
            log.warn("账号 {} 熔断打开: from={}, recoveryTimeout={}s",
                    accountId, t.from(), recoveryTimeout.toSeconds());
        }
        return t;
    }

    /**
     * 只读查询当前状态，不触发惰性状态转换
     */
    public CircuitSnapshot getStats(String accountId) {
        Cell cell = cellOf(accountId);
        synchronized (cell) {
            try {
                CircuitSnapshot stored = circuitStateDAO.find(accountId)
                        .map(CircuitStateDAO.StoredCircuit::snapshot)
                        .orElse(CircuitSnapshot.closed());
                cell.snapshot = stored;
                return stored;
            } catch (StoreUnavailableException e) {
                log.warn("熔断状态读取失败, 账号 {} 按本地状态处理: {}", accountId, e.getMessage());
                return cell.lastKnown();
            }
        }
    }

    /**
     * 运维手动重置为 CLOSED
     */
    public CircuitTransition reset(String accountId) {
        CircuitTransition t = update(accountId, current -> CircuitSnapshot.closed());
        log.info("账号 {} 熔断已手动重置: {} -> CLOSED", accountId, t.from());
        return t;
    }

    /**
     * 读 - 改 - 条件写
     * <p>
     * 状态以共享存储为准：每次都重新读取带 version 的行，按 version 条件写回，
     * 被其他实例抢先修改时重新读取再计算。本地锁只减少同一进程内的冲突。
     * 存储不可用时退回本地最近一次已知状态（初始为 CLOSED）。
     */
    private CircuitTransition update(String accountId, UnaryOperator<CircuitSnapshot> transition) {
        Cell cell = cellOf(accountId);
        synchronized (cell) {
            for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
                Optional<CircuitStateDAO.StoredCircuit> stored;
                try {
                    stored = circuitStateDAO.find(accountId);
                } catch (StoreUnavailableException e) {
                    log.warn("熔断状态读取失败, 账号 {} 按本地状态处理: {}", accountId, e.getMessage());
                    return applyLocally(cell, transition);
                }

                CircuitSnapshot current = stored.map(CircuitStateDAO.StoredCircuit::snapshot)
                        .orElse(CircuitSnapshot.closed());
                CircuitSnapshot next = transition.apply(current);
                if (next.equals(current)) {
                    cell.snapshot = current;
                    return new CircuitTransition(current.state(), current);
                }

                boolean written;
                try {
                    Instant now = clock.instant();
                    written = stored.isPresent()
                            ? circuitStateDAO.compareAndSet(accountId, next, stored.get().version(), now)
                            : circuitStateDAO.insertIfAbsent(accountId, next, now);
                } catch (StoreUnavailableException e) {
                    log.warn("熔断状态持久化失败, 账号 {} 仅保留本地状态 {}: {}",
                            accountId, next.state(), e.getMessage());
                    cell.snapshot = next;
                    return new CircuitTransition(current.state(), next);
                }
                if (written) {
                    cell.snapshot = next;
                    return new CircuitTransition(current.state(), next);
                }
                log.debug("账号 {} 熔断状态被其他实例修改, 第 {} 次重试", accountId, attempt);
            }
            // 放弃本次上报，状态保持其他实例写入的结果
            log.warn("账号 {} 熔断状态写入冲突超过 {} 次, 本次上报被丢弃", accountId, MAX_CAS_ATTEMPTS);
            CircuitSnapshot last = cell.lastKnown();
            return new CircuitTransition(last.state(), last);
        }
    }

    private CircuitTransition applyLocally(Cell cell, UnaryOperator<CircuitSnapshot> transition) {
        CircuitSnapshot current = cell.lastKnown();
        CircuitSnapshot next = transition.apply(current);
        cell.snapshot = next;
        return new CircuitTransition(current.state(), next);
    }

    private boolean recoveryElapsed(CircuitSnapshot snapshot) {
        Instant openedAt = snapshot.openedAt();
        return openedAt == null || !clock.instant().isBefore(openedAt.plus(recoveryTimeout));
    }

    private Cell cellOf(String accountId) {
        return cells.computeIfAbsent(accountId, id -> new Cell());
    }

    private static final class Cell {
        CircuitSnapshot snapshot;

        CircuitSnapshot lastKnown() {
            return snapshot != null ? snapshot : CircuitSnapshot.closed();
        }
    }
}
