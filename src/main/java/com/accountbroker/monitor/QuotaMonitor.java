package com.accountbroker.monitor;

import com.accountbroker.alert.AlertDispatcher;
import com.accountbroker.config.AppProperties;
import com.accountbroker.dao.QuotaAlertDAO;
import com.accountbroker.exception.AccountNotFoundException;
import com.accountbroker.exception.ConfigurationException;
import com.accountbroker.exception.UsageSyncException;
import com.accountbroker.pool.Account;
import com.accountbroker.pool.AccountPool;
import com.accountbroker.pool.AccountStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * 配额监控
 * <p>
 * 周期性从外部用量权威源拉取每个账号的用量，按 80 / 95 / 100% 阈值创建或解决告警，
 * 100% 时将账号置为 EXHAUSTED，用量回落后恢复为 ACTIVE。
 * <p>
 * 告警创建依赖数据库条件插入去重，多个实例同时运行也不会产生重复的未解决告警。
 */
public class QuotaMonitor {

    private static final Logger log = LoggerFactory.getLogger(QuotaMonitor.class);

    private final AccountPool pool;
    private final QuotaAlertDAO alertDAO;
    private final UsageAuthority usageAuthority;
    private final AlertDispatcher alertDispatcher;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration interval;
    private final Duration usageWindow;
    private final Map<QuotaThreshold, Double> thresholds = new LinkedHashMap<>();

    private ScheduledFuture<?> task;

    public QuotaMonitor(AccountPool pool, QuotaAlertDAO alertDAO, UsageAuthority usageAuthority,
                        AlertDispatcher alertDispatcher, TaskScheduler taskScheduler,
                        AppProperties.MonitorConfig config, Clock clock) {
        double previous = 0;
        for (QuotaThreshold t : QuotaThreshold.values()) {
            double percent = t.percentOf(config);
            if (percent <= previous) {
                throw new ConfigurationException("配额阈值必须为正数且严格递增: " + t + "=" + percent);
            }
            thresholds.put(t, percent);
            previous = percent;
        }
        if (config.getIntervalSeconds() <= 0 || config.getUsageWindowSeconds() <= 0) {
            throw new ConfigurationException("监控间隔与用量窗口必须为正数");
        }
        this.pool = pool;
        this.alertDAO = alertDAO;
        this.usageAuthority = usageAuthority;
        this.alertDispatcher = alertDispatcher;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.interval = Duration.ofSeconds(config.getIntervalSeconds());
        this.usageWindow = Duration.ofSeconds(config.getUsageWindowSeconds());
    }

    // ==================== 生命周期 ====================

    /**
     * 启动周期同步，重复调用无副作用
     */
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        task = taskScheduler.scheduleAtFixedRate(this::runScheduled, interval);
        log.info("配额监控已启动: interval={}s, thresholds={}", interval.toSeconds(), thresholds);
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("配额监控已停止");
        }
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDone();
    }

    private void runScheduled() {
        try {
            syncAll();
        } catch (RuntimeException e) {
            // 保持定时任务存活，下一个周期重试
            log.error("配额同步周期执行失败", e);
        }
    }

    // ==================== 同步 ====================

    /**
     * 同步全部 ACTIVE / EXHAUSTED 且配置了 usageKeyId 的账号
     * <p>
     * 单个账号失败只记录日志并继续下一个。
     */
    public SyncSummary syncAll() {
        int checked = 0;
        int synced = 0;
        int failed = 0;
        int created = 0;
        int resolved = 0;

        for (Account account : pool.listAccounts()) {
            if (!isMonitored(account)) {
                continue;
            }
            checked++;
            try {
                AccountSyncResult result = sync(account);
                synced++;
                created += result.created().size();
                resolved += result.resolved();
            } catch (UsageSyncException e) {
                failed++;
                log.warn("账号 {} ({}) 用量同步失败: {}", account.id(), account.name(), e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                log.error("账号 {} ({}) 配额检查异常", account.id(), account.name(), e);
            }
        }

        SyncSummary summary = new SyncSummary(checked, synced, failed, created, resolved);
        if (failed > 0 || created > 0 || resolved > 0) {
            log.info("配额同步完成: {}", summary);
        } else {
            log.debug("配额同步完成: {}", summary);
        }
        return summary;
    }

    /**
     * 同步单个账号（运维手动触发），失败直接抛出
     *
     * @throws AccountNotFoundException 账号不存在
     * @throws UsageSyncException       用量拉取失败
     */
    public AccountSyncResult syncAccount(String accountId) {
        Account account = pool.getById(accountId).orElseThrow(() -> new AccountNotFoundException(accountId));
        if (account.usageKeyId() == null || account.usageKeyId().isBlank()) {
            throw new UsageSyncException("账号未配置 usageKeyId: " + accountId);
        }
        return sync(account);
    }

    public List<QuotaAlert> listAlerts(String accountId, boolean unresolvedOnly) {
        return alertDAO.findByAccount(accountId, unresolvedOnly);
    }

    private AccountSyncResult sync(Account account) {
        UsageReport usage = usageAuthority.fetchUsage(account.usageKeyId(), usageWindow);
        if (usage.limit() <= 0) {
            log.debug("账号 {} 用量上限未知, 跳过阈值检查", account.id());
            return new AccountSyncResult(account.id(), 0, List.of(), 0, account.status());
        }

        double percentage = usage.percentage();
        Instant now = clock.instant();
        List<QuotaThreshold> created = new ArrayList<>();
        int resolved = 0;

        for (Map.Entry<QuotaThreshold, Double> entry : thresholds.entrySet()) {
            QuotaThreshold threshold = entry.getKey();
            if (percentage >= entry.getValue()) {
                QuotaAlert alert = new QuotaAlert(UUID.randomUUID().toString(), account.id(), threshold,
                        percentage, usage.used(), usage.limit(), now, null);
                if (alertDAO.insertIfAbsent(alert)) {
                    created.add(threshold);
                    log.warn("账号 {} ({}) 用量越过 {} 阈值: {}%", account.id(), account.name(),
                            threshold, String.format("%.1f", percentage));
                }
            } else {
                int n = alertDAO.resolve(account.id(), threshold, now);
                if (n > 0) {
                    resolved += n;
                    log.info("账号 {} ({}) 用量回落到 {} 阈值以下, 告警已解决", account.id(), account.name(), threshold);
                }
            }
        }

        if (percentage >= thresholds.get(QuotaThreshold.EXHAUSTED)) {
            pool.markExhausted(account.id());
        } else if (account.status() == AccountStatus.EXHAUSTED) {
            pool.renewQuota(account.id());
        }

        // 同一轮越过多个阈值时只发最严重的一条
        if (!created.isEmpty()) {
            QuotaThreshold worst = created.get(created.size() - 1);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("账号", account.name());
            payload.put("租户", account.tenantId());
            payload.put("档位", account.tier().value());
            payload.put("用量", usage.used() + " / " + usage.limit());
            payload.put("百分比", String.format("%.1f%%", percentage));
            alertDispatcher.send(worst.alertType(), account.id(), payload);
        }

        return new AccountSyncResult(account.id(), percentage, created, resolved, account.status());
    }

    private static boolean isMonitored(Account account) {
        return account.status() != AccountStatus.DISABLED
                && account.usageKeyId() != null && !account.usageKeyId().isBlank();
    }

    // ==================== 结果 Record ====================

    public record SyncSummary(int checked, int synced, int failed, int alertsCreated, int alertsResolved) {}

    public record AccountSyncResult(String accountId, double percentage, List<QuotaThreshold> created,
                                    int resolved, AccountStatus status) {}
}
