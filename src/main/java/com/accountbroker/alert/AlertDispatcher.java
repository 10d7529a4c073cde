package com.accountbroker.alert;

import com.accountbroker.config.AppProperties;
import com.accountbroker.exception.NotificationDeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 告警分发：按 (subject, type) 冷却去重，投递失败只记日志
 * <p>
 * 冷却在投递前原子占位，并发的重复告警只有一条会真正发出；投递失败时释放占位，下次可重试。
 */
public class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final NotificationChannel channel;
    private final Clock clock;
    private final String defaultChannel;
    private final String escalationChannel;
    private final Map<AlertType, Duration> cooldowns;
    private final ConcurrentHashMap<String, Instant> cooldownUntil = new ConcurrentHashMap<>();

    public AlertDispatcher(NotificationChannel channel, AppProperties.AlertConfig config, Clock clock) {
        this.channel = channel;
        this.clock = clock;
        this.defaultChannel = config.getChannel();
        this.escalationChannel = config.getEscalationChannel() == null || config.getEscalationChannel().isBlank()
                ? config.getChannel()
                : config.getEscalationChannel();

        Duration quota = Duration.ofMinutes(config.getQuotaCooldownMinutes());
        this.cooldowns = Map.of(
                AlertType.QUOTA_WARNING, quota,
                AlertType.QUOTA_CRITICAL, quota,
                AlertType.QUOTA_EXHAUSTED, quota,
                AlertType.CIRCUIT_OPEN, Duration.ofMinutes(config.getCircuitCooldownMinutes()),
                AlertType.ALL_ACCOUNTS_EXHAUSTED, Duration.ofMinutes(config.getExhaustedCooldownMinutes())
        );
    }

    /**
     * 发送告警
     *
     * @param type      告警类型
     * @param subjectId 账号 ID（ALL_ACCOUNTS_EXHAUSTED 时为租户 ID）
     * @param payload   展示字段，按插入顺序输出
     * @return true 已投递，false 冷却中被抑制或投递失败
     */
    public boolean send(AlertType type, String subjectId, Map<String, Object> payload) {
        String key = cooldownKey(subjectId, type);
        Instant now = clock.instant();
        Instant until = now.plus(cooldowns.get(type));

        AtomicBoolean claimed = new AtomicBoolean(false);
        Instant held = cooldownUntil.compute(key, (k, existing) -> {
            if (existing != null && now.isBefore(existing)) {
                return existing;
            }
            claimed.set(true);
            return until;
        });
        if (!claimed.get()) {
            log.debug("告警冷却中, 跳过: type={}, subject={}, until={}", type, subjectId, held);
            return false;
        }

        Severity severity = type.severity();
        String target = severity.escalated() ? escalationChannel : defaultChannel;
        String message = format(type, subjectId, payload);
        try {
            channel.send(target, message, severity);
        } catch (NotificationDeliveryException e) {
            cooldownUntil.remove(key, until);
            log.error("告警投递失败: type={}, subject={}: {}", type, subjectId, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            cooldownUntil.remove(key, until);
            log.error("告警投递异常: type={}, subject={}", type, subjectId, e);
            return false;
        }

        if (severity == Severity.EMERGENCY) {
            log.error("告警已发送: type={}, subject={}, channel={}", type, subjectId, target);
        } else {
            log.info("告警已发送: type={}, subject={}, channel={}", type, subjectId, target);
        }
        return true;
    }

    /**
     * 租户下全部账号不可用（最高紧急度）
     */
    public boolean sendAllAccountsExhausted(String tenantId, int totalAccounts, int unavailableAccounts) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("租户", tenantId);
        payload.put("账号总数", totalAccounts);
        payload.put("不可用账号", unavailableAccounts);
        payload.put("建议操作", "新增账号 / 提升配额 / 排查熔断原因 / 检查近期用量");
        return send(AlertType.ALL_ACCOUNTS_EXHAUSTED, tenantId, payload);
    }

    public boolean isInCooldown(AlertType type, String subjectId) {
        Instant until = cooldownUntil.get(cooldownKey(subjectId, type));
        return until != null && clock.instant().isBefore(until);
    }

    public void clearCooldown(AlertType type, String subjectId) {
        cooldownUntil.remove(cooldownKey(subjectId, type));
        log.info("告警冷却已清除: type={}, subject={}", type, subjectId);
    }

    /**
     * 清理已过期的冷却记录（由定时任务调用）
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = cooldownUntil.size();
        cooldownUntil.entrySet().removeIf(e -> !now.isBefore(e.getValue()));
        return before - cooldownUntil.size();
    }

    private String format(AlertType type, String subjectId, Map<String, Object> payload) {
        StringBuilder sb = new StringBuilder();
        switch (type.severity()) {
            case EMERGENCY -> sb.append("<!channel> 🚨🚨🚨 ");
            case CRITICAL -> sb.append("<!here> 🚨 ");
            case WARNING -> sb.append("⚠️ ");
        }
        sb.append(title(type)).append(": ").append(subjectId).append('\n');
        if (payload != null) {
            payload.forEach((k, v) -> sb.append("• ").append(k).append(": ").append(v).append('\n'));
        }
        return sb.toString().trim();
    }

    private static String title(AlertType type) {
        return switch (type) {
            case QUOTA_WARNING -> "配额预警";
            case QUOTA_CRITICAL -> "配额严重告警";
            case QUOTA_EXHAUSTED -> "配额已耗尽";
            case CIRCUIT_OPEN -> "熔断器打开";
            case ALL_ACCOUNTS_EXHAUSTED -> "全部账号不可用";
        };
    }

    private static String cooldownKey(String subjectId, AlertType type) {
        return subjectId + ":" + type.key();
    }
}
