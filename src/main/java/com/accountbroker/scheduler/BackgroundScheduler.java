package com.accountbroker.scheduler;

import com.accountbroker.alert.AlertDispatcher;
import com.accountbroker.capacity.CounterStore;
import com.accountbroker.capacity.InMemoryCounterStore;
import com.accountbroker.config.AppProperties;
import com.accountbroker.monitor.QuotaMonitor;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 后台定时任务调度器
 * <p>
 * - 应用就绪后启动配额监控，关闭时停止
 * - 内存容量计数清理
 * - 告警冷却记录清理
 */
@Component
public class BackgroundScheduler {

    private static final Logger log = LoggerFactory.getLogger(BackgroundScheduler.class);

    private final AppProperties properties;
    private final QuotaMonitor quotaMonitor;
    private final CounterStore counterStore;
    private final AlertDispatcher alertDispatcher;

    public BackgroundScheduler(AppProperties properties, QuotaMonitor quotaMonitor,
                               CounterStore counterStore, AlertDispatcher alertDispatcher) {
        this.properties = properties;
        this.quotaMonitor = quotaMonitor;
        this.counterStore = counterStore;
        this.alertDispatcher = alertDispatcher;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startQuotaMonitor() {
        if (!properties.getMonitor().isEnabled()) {
            log.info("配额监控已禁用 (broker.monitor.enabled=false)");
            return;
        }
        String baseUrl = properties.getAdminApi().getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            log.warn("未配置 broker.admin-api.base-url, 配额监控不启动");
            return;
        }
        quotaMonitor.start();
    }

    @PreDestroy
    public void stopQuotaMonitor() {
        quotaMonitor.stop();
    }

    /**
     * 内存计数清理（每分钟），Redis 依赖 key 过期
     */
    @Scheduled(fixedRate = 60000)
    public void purgeCounters() {
        if (counterStore instanceof InMemoryCounterStore memory) {
            int removed = memory.purgeExpired();
            if (removed > 0) {
                log.debug("清理过期容量计数: {} 个 key, 剩余 {}", removed, memory.size());
            }
        }
    }

    /**
     * 告警冷却记录清理（每 10 分钟）
     */
    @Scheduled(fixedRate = 600000)
    public void purgeAlertCooldowns() {
        int removed = alertDispatcher.purgeExpired();
        if (removed > 0) {
            log.debug("清理过期告警冷却: {} 条", removed);
        }
    }
}
