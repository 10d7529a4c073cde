package com.accountbroker.capacity;

import com.accountbroker.config.AppProperties;
import com.accountbroker.exception.ConfigurationException;
import com.accountbroker.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * 每账号、每指标的滑动窗口容量追踪
 * <p>
 * 固定粒度的时间桶（默认 1 秒）在滚动窗口（默认 60 秒）内求和，避免固定窗口在边界处放行两倍配额。
 * <p>
 * 计数存储不可用时默认 fail-open：宁可短时超限也不阻断全部流量。可通过
 * {@code broker.capacity.fail-open=false} 切换为 fail-closed。
 */
public class CapacityTracker {

    private static final Logger log = LoggerFactory.getLogger(CapacityTracker.class);

    private final CounterStore store;
    private final Clock clock;
    private final long bucketMillis;
    private final long windowBuckets;
    private final Duration keyTtl;
    private final double cacheReadDiscount;
    private final boolean failOpen;

    public CapacityTracker(CounterStore store, AppProperties.CapacityConfig config, Clock clock) {
        if (config.getBucketMillis() <= 0 || config.getWindowSeconds() <= 0) {
            throw new ConfigurationException("容量窗口配置非法: bucketMillis=" + config.getBucketMillis()
                    + ", windowSeconds=" + config.getWindowSeconds());
        }
        if (config.getCacheReadDiscount() < 0 || config.getCacheReadDiscount() >= 1.0) {
            throw new ConfigurationException("cache-read-discount 必须在 [0, 1) 之间: " + config.getCacheReadDiscount());
        }
        this.store = store;
        this.clock = clock;
        this.bucketMillis = config.getBucketMillis();
        long windowMillis = config.getWindowSeconds() * 1000L;
        this.windowBuckets = Math.max(1, windowMillis / bucketMillis);
        this.keyTtl = Duration.ofMillis(windowMillis * 2);
        this.cacheReadDiscount = config.getCacheReadDiscount();
        this.failOpen = config.isFailOpen();
        log.info("CapacityTracker 初始化: bucket={}ms, window={}s, cacheReadDiscount={}, failOpen={}",
                bucketMillis, config.getWindowSeconds(), cacheReadDiscount, failOpen);
    }

    /**
     * 检查账号是否还能承载 requested 的用量
     * <p>
     * 窗口用量已达上限，或加上本次用量会超限，均视为不可用。
     */
    public CapacityCheck hasCapacity(String accountId, CapacityLimits limits, UsageUnits requested) {
        Map<CapacityMetric, MetricUsage> usage;
        try {
            usage = readUsage(accountId, limits);
        } catch (StoreUnavailableException e) {
            log.error("计数存储不可用, 账号 {} 容量检查按 {} 处理: {}",
                    accountId, failOpen ? "fail-open" : "fail-closed", e.getMessage());
            return new CapacityCheck(failOpen, emptyUsage(limits), true);
        }

        boolean available = true;
        for (CapacityMetric metric : CapacityMetric.values()) {
            MetricUsage u = usage.get(metric);
            if (u.unlimited()) {
                continue;
            }
            long want = requested.of(metric);
            if (u.used() >= u.limit() || u.used() + want > u.limit()) {
                available = false;
                log.debug("账号 {} 指标 {} 容量不足: used={}, requested={}, limit={}",
                        accountId, metric, u.used(), want, u.limit());
                break;
            }
        }
        return new CapacityCheck(available, usage, false);
    }

    /**
     * 读取当前窗口用量，不做可用性判断（健康检查 / 选择策略使用）
     */
    public CapacityCheck snapshot(String accountId, CapacityLimits limits) {
        try {
            Map<CapacityMetric, MetricUsage> usage = readUsage(accountId, limits);
            boolean available = usage.values().stream().allMatch(u -> u.unlimited() || u.used() < u.limit());
            return new CapacityCheck(available, usage, false);
        } catch (StoreUnavailableException e) {
            log.warn("计数存储不可用, 账号 {} 用量快照为空: {}", accountId, e.getMessage());
            return new CapacityCheck(failOpen, emptyUsage(limits), true);
        }
    }

    /**
     * 记录用量
     * <p>
     * 缓存读取的 token 按折扣系数计入，例如 10000 个 cache-read token 在 0.1 折扣下计 1000。
     */
    public void recordUsage(String accountId, long requests, long tokens, long inputTokens, boolean isCacheRead) {
        long effectiveTokens = isCacheRead ? discount(tokens) : tokens;
        long effectiveInput = isCacheRead ? discount(inputTokens) : inputTokens;
        long bucket = currentBucket();
        try {
            incrementIfPositive(accountId, CapacityMetric.REQUESTS, bucket, requests);
            incrementIfPositive(accountId, CapacityMetric.TOKENS, bucket, effectiveTokens);
            incrementIfPositive(accountId, CapacityMetric.INPUT_TOKENS, bucket, effectiveInput);
        } catch (StoreUnavailableException e) {
            // 计数可从后续流量自愈，丢失本次用量不影响调用方
            log.error("计数存储不可用, 账号 {} 用量未记录: requests={}, tokens={}: {}",
                    accountId, requests, effectiveTokens, e.getMessage());
        }
    }

    /**
     * 清除账号的全部窗口计数
     */
    public void clear(String accountId) {
        try {
            for (CapacityMetric metric : CapacityMetric.values()) {
                store.delete(counterKey(accountId, metric));
            }
        } catch (StoreUnavailableException e) {
            log.warn("清除账号 {} 容量计数失败: {}", accountId, e.getMessage());
        }
    }

    public double cacheReadDiscount() {
        return cacheReadDiscount;
    }

    private Map<CapacityMetric, MetricUsage> readUsage(String accountId, CapacityLimits limits) {
        long fromBucket = currentBucket() - windowBuckets + 1;
        Map<CapacityMetric, MetricUsage> usage = new EnumMap<>(CapacityMetric.class);
        for (CapacityMetric metric : CapacityMetric.values()) {
            long limit = limits.limitOf(metric);
            long used = limit > 0 ? store.sumSince(counterKey(accountId, metric), fromBucket) : 0;
            usage.put(metric, new MetricUsage(used, limit));
        }
        return usage;
    }

    private void incrementIfPositive(String accountId, CapacityMetric metric, long bucket, long amount) {
        if (amount > 0) {
            store.increment(counterKey(accountId, metric), bucket, amount, keyTtl);
        }
    }

    private long discount(long tokens) {
        return Math.round(tokens * cacheReadDiscount);
    }

    private long currentBucket() {
        return clock.millis() / bucketMillis;
    }

    private static Map<CapacityMetric, MetricUsage> emptyUsage(CapacityLimits limits) {
        Map<CapacityMetric, MetricUsage> usage = new EnumMap<>(CapacityMetric.class);
        for (CapacityMetric metric : CapacityMetric.values()) {
            usage.put(metric, new MetricUsage(0, limits.limitOf(metric)));
        }
        return usage;
    }

    private static String counterKey(String accountId, CapacityMetric metric) {
        return "cap:" + accountId + ":" + metric.key();
    }
}
