package com.accountbroker.capacity;

import java.util.Map;

/**
 * 容量检查结果
 *
 * @param available 是否仍有余量
 * @param usage     各指标窗口用量
 * @param degraded  计数存储不可用，结果来自 fail-open / fail-closed 策略而非真实计数
 */
public record CapacityCheck(boolean available, Map<CapacityMetric, MetricUsage> usage, boolean degraded) {

    public MetricUsage usageOf(CapacityMetric metric) {
        MetricUsage u = usage.get(metric);
        return u != null ? u : new MetricUsage(0, 0);
    }

    public long remaining(CapacityMetric metric) {
        return usageOf(metric).remaining();
    }

    /**
     * 所有受限指标中最小的剩余比例
     */
    public double minRemainingFraction() {
        double min = 1.0;
        for (MetricUsage u : usage.values()) {
            min = Math.min(min, u.remainingFraction());
        }
        return min;
    }
}
