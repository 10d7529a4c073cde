package com.accountbroker.pool;

import com.accountbroker.capacity.CapacityCheck;
import com.accountbroker.capacity.CapacityMetric;
import com.accountbroker.capacity.MetricUsage;

import java.util.Map;

/**
 * 选择上下文：过滤阶段得到的各账号容量快照
 */
public record SelectionContext(String tenantId, Map<String, CapacityCheck> capacity) {

    public static SelectionContext empty(String tenantId) {
        return new SelectionContext(tenantId, Map.of());
    }

    /**
     * 账号在指定指标上的用量，无快照时视为未使用且不限额
     */
    public MetricUsage usageOf(Account account, CapacityMetric metric) {
        CapacityCheck check = capacity.get(account.id());
        return check != null ? check.usageOf(metric) : new MetricUsage(0, 0);
    }

    /**
     * 账号所有指标中最小的剩余比例
     */
    public double minRemainingFraction(Account account) {
        CapacityCheck check = capacity.get(account.id());
        return check != null ? check.minRemainingFraction() : 1.0;
    }
}
