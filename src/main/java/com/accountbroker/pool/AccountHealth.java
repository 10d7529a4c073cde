package com.accountbroker.pool;

import com.accountbroker.capacity.CapacityMetric;
import com.accountbroker.capacity.MetricUsage;
import com.accountbroker.circuit.CircuitSnapshot;

import java.time.Instant;
import java.util.Map;

/**
 * 账号健康快照
 */
public record AccountHealth(String accountId, String tenantId, String name, AccountTier tier, int priority,
                            AccountStatus status, CircuitSnapshot circuit,
                            Map<CapacityMetric, MetricUsage> capacity, boolean capacityDegraded,
                            Instant lastFailureAt, String lastFailureReason, Instant lastSuccessAt) {
}
