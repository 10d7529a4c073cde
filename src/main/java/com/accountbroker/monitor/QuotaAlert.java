package com.accountbroker.monitor;

import java.time.Instant;

/**
 * 配额告警记录，resolvedAt 为 null 表示未解决
 */
public record QuotaAlert(String id, String accountId, QuotaThreshold thresholdType, double percentage,
                         long used, long limit, Instant createdAt, Instant resolvedAt) {

    public boolean resolved() {
        return resolvedAt != null;
    }
}
