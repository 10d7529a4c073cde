package com.accountbroker.monitor;

/**
 * 外部用量权威源返回的用量
 */
public record UsageReport(long used, long limit) {

    /**
     * 用量百分比，limit 未知时返回 0
     */
    public double percentage() {
        if (limit <= 0) {
            return 0;
        }
        return used * 100.0 / limit;
    }
}
