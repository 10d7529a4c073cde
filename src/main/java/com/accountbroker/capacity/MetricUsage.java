package com.accountbroker.capacity;

/**
 * 单个指标在当前窗口内的用量
 */
public record MetricUsage(long used, long limit) {

    public boolean unlimited() {
        return limit <= 0;
    }

    public long remaining() {
        if (unlimited()) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, limit - used);
    }

    /**
     * 剩余比例 remaining / limit，不限额时为 1.0
     */
    public double remainingFraction() {
        if (unlimited()) {
            return 1.0;
        }
        return (double) remaining() / limit;
    }
}
