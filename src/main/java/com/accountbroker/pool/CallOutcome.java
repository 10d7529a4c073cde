package com.accountbroker.pool;

/**
 * 调用方上报的一次上游调用结果
 *
 * @param errorReason 失败原因，成功时为 null
 */
public record CallOutcome(boolean success, long latencyMs, long requestTokens, long responseTokens,
                          boolean cacheHit, String errorReason) {

    public static CallOutcome success(long latencyMs, long requestTokens, long responseTokens, boolean cacheHit) {
        return new CallOutcome(true, latencyMs, requestTokens, responseTokens, cacheHit, null);
    }

    public static CallOutcome failure(long latencyMs, String errorReason) {
        return new CallOutcome(false, latencyMs, 0, 0, false, errorReason);
    }

    public long totalTokens() {
        return Math.max(0, requestTokens) + Math.max(0, responseTokens);
    }
}
