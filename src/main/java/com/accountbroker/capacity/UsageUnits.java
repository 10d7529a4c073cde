package com.accountbroker.capacity;

/**
 * 一次调用消耗（或预估消耗）的用量
 */
public record UsageUnits(long requests, long tokens, long inputTokens) {

    public static final UsageUnits NONE = new UsageUnits(0, 0, 0);

    /**
     * 单次请求 + 预估 token 数（预估值同时计入 tokens 与 input tokens）
     */
    public static UsageUnits ofRequest(long estimatedTokens) {
        long tokens = Math.max(0, estimatedTokens);
        return new UsageUnits(1, tokens, tokens);
    }

    public long of(CapacityMetric metric) {
        return switch (metric) {
            case REQUESTS -> requests;
            case TOKENS -> tokens;
            case INPUT_TOKENS -> inputTokens;
        };
    }
}
