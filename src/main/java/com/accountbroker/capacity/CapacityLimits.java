package com.accountbroker.capacity;

/**
 * 账号的每分钟限额，limit <= 0 表示该指标不限
 */
public record CapacityLimits(long requestsPerMinute, long tokensPerMinute, long inputTokensPerMinute) {

    public long limitOf(CapacityMetric metric) {
        return switch (metric) {
            case REQUESTS -> requestsPerMinute;
            case TOKENS -> tokensPerMinute;
            case INPUT_TOKENS -> inputTokensPerMinute;
        };
    }
}
