package com.accountbroker.capacity;

/**
 * 滑动窗口追踪的指标（均为每分钟口径）
 */
public enum CapacityMetric {

    REQUESTS("rpm"),
    TOKENS("tpm"),
    INPUT_TOKENS("itpm");

    private final String key;

    CapacityMetric(String key) {
        this.key = key;
    }

    /**
     * 计数存储中使用的短键
     */
    public String key() {
        return key;
    }
}
