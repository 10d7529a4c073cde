package com.accountbroker.pool;

import com.accountbroker.exception.ConfigurationException;

/**
 * 账号生命周期状态
 * <p>
 * ACTIVE ↔ DISABLED 由运维切换；EXHAUSTED 只由配额监控设置，只在外部配额续期后清除。
 */
public enum AccountStatus {

    ACTIVE("active"),
    DISABLED("disabled"),
    EXHAUSTED("exhausted");

    private final String value;

    AccountStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static AccountStatus fromValue(String value) {
        for (AccountStatus s : values()) {
            if (s.value.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new ConfigurationException("未知账号状态: " + value);
    }
}
