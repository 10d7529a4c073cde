package com.accountbroker.alert;

/**
 * 告警类型
 * <p>
 * 冷却按 (subject, type) 维度计算；ALL_ACCOUNTS_EXHAUSTED 的 subject 为租户。
 */
public enum AlertType {

    QUOTA_WARNING("quota_warning", Severity.WARNING),
    QUOTA_CRITICAL("quota_critical", Severity.CRITICAL),
    QUOTA_EXHAUSTED("quota_exhausted", Severity.CRITICAL),
    CIRCUIT_OPEN("circuit_breaker", Severity.CRITICAL),
    ALL_ACCOUNTS_EXHAUSTED("all_accounts_exhausted", Severity.EMERGENCY);

    private final String key;
    private final Severity severity;

    AlertType(String key, Severity severity) {
        this.key = key;
        this.severity = severity;
    }

    public String key() {
        return key;
    }

    public Severity severity() {
        return severity;
    }
}
