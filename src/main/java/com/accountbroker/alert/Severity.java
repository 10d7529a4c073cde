package com.accountbroker.alert;

/**
 * 告警级别，按紧急程度递增
 */
public enum Severity {
    WARNING,
    CRITICAL,
    EMERGENCY;

    public boolean escalated() {
        return this != WARNING;
    }
}
