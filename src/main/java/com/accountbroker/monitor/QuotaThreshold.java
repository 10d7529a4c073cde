package com.accountbroker.monitor;

import com.accountbroker.alert.AlertType;
import com.accountbroker.config.AppProperties;

/**
 * 配额阈值，声明顺序即严重程度
 */
public enum QuotaThreshold {

    WARNING(AlertType.QUOTA_WARNING),
    CRITICAL(AlertType.QUOTA_CRITICAL),
    EXHAUSTED(AlertType.QUOTA_EXHAUSTED);

    private final AlertType alertType;

    QuotaThreshold(AlertType alertType) {
        this.alertType = alertType;
    }

    public AlertType alertType() {
        return alertType;
    }

    public double percentOf(AppProperties.MonitorConfig config) {
        return switch (this) {
            case WARNING -> config.getWarningPercent();
            case CRITICAL -> config.getCriticalPercent();
            case EXHAUSTED -> config.getExhaustedPercent();
        };
    }
}
