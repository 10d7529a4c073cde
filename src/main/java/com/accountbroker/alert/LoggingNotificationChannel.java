package com.accountbroker.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 未配置 webhook 时的默认渠道：只写日志
 */
public class LoggingNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationChannel.class);

    @Override
    public void send(String channel, String message, Severity severity) {
        if (severity.escalated()) {
            log.error("[{}] {} {}", channel, severity, message);
        } else {
            log.warn("[{}] {} {}", channel, severity, message);
        }
    }
}
