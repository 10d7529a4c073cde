package com.accountbroker.exception;

/**
 * 通知渠道投递失败，由告警分发器吞掉并记录日志
 */
public class NotificationDeliveryException extends BrokerException {

    public NotificationDeliveryException(String message) {
        super(message, 502);
    }

    public NotificationDeliveryException(String message, Throwable cause) {
        super(message, 502, cause);
    }
}
