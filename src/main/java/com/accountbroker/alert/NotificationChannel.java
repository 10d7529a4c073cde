package com.accountbroker.alert;

import com.accountbroker.exception.NotificationDeliveryException;

/**
 * 通知渠道（外部协作方）
 */
public interface NotificationChannel {

    /**
     * 投递一条消息
     *
     * @param channel  目标频道
     * @param message  已格式化的正文
     * @param severity 告警级别
     * @throws NotificationDeliveryException 投递失败
     */
    void send(String channel, String message, Severity severity) throws NotificationDeliveryException;
}
