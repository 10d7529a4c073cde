package com.accountbroker.exception;

/**
 * 单个账号的配额同步失败，跳过并在下一轮重试
 */
public class UsageSyncException extends BrokerException {

    public UsageSyncException(String message) {
        super(message, 502);
    }

    public UsageSyncException(String message, Throwable cause) {
        super(message, 502, cause);
    }
}
