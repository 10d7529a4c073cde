package com.accountbroker.exception;

/**
 * 共享计数 / 状态存储不可用
 * <p>
 * 调用方按 fail-open（容量）或 fail-safe CLOSED（熔断）处理，不向上抛
 */
public class StoreUnavailableException extends BrokerException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, 503, cause);
    }
}
