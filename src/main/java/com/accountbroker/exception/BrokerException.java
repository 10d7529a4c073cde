package com.accountbroker.exception;

import lombok.Getter;

/**
 * Account Broker 异常基类
 */
@Getter
public class BrokerException extends RuntimeException {

    private final int statusCode;

    public BrokerException(String message) {
        super(message);
        this.statusCode = 500;
    }

    public BrokerException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 500;
    }

    public BrokerException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

}
