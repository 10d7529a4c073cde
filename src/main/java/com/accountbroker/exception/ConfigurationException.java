package com.accountbroker.exception;

/**
 * 配置错误：凭证格式非法、未知档位、未知选择策略等，同步拒绝
 */
public class ConfigurationException extends BrokerException {

    public ConfigurationException(String message) {
        super(message, 400);
    }
}
