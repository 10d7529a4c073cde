package com.accountbroker.exception;

public class AccountNotFoundException extends BrokerException {

    public AccountNotFoundException(String accountId) {
        super("账号不存在: " + accountId, 404);
    }
}
