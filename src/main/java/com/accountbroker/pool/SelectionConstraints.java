package com.accountbroker.pool;

import java.util.Set;

/**
 * 选择约束
 *
 * @param allowedAccountIds 允许使用的账号白名单，null 表示不限
 * @param requiredTier      最低档位，null 表示不限
 * @param estimatedTokens   本次调用预估 token 数，参与容量检查
 */
public record SelectionConstraints(Set<String> allowedAccountIds, AccountTier requiredTier, long estimatedTokens) {

    private static final SelectionConstraints NONE = new SelectionConstraints(null, null, 0);

    public static SelectionConstraints none() {
        return NONE;
    }

    public static SelectionConstraints allowOnly(Set<String> accountIds) {
        return new SelectionConstraints(accountIds, null, 0);
    }

    public boolean permits(Account account) {
        if (allowedAccountIds != null && !allowedAccountIds.contains(account.id())) {
            return false;
        }
        return requiredTier == null || account.tier().atLeast(requiredTier);
    }
}
