package com.accountbroker.pool;

/**
 * 账号注册请求
 * <p>
 * 限额字段为 null 时使用档位默认值。
 */
public record RegisterAccountRequest(String tenantId, String name, String tier, Integer priority,
                                     String credential, String usageKeyId,
                                     Long requestsPerMinute, Long tokensPerMinute, Long inputTokensPerMinute) {

    public static RegisterAccountRequest of(String tenantId, String name, String tier, int priority, String credential) {
        return new RegisterAccountRequest(tenantId, name, tier, priority, credential, null, null, null, null);
    }

    public RegisterAccountRequest withUsageKeyId(String usageKeyId) {
        return new RegisterAccountRequest(tenantId, name, tier, priority, credential, usageKeyId,
                requestsPerMinute, tokensPerMinute, inputTokensPerMinute);
    }

    // 凭证不进入 toString
    @Override
    public String toString() {
        return "RegisterAccountRequest{tenantId=" + tenantId + ", name=" + name + ", tier=" + tier
                + ", priority=" + priority + ", usageKeyId=" + usageKeyId + "}";
    }
}
