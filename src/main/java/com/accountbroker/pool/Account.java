package com.accountbroker.pool;

import com.accountbroker.capacity.CapacityLimits;

import java.time.Instant;

/**
 * 上游账号实体
 * <p>
 * 只持有加密后的凭证引用。身份、档位、限额不可变；状态与最近成功 / 失败时间可变。
 * quotaExhausted 独立于 status 记录配额是否耗尽，注销再启用不会清除它，只有配额续期才会。
 */
public class Account {

    private final String id;
    private final String tenantId;
    private final String name;
    private final AccountTier tier;
    private final int priority;
    private final String encryptedCredential;
    private final String usageKeyId;
    private final CapacityLimits limits;
    private final Instant createdAt;

    private volatile AccountStatus status;
    private volatile boolean quotaExhausted;
    private volatile Instant lastFailureAt;
    private volatile String lastFailureReason;
    private volatile Instant lastSuccessAt;

    public Account(String id, String tenantId, String name, AccountTier tier, int priority,
                   String encryptedCredential, String usageKeyId, CapacityLimits limits,
                   AccountStatus status, Instant createdAt) {
        this.id = id;
        this.tenantId = tenantId;
        this.name = name;
        this.tier = tier;
        this.priority = priority;
        this.encryptedCredential = encryptedCredential;
        this.usageKeyId = usageKeyId;
        this.limits = limits != null ? limits : tier.defaultLimits();
        this.status = status;
        this.createdAt = createdAt;
    }

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }

    void markSuccess(Instant at) {
        this.lastSuccessAt = at;
    }

    void markFailure(Instant at, String reason) {
        this.lastFailureAt = at;
        this.lastFailureReason = reason;
    }

    void restoreActivity(Instant lastSuccessAt, Instant lastFailureAt, String lastFailureReason) {
        this.lastSuccessAt = lastSuccessAt;
        this.lastFailureAt = lastFailureAt;
        this.lastFailureReason = lastFailureReason;
    }

    void setStatus(AccountStatus status, boolean quotaExhausted) {
        this.status = status;
        this.quotaExhausted = quotaExhausted;
    }

    // --- getter ---

    public String id() { return id; }
    public String tenantId() { return tenantId; }
    public String name() { return name; }
    public AccountTier tier() { return tier; }
    public int priority() { return priority; }
    public String encryptedCredential() { return encryptedCredential; }
    public String usageKeyId() { return usageKeyId; }
    public CapacityLimits limits() { return limits; }
    public Instant createdAt() { return createdAt; }
    public AccountStatus status() { return status; }
    public boolean quotaExhausted() { return quotaExhausted; }
    public Instant lastFailureAt() { return lastFailureAt; }
    public String lastFailureReason() { return lastFailureReason; }
    public Instant lastSuccessAt() { return lastSuccessAt; }

    @Override
    public String toString() {
        return "Account{id=" + id + ", tenant=" + tenantId + ", name=" + name + ", tier=" + tier.value()
                + ", priority=" + priority + ", status=" + status.value() + "}";
    }
}
