package com.accountbroker.dao;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 账号 DAO（凭证存储）
 * <p>
 * 只读写加密后的凭证；账号永不物理删除，注销只修改状态。
 */
@Component
public class AccountDAO {

    private final JdbcTemplate jdbc;

    public AccountDAO(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<AccountRow> findAll() {
        return jdbc.query("SELECT * FROM accounts ORDER BY created_at, rowid", ACCOUNT_ROW_MAPPER);
    }

    public Optional<AccountRow> findById(String id) {
        return jdbc.query("SELECT * FROM accounts WHERE id = ?", ACCOUNT_ROW_MAPPER, id).stream().findFirst();
    }

    public void insert(AccountRow row) {
        jdbc.update("""
                        INSERT INTO accounts (id, tenant_id, name, tier, priority, encrypted_credential, usage_key_id,
                            rpm_limit, tpm_limit, itpm_limit, status, created_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                row.id(), row.tenantId(), row.name(), row.tier(), row.priority(), row.encryptedCredential(),
                row.usageKeyId(), row.rpmLimit(), row.tpmLimit(), row.itpmLimit(), row.status(),
                row.createdAt(), row.createdAt());
    }

    /**
     * 条件更新状态：仅当库中状态仍为 expectedStatus 时生效
     *
     * @return false 状态已被其他实例修改
     */
    public boolean updateStatus(String id, String expectedStatus, String status, boolean quotaExhausted,
                                String updatedAt) {
        int n = jdbc.update(
                "UPDATE accounts SET status = ?, quota_exhausted = ?, updated_at = ? WHERE id = ? AND status = ?",
                status, quotaExhausted ? 1 : 0, updatedAt, id, expectedStatus);
        return n == 1;
    }

    public void updateSuccess(String id, String lastSuccessAt) {
        jdbc.update(
                "UPDATE accounts SET last_success_at = ?, updated_at = ? WHERE id = ?",
                lastSuccessAt, lastSuccessAt, id);
    }

    public void updateFailure(String id, String lastFailureAt, String reason) {
        jdbc.update(
                "UPDATE accounts SET last_failure_at = ?, last_failure_reason = ?, updated_at = ? WHERE id = ?",
                lastFailureAt, reason, lastFailureAt, id);
    }

    private static final RowMapper<AccountRow> ACCOUNT_ROW_MAPPER = (rs, rowNum) -> new AccountRow(
            rs.getString("id"), rs.getString("tenant_id"), rs.getString("name"),
            rs.getString("tier"), rs.getInt("priority"),
            rs.getString("encrypted_credential"), rs.getString("usage_key_id"),
            rs.getLong("rpm_limit"), rs.getLong("tpm_limit"), rs.getLong("itpm_limit"),
            rs.getString("status"), rs.getInt("quota_exhausted") != 0,
            rs.getString("last_failure_at"), rs.getString("last_failure_reason"),
            rs.getString("last_success_at"), rs.getString("created_at")
    );

    public record AccountRow(String id, String tenantId, String name, String tier, int priority,
                             String encryptedCredential, String usageKeyId,
                             long rpmLimit, long tpmLimit, long itpmLimit, String status, boolean quotaExhausted,
                             String lastFailureAt, String lastFailureReason, String lastSuccessAt,
                             String createdAt) {}
}
