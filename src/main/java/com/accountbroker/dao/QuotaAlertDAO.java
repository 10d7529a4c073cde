package com.accountbroker.dao;

import com.accountbroker.monitor.QuotaAlert;
import com.accountbroker.monitor.QuotaThreshold;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 配额告警 DAO
 * <p>
 * (account_id, threshold_type) 上最多一条未解决告警，由条件插入和部分唯一索引共同保证。
 */
@Component
public class QuotaAlertDAO {

    private final JdbcTemplate jdbc;

    public QuotaAlertDAO(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * 不存在同类型未解决告警时插入
     *
     * @return true 新建，false 已存在
     */
    public boolean insertIfAbsent(QuotaAlert alert) {
        try {
            int inserted = jdbc.update("""
                            INSERT INTO quota_alerts (id, account_id, threshold_type, percentage, used, quota_limit, created_at, resolved_at)
                            SELECT ?, ?, ?, ?, ?, ?, ?, NULL
                            WHERE NOT EXISTS (
                                SELECT 1 FROM quota_alerts
                                WHERE account_id = ? AND threshold_type = ? AND resolved_at IS NULL
                            )
                            """,
                    alert.id(), alert.accountId(), alert.thresholdType().name(), alert.percentage(),
                    alert.used(), alert.limit(), alert.createdAt().toString(),
                    alert.accountId(), alert.thresholdType().name());
            return inserted > 0;
        } catch (DataAccessException e) {
            // 并发实例抢先插入时部分唯一索引拒绝, 其余错误照常抛出
            if (countOpen(alert.accountId(), alert.thresholdType()) > 0) {
                return false;
            }
            throw e;
        }
    }

    public Optional<QuotaAlert> findOpen(String accountId, QuotaThreshold type) {
        return jdbc.query(
                "SELECT * FROM quota_alerts WHERE account_id = ? AND threshold_type = ? AND resolved_at IS NULL",
                ALERT_ROW_MAPPER, accountId, type.name()).stream().findFirst();
    }

    /**
     * 解决指定类型的未解决告警
     *
     * @return 被解决的条数
     */
    public int resolve(String accountId, QuotaThreshold type, Instant resolvedAt) {
        return jdbc.update(
                "UPDATE quota_alerts SET resolved_at = ? WHERE account_id = ? AND threshold_type = ? AND resolved_at IS NULL",
                resolvedAt.toString(), accountId, type.name());
    }

    public List<QuotaAlert> findByAccount(String accountId, boolean unresolvedOnly) {
        String sql = unresolvedOnly
                ? "SELECT * FROM quota_alerts WHERE account_id = ? AND resolved_at IS NULL ORDER BY created_at DESC"
                : "SELECT * FROM quota_alerts WHERE account_id = ? ORDER BY created_at DESC";
        return jdbc.query(sql, ALERT_ROW_MAPPER, accountId);
    }

    public int countOpen(String accountId, QuotaThreshold type) {
        Integer count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM quota_alerts WHERE account_id = ? AND threshold_type = ? AND resolved_at IS NULL",
                Integer.class, accountId, type.name());
        return count != null ? count : 0;
    }

    private static final RowMapper<QuotaAlert> ALERT_ROW_MAPPER = (rs, rowNum) -> new QuotaAlert(
            rs.getString("id"), rs.getString("account_id"),
            QuotaThreshold.valueOf(rs.getString("threshold_type")),
            rs.getDouble("percentage"), rs.getLong("used"), rs.getLong("quota_limit"),
            Instant.parse(rs.getString("created_at")),
            rs.getString("resolved_at") != null ? Instant.parse(rs.getString("resolved_at")) : null
    );
}
