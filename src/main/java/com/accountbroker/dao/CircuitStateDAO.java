package com.accountbroker.dao;

import com.accountbroker.circuit.CircuitSnapshot;
import com.accountbroker.circuit.CircuitState;
import com.accountbroker.exception.StoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 熔断状态 DAO
 * <p>
 * 多个实例共享同一张表，每行带 version，写入只通过 {@link #insertIfAbsent} 与 {@link #compareAndSet} 条件更新。
 * 存储异常统一转为 {@link StoreUnavailableException}
 */
@Component
public class CircuitStateDAO {

    private final JdbcTemplate jdbc;

    public CircuitStateDAO(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<StoredCircuit> find(String accountId) {
        try {
            List<StoredCircuit> rows = jdbc.query(
                    "SELECT * FROM circuit_states WHERE account_id = ?", CIRCUIT_ROW_MAPPER, accountId);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("读取熔断状态失败: " + accountId, e);
        }
    }

    /**
     * 首次写入，行已存在时不做任何修改
     *
     * @return true 本次插入成功
     */
    public boolean insertIfAbsent(String accountId, CircuitSnapshot snapshot, Instant updatedAt) {
        try {
            int n = jdbc.update("""
                            INSERT INTO circuit_states (account_id, state, consecutive_failures, consecutive_successes,
                                opened_at, version, updated_at)
                            VALUES (?, ?, ?, ?, ?, 0, ?)
                            ON CONFLICT(account_id) DO NOTHING
                            """,
                    accountId, snapshot.state().name(), snapshot.consecutiveFailures(),
                    snapshot.consecutiveSuccesses(), toText(snapshot.openedAt()), updatedAt.toString());
            return n == 1;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("写入熔断状态失败: " + accountId, e);
        }
    }

    /**
     * 仅当库中 version 仍为 expectedVersion 时写入，并将 version 加一
     *
     * @return false 其他实例已先行修改
     */
    public boolean compareAndSet(String accountId, CircuitSnapshot snapshot, long expectedVersion, Instant updatedAt) {
        try {
            int n = jdbc.update("""
                            UPDATE circuit_states
                            SET state = ?, consecutive_failures = ?, consecutive_successes = ?, opened_at = ?,
                                version = version + 1, updated_at = ?
                            WHERE account_id = ? AND version = ?
                            """,
                    snapshot.state().name(), snapshot.consecutiveFailures(), snapshot.consecutiveSuccesses(),
                    toText(snapshot.openedAt()), updatedAt.toString(), accountId, expectedVersion);
            return n == 1;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("写入熔断状态失败: " + accountId, e);
        }
    }

    private static String toText(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private static final RowMapper<StoredCircuit> CIRCUIT_ROW_MAPPER = (rs, rowNum) -> new StoredCircuit(
            new CircuitSnapshot(
                    CircuitState.valueOf(rs.getString("state")),
                    rs.getInt("consecutive_failures"),
                    rs.getInt("consecutive_successes"),
                    rs.getString("opened_at") != null ? Instant.parse(rs.getString("opened_at")) : null),
            rs.getLong("version")
    );

    public record StoredCircuit(CircuitSnapshot snapshot, long version) {}
}
