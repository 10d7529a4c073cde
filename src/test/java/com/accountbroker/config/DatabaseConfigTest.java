package com.accountbroker.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DatabaseConfigTest {

    private final SingleConnectionDataSource dataSource =
            new SingleConnectionDataSource("jdbc:sqlite::memory:", true);
    private final JdbcTemplate jdbc = new JdbcTemplate(dataSource);

    @AfterEach
    void tearDown() {
        dataSource.destroy();
    }

    private List<String> columnsOf(String table) {
        return jdbc.query("PRAGMA table_info(" + table + ")", (rs, rowNum) -> rs.getString("name"));
    }

    @Test
    void migratesTablesCreatedBeforeVersioning() {
        jdbc.execute("""
                CREATE TABLE circuit_states (
                    account_id TEXT PRIMARY KEY, state TEXT NOT NULL,
                    consecutive_failures INTEGER NOT NULL DEFAULT 0, consecutive_successes INTEGER NOT NULL DEFAULT 0,
                    opened_at TEXT, updated_at TEXT NOT NULL)""");
        jdbc.update("INSERT INTO circuit_states (account_id, state, updated_at) VALUES ('a', 'OPEN', '2026-03-01T10:00:00Z')");

        DatabaseConfig.applySchema(jdbc);

        assertThat(columnsOf("circuit_states")).contains("version");
        assertThat(columnsOf("accounts")).contains("quota_exhausted");
        assertThat(jdbc.queryForObject("SELECT version FROM circuit_states WHERE account_id = 'a'", Long.class))
                .isZero();
    }

    @Test
    void applyingTwiceIsHarmless() {
        DatabaseConfig.applySchema(jdbc);
        DatabaseConfig.applySchema(jdbc);

        assertThat(columnsOf("circuit_states")).containsOnlyOnce("version");
    }
}
