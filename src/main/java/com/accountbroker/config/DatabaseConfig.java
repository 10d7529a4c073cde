package com.accountbroker.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * SQLite 数据库初始化（账号、熔断状态、配额告警三张表）
 */
@Component
public class DatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

    private final AppProperties properties;
    private final JdbcTemplate jdbc;

    public DatabaseConfig(AppProperties properties, JdbcTemplate jdbc) {
        this.properties = properties;
        this.jdbc = jdbc;
    }

    @PostConstruct
    public void init() {
        String dbPath = properties.getDatabase().getPath();
        Path parent = Path.of(dbPath).getParent();
        if (parent != null && !Files.exists(parent)) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new IllegalStateException("无法创建数据库目录: " + parent, e);
            }
        }

        applySchema(jdbc);
        log.info("SQLite 数据库初始化完成: {}", dbPath);
    }

    /**
     * 执行 classpath 下的 schema.sql，语句均为 IF NOT EXISTS，可重复执行
     */
    public static void applySchema(JdbcTemplate jdbc) {
        try (InputStream is = DatabaseConfig.class.getResourceAsStream("/schema.sql")) {
            if (is == null) {
                throw new IllegalStateException("未找到 schema.sql");
            }
            String sql = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            for (String s : sql.split(";")) {
                String trimmed = s.trim();
                if (!trimmed.isEmpty()) {
                    jdbc.execute(trimmed);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("初始化数据库 schema 失败", e);
        }
        migrate(jdbc);
    }

    /**
     * 数据库迁移（增量 schema 变更）
     */
    private static void migrate(JdbcTemplate jdbc) {
        // v2: 熔断状态条件写所需的 version，注销期间保留的配额耗尽标记
        addColumnIfMissing(jdbc, "circuit_states", "version", "INTEGER NOT NULL DEFAULT 0");
        addColumnIfMissing(jdbc, "accounts", "quota_exhausted", "INTEGER NOT NULL DEFAULT 0");
    }

    private static void addColumnIfMissing(JdbcTemplate jdbc, String table, String column, String type) {
        List<String> columns = jdbc.query("PRAGMA table_info(" + table + ")", (rs, rowNum) -> rs.getString("name"));
        if (!columns.contains(column)) {
            jdbc.execute("ALTER TABLE " + table + " ADD COLUMN " + column + " " + type);
            log.info("数据库迁移: {}.{} 列已添加", table, column);
        }
    }
}
