package com.accountbroker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 应用配置属性绑定
 * <p>
 * 熔断阈值、配额阈值、冷却时间等均为配置项，便于按租户 / 档位调优
 */
@Data
@Component
@ConfigurationProperties(prefix = "broker")
public class AppProperties {

    private String poolStrategy = "least-loaded";
    private DatabaseConfig database = new DatabaseConfig();
    private CryptoConfig crypto = new CryptoConfig();
    private CapacityConfig capacity = new CapacityConfig();
    private SelectionConfig selection = new SelectionConfig();
    private CircuitConfig circuit = new CircuitConfig();
    private MonitorConfig monitor = new MonitorConfig();
    private AdminApiConfig adminApi = new AdminApiConfig();
    private AlertConfig alert = new AlertConfig();
    private LoggingConfig logging = new LoggingConfig();

    // --- 嵌套配置类 ---

    @Data
    public static class DatabaseConfig {
        private String path = "data/broker.db";
    }

    @Data
    public static class CryptoConfig {
        // Base64 编码的 32 字节 AES-256 主密钥
        private String masterKey = "";
    }

    @Data
    public static class CapacityConfig {
        // memory | redis
        private String store = "memory";
        private String keyPrefix = "broker:";
        private long bucketMillis = 1000;
        private int windowSeconds = 60;
        private double cacheReadDiscount = 0.1;
        // 计数存储不可用时放行（true）或拒绝（false）
        private boolean failOpen = true;
    }

    @Data
    public static class SelectionConfig {
        // capacity-aware 策略的剩余容量下限
        private double capacityFloor = 0.1;
    }

    @Data
    public static class CircuitConfig {
        private int failureThreshold = 5;
        private int recoveryTimeoutSeconds = 60;
        private int halfOpenSuccessThreshold = 3;
    }

    @Data
    public static class MonitorConfig {
        private boolean enabled = true;
        private int intervalSeconds = 60;
        private int usageWindowSeconds = 3600;
        private double warningPercent = 80;
        private double criticalPercent = 95;
        private double exhaustedPercent = 100;
    }

    @Data
    public static class AdminApiConfig {
        private String baseUrl = "";
        private String apiKey = "";
        private int timeoutSeconds = 10;
    }

    @Data
    public static class AlertConfig {
        private String channel = "#eng-alerts";
        // 为空时 CRITICAL 以上告警也发到 channel
        private String escalationChannel = "";
        private String webhookUrl = "";
        private int quotaCooldownMinutes = 30;
        private int circuitCooldownMinutes = 5;
        private int exhaustedCooldownMinutes = 60;
    }

    @Data
    public static class LoggingConfig {
        private String filePath = "data/logs";
    }
}
