package com.accountbroker.config;

import com.accountbroker.alert.AlertDispatcher;
import com.accountbroker.alert.LoggingNotificationChannel;
import com.accountbroker.alert.NotificationChannel;
import com.accountbroker.alert.WebhookNotificationChannel;
import com.accountbroker.capacity.CapacityTracker;
import com.accountbroker.capacity.CounterStore;
import com.accountbroker.capacity.InMemoryCounterStore;
import com.accountbroker.capacity.RedisCounterStore;
import com.accountbroker.circuit.CircuitBreaker;
import com.accountbroker.crypto.CredentialCipher;
import com.accountbroker.dao.CircuitStateDAO;
import com.accountbroker.dao.QuotaAlertDAO;
import com.accountbroker.exception.ConfigurationException;
import com.accountbroker.monitor.AdminApiUsageAuthority;
import com.accountbroker.monitor.QuotaMonitor;
import com.accountbroker.monitor.UsageAuthority;
import com.accountbroker.pool.AccountPool;
import com.accountbroker.pool.AccountSelector;
import com.accountbroker.pool.strategy.CapacityAwareStrategy;
import com.accountbroker.pool.strategy.LeastLoadedStrategy;
import com.accountbroker.pool.strategy.PriorityWeightedStrategy;
import com.accountbroker.pool.strategy.RoundRobinStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;

/**
 * 核心组件装配
 * <p>
 * 组件本身不依赖 Spring 注解，测试中可以直接 new 出相互隔离的实例。
 */
@Configuration
public class BrokerConfig {

    private static final Logger log = LoggerFactory.getLogger(BrokerConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CounterStore counterStore(AppProperties properties, ObjectProvider<StringRedisTemplate> redisTemplate,
                                     Clock clock) {
        String store = properties.getCapacity().getStore();
        if ("redis".equalsIgnoreCase(store)) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null) {
                throw new ConfigurationException("broker.capacity.store=redis 但未配置 Redis 连接");
            }
            log.info("容量计数存储: Redis, keyPrefix={}", properties.getCapacity().getKeyPrefix());
            return new RedisCounterStore(template, properties.getCapacity().getKeyPrefix());
        }
        if (!"memory".equalsIgnoreCase(store)) {
            throw new ConfigurationException("未知的容量计数存储: " + store + ", 可选值 memory / redis");
        }
        log.info("容量计数存储: 内存（仅单实例）");
        return new InMemoryCounterStore(clock);
    }

    @Bean
    public CapacityTracker capacityTracker(CounterStore counterStore, AppProperties properties, Clock clock) {
        return new CapacityTracker(counterStore, properties.getCapacity(), clock);
    }

    @Bean
    public CircuitBreaker circuitBreaker(CircuitStateDAO circuitStateDAO, AppProperties properties, Clock clock) {
        return new CircuitBreaker(circuitStateDAO, properties.getCircuit(), clock);
    }

    @Bean
    public AccountSelector accountSelector(AppProperties properties) {
        return new AccountSelector(List.of(
                new RoundRobinStrategy(),
                new LeastLoadedStrategy(),
                new PriorityWeightedStrategy(),
                new CapacityAwareStrategy(properties.getSelection().getCapacityFloor())
        ));
    }

    @Bean
    public NotificationChannel notificationChannel(AppProperties properties, HttpClient httpClient) {
        String webhookUrl = properties.getAlert().getWebhookUrl();
        if (webhookUrl != null && !webhookUrl.isBlank()) {
            log.info("告警通道: Webhook");
            return new WebhookNotificationChannel(httpClient, webhookUrl);
        }
        log.info("告警通道: 日志（未配置 broker.alert.webhook-url）");
        return new LoggingNotificationChannel();
    }

    @Bean
    public AlertDispatcher alertDispatcher(NotificationChannel channel, AppProperties properties, Clock clock) {
        return new AlertDispatcher(channel, properties.getAlert(), clock);
    }

    @Bean
    public CredentialCipher credentialCipher(AppProperties properties) {
        return new CredentialCipher(properties.getCrypto().getMasterKey());
    }

    @Bean
    public UsageAuthority usageAuthority(HttpClient httpClient, AppProperties properties) {
        return new AdminApiUsageAuthority(httpClient, properties.getAdminApi());
    }

    @Bean
    public ThreadPoolTaskScheduler brokerTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("broker-monitor-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public QuotaMonitor quotaMonitor(AccountPool pool, QuotaAlertDAO quotaAlertDAO, UsageAuthority usageAuthority,
                                     AlertDispatcher alertDispatcher, ThreadPoolTaskScheduler brokerTaskScheduler,
                                     AppProperties properties, Clock clock) {
        return new QuotaMonitor(pool, quotaAlertDAO, usageAuthority, alertDispatcher, brokerTaskScheduler,
                properties.getMonitor(), clock);
    }
}
