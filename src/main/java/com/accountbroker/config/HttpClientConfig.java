package com.accountbroker.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 出站 HttpClient 配置（用量 API、告警 Webhook 共用）
 */
@Configuration
public class HttpClientConfig {

    private static final Logger log = LoggerFactory.getLogger(HttpClientConfig.class);

    @Bean
    public HttpClient brokerHttpClient(AppProperties properties) {
        int timeout = Math.max(1, properties.getAdminApi().getTimeoutSeconds());
        log.info("HttpClient 初始化: connectTimeout={}s", timeout);
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(timeout))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }
}
