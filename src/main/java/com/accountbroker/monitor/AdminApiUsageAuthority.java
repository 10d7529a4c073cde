package com.accountbroker.monitor;

import com.accountbroker.config.AppProperties;
import com.accountbroker.exception.UsageSyncException;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * 通过管理 API 拉取账号用量
 * <p>
 * GET {base-url}/v1/usage?key_id=..&window_seconds=..，响应体 {"used": n, "limit": n}
 */
public class AdminApiUsageAuthority implements UsageAuthority {

    private static final Logger log = LoggerFactory.getLogger(AdminApiUsageAuthority.class);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    public AdminApiUsageAuthority(HttpClient httpClient, AppProperties.AdminApiConfig config) {
        this.httpClient = httpClient;
        String base = config.getBaseUrl() != null ? config.getBaseUrl().trim() : "";
        this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.apiKey = config.getApiKey();
        this.timeout = Duration.ofSeconds(Math.max(1, config.getTimeoutSeconds()));
    }

    @Override
    public UsageReport fetchUsage(String usageKeyId, Duration window) {
        if (baseUrl.isEmpty()) {
            throw new UsageSyncException("未配置用量 API 地址 broker.admin-api.base-url");
        }
        String url = baseUrl + "/v1/usage?key_id=" + URLEncoder.encode(usageKeyId, StandardCharsets.UTF_8)
                + "&window_seconds=" + window.toSeconds();

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        if (apiKey != null && !apiKey.isEmpty()) {
            builder.header("x-api-key", apiKey);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UsageSyncException("用量 API 请求失败: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UsageSyncException("用量 API 请求被中断", e);
        }

        if (response.statusCode() != 200) {
            log.warn("用量 API 返回异常: key={}, status={}, body={}", usageKeyId, response.statusCode(), response.body());
            throw new UsageSyncException("用量 API 返回 " + response.statusCode());
        }

        try {
            JSONObject json = JSONObject.parseObject(response.body());
            if (json == null || !json.containsKey("used") || !json.containsKey("limit")) {
                throw new UsageSyncException("用量 API 响应缺少 used/limit 字段");
            }
            long used = json.getLongValue("used");
            long limit = json.getLongValue("limit");
            log.debug("用量拉取成功: key={}, used={}, limit={}", usageKeyId, used, limit);
            return new UsageReport(used, limit);
        } catch (JSONException e) {
            throw new UsageSyncException("用量 API 响应解析失败: " + e.getMessage(), e);
        }
    }
}
