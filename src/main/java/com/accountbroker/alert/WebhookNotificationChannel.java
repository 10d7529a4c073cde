package com.accountbroker.alert;

import com.accountbroker.exception.NotificationDeliveryException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Webhook 通知渠道（Slack incoming webhook 兼容的 JSON 负载）
 */
public class WebhookNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationChannel.class);

    private final HttpClient httpClient;
    private final URI webhookUri;

    public WebhookNotificationChannel(HttpClient httpClient, String webhookUrl) {
        this.httpClient = httpClient;
        this.webhookUri = URI.create(webhookUrl);
    }

    @Override
    public void send(String channel, String message, Severity severity) {
        JSONObject body = JSONObject.of(
                "channel", channel, //
                "text", message, //
                "severity", severity.name() //
        );
        HttpRequest request = HttpRequest.newBuilder(webhookUri)
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toJSONString(), StandardCharsets.UTF_8))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new NotificationDeliveryException(
                        "Webhook 返回非 2xx: status=" + response.statusCode() + ", body=" + response.body());
            }
            log.debug("Webhook 投递成功: channel={}, severity={}", channel, severity);
        } catch (IOException e) {
            throw new NotificationDeliveryException("Webhook 投递失败: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationDeliveryException("Webhook 投递被中断", e);
        }
    }
}
