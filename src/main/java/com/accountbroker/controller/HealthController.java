package com.accountbroker.controller;

import com.accountbroker.monitor.QuotaMonitor;
import com.accountbroker.pool.AccountPool;
import com.alibaba.fastjson2.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 健康检查端点
 */
@RestController
public class HealthController {

    private final AccountPool accountPool;
    private final QuotaMonitor quotaMonitor;

    public HealthController(AccountPool accountPool, QuotaMonitor quotaMonitor) {
        this.accountPool = accountPool;
        this.quotaMonitor = quotaMonitor;
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> health() {
        AccountPool.PoolStats stats = accountPool.getStats();
        JSONObject result = new JSONObject();
        result.put("status", stats.active() > stats.circuitOpen() ? "ok" : "degraded");
        result.put("version", "1.0.0");
        result.put("strategy", accountPool.strategyName());
        JSONObject accounts = new JSONObject();
        accounts.put("total", stats.total());
        accounts.put("active", stats.active());
        accounts.put("disabled", stats.disabled());
        accounts.put("exhausted", stats.exhausted());
        accounts.put("circuitOpen", stats.circuitOpen());
        result.put("accounts", accounts);
        result.put("quotaMonitor", quotaMonitor.isRunning() ? "running" : "stopped");
        return Mono.just(result.toJSONString());
    }
}
