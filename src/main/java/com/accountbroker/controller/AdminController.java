package com.accountbroker.controller;

import com.accountbroker.capacity.CapacityMetric;
import com.accountbroker.capacity.MetricUsage;
import com.accountbroker.circuit.CircuitSnapshot;
import com.accountbroker.exception.AccountNotFoundException;
import com.accountbroker.exception.ConfigurationException;
import com.accountbroker.monitor.QuotaAlert;
import com.accountbroker.monitor.QuotaMonitor;
import com.accountbroker.pool.Account;
import com.accountbroker.pool.AccountHealth;
import com.accountbroker.pool.AccountPool;
import com.accountbroker.pool.RegisterAccountRequest;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;

/**
 * 运维 API：账号注册 / 注销、健康查看、熔断重置、配额告警与手动同步
 */
@RestController
@RequestMapping(value = "/admin/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class AdminController {

    private final AccountPool accountPool;
    private final QuotaMonitor quotaMonitor;

    public AdminController(AccountPool accountPool, QuotaMonitor quotaMonitor) {
        this.accountPool = accountPool;
        this.quotaMonitor = quotaMonitor;
    }

    // ==================== 账号管理 ====================

    @GetMapping("/accounts")
    public Mono<String> listAccounts() {
        JSONArray arr = new JSONArray();
        for (AccountHealth h : accountPool.listHealth()) {
            arr.add(toJson(h));
        }
        return Mono.just(arr.toJSONString());
    }

    @GetMapping("/accounts/{id}/health")
    public Mono<String> getHealth(@PathVariable String id) {
        return Mono.just(toJson(accountPool.getHealth(id)).toJSONString());
    }

    @PostMapping("/accounts")
    public Mono<String> registerAccount(@RequestBody String body) {
        JSONObject req = parseBody(body);
        RegisterAccountRequest request = new RegisterAccountRequest(
                req.getString("tenantId"),
                req.getString("name"),
                req.getString("tier"),
                req.getInteger("priority"),
                req.getString("credential"),
                req.getString("usageKeyId"),
                req.getLong("requestsPerMinute"),
                req.getLong("tokensPerMinute"),
                req.getLong("inputTokensPerMinute"));
        Account account = accountPool.registerAccount(request);
        return Mono.just(JSONObject.of("success", true, "id", account.id()).toJSONString());
    }

    @DeleteMapping("/accounts/{id}")
    public Mono<String> deregisterAccount(@PathVariable String id) {
        accountPool.deregisterAccount(id);
        return Mono.just(JSONObject.of("success", true, "status", "disabled").toJSONString());
    }

    @PostMapping("/accounts/{id}/enable")
    public Mono<String> enableAccount(@PathVariable String id) {
        accountPool.enableAccount(id);
        return Mono.just(JSONObject.of("success", true, "status", "active").toJSONString());
    }

    @PostMapping("/accounts/{id}/renew-quota")
    public Mono<String> renewQuota(@PathVariable String id) {
        boolean renewed = accountPool.renewQuota(id);
        return Mono.just(JSONObject.of("success", renewed).toJSONString());
    }

    @PostMapping("/accounts/{id}/reset-circuit")
    public Mono<String> resetCircuit(@PathVariable String id) {
        CircuitSnapshot snapshot = accountPool.resetCircuit(id);
        return Mono.just(JSONObject.of("success", true, "circuit", toJson(snapshot)).toJSONString());
    }

    // ==================== 配额 ====================

    @GetMapping("/accounts/{id}/alerts")
    public Mono<String> listAlerts(@PathVariable String id,
                                   @RequestParam(defaultValue = "false") boolean unresolvedOnly) {
        if (accountPool.getById(id).isEmpty()) {
            throw new AccountNotFoundException(id);
        }
        JSONArray arr = new JSONArray();
        for (QuotaAlert a : quotaMonitor.listAlerts(id, unresolvedOnly)) {
            JSONObject item = new JSONObject();
            item.put("id", a.id());
            item.put("thresholdType", a.thresholdType().name());
            item.put("percentage", a.percentage());
            item.put("used", a.used());
            item.put("limit", a.limit());
            item.put("createdAt", a.createdAt().toString());
            item.put("resolvedAt", iso(a.resolvedAt()));
            arr.add(item);
        }
        return Mono.just(arr.toJSONString());
    }

    @PostMapping("/accounts/{id}/sync")
    public Mono<String> syncAccount(@PathVariable String id) {
        QuotaMonitor.AccountSyncResult result = quotaMonitor.syncAccount(id);
        JSONObject json = new JSONObject();
        json.put("success", true);
        json.put("percentage", result.percentage());
        json.put("created", result.created().stream().map(Enum::name).toList());
        json.put("resolved", result.resolved());
        json.put("status", result.status().value());
        return Mono.just(json.toJSONString());
    }

    @PostMapping("/quota/sync")
    public Mono<String> syncAll() {
        QuotaMonitor.SyncSummary s = quotaMonitor.syncAll();
        JSONObject json = new JSONObject();
        json.put("checked", s.checked());
        json.put("synced", s.synced());
        json.put("failed", s.failed());
        json.put("alertsCreated", s.alertsCreated());
        json.put("alertsResolved", s.alertsResolved());
        return Mono.just(json.toJSONString());
    }

    // ==================== 策略 ====================

    @GetMapping("/strategy")
    public Mono<String> getStrategy() {
        return Mono.just(JSONObject.of("strategy", accountPool.strategyName()).toJSONString());
    }

    @PutMapping("/strategy")
    public Mono<String> setStrategy(@RequestBody String body) {
        accountPool.setStrategy(parseBody(body).getString("strategy"));
        return Mono.just(JSONObject.of("success", true, "strategy", accountPool.strategyName()).toJSONString());
    }

    // ==================== 内部方法 ====================

    private static JSONObject parseBody(String body) {
        JSONObject req = body == null || body.isBlank() ? null : JSONObject.parseObject(body);
        if (req == null) {
            throw new ConfigurationException("请求体不能为空");
        }
        return req;
    }

    private static JSONObject toJson(AccountHealth h) {
        JSONObject item = new JSONObject();
        item.put("id", h.accountId());
        item.put("tenantId", h.tenantId());
        item.put("name", h.name());
        item.put("tier", h.tier().value());
        item.put("priority", h.priority());
        item.put("status", h.status().value());
        item.put("circuit", toJson(h.circuit()));

        JSONObject capacity = new JSONObject();
        for (Map.Entry<CapacityMetric, MetricUsage> e : h.capacity().entrySet()) {
            MetricUsage u = e.getValue();
            capacity.put(e.getKey().key(), JSONObject.of( //
                    "used", u.used(), //
                    "limit", u.limit(), //
                    "remaining", u.remaining() //
            ));
        }
        item.put("capacity", capacity);
        item.put("capacityDegraded", h.capacityDegraded());
        item.put("lastFailureAt", iso(h.lastFailureAt()));
        item.put("lastFailureReason", h.lastFailureReason());
        item.put("lastSuccessAt", iso(h.lastSuccessAt()));
        return item;
    }

    private static JSONObject toJson(CircuitSnapshot c) {
        JSONObject json = new JSONObject();
        json.put("state", c.state().name());
        json.put("consecutiveFailures", c.consecutiveFailures());
        json.put("consecutiveSuccesses", c.consecutiveSuccesses());
        json.put("openedAt", iso(c.openedAt()));
        return json;
    }

    private static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
