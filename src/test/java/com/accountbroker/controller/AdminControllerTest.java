package com.accountbroker.controller;

import com.accountbroker.exception.GlobalExceptionHandler;
import com.accountbroker.monitor.QuotaMonitor;
import com.accountbroker.monitor.UsageReport;
import com.accountbroker.pool.Account;
import com.accountbroker.pool.RegisterAccountRequest;
import com.accountbroker.support.BrokerFixture;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class AdminControllerTest {

    private BrokerFixture broker;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        broker = new BrokerFixture("least-loaded");
        QuotaMonitor monitor = new QuotaMonitor(broker.pool, broker.quotaAlertDAO,
                (keyId, window) -> new UsageReport(960, 1_000), broker.alertDispatcher,
                mock(TaskScheduler.class), broker.properties.getMonitor(), broker.clock);
        client = WebTestClient
                .bindToController(new AdminController(broker.pool, monitor), new HealthController(broker.pool, monitor))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        broker.close();
    }

    @Test
    void registerListAndDeregister() {
        String body = client.post().uri("/admin/api/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"tenantId": "org-1", "name": "main", "tier": "tier2",
                         "credential": "sk-ant-api03-controller", "usageKeyId": "key-main"}
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).returnResult().getResponseBody();
        String id = JSONObject.parseObject(body).getString("id");

        client.get().uri("/admin/api/accounts").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo(id)
                .jsonPath("$[0].tier").isEqualTo("tier2")
                .jsonPath("$[0].circuit.state").isEqualTo("CLOSED")
                .jsonPath("$[0].capacity.rpm.limit").isEqualTo(500);

        client.delete().uri("/admin/api/accounts/{id}", id).exchange()
                .expectStatus().isOk();
        client.get().uri("/admin/api/accounts/{id}/health", id).exchange()
                .expectBody().jsonPath("$.status").isEqualTo("disabled");
    }

    @Test
    void invalidRegistrationIsBadRequest() {
        client.post().uri("/admin/api/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"tenantId\": \"org-1\", \"name\": \"x\", \"tier\": \"tier1\", \"credential\": \"nope\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.error.type").isEqualTo("validation_error");
    }

    @Test
    void unknownAccountIsNotFound() {
        client.post().uri("/admin/api/accounts/missing/reset-circuit").exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.success").isEqualTo(false);
    }

    @Test
    void syncCreatesAlertsVisibleThroughApi() {
        Account a = broker.pool.registerAccount(RegisterAccountRequest
                .of("org-1", "a", "tier1", 100, "sk-ant-api03-sync").withUsageKeyId("key-a"));

        client.post().uri("/admin/api/accounts/{id}/sync", a.id()).exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.created.length()").isEqualTo(2);

        client.get().uri("/admin/api/accounts/{id}/alerts?unresolvedOnly=true", a.id()).exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.length()").isEqualTo(2);
    }

    @Test
    void strategyCanBeReadAndChanged() {
        client.put().uri("/admin/api/strategy")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"strategy\": \"capacity-aware\"}")
                .exchange()
                .expectStatus().isOk();
        assertThat(broker.pool.strategyName()).isEqualTo("capacity-aware");

        client.put().uri("/admin/api/strategy")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"strategy\": \"random\"}")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void healthSummarizesPool() {
        broker.register("org-1", "a", "tier1", 100);

        client.get().uri("/health").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ok")
                .jsonPath("$.accounts.total").isEqualTo(1)
                .jsonPath("$.strategy").isEqualTo("least-loaded")
                .jsonPath("$.quotaMonitor").isEqualTo("stopped");
    }
}
