package com.accountbroker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AccountBrokerApplication {

    private static final Logger log = LoggerFactory.getLogger(AccountBrokerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AccountBrokerApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("╔═══════════════════════════════════════════════════╗");
        log.info("║           Account Broker v1.0.0                   ║");
        log.info("║     Upstream Credential Pool & Quota Monitor      ║");
        log.info("╚═══════════════════════════════════════════════════╝");
        log.info("运维端点:");
        log.info("  GET    /admin/api/accounts");
        log.info("  POST   /admin/api/accounts");
        log.info("  POST   /admin/api/accounts/{id}/reset-circuit");
        log.info("  GET    /health");
    }
}
