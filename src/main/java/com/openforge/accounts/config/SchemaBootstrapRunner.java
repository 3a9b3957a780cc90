package com.openforge.accounts.config;

import com.openforge.accounts.service.AccountService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Brings the users schema up on startup.
 *
 *   accounts.schema.reset-on-startup=true  → destructiveReset (skipped in prod)
 *   accounts.schema.auto-migrate=true      → autoMigrate
 */
@Slf4j
@Order(0)
@Component
@RequiredArgsConstructor
public class SchemaBootstrapRunner implements ApplicationRunner {

    private final AccountService    accountService;
    private final AccountProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        AccountProperties.Schema schema = properties.schema();

        if (schema.resetOnStartup()) {
            if (properties.isProd()) {
                log.warn("[Schema] reset-on-startup ignored: env is prod");
            } else {
                log.warn("[Schema] Destructive reset requested, all users will be dropped");
                accountService.destructiveReset();
                return;
            }
        }
        if (schema.autoMigrate()) {
            accountService.autoMigrate();
        }
    }
}
