package com.openforge.accounts.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Prints a structured startup summary after the schema bootstrap has run.
 *
 * Checks performed:
 *   - Database: opens a real JDBC connection and reads the server version
 *   - Accounts: env, store backend, BCrypt strength, schema flags
 */
@Slf4j
@Order(1)
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final ObjectProvider<DataSource> dataSource;
    private final AccountProperties          properties;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Accounts  —  Startup Summary                ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Runtime                                                 ║
                ║    Env            : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Store                                                   ║
                ║    Backend        : {}
                ║    Database       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Passwords                                               ║
                ║    BCrypt strength: {}
                ║    Auto-migrate   : {}   reset-on-startup: {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                properties.env(),
                System.getProperty("java.version"),

                properties.store(),
                checkDatabase(),

                properties.password().bcryptStrength(),
                properties.schema().autoMigrate(),
                properties.schema().resetOnStartup()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Opens a real JDBC connection and reads the DB server version.
     * Returns a one-line summary or error message.
     */
    private String checkDatabase() {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            return "(no datasource)";
        }
        try (Connection conn = ds.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String product = conn.getMetaData().getDatabaseProductName();
            String version = conn.getMetaData().getDatabaseProductVersion();
            // Strip credentials from the JDBC URL for safe logging
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ " + product + " " + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED — " + e.getMessage();
        }
    }
}
