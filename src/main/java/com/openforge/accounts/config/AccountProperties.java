package com.openforge.accounts.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised account settings, read from application.yml under "accounts":
 *
 * accounts:
 *   env: dev
 *   store: jpa                  # jpa | memory
 *   password:
 *     bcrypt-strength: 10
 *   schema:
 *     auto-migrate: true
 *     reset-on-startup: false   # never honoured when env = prod
 *
 * The datasource itself is configured under spring.datasource and handed
 * to the store untouched.
 */
@ConfigurationProperties(prefix = "accounts")
public record AccountProperties(
        @DefaultValue("dev") String env,
        @DefaultValue("jpa") String store,
        @DefaultValue Password password,
        @DefaultValue Schema schema
) {

    public boolean isProd() {
        return "prod".equals(env);
    }

    public record Password(
            @DefaultValue("10") int bcryptStrength
    ) {}

    public record Schema(
            @DefaultValue("true") boolean autoMigrate,
            @DefaultValue("false") boolean resetOnStartup
    ) {}
}
