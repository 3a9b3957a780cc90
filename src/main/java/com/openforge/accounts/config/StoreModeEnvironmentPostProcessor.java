package com.openforge.accounts.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;
import org.springframework.util.StringUtils;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * With accounts.store=memory, switches off the datasource and JPA
 * auto-configuration so the application starts without a database.
 *
 * Exclusions the user already configured are kept.
 */
public class StoreModeEnvironmentPostProcessor implements EnvironmentPostProcessor {

    static final String EXCLUDE_PROPERTY = "spring.autoconfigure.exclude";

    static final List<String> JPA_AUTO_CONFIGURATIONS = List.of(
            "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
            "org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration",
            "org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration"
    );

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        if (!"memory".equals(environment.getProperty("accounts.store"))) {
            return;
        }
        Set<String> excludes = new LinkedHashSet<>();
        for (String configured : StringUtils.commaDelimitedListToStringArray(environment.getProperty(EXCLUDE_PROPERTY))) {
            if (StringUtils.hasText(configured)) {
                excludes.add(configured.trim());
            }
        }
        excludes.addAll(JPA_AUTO_CONFIGURATIONS);

        environment.getPropertySources().addFirst(new MapPropertySource("accountsMemoryStore",
                Map.of(EXCLUDE_PROPERTY, String.join(",", excludes))));
    }
}
