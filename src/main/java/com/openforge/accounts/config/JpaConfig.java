package com.openforge.accounts.config;

import com.openforge.accounts.repository.UserRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * JPA wiring for the relational store: repository scanning plus Spring Data
 * auditing so that @CreatedDate / @LastModifiedDate on User are populated.
 *
 * Only active with accounts.store=jpa (the default); the in-memory store
 * runs without a datasource.
 */
@Configuration
@EnableJpaAuditing
@EnableJpaRepositories(basePackageClasses = UserRepository.class)
@ConditionalOnProperty(prefix = "accounts", name = "store", havingValue = "jpa", matchIfMissing = true)
public class JpaConfig {
}
