package com.openforge.accounts.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.security.SecureRandom;

/**
 * Core infrastructure beans:
 *  - SecureRandom     → entropy for remember tokens and BCrypt salts
 *  - PasswordEncoder  → BCrypt with the configured work factor
 */
@Configuration
public class AppConfig {

    /** Platform default CSPRNG; thread-safe and shared. */
    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    /**
     * BCrypt is deliberately slow and salts every hash. Strength 10 matches
     * the common default cost; raise it as hardware gets faster.
     */
    @Bean
    public PasswordEncoder passwordEncoder(AccountProperties properties, SecureRandom secureRandom) {
        return new BCryptPasswordEncoder(properties.password().bcryptStrength(), secureRandom);
    }
}
