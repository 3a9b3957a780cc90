package com.openforge.accounts.token;

import com.openforge.accounts.error.AccountException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Cryptographically strong random bytes and URL-safe tokens for
 * session / remember-me cookies.
 */
@Component
@RequiredArgsConstructor
public class RandomTokens {

    /** Byte length of remember tokens (256 bits). Not caller-configurable. */
    public static final int REMEMBER_TOKEN_BYTES = 32;

    private final SecureRandom secureRandom;

    /**
     * Returns {@code n} random bytes. Any failure of the entropy source
     * surfaces as RANDOM_SOURCE_ERROR; no partially filled buffer is returned.
     */
    public byte[] bytes(int n) {
        if (n < 0) {
            throw AccountException.invalidArgument("byte count must not be negative: " + n);
        }
        byte[] buf = new byte[n];
        try {
            secureRandom.nextBytes(buf);
        } catch (RuntimeException e) {
            throw AccountException.randomSourceError(e);
        }
        return buf;
    }

    /** URL-safe Base64 (padded) of {@code n} random bytes. */
    public String token(int n) {
        return Base64.getUrlEncoder().encodeToString(bytes(n));
    }

    public String rememberToken() {
        return token(REMEMBER_TOKEN_BYTES);
    }
}
