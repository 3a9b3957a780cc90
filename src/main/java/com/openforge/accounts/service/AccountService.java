package com.openforge.accounts.service;

import com.openforge.accounts.domain.User;
import com.openforge.accounts.error.AccountException;
import com.openforge.accounts.store.AccountStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Business layer over an {@link AccountStore}.
 *
 * Owns everything that touches a plaintext password: hashing on write and
 * the BCrypt comparison in {@link #authenticate(String, String)}. Every other
 * operation forwards to the store, so request handlers depend on this class
 * only. Errors classified by the store pass through unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    /** BCrypt only reads the first 72 bytes of its input; longer passwords are rejected. */
    static final int MAX_PASSWORD_BYTES = 72;

    private static final Pattern BCRYPT_HASH = Pattern.compile("\\A\\$2([ayb])?\\$(\\d\\d)\\$[./0-9A-Za-z]{53}");

    private final AccountStore    store;
    private final PasswordEncoder passwordEncoder;

    /**
     * Hashes {@code user.password}, clears it, and inserts the user.
     * id, createdAt and updatedAt are backfilled on the passed record.
     */
    public void create(User user) {
        if (user == null) {
            throw AccountException.invalidArgument("user must not be null");
        }
        hashPassword(user);
        store.create(user);
        log.info("[Accounts] New user created: id={}", user.getId());
    }

    public User byId(long id) {
        return store.byId(id);
    }

    public User byEmail(String email) {
        return store.byEmail(email);
    }

    /**
     * Saves name, email and password hash. A non-empty plaintext password on
     * the record is hashed and cleared first, the same way as on create.
     */
    public void update(User user) {
        if (user == null) {
            throw AccountException.invalidArgument("user must not be null");
        }
        if (user.getPassword() != null && !user.getPassword().isEmpty()) {
            hashPassword(user);
        }
        store.update(user);
    }

    public void delete(long id) {
        store.delete(id);
    }

    public void close() {
        store.close();
    }

    public void autoMigrate() {
        store.autoMigrate();
    }

    public void destructiveReset() {
        store.destructiveReset();
    }

    /**
     * Checks an email/password pair.
     *
     * Unknown email surfaces as NOT_FOUND, a wrong password as
     * INVALID_CREDENTIALS; the caller decides whether to tell them apart.
     * A stored hash that cannot be compared is a BACKEND_ERROR.
     */
    public User authenticate(String email, String password) {
        User found = store.byEmail(email);

        String hash = found.getPasswordHash();
        if (hash == null || !BCRYPT_HASH.matcher(hash).matches()) {
            throw AccountException.backendError("stored password hash for user " + found.getId() + " is malformed", null);
        }
        if (password == null || password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES) {
            log.warn("[Accounts] Authentication failed for user id={}", found.getId());
            throw AccountException.invalidCredentials();
        }

        boolean matches;
        try {
            matches = passwordEncoder.matches(password, hash);
        } catch (RuntimeException e) {
            throw AccountException.backendError("password comparison failed for user " + found.getId(), e);
        }
        if (!matches) {
            log.warn("[Accounts] Authentication failed for user id={}", found.getId());
            throw AccountException.invalidCredentials();
        }
        log.debug("[Accounts] Authenticated user id={}", found.getId());
        return found;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void hashPassword(User user) {
        String password = user.getPassword();
        if (password == null) {
            throw AccountException.hashingError("password must not be null", null);
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES) {
            throw AccountException.hashingError("password exceeds " + MAX_PASSWORD_BYTES + " bytes", null);
        }
        String hash;
        try {
            hash = passwordEncoder.encode(password);
        } catch (RuntimeException e) {
            throw AccountException.hashingError("password hashing failed", e);
        }
        user.setPasswordHash(hash);
        user.setPassword("");
    }
}
