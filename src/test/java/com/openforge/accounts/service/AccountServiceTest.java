package com.openforge.accounts.service;

import com.openforge.accounts.domain.User;
import com.openforge.accounts.error.AccountErrorKind;
import com.openforge.accounts.error.AccountException;
import com.openforge.accounts.store.InMemoryAccountStore;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AccountServiceTest {

    private InMemoryAccountStore store;
    private AccountService       accountService;

    @BeforeEach
    void setUp() {
        store = new InMemoryAccountStore();
        accountService = new AccountService(store, new BCryptPasswordEncoder(4));
    }

    @Test
    @DisplayName("create stores a BCrypt hash, clears the plaintext and assigns an id")
    void createHashesAndClearsPassword() {
        User user = new User("Ann", "ann@example.com", "correct horse");

        accountService.create(user);

        assertThat(user.getPassword()).isEmpty();
        assertThat(user.getPasswordHash()).startsWith("$2a$04$").doesNotContain("correct horse");
        assertThat(user.getId()).isPositive();

        User stored = accountService.byEmail("ann@example.com");
        assertThat(stored.getPassword()).isEmpty();
        assertThat(stored.getPasswordHash()).isEqualTo(user.getPasswordHash());
        assertThat(stored.getId()).isEqualTo(user.getId());
    }

    @Test
    @DisplayName("two users with the same password get different salted hashes")
    void hashesAreSalted() {
        User ann = new User("Ann", "ann@example.com", "same-password");
        User bob = new User("Bob", "bob@example.com", "same-password");

        accountService.create(ann);
        accountService.create(bob);

        assertThat(ann.getPasswordHash()).isNotEqualTo(bob.getPasswordHash());
    }

    @Test
    @DisplayName("authenticate distinguishes success, wrong password and unknown email")
    void authenticateOutcomes() {
        User user = new User("Ann", "ann@example.com", "correct horse");
        accountService.create(user);

        User authenticated = accountService.authenticate("ann@example.com", "correct horse");
        assertThat(authenticated.getId()).isEqualTo(user.getId());
        assertThat(authenticated.getName()).isEqualTo("Ann");

        assertKind(() -> accountService.authenticate("ann@example.com", "battery staple"),
                AccountErrorKind.INVALID_CREDENTIALS);
        assertKind(() -> accountService.authenticate("nobody@example.com", "correct horse"),
                AccountErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("authenticate treats a null or over-long candidate as a wrong password")
    void authenticateRejectsUnhashablePasswords() {
        accountService.create(new User("Ann", "ann@example.com", "correct horse"));

        assertKind(() -> accountService.authenticate("ann@example.com", null), AccountErrorKind.INVALID_CREDENTIALS);
        assertKind(() -> accountService.authenticate("ann@example.com", "x".repeat(100)),
                AccountErrorKind.INVALID_CREDENTIALS);
    }

    @Test
    @DisplayName("a malformed stored hash is a BACKEND_ERROR, not a credentials failure")
    void malformedHashIsBackendError() {
        User broken = new User("Ann", "ann@example.com", "");
        broken.setPasswordHash("not-a-bcrypt-hash");
        store.create(broken);

        assertKind(() -> accountService.authenticate("ann@example.com", "anything"), AccountErrorKind.BACKEND_ERROR);
    }

    @Test
    @DisplayName("passwords beyond 72 bytes or null fail with HASHING_ERROR and nothing is stored")
    void unhashablePasswordsOnCreate() {
        User tooLong = new User("Ann", "ann@example.com", "é".repeat(37));
        assertKind(() -> accountService.create(tooLong), AccountErrorKind.HASHING_ERROR);

        User noPassword = new User("Ann", "ann@example.com", null);
        assertKind(() -> accountService.create(noPassword), AccountErrorKind.HASHING_ERROR);

        assertKind(() -> accountService.byEmail("ann@example.com"), AccountErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("a failing encoder surfaces as HASHING_ERROR")
    void encoderFailureIsHashingError() {
        PasswordEncoder encoder = mock(PasswordEncoder.class);
        when(encoder.encode(anyString())).thenThrow(new IllegalStateException("encoder exploded"));
        AccountService failing = new AccountService(store, encoder);

        assertThatThrownBy(() -> failing.create(new User("Ann", "ann@example.com", "pw")))
                .isInstanceOf(AccountException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .extracting(e -> ((AccountException) e).getKind())
                .isEqualTo(AccountErrorKind.HASHING_ERROR);
    }

    @Test
    @DisplayName("a failing comparison surfaces as BACKEND_ERROR")
    void comparisonFailureIsBackendError() {
        accountService.create(new User("Ann", "ann@example.com", "correct horse"));
        PasswordEncoder encoder = mock(PasswordEncoder.class);
        when(encoder.matches(anyString(), anyString())).thenThrow(new IllegalArgumentException("bad salt"));
        AccountService failing = new AccountService(store, encoder);

        assertKind(() -> failing.authenticate("ann@example.com", "correct horse"), AccountErrorKind.BACKEND_ERROR);
    }

    @Test
    @DisplayName("duplicate email fails with CONSTRAINT_VIOLATION and leaves the first user intact")
    void duplicateEmail() {
        User first = new User("Ann", "ann@example.com", "first");
        accountService.create(first);

        assertKind(() -> accountService.create(new User("Impostor", "ann@example.com", "second")),
                AccountErrorKind.CONSTRAINT_VIOLATION);

        assertThat(accountService.byId(first.getId()).getName()).isEqualTo("Ann");
        assertThat(accountService.authenticate("ann@example.com", "first").getId()).isEqualTo(first.getId());
    }

    @Test
    @DisplayName("byId rejects 0 and negative ids")
    void byIdRejectsNonPositiveIds() {
        assertKind(() -> accountService.byId(0), AccountErrorKind.INVALID_ARGUMENT);
        assertKind(() -> accountService.byId(-5), AccountErrorKind.INVALID_ARGUMENT);
    }

    @Test
    @DisplayName("delete(0) is invalid; deleting an existing user makes it NOT_FOUND")
    void deleteSemantics() {
        assertKind(() -> accountService.delete(0), AccountErrorKind.INVALID_ARGUMENT);

        User user = new User("Ann", "ann@example.com", "pw");
        accountService.create(user);
        accountService.delete(user.getId());

        assertKind(() -> accountService.byId(user.getId()), AccountErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("renaming keeps the password hash untouched")
    void updateNameKeepsHash() {
        User user = new User("Ann", "ann@example.com", "pw");
        accountService.create(user);
        String originalHash = user.getPasswordHash();

        User fetched = accountService.byId(user.getId());
        fetched.setName("Annie");
        accountService.update(fetched);

        User reloaded = accountService.byId(user.getId());
        assertThat(reloaded.getName()).isEqualTo("Annie");
        assertThat(reloaded.getPasswordHash()).isEqualTo(originalHash);
    }

    @Test
    @DisplayName("a plaintext password on update is hashed and cleared before saving")
    void updateWithNewPassword() {
        User user = new User("Ann", "ann@example.com", "old-password");
        accountService.create(user);

        User fetched = accountService.byId(user.getId());
        fetched.setPassword("new-password");
        accountService.update(fetched);

        assertThat(fetched.getPassword()).isEmpty();
        assertKind(() -> accountService.authenticate("ann@example.com", "old-password"),
                AccountErrorKind.INVALID_CREDENTIALS);
        assertThat(accountService.authenticate("ann@example.com", "new-password").getId()).isEqualTo(user.getId());
    }

    @Test
    @DisplayName("null users are rejected up front")
    void nullUserIsInvalid() {
        assertKind(() -> accountService.create(null), AccountErrorKind.INVALID_ARGUMENT);
        assertKind(() -> accountService.update(null), AccountErrorKind.INVALID_ARGUMENT);
    }

    @Test
    @DisplayName("lifecycle calls reach the store")
    void lifecycleIsForwarded() {
        accountService.create(new User("Ann", "ann@example.com", "pw"));

        accountService.destructiveReset();
        assertKind(() -> accountService.byEmail("ann@example.com"), AccountErrorKind.NOT_FOUND);

        accountService.autoMigrate();
        accountService.close();
        assertKind(() -> accountService.byId(1), AccountErrorKind.BACKEND_ERROR);
    }

    @Test
    @DisplayName("only bad input, missing records and wrong passwords count as expected errors")
    void expectedKinds() {
        assertThat(AccountErrorKind.INVALID_ARGUMENT.isExpected()).isTrue();
        assertThat(AccountErrorKind.NOT_FOUND.isExpected()).isTrue();
        assertThat(AccountErrorKind.INVALID_CREDENTIALS.isExpected()).isTrue();
        assertThat(AccountErrorKind.CONSTRAINT_VIOLATION.isExpected()).isFalse();
        assertThat(AccountErrorKind.HASHING_ERROR.isExpected()).isFalse();
        assertThat(AccountErrorKind.RANDOM_SOURCE_ERROR.isExpected()).isFalse();
        assertThat(AccountErrorKind.BACKEND_ERROR.isExpected()).isFalse();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static void assertKind(ThrowingCallable call, AccountErrorKind kind) {
        assertThatThrownBy(call)
                .isInstanceOf(AccountException.class)
                .extracting(e -> ((AccountException) e).getKind())
                .isEqualTo(kind);
    }
}
