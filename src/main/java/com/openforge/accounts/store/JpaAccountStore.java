package com.openforge.accounts.store;

import com.openforge.accounts.domain.User;
import com.openforge.accounts.error.AccountException;
import com.openforge.accounts.repository.UserRepository;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Relational {@link AccountStore} on Spring Data JPA.
 *
 * Email uniqueness is the {@code uk_users_email} constraint of the users
 * table; a violation comes back from the driver as a
 * {@link DataIntegrityViolationException} and is reported as
 * CONSTRAINT_VIOLATION. The schema is owned by the scripts under
 * {@code db/}, Hibernate's ddl-auto is off.
 *
 * Update and delete run in a {@link TransactionTemplate} so the closed
 * check comes before a connection is requested.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "accounts", name = "store", havingValue = "jpa", matchIfMissing = true)
public class JpaAccountStore implements AccountStore {

    static final String SCHEMA_SCRIPT = "db/users-schema.sql";
    static final String DROP_SCRIPT   = "db/users-drop.sql";

    private final UserRepository      userRepository;
    private final DataSource          dataSource;
    private final TransactionTemplate transactionTemplate;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public JpaAccountStore(UserRepository userRepository,
                           DataSource dataSource,
                           PlatformTransactionManager transactionManager) {
        this.userRepository      = userRepository;
        this.dataSource          = dataSource;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public void create(User user) {
        ensureOpen();
        StoreArguments.requireComplete(user);
        if (user.getId() != null) {
            throw AccountException.invalidArgument("new user must not carry an id, got " + user.getId());
        }
        user.setEmail(StoreArguments.normalizeEmail(user.getEmail()));
        if (user.getName() == null) {
            user.setName("");
        }
        try {
            userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            throw AccountException.constraintViolation("email address is already taken", e);
        } catch (DataAccessException | PersistenceException e) {
            throw AccountException.backendError("failed to create user", e);
        }
        log.info("[Store] Created user id={}", user.getId());
    }

    @Override
    public User byId(long id) {
        ensureOpen();
        StoreArguments.requireValidId(id);
        try {
            return userRepository.findById(id)
                    .orElseThrow(() -> AccountException.notFound("no user with id " + id));
        } catch (DataAccessException | PersistenceException e) {
            throw AccountException.backendError("failed to look up user " + id, e);
        }
    }

    @Override
    public User byEmail(String email) {
        ensureOpen();
        if (StoreArguments.isBlank(email)) {
            throw AccountException.notFound("no user with a blank email");
        }
        try {
            return userRepository.findByEmail(StoreArguments.normalizeEmail(email))
                    .orElseThrow(() -> AccountException.notFound("no user with the given email"));
        } catch (DataAccessException | PersistenceException e) {
            throw AccountException.backendError("failed to look up user by email", e);
        }
    }

    @Override
    public void update(User user) {
        ensureOpen();
        StoreArguments.requireComplete(user);
        if (user.getId() == null) {
            throw AccountException.invalidArgument("user to update has no id");
        }
        long id = user.getId();
        StoreArguments.requireValidId(id);
        try {
            transactionTemplate.executeWithoutResult(status -> {
                User existing = userRepository.findById(id)
                        .orElseThrow(() -> AccountException.notFound("no user with id " + id));
                existing.setName(user.getName() == null ? "" : user.getName());
                existing.setEmail(StoreArguments.normalizeEmail(user.getEmail()));
                existing.setPasswordHash(user.getPasswordHash());
                userRepository.saveAndFlush(existing);

                user.setEmail(existing.getEmail());
                user.setCreatedAt(existing.getCreatedAt());
                user.setUpdatedAt(existing.getUpdatedAt());
            });
        } catch (DataIntegrityViolationException e) {
            throw AccountException.constraintViolation("email address is already taken", e);
        } catch (DataAccessException | PersistenceException | TransactionException e) {
            throw AccountException.backendError("failed to update user " + id, e);
        }
        log.debug("[Store] Updated user id={}", id);
    }

    @Override
    public void delete(long id) {
        ensureOpen();
        StoreArguments.requireValidId(id);
        try {
            transactionTemplate.executeWithoutResult(status -> userRepository.deleteById(id));
        } catch (DataAccessException | PersistenceException | TransactionException e) {
            throw AccountException.backendError("failed to delete user " + id, e);
        }
        log.info("[Store] Deleted user id={}", id);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (dataSource instanceof Closeable closeable) {
            try {
                closeable.close();
            } catch (IOException e) {
                throw AccountException.backendError("failed to close data source", e);
            }
        }
        log.info("[Store] Closed");
    }

    @Override
    public void autoMigrate() {
        ensureOpen();
        runScript(SCHEMA_SCRIPT);
        log.info("[Schema] users table is up to date");
    }

    @Override
    public void destructiveReset() {
        ensureOpen();
        runScript(DROP_SCRIPT);
        log.warn("[Schema] users table dropped");
        autoMigrate();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void runScript(String path) {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(path));
        try {
            populator.execute(dataSource);
        } catch (DataAccessException e) {
            throw AccountException.backendError("failed to run " + path, e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw AccountException.backendError("account store is closed", null);
        }
    }
}
