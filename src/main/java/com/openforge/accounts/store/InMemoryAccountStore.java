package com.openforge.accounts.store;

import com.openforge.accounts.domain.User;
import com.openforge.accounts.error.AccountException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-backed {@link AccountStore} for tests and bootstrap environments.
 *
 * The id map and the unique email index are mutated together under one
 * write lock, so two concurrent creates with the same email cannot both
 * succeed. Records are copied on the way in and out.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "accounts", name = "store", havingValue = "memory")
public class InMemoryAccountStore implements AccountStore {

    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Long, User>   usersById  = new HashMap<>();
    private final Map<String, Long> idsByEmail = new HashMap<>();

    private long    nextId = 1;
    private boolean closed;

    public InMemoryAccountStore() {
        this(Clock.systemDefaultZone());
    }

    public InMemoryAccountStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void create(User user) {
        StoreArguments.requireComplete(user);
        if (user.getId() != null) {
            throw AccountException.invalidArgument("new user must not carry an id, got " + user.getId());
        }
        String email = StoreArguments.normalizeEmail(user.getEmail());

        lock.writeLock().lock();
        try {
            ensureOpen();
            if (idsByEmail.containsKey(email)) {
                throw AccountException.constraintViolation("email address is already taken", null);
            }
            LocalDateTime now = LocalDateTime.now(clock);
            user.setId(nextId++);
            user.setEmail(email);
            if (user.getName() == null) {
                user.setName("");
            }
            user.setCreatedAt(now);
            user.setUpdatedAt(now);

            usersById.put(user.getId(), copyOf(user));
            idsByEmail.put(email, user.getId());
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Store] Created user id={}", user.getId());
    }

    @Override
    public User byId(long id) {
        StoreArguments.requireValidId(id);
        lock.readLock().lock();
        try {
            ensureOpen();
            User found = usersById.get(id);
            if (found == null) {
                throw AccountException.notFound("no user with id " + id);
            }
            return copyOf(found);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public User byEmail(String email) {
        if (StoreArguments.isBlank(email)) {
            throw AccountException.notFound("no user with a blank email");
        }
        lock.readLock().lock();
        try {
            ensureOpen();
            Long id = idsByEmail.get(StoreArguments.normalizeEmail(email));
            if (id == null) {
                throw AccountException.notFound("no user with the given email");
            }
            return copyOf(usersById.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void update(User user) {
        StoreArguments.requireComplete(user);
        if (user.getId() == null) {
            throw AccountException.invalidArgument("user to update has no id");
        }
        long id = user.getId();
        StoreArguments.requireValidId(id);
        String email = StoreArguments.normalizeEmail(user.getEmail());

        lock.writeLock().lock();
        try {
            ensureOpen();
            User existing = usersById.get(id);
            if (existing == null) {
                throw AccountException.notFound("no user with id " + id);
            }
            Long owner = idsByEmail.get(email);
            if (owner != null && owner != id) {
                throw AccountException.constraintViolation("email address is already taken", null);
            }
            idsByEmail.remove(existing.getEmail());
            idsByEmail.put(email, id);

            user.setEmail(email);
            if (user.getName() == null) {
                user.setName("");
            }
            user.setCreatedAt(existing.getCreatedAt());
            user.setUpdatedAt(LocalDateTime.now(clock));
            usersById.put(id, copyOf(user));
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[Store] Updated user id={}", id);
    }

    @Override
    public void delete(long id) {
        StoreArguments.requireValidId(id);
        lock.writeLock().lock();
        try {
            ensureOpen();
            User removed = usersById.remove(id);
            if (removed != null) {
                idsByEmail.remove(removed.getEmail());
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Store] Deleted user id={}", id);
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            closed = true;
            usersById.clear();
            idsByEmail.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Store] Closed");
    }

    /** Nothing to create: the maps are the schema. */
    @Override
    public void autoMigrate() {
        lock.readLock().lock();
        try {
            ensureOpen();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void destructiveReset() {
        lock.writeLock().lock();
        try {
            ensureOpen();
            usersById.clear();
            idsByEmail.clear();
            nextId = 1;
        } finally {
            lock.writeLock().unlock();
        }
        log.warn("[Schema] in-memory users dropped");
        autoMigrate();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void ensureOpen() {
        if (closed) {
            throw AccountException.backendError("account store is closed", null);
        }
    }

    private static User copyOf(User source) {
        User copy = new User();
        copy.setId(source.getId());
        copy.setName(source.getName());
        copy.setEmail(source.getEmail());
        copy.setPasswordHash(source.getPasswordHash());
        copy.setCreatedAt(source.getCreatedAt());
        copy.setUpdatedAt(source.getUpdatedAt());
        return copy;
    }
}
