package com.openforge.accounts.store;

import com.openforge.accounts.domain.User;

/**
 * Persistence contract for user records.
 *
 * Every backend classifies its own failures into
 * {@link com.openforge.accounts.error.AccountErrorKind} before they leave
 * the store; callers never see driver or ORM exceptions. Implementations
 * must be safe for concurrent use, except {@link #close()}, which is called
 * once at shutdown with no operation in flight.
 *
 * Records handed out by a store are detached copies. Changes to them are
 * persisted only through {@link #update(User)}.
 */
public interface AccountStore {

    /**
     * Inserts a new user and backfills id, createdAt and updatedAt on the
     * passed record.
     *
     * @throws com.openforge.accounts.error.AccountException
     *         CONSTRAINT_VIOLATION on duplicate email, INVALID_ARGUMENT when the
     *         record is incomplete, BACKEND_ERROR otherwise
     */
    void create(User user);

    /**
     * @throws com.openforge.accounts.error.AccountException
     *         INVALID_ARGUMENT if {@code id <= 0}, NOT_FOUND if absent
     */
    User byId(long id);

    /**
     * Looks up a user by email, using the same normalisation the store
     * applies when enforcing uniqueness.
     *
     * @throws com.openforge.accounts.error.AccountException NOT_FOUND if absent
     */
    User byEmail(String email);

    /**
     * Persists name, email and passwordHash of the given record, keyed by its id.
     *
     * @throws com.openforge.accounts.error.AccountException
     *         NOT_FOUND if the id no longer exists, CONSTRAINT_VIOLATION on
     *         duplicate email, BACKEND_ERROR otherwise
     */
    void update(User user);

    /**
     * Removes the user. Deleting an id that does not exist is not an error.
     *
     * @throws com.openforge.accounts.error.AccountException INVALID_ARGUMENT if {@code id <= 0}
     */
    void delete(long id);

    /** Releases held resources. Later calls fail with BACKEND_ERROR. */
    void close();

    /** Creates the users structure and its unique email index if missing. */
    void autoMigrate();

    /**
     * Drops the users structure and rebuilds it with {@link #autoMigrate()}.
     * Test and bootstrap environments only: all records are lost.
     */
    void destructiveReset();
}
