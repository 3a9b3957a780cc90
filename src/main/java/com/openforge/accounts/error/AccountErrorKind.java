package com.openforge.accounts.error;

/**
 * Closed set of failure kinds raised by the account store and service.
 *
 * Expected kinds are conditions the caller can recover from (bad input,
 * missing record, wrong password). Everything else is a server-side failure.
 */
public enum AccountErrorKind {

    /** Structurally invalid input, e.g. a non-positive id. */
    INVALID_ARGUMENT(true),

    /** A lookup found no matching record. */
    NOT_FOUND(true),

    /** A uniqueness or integrity rule was violated by the store, e.g. duplicate email. */
    CONSTRAINT_VIOLATION(false),

    /** Password did not match the stored hash. */
    INVALID_CREDENTIALS(true),

    /** The password hashing primitive rejected otherwise valid input. */
    HASHING_ERROR(false),

    /** The entropy source could not produce random bytes. */
    RANDOM_SOURCE_ERROR(false),

    /** Any other persistence failure. */
    BACKEND_ERROR(false);

    private final boolean expected;

    AccountErrorKind(boolean expected) {
        this.expected = expected;
    }

    public boolean isExpected() {
        return expected;
    }
}
