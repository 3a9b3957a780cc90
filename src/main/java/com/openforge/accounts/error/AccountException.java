package com.openforge.accounts.error;

/**
 * Single exception type for the account layer, classified by {@link AccountErrorKind}.
 *
 * Instances are created at the throw site through the static factories;
 * callers branch on {@link #getKind()} rather than on message text.
 */
public class AccountException extends RuntimeException {

    private final AccountErrorKind kind;

    public AccountException(AccountErrorKind kind, String message) {
        this(kind, message, null);
    }

    public AccountException(AccountErrorKind kind, String message, Throwable cause) {
        super("accounts: " + message, cause);
        this.kind = kind;
    }

    public AccountErrorKind getKind() {
        return kind;
    }

    public boolean is(AccountErrorKind other) {
        return kind == other;
    }

    public static AccountException invalidArgument(String message) {
        return new AccountException(AccountErrorKind.INVALID_ARGUMENT, message);
    }

    public static AccountException notFound(String message) {
        return new AccountException(AccountErrorKind.NOT_FOUND, message);
    }

    public static AccountException constraintViolation(String message, Throwable cause) {
        return new AccountException(AccountErrorKind.CONSTRAINT_VIOLATION, message, cause);
    }

    public static AccountException invalidCredentials() {
        return new AccountException(AccountErrorKind.INVALID_CREDENTIALS, "incorrect password provided");
    }

    public static AccountException hashingError(String message, Throwable cause) {
        return new AccountException(AccountErrorKind.HASHING_ERROR, message, cause);
    }

    public static AccountException randomSourceError(Throwable cause) {
        return new AccountException(AccountErrorKind.RANDOM_SOURCE_ERROR,
                "entropy source failed to produce random bytes", cause);
    }

    public static AccountException backendError(String message, Throwable cause) {
        return new AccountException(AccountErrorKind.BACKEND_ERROR, message, cause);
    }
}
