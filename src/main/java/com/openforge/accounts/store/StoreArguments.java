package com.openforge.accounts.store;

import com.openforge.accounts.domain.User;
import com.openforge.accounts.error.AccountException;

import java.util.Locale;

/**
 * Input checks and email normalisation shared by every backend, so both
 * classify bad input the same way and uniqueness agrees with lookup.
 */
final class StoreArguments {

    private StoreArguments() {
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    static boolean isBlank(String email) {
        return email == null || email.isBlank();
    }

    static void requireValidId(long id) {
        if (id <= 0) {
            throw AccountException.invalidArgument("id must be positive, got " + id);
        }
    }

    /** Checks a record about to be written: email and hash present. */
    static void requireComplete(User user) {
        if (user == null) {
            throw AccountException.invalidArgument("user must not be null");
        }
        if (isBlank(user.getEmail())) {
            throw AccountException.invalidArgument("email is required");
        }
        if (user.getPasswordHash() == null || user.getPasswordHash().isEmpty()) {
            throw AccountException.invalidArgument("password hash is required");
        }
    }
}
