package io.prepro.core.secret;

import java.util.Locale;
import java.util.Optional;

/// Kind of value named by a triple-delimited reference such as
/// `$<<<secret:db-password:ops>>>`.
public enum SecretKind {

    /// A password stored in a vault.
    PASSWORD,

    /// A generic secret value stored in a vault.
    SECRET,

    /// A non-secret value from the user's profile.
    PROFILE;

    /// Returns the lower-case form used in references.
    ///
    /// @return reference token, never null
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Parses a reference token, ignoring case.
    ///
    /// @param token the token, e.g. `password`, not null
    /// @return the matching kind, or empty for an unknown token
    public static Optional<SecretKind> fromToken(String token) {
        for (SecretKind kind : values()) {
            if (kind.name().equalsIgnoreCase(token)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
