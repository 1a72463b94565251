package io.prepro.core.secret;

import java.util.Objects;

/// A parsed secret, password or profile reference.
///
/// @param kind what is being referenced, not null
/// @param name the secret or profile value name, not blank
/// @param vault the vault holding the value, null when not specified
public record SecretReference(SecretKind kind, String name, String vault) {

    public SecretReference {
        Objects.requireNonNull(kind, "kind");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (vault != null && vault.isBlank()) {
            vault = null;
        }
    }

    /// Creates a reference without a vault.
    ///
    /// @param kind what is being referenced, not null
    /// @param name the value name, not blank
    /// @return new reference, never null
    public static SecretReference of(SecretKind kind, String name) {
        return new SecretReference(kind, name, null);
    }

    /// Returns the `kind:name[:vault]` form used inside references.
    ///
    /// @return key text, never null
    public String key() {
        return vault == null ? kind.token() + ":" + name : kind.token() + ":" + name + ":" + vault;
    }

    @Override
    public String toString() {
        return key();
    }
}
