package io.prepro.core.secret;

/// Capability for resolving secret, password and profile references.
///
/// The preprocessor does not store or fetch secrets itself. Implementations
/// bridge to whatever vault or profile service the application uses and are
/// passed explicitly through
/// {@link io.prepro.core.PreprocessorConfig.Builder#secretResolver(SecretResolver)}.
///
/// ### Error contract
/// - {@link SecretNotFoundException} means the value does not exist; the
///   preprocessor reports it as a
///   {@link io.prepro.core.exception.ProfileResolutionException}
/// - Any runtime exception is propagated to the caller unchanged
///
/// @implNote Called synchronously from the reading thread, once per reference.
/// @see InMemorySecretResolver for a map-backed implementation
@FunctionalInterface
public interface SecretResolver {

    /// Resolves a reference to its value.
    ///
    /// @param reference the parsed reference, not null
    /// @return the value, never null
    /// @throws SecretNotFoundException if the value does not exist
    String resolve(SecretReference reference) throws SecretNotFoundException;

    /// Returns a resolver that reports every reference as not found.
    ///
    /// @return shared resolver instance, never null
    static SecretResolver none() {
        return reference -> {
            throw new SecretNotFoundException("No secret resolver configured for: " + reference);
        };
    }
}
