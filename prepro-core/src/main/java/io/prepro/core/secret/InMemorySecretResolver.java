package io.prepro.core.secret;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

/// Map-backed {@link SecretResolver}.
///
/// Values are keyed by the reference key `kind:name[:vault]`. A reference with
/// a vault falls back to the vault-less key when no vault-specific value exists.
///
/// Properties files use the same keys, e.g.:
/// ```properties
/// secret\:db-password\:ops = hunter2
/// profile\:region = us-west-2
/// ```
///
/// @implNote Thread-safe. Uses {@link ConcurrentHashMap} for storage.
public class InMemorySecretResolver implements SecretResolver {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    /// Stores a value for the given reference, replacing any previous value.
    ///
    /// @param reference the reference, not null
    /// @param value the value, not null
    /// @return this resolver for chaining, never null
    public InMemorySecretResolver put(SecretReference reference, String value) {
        values.put(reference.key(), value);
        return this;
    }

    /// Stores a value for a vault-less reference.
    ///
    /// @param kind reference kind, not null
    /// @param name value name, not blank
    /// @param value the value, not null
    /// @return this resolver for chaining, never null
    public InMemorySecretResolver put(SecretKind kind, String name, String value) {
        return put(SecretReference.of(kind, name), value);
    }

    /// Loads all entries of a properties file.
    ///
    /// @param path properties file, not null
    /// @return a new resolver, never null
    /// @throws IOException if the file cannot be read
    public static InMemorySecretResolver fromProperties(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        }
    }

    /// Copies all entries of the given properties.
    ///
    /// @param properties keys of the form `kind:name[:vault]`, not null
    /// @return a new resolver, never null
    public static InMemorySecretResolver fromProperties(Properties properties) {
        InMemorySecretResolver resolver = new InMemorySecretResolver();
        for (String key : properties.stringPropertyNames()) {
            resolver.values.put(key, properties.getProperty(key));
        }
        return resolver;
    }

    @Override
    public String resolve(SecretReference reference) throws SecretNotFoundException {
        String value = values.get(reference.key());
        if (value == null && reference.vault() != null) {
            value = values.get(SecretReference.of(reference.kind(), reference.name()).key());
        }
        if (value == null) {
            throw new SecretNotFoundException("Not found: " + reference.key());
        }
        return value;
    }

    /// Returns the number of stored values.
    ///
    /// @return value count, always non-negative
    public int size() {
        return values.size();
    }
}
