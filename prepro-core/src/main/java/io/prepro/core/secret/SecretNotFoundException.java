package io.prepro.core.secret;

import java.io.Serial;

/// Reported by a {@link SecretResolver} when the referenced value does not exist.
public class SecretNotFoundException extends Exception {

    @Serial private static final long serialVersionUID = -8021558815436625460L;

    public SecretNotFoundException(String message) {
        super(message);
    }
}
