package io.prepro.core.exception;

import java.io.Serial;

/// Thrown when a secret, password or profile reference cannot be resolved.
///
/// Wraps the resolver's {@link io.prepro.core.secret.SecretNotFoundException}
/// as the cause when one was reported.
public class ProfileResolutionException extends PreprocessException {

    @Serial private static final long serialVersionUID = 1857239011684207755L;

    public ProfileResolutionException(int lineNumber, String message) {
        super(lineNumber, message);
    }

    public ProfileResolutionException(int lineNumber, String message, Throwable cause) {
        super(lineNumber, message, cause);
    }
}
