package io.prepro.core.exception;

import java.io.Serial;

/// Thrown when a variable or environment variable reference has no value and
/// no default value is configured.
public class UndefinedVariableException extends PreprocessException {

    @Serial private static final long serialVersionUID = 7391658017263441380L;

    private final String reference;

    /// Creates exception for an unresolved reference.
    ///
    /// @param lineNumber 1-based input line
    /// @param reference the reference text as written, e.g. `$<name>`
    /// @param message description of the failure
    public UndefinedVariableException(int lineNumber, String reference, String message) {
        super(lineNumber, message);
        this.reference = reference;
    }

    /// Returns the reference text as it appeared in the source.
    ///
    /// @return reference text, never null
    public String getReference() {
        return reference;
    }
}
