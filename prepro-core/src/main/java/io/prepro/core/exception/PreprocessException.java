package io.prepro.core.exception;

import java.io.Serial;

/// Base class for failures raised while preprocessing a document.
///
/// Carries the 1-based input line number that was being processed when the
/// failure occurred. The line number is `0` for failures that are not tied to
/// a specific line. {@link #getMessage()} prefixes the detail message with
/// `Line N: ` when a line number is known.
///
/// @see DirectiveSyntaxException
/// @see UndefinedVariableException
/// @see CyclicReferenceException
/// @see ProfileResolutionException
public class PreprocessException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4410253276130848561L;

    private final int lineNumber;

    /// Creates exception with a line number and message.
    ///
    /// @param lineNumber 1-based input line, or `0` when not line specific
    /// @param message description of the failure
    public PreprocessException(int lineNumber, String message) {
        super(message);
        this.lineNumber = lineNumber;
    }

    /// Creates exception with a line number, message and cause.
    ///
    /// @param lineNumber 1-based input line, or `0` when not line specific
    /// @param message description of the failure
    /// @param cause the underlying exception
    public PreprocessException(int lineNumber, String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = lineNumber;
    }

    /// Returns the input line that was being processed.
    ///
    /// @return 1-based line number, or `0` when not line specific
    public int getLineNumber() {
        return lineNumber;
    }

    /// Returns the detail message without the line prefix.
    ///
    /// @return raw message, may be null
    public String getDetail() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return lineNumber > 0 ? "Line " + lineNumber + ": " + super.getMessage() : super.getMessage();
    }
}
