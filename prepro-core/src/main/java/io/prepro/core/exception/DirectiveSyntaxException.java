package io.prepro.core.exception;

import java.io.Serial;

/// Thrown for a malformed or structurally invalid directive.
///
/// Common causes:
/// - Bad `#define`, `#if` or `#switch` grammar
/// - `#else`, `#endif`, `#case`, `#default` or `#endswitch` without an open block
/// - Duplicate `#case` values or a `#case` after `#default`
/// - A block left open at end of input
public class DirectiveSyntaxException extends PreprocessException {

    @Serial private static final long serialVersionUID = -2790941245716388107L;

    public DirectiveSyntaxException(int lineNumber, String message) {
        super(lineNumber, message);
    }
}
