package io.prepro.core;

/// Line terminator appended by {@link PreprocessReader#readToEnd()}.
public enum LineEnding {

    /// Carriage return followed by line feed (`\r\n`).
    CRLF,

    /// Line feed only (`\n`).
    LF,

    /// The platform's {@link System#lineSeparator()}.
    PLATFORM;

    /// Returns the terminator characters.
    ///
    /// @return terminator, never null
    public String terminator() {
        return switch (this) {
            case CRLF -> "\r\n";
            case LF -> "\n";
            case PLATFORM -> System.lineSeparator();
        };
    }
}
