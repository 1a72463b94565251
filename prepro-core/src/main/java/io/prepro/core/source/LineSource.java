package io.prepro.core.source;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/// Supplies raw input lines to the preprocessor.
///
/// Lines are returned without their terminator; `\n`, `\r\n` and `\r` are
/// all accepted. Both methods return null once the input is exhausted.
///
/// @see ReaderLineSource
public interface LineSource extends Closeable {

    /// Reads the next line, blocking until it is available.
    ///
    /// @return the line without terminator, or null at end of input
    /// @throws IOException if the underlying input fails
    String readLine() throws IOException;

    /// Reads the next line without blocking the caller.
    ///
    /// @return future completing with the line, or null at end of input; an
    ///         I/O failure completes it exceptionally
    CompletableFuture<String> readLineAsync();

    /// Creates a source over a string. Async reads complete immediately.
    ///
    /// @param text the input, not null
    /// @return a new source, never null
    static LineSource of(String text) {
        return new ReaderLineSource(new StringReader(text), Runnable::run);
    }

    /// Creates a source over UTF-8 encoded bytes.
    ///
    /// @param bytes the input, not null
    /// @return a new source, never null
    static LineSource of(byte[] bytes) {
        return of(new String(bytes, StandardCharsets.UTF_8));
    }

    /// Creates a source over a reader. Async reads run on the calling thread.
    ///
    /// @param reader the input, not null; closed with the source
    /// @return a new source, never null
    static LineSource of(Reader reader) {
        return new ReaderLineSource(reader, Runnable::run);
    }

    /// Creates a source over a reader whose async reads run on an executor.
    ///
    /// @param reader the input, not null; closed with the source
    /// @param executor runs the blocking reads behind {@link #readLineAsync()}, not null
    /// @return a new source, never null
    static LineSource of(Reader reader, Executor executor) {
        return new ReaderLineSource(reader, executor);
    }

    /// Wraps a reader in a {@link BufferedReader} unless it already is one.
    ///
    /// @param reader the reader, not null
    /// @return a buffered reader, never null
    static BufferedReader buffered(Reader reader) {
        return reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
    }
}
