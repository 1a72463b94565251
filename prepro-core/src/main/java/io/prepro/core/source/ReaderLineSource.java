package io.prepro.core.source;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/// {@link LineSource} backed by a {@link Reader}.
///
/// Async reads run the blocking {@link BufferedReader#readLine()} on the
/// configured executor. With a direct executor (`Runnable::run`) they complete
/// before returning, which suits in-memory readers.
///
/// @implNote **Not thread-safe**. At most one read may be outstanding.
public class ReaderLineSource implements LineSource {

    private final BufferedReader reader;
    private final Executor executor;

    /// Creates a source.
    ///
    /// @param reader the input, not null; closed with the source
    /// @param executor runs async reads, not null
    public ReaderLineSource(Reader reader, Executor executor) {
        this.reader = LineSource.buffered(Objects.requireNonNull(reader, "reader"));
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public String readLine() throws IOException {
        return reader.readLine();
    }

    @Override
    public CompletableFuture<String> readLineAsync() {
        return CompletableFuture.supplyAsync(
                () -> {
                    try {
                        return reader.readLine();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                },
                executor);
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
