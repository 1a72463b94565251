package io.prepro.core;

import io.prepro.core.directive.Directive;
import io.prepro.core.directive.DirectiveInterpreter;
import io.prepro.core.directive.DirectiveParser;
import io.prepro.core.format.LineFormatter;
import io.prepro.core.source.LineSource;
import io.prepro.core.variable.SymbolTable;
import io.prepro.core.variable.VariableExpander;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.CharBuffer;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/// Preprocesses line-oriented text by interpreting directives, expanding
/// variables, handling comments and reformatting lines.
///
/// ### Directives
/// A directive is a line whose first non-whitespace character is the statement
/// marker (`#` by default) immediately followed by a keyword:
///
/// | Directive                 | Effect |
/// |---------------------------|--------|
/// | `#define NAME[=VALUE]`    | Defines a variable; the value defaults to the empty string and is expanded when referenced |
/// | `#if A == B`, `#if A != B`| Compares the expanded, trimmed operands |
/// | `#if defined(NAME)`, `#if undefined(NAME)` | Tests whether a variable is defined |
/// | `#else`, `#endif`         | Alternative branch and end of an `#if` block |
/// | `#switch VALUE`           | Opens a switch on the expanded value |
/// | `#case VALUE`             | Lines up to the next clause are emitted for the first matching case |
/// | `#default`                | Lines up to `#endswitch` are emitted when no case matched; must be last |
/// | `#endswitch`              | Ends a switch block |
///
/// Blocks nest freely. A line is emitted only when every enclosing block has
/// its current branch selected.
///
/// ### Variables
/// `$<name>` references a variable set with {@link #set(String, String)} or
/// `#define`, `$<<NAME>>` an environment variable and
/// `$<<<kind:name[:vault]>>>` a secret, password or profile value. See
/// {@link io.prepro.core.variable.VariableStyle} for the alternate bracket styles.
///
/// ### Output
/// Directive lines and lines inside unselected branches are returned as empty
/// lines by default so that output line numbers match the input. Comments,
/// blank lines, tabs and indentation are handled as configured in
/// {@link PreprocessorConfig}.
///
/// ### Usage
/// {@snippet :
/// try (var reader = new PreprocessReader(template, PreprocessorConfig.builder().removeBlank(true).build())) {
///     reader.set("region", "us-west-2");
///     String text = reader.readToEnd();
/// }
/// }
///
/// @apiNote Only line-level reads are supported. The character-level
/// {@link Reader} methods throw {@link UnsupportedOperationException}.
/// @implNote **Not thread-safe**. Calls on one instance, including async
/// calls, must not overlap. Processing is strictly sequential because a line
/// may depend on directives in earlier lines.
/// @see PreprocessorConfig
public class PreprocessReader extends Reader {

    private static final Logger logger = Logger.getLogger(PreprocessReader.class.getName());

    /// Outcome of processing one raw line.
    ///
    /// @param produced whether a value is ready for the caller
    /// @param line the output line, null for end of input
    private record Step(boolean produced, String line) {
        static final Step DROPPED = new Step(false, null);
        static final Step END = new Step(true, null);

        static Step of(String line) {
            return new Step(true, line);
        }
    }

    private final LineSource source;
    private final PreprocessorConfig config;
    private final SymbolTable symbols = new SymbolTable();
    private final VariableExpander expander;
    private final DirectiveParser parser;
    private final DirectiveInterpreter interpreter;
    private final LineFormatter formatter;
    private int lineNumber;
    private boolean ended;

    /// Creates a reader over a line source.
    ///
    /// @param source the input, not null; owned and closed by this reader
    /// @param config processing options, not null
    /// @param variables initial variables, may be null
    /// @throws IllegalArgumentException if a variable name is invalid
    public PreprocessReader(LineSource source, PreprocessorConfig config, Map<String, String> variables) {
        this.source = Objects.requireNonNull(source, "source");
        this.config = Objects.requireNonNull(config, "config");
        this.expander = new VariableExpander(config, symbols);
        this.parser = new DirectiveParser(config.getStatementMarker());
        this.interpreter = new DirectiveInterpreter(config.getStatementMarker(), symbols, expander);
        this.formatter = new LineFormatter(config);

        if (variables != null) {
            variables.forEach(symbols::set);
        }
    }

    public PreprocessReader(LineSource source, PreprocessorConfig config) {
        this(source, config, null);
    }

    /// Creates a reader over a {@link Reader}.
    ///
    /// Async reads run the underlying I/O on the calling thread. Use
    /// {@link #PreprocessReader(Reader, Executor, PreprocessorConfig)} to keep
    /// blocking reads off the caller.
    ///
    /// @param reader the input, not null; closed with this reader
    /// @param config processing options, not null
    public PreprocessReader(Reader reader, PreprocessorConfig config) {
        this(LineSource.of(reader), config, null);
    }

    /// Creates a reader over a {@link Reader} whose async reads run the
    /// blocking I/O on an executor.
    ///
    /// @param reader the input, not null; closed with this reader
    /// @param executor runs the reads behind {@link #readLineAsync()}, not null
    /// @param config processing options, not null
    public PreprocessReader(Reader reader, Executor executor, PreprocessorConfig config) {
        this(LineSource.of(reader, executor), config, null);
    }

    public PreprocessReader(Reader reader) {
        this(LineSource.of(reader), PreprocessorConfig.defaults(), null);
    }

    public PreprocessReader(String input, PreprocessorConfig config, Map<String, String> variables) {
        this(LineSource.of(input), config, variables);
    }

    public PreprocessReader(String input, PreprocessorConfig config) {
        this(LineSource.of(input), config, null);
    }

    public PreprocessReader(String input) {
        this(LineSource.of(input), PreprocessorConfig.defaults(), null);
    }

    /// Creates a reader over UTF-8 encoded bytes.
    ///
    /// @param bytes the input, not null
    /// @param config processing options, not null
    public PreprocessReader(byte[] bytes, PreprocessorConfig config) {
        this(LineSource.of(bytes), config, null);
    }

    public PreprocessReader(byte[] bytes) {
        this(LineSource.of(bytes), PreprocessorConfig.defaults(), null);
    }

    /// Returns the options this reader was created with.
    ///
    /// @return the configuration, never null
    public PreprocessorConfig getConfig() {
        return config;
    }

    /// Returns the number of input lines consumed so far.
    ///
    /// @return 1-based number of the last line read, `0` before the first read
    public int getLineNumber() {
        return lineNumber;
    }

    /// Sets a variable, replacing any value set earlier or by `#define`.
    ///
    /// May be called before or between reads; the value is visible to all
    /// lines read afterwards.
    ///
    /// @param name case sensitive variable name, not null
    /// @param value the value; null is stored as the empty string
    /// @throws IllegalArgumentException if the name is not a legal variable name
    public void set(String name, String value) {
        symbols.set(name, value);
    }

    /// Sets a variable to `true` or `false`.
    ///
    /// @param name case sensitive variable name, not null
    /// @param value the value
    /// @throws IllegalArgumentException if the name is not a legal variable name
    public void set(String name, boolean value) {
        symbols.set(name, value);
    }

    /// Sets a variable to the string form of an object.
    ///
    /// @param name case sensitive variable name, not null
    /// @param value the value; null is stored as the empty string
    /// @throws IllegalArgumentException if the name is not a legal variable name
    public void set(String name, Object value) {
        symbols.set(name, value);
    }

    /// Returns the current value of a variable.
    ///
    /// @param name variable name, not null
    /// @return the unexpanded value, or empty if undefined
    public Optional<String> get(String name) {
        return symbols.get(name);
    }

    /// Reads the next output line.
    ///
    /// @return the line without terminator, or null at end of input
    /// @throws IOException if the underlying input fails
    /// @throws io.prepro.core.exception.PreprocessException if the line cannot be processed
    public String readLine() throws IOException {
        while (true) {
            Step step = process(ended ? null : source.readLine());
            if (step.produced()) {
                return step.line();
            }
        }
    }

    /// Reads the next output line without blocking on the underlying input.
    ///
    /// @return future completing with the line, or null at end of input. A
    ///         processing or I/O failure completes it exceptionally with the
    ///         unwrapped exception
    public CompletableFuture<String> readLineAsync() {
        CompletableFuture<String> result = new CompletableFuture<>();
        pump(result);
        return result;
    }

    /// Reads all remaining lines, each followed by the configured terminator.
    ///
    /// @return the remaining output, empty at end of input, never null
    /// @throws IOException if the underlying input fails
    /// @throws io.prepro.core.exception.PreprocessException if a line cannot be processed
    public String readToEnd() throws IOException {
        String terminator = config.getLineEnding().terminator();
        StringBuilder sb = new StringBuilder(1024);
        for (String line = readLine(); line != null; line = readLine()) {
            sb.append(line).append(terminator);
        }
        return sb.toString();
    }

    /// Reads all remaining lines without blocking on the underlying input.
    ///
    /// @return future completing with the remaining output
    /// @see #readToEnd()
    public CompletableFuture<String> readToEndAsync() {
        CompletableFuture<String> result = new CompletableFuture<>();
        drain(new StringBuilder(1024), config.getLineEnding().terminator(), result);
        return result;
    }

    /// Returns the remaining output lines as a lazy stream.
    ///
    /// The stream reads on demand, can be consumed only once and does not
    /// include terminators. I/O failures are thrown as {@link UncheckedIOException}.
    ///
    /// @return ordered stream of lines, never null
    public Stream<String> lines() {
        Iterator<String> iterator =
                new Iterator<>() {
                    private String next;

                    @Override
                    public boolean hasNext() {
                        if (next != null) {
                            return true;
                        }
                        try {
                            next = readLine();
                            return next != null;
                        } catch (IOException e) {
                            throw new UncheckedIOException(e);
                        }
                    }

                    @Override
                    public String next() {
                        if (!hasNext()) {
                            throw new NoSuchElementException();
                        }
                        String line = next;
                        next = null;
                        return line;
                    }
                };
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /// Closes the underlying line source.
    ///
    /// @throws IOException if closing the source fails
    @Override
    public void close() throws IOException {
        source.close();
    }

    /// Appends async reads to `sb` until end of input. Reads that complete
    /// immediately are handled in the loop, others resume from their callback,
    /// so the stack depth does not grow with the number of lines.
    private void drain(StringBuilder sb, String terminator, CompletableFuture<String> result) {
        while (true) {
            CompletableFuture<String> next = readLineAsync();
            if (!next.isDone()) {
                next.whenComplete(
                        (line, error) -> {
                            if (error != null) {
                                result.completeExceptionally(unwrap(error));
                            } else if (line == null) {
                                result.complete(sb.toString());
                            } else {
                                sb.append(line).append(terminator);
                                drain(sb, terminator, result);
                            }
                        });
                return;
            }

            String line;
            try {
                line = next.join();
            } catch (CompletionException e) {
                result.completeExceptionally(unwrap(e));
                return;
            }
            if (line == null) {
                result.complete(sb.toString());
                return;
            }
            sb.append(line).append(terminator);
        }
    }

    /// Drives async reads until a line is produced. Reads that complete
    /// immediately are handled in the loop, others resume from their callback.
    private void pump(CompletableFuture<String> result) {
        while (true) {
            CompletableFuture<String> next =
                    ended ? CompletableFuture.completedFuture(null) : source.readLineAsync();
            if (!next.isDone()) {
                next.whenComplete(
                        (raw, error) -> {
                            if (error != null) {
                                result.completeExceptionally(unwrap(error));
                            } else if (!offer(raw, result)) {
                                pump(result);
                            }
                        });
                return;
            }

            String raw;
            try {
                raw = next.join();
            } catch (CompletionException e) {
                result.completeExceptionally(unwrap(e));
                return;
            }
            if (offer(raw, result)) {
                return;
            }
        }
    }

    /// Processes a raw line on behalf of an async read.
    ///
    /// @return `true` if the result future was completed
    private boolean offer(String raw, CompletableFuture<String> result) {
        try {
            Step step = process(raw);
            if (step.produced()) {
                result.complete(step.line());
                return true;
            }
            return false;
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return true;
        }
    }

    private Step process(String raw) {
        if (raw == null) {
            if (!ended) {
                ended = true;
                interpreter.verifyClosed(lineNumber);
                logger.fine("End of input after " + lineNumber + " lines");
            }
            return Step.END;
        }

        lineNumber++;

        if (config.isProcessStatements()) {
            Optional<Directive> directive = parser.parse(raw);
            if (directive.isPresent()) {
                interpreter.execute(directive.get(), lineNumber);
                return suppressed();
            }
        }

        if (!interpreter.isActive()) {
            return suppressed();
        }

        String text = config.isExpandVariables() ? expander.expand(raw, lineNumber) : raw;
        return formatter.format(text).map(Step::of).orElse(Step.DROPPED);
    }

    private Step suppressed() {
        return config.isBlankSuppressedLines() && !config.isRemoveBlank() ? Step.of("") : Step.DROPPED;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause instanceof UncheckedIOException unchecked ? unchecked.getCause() : cause;
    }

    //---------------------------------------------------------------------
    // Character-level access is not supported.

    @Override
    public int read() {
        throw new UnsupportedOperationException("PreprocessReader supports line reads only.");
    }

    @Override
    public int read(char[] buffer) {
        throw new UnsupportedOperationException("PreprocessReader supports line reads only.");
    }

    @Override
    public int read(char[] buffer, int offset, int length) {
        throw new UnsupportedOperationException("PreprocessReader supports line reads only.");
    }

    @Override
    public int read(CharBuffer target) {
        throw new UnsupportedOperationException("PreprocessReader supports line reads only.");
    }

    @Override
    public long skip(long n) {
        throw new UnsupportedOperationException("PreprocessReader supports line reads only.");
    }

    @Override
    public boolean ready() {
        throw new UnsupportedOperationException("PreprocessReader supports line reads only.");
    }

    @Override
    public void mark(int readAheadLimit) {
        throw new UnsupportedOperationException("PreprocessReader supports line reads only.");
    }

    @Override
    public void reset() {
        throw new UnsupportedOperationException("PreprocessReader supports line reads only.");
    }
}
