package io.prepro.cli.commands;

import io.prepro.core.LineEnding;
import io.prepro.core.PreprocessReader;
import io.prepro.core.PreprocessorConfig;
import io.prepro.core.source.LineSource;
import io.prepro.core.secret.InMemorySecretResolver;
import io.prepro.core.variable.VariableStyle;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/// Base class for commands that run the preprocessor.
///
/// Owns the options shared by all commands and turns them into a
/// {@link PreprocessorConfig}. Subclasses implement {@link #execute()} and
/// report failures through {@link #fail(String)}, which sets exit code `1`.
/// Illegal option values are reported as usage errors (exit code `2`).
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see ProcessCommand
/// @see CheckCommand
public abstract class PreprocessCommand implements Runnable, CommandLine.IExitCodeGenerator {

    private static final Logger rootLogger = Logger.getLogger("io.prepro");

    @Spec protected CommandSpec spec;

    @Option(
            names = "-D",
            paramLabel = "NAME=VALUE",
            mapFallbackValue = "",
            description = "Defines a variable. May be repeated.")
    protected Map<String, String> variables = new LinkedHashMap<>();

    @Option(
            names = "--style",
            defaultValue = "ANGLE",
            description = "Variable reference style: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    protected VariableStyle style;

    @Option(
            names = "--marker",
            defaultValue = "#",
            description = "Statement marker character (default: ${DEFAULT-VALUE})")
    protected char marker;

    @Option(names = "--tab-stop", defaultValue = "0", description = "Expand tabs to this width; 0 keeps tabs")
    protected int tabStop;

    @Option(names = "--indent", defaultValue = "0", description = "Spaces prefixed to each non-blank line")
    protected int indent;

    @Option(
            names = "--line-ending",
            defaultValue = "PLATFORM",
            description = "Output line ending: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    protected LineEnding lineEnding;

    @Option(
            names = "--comment-marker",
            paramLabel = "MARKER",
            description = "Comment line prefix, replaces the default // . May be repeated.")
    protected List<String> commentMarkers;

    @Option(names = "--keep-comments", description = "Emit comment lines unchanged")
    protected boolean keepComments;

    @Option(names = "--remove-comments", description = "Drop comment lines from the output")
    protected boolean removeComments;

    @Option(names = "--remove-blank", description = "Drop blank lines from the output")
    protected boolean removeBlank;

    @Option(names = "--no-statements", description = "Pass directive lines through as text")
    protected boolean noStatements;

    @Option(names = "--no-expand", description = "Do not expand variable references")
    protected boolean noExpand;

    @Option(names = "--compact", description = "Drop directive and suppressed lines instead of blanking them")
    protected boolean compact;

    @Option(names = "--default-variable", description = "Value for undefined variable references")
    protected String defaultVariable;

    @Option(names = "--default-env", description = "Value for undefined environment variable references")
    protected String defaultEnvironmentVariable;

    @Option(
            names = "--secrets",
            paramLabel = "FILE",
            description = "Properties file with kind:name[:vault] = value entries")
    protected Path secretsFile;

    @Option(
            names = {"-v", "--verbose"},
            description = "Log directive processing")
    protected boolean verbose;

    private int exitCode;

    @Override
    public final void run() {
        if (verbose) {
            rootLogger.setLevel(Level.FINE);
        }
        execute();
    }

    protected abstract void execute();

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /// Reports a failure on stderr and sets exit code `1`.
    ///
    /// @param message failure description, not null
    protected void fail(String message) {
        System.err.println(" [FAIL] " + message);
        exitCode = 1;
    }

    /// Builds the engine configuration from the command options.
    ///
    /// @return configuration, never null
    /// @throws IOException if the secrets file cannot be read
    /// @throws CommandLine.ParameterException if an option value is illegal
    protected PreprocessorConfig buildConfig() throws IOException {
        PreprocessorConfig.Builder builder = PreprocessorConfig.builder();
        try {
            builder.statementMarker(marker)
                    .variableStyle(style)
                    .processStatements(!noStatements)
                    .expandVariables(!noExpand)
                    .stripComments(!keepComments)
                    .removeComments(removeComments)
                    .removeBlank(removeBlank)
                    .blankSuppressedLines(!compact)
                    .tabStop(tabStop)
                    .indent(indent)
                    .lineEnding(lineEnding)
                    .defaultVariable(defaultVariable)
                    .defaultEnvironmentVariable(defaultEnvironmentVariable);
            if (commentMarkers != null && !commentMarkers.isEmpty()) {
                builder.clearCommentMarkers();
                commentMarkers.forEach(builder::addCommentMarker);
            }
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        if (secretsFile != null) {
            builder.secretResolver(InMemorySecretResolver.fromProperties(secretsFile));
        }
        return builder.build();
    }

    /// Opens a reader over a file, or over stdin for null or `-`.
    ///
    /// @param input input file, may be null
    /// @param config engine configuration, not null
    /// @return reader with the `-D` variables set, never null
    /// @throws IOException if the file cannot be opened
    /// @throws CommandLine.ParameterException if a `-D` name is illegal
    protected PreprocessReader openReader(Path input, PreprocessorConfig config) throws IOException {
        Reader source =
                isStdin(input)
                        ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
                        : Files.newBufferedReader(input, StandardCharsets.UTF_8);
        try {
            return new PreprocessReader(LineSource.of(source), config, variables);
        } catch (IllegalArgumentException e) {
            source.close();
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    /// Returns a display name for the input.
    ///
    /// @param input input file, may be null
    /// @return file name, or `<stdin>`
    protected static String describe(Path input) {
        return isStdin(input) ? "<stdin>" : input.toString();
    }

    private static boolean isStdin(Path input) {
        return input == null || input.toString().equals("-");
    }
}
