package io.prepro.cli.commands;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Main entry point for the prepro CLI application.
///
/// Registers the available subcommands:
/// - `process` - Preprocess a file or stdin to a file or stdout
/// - `check` - Preprocess a file, discarding output, and report problems
///
/// Option defaults can be supplied in `~/.prepro.properties`, or in the file
/// named by the `picocli.defaults.prepro.path` system property.
///
/// @see ProcessCommand
/// @see CheckCommand
@Command(
        name = "prepro",
        description = "Line-oriented directive preprocessor",
        mixinStandardHelpOptions = true,
        version = "prepro 1.0.0",
        subcommands = {ProcessCommand.class, CheckCommand.class})
public class PreproCli {

    public static void main(String[] args) {
        loadLoggingConfiguration();
        System.exit(newCommandLine().execute(args));
    }

    /// Creates the command line with all subcommands and default providers
    /// registered.
    ///
    /// @return configured command line, never null
    public static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new PreproCli());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setDefaultValueProvider(new CommandLine.PropertiesDefaultProvider());
        return commandLine;
    }

    private static void loadLoggingConfiguration() {
        try (InputStream in = PreproCli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println(" [WARN] Could not load logging configuration: " + e.getMessage());
        }
    }
}
