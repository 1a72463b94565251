package io.prepro.cli.commands;

import io.prepro.core.PreprocessReader;
import io.prepro.core.exception.PreprocessException;
import java.io.IOException;
import java.nio.file.Path;
import picocli.CommandLine;

/// CLI command for validating a document without writing output.
///
/// Runs the preprocessor to the end of the input so that every directive,
/// reference and block structure is checked:
/// - Malformed or misplaced directives
/// - Unclosed `#if` and `#switch` blocks
/// - Undefined or cyclic variable references
///
/// ### Usage
/// ```bash
/// prepro check [-D name=value]... <input>
/// ```
///
/// @see PreprocessCommand
@CommandLine.Command(
        name = "check",
        mixinStandardHelpOptions = true,
        description = "Check a file for preprocessing errors")
class CheckCommand extends PreprocessCommand {

    @CommandLine.Parameters(index = "0", paramLabel = "INPUT", description = "Input file, or - for stdin")
    private Path input;

    @Override
    protected void execute() {
        try (PreprocessReader reader = openReader(input, buildConfig())) {
            int lines = 0;
            while (reader.readLine() != null) {
                lines++;
            }
            System.out.println(" [OK] " + describe(input) + " is valid");
            System.out.println("   Input lines: " + reader.getLineNumber());
            System.out.println("   Output lines: " + lines);
        } catch (PreprocessException e) {
            fail("Check failed: " + describe(input) + ": " + e.getMessage());
        } catch (IOException e) {
            fail("I/O error: " + e.getMessage());
        }
    }
}
