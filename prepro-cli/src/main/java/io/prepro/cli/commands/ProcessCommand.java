package io.prepro.cli.commands;

import io.prepro.core.PreprocessReader;
import io.prepro.core.PreprocessorConfig;
import io.prepro.core.exception.PreprocessException;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;
import picocli.CommandLine;

/// CLI command that preprocesses a document.
///
/// Reads the input file, or stdin when the input is omitted or `-`, and
/// writes the processed lines to the output file or stdout. Output is written
/// as lines are produced; a failure part way leaves the lines emitted so far.
///
/// ### Usage
/// ```bash
/// prepro process [-D name=value]... [--remove-blank] [-o <output>] [<input>]
/// ```
///
/// @see PreprocessCommand
@CommandLine.Command(
        name = "process",
        mixinStandardHelpOptions = true,
        description = "Preprocess a file or stdin")
class ProcessCommand extends PreprocessCommand {

    private static final Logger logger = Logger.getLogger(ProcessCommand.class.getName());

    @CommandLine.Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "INPUT",
            description = "Input file; stdin when omitted or -")
    private Path input;

    @CommandLine.Option(
            names = {"-o", "--output"},
            paramLabel = "FILE",
            description = "Output file; stdout when omitted")
    private Path output;

    @Override
    protected void execute() {
        try {
            PreprocessorConfig config = buildConfig();
            String terminator = config.getLineEnding().terminator();
            int count = 0;
            try (PreprocessReader reader = openReader(input, config);
                    Writer writer = openWriter()) {
                try {
                    for (String line = reader.readLine(); line != null; line = reader.readLine()) {
                        writer.write(line);
                        writer.write(terminator);
                        count++;
                    }
                } finally {
                    writer.flush();
                }
            }
            logger.fine("Wrote " + count + " lines from " + describe(input));
        } catch (PreprocessException e) {
            fail(describe(input) + ": " + e.getMessage());
        } catch (IOException e) {
            fail("I/O error: " + e.getMessage());
        }
    }

    private Writer openWriter() throws IOException {
        if (output != null) {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return Files.newBufferedWriter(output, StandardCharsets.UTF_8);
        }
        return new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)) {
            @Override
            public void close() throws IOException {
                flush();
            }
        };
    }
}
