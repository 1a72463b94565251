package io.prepro.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CheckCommandTest extends BaseCommandTest {

    @TempDir Path tempDir;

    @Test
    void shouldReportValidFile() throws Exception {
        // Given
        Path file = tempDir.resolve("ok.in");
        Files.writeString(file, "#define a=1\n#if $<a>==1\nyes\n#endif\n");

        // When
        int exitCode = execute("check", "--compact", file.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out()).contains("[OK]").contains("Input lines: 4").contains("Output lines: 1");
    }

    @Test
    void shouldReportUnclosedBlock() throws Exception {
        Path file = tempDir.resolve("bad.in");
        Files.writeString(file, "#if a==a\nyes\n");

        int exitCode = execute("check", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err()).contains("[FAIL] Check failed").contains("Unclosed [#if] opened at line 1");
        assertThat(out()).doesNotContain("[OK]");
    }

    @Test
    void shouldReportCycle() throws Exception {
        Path file = tempDir.resolve("cycle.in");
        Files.writeString(file, "#define a=$<b>\n#define b=$<a>\n$<a>\n");

        int exitCode = execute("check", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err()).contains("Line 3: Cyclic variable reference: a -> b -> a");
    }

    @Test
    void shouldRequireInput() {
        assertThat(execute("check")).isEqualTo(2);
        assertThat(err()).contains("INPUT");
    }
}
