package org.pragmatica.pywrap.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class PyWrapCliTest {
    private static final String LONG_SOURCE =
            "value = compute(first_argument, second_argument, third_argument, fourth_argument_x)\n";
    private static final String WRAPPED_SOURCE =
            "value = compute(first_argument, second_argument, third_argument,\n    fourth_argument_x)\n";

    @TempDir
    Path root;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new PyWrapCli());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void check_returnsOne_whenFileWouldChange() throws IOException {
        var file = Files.writeString(root.resolve("long.py"), LONG_SOURCE);

        int exitCode = commandLine.execute("check", root.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("Would reformat: " + file);
        assertThat(Files.readString(file)).isEqualTo(LONG_SOURCE);
    }

    @Test
    void check_returnsZero_whenAllFilesFit() throws IOException {
        Files.writeString(root.resolve("short.py"), WRAPPED_SOURCE);

        int exitCode = commandLine.execute("check", root.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void check_returnsTwo_onParseError() throws IOException {
        Files.writeString(root.resolve("broken.py"), "x = = 1\n");
        Files.writeString(root.resolve("long.py"), LONG_SOURCE);

        int exitCode = commandLine.execute("check", root.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("broken.py:1:4: unexpected token, found '='");
    }

    @Test
    void check_returnsTwo_forMissingPath() {
        int exitCode = commandLine.execute("check", root.resolve("absent.py").toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("File not found:");
    }

    @Test
    void format_rewritesFilesInPlace() throws IOException {
        var file = Files.writeString(root.resolve("long.py"), LONG_SOURCE);
        Files.writeString(root.resolve("short.py"), WRAPPED_SOURCE);

        int exitCode = commandLine.execute("format", root.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(file)).isEqualTo(WRAPPED_SOURCE);
        assertThat(out.toString()).contains("Formatted: " + file)
                                  .contains("1 of 2 file(s) reformatted");
    }

    @Test
    void format_dryRun_printsWithoutWriting() throws IOException {
        var file = Files.writeString(root.resolve("long.py"), LONG_SOURCE);

        int exitCode = commandLine.execute("format", "--dry-run", file.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(file)).isEqualTo(LONG_SOURCE);
        assertThat(out.toString()).contains("==> " + file + " <==")
                                  .contains(WRAPPED_SOURCE)
                                  .contains("1 of 1 file(s) would be reformatted");
    }

    @Test
    void noSubcommand_printsUsage() {
        int exitCode = commandLine.execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Usage: pywrap");
    }
}
