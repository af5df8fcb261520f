package org.pragmatica.pywrap.format;

import org.junit.jupiter.api.Test;
import org.pragmatica.pywrap.shared.SourceFile;
import org.pragmatica.pywrap.wrap.FixerConfig;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.pywrap.format.PyWrapFormatter.pyWrapFormatter;

class PyWrapFormatterTest {
    private final PyWrapFormatter formatter = pyWrapFormatter();

    @Test
    void format_leavesShortLinesUntouched() throws FormattingException {
        var source = new SourceFile(Path.of("short.py"),
                                    """
                import os


                def main(argv):
                    # short comment
                    return os.path.join(argv[0], "x")  # trailing
                """);

        var formatted = formatter.format(source);

        assertThat(formatted.content()).isEqualTo(source.content());
        assertThat(formatted.fileName()).isEqualTo(source.fileName());
    }

    @Test
    void format_preservesSourceWithoutTrailingNewline() throws FormattingException {
        var source = new SourceFile(Path.of("eof.py"), "value = 1\n# last comment");

        assertThat(formatter.format(source).content()).isEqualTo("value = 1\n# last comment");
    }

    @Test
    void format_rewrapsCommentWithLongWord() throws FormattingException {
        var source = new SourceFile(Path.of("comment.py"), "# " + "x".repeat(98) + "\nx = 1\n");

        var formatted = formatter.format(source);

        assertThat(formatted.content())
                .isEqualTo("# " + "x".repeat(77) + "\n# " + "x".repeat(21) + "\nx = 1\n");
    }

    @Test
    void format_wrapsStandaloneCommentAtEndOfFile() throws FormattingException {
        var comment = "word ".repeat(20).strip();
        var source = new SourceFile(Path.of("tail.py"), "x = 1\n# " + comment);

        var formatted = formatter.format(source);

        assertThat(formatted.content())
                .isEqualTo("x = 1\n# " + "word ".repeat(15).strip() + "\n# " + "word ".repeat(5).strip());
    }

    @Test
    void format_honoursConfiguredWidth() throws FormattingException {
        var narrow = pyWrapFormatter(FixerConfig.defaultConfig().withMaxWidth(40));
        var source = new SourceFile(Path.of("narrow.py"), "values = call(first_argument, second_argument)\n");

        var formatted = narrow.format(source);

        assertThat(formatted.content()).isEqualTo("values = call(first_argument,\n    second_argument)\n");
    }

    @Test
    void isFormatted_reportsWhetherFormattingChangesContent() throws FormattingException {
        var formatted = new SourceFile(Path.of("a.py"), "x = 1\n");
        var unformatted = new SourceFile(Path.of("b.py"), "x = 1  # " + "comment ".repeat(12) + "\n");

        assertThat(formatter.isFormatted(formatted)).isTrue();
        assertThat(formatter.isFormatted(unformatted)).isFalse();
    }

    @Test
    void format_reportsParseErrorWithLocation() {
        var source = new SourceFile(Path.of("broken.py"), "x = 1\ny = = 2\n");

        assertThatThrownBy(() -> formatter.format(source))
                .isInstanceOfSatisfying(FormattingException.class, thrown -> {
                    var error = thrown.error();
                    assertThat(error).isInstanceOf(FormattingError.ParseError.class);
                    var parseError = (FormattingError.ParseError) error;
                    assertThat(parseError.file()).isEqualTo(Path.of("broken.py"));
                    assertThat(parseError.line()).isEqualTo(2);
                    assertThat(parseError.column()).isEqualTo(4);
                    assertThat(error.message()).startsWith("broken.py:2:4: ");
                });
    }

    @Test
    void config_returnsDefaults() {
        assertThat(formatter.config()).isEqualTo(FixerConfig.defaultConfig());
        assertThat(formatter.config().maxWidth()).isEqualTo(79);
    }

    @Test
    void format_splitsCallInsideCoroutine() throws FormattingException {
        var source = new SourceFile(Path.of("coroutine.py"),
                                    "async def f():\n"
                                    + "    await compute(first_argument, second_argument, third_argument, fourth_arg_x)\n");

        var formatted = formatter.format(source);

        assertThat(formatted.content())
                .isEqualTo("async def f():\n"
                           + "    await compute(first_argument, second_argument, third_argument,\n"
                           + "        fourth_arg_x)\n");
    }

    @Test
    void isFormatted_acceptsSlicesAfterComma() throws FormattingException {
        var source = new SourceFile(Path.of("slices.py"), "u = a[0, :]\nv = a[1:2, ::3]\n");

        assertThat(formatter.isFormatted(source)).isTrue();
    }

    @Test
    void format_leavesAssignedStringLiteralOnContinuationLine() throws FormattingException {
        var literal = "'" + "word ".repeat(17).strip() + "'";
        var source = new SourceFile(Path.of("literal.py"), "x = " + literal + "\n");

        var formatted = formatter.format(source);

        assertThat(formatted.content()).isEqualTo("x = (\n    " + literal + ")\n");
        assertThat(formatter.isFormatted(formatted)).isTrue();
    }
}
