package org.pragmatica.pywrap.wrap;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.pywrap.wrap.TextWrapper.textWrapper;

class TextWrapperTest {

    @Test
    void wrap_collapsesWhitespace_andFillsLinesGreedily() {
        assertThat(textWrapper(20).wrap("one  two\n three four five six"))
                .containsExactly("one two three four", "five six");
    }

    @Test
    void wrap_prependsIndentToEveryLine() {
        assertThat(textWrapper(12).withIndent("# ").wrap("alpha beta gamma"))
                .containsExactly("# alpha beta", "# gamma");
    }

    @Test
    void wrap_usesSubsequentIndent_afterFirstLine() {
        assertThat(textWrapper(10).withSubsequentIndent("    ").wrap("one two three"))
                .containsExactly("one two", "    three");
    }

    @Test
    void wrap_keepsLongWordWhole_byDefault() {
        assertThat(textWrapper(5).wrap("ab abcdefgh cd"))
                .containsExactly("ab", "abcdefgh", "cd");
    }

    @Test
    void wrap_cutsLongWords_whenEnabled() {
        assertThat(textWrapper(5).withBreakLongWords(true).wrap("ab abcdefgh"))
                .containsExactly("ab ab", "cdefg", "h");
    }

    @Test
    void wrap_keepsSpacing_whenPreserving() {
        var text = "aa  bb cc dd";

        var lines = textWrapper(10).withPreserveSpacing(true).wrap(text);

        assertThat(lines).containsExactly("aa  bb cc ", "dd");
        assertThat(String.join("", lines)).isEqualTo(text);
    }

    @Test
    void wrap_producesNoLines_forBlankText() {
        assertThat(textWrapper(10).wrap("   \n ")).isEmpty();
        assertThat(textWrapper(10).withPreserveSpacing(true).wrap("")).isEmpty();
    }

    @Test
    void textWrapper_rejectsNonPositiveWidth() {
        assertThatThrownBy(() -> textWrapper(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
