package org.pragmatica.pywrap.wrap;

import org.junit.jupiter.api.Test;
import org.pragmatica.pywrap.cst.CstLeaf;
import org.pragmatica.pywrap.cst.TokenKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.pywrap.wrap.WrapFixtures.leaves;
import static org.pragmatica.pywrap.wrap.WrapFixtures.parsed;

class DocstringRewrapperTest {
    private final DocstringRewrapper rewrapper = DocstringRewrapper.docstringRewrapper(FixerConfig.defaultConfig());

    @Test
    void rewrap_reflowsTripleQuotedDocstring() {
        var words = "lorem ".repeat(19).strip();
        var tree = parsed("def f():\n    \"\"\"" + words + "\"\"\"\n");
        var literal = leaves(tree, TokenKind.STRING).get(0);

        assertThat(rewrapper.rewrap(literal)).isTrue();

        assertThat(tree.render())
                .isEqualTo("def f():\n    \"\"\"" + "lorem ".repeat(12).strip()
                           + "\n        " + "lorem ".repeat(7).strip() + "\"\"\"\n");
        assertThat(tree.isAttached(literal)).isFalse();
    }

    @Test
    void rewrap_splitsSingleQuotedLiteral_intoAdjacentLiterals() {
        var content = "the quick brown fox jumps over the lazy dog ".repeat(3).strip();
        var tree = parsed("'" + content + "'\n");
        var literal = leaves(tree, TokenKind.STRING).get(0);

        assertThat(rewrapper.rewrap(literal)).isTrue();

        var segments = leaves(tree, TokenKind.STRING);
        assertThat(segments).hasSizeGreaterThan(1);
        assertThat(segments.get(0).value()).startsWith("('");
        assertThat(segments.get(segments.size() - 1).value()).endsWith("')");

        var joined = new StringBuilder();
        for (var segment : segments) {
            var value = segment.value().strip();
            value = value.startsWith("(") ? value.substring(1) : value;
            value = value.endsWith(")") ? value.substring(0, value.length() - 1) : value;
            joined.append(value, 1, value.length() - 1);
        }
        assertThat(joined.toString()).isEqualTo(content);
        assertThat(tree.render().lines()).allSatisfy(line -> assertThat(line.length()).isLessThanOrEqualTo(79));
    }

    @Test
    void rewrap_keepsPrefixLettersOnEverySegment() {
        var tree = parsed("b'" + "bytes ".repeat(20).strip() + "'\n");
        var literal = leaves(tree, TokenKind.STRING).get(0);

        assertThat(rewrapper.rewrap(literal)).isTrue();

        assertThat(leaves(tree, TokenKind.STRING))
                .allSatisfy(segment -> assertThat(segment.value().strip()).matches("\\(?b'.*"));
    }

    @Test
    void rewrap_doesNothing_whenLiteralFitsOnOneLine() {
        var tree = parsed("'short'\n");
        var literal = leaves(tree, TokenKind.STRING).get(0);

        assertThat(rewrapper.rewrap(literal)).isFalse();
        assertThat(tree.render()).isEqualTo("'short'\n");
    }

    @Test
    void rewrap_skipsFormattedStringWithFields() {
        var tree = parsed("f'{value} " + "text ".repeat(20).strip() + "'\n");
        var literal = leaves(tree, TokenKind.STRING).get(0);

        assertThat(rewrapper.rewrap(literal)).isFalse();
    }

    @Test
    void rewrap_skipsTokenWhichIsNotALiteralStart() {
        var segment = CstLeaf.leaf(TokenKind.STRING, "        " + "'tail words' ".repeat(10));

        assertThat(rewrapper.rewrap(segment)).isFalse();
    }
}
