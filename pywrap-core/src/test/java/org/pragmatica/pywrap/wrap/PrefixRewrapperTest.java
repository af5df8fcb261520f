package org.pragmatica.pywrap.wrap;

import org.junit.jupiter.api.Test;
import org.pragmatica.pywrap.cst.TokenKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.pywrap.wrap.WrapFixtures.leaf;
import static org.pragmatica.pywrap.wrap.WrapFixtures.leaves;
import static org.pragmatica.pywrap.wrap.WrapFixtures.parsed;

class PrefixRewrapperTest {
    private static final String WORDS = "word ".repeat(20).strip();

    private final PrefixRewrapper rewrapper = PrefixRewrapper.prefixRewrapper(FixerConfig.defaultConfig());

    @Test
    void rewrap_wrapsStandaloneComment_keepingSurroundingBlankLines() {
        var tree = parsed("def f():\n    pass\n\n\n# " + WORDS + "\ny = 2\n");
        var name = leaf(tree, "y");

        assertThat(rewrapper.needsRewrap(name)).isTrue();
        assertThat(rewrapper.rewrap(name)).isTrue();

        assertThat(name.prefix())
                .isEqualTo("\n\n# " + "word ".repeat(15).strip() + "\n# " + "word ".repeat(5).strip() + "\n");
        assertThat(name.isChanged()).isTrue();
    }

    @Test
    void rewrap_movesTrailingComment_belowStatement() {
        var tree = parsed("def f():\n    x = 1  # " + WORDS + "\n");
        var newline = leaves(tree, TokenKind.NEWLINE).get(1);

        assertThat(rewrapper.rewrap(newline)).isTrue();

        assertThat(newline.prefix())
                .isEqualTo("\n    # " + "word ".repeat(14).strip() + "\n    # " + "word ".repeat(6).strip());
        assertThat(tree.render())
                .isEqualTo("def f():\n    x = 1\n    # " + "word ".repeat(14).strip()
                           + "\n    # " + "word ".repeat(6).strip() + "\n");
    }

    @Test
    void rewrap_leavesPrefixWithoutComments() {
        var tree = parsed("def f():\n    return 1\n");
        var keyword = leaf(tree, "return");

        assertThat(rewrapper.rewrap(keyword)).isFalse();
        assertThat(keyword.isChanged()).isFalse();
    }

    @Test
    void rewrap_reportsNoChange_forWellWrappedComment() {
        var tree = parsed("# short comment\nx = 1\n");
        var name = leaf(tree, "x");

        assertThat(rewrapper.needsRewrap(name)).isFalse();
        assertThat(rewrapper.rewrap(name)).isFalse();
        assertThat(name.prefix()).isEqualTo("# short comment\n");
    }
}
