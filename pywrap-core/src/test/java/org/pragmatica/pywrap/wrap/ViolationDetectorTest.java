package org.pragmatica.pywrap.wrap;

import org.junit.jupiter.api.Test;
import org.pragmatica.pywrap.cst.TokenKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.pywrap.wrap.WrapFixtures.leaf;
import static org.pragmatica.pywrap.wrap.WrapFixtures.leaves;
import static org.pragmatica.pywrap.wrap.WrapFixtures.parsed;

class ViolationDetectorTest {
    private final ViolationDetector detector = ViolationDetector.violationDetector(FixerConfig.defaultConfig());

    @Test
    void isViolation_acceptsLineOfExactlyMaxWidth() {
        var tree = parsed("x = " + "1".repeat(75) + "\n");

        assertThat(detector.isViolation(leaves(tree, TokenKind.NEWLINE).get(0))).isFalse();
    }

    @Test
    void isViolation_detectsNewlinePastLimit() {
        var tree = parsed("x = " + "1".repeat(76) + "\n");

        assertThat(detector.isViolation(leaves(tree, TokenKind.NEWLINE).get(0))).isTrue();
    }

    @Test
    void isViolation_detectsBlockColonPastLimit() {
        var tree = parsed("if " + "a".repeat(80) + ":\n    pass\n");

        assertThat(detector.isViolation(leaf(tree, ":"))).isTrue();
    }

    @Test
    void isViolation_detectsLongPrefixLine() {
        var tree = parsed("# " + "c".repeat(80) + "\nx = 1\n");

        assertThat(detector.isViolation(leaf(tree, "x"))).isTrue();
        assertThat(detector.isViolation(leaf(tree, "="))).isFalse();
        assertThat(detector.isViolation(tree.root())).isTrue();
    }
}
