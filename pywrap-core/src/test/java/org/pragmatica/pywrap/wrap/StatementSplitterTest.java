package org.pragmatica.pywrap.wrap;

import org.junit.jupiter.api.Test;
import org.pragmatica.pywrap.cst.NodeKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.pywrap.wrap.WrapFixtures.branch;
import static org.pragmatica.pywrap.wrap.WrapFixtures.leaf;
import static org.pragmatica.pywrap.wrap.WrapFixtures.parsed;
import static org.pragmatica.pywrap.wrap.WrapFixtures.terminatorTarget;

class StatementSplitterTest {
    private final StatementSplitter splitter = StatementSplitter.statementSplitter(FixerConfig.defaultConfig());

    @Test
    void split_breaksInsideBrackets_withoutGrouping() {
        var source = "value = compute(first_argument, second_argument, third_argument, fourth_argument_x)\n";
        var tree = parsed(source);

        assertThat(splitter.split(terminatorTarget(tree))).isTrue();

        assertThat(tree.render())
                .isEqualTo("value = compute(first_argument, second_argument, third_argument,\n"
                           + "    fourth_argument_x)\n");
        assertThat(leaf(tree, "fourth_argument_x").isChanged()).isTrue();
    }

    @Test
    void split_movesDotToContinuationLine_andGroupsChain() {
        var tree = parsed("result = first_object.compute_values().transform_all().normalize().aggregate_total()\n");

        assertThat(splitter.split(terminatorTarget(tree))).isTrue();

        assertThat(tree.render())
                .isEqualTo("result = (first_object.compute_values().transform_all().normalize()\n"
                           + "    .aggregate_total())\n");
    }

    @Test
    void split_indentsContinuationRelativeToBlock() {
        var tree = parsed("class A:\n    def f(self):\n"
                          + "        return alpha_value + beta_value + gamma_value + delta_value + epsilon_value_x\n");

        assertThat(splitter.split(branch(tree, NodeKind.RETURN_STMT))).isTrue();

        assertThat(tree.render())
                .isEqualTo("class A:\n    def f(self):\n"
                           + "        return (alpha_value + beta_value + gamma_value + delta_value +\n"
                           + "            epsilon_value_x)\n");
    }

    @Test
    void split_doesNothing_whenOnlyFirstTokenFits() {
        var source = "x".repeat(100) + " = 1\n";
        var tree = parsed(source);

        assertThat(splitter.split(terminatorTarget(tree))).isFalse();
        assertThat(tree.render()).isEqualTo(source);
    }

    @Test
    void split_doesNothing_forKindWhichCannotBeGrouped() {
        var source = "assert some_condition_value, 'this message is much too long to fit on the line!!'\n";
        var tree = parsed(source);

        assertThat(splitter.split(terminatorTarget(tree))).isFalse();
        assertThat(tree.render()).isEqualTo(source);
        assertThat(tree.root().isChanged()).isFalse();
    }

    @Test
    void split_doesNothing_whenBreakPointAlreadyHandled() {
        var tree = parsed("value = compute(first_argument, second_argument, third_argument, fourth_argument_x)\n");
        var target = terminatorTarget(tree);

        assertThat(splitter.split(target)).isTrue();
        var once = tree.render();

        assertThat(splitter.split(target)).isFalse();
        assertThat(tree.render()).isEqualTo(once);
    }

    @Test
    void split_doesNothing_whenBreakPointStartsLine() {
        var source = "value = compute(first_argument, second_argument, third_argument,\n"
                     + "                " + "a".repeat(70) + ")\n";
        var tree = parsed(source);

        assertThat(splitter.split(terminatorTarget(tree))).isFalse();
        assertThat(tree.render()).isEqualTo(source);
    }
}
