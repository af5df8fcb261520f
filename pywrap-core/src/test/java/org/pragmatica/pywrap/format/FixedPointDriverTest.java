package org.pragmatica.pywrap.format;

import org.junit.jupiter.api.Test;
import org.pragmatica.pywrap.parser.PyParser;
import org.pragmatica.pywrap.wrap.FixerConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.pywrap.format.FixedPointDriver.fixedPointDriver;

class FixedPointDriverTest {

    @Test
    void run_convergesInOnePass_whenNothingToFix() {
        var tree = PyParser.parse("x = 1\n");

        var report = fixedPointDriver().run(tree);

        assertThat(report.converged()).isTrue();
        assertThat(report.passes()).isEqualTo(1);
        assertThat(report.fixes()).isZero();
    }

    @Test
    void run_appliesFixesUntilFixedPoint() {
        var tree = PyParser.parse("result = compute(" + "argument, ".repeat(18) + "last)\n");

        var report = fixedPointDriver().run(tree);

        assertThat(report.converged()).isTrue();
        assertThat(report.fixes()).isEqualTo(2);
        assertThat(report.passes()).isEqualTo(3);
        assertThat(tree.render())
                .isEqualTo("result = compute(" + "argument, ".repeat(5) + "argument,\n"
                           + "    " + "argument, ".repeat(6) + "argument,\n"
                           + "    " + "argument, ".repeat(5) + "last)\n");
    }

    @Test
    void run_stopsAtPassCap() {
        var tree = PyParser.parse("result = compute(" + "argument, ".repeat(18) + "last)\n");

        var report = fixedPointDriver(FixerConfig.defaultConfig().withMaxPasses(1)).run(tree);

        assertThat(report.converged()).isFalse();
        assertThat(report.passes()).isEqualTo(1);
        assertThat(report.fixes()).isEqualTo(1);
    }

    @Test
    void run_terminates_onUnsplittableLine() {
        var longName = "x".repeat(100);
        var tree = PyParser.parse(longName + " = 1\n");

        var report = fixedPointDriver().run(tree);

        assertThat(report.converged()).isTrue();
        assertThat(tree.render()).isEqualTo(longName + " = 1\n");
    }
}
