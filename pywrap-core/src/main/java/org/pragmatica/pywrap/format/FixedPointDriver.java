package org.pragmatica.pywrap.format;

import org.pragmatica.pywrap.cst.CstTree;
import org.pragmatica.pywrap.wrap.FixerConfig;
import org.pragmatica.pywrap.wrap.LineLengthFixer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@link LineLengthFixer} to every node of a tree, pass after pass, until a pass
 * changes nothing or the pass cap is reached.
 *
 * Columns are recomputed at the start of each pass. Nodes are visited in document order from a
 * snapshot taken at the same time; nodes spliced out by an earlier fix in the same pass are
 * skipped.
 */
public final class FixedPointDriver {
    private static final Logger log = LoggerFactory.getLogger(FixedPointDriver.class);

    private final FixerConfig config;
    private final LineLengthFixer fixer;

    private FixedPointDriver(FixerConfig config) {
        this.config = config;
        this.fixer = LineLengthFixer.lineLengthFixer(config);
    }

    public static FixedPointDriver fixedPointDriver() {
        return new FixedPointDriver(FixerConfig.defaultConfig());
    }

    public static FixedPointDriver fixedPointDriver(FixerConfig config) {
        return new FixedPointDriver(config);
    }

    /**
     * Outcome of a driver run.
     *
     * @param passes    number of passes performed, including the final one which changed nothing
     * @param fixes     total number of successful fixes
     * @param converged whether a pass without changes was reached within the pass cap
     */
    public record FixReport(int passes, int fixes, boolean converged) {}

    public FixReport run(CstTree tree) {
        int fixes = 0;

        for (int pass = 1; pass <= config.maxPasses(); pass++) {
            tree.layout();
            int applied = 0;

            for (var node : tree.nodes()) {
                if (tree.isAttached(node) && fixer.attemptFix(node)) {
                    applied++;
                }
            }

            fixes += applied;
            log.debug("Pass {} applied {} fix(es)", pass, applied);

            if (applied == 0) {
                return new FixReport(pass, fixes, true);
            }
        }

        log.warn("No fixed point after {} passes, giving up with {} fix(es) applied", config.maxPasses(), fixes);
        tree.layout();
        return new FixReport(config.maxPasses(), fixes, false);
    }
}
