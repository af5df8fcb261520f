package org.pragmatica.pywrap.wrap;

import org.pragmatica.pywrap.cst.CstLeaf;
import org.pragmatica.pywrap.cst.CstNode;
import org.pragmatica.pywrap.cst.Prefixes;

/**
 * Decides whether a node sits on an over-long line.
 */
public final class ViolationDetector {
    private final int maxWidth;

    private ViolationDetector(int maxWidth) {
        this.maxWidth = maxWidth;
    }

    public static ViolationDetector violationDetector(FixerConfig config) {
        return new ViolationDetector(config.maxWidth());
    }

    /**
     * A line terminator (NEWLINE, or the COLON opening a block) past the limit, or a prefix with
     * an over-long line.
     */
    public boolean isViolation(CstNode node) {
        if (isTerminator(node)) {
            return node.column() > maxWidth;
        }
        return Prefixes.longestLine(node.prefix()) > maxWidth;
    }

    static boolean isTerminator(CstNode node) {
        return node instanceof CstLeaf leaf && leaf.kind().isTerminator();
    }
}
