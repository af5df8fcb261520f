package org.pragmatica.pywrap.wrap;

import org.pragmatica.pywrap.cst.CstLeaf;
import org.pragmatica.pywrap.cst.CstNode;
import org.pragmatica.pywrap.cst.Prefixes;
import org.pragmatica.pywrap.cst.TokenKind;

/**
 * Entry point of the rewrap engine: applies one local fix to a node sitting on an over-long line.
 *
 * Over-long comments are re-flowed first. If the node is a line terminator whose code part still
 * ends past the limit, the node before it is split: a lone string literal by the
 * {@link DocstringRewrapper}, anything else by the {@link StatementSplitter}. The fixer expects
 * columns computed by {@link org.pragmatica.pywrap.cst.CstTree#layout()} and is meant to be
 * applied repeatedly until nothing changes.
 */
public final class LineLengthFixer {
    private final FixerConfig config;
    private final ViolationDetector detector;
    private final PrefixRewrapper prefixRewrapper;
    private final DocstringRewrapper docstringRewrapper;
    private final StatementSplitter statementSplitter;

    private LineLengthFixer(FixerConfig config) {
        this.config = config;
        this.detector = ViolationDetector.violationDetector(config);
        this.prefixRewrapper = PrefixRewrapper.prefixRewrapper(config);
        this.docstringRewrapper = DocstringRewrapper.docstringRewrapper(config);
        this.statementSplitter = StatementSplitter.statementSplitter(config);
    }

    /**
     * Factory method for creating a fixer with default config.
     */
    public static LineLengthFixer lineLengthFixer() {
        return new LineLengthFixer(FixerConfig.defaultConfig());
    }

    /**
     * Factory method for creating a fixer with custom config.
     */
    public static LineLengthFixer lineLengthFixer(FixerConfig config) {
        return new LineLengthFixer(config);
    }

    public FixerConfig config() {
        return config;
    }

    /**
     * Try to fix the line the node sits on.
     *
     * @return {@code true} if the tree was modified
     */
    public boolean attemptFix(CstNode node) {
        if (!detector.isViolation(node)) {
            return false;
        }

        // Where the code ends, measured before the prefix is rewritten.
        int codeEnd = node.column() - Prefixes.lastLine(node.prefix()).length();
        boolean changed = false;

        if (prefixRewrapper.needsRewrap(node)) {
            changed = prefixRewrapper.rewrap(node);
        }

        if (!ViolationDetector.isTerminator(node) || codeEnd <= config.maxWidth()) {
            return changed;
        }

        var target = node.prevSibling();
        if (target.isEmpty()) {
            return changed;
        }
        if (target.get() instanceof CstLeaf literal && literal.kind() == TokenKind.STRING) {
            return docstringRewrapper.rewrap(literal) || changed;
        }
        return statementSplitter.split(target.get()) || changed;
    }
}
