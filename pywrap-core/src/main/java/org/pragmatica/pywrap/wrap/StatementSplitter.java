package org.pragmatica.pywrap.wrap;

import org.pragmatica.pywrap.cst.CstBranch;
import org.pragmatica.pywrap.cst.CstLeaf;
import org.pragmatica.pywrap.cst.CstNode;
import org.pragmatica.pywrap.cst.Indentation;
import org.pragmatica.pywrap.cst.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Breaks an over-long statement or expression before its last token which still starts within
 * the limit.
 *
 * The break is a NEWLINE leaf followed by an INDENT leaf carrying the continuation indent. When the
 * break point is not enclosed by any bracket of the split node, the {@link Parenthesizer} groups
 * the node first; if the node's kind cannot be grouped the split is abandoned before anything
 * is touched.
 */
public final class StatementSplitter {
    private static final Logger log = LoggerFactory.getLogger(StatementSplitter.class);

    private final FixerConfig config;
    private final Parenthesizer parenthesizer;

    private StatementSplitter(FixerConfig config, Parenthesizer parenthesizer) {
        this.config = config;
        this.parenthesizer = parenthesizer;
    }

    public static StatementSplitter statementSplitter(FixerConfig config) {
        return new StatementSplitter(config, Parenthesizer.parenthesizer());
    }

    /**
     * @return {@code true} if a break was inserted
     */
    public boolean split(CstNode node) {
        var leaves = node.leaves();

        CstLeaf pivot = null;
        int depth = 0;
        int depthAtPivot = 0;
        for (var leaf : leaves) {
            if (leaf.column() >= config.maxWidth()) {
                break;
            }
            pivot = leaf;
            depthAtPivot = depth;
            depth += bracketDelta(leaf);
        }

        if (pivot == null) {
            log.debug("Nothing starts before column {}", config.maxWidth());
            return false;
        }

        // A dotted name continues on the new line starting with its dot.
        var breakLeaf = pivot.prevSibling()
                             .filter(sibling -> sibling.isLeafOf(TokenKind.DOT))
                             .map(CstLeaf.class::cast)
                             .orElse(pivot);

        if (breakLeaf == leaves.get(0)) {
            log.debug("Break point is the first token of {}", describe(node));
            return false;
        }
        if (breakLeaf.isChanged()) {
            log.debug("Break point {} already handled", breakLeaf.value());
            return false;
        }
        if (startsLine(breakLeaf)) {
            log.debug("Break point {} already starts a line", breakLeaf.value());
            return false;
        }

        boolean grouped = depthAtPivot > 0;
        if (!grouped) {
            if (!(node instanceof CstBranch branch) || !parenthesizer.canGroup(branch, breakLeaf)) {
                log.debug("Cannot group {} for a break outside brackets", describe(node));
                return false;
            }
            parenthesizer.group(branch);
        }

        var continuation = Indentation.of(node) + config.continuationIndent();
        var newline = CstLeaf.leaf(TokenKind.NEWLINE, "\n");
        var indent = CstLeaf.leaf(TokenKind.INDENT, continuation);

        breakLeaf.setPrefix("");
        breakLeaf.replace(List.of(newline, indent, breakLeaf));

        newline.markChanged();
        indent.markChanged();
        breakLeaf.markChanged();

        log.debug("Split {} before '{}'{}", describe(node), breakLeaf.value(), grouped ? "" : " with grouping");
        return true;
    }

    private static int bracketDelta(CstLeaf leaf) {
        if (leaf.kind().isOpeningBracket()) {
            return 1;
        }
        return leaf.kind().isClosingBracket() ? -1 : 0;
    }

    private static boolean startsLine(CstLeaf leaf) {
        return leaf.prefix().indexOf('\n') >= 0
               || leaf.kind() == TokenKind.NEWLINE
               || leaf.kind() == TokenKind.INDENT
               || leaf.kind() == TokenKind.DEDENT;
    }

    private static String describe(CstNode node) {
        return node instanceof CstBranch branch
               ? branch.kind().toString()
               : ((CstLeaf) node).kind().toString();
    }
}
