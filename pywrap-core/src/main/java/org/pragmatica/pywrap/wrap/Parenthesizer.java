package org.pragmatica.pywrap.wrap;

import org.pragmatica.pywrap.cst.CstBranch;
import org.pragmatica.pywrap.cst.CstLeaf;
import org.pragmatica.pywrap.cst.CstNode;
import org.pragmatica.pywrap.cst.NodeKind;
import org.pragmatica.pywrap.cst.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Inserts grouping parentheses so that a line break outside any bracket becomes legal.
 *
 * Which part of a node gets grouped depends on its kind, see {@link GroupingRule}. All rules are
 * idempotent: a part already opened by a parenthesis inserted here is left alone. Parentheses
 * written in the source do not count, a break in front of them still needs its own group.
 */
public final class Parenthesizer {
    private static final Logger log = LoggerFactory.getLogger(Parenthesizer.class);

    /**
     * Grouping strategy per node kind.
     */
    public enum GroupingRule {
        /// Group everything after the keyword.
        PRINT_OR_RETURN,
        /// Group the assigned value.
        ASSIGNMENT,
        /// Group the whole call or attribute chain.
        CALL_CHAIN,
        /// Group the list of imported names.
        IMPORT_FROM,
        /// Group the whole expression.
        TEST,
        /// Already inside parentheses.
        ALREADY_GROUPED,
        /// No known way to group.
        NONE;

        public static GroupingRule of(NodeKind kind) {
            return switch (kind) {
                case PRINT_STMT, RETURN_STMT -> PRINT_OR_RETURN;
                case EXPR_STMT -> ASSIGNMENT;
                case POWER, ATOM -> CALL_CHAIN;
                case IMPORT_FROM -> IMPORT_FROM;
                case OR_TEST, AND_TEST, NOT_TEST, TEST, COMPARISON, ARITH_EXPR, TERM -> TEST;
                case PARAMETERS -> ALREADY_GROUPED;
                default -> NONE;
            };
        }
    }

    private Parenthesizer() {}

    public static Parenthesizer parenthesizer() {
        return new Parenthesizer();
    }

    /**
     * Check whether a break before {@code breakLeaf} at bracket depth zero can be made legal.
     */
    public boolean canGroup(CstNode node, CstLeaf breakLeaf) {
        if (!(node instanceof CstBranch branch)) {
            return false;
        }
        return switch (GroupingRule.of(branch.kind())) {
            case PRINT_OR_RETURN -> branch.size() > 1
                                    && !isGroupOpening(branch.child(1))
                                    && !isRedirection(branch.child(1))
                                    && !branch.child(0).contains(breakLeaf);
            case ASSIGNMENT -> assignedValue(branch).filter(value -> canWrap(value, breakLeaf))
                                                    .isPresent();
            case CALL_CHAIN, TEST -> !isGroupOpening(branch.child(0));
            case IMPORT_FROM -> importedNames(branch).filter(names -> canWrap(names, breakLeaf))
                                                     .isPresent();
            case ALREADY_GROUPED -> true;
            case NONE -> false;
        };
    }

    /**
     * Group the part of the node which must hold the break. Does nothing if it is grouped already.
     */
    public void group(CstBranch node) {
        switch (GroupingRule.of(node.kind())) {
            case PRINT_OR_RETURN -> groupTail(node);
            case ASSIGNMENT -> assignedValue(node).ifPresent(value -> wrap(value, " "));
            case CALL_CHAIN, TEST -> wrapWhole(node);
            case IMPORT_FROM -> importedNames(node).ifPresent(names -> wrap(names, " "));
            case ALREADY_GROUPED, NONE -> {
            }
        }
    }

    private void groupTail(CstBranch node) {
        var first = node.child(1);
        if (isGroupOpening(first)) {
            return;
        }
        var open = CstLeaf.lpar(first.prefix());
        first.setPrefix("");
        node.insertChild(1, open);
        node.appendChild(CstLeaf.rpar());
        markGrouped(node, open);
    }

    private void wrapWhole(CstBranch node) {
        var first = node.child(0);
        if (isGroupOpening(first)) {
            return;
        }
        var open = CstLeaf.lpar(first.prefix());
        first.setPrefix("");
        node.insertChild(0, open);
        node.appendChild(CstLeaf.rpar());
        markGrouped(node, open);
    }

    private void wrap(CstNode target, String openPrefix) {
        var open = CstLeaf.lpar(openPrefix);

        if (target instanceof CstBranch branch) {
            if (isGroupOpening(branch.child(0))) {
                return;
            }
            branch.setPrefix("");
            branch.insertChild(0, open);
            branch.appendChild(CstLeaf.rpar());
            markGrouped(branch, open);
            return;
        }

        var atom = CstBranch.branch(NodeKind.ATOM, List.of());
        target.replace(List.of(atom));
        target.setPrefix("");
        atom.appendChild(open);
        atom.appendChild(target);
        atom.appendChild(CstLeaf.rpar());
        markGrouped(atom, open);
    }

    private static void markGrouped(CstBranch node, CstLeaf open) {
        open.markChanged();
        node.lastChild()
            .markChanged();
        log.debug("Parenthesized {}", node.kind());
    }

    private static Optional<CstNode> assignedValue(CstBranch statement) {
        var last = statement.lastChild();
        if (last instanceof CstBranch annotation && annotation.kind() == NodeKind.ANNASSIGN) {
            return annotation.size() == 4
                   ? Optional.of(annotation.lastChild())
                   : Optional.empty();
        }
        return statement.size() >= 3
               ? Optional.of(last)
               : Optional.empty();
    }

    private static Optional<CstNode> importedNames(CstBranch statement) {
        var last = statement.lastChild();
        if (last.isLeafOf(TokenKind.RPAR) || (last instanceof CstLeaf leaf && leaf.value().equals("*"))) {
            return Optional.empty();
        }
        return Optional.of(last);
    }

    private static boolean canWrap(CstNode target, CstLeaf breakLeaf) {
        return target.contains(breakLeaf)
               && !(target instanceof CstBranch branch && isGroupOpening(branch.child(0)));
    }

    private static boolean isGroupOpening(CstNode node) {
        return node.isLeafOf(TokenKind.LPAR) && node.isChanged();
    }

    private static boolean isRedirection(CstNode node) {
        return node instanceof CstLeaf leaf && leaf.value().equals(">>");
    }
}
