package org.pragmatica.pywrap.cst;

import java.util.List;
import java.util.Objects;

/**
 * Parsed source file: the root node plus the column layout of its leaves.
 */
public final class CstTree {
    private final CstBranch root;

    private CstTree(CstBranch root) {
        this.root = Objects.requireNonNull(root);
    }

    public static CstTree cstTree(CstBranch root) {
        return new CstTree(root);
    }

    public CstBranch root() {
        return root;
    }

    public String render() {
        return root.render();
    }

    /**
     * Nodes in document order. The list is a snapshot; later mutations do not affect it.
     */
    public List<CstNode> nodes() {
        return root.preOrder();
    }

    /**
     * Check whether the node is still reachable from the root, i.e. was not spliced out by a
     * replacement since it was collected.
     */
    public boolean isAttached(CstNode node) {
        return root.contains(node);
    }

    /**
     * Recompute the column of every leaf from the rendered text.
     */
    public CstTree layout() {
        int column = 0;
        for (var leaf : root.leaves()) {
            column = advance(column, leaf.prefix());
            leaf.column(column);
            column = advance(column, leaf.value());
        }
        return this;
    }

    private static int advance(int column, String text) {
        int newline = text.lastIndexOf('\n');
        return newline < 0
               ? column + text.length()
               : text.length() - newline - 1;
    }
}
