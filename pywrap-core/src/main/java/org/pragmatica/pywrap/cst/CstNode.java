package org.pragmatica.pywrap.cst;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Node of the concrete syntax tree.
 *
 * The tree preserves every token, comment and whitespace run of the source: rendering a node
 * concatenates the prefix and value of all its leaves in order. Parent and sibling links are
 * plain lookups; children are owned by their parent's child list only.
 */
public abstract sealed class CstNode permits CstLeaf, CstBranch {
    private CstBranch parent;
    private boolean changed;

    CstNode() {}

    /**
     * Whitespace and comments rendered immediately before this node.
     */
    public abstract String prefix();

    public abstract void setPrefix(String prefix);

    /**
     * Zero-based column of the first character after the prefix, as computed by the last
     * {@link CstTree#layout()} pass.
     */
    public abstract int column();

    /**
     * Leaves of this subtree in document order.
     */
    public abstract List<CstLeaf> leaves();

    public abstract Optional<CstLeaf> firstLeaf();

    abstract void renderTo(StringBuilder out);

    public String render() {
        var out = new StringBuilder();
        renderTo(out);
        return out.toString();
    }

    public Optional<CstBranch> parent() {
        return Optional.ofNullable(parent);
    }

    void parent(CstBranch parent) {
        this.parent = parent;
    }

    public Optional<CstNode> prevSibling() {
        return sibling(-1);
    }

    public Optional<CstNode> nextSibling() {
        return sibling(1);
    }

    private Optional<CstNode> sibling(int offset) {
        if (parent == null) {
            return Optional.empty();
        }
        var siblings = parent.children();
        int index = siblings.indexOf(this) + offset;
        return index >= 0 && index < siblings.size()
               ? Optional.of(siblings.get(index))
               : Optional.empty();
    }

    public boolean isChanged() {
        return changed;
    }

    /**
     * Mark this node and all its ancestors as mutated.
     */
    public void markChanged() {
        for (CstNode node = this; node != null; node = node.parent) {
            node.changed = true;
        }
    }

    /**
     * Replace this node in its parent by the given nodes. The list may contain this node itself.
     *
     * @throws IllegalStateException if this node has no parent
     */
    public void replace(List<? extends CstNode> replacement) {
        if (parent == null) {
            throw new IllegalStateException("Cannot replace a node without parent");
        }
        parent.replaceChild(this, replacement);
    }

    /**
     * Check whether {@code other} is this node or one of its descendants.
     */
    public boolean contains(CstNode other) {
        for (CstNode node = other; node != null; node = node.parent) {
            if (node == this) {
                return true;
            }
        }
        return false;
    }

    public boolean isLeafOf(TokenKind kind) {
        return this instanceof CstLeaf leaf && leaf.kind() == kind;
    }

    public boolean isBranchOf(NodeKind kind) {
        return this instanceof CstBranch branch && branch.kind() == kind;
    }

    /**
     * Nodes of this subtree in document order, parents before children.
     */
    public List<CstNode> preOrder() {
        var result = new ArrayList<CstNode>();
        collect(result);
        return result;
    }

    abstract void collect(List<CstNode> out);

    @Override
    public String toString() {
        return render();
    }
}
