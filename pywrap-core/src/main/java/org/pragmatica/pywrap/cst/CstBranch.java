package org.pragmatica.pywrap.cst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Composite node: an ordered sequence of children tagged with a {@link NodeKind}.
 */
public final class CstBranch extends CstNode {
    private final NodeKind kind;
    private final List<CstNode> children = new ArrayList<>();

    private CstBranch(NodeKind kind) {
        this.kind = Objects.requireNonNull(kind);
    }

    public static CstBranch branch(NodeKind kind, List<? extends CstNode> children) {
        var branch = new CstBranch(kind);
        children.forEach(branch::appendChild);
        return branch;
    }

    public NodeKind kind() {
        return kind;
    }

    public List<CstNode> children() {
        return Collections.unmodifiableList(children);
    }

    public CstNode child(int index) {
        return children.get(index);
    }

    public CstNode lastChild() {
        return children.get(children.size() - 1);
    }

    public int size() {
        return children.size();
    }

    public void insertChild(int index, CstNode child) {
        adopt(child);
        children.add(index, child);
    }

    public void appendChild(CstNode child) {
        adopt(child);
        children.add(child);
    }

    void replaceChild(CstNode child, List<? extends CstNode> replacement) {
        int index = children.indexOf(child);
        if (index < 0) {
            throw new IllegalStateException("Node is not a child of " + kind);
        }
        children.remove(index);
        child.parent(null);

        for (var node : replacement) {
            adopt(node);
            children.add(index++, node);
        }
    }

    private void adopt(CstNode child) {
        child.parent()
             .ifPresent(previous -> previous.children.remove(child));
        child.parent(this);
    }

    @Override
    public String prefix() {
        return firstLeaf().map(CstLeaf::prefix)
                          .orElse("");
    }

    @Override
    public void setPrefix(String prefix) {
        firstLeaf().ifPresent(leaf -> leaf.setPrefix(prefix));
    }

    @Override
    public int column() {
        return firstLeaf().map(CstLeaf::column)
                          .orElse(0);
    }

    @Override
    public List<CstLeaf> leaves() {
        var result = new ArrayList<CstLeaf>();
        for (var node : preOrder()) {
            if (node instanceof CstLeaf leaf) {
                result.add(leaf);
            }
        }
        return result;
    }

    @Override
    public Optional<CstLeaf> firstLeaf() {
        for (var child : children) {
            var leaf = child.firstLeaf();
            if (leaf.isPresent()) {
                return leaf;
            }
        }
        return Optional.empty();
    }

    @Override
    void renderTo(StringBuilder out) {
        children.forEach(child -> child.renderTo(out));
    }

    @Override
    void collect(List<CstNode> out) {
        out.add(this);
        children.forEach(child -> child.collect(out));
    }
}
