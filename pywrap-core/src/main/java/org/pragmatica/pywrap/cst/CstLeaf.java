package org.pragmatica.pywrap.cst;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Token node: literal text plus the whitespace and comments preceding it.
 */
public final class CstLeaf extends CstNode {
    private final TokenKind kind;
    private final String value;
    private String prefix;
    private int column;

    private CstLeaf(TokenKind kind, String value, String prefix) {
        this.kind = Objects.requireNonNull(kind);
        this.value = Objects.requireNonNull(value);
        this.prefix = Objects.requireNonNull(prefix);
    }

    public static CstLeaf leaf(TokenKind kind, String value) {
        return new CstLeaf(kind, value, "");
    }

    public static CstLeaf leaf(TokenKind kind, String value, String prefix) {
        return new CstLeaf(kind, value, prefix);
    }

    public static CstLeaf lpar(String prefix) {
        return new CstLeaf(TokenKind.LPAR, "(", prefix);
    }

    public static CstLeaf rpar() {
        return new CstLeaf(TokenKind.RPAR, ")", "");
    }

    public TokenKind kind() {
        return kind;
    }

    public String value() {
        return value;
    }

    @Override
    public String prefix() {
        return prefix;
    }

    @Override
    public void setPrefix(String prefix) {
        this.prefix = Objects.requireNonNull(prefix);
    }

    @Override
    public int column() {
        return column;
    }

    void column(int column) {
        this.column = column;
    }

    @Override
    public List<CstLeaf> leaves() {
        return List.of(this);
    }

    @Override
    public Optional<CstLeaf> firstLeaf() {
        return Optional.of(this);
    }

    @Override
    void renderTo(StringBuilder out) {
        out.append(prefix).append(value);
    }

    @Override
    void collect(List<CstNode> out) {
        out.add(this);
    }
}
