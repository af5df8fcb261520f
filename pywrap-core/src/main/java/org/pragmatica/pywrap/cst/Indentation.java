package org.pragmatica.pywrap.cst;

/**
 * Indentation lookup for statements inside indented blocks.
 */
public final class Indentation {
    private Indentation() {}

    /**
     * Indentation string of the nearest block enclosing the node, or an empty string at module
     * level.
     */
    public static String of(CstNode node) {
        for (var parent = node.parent(); parent.isPresent(); parent = parent.get().parent()) {
            if (parent.get().kind() == NodeKind.SUITE) {
                return ofSuite(parent.get());
            }
        }
        return "";
    }

    private static String ofSuite(CstBranch suite) {
        for (var child : suite.children()) {
            if (child.isLeafOf(TokenKind.NEWLINE) || child.isLeafOf(TokenKind.INDENT) || child.isLeafOf(TokenKind.DEDENT)) {
                continue;
            }
            return leadingWhitespace(Prefixes.lastLine(child.prefix()));
        }
        return "";
    }

    private static String leadingWhitespace(String line) {
        int end = 0;
        while (end < line.length() && (line.charAt(end) == ' ' || line.charAt(end) == '\t')) {
            end++;
        }
        return line.substring(0, end);
    }
}
