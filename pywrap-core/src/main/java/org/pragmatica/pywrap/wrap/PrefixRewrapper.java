package org.pragmatica.pywrap.wrap;

import org.pragmatica.pywrap.cst.CstNode;
import org.pragmatica.pywrap.cst.Prefixes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-flows over-long comments living in a node's prefix.
 *
 * A standalone comment block is wrapped in place at its own indentation. A trailing comment
 * which pushes the line past the limit is moved below the code and indented like the statement
 * it followed.
 */
public final class PrefixRewrapper {
    private static final Logger log = LoggerFactory.getLogger(PrefixRewrapper.class);

    private final FixerConfig config;

    private PrefixRewrapper(FixerConfig config) {
        this.config = config;
    }

    public static PrefixRewrapper prefixRewrapper(FixerConfig config) {
        return new PrefixRewrapper(config);
    }

    /**
     * The prefix has an over-long line, or holds a comment which ends past the limit.
     */
    public boolean needsRewrap(CstNode node) {
        var prefix = node.prefix();
        return Prefixes.longestLine(prefix) > config.maxWidth()
               || (prefix.indexOf('#') >= 0 && node.column() + prefix.length() > config.maxWidth());
    }

    /**
     * Rewrap the comments of the node's prefix.
     *
     * @return {@code true} if the prefix was replaced
     */
    public boolean rewrap(CstNode node) {
        var prefix = node.prefix();
        var split = Prefixes.split(prefix);
        if (!split.hasComments()) {
            return false;
        }

        boolean inline = isTrailingComment(node);
        int indent = inline
                     ? node.prevSibling()
                           .flatMap(CstNode::firstLeaf)
                           .map(CstNode::column)
                           .orElse(0)
                     : split.comments().indexOf('#');
        var commentIndent = " ".repeat(indent) + config.commentMarker();

        var lines = TextWrapper.textWrapper(config.maxWidth())
                               .withIndent(commentIndent)
                               .withBreakLongWords(true)
                               .wrap(Prefixes.flattenComments(split.comments()));
        if (lines.isEmpty()) {
            return false;
        }

        var comments = String.join("\n", lines);
        var rewrapped = inline
                        ? split.before() + "\n" + comments + split.after()
                        : split.before() + comments + split.after();

        if (rewrapped.equals(prefix)) {
            return false;
        }

        log.debug("Rewrapped {} comment into {} line(s)", inline ? "trailing" : "standalone", lines.size());
        node.setPrefix(rewrapped);
        node.markChanged();
        return true;
    }

    // A single-line prefix is a trailing comment only when code precedes it on the same line.
    private static boolean isTrailingComment(CstNode node) {
        var prefix = node.prefix();
        return prefix.indexOf('\n') < 0 && node.column() > prefix.length();
    }
}
