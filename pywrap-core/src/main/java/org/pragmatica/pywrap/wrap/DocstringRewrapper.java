package org.pragmatica.pywrap.wrap;

import org.pragmatica.pywrap.cst.CstLeaf;
import org.pragmatica.pywrap.cst.Quotes;
import org.pragmatica.pywrap.cst.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Splits an over-long string literal statement into several physical lines.
 *
 * Triple-quoted literals are re-flowed inside the quotes. Other literals become a parenthesized
 * sequence of adjacent literals, each closed and reopened with the original delimiters, whose
 * implicit concatenation equals the original value.
 */
public final class DocstringRewrapper {
    private static final Logger log = LoggerFactory.getLogger(DocstringRewrapper.class);

    private final FixerConfig config;

    private DocstringRewrapper(FixerConfig config) {
        this.config = config;
    }

    public static DocstringRewrapper docstringRewrapper(FixerConfig config) {
        return new DocstringRewrapper(config);
    }

    /**
     * @return {@code true} if the literal was replaced by several segments
     */
    public boolean rewrap(CstLeaf literal) {
        var value = literal.value();
        if (literal.kind() != TokenKind.STRING || !Quotes.isLiteral(value)) {
            return false;
        }

        var quotes = Quotes.of(value);
        if (quotes.isFormatted() && value.indexOf('{') >= 0) {
            log.debug("Skipping formatted string literal at column {}", literal.column());
            return false;
        }

        int column = literal.column();
        int maxLength = config.maxWidth() - column;
        var continuation = " ".repeat(config.indentWidth() + column);
        var text = value;

        if (!quotes.isTripleQuoted()) {
            continuation += quotes.opening();
            maxLength -= quotes.closing().length();
            text = "(" + value + ")";
        }
        if (maxLength < 1) {
            return false;
        }

        var lines = TextWrapper.textWrapper(maxLength)
                               .withSubsequentIndent(continuation)
                               .withPreserveSpacing(!quotes.isTripleQuoted())
                               .wrap(text);
        if (lines.size() < 2) {
            return false;
        }

        var segments = new ArrayList<CstLeaf>();
        for (int i = 0; i < lines.size(); i++) {
            var line = quotes.isTripleQuoted() || i == lines.size() - 1
                       ? lines.get(i)
                       : lines.get(i) + quotes.closing();
            if (i == 0) {
                segments.add(CstLeaf.leaf(TokenKind.STRING, line, literal.prefix()));
            } else {
                segments.add(CstLeaf.leaf(TokenKind.NEWLINE, "\n"));
                segments.add(CstLeaf.leaf(TokenKind.STRING, line));
            }
        }

        literal.replace(segments);
        segments.forEach(CstLeaf::markChanged);

        log.debug("Split string literal at column {} into {} segments", column, lines.size());
        return true;
    }
}
