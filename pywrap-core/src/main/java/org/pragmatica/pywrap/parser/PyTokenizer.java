package org.pragmatica.pywrap.parser;

import org.pragmatica.pywrap.cst.TokenKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Python tokenizer which keeps all whitespace and comments.
 *
 * Every character of the source ends up either in a token value or in the prefix of the token
 * that follows it, so concatenating prefix and value of all tokens reproduces the input exactly.
 * Blank lines, comment-only lines and line breaks inside brackets go to the prefix; INDENT and
 * DEDENT tokens have empty text and leave the indentation in the prefix of the next token.
 */
public final class PyTokenizer {
    private static final Pattern NUMBER = Pattern.compile(
            "0[xX][0-9a-fA-F_]+[lL]?|0[oO][0-7_]+|0[bB][01_]+|(?:\\d[\\d_]*\\.?[\\d_]*|\\.\\d[\\d_]*)(?:[eE][+-]?\\d[\\d_]*)?[jJlL]?");

    private static final List<String> OPERATORS = List.of(
            "**=", "//=", ">>=", "<<=", "...",
            "!=", "==", "<=", ">=", "<>", "<<", ">>", "**", "//", "->", ":=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "=", "!");

    private static final Map<String, TokenKind> PUNCTUATION = Map.of(
            "(", TokenKind.LPAR,
            ")", TokenKind.RPAR,
            "[", TokenKind.LSQB,
            "]", TokenKind.RSQB,
            "{", TokenKind.LBRACE,
            "}", TokenKind.RBRACE,
            ",", TokenKind.COMMA,
            ":", TokenKind.COLON,
            ".", TokenKind.DOT);

    private static final String STRING_PREFIX_LETTERS = "rRbBuUfF";

    private final String source;
    private final List<PyToken> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final StringBuilder pending = new StringBuilder();

    private int pos;
    private int line = 1;
    private int lineStart;
    private int depth;
    private boolean atLineStart = true;

    private PyTokenizer(String source) {
        this.source = source;
        indents.push(0);
    }

    /**
     * Tokenize the whole source. The last token is always {@link TokenKind#ENDMARKER}.
     *
     * @throws PyParseException on characters or constructs the tokenizer does not understand
     */
    public static List<PyToken> tokenize(String source) {
        return new PyTokenizer(source).run();
    }

    private List<PyToken> run() {
        while (pos < source.length()) {
            if (atLineStart && depth == 0) {
                lineStart();
            } else {
                next();
            }
        }
        finish();
        return tokens;
    }

    private void lineStart() {
        int start = pos;
        while (pos < source.length() && isBlank(source.charAt(pos))) {
            pos++;
        }
        var whitespace = source.substring(start, pos);
        pending.append(whitespace);

        if (pos >= source.length()) {
            return;
        }

        char c = source.charAt(pos);
        if (c == '#') {
            comment();
            return;
        }
        if (c == '\n' || c == '\r') {
            pending.append(lineBreak());
            return;
        }

        indentation(indentWidth(whitespace));
        atLineStart = false;
    }

    private void indentation(int width) {
        if (width > indents.peek()) {
            indents.push(width);
            emit(TokenKind.INDENT, "", "");
            return;
        }
        while (width < indents.peek()) {
            indents.pop();
            emit(TokenKind.DEDENT, "", "");
        }
        if (width != indents.peek()) {
            throw error("Unindent does not match any outer indentation level");
        }
    }

    private void next() {
        char c = source.charAt(pos);

        if (isBlank(c)) {
            pending.append(c);
            pos++;
        } else if (c == '#') {
            comment();
        } else if (c == '\\' && isLineBreakAt(pos + 1)) {
            pending.append(c);
            pos++;
            pending.append(lineBreak());
        } else if (c == '\n' || c == '\r') {
            newline();
        } else if (isStringStart()) {
            string();
        } else if (Character.isLetter(c) || c == '_' || (c > 127 && Character.isUnicodeIdentifierStart(c))) {
            name();
        } else if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
            number();
        } else {
            operator();
        }
    }

    private void newline() {
        if (depth > 0) {
            pending.append(lineBreak());
            return;
        }
        int column = pos - lineStart;
        int startLine = line;
        var value = lineBreak();
        tokens.add(new PyToken(TokenKind.NEWLINE, value, takePending(), startLine, column));
        atLineStart = true;
    }

    private void comment() {
        int start = pos;
        while (pos < source.length() && source.charAt(pos) != '\n' && source.charAt(pos) != '\r') {
            pos++;
        }
        pending.append(source, start, pos);
    }

    private void name() {
        int start = pos;
        while (pos < source.length() && isNamePart(source.charAt(pos))) {
            pos++;
        }
        emit(TokenKind.NAME, source.substring(start, pos), start);
    }

    private void number() {
        var matcher = NUMBER.matcher(source).region(pos, source.length());
        if (!matcher.lookingAt()) {
            throw error("Malformed number");
        }
        int start = pos;
        pos = matcher.end();
        emit(TokenKind.NUMBER, source.substring(start, pos), start);
    }

    private void operator() {
        for (var operator : OPERATORS) {
            if (source.startsWith(operator, pos)) {
                int start = pos;
                pos += operator.length();
                trackDepth(operator);
                emit(PUNCTUATION.getOrDefault(operator, TokenKind.OPERATOR), operator, start);
                return;
            }
        }
        throw error("Unexpected character '" + source.charAt(pos) + "'");
    }

    private void trackDepth(String operator) {
        switch (operator) {
            case "(", "[", "{" -> depth++;
            case ")", "]", "}" -> {
                if (depth == 0) {
                    throw error("Unmatched '" + operator + "'");
                }
                depth--;
            }
            default -> {
            }
        }
    }

    private boolean isStringStart() {
        int index = pos;
        while (index < source.length() && index - pos < 3 && STRING_PREFIX_LETTERS.indexOf(source.charAt(index)) >= 0) {
            index++;
        }
        return index < source.length() && (source.charAt(index) == '"' || source.charAt(index) == '\'');
    }

    private void string() {
        int start = pos;
        int startLine = line;
        int startColumn = pos - lineStart;

        while (STRING_PREFIX_LETTERS.indexOf(source.charAt(pos)) >= 0) {
            pos++;
        }
        char quote = source.charAt(pos);
        var delimiter = source.startsWith(String.valueOf(quote).repeat(3), pos)
                        ? String.valueOf(quote).repeat(3)
                        : String.valueOf(quote);
        pos += delimiter.length();

        while (true) {
            if (pos >= source.length()) {
                throw new PyParseException(startLine, startColumn, "Unterminated string literal");
            }
            char c = source.charAt(pos);
            if (c == '\\' && pos + 1 < source.length()) {
                pos++;
                skipCharacter();
            } else if (source.startsWith(delimiter, pos)) {
                pos += delimiter.length();
                break;
            } else if ((c == '\n' || c == '\r') && delimiter.length() == 1) {
                throw new PyParseException(startLine, startColumn, "Unterminated string literal");
            } else {
                skipCharacter();
            }
        }
        tokens.add(new PyToken(TokenKind.STRING, source.substring(start, pos), takePending(), startLine, startColumn));
    }

    private void skipCharacter() {
        if (isLineBreakAt(pos)) {
            lineBreak();
        } else {
            pos++;
        }
    }

    private void finish() {
        if (!atLineStart) {
            tokens.add(new PyToken(TokenKind.NEWLINE, "", takePending(), line, pos - lineStart));
        }
        if (depth > 0) {
            throw error("Unexpected end of file inside brackets");
        }
        while (indents.size() > 1) {
            indents.pop();
            emit(TokenKind.DEDENT, "", "");
        }
        tokens.add(new PyToken(TokenKind.ENDMARKER, "", takePending(), line, pos - lineStart));
    }

    private void emit(TokenKind kind, String value, int start) {
        tokens.add(new PyToken(kind, value, takePending(), line, start - lineStart));
    }

    private void emit(TokenKind kind, String value, String prefix) {
        tokens.add(new PyToken(kind, value, prefix, line, pos - lineStart));
    }

    private String takePending() {
        var prefix = pending.toString();
        pending.setLength(0);
        return prefix;
    }

    /**
     * Consume the line break at the current position and return its text.
     */
    private String lineBreak() {
        int start = pos;
        if (source.startsWith("\r\n", pos)) {
            pos += 2;
        } else {
            pos++;
        }
        line++;
        lineStart = pos;
        return source.substring(start, pos);
    }

    private boolean isLineBreakAt(int index) {
        return index < source.length() && (source.charAt(index) == '\n' || source.charAt(index) == '\r');
    }

    private PyParseException error(String details) {
        return new PyParseException(line, pos - lineStart, details);
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\f';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || (c > 127 && Character.isUnicodeIdentifierPart(c));
    }

    private static int indentWidth(String whitespace) {
        int width = 0;
        for (char c : whitespace.toCharArray()) {
            if (c == '\t') {
                width = (width / 8 + 1) * 8;
            } else if (c == ' ') {
                width++;
            }
        }
        return width;
    }
}
