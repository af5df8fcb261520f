package org.pragmatica.pywrap.cst;

import java.util.List;

/**
 * Opening and closing delimiters of a string literal. String prefix letters ({@code r}, {@code b},
 * {@code u}, {@code f}) belong to the opening delimiter.
 */
public record Quotes(String opening, String closing) {
    private static final List<String> DELIMITERS = List.of("\"\"\"", "'''", "\"", "'");

    /**
     * Check whether the text starts like a string literal: optional prefix letters followed by a
     * quote character.
     */
    public static boolean isLiteral(String text) {
        int index = skipPrefixLetters(text);
        return index < text.length() && (text.charAt(index) == '"' || text.charAt(index) == '\'');
    }

    /**
     * @throws IllegalArgumentException if the text does not start with a string literal
     */
    public static Quotes of(String literal) {
        int index = skipPrefixLetters(literal);
        for (var delimiter : DELIMITERS) {
            if (literal.startsWith(delimiter, index)) {
                return new Quotes(literal.substring(0, index + delimiter.length()), delimiter);
            }
        }
        throw new IllegalArgumentException("Not a string literal: " + literal);
    }

    private static int skipPrefixLetters(String text) {
        int index = 0;
        while (index < text.length() && Character.isLetter(text.charAt(index))) {
            index++;
        }
        return index;
    }

    public boolean isTripleQuoted() {
        return closing.length() == 3;
    }

    /**
     * Formatted string literals must not be cut inside a replacement field.
     */
    public boolean isFormatted() {
        return opening.indexOf('f') >= 0 || opening.indexOf('F') >= 0;
    }
}
