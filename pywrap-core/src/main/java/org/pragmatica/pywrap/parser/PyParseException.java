package org.pragmatica.pywrap.parser;

/**
 * Source text could not be tokenized or parsed.
 */
public class PyParseException extends RuntimeException {
    private final int line;
    private final int column;
    private final String details;

    public PyParseException(int line, int column, String details) {
        super(line + ":" + column + ": " + details);
        this.line = line;
        this.column = column;
        this.details = details;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public String details() {
        return details;
    }
}
