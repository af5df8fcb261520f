package org.pragmatica.pywrap.format;

import java.nio.file.Path;

/**
 * Reasons a source file could not be formatted.
 */
public sealed interface FormattingError {

    String message();

    /**
     * Source is not valid Python, or uses syntax the parser does not support.
     */
    record ParseError(Path file, int line, int column, String details) implements FormattingError {
        @Override
        public String message() {
            return file + ":" + line + ":" + column + ": " + details;
        }
    }

    /**
     * Source file could not be read or written.
     */
    record ReadError(Path file, String details) implements FormattingError {
        @Override
        public String message() {
            return "Cannot access " + file + ": " + details;
        }
    }

    static FormattingError parseError(Path file, int line, int column, String details) {
        return new ParseError(file, line, column, details);
    }

    static FormattingError readError(Path file, String details) {
        return new ReadError(file, details);
    }

    default FormattingException exception() {
        return new FormattingException(this);
    }
}
