package org.pragmatica.pywrap.format;

/**
 * Checked carrier of a {@link FormattingError}.
 */
public class FormattingException extends Exception {
    private final FormattingError error;

    public FormattingException(FormattingError error) {
        super(error.message());
        this.error = error;
    }

    public FormattingError error() {
        return error;
    }
}
