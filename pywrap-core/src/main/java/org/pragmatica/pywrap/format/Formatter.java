package org.pragmatica.pywrap.format;

import org.pragmatica.pywrap.shared.SourceFile;
import org.pragmatica.pywrap.wrap.FixerConfig;

/**
 * Rewraps Python source so that no line exceeds the configured width, where the engine knows how.
 */
public interface Formatter {

    /**
     * Format the source file.
     *
     * @throws FormattingException if the source cannot be parsed
     */
    SourceFile format(SourceFile source) throws FormattingException;

    /**
     * Check whether formatting would leave the source unchanged.
     */
    boolean isFormatted(SourceFile source) throws FormattingException;

    FixerConfig config();
}
