package org.pragmatica.pywrap.format;

import org.pragmatica.pywrap.cst.CstTree;
import org.pragmatica.pywrap.parser.PyParseException;
import org.pragmatica.pywrap.parser.PyParser;
import org.pragmatica.pywrap.shared.SourceFile;
import org.pragmatica.pywrap.wrap.FixerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-length formatter for Python sources.
 *
 * Parses the source into a concrete syntax tree, runs the fixed-point driver over it and renders
 * the result. Everything the engine does not touch is reproduced byte for byte.
 */
public class PyWrapFormatter implements Formatter {
    private static final Logger log = LoggerFactory.getLogger(PyWrapFormatter.class);

    private final FixerConfig config;
    private final FixedPointDriver driver;

    private PyWrapFormatter(FixerConfig config) {
        this.config = config;
        this.driver = FixedPointDriver.fixedPointDriver(config);
    }

    /**
     * Factory method for creating a formatter with default config.
     */
    public static PyWrapFormatter pyWrapFormatter() {
        return new PyWrapFormatter(FixerConfig.defaultConfig());
    }

    /**
     * Factory method for creating a formatter with custom config.
     */
    public static PyWrapFormatter pyWrapFormatter(FixerConfig config) {
        return new PyWrapFormatter(config);
    }

    @Override
    public SourceFile format(SourceFile source) throws FormattingException {
        var tree = parse(source);
        var report = driver.run(tree);

        log.debug("{}: {} fix(es) in {} pass(es)", source.fileName(), report.fixes(), report.passes());
        return source.withContent(tree.render());
    }

    @Override
    public boolean isFormatted(SourceFile source) throws FormattingException {
        return format(source).content()
                             .equals(source.content());
    }

    @Override
    public FixerConfig config() {
        return config;
    }

    private static CstTree parse(SourceFile source) throws FormattingException {
        try {
            return PyParser.parse(source.content());
        } catch (PyParseException e) {
            throw FormattingError.parseError(source.fileName(), e.line(), e.column(), e.details())
                                 .exception();
        }
    }
}
