package org.pragmatica.pywrap.wrap;

/**
 * Configuration for the line-length fixer.
 *
 * @param maxWidth      longest allowed physical line
 * @param indentWidth   extra indentation of continuation lines
 * @param commentMarker text starting every rewrapped comment line
 * @param maxPasses     upper bound of fixed-point passes over one tree
 */
public record FixerConfig(
        int maxWidth,
        int indentWidth,
        String commentMarker,
        int maxPasses
) {

    /**
     * Default configuration: 79 columns, 4-space continuation indent.
     */
    public static final FixerConfig DEFAULT = new FixerConfig(79, 4, "# ", 32);

    public FixerConfig {
        if (maxWidth < 1) {
            throw new IllegalArgumentException("maxWidth must be positive: " + maxWidth);
        }
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be positive: " + maxPasses);
        }
    }

    /**
     * Factory method for default config.
     */
    public static FixerConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Builder-style method to set the line width.
     */
    public FixerConfig withMaxWidth(int maxWidth) {
        return new FixerConfig(maxWidth, indentWidth, commentMarker, maxPasses);
    }

    /**
     * Builder-style method to set the continuation indent width.
     */
    public FixerConfig withIndentWidth(int indentWidth) {
        return new FixerConfig(maxWidth, indentWidth, commentMarker, maxPasses);
    }

    /**
     * Builder-style method to set the pass cap.
     */
    public FixerConfig withMaxPasses(int maxPasses) {
        return new FixerConfig(maxWidth, indentWidth, commentMarker, maxPasses);
    }

    String continuationIndent() {
        return " ".repeat(indentWidth);
    }
}
