package org.pragmatica.pywrap.wrap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Greedy width-constrained line wrapping of plain text.
 *
 * Every produced line starts with the indent (initial indent for the first line, subsequent
 * indent for the rest) and is at most {@code width} characters long, unless a single word does
 * not fit and long words are not broken.
 *
 * @param width            maximal line length including the indent
 * @param initialIndent    prepended to the first line
 * @param subsequentIndent prepended to all other lines
 * @param breakLongWords   cut words which do not fit on a line of their own
 * @param preserveSpacing  keep whitespace runs attached to the preceding word instead of
 *                         collapsing them, so the line bodies concatenate back to the input
 */
public record TextWrapper(
        int width,
        String initialIndent,
        String subsequentIndent,
        boolean breakLongWords,
        boolean preserveSpacing
) {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SPACED_WORD = Pattern.compile("\\S+\\s*");

    public TextWrapper {
        if (width < 1) {
            throw new IllegalArgumentException("Invalid width " + width);
        }
    }

    public static TextWrapper textWrapper(int width) {
        return new TextWrapper(width, "", "", false, false);
    }

    public TextWrapper withIndent(String indent) {
        return new TextWrapper(width, indent, indent, breakLongWords, preserveSpacing);
    }

    public TextWrapper withSubsequentIndent(String indent) {
        return new TextWrapper(width, initialIndent, indent, breakLongWords, preserveSpacing);
    }

    public TextWrapper withBreakLongWords(boolean breakLongWords) {
        return new TextWrapper(width, initialIndent, subsequentIndent, breakLongWords, preserveSpacing);
    }

    public TextWrapper withPreserveSpacing(boolean preserveSpacing) {
        return new TextWrapper(width, initialIndent, subsequentIndent, breakLongWords, preserveSpacing);
    }

    /**
     * Wrap the text. Blank text produces no lines.
     */
    public List<String> wrap(String text) {
        var pending = new ArrayDeque<>(chunks(text));
        var separator = preserveSpacing ? "" : " ";
        var lines = new ArrayList<String>();

        var indent = initialIndent;
        var line = new StringBuilder(indent);
        boolean empty = true;

        while (!pending.isEmpty()) {
            var chunk = pending.peek();
            var gap = empty ? "" : separator;

            if (line.length() + gap.length() + chunk.length() <= width) {
                line.append(gap).append(chunk);
                pending.poll();
                empty = false;
                continue;
            }

            if (breakLongWords && chunk.length() > width - indent.length()) {
                int room = width - line.length() - gap.length();
                if (empty && room < 1) {
                    room = 1;
                }
                if (room >= 1) {
                    line.append(gap).append(chunk, 0, room);
                    pending.poll();
                    pending.push(chunk.substring(room));
                    empty = false;
                }
            } else if (empty) {
                line.append(chunk);
                pending.poll();
                empty = false;
                continue;
            }

            lines.add(line.toString());
            indent = subsequentIndent;
            line = new StringBuilder(indent);
            empty = true;
        }

        if (!empty) {
            lines.add(line.toString());
        }
        return lines;
    }

    private List<String> chunks(String text) {
        var result = new ArrayList<String>();
        if (text.isBlank()) {
            return result;
        }
        if (!preserveSpacing) {
            result.addAll(List.of(WHITESPACE.split(text.strip())));
            return result;
        }

        var matcher = SPACED_WORD.matcher(text);
        while (matcher.find()) {
            result.add(matcher.group());
        }
        int leading = text.length() - text.stripLeading().length();
        if (leading > 0) {
            result.set(0, text.substring(0, leading) + result.get(0));
        }
        return result;
    }
}
