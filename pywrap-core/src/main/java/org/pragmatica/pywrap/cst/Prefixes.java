package org.pragmatica.pywrap.cst;

/**
 * Helpers for the whitespace/comment text stored in node prefixes.
 */
public final class Prefixes {
    private Prefixes() {}

    /**
     * Prefix split into the material before the first comment line, the comment-bearing region
     * and the material after it.
     *
     * @param before   text up to the start of the first line holding a comment
     * @param comments text from that line start to the end of the last comment line, without its
     *                 line break
     * @param after    remaining text, starting with the line break that ended the last comment
     *                 line (empty if the comment runs to the end of the prefix)
     */
    public record CommentSplit(String before, String comments, String after) {
        public boolean hasComments() {
            return comments.indexOf('#') >= 0;
        }
    }

    /**
     * Split a prefix around its comments. A prefix without line breaks is a trailing comment and
     * is returned whole as the comment region.
     */
    public static CommentSplit split(String prefix) {
        if (prefix.indexOf('\n') < 0) {
            return new CommentSplit("", prefix, "");
        }

        int firstHash = prefix.indexOf('#');
        if (firstHash < 0) {
            return new CommentSplit(prefix, "", "");
        }

        int start = prefix.lastIndexOf('\n', firstHash) + 1;
        int end = prefix.indexOf('\n', prefix.lastIndexOf('#'));
        if (end < 0) {
            return new CommentSplit(prefix.substring(0, start), prefix.substring(start), "");
        }
        return new CommentSplit(prefix.substring(0, start), prefix.substring(start, end), prefix.substring(end));
    }

    /**
     * Join the lines of a comment region into one logical text: the first {@code #} of each line
     * and the whitespace after it are dropped, lines are joined with single spaces.
     */
    public static String flattenComments(String comments) {
        var result = new StringBuilder();
        for (var line : comments.split("\n", -1)) {
            int hash = line.indexOf('#');
            var text = hash < 0
                       ? line
                       : line.substring(0, hash) + line.substring(hash + 1);
            if (!result.isEmpty()) {
                result.append(' ');
            }
            result.append(text.stripLeading());
        }
        return result.toString();
    }

    /**
     * Length of the longest line of the given text.
     */
    public static int longestLine(String text) {
        int longest = 0;
        for (var line : text.split("\n", -1)) {
            longest = Math.max(longest, line.length());
        }
        return longest;
    }

    /**
     * The part of the text after its last line break.
     */
    public static String lastLine(String text) {
        return text.substring(text.lastIndexOf('\n') + 1);
    }
}
