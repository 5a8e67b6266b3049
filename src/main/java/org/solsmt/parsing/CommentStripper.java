package org.solsmt.parsing;

/**
 * Removes {@code ;} line comments. A comment runs up to and including the next
 * newline, or to the end of the input.
 */
public final class CommentStripper {

    public static final char COMMENT_MARKER = ';';

    private CommentStripper() {
        throw new AssertionError();
    }

    public static String strip(String input) {
        StringBuilder result = new StringBuilder(input.length());
        int i = 0;
        int end = input.length();
        while (i < end) {
            char c = input.charAt(i);
            if (c == COMMENT_MARKER) {
                while (i < end && input.charAt(i) != '\n') {
                    i++;
                }
                if (i < end) {
                    i++; // the newline belongs to the comment
                }
            } else {
                result.append(c);
                i++;
            }
        }
        return result.toString();
    }
}
