package io.blockmon.core.fingerprint;

/**
 * Removes comment-only lines from Java-like source text before checksumming.
 *
 * <p>A line is dropped when it carries no code and is part of a comment: a
 * {@code //} line, a line inside or opening a {@code /* ... *}{@code /} block
 * that has nothing else on it. Lines that contain code are kept verbatim,
 * trailing comments included. Blank lines outside comments are kept, since
 * whitespace is significant. String, char and text-block literals are skipped
 * so comment markers inside them are not mistaken for comments.
 */
public final class CommentStripper {

    private enum State { CODE, LINE_COMMENT, BLOCK_COMMENT, STRING, CHAR, TEXT_BLOCK }

    private CommentStripper() {
        // utility class
    }

    public static String strip(String text) {
        if (text.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        State state = State.CODE;
        int lineStart = 0;
        boolean hasCode = false;
        boolean hasComment = false;
        int n = text.length();

        for (int i = 0; i < n; i++) {
            char c = text.charAt(i);
            char next = i + 1 < n ? text.charAt(i + 1) : '\0';

            if (c == '\n') {
                if (state == State.LINE_COMMENT) {
                    state = State.CODE;
                }
                if (hasCode || !hasComment) {
                    out.append(text, lineStart, i + 1);
                }
                lineStart = i + 1;
                hasCode = state == State.TEXT_BLOCK;
                hasComment = state == State.BLOCK_COMMENT;
                continue;
            }

            switch (state) {
                case CODE -> {
                    if (c == '/' && next == '/') {
                        state = State.LINE_COMMENT;
                        hasComment = true;
                        i++;
                    } else if (c == '/' && next == '*') {
                        state = State.BLOCK_COMMENT;
                        hasComment = true;
                        i++;
                    } else if (c == '"' && next == '"' && i + 2 < n && text.charAt(i + 2) == '"') {
                        state = State.TEXT_BLOCK;
                        hasCode = true;
                        i += 2;
                    } else if (c == '"') {
                        state = State.STRING;
                        hasCode = true;
                    } else if (c == '\'') {
                        state = State.CHAR;
                        hasCode = true;
                    } else if (!Character.isWhitespace(c)) {
                        hasCode = true;
                    }
                }
                case LINE_COMMENT -> {
                    // runs to end of line
                }
                case BLOCK_COMMENT -> {
                    if (c == '*' && next == '/') {
                        state = State.CODE;
                        i++;
                    }
                }
                case STRING -> {
                    if (c == '\\' && next != '\n') {
                        i++;
                    } else if (c == '"') {
                        state = State.CODE;
                    }
                }
                case CHAR -> {
                    if (c == '\\' && next != '\n') {
                        i++;
                    } else if (c == '\'') {
                        state = State.CODE;
                    }
                }
                case TEXT_BLOCK -> {
                    hasCode = true;
                    if (c == '\\' && next != '\n') {
                        i++;
                    } else if (c == '"' && next == '"' && i + 2 < n && text.charAt(i + 2) == '"') {
                        state = State.CODE;
                        i += 2;
                    }
                }
            }
        }

        if (lineStart < n && (hasCode || !hasComment)) {
            out.append(text, lineStart, n);
        }
        return out.toString();
    }
}
