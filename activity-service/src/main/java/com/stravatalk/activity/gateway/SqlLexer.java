package com.stravatalk.activity.gateway;

import com.stravatalk.activity.error.SqlValidationException;

/**
 * Character classification for PostgreSQL text: which characters are code and which
 * sit inside string literals, quoted identifiers, dollar-quoted bodies or comments.
 *
 * Only used for the two jobs the parser cannot do for us: finding statement
 * terminators before parsing, and locating placeholders in deparsed output.
 */
final class SqlLexer {

    static final byte CODE = 0;
    static final byte LITERAL = 1;
    static final byte COMMENT = 2;

    private SqlLexer() {
    }

    static byte[] classify(String sql) {
        int n = sql.length();
        byte[] kinds = new byte[n];
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);
            char next = i + 1 < n ? sql.charAt(i + 1) : '\0';

            if (c == '-' && next == '-') {
                int end = sql.indexOf('\n', i);
                end = end < 0 ? n : end;
                fill(kinds, i, end, COMMENT);
                i = end;
            } else if (c == '/' && next == '*') {
                int end = blockCommentEnd(sql, i);
                fill(kinds, i, end, COMMENT);
                i = end;
            } else if (c == '\'') {
                boolean escapes = i > 0 && (sql.charAt(i - 1) == 'E' || sql.charAt(i - 1) == 'e')
                        && (i == 1 || !Character.isLetterOrDigit(sql.charAt(i - 2)));
                int end = quotedEnd(sql, i, '\'', escapes);
                fill(kinds, i, end, LITERAL);
                i = end;
            } else if (c == '"') {
                int end = quotedEnd(sql, i, '"', false);
                fill(kinds, i, end, LITERAL);
                i = end;
            } else if (c == '$') {
                int end = dollarQuotedEnd(sql, i);
                if (end > i) {
                    fill(kinds, i, end, LITERAL);
                    i = end;
                } else {
                    i++;
                }
            } else {
                i++;
            }
        }
        return kinds;
    }

    /**
     * Removes one trailing statement terminator (and any comment after it).
     * Any other terminator means a second statement and is refused.
     */
    static String stripTerminator(String sql) {
        byte[] kinds = classify(sql);
        int last = -1;
        for (int i = sql.length() - 1; i >= 0; i--) {
            if (kinds[i] == CODE && sql.charAt(i) == ';') {
                last = i;
                break;
            }
        }
        if (last < 0) {
            return sql.strip();
        }
        for (int i = last + 1; i < sql.length(); i++) {
            if (kinds[i] == LITERAL || (kinds[i] == CODE && !Character.isWhitespace(sql.charAt(i)))) {
                throw new SqlValidationException("Only a single SELECT statement is allowed");
            }
        }
        String body = sql.substring(0, last);
        for (int i = 0; i < body.length(); i++) {
            if (kinds[i] == CODE && body.charAt(i) == ';') {
                throw new SqlValidationException("Only a single SELECT statement is allowed");
            }
        }
        return body.strip();
    }

    private static int blockCommentEnd(String sql, int start) {
        int depth = 0;
        int i = start;
        while (i < sql.length()) {
            if (sql.startsWith("/*", i)) {
                depth++;
                i += 2;
            } else if (sql.startsWith("*/", i)) {
                depth--;
                i += 2;
                if (depth == 0) return i;
            } else {
                i++;
            }
        }
        return sql.length();
    }

    private static int quotedEnd(String sql, int start, char quote, boolean backslashEscapes) {
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (backslashEscapes && c == '\\') {
                i += 2;
            } else if (c == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                } else {
                    return i + 1;
                }
            } else {
                i++;
            }
        }
        return sql.length();
    }

    // $$...$$ or $tag$...$tag$; a bare $1 style reference is not a quote
    private static int dollarQuotedEnd(String sql, int start) {
        int i = start + 1;
        while (i < sql.length() && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '_')) {
            i++;
        }
        if (i >= sql.length() || sql.charAt(i) != '$') {
            return start;
        }
        String tag = sql.substring(start, i + 1);
        if (tag.length() > 2 && Character.isDigit(tag.charAt(1))) {
            return start;
        }
        int close = sql.indexOf(tag, i + 1);
        return close < 0 ? sql.length() : close + tag.length();
    }

    private static void fill(byte[] kinds, int from, int to, byte kind) {
        for (int i = from; i < to && i < kinds.length; i++) {
            kinds[i] = kind;
        }
    }
}
