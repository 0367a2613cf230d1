package io.lighting.metakit.sql;

import java.util.Objects;

/**
 * Minimal lexical scan of SQL text.
 * <p>
 * Skips single-quoted literals, double-quoted and back-quoted identifiers, line and
 * block comments, and anything nested in parentheses, so keywords inside literals or
 * subqueries are never matched.
 */
public final class SqlScanner {
    private SqlScanner() {
    }

    /**
     * Index of the first top-level occurrence of {@code keyword} as a whole word, ignoring
     * case, or {@code -1}.
     */
    public static int findTopLevelKeyword(String sql, String keyword) {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(keyword, "keyword");
        int depth = 0;
        int i = 0;
        int length = sql.length();
        while (i < length) {
            char ch = sql.charAt(i);
            switch (ch) {
                case '\'', '"', '`' -> {
                    i = skipQuoted(sql, i, ch);
                    continue;
                }
                case '(' -> depth++;
                case ')' -> depth = Math.max(0, depth - 1);
                case '-' -> {
                    if (i + 1 < length && sql.charAt(i + 1) == '-') {
                        int end = sql.indexOf('\n', i);
                        i = end < 0 ? length : end + 1;
                        continue;
                    }
                }
                case '/' -> {
                    if (i + 1 < length && sql.charAt(i + 1) == '*') {
                        int end = sql.indexOf("*/", i + 2);
                        i = end < 0 ? length : end + 2;
                        continue;
                    }
                }
                default -> {
                    if (depth == 0 && matchesWord(sql, i, keyword)) {
                        return i;
                    }
                }
            }
            i++;
        }
        return -1;
    }

    private static boolean matchesWord(String sql, int start, String keyword) {
        int end = start + keyword.length();
        if (end > sql.length() || !sql.regionMatches(true, start, keyword, 0, keyword.length())) {
            return false;
        }
        boolean boundaryBefore = start == 0 || !isWordChar(sql.charAt(start - 1));
        boolean boundaryAfter = end == sql.length() || !isWordChar(sql.charAt(end));
        return boundaryBefore && boundaryAfter;
    }

    private static boolean isWordChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$';
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            char ch = sql.charAt(i);
            if (ch == '\\' && quote == '\'') {
                i += 2;
                continue;
            }
            if (ch == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }
}
