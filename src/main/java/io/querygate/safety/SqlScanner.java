package io.querygate.safety;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits SQL text into tokens without building a syntax tree. Knows enough of the lexical grammar
 * (string literals with doubled-quote and, optionally, backslash escapes, double-quoted and
 * back-quoted identifiers, line and block comments) that punctuation and keywords inside literals
 * or comments are never mistaken for live code.
 *
 * <p>Backends disagree on backslash escapes: MySQL and BigQuery honor them, ANSI and Postgres
 * end the literal at the quote. {@link #scan(String, boolean)} reads the text either way.
 */
public final class SqlScanner {

    private SqlScanner() {
    }

    public static Scan scan(String sql) {
        return scan(sql, true);
    }

    public static Scan scan(String sql, boolean backslashEscapes) {
        String text = sql == null ? "" : sql;
        List<SqlToken> tokens = new ArrayList<>();
        boolean unterminatedString = false;
        boolean unterminatedComment = false;
        int n = text.length();
        int i = 0;
        while (i < n) {
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
                continue;
            }
            int start = i;
            if (ch == '-' && i + 1 < n && text.charAt(i + 1) == '-') {
                int eol = text.indexOf('\n', i);
                i = eol < 0 ? n : eol;
                tokens.add(new SqlToken(SqlToken.Kind.LINE_COMMENT, text.substring(start, i), start, i));
                continue;
            }
            if (ch == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                int close = text.indexOf("*/", i + 2);
                if (close < 0) {
                    unterminatedComment = true;
                    i = n;
                } else {
                    i = close + 2;
                }
                tokens.add(new SqlToken(SqlToken.Kind.BLOCK_COMMENT, text.substring(start, i), start, i));
                continue;
            }
            if (ch == '\'') {
                int end = closeQuoted(text, i, '\'', backslashEscapes);
                if (end < 0) {
                    unterminatedString = true;
                    end = n;
                }
                i = end;
                tokens.add(new SqlToken(SqlToken.Kind.STRING, text.substring(start, i), start, i));
                continue;
            }
            if (ch == '"' || ch == '`') {
                int end = closeQuoted(text, i, ch, false);
                if (end < 0) {
                    unterminatedString = true;
                    end = n;
                }
                i = end;
                tokens.add(new SqlToken(SqlToken.Kind.QUOTED_IDENTIFIER, text.substring(start, i), start, i));
                continue;
            }
            if (Character.isLetter(ch) || ch == '_') {
                i++;
                while (i < n && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_' || text.charAt(i) == '$')) {
                    i++;
                }
                tokens.add(new SqlToken(SqlToken.Kind.WORD, text.substring(start, i), start, i));
                continue;
            }
            if (Character.isDigit(ch)) {
                i++;
                while (i < n && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new SqlToken(SqlToken.Kind.NUMBER, text.substring(start, i), start, i));
                continue;
            }
            i++;
            tokens.add(new SqlToken(SqlToken.Kind.SYMBOL, text.substring(start, i), start, i));
        }
        return new Scan(text, List.copyOf(tokens), unterminatedString, unterminatedComment);
    }

    /** Returns the offset just past the closing quote, or -1 when the literal never closes. */
    private static int closeQuoted(String text, int openAt, char quote, boolean backslashEscapes) {
        int i = openAt + 1;
        int n = text.length();
        while (i < n) {
            char ch = text.charAt(i);
            if (backslashEscapes && ch == '\\') {
                i += 2;
                continue;
            }
            if (ch == quote) {
                if (i + 1 < n && text.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return -1;
    }

    public record Scan(String text, List<SqlToken> tokens, boolean unterminatedString, boolean unterminatedComment) {

        public List<SqlToken> codeTokens() {
            List<SqlToken> out = new ArrayList<>(tokens.size());
            for (SqlToken token : tokens) {
                if (!token.isComment()) {
                    out.add(token);
                }
            }
            return out;
        }

        /** True when some string literal contains a backslash, so its extent depends on the dialect. */
        public boolean hasBackslashInLiteral() {
            for (SqlToken token : tokens) {
                if (token.kind() == SqlToken.Kind.STRING && token.text().indexOf('\\') >= 0) {
                    return true;
                }
            }
            return false;
        }

        public List<SqlToken> comments() {
            List<SqlToken> out = new ArrayList<>();
            for (SqlToken token : tokens) {
                if (token.isComment()) {
                    out.add(token);
                }
            }
            return out;
        }
    }
}
