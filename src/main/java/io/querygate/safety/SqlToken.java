package io.querygate.safety;

import java.util.Locale;

/**
 * One lexical unit of SQL text. {@code start}/{@code end} are offsets into the scanned text
 * ({@code end} exclusive), so rewrites can splice text at token boundaries.
 */
public record SqlToken(Kind kind, String text, int start, int end) {

    public enum Kind {
        WORD,
        QUOTED_IDENTIFIER,
        STRING,
        NUMBER,
        SYMBOL,
        LINE_COMMENT,
        BLOCK_COMMENT
    }

    public boolean isComment() {
        return kind == Kind.LINE_COMMENT || kind == Kind.BLOCK_COMMENT;
    }

    public boolean isWord(String keyword) {
        return kind == Kind.WORD && text.equalsIgnoreCase(keyword);
    }

    public boolean isSymbol(char symbol) {
        return kind == Kind.SYMBOL && text.length() == 1 && text.charAt(0) == symbol;
    }

    public boolean isIdentifier() {
        return kind == Kind.WORD || kind == Kind.QUOTED_IDENTIFIER;
    }

    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }

    /** Identifier text without quoting, lower-cased. Quoted identifiers may contain dots. */
    public String identifier() {
        if (kind == Kind.QUOTED_IDENTIFIER && text.length() >= 2) {
            char quote = text.charAt(0);
            String inner = text.substring(1, text.endsWith(String.valueOf(quote)) ? text.length() - 1 : text.length());
            return inner.replace(String.valueOf(quote) + quote, String.valueOf(quote)).toLowerCase(Locale.ROOT);
        }
        return text.toLowerCase(Locale.ROOT);
    }
}
