package org.dxworks.dacframe.analyzer.sql.body;

/**
 * A classified lexical unit of a body. {@code start} is inclusive, {@code end} exclusive,
 * both character offsets into the scanned text.
 */
public final class Token {

    private final TokenKind kind;
    private final String text;
    private final int start;
    private final int end;
    private final boolean unterminated;

    Token(TokenKind kind, String text, int start, int end, boolean unterminated) {
        this.kind = kind;
        this.text = text;
        this.start = start;
        this.end = end;
        this.unterminated = unterminated;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * True for a string, bracketed identifier or comment whose closing delimiter is missing;
     * such a token runs to the end of the input.
     */
    public boolean isUnterminated() {
        return unterminated;
    }

    public boolean isSignificant() {
        return kind != TokenKind.WHITESPACE && kind != TokenKind.COMMENT;
    }

    public boolean isIdentifier() {
        return kind == TokenKind.IDENTIFIER || kind == TokenKind.BRACKETED_IDENTIFIER;
    }

    public boolean isBracketed() {
        return kind == TokenKind.BRACKETED_IDENTIFIER;
    }

    /**
     * Case-insensitive match of an unquoted word, keyword or not.
     */
    public boolean is(String word) {
        return (kind == TokenKind.KEYWORD || kind == TokenKind.IDENTIFIER) && text.equalsIgnoreCase(word);
    }

    public boolean isPunct(char c) {
        return kind == TokenKind.PUNCTUATION && text.length() == 1 && text.charAt(0) == c;
    }

    /**
     * The name this token denotes: delimiters removed and doubled closing delimiters unescaped.
     */
    public String value() {
        if (kind != TokenKind.BRACKETED_IDENTIFIER) {
            return text;
        }
        char open = text.charAt(0);
        char close = open == '[' ? ']' : '"';
        String inner = text.substring(1, text.length() - 1);
        return inner.replace("" + close + close, "" + close);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + start;
    }
}
