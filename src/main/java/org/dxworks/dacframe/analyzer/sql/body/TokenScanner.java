package org.dxworks.dacframe.analyzer.sql.body;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Splits T-SQL text into tokens that cover the whole input without gaps.
 * <p>
 * Iteration is lazy and every call to {@link #iterator()} starts over from the beginning.
 * Strings, bracketed and quoted identifiers and comments are always single tokens. A string
 * or identifier missing its closing delimiter turns the rest of the text into one
 * unterminated literal; an open block comment swallows the rest as one unterminated comment.
 */
public final class TokenScanner implements Iterable<Token> {

    private final String text;

    public TokenScanner(String text) {
        this.text = text == null ? "" : text;
    }

    public String getText() {
        return text;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Cursor();
    }

    public List<Token> tokens() {
        List<Token> out = new ArrayList<>();
        for (Token token : this) {
            out.add(token);
        }
        return out;
    }

    /**
     * Tokens without whitespace and comments.
     */
    public List<Token> significantTokens() {
        List<Token> out = new ArrayList<>();
        for (Token token : this) {
            if (token.isSignificant()) {
                out.add(token);
            }
        }
        return out;
    }

    private final class Cursor implements Iterator<Token> {
        private int pos = 0;

        @Override
        public boolean hasNext() {
            return pos < text.length();
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Token token = scan(pos);
            pos = token.getEnd();
            return token;
        }
    }

    private Token scan(int start) {
        char c = text.charAt(start);
        char next = start + 1 < text.length() ? text.charAt(start + 1) : '\0';

        if (Character.isWhitespace(c)) {
            int end = start;
            while (end < text.length() && Character.isWhitespace(text.charAt(end))) end++;
            return token(TokenKind.WHITESPACE, start, end, false);
        }
        if (c == '-' && next == '-') {
            int end = text.indexOf('\n', start);
            return token(TokenKind.COMMENT, start, end < 0 ? text.length() : end, false);
        }
        if (c == '/' && next == '*') {
            return blockComment(start);
        }
        if (c == '\'') {
            return delimited(start, start + 1, '\'', TokenKind.LITERAL);
        }
        if ((c == 'N' || c == 'n') && next == '\'') {
            return delimited(start, start + 2, '\'', TokenKind.LITERAL);
        }
        if (c == '[') {
            return delimited(start, start + 1, ']', TokenKind.BRACKETED_IDENTIFIER);
        }
        if (c == '"') {
            return delimited(start, start + 1, '"', TokenKind.BRACKETED_IDENTIFIER);
        }
        if (c == '@') {
            int end = start + 1;
            if (end < text.length() && text.charAt(end) == '@') end++;
            int nameStart = end;
            while (end < text.length() && isIdentifierPart(text.charAt(end))) end++;
            if (end == nameStart) {
                return token(TokenKind.PUNCTUATION, start, start + 1, false);
            }
            return token(TokenKind.AT_VARIABLE, start, end, false);
        }
        if (c == '0' && (next == 'x' || next == 'X')) {
            int end = start + 2;
            while (end < text.length() && Character.digit(text.charAt(end), 16) >= 0) end++;
            return token(TokenKind.LITERAL, start, end, false);
        }
        if (Character.isDigit(c)) {
            return number(start);
        }
        if (isIdentifierStart(c)) {
            int end = start + 1;
            while (end < text.length() && isIdentifierPart(text.charAt(end))) end++;
            String word = text.substring(start, end);
            TokenKind kind = SqlKeywords.isReserved(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER;
            return new Token(kind, word, start, end, false);
        }
        return token(TokenKind.PUNCTUATION, start, start + 1, false);
    }

    private Token blockComment(int start) {
        int depth = 0;
        int i = start;
        while (i < text.length()) {
            if (text.startsWith("/*", i)) {
                depth++;
                i += 2;
            } else if (text.startsWith("*/", i)) {
                depth--;
                i += 2;
                if (depth == 0) {
                    return token(TokenKind.COMMENT, start, i, false);
                }
            } else {
                i++;
            }
        }
        return token(TokenKind.COMMENT, start, text.length(), true);
    }

    private Token delimited(int start, int contentStart, char close, TokenKind kind) {
        int i = contentStart;
        while (i < text.length()) {
            if (text.charAt(i) == close) {
                if (i + 1 < text.length() && text.charAt(i + 1) == close) {
                    i += 2;
                    continue;
                }
                return token(kind, start, i + 1, false);
            }
            i++;
        }
        return token(TokenKind.LITERAL, start, text.length(), true);
    }

    private Token number(int start) {
        int end = start;
        while (end < text.length() && (Character.isDigit(text.charAt(end)) || text.charAt(end) == '.')) end++;
        if (end < text.length() && (text.charAt(end) == 'e' || text.charAt(end) == 'E')) {
            int exp = end + 1;
            if (exp < text.length() && (text.charAt(exp) == '+' || text.charAt(exp) == '-')) exp++;
            if (exp < text.length() && Character.isDigit(text.charAt(exp))) {
                end = exp;
                while (end < text.length() && Character.isDigit(text.charAt(end))) end++;
            }
        }
        return token(TokenKind.LITERAL, start, end, false);
    }

    private Token token(TokenKind kind, int start, int end, boolean unterminated) {
        return new Token(kind, text.substring(start, end), start, end, unterminated);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '#' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '#' || c == '$' || c == '@';
    }
}
