package org.dxworks.dacframe.analyzer.sql.body;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One to four name parts joined by dots, e.g. {@code x}, {@code [a].[Col]}, {@code db..t},
 * optionally ending in {@code .*}. A part skipped with {@code ..} is the empty string.
 */
public final class IdentifierChain {

    private static final int MAX_PARTS = 4;

    private final List<Token> partTokens;
    private final int startIndex;
    private final int endIndex;
    private final boolean star;

    private IdentifierChain(List<Token> partTokens, int startIndex, int endIndex, boolean star) {
        this.partTokens = partTokens;
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.star = star;
    }

    /**
     * Reads the longest chain starting at {@code tokens.get(start)}, which must be a name.
     * Keywords are accepted after a dot, where they can only be names.
     */
    public static IdentifierChain read(List<Token> tokens, int start, int limit) {
        List<Token> parts = new ArrayList<>();
        parts.add(tokens.get(start));
        int end = start;
        boolean star = false;
        while (parts.size() < MAX_PARTS && end + 2 < limit && tokens.get(end + 1).isPunct('.')) {
            Token next = tokens.get(end + 2);
            if (next.isIdentifier() || next.getKind() == TokenKind.KEYWORD) {
                parts.add(next);
                end += 2;
            } else if (next.isPunct('.')) {
                parts.add(null);
                end += 1;
            } else if (next.isPunct('*')) {
                star = true;
                end += 2;
                break;
            } else {
                break;
            }
        }
        while (!parts.isEmpty() && parts.get(parts.size() - 1) == null) {
            // a trailing ".." belongs to nothing
            parts.remove(parts.size() - 1);
            end -= 1;
        }
        return new IdentifierChain(parts, start, end, star);
    }

    /**
     * The chain minus its final part, as when {@code col.value(...)} calls a method on a column.
     */
    public IdentifierChain dropLast() {
        return new IdentifierChain(partTokens.subList(0, partTokens.size() - 1), startIndex, endIndex, false);
    }

    public int size() {
        return partTokens.size();
    }

    public String part(int i) {
        Token token = partTokens.get(i);
        return token == null ? "" : token.value();
    }

    public Token partToken(int i) {
        return partTokens.get(i);
    }

    public String last() {
        return part(size() - 1);
    }

    public List<String> parts() {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < size(); i++) {
            out.add(part(i));
        }
        return Collections.unmodifiableList(out);
    }

    public Token first() {
        return partTokens.get(0);
    }

    public int getStartIndex() {
        return startIndex;
    }

    /**
     * Index of the chain's last token (the star, when there is one).
     */
    public int getEndIndex() {
        return endIndex;
    }

    public int getStartOffset() {
        return partTokens.get(0).getStart();
    }

    public boolean isStar() {
        return star;
    }

    @Override
    public String toString() {
        return String.join(".", parts()) + (star ? ".*" : "");
    }
}
